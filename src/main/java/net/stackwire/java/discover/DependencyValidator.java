// Copyright 2026 The Stackwire Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.stackwire.java.discover;

import com.google.common.collect.ImmutableList;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Checks that every dependency of a resource names a known binding. A dependency on another
 * resource or on any other top-level binding is accepted; anything else is reported as an
 * undefined resource. Validation never fails; it only collects errors.
 */
final class DependencyValidator {

  private DependencyValidator() {}

  static ImmutableList<DiscoveryError> validate(
      Map<String, Declaration> resources, Set<String> allBindings) {
    ImmutableList.Builder<DiscoveryError> errors = ImmutableList.builder();
    // Sorted, so that errors are reported in a stable order.
    for (Declaration resource : new TreeMap<>(resources).values()) {
      for (String dep : resource.dependencies()) {
        if (resources.containsKey(dep) || allBindings.contains(dep)) {
          continue;
        }
        errors.add(
            DiscoveryError.create(
                resource.file(),
                resource.line(),
                String.format("%s references undefined resource \"%s\"", resource.name(), dep)));
      }
    }
    return errors.build();
  }
}
