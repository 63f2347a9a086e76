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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DependencyValidatorTest {

  private static Declaration resource(String name, int line, String... deps) {
    return Declaration.builder()
        .kind(Declaration.Kind.RESOURCE)
        .name(name)
        .shape(ShapeId.create("s3", "Bucket"))
        .file("infra/app.wire")
        .line(line)
        .dependencies(ImmutableList.copyOf(deps))
        .build();
  }

  @Test
  public void testReportsOnlyUndefinedNames() {
    ImmutableMap<String, Declaration> resources =
        ImmutableMap.of(
            "Logs", resource("Logs", 3),
            "Function", resource("Function", 7, "Logs", "Settings", "Foo"));
    ImmutableList<DiscoveryError> errors =
        DependencyValidator.validate(
            resources, ImmutableSet.of("Logs", "Function", "Settings"));
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).toString())
        .isEqualTo("infra/app.wire:7: Function references undefined resource \"Foo\"");
  }

  @Test
  public void testErrorsSortedByResourceName() {
    ImmutableMap<String, Declaration> resources =
        ImmutableMap.of(
            "Zeta", resource("Zeta", 1, "Missing"),
            "Alpha", resource("Alpha", 2, "Missing"));
    ImmutableList<DiscoveryError> errors =
        DependencyValidator.validate(resources, ImmutableSet.of("Zeta", "Alpha"));
    assertThat(errors).hasSize(2);
    assertThat(errors.get(0).message()).startsWith("Alpha ");
    assertThat(errors.get(1).message()).startsWith("Zeta ");
  }

  @Test
  public void testNoResources() {
    assertThat(DependencyValidator.validate(ImmutableMap.of(), ImmutableSet.of())).isEmpty();
  }
}
