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
package net.stackwire.java.extract;

import com.google.common.collect.ImmutableMap;
import java.util.List;

/**
 * Obtains the values of declarations.
 *
 * <p>Values are JSON-like: strings, {@link Long} and {@link Double} numbers, booleans, lists and
 * string-keyed maps. A declaration without a value is absent from the result.
 */
public interface ValueExtractor {

  ImmutableMap<String, Object> extract(List<DeclarationSite> sites) throws ExtractionException;
}
