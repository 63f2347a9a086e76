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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import javax.annotation.Nullable;

/**
 * The result of scanning source roots: the declarations of each kind, every top-level binding,
 * the references recorded for each structured-literal binding, and the diagnostics.
 *
 * <p>A Discovery is immutable. Declarations of each kind are in scan order: roots in the order
 * given, files of a root in path order, bindings of a file in source order.
 */
public final class Discovery {

  private final ImmutableMap<String, Declaration> resources;
  private final ImmutableMap<String, Declaration> parameters;
  private final ImmutableMap<String, Declaration> outputs;
  private final ImmutableMap<String, Declaration> mappings;
  private final ImmutableMap<String, Declaration> conditions;
  private final ImmutableMap<String, Binding> bindings;
  private final ImmutableMap<String, VariableReferences> variableReferences;
  private final ImmutableList<DiscoveryError> errors;
  private final ImmutableList<ScanException> scanFailures;

  Discovery(
      ImmutableMap<String, Declaration> resources,
      ImmutableMap<String, Declaration> parameters,
      ImmutableMap<String, Declaration> outputs,
      ImmutableMap<String, Declaration> mappings,
      ImmutableMap<String, Declaration> conditions,
      ImmutableMap<String, Binding> bindings,
      ImmutableMap<String, VariableReferences> variableReferences,
      ImmutableList<DiscoveryError> errors,
      ImmutableList<ScanException> scanFailures) {
    this.resources = resources;
    this.parameters = parameters;
    this.outputs = outputs;
    this.mappings = mappings;
    this.conditions = conditions;
    this.bindings = bindings;
    this.variableReferences = variableReferences;
    this.errors = errors;
    this.scanFailures = scanFailures;
  }

  public ImmutableMap<String, Declaration> resources() {
    return resources;
  }

  public ImmutableMap<String, Declaration> parameters() {
    return parameters;
  }

  public ImmutableMap<String, Declaration> outputs() {
    return outputs;
  }

  public ImmutableMap<String, Declaration> mappings() {
    return mappings;
  }

  public ImmutableMap<String, Declaration> conditions() {
    return conditions;
  }

  /** Every top-level binding, by name. */
  public ImmutableMap<String, Binding> bindings() {
    return bindings;
  }

  /** The names of every top-level binding, including those of no declaration kind. */
  public ImmutableSet<String> allBindings() {
    return bindings.keySet();
  }

  /** References recorded for each structured-literal binding. */
  public ImmutableMap<String, VariableReferences> variableReferences() {
    return variableReferences;
  }

  /** Validation errors: undefined references and duplicate names. */
  public ImmutableList<DiscoveryError> errors() {
    return errors;
  }

  /** Roots whose scan was aborted. */
  public ImmutableList<ScanException> scanFailures() {
    return scanFailures;
  }

  /** Reports whether the scan produced no errors and no root failed. */
  public boolean ok() {
    return errors.isEmpty() && scanFailures.isEmpty();
  }

  /** Returns the declaration of any kind with the given name, or null. */
  @Nullable
  public Declaration declaration(String name) {
    for (ImmutableMap<String, Declaration> section :
        ImmutableList.of(resources, parameters, outputs, mappings, conditions)) {
      Declaration decl = section.get(name);
      if (decl != null) {
        return decl;
      }
    }
    return null;
  }

  /**
   * Returns every attribute reference reachable from the named binding through the bindings it
   * uses, with field paths relative to the named binding. The order is unspecified.
   */
  public ImmutableList<AttributeReference> resolveAttributeReferences(String name) {
    return AttrRefResolver.resolve(name, variableReferences);
  }
}
