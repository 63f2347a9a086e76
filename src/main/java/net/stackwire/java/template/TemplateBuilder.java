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
package net.stackwire.java.template;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import javax.annotation.Nullable;
import net.stackwire.java.config.ShapeRegistry;
import net.stackwire.java.discover.Declaration;
import net.stackwire.java.discover.Discovery;

/**
 * Assembles a {@link Template} from scanned declarations and the values supplied for them.
 *
 * <p>Resources are emitted in dependency order. Among resources whose dependencies are all
 * emitted, the smallest name comes first, so the result does not depend on the order in which
 * declarations are given.
 */
public final class TemplateBuilder {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ShapeRegistry registry;
  @Nullable private String description;

  public TemplateBuilder(ShapeRegistry registry) {
    this.registry = registry;
  }

  /** Sets the description of the templates built from now on. */
  public TemplateBuilder setDescription(@Nullable String description) {
    this.description = description;
    return this;
  }

  /** Builds the template for every declaration of a scan. */
  public Template build(Discovery discovery, Map<String, ?> values) throws BuildException {
    List<Declaration> declarations = new ArrayList<>();
    declarations.addAll(discovery.parameters().values());
    declarations.addAll(discovery.mappings().values());
    declarations.addAll(discovery.conditions().values());
    declarations.addAll(discovery.resources().values());
    declarations.addAll(discovery.outputs().values());
    return build(declarations, values);
  }

  /**
   * Builds the template for the given declarations. Declarations other than resources that have
   * no supplied value are left out; a resource without a value has no properties.
   *
   * @throws BuildException if a resource has no backend type, the resources depend on each other
   *     cyclically, or a supplied value has the wrong structure
   */
  public Template build(Iterable<Declaration> declarations, Map<String, ?> values)
      throws BuildException {
    Map<Declaration.Kind, Map<String, Declaration>> byKind = new HashMap<>();
    for (Declaration.Kind kind : Declaration.Kind.values()) {
      byKind.put(kind, new TreeMap<>());
    }
    Set<String> names = new HashSet<>();
    for (Declaration declaration : declarations) {
      checkArgument(
          names.add(declaration.name()), "duplicate declaration %s", declaration.name());
      byKind.get(declaration.kind()).put(declaration.name(), declaration);
    }

    Template.Builder template =
        Template.builder().formatVersion(registry.formatVersion()).description(description);

    Map<String, ParameterDefinition> parameters = new LinkedHashMap<>();
    for (String name : byKind.get(Declaration.Kind.PARAMETER).keySet()) {
      Object value = values.get(name);
      if (value != null) {
        parameters.put(name, parameterDefinition(name, value));
      }
    }
    template.parameters(parameters);
    template.mappings(transcribe(byKind.get(Declaration.Kind.MAPPING), values));
    template.conditions(transcribe(byKind.get(Declaration.Kind.CONDITION), values));

    Map<String, Declaration> resources = byKind.get(Declaration.Kind.RESOURCE);
    Map<String, ResourceDefinition> definitions = new LinkedHashMap<>();
    boolean transform = false;
    for (String name : order(resources)) {
      Declaration resource = resources.get(name);
      String namespace = resource.shape().namespace();
      String type = registry.resourceType(namespace, resource.shape().localName());
      if (type == null) {
        throw new BuildException(
            BuildException.Kind.UNKNOWN_TYPE,
            String.format(
                "%s: unknown resource type: %s", resource.location(), resource.shape()));
      }
      transform |= registry.requiresTransform(namespace);
      definitions.put(name, ResourceDefinition.create(type, properties(name, values.get(name))));
    }
    template.resources(definitions);
    if (transform) {
      template.transform(registry.transform());
    }

    Map<String, OutputDefinition> outputs = new LinkedHashMap<>();
    for (String name : byKind.get(Declaration.Kind.OUTPUT).keySet()) {
      Object value = values.get(name);
      if (value != null) {
        outputs.put(name, outputDefinition(name, value));
      }
    }
    template.outputs(outputs);

    logger.atInfo().log(
        "built template with %d resources, %d parameters and %d outputs",
        definitions.size(), parameters.size(), outputs.size());
    return template.build();
  }

  /**
   * Returns the names of {@code resources} in dependency order.
   *
   * @throws BuildException if some resources cannot be ordered because of a cycle
   */
  static ImmutableList<String> order(Map<String, Declaration> resources) throws BuildException {
    Map<String, List<String>> dependents = new HashMap<>();
    Map<String, Integer> inDegree = new HashMap<>();
    for (Declaration resource : resources.values()) {
      int degree = 0;
      for (String dependency : resource.dependencies()) {
        if (resources.containsKey(dependency)) {
          dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(resource.name());
          degree++;
        }
      }
      inDegree.put(resource.name(), degree);
    }

    TreeSet<String> ready = new TreeSet<>();
    inDegree.forEach(
        (name, degree) -> {
          if (degree == 0) {
            ready.add(name);
          }
        });
    ImmutableList.Builder<String> order = ImmutableList.builderWithExpectedSize(resources.size());
    int ordered = 0;
    while (!ready.isEmpty()) {
      String name = ready.pollFirst();
      order.add(name);
      ordered++;
      for (String dependent : dependents.getOrDefault(name, ImmutableList.of())) {
        int degree = inDegree.merge(dependent, -1, Integer::sum);
        if (degree == 0) {
          ready.add(dependent);
        }
      }
    }
    if (ordered < resources.size()) {
      throw cycleError(resources);
    }
    return order.build();
  }

  private static BuildException cycleError(Map<String, Declaration> resources) {
    ImmutableList<String> cycle = new CycleFinder(resources).find();
    StringBuilder message = new StringBuilder("circular dependency detected:");
    String separator = "\n  ";
    for (String name : cycle) {
      message.append(separator).append(name).append(" (").append(location(resources, name));
      message.append(')');
      separator = "\n    -> ";
    }
    if (!cycle.isEmpty()) {
      String start = cycle.get(0);
      message.append(separator).append(start).append(" (").append(location(resources, start));
      message.append(')');
    }
    return new BuildException(
        BuildException.Kind.DEPENDENCY_CYCLE, message.toString(), cycle, null);
  }

  private static String location(Map<String, Declaration> resources, String name) {
    return resources.get(name).location();
  }

  /** Depth-first search for one cycle of the resource graph. */
  private static final class CycleFinder {
    private final Map<String, Declaration> resources;
    private final Set<String> visited = new HashSet<>();
    private final LinkedHashSet<String> path = new LinkedHashSet<>();
    private final Deque<String> names = new ArrayDeque<>();
    private final Deque<Iterator<String>> stack = new ArrayDeque<>();

    CycleFinder(Map<String, Declaration> resources) {
      this.resources = resources;
    }

    ImmutableList<String> find() {
      for (String name : new TreeSet<>(resources.keySet())) {
        if (!visited.contains(name)) {
          ImmutableList<String> cycle = visit(name);
          if (cycle != null) {
            return cycle;
          }
        }
      }
      return ImmutableList.of();
    }

    /** Walks the graph from {@code root} with an explicit stack of dependency iterators. */
    @Nullable
    private ImmutableList<String> visit(String root) {
      enter(root);
      while (!stack.isEmpty()) {
        Iterator<String> dependencies = stack.peek();
        if (!dependencies.hasNext()) {
          stack.pop();
          path.remove(names.pop());
          continue;
        }
        String dependency = dependencies.next();
        if (!resources.containsKey(dependency)) {
          continue;
        }
        if (path.contains(dependency)) {
          List<String> onPath = new ArrayList<>(path);
          return ImmutableList.copyOf(onPath.subList(onPath.indexOf(dependency), onPath.size()));
        }
        if (!visited.contains(dependency)) {
          enter(dependency);
        }
      }
      return null;
    }

    private void enter(String name) {
      visited.add(name);
      path.add(name);
      names.push(name);
      stack.push(resources.get(name).dependencies().iterator());
    }
  }

  private ParameterDefinition parameterDefinition(String name, Object value)
      throws BuildException {
    if (!(value instanceof Map<?, ?> map)) {
      return ParameterDefinition.builder().build();
    }
    return ParameterDefinition.fromMap(serializeMap(name, map));
  }

  private OutputDefinition outputDefinition(String name, Object value) throws BuildException {
    if (!(value instanceof Map<?, ?> map)) {
      throw new BuildException(
          BuildException.Kind.INVALID_VALUE,
          String.format("output %s: expected a structured value, got %s", name, describe(value)));
    }
    return OutputDefinition.fromMap(serializeMap(name, map));
  }

  private ImmutableMap<String, Object> properties(String name, @Nullable Object value)
      throws BuildException {
    if (value == null) {
      return ImmutableMap.of();
    }
    if (!(value instanceof Map<?, ?> map)) {
      throw new BuildException(
          BuildException.Kind.INVALID_VALUE,
          String.format(
              "serializing %s: expected a structured value, got %s", name, describe(value)));
    }
    return serializeMap(name, map);
  }

  private Map<String, Object> transcribe(
      Map<String, Declaration> declarations, Map<String, ?> values) throws BuildException {
    Map<String, Object> section = new LinkedHashMap<>();
    for (String name : declarations.keySet()) {
      Object value = values.get(name);
      if (value != null) {
        section.put(name, serialize(name, value));
      }
    }
    return section;
  }

  private ImmutableMap<String, Object> serializeMap(String name, Map<?, ?> map)
      throws BuildException {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (entry.getValue() != null) {
        copy.put(String.valueOf(entry.getKey()), serialize(name, entry.getValue()));
      }
    }
    return ImmutableMap.copyOf(copy);
  }

  /**
   * Rebuilds maps and lists. A map that carries an intrinsic-function key is copied as a whole,
   * without looking into its arguments.
   */
  private Object serialize(String name, Object value) throws BuildException {
    if (value instanceof Map<?, ?> map) {
      if (registry.isIntrinsic(map)) {
        return normalize(name, map);
      }
      return serializeMap(name, map);
    }
    if (value instanceof List<?> list) {
      ImmutableList.Builder<Object> copy = ImmutableList.builder();
      for (Object element : list) {
        if (element != null) {
          copy.add(serialize(name, element));
        }
      }
      return copy.build();
    }
    return normalize(name, value);
  }

  private static Object normalize(String name, Object value) throws BuildException {
    try {
      return Values.normalize(value);
    } catch (IllegalArgumentException e) {
      throw new BuildException(
          BuildException.Kind.INVALID_VALUE,
          String.format("serializing %s: %s", name, e.getMessage()),
          e);
    }
  }

  private static String describe(Object value) {
    return value instanceof List ? "a list" : value.getClass().getSimpleName();
  }
}
