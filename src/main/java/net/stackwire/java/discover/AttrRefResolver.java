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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects every attribute reference reachable from a binding, following the bindings it names at
 * each field path. A reference found through a chain of bindings carries the concatenation of the
 * field paths along the chain.
 *
 * <p>Each binding is visited at most once per resolution, so reference cycles terminate. The walk
 * uses an explicit stack and visits bindings in the same preorder as a recursive walk would.
 */
final class AttrRefResolver {

  private static final Joiner PATH_JOINER = Joiner.on('.').skipNulls();

  private AttrRefResolver() {}

  private static final class Frame {
    final String name;
    final String prefix;

    Frame(String name, String prefix) {
      this.name = name;
      this.prefix = prefix;
    }
  }

  static ImmutableList<AttributeReference> resolve(
      String name, Map<String, VariableReferences> references) {
    ImmutableList.Builder<AttributeReference> result = ImmutableList.builder();
    Set<String> visited = new HashSet<>();
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(name, ""));
    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      if (!visited.add(frame.name)) {
        continue;
      }
      VariableReferences refs = references.get(frame.name);
      if (refs == null) {
        continue;
      }
      for (AttributeReference ref : refs.attributeReferences()) {
        result.add(
            AttributeReference.create(
                ref.resource(), ref.attribute(), join(frame.prefix, ref.fieldPath())));
      }
      List<Frame> children = new ArrayList<>();
      for (Map.Entry<String, String> e : refs.fieldReferences().entrySet()) {
        children.add(new Frame(e.getValue(), join(frame.prefix, e.getKey())));
      }
      // Push in reverse so the first field reference is resolved first.
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return result.build();
  }

  // Joins two dot-separated paths, omitting an empty one.
  static String join(String prefix, String path) {
    return PATH_JOINER.join(emptyToNull(prefix), emptyToNull(path));
  }

  private static String emptyToNull(String s) {
    return s.isEmpty() ? null : s;
  }
}
