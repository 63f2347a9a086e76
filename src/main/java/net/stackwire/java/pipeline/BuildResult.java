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
package net.stackwire.java.pipeline;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.stackwire.java.template.Template;

/**
 * The outcome of a build: the template and the names of its resources in deployment order on
 * success, the error messages on failure.
 */
@AutoValue
public abstract class BuildResult {

  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  public abstract boolean success();

  @Nullable
  public abstract Template template();

  public abstract ImmutableList<String> resources();

  public abstract ImmutableList<String> errors();

  public static BuildResult success(Template template) {
    return new AutoValue_BuildResult(
        true, template, template.resources().keySet().asList(), ImmutableList.of());
  }

  public static BuildResult failure(List<String> errors) {
    return new AutoValue_BuildResult(
        false, null, ImmutableList.of(), ImmutableList.copyOf(errors));
  }

  /** Returns the result as a JSON object. Absent and empty members are omitted. */
  public String toJson() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("success", success());
    if (template() != null) {
      map.put("template", template().toMap());
    }
    if (!resources().isEmpty()) {
      map.put("resources", resources());
    }
    if (!errors().isEmpty()) {
      map.put("errors", errors());
    }
    return GSON.toJson(map) + "\n";
  }
}
