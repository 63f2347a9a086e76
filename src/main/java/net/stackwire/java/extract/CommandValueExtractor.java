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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A {@link ValueExtractor} that delegates to an external command.
 *
 * <p>The command reads a JSON object {@code {"sites": [{"name", "kind", "file", "line"}, ...]}}
 * from its standard input and writes a JSON object mapping names to values on its standard
 * output. Names the command leaves out, or maps to null, have no value.
 */
public final class CommandValueExtractor implements ValueExtractor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Bytes of standard error quoted in failure messages. */
  private static final int MAX_STDERR_BYTES = 4096;

  private static final Gson GSON =
      new GsonBuilder().setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE).create();

  private final ImmutableList<String> command;
  @Nullable private final Path workingDirectory;

  public CommandValueExtractor(List<String> command, @Nullable Path workingDirectory) {
    this.command = ImmutableList.copyOf(command);
    this.workingDirectory = workingDirectory;
  }

  @Override
  public ImmutableMap<String, Object> extract(List<DeclarationSite> sites)
      throws ExtractionException {
    byte[] request = GSON.toJson(request(sites)).getBytes(UTF_8);
    Path stdout = null;
    Path stderr = null;
    try {
      // Output goes to files, so the command never blocks on a full pipe while we write.
      stdout = Files.createTempFile("stackwire-extract", ".stdout");
      stderr = Files.createTempFile("stackwire-extract", ".stderr");
      ProcessBuilder builder =
          new ProcessBuilder(command)
              .redirectOutput(ProcessBuilder.Redirect.to(stdout.toFile()))
              .redirectError(ProcessBuilder.Redirect.to(stderr.toFile()));
      if (workingDirectory != null) {
        builder.directory(workingDirectory.toFile());
      }
      logger.atFine().log("running %s for %d declarations", command, sites.size());
      Process process = builder.start();
      try (OutputStream stdin = process.getOutputStream()) {
        stdin.write(request);
      }
      int exitCode = process.waitFor();
      if (exitCode != 0) {
        throw new ExtractionException(
            String.format(
                "%s exited with status %d: %s", command.get(0), exitCode, tail(stderr)));
      }
      return parseResponse(new String(Files.readAllBytes(stdout), UTF_8));
    } catch (IOException e) {
      throw new ExtractionException(
          String.format("running %s: %s", command.get(0), e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExtractionException("interrupted while running " + command.get(0), e);
    } finally {
      delete(stdout);
      delete(stderr);
    }
  }

  private static void delete(@Nullable Path file) {
    if (file != null) {
      try {
        Files.deleteIfExists(file);
      } catch (IOException e) {
        logger.atWarning().withCause(e).log("cannot delete %s", file);
      }
    }
  }

  private static JsonObject request(List<DeclarationSite> sites) {
    JsonArray array = new JsonArray();
    for (DeclarationSite site : sites) {
      JsonObject object = new JsonObject();
      object.addProperty("name", site.name());
      object.addProperty("kind", site.kind().name());
      object.addProperty("file", site.file());
      object.addProperty("line", site.line());
      array.add(object);
    }
    JsonObject request = new JsonObject();
    request.add("sites", array);
    return request;
  }

  private ImmutableMap<String, Object> parseResponse(String response)
      throws ExtractionException {
    Object parsed;
    try {
      parsed = GSON.fromJson(response, Object.class);
    } catch (JsonParseException e) {
      throw new ExtractionException(
          String.format("%s wrote malformed JSON: %s", command.get(0), e.getMessage()), e);
    }
    if (!(parsed instanceof Map<?, ?> map)) {
      throw new ExtractionException(command.get(0) + " did not write a JSON object");
    }
    ImmutableMap.Builder<String, Object> values = ImmutableMap.builder();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (entry.getValue() != null) {
        values.put(String.valueOf(entry.getKey()), entry.getValue());
      }
    }
    return values.buildOrThrow();
  }

  private static String tail(Path stderr) throws IOException {
    byte[] bytes = Files.readAllBytes(stderr);
    int start = Math.max(0, bytes.length - MAX_STDERR_BYTES);
    return new String(bytes, start, bytes.length - start, UTF_8).trim();
  }
}
