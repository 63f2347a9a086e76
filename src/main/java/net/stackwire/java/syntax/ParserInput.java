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
package net.stackwire.java.syntax;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** The input to the parser: the contents of a declaration file, and its name. */
public final class ParserInput {

  private final String file;
  private final char[] content;

  private ParserInput(char[] content, String file) {
    this.content = content;
    this.file = file;
  }

  /** Returns the content of the input source. Callers must not modify the result. */
  char[] getContent() {
    return content;
  }

  /** Returns the name of the input source, as it appears in error messages and locations. */
  public String getFile() {
    return file;
  }

  /** Returns an input source that reads from a UTF-8 encoded file. */
  public static ParserInput readFile(Path path) throws IOException {
    String content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    return fromString(content, path.toString());
  }

  /** Returns an input source that reads from the given string. */
  public static ParserInput fromString(String content, String file) {
    return new ParserInput(content.toCharArray(), file);
  }

  /** Returns an unnamed input source that reads from a list of lines. */
  public static ParserInput fromLines(String... lines) {
    return fromString(String.join("\n", lines), "");
  }
}
