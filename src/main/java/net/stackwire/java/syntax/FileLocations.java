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

import java.util.Arrays;

/**
 * FileLocations maps character offsets within a source file to {@link Location}s. Every syntax
 * node holds a reference to the FileLocations of its file, so that it can compute its position on
 * demand without storing lines and columns.
 */
final class FileLocations {

  private final int[] linestart; // maps line number (line >= 1) to char offset
  private final String file;
  private final int size; // size of file in chars

  private FileLocations(int[] linestart, String file, int size) {
    this.linestart = linestart;
    this.file = file;
    this.size = size;
  }

  static FileLocations create(char[] buffer, String file) {
    int[] linestart = new int[buffer.length / 16 + 2];
    int n = 1; // linestart[0] is unused; line 1 starts at offset 0
    for (int i = 0; i < buffer.length; i++) {
      if (buffer[i] == '\n') {
        if (n + 1 >= linestart.length) {
          linestart = Arrays.copyOf(linestart, linestart.length * 2);
        }
        linestart[++n] = i + 1;
      }
    }
    return new FileLocations(Arrays.copyOf(linestart, n + 1), file, buffer.length);
  }

  String file() {
    return file;
  }

  /** Returns the location of the given character offset. */
  Location getLocation(int offset) {
    if (offset < 0 || offset > size) {
      throw new IllegalArgumentException("offset " + offset + " out of range [0, " + size + "]");
    }
    int line = getLineAt(offset);
    return new Location(file, line, offset - linestart[line] + 1);
  }

  private int getLineAt(int offset) {
    int i = Arrays.binarySearch(linestart, 1, linestart.length, offset);
    if (i >= 0) {
      // An exact match yields the first line starting at that offset.
      return i;
    }
    return -i - 2; // the line whose start precedes the offset
  }
}
