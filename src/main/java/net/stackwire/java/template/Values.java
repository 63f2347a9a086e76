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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Helpers for the loosely typed values that make up a template. */
final class Values {

  private Values() {}

  @Nullable
  static String stringOrNull(@Nullable Object value) {
    return value instanceof String s ? s : null;
  }

  /**
   * Returns a copy of {@code value} with integral numbers widened to {@link Long}, other numbers
   * to {@link Double}, map keys converted to strings, and null entries of maps and lists dropped.
   * Key order is preserved.
   *
   * @throws IllegalArgumentException if the value contains something other than strings,
   *     finite numbers, booleans, maps and lists
   */
  static Object normalize(Object value) {
    if (value instanceof Map<?, ?> map) {
      return normalizeMap(map);
    }
    if (value instanceof List<?> list) {
      ImmutableList.Builder<Object> copy = ImmutableList.builder();
      for (Object element : list) {
        if (element != null) {
          copy.add(normalize(element));
        }
      }
      return copy.build();
    }
    if (value instanceof Number number) {
      return normalizeNumber(number);
    }
    if (value instanceof String || value instanceof Boolean) {
      return value;
    }
    throw new IllegalArgumentException(
        "unsupported value of type " + value.getClass().getSimpleName());
  }

  static ImmutableMap<String, Object> normalizeMap(Map<?, ?> map) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (entry.getValue() != null) {
        copy.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
      }
    }
    return ImmutableMap.copyOf(copy);
  }

  private static Number normalizeNumber(Number number) {
    if (number instanceof Long) {
      return number;
    }
    if (number instanceof BigInteger big) {
      return big.bitLength() < 64 ? (Number) big.longValue() : finite(big.doubleValue());
    }
    if (number instanceof Double || number instanceof Float || number instanceof BigDecimal) {
      return finite(number.doubleValue());
    }
    return number.longValue();
  }

  private static Double finite(double value) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("non-finite number " + value);
    }
    return value;
  }
}
