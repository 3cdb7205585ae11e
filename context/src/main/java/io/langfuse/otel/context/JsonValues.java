/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.context;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;

import static java.util.stream.Collectors.joining;

/** Renders structured metadata values as compact JSON for string attributes. */
final class JsonValues {
  static String toJson(Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof CharSequence) {
      return quote(value.toString());
    }
    if (value instanceof Boolean) {
      return value.toString();
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      // JSON has no NaN or infinity
      return Double.isNaN(d) || Double.isInfinite(d) ? quote(value.toString()) : value.toString();
    }
    if (value instanceof Number) {
      return value.toString();
    }
    if (value instanceof Map) {
      return ((Map<?, ?>) value).entrySet().stream()
          .map(entry -> quote(String.valueOf(entry.getKey())) + ":" + toJson(entry.getValue()))
          .collect(joining(",", "{", "}"));
    }
    if (value instanceof Collection) {
      return ((Collection<?>) value).stream()
          .map(JsonValues::toJson)
          .collect(joining(",", "[", "]"));
    }
    if (value instanceof Object[]) {
      return toJson(Arrays.asList((Object[]) value));
    }
    return quote(value.toString());
  }

  static String quote(String value) {
    StringBuilder result = new StringBuilder(value.length() + 2).append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          result.append("\\\"");
          break;
        case '\\':
          result.append("\\\\");
          break;
        case '\n':
          result.append("\\n");
          break;
        case '\r':
          result.append("\\r");
          break;
        case '\t':
          result.append("\\t");
          break;
        default:
          if (c < 0x20) {
            result.append(String.format("\\u%04x", (int) c));
          } else {
            result.append(c);
          }
      }
    }
    return result.append('"').toString();
  }

  private JsonValues() {
  }
}
