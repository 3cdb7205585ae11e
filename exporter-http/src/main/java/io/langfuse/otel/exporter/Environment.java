/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.exporter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Immutable snapshot of the environment variables this exporter understands.
 *
 * <p>Each variable is read from the underlying source exactly once, when the snapshot is taken.
 * Values are trimmed and blank values are treated as absent, so untrimmed input never reaches
 * URL composition or header encoding.
 */
public final class Environment {
  public static final String LANGFUSE_PUBLIC_KEY = "LANGFUSE_PUBLIC_KEY";
  public static final String LANGFUSE_SECRET_KEY = "LANGFUSE_SECRET_KEY";
  public static final String LANGFUSE_HOST = "LANGFUSE_HOST";

  public static final String OTEL_EXPORTER_OTLP_ENDPOINT = "OTEL_EXPORTER_OTLP_ENDPOINT";
  public static final String OTEL_EXPORTER_OTLP_TRACES_ENDPOINT =
      "OTEL_EXPORTER_OTLP_TRACES_ENDPOINT";
  public static final String OTEL_EXPORTER_OTLP_HEADERS = "OTEL_EXPORTER_OTLP_HEADERS";
  public static final String OTEL_EXPORTER_OTLP_TRACES_HEADERS =
      "OTEL_EXPORTER_OTLP_TRACES_HEADERS";
  public static final String OTEL_EXPORTER_OTLP_TIMEOUT = "OTEL_EXPORTER_OTLP_TIMEOUT";
  public static final String OTEL_EXPORTER_OTLP_COMPRESSION = "OTEL_EXPORTER_OTLP_COMPRESSION";

  static final String[] NAMES = {
      LANGFUSE_PUBLIC_KEY,
      LANGFUSE_SECRET_KEY,
      LANGFUSE_HOST,
      OTEL_EXPORTER_OTLP_ENDPOINT,
      OTEL_EXPORTER_OTLP_TRACES_ENDPOINT,
      OTEL_EXPORTER_OTLP_HEADERS,
      OTEL_EXPORTER_OTLP_TRACES_HEADERS,
      OTEL_EXPORTER_OTLP_TIMEOUT,
      OTEL_EXPORTER_OTLP_COMPRESSION
  };

  static final Environment EMPTY = new Environment(Collections.emptyMap());

  /** Snapshots the process environment. */
  public static Environment system() {
    return from(System::getenv);
  }

  /** Snapshots the given map, typically in tests. Unknown keys are ignored. */
  public static Environment of(Map<String, String> variables) {
    if (variables == null) throw new NullPointerException("variables == null");
    return from(variables::get);
  }

  public static Environment empty() {
    return EMPTY;
  }

  static Environment from(Function<String, String> source) {
    Map<String, String> values = new LinkedHashMap<>();
    for (String name : NAMES) {
      String value = normalize(source.apply(name));
      if (value != null) values.put(name, value);
    }
    return new Environment(values);
  }

  static String normalize(String value) {
    if (value == null) return null;
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  final Map<String, String> values;

  Environment(Map<String, String> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  /** Returns the trimmed value of the variable, or null if it is unset or blank. */
  public String get(String name) {
    if (name == null) throw new NullPointerException("name == null");
    return values.get(name);
  }

  @Override public String toString() {
    // values may hold secrets
    return "Environment{" + values.keySet() + "}";
  }
}
