/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.exporter;

import java.util.Locale;

import static io.langfuse.otel.exporter.LangfuseConfigurationException.Kind.INVALID_COMPRESSION;

/** Request body compression. Only the values OTLP/HTTP defines are accepted. */
public enum Compression {
  NONE("none"),
  GZIP("gzip");

  final String value;

  Compression(String value) {
    this.value = value;
  }

  /** The name used by {@value Environment#OTEL_EXPORTER_OTLP_COMPRESSION}. */
  public String value() {
    return value;
  }

  /**
   * Parses a compression name, ignoring case.
   *
   * @throws LangfuseConfigurationException if the name is neither "none" nor "gzip"
   */
  public static Compression parse(String value) {
    if (value == null) throw new NullPointerException("value == null");
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (Compression compression : values()) {
      if (compression.value.equals(normalized)) return compression;
    }
    throw new LangfuseConfigurationException(INVALID_COMPRESSION,
        "Unsupported compression: \"" + value + "\". Supported values are \"none\" and \"gzip\"");
  }
}
