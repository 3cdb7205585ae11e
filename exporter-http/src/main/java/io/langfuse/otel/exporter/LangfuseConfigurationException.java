/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.exporter;

/**
 * Raised by {@link LangfuseSpanExporterBuilder#build()} when the merged configuration cannot
 * produce a working exporter. Configuration problems never surface later, during export.
 */
public final class LangfuseConfigurationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    /** The composed endpoint is not an absolute http(s) URL. */
    INVALID_ENDPOINT,
    /** No source yielded an {@code Authorization} value. */
    MISSING_CREDENTIALS,
    /** The timeout is non-numeric or not positive. */
    INVALID_TIMEOUT,
    /** The compression is neither {@code none} nor {@code gzip}. */
    INVALID_COMPRESSION,
    /** The exporter was constructed from a configuration without an HTTP client. */
    NO_HTTP_CLIENT
  }

  final Kind kind;

  public LangfuseConfigurationException(Kind kind, String message) {
    super(message);
    if (kind == null) throw new NullPointerException("kind == null");
    this.kind = kind;
  }

  public LangfuseConfigurationException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    if (kind == null) throw new NullPointerException("kind == null");
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
