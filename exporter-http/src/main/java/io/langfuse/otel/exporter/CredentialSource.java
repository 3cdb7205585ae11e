/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.exporter;

/** Where the resolved {@code Authorization} header came from, highest precedence first. */
public enum CredentialSource {
  /** {@link LangfuseSpanExporterBuilder#credentials(String, String)} */
  EXPLICIT_KEY_PAIR,
  /** An explicitly added {@code Authorization} header. */
  EXPLICIT_HEADER,
  /** {@value Environment#LANGFUSE_PUBLIC_KEY} and {@value Environment#LANGFUSE_SECRET_KEY} */
  BACKEND_ENV_KEY_PAIR,
  /** The {@code Authorization} entry of {@value Environment#OTEL_EXPORTER_OTLP_TRACES_HEADERS} */
  GENERIC_ENV_TRACES_HEADER,
  /** The {@code Authorization} entry of {@value Environment#OTEL_EXPORTER_OTLP_HEADERS} */
  GENERIC_ENV_HEADER
}
