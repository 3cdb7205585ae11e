/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.exporter;

/** Where the resolved endpoint came from, highest precedence first. */
public enum EndpointSource {
  /** {@link LangfuseSpanExporterBuilder#host(String)} */
  EXPLICIT_HOST,
  /** {@value Environment#LANGFUSE_HOST} */
  BACKEND_ENV_HOST,
  /** {@value Environment#OTEL_EXPORTER_OTLP_TRACES_ENDPOINT} */
  GENERIC_ENV_TRACES_ENDPOINT,
  /** {@value Environment#OTEL_EXPORTER_OTLP_ENDPOINT} */
  GENERIC_ENV_BASE_ENDPOINT,
  /** {@value EndpointComposer#DEFAULT_HOST} */
  DEFAULT
}
