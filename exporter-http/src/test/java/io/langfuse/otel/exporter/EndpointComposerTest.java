/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.exporter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static io.langfuse.otel.exporter.EndpointSource.BACKEND_ENV_HOST;
import static io.langfuse.otel.exporter.EndpointSource.DEFAULT;
import static io.langfuse.otel.exporter.EndpointSource.EXPLICIT_HOST;
import static io.langfuse.otel.exporter.EndpointSource.GENERIC_ENV_BASE_ENDPOINT;
import static io.langfuse.otel.exporter.EndpointSource.GENERIC_ENV_TRACES_ENDPOINT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class EndpointComposerTest {
  @ParameterizedTest
  @EnumSource(value = EndpointSource.class, names = {"EXPLICIT_HOST", "BACKEND_ENV_HOST"})
  void host_appendsLangfusePath(EndpointSource source) {
    assertThat(EndpointComposer.compose("https://example.com", source))
        .hasToString("https://example.com/api/public/otel/v1/traces");
  }

  @ParameterizedTest
  @CsvSource({
      "https://example.com/, https://example.com/api/public/otel/v1/traces",
      "https://example.com/api/public/otel/v1/traces, https://example.com/api/public/otel/v1/traces",
      "https://example.com/api/public/otel/v1/traces/, https://example.com/api/public/otel/v1/traces",
      "http://localhost:3000, http://localhost:3000/api/public/otel/v1/traces",
      "https://proxy.example.com/langfuse, https://proxy.example.com/langfuse/api/public/otel/v1/traces",
      "'  https://example.com  ', https://example.com/api/public/otel/v1/traces"
  })
  void host_doesNotDuplicateSuffixOrSlashes(String host, String expected) {
    assertThat(EndpointComposer.compose(host, EXPLICIT_HOST)).hasToString(expected);
  }

  /** Older configurations pointed at the OTLP root rather than the host. */
  @Test void host_upgradesVendorRootPath() {
    assertThat(EndpointComposer.compose("https://example.com/api/public/otel", BACKEND_ENV_HOST))
        .hasToString("https://example.com/api/public/otel/v1/traces");
    assertThat(EndpointComposer.compose("https://example.com/api/public/otel/", EXPLICIT_HOST))
        .hasToString("https://example.com/api/public/otel/v1/traces");
  }

  @Test void baseEndpoint_appendsOnlyTracesPath() {
    assertThat(EndpointComposer.compose("https://h/api/public/otel", GENERIC_ENV_BASE_ENDPOINT))
        .hasToString("https://h/api/public/otel/v1/traces");
    assertThat(EndpointComposer.compose("https://h/api/public/otel/", GENERIC_ENV_BASE_ENDPOINT))
        .hasToString("https://h/api/public/otel/v1/traces");
    assertThat(EndpointComposer.compose("https://h/api/public/otel/v1/traces",
        GENERIC_ENV_BASE_ENDPOINT))
        .hasToString("https://h/api/public/otel/v1/traces");
  }

  @Test void tracesEndpoint_usedVerbatim() {
    assertThat(EndpointComposer.compose("https://h/custom/ingest", GENERIC_ENV_TRACES_ENDPOINT))
        .hasToString("https://h/custom/ingest");
    assertThat(EndpointComposer.compose("https://h/v1/traces?tenant=a", GENERIC_ENV_TRACES_ENDPOINT))
        .hasToString("https://h/v1/traces?tenant=a");
  }

  @Test void defaultEndpoint_ignoresBase() {
    assertThat(EndpointComposer.compose(null, DEFAULT))
        .hasToString("https://cloud.langfuse.com/api/public/otel/v1/traces");
    assertThat(EndpointComposer.compose("https://ignored", DEFAULT))
        .hasToString("https://cloud.langfuse.com/api/public/otel/v1/traces");
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "cloud.langfuse.com",
      "ftp://example.com",
      "https://example.com//",
      "https://example.com/a//b",
      "https://example.com?tenant=a",
      "https://example.com#top"
  })
  void host_invalid(String host) {
    LangfuseConfigurationException e = catchThrowableOfType(
        () -> EndpointComposer.compose(host, EXPLICIT_HOST), LangfuseConfigurationException.class);

    assertThat(e.kind()).isEqualTo(LangfuseConfigurationException.Kind.INVALID_ENDPOINT);
    assertThat(e).hasMessageContaining("EXPLICIT_HOST");
  }

  @Test void nonDefaultSource_requiresBase() {
    assertThatThrownBy(() -> EndpointComposer.compose(null, EXPLICIT_HOST))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("base == null");
  }
}
