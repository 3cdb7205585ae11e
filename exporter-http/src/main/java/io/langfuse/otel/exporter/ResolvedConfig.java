/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.exporter;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;

/**
 * Fully merged exporter configuration. Instances are immutable and owned by the exporter built
 * from them.
 */
public final class ResolvedConfig {
  final HttpUrl endpoint;
  final EndpointSource endpointSource;
  final String authorization;
  final CredentialSource credentialSource;
  final Map<String, String> headers;
  final Duration timeout;
  final Compression compression;
  final OkHttpClient httpClient;

  ResolvedConfig(HttpUrl endpoint, EndpointSource endpointSource, String authorization,
      CredentialSource credentialSource, Map<String, String> headers, Duration timeout,
      Compression compression, OkHttpClient httpClient) {
    this.endpoint = endpoint;
    this.endpointSource = endpointSource;
    this.authorization = authorization;
    this.credentialSource = credentialSource;
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    this.timeout = timeout;
    this.compression = compression;
    this.httpClient = httpClient;
  }

  /** Absolute traces URL, for example {@code https://cloud.langfuse.com/api/public/otel/v1/traces} */
  public HttpUrl endpoint() {
    return endpoint;
  }

  public EndpointSource endpointSource() {
    return endpointSource;
  }

  /** Value of the {@code Authorization} request header. Never null. */
  public String authorization() {
    return authorization;
  }

  public CredentialSource credentialSource() {
    return credentialSource;
  }

  /** Extra request headers. Never contains {@code Authorization}. */
  public Map<String, String> headers() {
    return headers;
  }

  public Duration timeout() {
    return timeout;
  }

  public Compression compression() {
    return compression;
  }

  /** The client used for export, or null before the builder provisions one. */
  public OkHttpClient httpClient() {
    return httpClient;
  }

  ResolvedConfig withHttpClient(OkHttpClient httpClient) {
    if (httpClient == null) throw new NullPointerException("httpClient == null");
    return new ResolvedConfig(endpoint, endpointSource, authorization, credentialSource, headers,
        timeout, compression, httpClient);
  }

  /** Never includes the authorization value or header values. */
  @Override public String toString() {
    return "ResolvedConfig{endpoint=" + endpoint
        + ", endpointSource=" + endpointSource
        + ", credentialSource=" + credentialSource
        + ", headers=" + headers.keySet()
        + ", timeout=" + timeout
        + ", compression=" + compression.value()
        + "}";
  }
}
