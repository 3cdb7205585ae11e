/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.exporter;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

/**
 * Records explicit settings for a {@link LangfuseSpanExporter}. Setters only reject nulls; values
 * are validated by {@link #build()}, after merging with the environment.
 */
public final class LangfuseSpanExporterBuilder {
  final ConfigResolver.Input input = new ConfigResolver.Input();
  Environment environment;
  boolean runtimeGuard = true;

  LangfuseSpanExporterBuilder() {
  }

  /**
   * The Langfuse host, such as {@code https://cloud.langfuse.com}, or a full traces endpoint.
   * {@value EndpointComposer#LANGFUSE_TRACES_PATH} is appended unless the value already ends with
   * {@value EndpointComposer#TRACES_PATH}. Overrides every environment variable.
   */
  public LangfuseSpanExporterBuilder host(String host) {
    if (host == null) throw new NullPointerException("host == null");
    input.host = host;
    return this;
  }

  /** Sends basic auth built from the Langfuse project keys. Wins over any header. */
  public LangfuseSpanExporterBuilder credentials(String publicKey, String secretKey) {
    if (publicKey == null) throw new NullPointerException("publicKey == null");
    if (secretKey == null) throw new NullPointerException("secretKey == null");
    input.publicKey = publicKey;
    input.secretKey = secretKey;
    return this;
  }

  /**
   * Adds a request header, replacing any earlier value of the same name. An {@code Authorization}
   * header is used verbatim unless {@link #credentials(String, String)} is also set.
   */
  public LangfuseSpanExporterBuilder header(String name, String value) {
    if (name == null) throw new NullPointerException("name == null");
    if (value == null) throw new NullPointerException("value == null");
    ConfigResolver.putHeader(input.headers, name, value);
    return this;
  }

  public LangfuseSpanExporterBuilder headers(Map<String, String> headers) {
    if (headers == null) throw new NullPointerException("headers == null");
    headers.forEach(this::header);
    return this;
  }

  public LangfuseSpanExporterBuilder authorizationHeader(String value) {
    return header(ConfigResolver.AUTHORIZATION, value);
  }

  /** Bounds each export request. Defaults to {@code OTEL_EXPORTER_OTLP_TIMEOUT}, then 10s. */
  public LangfuseSpanExporterBuilder timeout(Duration timeout) {
    if (timeout == null) throw new NullPointerException("timeout == null");
    input.timeout = timeout;
    return this;
  }

  public LangfuseSpanExporterBuilder timeout(long timeout, TimeUnit unit) {
    if (unit == null) throw new NullPointerException("unit == null");
    return timeout(Duration.ofNanos(unit.toNanos(timeout)));
  }

  public LangfuseSpanExporterBuilder compression(Compression compression) {
    if (compression == null) throw new NullPointerException("compression == null");
    input.compression = compression.value();
    return this;
  }

  /** Either "none" or "gzip". Other values fail {@link #build()}. */
  public LangfuseSpanExporterBuilder compression(String compression) {
    if (compression == null) throw new NullPointerException("compression == null");
    input.compression = compression;
    return this;
  }

  /**
   * Client used to send spans. Its connection pool and dispatcher are shared, and it is not
   * closed when the exporter shuts down. When unset, the exporter creates and owns a client.
   */
  public LangfuseSpanExporterBuilder httpClient(OkHttpClient httpClient) {
    if (httpClient == null) throw new NullPointerException("httpClient == null");
    input.httpClient = httpClient;
    return this;
  }

  /** Variables to merge below explicit settings. Defaults to the process environment. */
  public LangfuseSpanExporterBuilder environment(Environment environment) {
    if (environment == null) throw new NullPointerException("environment == null");
    this.environment = environment;
    return this;
  }

  /** Whether exports are routed through a {@link RuntimeGuard}. Defaults to true. */
  public LangfuseSpanExporterBuilder runtimeGuard(boolean runtimeGuard) {
    this.runtimeGuard = runtimeGuard;
    return this;
  }

  /**
   * Resolves the configuration and creates the exporter.
   *
   * @throws LangfuseConfigurationException if the endpoint, credentials, timeout or compression
   * cannot be resolved
   */
  public LangfuseSpanExporter build() {
    Environment env = environment != null ? environment : Environment.system();
    ResolvedConfig config = ConfigResolver.resolve(input, env);

    boolean ownsClient = config.httpClient() == null;
    OkHttpClient.Builder clientBuilder =
        ownsClient ? new OkHttpClient.Builder() : config.httpClient().newBuilder();
    OkHttpClient client = clientBuilder.callTimeout(config.timeout()).build();
    return new LangfuseSpanExporter(config.withHttpClient(client), ownsClient, runtimeGuard);
  }
}
