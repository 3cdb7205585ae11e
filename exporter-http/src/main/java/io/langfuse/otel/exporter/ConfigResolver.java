/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.exporter;

import java.net.URLDecoder;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;

import static io.langfuse.otel.exporter.Environment.LANGFUSE_HOST;
import static io.langfuse.otel.exporter.Environment.LANGFUSE_PUBLIC_KEY;
import static io.langfuse.otel.exporter.Environment.LANGFUSE_SECRET_KEY;
import static io.langfuse.otel.exporter.Environment.OTEL_EXPORTER_OTLP_COMPRESSION;
import static io.langfuse.otel.exporter.Environment.OTEL_EXPORTER_OTLP_ENDPOINT;
import static io.langfuse.otel.exporter.Environment.OTEL_EXPORTER_OTLP_HEADERS;
import static io.langfuse.otel.exporter.Environment.OTEL_EXPORTER_OTLP_TIMEOUT;
import static io.langfuse.otel.exporter.Environment.OTEL_EXPORTER_OTLP_TRACES_ENDPOINT;
import static io.langfuse.otel.exporter.Environment.OTEL_EXPORTER_OTLP_TRACES_HEADERS;
import static io.langfuse.otel.exporter.LangfuseConfigurationException.Kind.INVALID_TIMEOUT;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Merges explicit settings, {@code LANGFUSE_*} variables and generic {@code OTEL_EXPORTER_OTLP_*}
 * variables into a {@link ResolvedConfig}. Explicit settings always win. Resolution performs no
 * I/O.
 */
final class ConfigResolver {
  private static final Logger LOG = Logger.getLogger(ConfigResolver.class.getName());

  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
  static final String AUTHORIZATION = "Authorization";

  /** Explicit settings, as recorded by {@link LangfuseSpanExporterBuilder}. Any field may be null. */
  static final class Input {
    String host;
    String publicKey;
    String secretKey;
    final Map<String, String> headers = new LinkedHashMap<>();
    Duration timeout;
    String compression;
    OkHttpClient httpClient;
  }

  /**
   * @throws LangfuseConfigurationException on an invalid endpoint, timeout or compression, or
   * when no credentials are available
   */
  static ResolvedConfig resolve(Input input, Environment env) {
    if (input == null) throw new NullPointerException("input == null");
    if (env == null) throw new NullPointerException("env == null");

    EndpointSource endpointSource;
    String base;
    if (input.host != null) {
      endpointSource = EndpointSource.EXPLICIT_HOST;
      base = input.host;
    } else if (env.get(LANGFUSE_HOST) != null) {
      endpointSource = EndpointSource.BACKEND_ENV_HOST;
      base = env.get(LANGFUSE_HOST);
    } else if (env.get(OTEL_EXPORTER_OTLP_TRACES_ENDPOINT) != null) {
      endpointSource = EndpointSource.GENERIC_ENV_TRACES_ENDPOINT;
      base = env.get(OTEL_EXPORTER_OTLP_TRACES_ENDPOINT);
    } else if (env.get(OTEL_EXPORTER_OTLP_ENDPOINT) != null) {
      endpointSource = EndpointSource.GENERIC_ENV_BASE_ENDPOINT;
      base = env.get(OTEL_EXPORTER_OTLP_ENDPOINT);
    } else {
      endpointSource = EndpointSource.DEFAULT;
      base = null;
    }
    HttpUrl endpoint = EndpointComposer.compose(base, endpointSource);

    Map<String, String> genericHeaders =
        parseHeaderList(OTEL_EXPORTER_OTLP_HEADERS, env.get(OTEL_EXPORTER_OTLP_HEADERS));
    Map<String, String> genericTracesHeaders =
        parseHeaderList(OTEL_EXPORTER_OTLP_TRACES_HEADERS, env.get(OTEL_EXPORTER_OTLP_TRACES_HEADERS));

    AuthComposer.Resolution auth = AuthComposer.resolve(AuthComposer.Credentials.newBuilder()
        .keyPair(CredentialSource.EXPLICIT_KEY_PAIR, input.publicKey, input.secretKey)
        .header(CredentialSource.EXPLICIT_HEADER, getHeader(input.headers, AUTHORIZATION))
        .keyPair(CredentialSource.BACKEND_ENV_KEY_PAIR,
            env.get(LANGFUSE_PUBLIC_KEY), env.get(LANGFUSE_SECRET_KEY))
        .header(CredentialSource.GENERIC_ENV_TRACES_HEADER,
            getHeader(genericTracesHeaders, AUTHORIZATION))
        .header(CredentialSource.GENERIC_ENV_HEADER, getHeader(genericHeaders, AUTHORIZATION))
        .build());

    Map<String, String> headers = new LinkedHashMap<>();
    putAllHeaders(headers, genericHeaders);
    putAllHeaders(headers, genericTracesHeaders);
    putAllHeaders(headers, input.headers);
    removeHeader(headers, AUTHORIZATION);

    ResolvedConfig config = new ResolvedConfig(endpoint, endpointSource, auth.authorization(),
        auth.source(), headers, resolveTimeout(input.timeout, env),
        resolveCompression(input.compression, env), input.httpClient);
    LOG.log(Level.FINE, "Resolved {0}", config);
    return config;
  }

  static Duration resolveTimeout(Duration explicit, Environment env) {
    if (explicit != null) return checkTimeout(explicit, "Timeout");
    String value = env.get(OTEL_EXPORTER_OTLP_TIMEOUT);
    if (value == null) return DEFAULT_TIMEOUT;
    long millis;
    try {
      millis = Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new LangfuseConfigurationException(INVALID_TIMEOUT,
          OTEL_EXPORTER_OTLP_TIMEOUT + " must be a number of milliseconds, but was \"" + value + "\"",
          e);
    }
    return checkTimeout(Duration.ofMillis(millis), OTEL_EXPORTER_OTLP_TIMEOUT);
  }

  /**
   * The HTTP client counts call timeouts in whole milliseconds held in an int, where zero means no
   * timeout. Anything it can't represent is rejected rather than rounded.
   */
  static Duration checkTimeout(Duration timeout, String name) {
    if (timeout.isNegative() || timeout.isZero()) {
      throw new LangfuseConfigurationException(INVALID_TIMEOUT,
          name + " must be positive, but was " + timeout);
    }
    long millis;
    try {
      millis = timeout.toMillis();
    } catch (ArithmeticException e) {
      throw new LangfuseConfigurationException(INVALID_TIMEOUT,
          name + " is too large: " + timeout, e);
    }
    if (millis == 0) {
      throw new LangfuseConfigurationException(INVALID_TIMEOUT,
          name + " must be at least 1ms, but was " + timeout);
    }
    if (millis > Integer.MAX_VALUE) {
      throw new LangfuseConfigurationException(INVALID_TIMEOUT,
          name + " must be at most " + Integer.MAX_VALUE + "ms, but was " + timeout);
    }
    return timeout;
  }

  static Compression resolveCompression(String explicit, Environment env) {
    if (explicit != null) return Compression.parse(explicit);
    String value = env.get(OTEL_EXPORTER_OTLP_COMPRESSION);
    return value != null ? Compression.parse(value) : Compression.NONE;
  }

  /**
   * Parses the W3C baggage style list used by {@code OTEL_EXPORTER_OTLP_HEADERS}: comma separated
   * {@code key=value} pairs with percent-encoded values. Malformed entries are skipped.
   */
  static Map<String, String> parseHeaderList(String variable, String value) {
    Map<String, String> result = new LinkedHashMap<>();
    if (value == null) return result;
    for (String entry : value.split(",")) {
      String trimmed = entry.trim();
      if (trimmed.isEmpty()) continue;
      int equals = trimmed.indexOf('=');
      if (equals <= 0) {
        // don't log the entry: it may be a credential
        LOG.log(Level.WARNING, "Ignoring an entry without a key in {0}", variable);
        continue;
      }
      String key = decode(trimmed.substring(0, equals).trim());
      String headerValue = decode(trimmed.substring(equals + 1).trim());
      putHeader(result, key, headerValue);
    }
    return result;
  }

  /** Percent-decodes, keeping a literal '+' so base64 values survive. */
  static String decode(String value) {
    try {
      return URLDecoder.decode(value.replace("+", "%2B"), UTF_8);
    } catch (IllegalArgumentException e) {
      return value; // not percent-encoded
    }
  }

  static String getHeader(Map<String, String> headers, String name) {
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (entry.getKey().equalsIgnoreCase(name)) return entry.getValue();
    }
    return null;
  }

  static void putAllHeaders(Map<String, String> headers, Map<String, String> overrides) {
    for (Map.Entry<String, String> entry : overrides.entrySet()) {
      putHeader(headers, entry.getKey(), entry.getValue());
    }
  }

  /** Header names are case-insensitive, so a later value replaces any differently cased one. */
  static void putHeader(Map<String, String> headers, String name, String value) {
    removeHeader(headers, name);
    headers.put(name, value);
  }

  static void removeHeader(Map<String, String> headers, String name) {
    for (Iterator<String> i = headers.keySet().iterator(); i.hasNext(); ) {
      if (i.next().equalsIgnoreCase(name)) i.remove();
    }
  }

  private ConfigResolver() {
  }
}
