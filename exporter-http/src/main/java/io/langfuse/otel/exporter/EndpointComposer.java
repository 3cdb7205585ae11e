/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.exporter;

import java.util.logging.Level;
import java.util.logging.Logger;
import okhttp3.HttpUrl;

import static io.langfuse.otel.exporter.LangfuseConfigurationException.Kind.INVALID_ENDPOINT;

/**
 * Composes the absolute OTLP traces URL from a configured host or endpoint.
 *
 * <p>Langfuse serves OTLP under {@value #VENDOR_ROOT_PATH}, so a Langfuse host gets
 * {@value #LANGFUSE_TRACES_PATH} appended, while a generic OTLP base endpoint only gets
 * {@value #TRACES_PATH}. Exactly one trailing slash is trimmed before appending and exactly one
 * suffix is appended.
 */
public final class EndpointComposer {
  private static final Logger LOG = Logger.getLogger(EndpointComposer.class.getName());

  public static final String DEFAULT_HOST = "https://cloud.langfuse.com";
  public static final String VENDOR_ROOT_PATH = "/api/public/otel";
  public static final String TRACES_PATH = "/v1/traces";
  public static final String LANGFUSE_TRACES_PATH = VENDOR_ROOT_PATH + TRACES_PATH;

  /**
   * Returns the traces endpoint for the given base and source.
   *
   * @param base ignored when the source is {@link EndpointSource#DEFAULT}
   * @throws LangfuseConfigurationException when the result is not an absolute http(s) URL
   */
  public static HttpUrl compose(String base, EndpointSource source) {
    if (source == null) throw new NullPointerException("source == null");
    String composed;
    switch (source) {
      case EXPLICIT_HOST:
      case BACKEND_ENV_HOST:
        composed = appendLangfusePath(requireBase(base), source);
        break;
      case GENERIC_ENV_TRACES_ENDPOINT:
        composed = requireBase(base);
        if (!composed.endsWith(TRACES_PATH)) {
          LOG.log(Level.FINE, "Using traces endpoint {0} verbatim", composed);
        }
        return parse(composed, source, false);
      case GENERIC_ENV_BASE_ENDPOINT:
        composed = trimTrailingSlash(requireBase(base));
        if (!composed.endsWith(TRACES_PATH)) composed += TRACES_PATH;
        break;
      case DEFAULT:
        composed = DEFAULT_HOST + LANGFUSE_TRACES_PATH;
        break;
      default:
        throw new AssertionError("unexpected source " + source);
    }
    return parse(composed, source, true);
  }

  static String appendLangfusePath(String base, EndpointSource source) {
    String trimmed = trimTrailingSlash(base);
    if (trimmed.endsWith(TRACES_PATH)) return trimmed;
    if (trimmed.endsWith(VENDOR_ROOT_PATH)) {
      // historical form of the Langfuse endpoint, before the OTLP path was required
      LOG.log(Level.WARNING, "{0} {1} ends with {2}; appending {3}. Configure the host without "
          + "a path instead.", new Object[] {source, trimmed, VENDOR_ROOT_PATH, TRACES_PATH});
      return trimmed + TRACES_PATH;
    }
    return trimmed + LANGFUSE_TRACES_PATH;
  }

  /** Trims exactly one trailing slash. */
  static String trimTrailingSlash(String value) {
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }

  static String requireBase(String base) {
    if (base == null) throw new NullPointerException("base == null");
    return base.trim();
  }

  static HttpUrl parse(String composed, EndpointSource source, boolean requireTracesPath) {
    HttpUrl url = HttpUrl.parse(composed);
    if (url == null) {
      throw new LangfuseConfigurationException(INVALID_ENDPOINT,
          "Invalid endpoint from " + source + ": \"" + composed + "\" is not an absolute http(s) URL");
    }
    String path = url.encodedPath();
    if (path.contains("//")) {
      throw new LangfuseConfigurationException(INVALID_ENDPOINT,
          "Invalid endpoint from " + source + ": \"" + composed + "\" has an empty path segment");
    }
    if (requireTracesPath
        && (!path.endsWith(TRACES_PATH) || url.encodedQuery() != null || url.encodedFragment() != null)) {
      throw new LangfuseConfigurationException(INVALID_ENDPOINT,
          "Invalid endpoint from " + source + ": \"" + composed + "\" must end with "
              + TRACES_PATH + " and have no query or fragment");
    }
    return url;
  }

  private EndpointComposer() {
  }
}
