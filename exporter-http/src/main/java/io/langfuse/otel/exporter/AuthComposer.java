/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.exporter;

import java.util.Base64;
import java.util.EnumMap;
import java.util.Map;

import static io.langfuse.otel.exporter.LangfuseConfigurationException.Kind.MISSING_CREDENTIALS;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Derives the single {@code Authorization} header sent to Langfuse.
 *
 * <p>Candidates are considered in {@link CredentialSource} order and the first one present wins.
 * A key pair always ranks above a raw header, so basic auth built from an explicit key pair is
 * never overridden by a header map supplied through the generic OTLP variables.
 */
public final class AuthComposer {

  /** Returns {@code Basic base64(publicKey:secretKey)}. */
  public static String basicAuth(String publicKey, String secretKey) {
    if (publicKey == null) throw new NullPointerException("publicKey == null");
    if (secretKey == null) throw new NullPointerException("secretKey == null");
    String credentials = publicKey + ":" + secretKey;
    return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(UTF_8));
  }

  /**
   * Returns the highest precedence credential.
   *
   * @throws LangfuseConfigurationException when no source yields a value
   */
  public static Resolution resolve(Credentials credentials) {
    if (credentials == null) throw new NullPointerException("credentials == null");
    if (!credentials.candidates.isEmpty()) { // EnumMap iterates in precedence order
      Map.Entry<CredentialSource, String> first =
          credentials.candidates.entrySet().iterator().next();
      return new Resolution(first.getValue(), first.getKey());
    }
    throw new LangfuseConfigurationException(MISSING_CREDENTIALS,
        "No Langfuse credentials found. Call credentials(publicKey, secretKey), set "
            + Environment.LANGFUSE_PUBLIC_KEY + " and " + Environment.LANGFUSE_SECRET_KEY
            + ", or supply an Authorization entry in " + Environment.OTEL_EXPORTER_OTLP_HEADERS);
  }

  /** Credential material gathered from every source, tagged by where it came from. */
  public static final class Credentials {

    public static Builder newBuilder() {
      return new Builder();
    }

    public static final class Builder {
      final EnumMap<CredentialSource, String> candidates = new EnumMap<>(CredentialSource.class);

      /**
       * Adds a key pair candidate. Ignored unless both keys are present, since a lone public or
       * secret key cannot produce a header.
       */
      public Builder keyPair(CredentialSource source, String publicKey, String secretKey) {
        if (source == null) throw new NullPointerException("source == null");
        String pk = Environment.normalize(publicKey);
        String sk = Environment.normalize(secretKey);
        if (pk != null && sk != null) candidates.put(source, basicAuth(pk, sk));
        return this;
      }

      /** Adds a raw {@code Authorization} header candidate. Ignored when blank. */
      public Builder header(CredentialSource source, String authorization) {
        if (source == null) throw new NullPointerException("source == null");
        String value = Environment.normalize(authorization);
        if (value != null) candidates.put(source, value);
        return this;
      }

      public Credentials build() {
        return new Credentials(this);
      }

      Builder() {
      }
    }

    final EnumMap<CredentialSource, String> candidates;

    Credentials(Builder builder) {
      candidates = new EnumMap<>(builder.candidates);
    }
  }

  public static final class Resolution {
    final String authorization;
    final CredentialSource source;

    Resolution(String authorization, CredentialSource source) {
      this.authorization = authorization;
      this.source = source;
    }

    public String authorization() {
      return authorization;
    }

    public CredentialSource source() {
      return source;
    }

    @Override public String toString() {
      return "Resolution{source=" + source + "}";
    }
  }

  private AuthComposer() {
  }
}
