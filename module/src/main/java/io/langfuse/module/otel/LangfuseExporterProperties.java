/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.module.otel;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Overrides applied on top of the {@code LANGFUSE_*} and {@code OTEL_EXPORTER_OTLP_*} variables. */
@ConfigurationProperties("langfuse.otel.exporter")
public class LangfuseExporterProperties {
  private String host;

  private String publicKey;

  private String secretKey;

  private Duration timeout;

  private String compression;

  public String getHost() {
    return host;
  }

  public void setHost(String host) {
    this.host = host;
  }

  public String getPublicKey() {
    return publicKey;
  }

  public void setPublicKey(String publicKey) {
    this.publicKey = publicKey;
  }

  public String getSecretKey() {
    return secretKey;
  }

  public void setSecretKey(String secretKey) {
    this.secretKey = secretKey;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public String getCompression() {
    return compression;
  }

  public void setCompression(String compression) {
    this.compression = compression;
  }
}
