/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.module.otel;

import io.langfuse.otel.exporter.Environment;
import io.langfuse.otel.exporter.LangfuseSpanExporter;
import io.langfuse.otel.exporter.LangfuseSpanExporterBuilder;
import java.util.logging.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "langfuse.otel.exporter.enabled", matchIfMissing = true)
@EnableConfigurationProperties(LangfuseExporterProperties.class)
class LangfuseExporterModule {
  static final Logger LOG = Logger.getLogger(LangfuseExporterModule.class.getName());

  @ConditionalOnMissingBean(LangfuseSpanExporter.class)
  @Bean(destroyMethod = "shutdown")
  LangfuseSpanExporter langfuseSpanExporter(LangfuseExporterProperties properties,
      ObjectProvider<Environment> environment) {
    LangfuseSpanExporterBuilder builder =
        LangfuseSpanExporter.fromEnvironment(environment.getIfAvailable(Environment::system));
    if (properties.getHost() != null) {
      builder.host(properties.getHost());
    }
    if (properties.getPublicKey() != null && properties.getSecretKey() != null) {
      builder.credentials(properties.getPublicKey(), properties.getSecretKey());
    } else if (properties.getPublicKey() != null || properties.getSecretKey() != null) {
      String missing = properties.getPublicKey() == null ? "public-key" : "secret-key";
      LOG.warning("Ignoring langfuse.otel.exporter key pair: " + missing
          + " is not set. Credentials fall back to the environment.");
    }
    if (properties.getTimeout() != null) {
      builder.timeout(properties.getTimeout());
    }
    if (properties.getCompression() != null) {
      builder.compression(properties.getCompression());
    }
    return builder.build();
  }
}
