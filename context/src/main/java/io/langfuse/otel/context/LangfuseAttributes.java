/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.context;

/**
 * Span attribute names Langfuse maps onto its trace and observation model. These take precedence
 * over generic OpenTelemetry conventions on the Langfuse side.
 *
 * @see <a href="https://langfuse.com/docs/opentelemetry/get-started">Langfuse OpenTelemetry</a>
 */
public final class LangfuseAttributes {
  // trace level
  public static final String TRACE_NAME = "langfuse.trace.name";
  public static final String TRACE_USER_ID = "user.id";
  public static final String TRACE_SESSION_ID = "session.id";
  public static final String TRACE_TAGS = "langfuse.trace.tags";
  public static final String TRACE_PUBLIC = "langfuse.trace.public";
  /** Prefix: each metadata key is appended after a dot. */
  public static final String TRACE_METADATA = "langfuse.trace.metadata";
  public static final String TRACE_INPUT = "langfuse.trace.input";
  public static final String TRACE_OUTPUT = "langfuse.trace.output";

  // observation level
  public static final String OBSERVATION_TYPE = "langfuse.observation.type";
  public static final String OBSERVATION_METADATA = "langfuse.observation.metadata";
  public static final String OBSERVATION_MODEL = "langfuse.observation.model.name";
  public static final String OBSERVATION_MODEL_PARAMETERS = "langfuse.observation.model.parameters";
  public static final String OBSERVATION_INPUT = "langfuse.observation.input";
  public static final String OBSERVATION_OUTPUT = "langfuse.observation.output";
  public static final String OBSERVATION_COMPLETION_START_TIME =
      "langfuse.observation.completion_start_time";
  public static final String OBSERVATION_USAGE_INPUT = "langfuse.observation.usage.input";
  public static final String OBSERVATION_USAGE_OUTPUT = "langfuse.observation.usage.output";
  public static final String OBSERVATION_USAGE_TOTAL = "langfuse.observation.usage.total";

  // OpenTelemetry GenAI conventions, written alongside the Langfuse keys
  public static final String GEN_AI_REQUEST_MODEL = "gen_ai.request.model";
  /** Prefix: each scalar model parameter is appended after a dot. */
  public static final String GEN_AI_REQUEST = "gen_ai.request";
  public static final String GEN_AI_USAGE_PROMPT_TOKENS = "gen_ai.usage.prompt_tokens";
  public static final String GEN_AI_USAGE_COMPLETION_TOKENS = "gen_ai.usage.completion_tokens";
  public static final String GEN_AI_USAGE_TOTAL_TOKENS = "gen_ai.usage.total_tokens";

  static String metadataKey(String key) {
    return TRACE_METADATA + "." + key;
  }

  private LangfuseAttributes() {
  }
}
