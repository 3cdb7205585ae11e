/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.context;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import java.time.Instant;
import java.util.Map;

import static io.langfuse.otel.context.LangfuseAttributes.GEN_AI_REQUEST;
import static io.langfuse.otel.context.LangfuseAttributes.GEN_AI_REQUEST_MODEL;
import static io.langfuse.otel.context.LangfuseAttributes.GEN_AI_USAGE_COMPLETION_TOKENS;
import static io.langfuse.otel.context.LangfuseAttributes.GEN_AI_USAGE_PROMPT_TOKENS;
import static io.langfuse.otel.context.LangfuseAttributes.GEN_AI_USAGE_TOTAL_TOKENS;
import static io.langfuse.otel.context.LangfuseAttributes.OBSERVATION_COMPLETION_START_TIME;
import static io.langfuse.otel.context.LangfuseAttributes.OBSERVATION_INPUT;
import static io.langfuse.otel.context.LangfuseAttributes.OBSERVATION_METADATA;
import static io.langfuse.otel.context.LangfuseAttributes.OBSERVATION_MODEL;
import static io.langfuse.otel.context.LangfuseAttributes.OBSERVATION_MODEL_PARAMETERS;
import static io.langfuse.otel.context.LangfuseAttributes.OBSERVATION_OUTPUT;
import static io.langfuse.otel.context.LangfuseAttributes.OBSERVATION_TYPE;
import static io.langfuse.otel.context.LangfuseAttributes.OBSERVATION_USAGE_INPUT;
import static io.langfuse.otel.context.LangfuseAttributes.OBSERVATION_USAGE_OUTPUT;
import static io.langfuse.otel.context.LangfuseAttributes.OBSERVATION_USAGE_TOTAL;
import static io.langfuse.otel.context.LangfuseAttributes.TRACE_INPUT;
import static io.langfuse.otel.context.LangfuseAttributes.TRACE_OUTPUT;
import static io.langfuse.otel.context.LangfuseAttributes.TRACE_PUBLIC;

/**
 * Sets observation level Langfuse attributes on a span, such as the model used and token usage.
 *
 * <p>Model name and token counts are also written under their {@code gen_ai.*} names, so backends
 * that only read the OpenTelemetry GenAI conventions see them too.
 *
 * <pre>{@code
 * LangfuseSpan.wrap(span)
 *     .observationType("generation")
 *     .model("gpt-4o")
 *     .input(messages)
 *     .usage(12, 30);
 * }</pre>
 */
public final class LangfuseSpan {
  public static LangfuseSpan wrap(Span span) {
    if (span == null) throw new NullPointerException("span == null");
    return new LangfuseSpan(span);
  }

  final Span span;

  LangfuseSpan(Span span) {
    this.span = span;
  }

  public Span span() {
    return span;
  }

  /** For example "generation", "span" or "event". */
  public LangfuseSpan observationType(String type) {
    if (type == null) throw new NullPointerException("type == null");
    span.setAttribute(OBSERVATION_TYPE, type);
    return this;
  }

  public LangfuseSpan model(String model) {
    if (model == null) throw new NullPointerException("model == null");
    span.setAttribute(OBSERVATION_MODEL, model);
    span.setAttribute(GEN_AI_REQUEST_MODEL, model);
    return this;
  }

  /**
   * Writes the parameters as one JSON object. Scalar entries are also written as
   * {@code gen_ai.request.<key>}, keeping their type.
   */
  public LangfuseSpan modelParameters(Map<String, ?> parameters) {
    if (parameters == null) throw new NullPointerException("parameters == null");
    AttributesBuilder builder = Attributes.builder()
        .put(AttributeKey.stringKey(OBSERVATION_MODEL_PARAMETERS), JsonValues.toJson(parameters));
    for (Map.Entry<String, ?> entry : parameters.entrySet()) {
      Object value = entry.getValue();
      if (isScalar(value)) {
        TraceAttributeContext.putTyped(builder, GEN_AI_REQUEST + "." + entry.getKey(), value);
      }
    }
    span.setAllAttributes(builder.build());
    return this;
  }

  /** Strings are written as they are. Anything else is written as JSON. */
  public LangfuseSpan input(Object input) {
    span.setAttribute(OBSERVATION_INPUT, textOrJson(input, "input"));
    return this;
  }

  /** Strings are written as they are. Anything else is written as JSON. */
  public LangfuseSpan output(Object output) {
    span.setAttribute(OBSERVATION_OUTPUT, textOrJson(output, "output"));
    return this;
  }

  public LangfuseSpan inputTokens(long tokens) {
    span.setAttribute(OBSERVATION_USAGE_INPUT, checkTokens(tokens, "inputTokens"));
    span.setAttribute(GEN_AI_USAGE_PROMPT_TOKENS, tokens);
    return this;
  }

  public LangfuseSpan outputTokens(long tokens) {
    span.setAttribute(OBSERVATION_USAGE_OUTPUT, checkTokens(tokens, "outputTokens"));
    span.setAttribute(GEN_AI_USAGE_COMPLETION_TOKENS, tokens);
    return this;
  }

  public LangfuseSpan totalTokens(long tokens) {
    span.setAttribute(OBSERVATION_USAGE_TOTAL, checkTokens(tokens, "totalTokens"));
    span.setAttribute(GEN_AI_USAGE_TOTAL_TOKENS, tokens);
    return this;
  }

  /** Sets input and output tokens, and their sum as the total. */
  public LangfuseSpan usage(long inputTokens, long outputTokens) {
    checkTokens(inputTokens, "inputTokens");
    checkTokens(outputTokens, "outputTokens");
    long total = Math.addExact(inputTokens, outputTokens);
    return inputTokens(inputTokens).outputTokens(outputTokens).totalTokens(total);
  }

  /** When the first token arrived, in ISO-8601. */
  public LangfuseSpan completionStartTime(Instant time) {
    if (time == null) throw new NullPointerException("time == null");
    span.setAttribute(OBSERVATION_COMPLETION_START_TIME, time.toString());
    return this;
  }

  /** Writes {@code langfuse.observation.metadata.<key>}. Non-scalar values are written as JSON. */
  public LangfuseSpan metadata(String key, Object value) {
    if (key == null) throw new NullPointerException("key == null");
    if (value == null) throw new NullPointerException("value == null");
    AttributesBuilder builder = Attributes.builder();
    TraceAttributeContext.putTyped(builder, OBSERVATION_METADATA + "." + key, value);
    span.setAllAttributes(builder.build());
    return this;
  }

  public LangfuseSpan tracePublic(boolean traceIsPublic) {
    span.setAttribute(TRACE_PUBLIC, traceIsPublic);
    return this;
  }

  public LangfuseSpan traceInput(Object input) {
    span.setAttribute(TRACE_INPUT, textOrJson(input, "input"));
    return this;
  }

  public LangfuseSpan traceOutput(Object output) {
    span.setAttribute(TRACE_OUTPUT, textOrJson(output, "output"));
    return this;
  }

  static String textOrJson(Object value, String name) {
    if (value == null) throw new NullPointerException(name + " == null");
    return value instanceof String ? (String) value : JsonValues.toJson(value);
  }

  static long checkTokens(long tokens, String name) {
    if (tokens < 0) throw new IllegalArgumentException(name + " < 0");
    return tokens;
  }

  static boolean isScalar(Object value) {
    return value instanceof String || value instanceof Boolean
        || value instanceof Double || value instanceof Float
        || value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte;
  }

  @Override public String toString() {
    return "LangfuseSpan{" + span + "}";
  }
}
