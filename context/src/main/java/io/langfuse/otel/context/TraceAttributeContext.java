/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.context;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.langfuse.otel.context.LangfuseAttributes.TRACE_NAME;
import static io.langfuse.otel.context.LangfuseAttributes.TRACE_SESSION_ID;
import static io.langfuse.otel.context.LangfuseAttributes.TRACE_TAGS;
import static io.langfuse.otel.context.LangfuseAttributes.TRACE_USER_ID;

/**
 * Collects trace level fields Langfuse groups spans by, such as the session and user, and turns
 * them into span attributes.
 *
 * <p>Only fields that were set are emitted, always in the same order: name, session, user, tags,
 * then metadata in insertion order. Emitting does not change this context.
 *
 * <pre>{@code
 * TraceAttributeContext.create()
 *     .sessionId("chat-42")
 *     .userId("alice")
 *     .addTags("beta")
 *     .applyTo(Span.current());
 * }</pre>
 *
 * <p>Instances are not thread-safe.
 */
public final class TraceAttributeContext {
  public static TraceAttributeContext create() {
    return new TraceAttributeContext();
  }

  String name, sessionId, userId;
  final List<String> tags = new ArrayList<>();
  final Map<String, Object> metadata = new LinkedHashMap<>();

  public TraceAttributeContext() {
  }

  TraceAttributeContext(TraceAttributeContext parent) {
    this.name = parent.name;
    this.sessionId = parent.sessionId;
    this.userId = parent.userId;
    this.tags.addAll(parent.tags);
    this.metadata.putAll(parent.metadata);
  }

  public TraceAttributeContext name(String name) {
    if (name == null) throw new NullPointerException("name == null");
    this.name = name;
    return this;
  }

  public TraceAttributeContext sessionId(String sessionId) {
    if (sessionId == null) throw new NullPointerException("sessionId == null");
    this.sessionId = sessionId;
    return this;
  }

  public TraceAttributeContext userId(String userId) {
    if (userId == null) throw new NullPointerException("userId == null");
    this.userId = userId;
    return this;
  }

  public TraceAttributeContext addTags(String... tags) {
    if (tags == null) throw new NullPointerException("tags == null");
    for (String tag : tags) addTag(tag);
    return this;
  }

  public TraceAttributeContext addTags(Collection<String> tags) {
    if (tags == null) throw new NullPointerException("tags == null");
    for (String tag : tags) addTag(tag);
    return this;
  }

  void addTag(String tag) {
    if (tag == null) throw new NullPointerException("tag == null");
    tags.add(tag);
  }

  /**
   * Adds a metadata entry, replacing any earlier value of the same key without moving it. Values
   * other than strings, booleans and numbers are emitted as JSON.
   */
  public TraceAttributeContext metadata(String key, Object value) {
    if (key == null) throw new NullPointerException("key == null");
    if (value == null) throw new NullPointerException("value == null");
    metadata.put(key, value);
    return this;
  }

  /** Returns an independent copy of this context. Changes to either don't affect the other. */
  public TraceAttributeContext child() {
    return new TraceAttributeContext(this);
  }

  /** Returns the attributes to set, in emission order. */
  public List<Map.Entry<String, Object>> emit() {
    List<Map.Entry<String, Object>> result = new ArrayList<>();
    if (name != null) result.add(new SimpleImmutableEntry<>(TRACE_NAME, name));
    if (sessionId != null) result.add(new SimpleImmutableEntry<>(TRACE_SESSION_ID, sessionId));
    if (userId != null) result.add(new SimpleImmutableEntry<>(TRACE_USER_ID, userId));
    if (!tags.isEmpty()) {
      result.add(new SimpleImmutableEntry<>(TRACE_TAGS,
          Collections.unmodifiableList(new ArrayList<>(tags))));
    }
    for (Map.Entry<String, Object> entry : metadata.entrySet()) {
      result.add(new SimpleImmutableEntry<>(
          LangfuseAttributes.metadataKey(entry.getKey()), entry.getValue()));
    }
    return Collections.unmodifiableList(result);
  }

  public Attributes toAttributes() {
    AttributesBuilder builder = Attributes.builder();
    for (Map.Entry<String, Object> entry : emit()) {
      if (entry.getKey().equals(TRACE_TAGS)) {
        builder.put(AttributeKey.stringArrayKey(TRACE_TAGS), new ArrayList<>(tags));
      } else {
        putTyped(builder, entry.getKey(), entry.getValue());
      }
    }
    return builder.build();
  }

  /** Strings, booleans and numbers keep their type. Anything else is written as JSON. */
  static void putTyped(AttributesBuilder builder, String key, Object value) {
    if (value instanceof String) {
      builder.put(AttributeKey.stringKey(key), (String) value);
    } else if (value instanceof Boolean) {
      builder.put(AttributeKey.booleanKey(key), (Boolean) value);
    } else if (value instanceof Double || value instanceof Float) {
      builder.put(AttributeKey.doubleKey(key), ((Number) value).doubleValue());
    } else if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      builder.put(AttributeKey.longKey(key), ((Number) value).longValue());
    } else {
      builder.put(AttributeKey.stringKey(key), JsonValues.toJson(value));
    }
  }

  /** Sets {@link #toAttributes()} on the span. */
  public Span applyTo(Span span) {
    if (span == null) throw new NullPointerException("span == null");
    return span.setAllAttributes(toAttributes());
  }

  @Override public String toString() {
    return "TraceAttributeContext{" + emit() + "}";
  }
}
