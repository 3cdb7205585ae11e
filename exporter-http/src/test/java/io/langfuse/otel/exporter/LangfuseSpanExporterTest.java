/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.exporter;

import com.linecorp.armeria.common.AggregatedHttpRequest;
import com.linecorp.armeria.common.HttpResponse;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.server.ServerBuilder;
import com.linecorp.armeria.testing.junit5.server.ServerExtension;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;
import io.opentelemetry.proto.trace.v1.Span;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.testing.trace.TestSpanData;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.data.StatusData;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okio.Buffer;
import okio.GzipSource;
import okio.Okio;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import static io.langfuse.otel.exporter.Environment.LANGFUSE_HOST;
import static io.langfuse.otel.exporter.Environment.LANGFUSE_PUBLIC_KEY;
import static io.langfuse.otel.exporter.Environment.LANGFUSE_SECRET_KEY;
import static io.langfuse.otel.exporter.Environment.OTEL_EXPORTER_OTLP_HEADERS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class LangfuseSpanExporterTest {
  static final ConcurrentLinkedQueue<AggregatedHttpRequest> requests =
      new ConcurrentLinkedQueue<>();
  static final ConcurrentLinkedQueue<HttpResponse> errors = new ConcurrentLinkedQueue<>();

  @RegisterExtension
  static final ServerExtension server = new ServerExtension() {
    @Override protected void configure(ServerBuilder sb) {
      sb.service(EndpointComposer.LANGFUSE_TRACES_PATH, (ctx, req) -> HttpResponse.of(
          req.aggregate().thenApply(aggregated -> {
            requests.add(aggregated);
            HttpResponse error = errors.poll();
            return error != null ? error : HttpResponse.of(HttpStatus.OK);
          })));
      sb.http(0);
    }
  };

  LangfuseSpanExporter exporter;

  @AfterEach void reset() {
    requests.clear();
    errors.clear();
    if (exporter != null) exporter.shutdown().join(10, SECONDS);
  }

  LangfuseSpanExporterBuilder builder() {
    return LangfuseSpanExporter.fromEnvironment(Environment.of(Map.of(
        LANGFUSE_HOST, server.httpUri().toString(),
        LANGFUSE_PUBLIC_KEY, "pk-lf-test",
        LANGFUSE_SECRET_KEY, "sk-lf-test")));
  }

  @Test void export() throws IOException {
    exporter = builder().build();

    CompletableResultCode result = exporter.export(List.of(span("chat", "session.id", "s-1")));

    assertThat(result.join(10, SECONDS).isSuccess()).isTrue();
    assertThat(requests).hasSize(1);
    AggregatedHttpRequest request = requests.peek();
    assertThat(request.path()).isEqualTo("/api/public/otel/v1/traces");
    assertThat(request.headers().get("authorization"))
        .isEqualTo(AuthComposer.basicAuth("pk-lf-test", "sk-lf-test"));
    assertThat(request.headers().get("content-type")).isEqualTo("application/x-protobuf");
    assertThat(request.headers().get("user-agent")).isEqualTo(LangfuseSpanExporter.USER_AGENT);
    assertThat(request.headers().get("content-encoding")).isNull();

    List<Span> spans = parse(request);
    assertThat(spans).extracting(Span::getName).containsExactly("chat");
    assertThat(spans.get(0).getAttributesList())
        .anySatisfy(kv -> {
          assertThat(kv.getKey()).isEqualTo("session.id");
          assertThat(kv.getValue().getStringValue()).isEqualTo("s-1");
        });
  }

  @Test void export_multipleSpansInOneRequest() throws IOException {
    exporter = builder().build();
    List<SpanData> batch = new ArrayList<>();
    for (int i = 0; i < 10; i++) batch.add(span("span-" + i, "index", String.valueOf(i)));

    assertThat(exporter.export(batch).join(10, SECONDS).isSuccess()).isTrue();

    assertThat(requests).hasSize(1);
    assertThat(parse(requests.peek())).hasSize(10);
  }

  @Test void export_empty() {
    exporter = builder().build();

    assertThat(exporter.export(Collections.emptyList()).isSuccess()).isTrue();
    assertThat(requests).isEmpty();
  }

  @Test void export_gzip() throws IOException {
    exporter = builder().compression(Compression.GZIP).build();

    assertThat(exporter.export(List.of(span("chat", "k", "v"))).join(10, SECONDS).isSuccess())
        .isTrue();

    AggregatedHttpRequest request = requests.peek();
    assertThat(request.headers().get("content-encoding")).isEqualTo("gzip");
    assertThat(parse(request)).extracting(Span::getName).containsExactly("chat");
  }

  @Test void export_extraHeaders() {
    exporter = LangfuseSpanExporter.fromEnvironment(Environment.of(Map.of(
            LANGFUSE_HOST, server.httpUri().toString(),
            OTEL_EXPORTER_OTLP_HEADERS, "Authorization=Bearer%20abc,X-Tenant=acme")))
        .build();

    assertThat(exporter.export(List.of(span("chat", "k", "v"))).join(10, SECONDS).isSuccess())
        .isTrue();

    AggregatedHttpRequest request = requests.peek();
    assertThat(request.headers().get("authorization")).isEqualTo("Bearer abc");
    assertThat(request.headers().get("x-tenant")).isEqualTo("acme");
  }

  @Test void export_failsOnErrorStatus() {
    exporter = builder().build();
    errors.add(HttpResponse.of(HttpStatus.UNAUTHORIZED, MediaType.PLAIN_TEXT_UTF_8,
        "Invalid credentials"));

    CompletableResultCode result = exporter.export(List.of(span("chat", "k", "v")));

    assertThat(result.join(10, SECONDS).isSuccess()).isFalse();
  }

  @Test void export_failsOnServerError() {
    exporter = builder().build();
    errors.add(HttpResponse.of(HttpStatus.SERVICE_UNAVAILABLE));

    assertThat(exporter.export(List.of(span("chat", "k", "v"))).join(10, SECONDS).isSuccess())
        .isFalse();
  }

  @Test void export_failsWhenUnreachable() {
    exporter = LangfuseSpanExporter.create("http://127.0.0.1:1", "pk", "sk");

    assertThat(exporter.export(List.of(span("chat", "k", "v"))).join(10, SECONDS).isSuccess())
        .isFalse();
  }

  @Test void export_guardRecoversShutDownDispatcher() {
    OkHttpClient client = new OkHttpClient();
    client.dispatcher().executorService().shutdown();
    exporter = builder().httpClient(client).build();

    CompletableResultCode result = exporter.export(List.of(span("chat", "k", "v")));

    assertThat(result.join(10, SECONDS).isSuccess()).isTrue();
    assertThat(requests).hasSize(1);
  }

  @Test void export_withoutGuardFailsOnShutDownDispatcher() {
    OkHttpClient client = new OkHttpClient();
    client.dispatcher().executorService().shutdown();
    exporter = builder().httpClient(client).runtimeGuard(false).build();

    CompletableResultCode result = exporter.export(List.of(span("chat", "k", "v")));

    assertThat(result.join(10, SECONDS).isSuccess()).isFalse();
    assertThat(requests).isEmpty();
  }

  @Test void shutdown() {
    exporter = builder().build();

    assertThat(exporter.shutdown().join(10, SECONDS).isSuccess()).isTrue();
    await().atMost(10, TimeUnit.SECONDS)
        .until(() -> exporter.client.dispatcher().executorService().isShutdown());
    assertThat(exporter.export(List.of(span("chat", "k", "v"))).isSuccess()).isFalse();
    assertThat(requests).isEmpty();
  }

  @Test void flush_waitsForInFlightExports() {
    exporter = builder().build();

    CompletableResultCode export = exporter.export(List.of(span("chat", "k", "v")));
    CompletableResultCode flush = exporter.flush();

    assertThat(flush.join(10, SECONDS).isSuccess()).isTrue();
    assertThat(export.isDone()).isTrue();
    await().atMost(10, TimeUnit.SECONDS).until(() -> exporter.inFlight.isEmpty());
  }

  static SpanData span(String name, String attributeKey, String attributeValue) {
    long start = TimeUnit.MILLISECONDS.toNanos(System.currentTimeMillis());
    return TestSpanData.builder()
        .setSpanContext(SpanContext.create("0af7651916cd43dd8448eb211c80319c", "b7ad6b7169203331",
            TraceFlags.getSampled(), TraceState.getDefault()))
        .setName(name)
        .setKind(SpanKind.INTERNAL)
        .setResource(Resource.getDefault())
        .setAttributes(Attributes.of(AttributeKey.stringKey(attributeKey), attributeValue))
        .setStartEpochNanos(start)
        .setEndEpochNanos(start + 1_000_000)
        .setStatus(StatusData.unset())
        .setHasEnded(true)
        .setTotalRecordedEvents(0)
        .setTotalRecordedLinks(0)
        .build();
  }

  static List<Span> parse(AggregatedHttpRequest request) throws IOException {
    byte[] body = request.content().array();
    if ("gzip".equals(request.headers().get("content-encoding"))) {
      Buffer buffer = new Buffer();
      try (GzipSource source = new GzipSource(Okio.source(new ByteArrayInputStream(body)))) {
        while (source.read(buffer, Integer.MAX_VALUE) != -1) {
          // drain
        }
      }
      body = buffer.readByteArray();
    }
    List<Span> spans = new ArrayList<>();
    ExportTraceServiceRequest.parseFrom(body).getResourceSpansList().forEach(
        resourceSpans -> resourceSpans.getScopeSpansList().forEach(
            scopeSpans -> spans.addAll(scopeSpans.getSpansList())));
    return spans;
  }
}
