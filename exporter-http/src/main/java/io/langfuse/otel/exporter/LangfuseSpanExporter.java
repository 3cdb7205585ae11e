/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.exporter;

import io.opentelemetry.exporter.internal.otlp.traces.TraceRequestMarshaler;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import okio.BufferedSink;
import okio.GzipSink;
import okio.Okio;

import static io.langfuse.otel.exporter.LangfuseConfigurationException.Kind.NO_HTTP_CLIENT;

/**
 * Sends spans to Langfuse as OTLP/HTTP protobuf. Each {@link #export(Collection)} is one POST.
 *
 * <p>Typical use is with a batch span processor:
 * <pre>{@code
 * SdkTracerProvider.builder()
 *     .addSpanProcessor(BatchSpanProcessor.builder(LangfuseSpanExporter.createFromEnvironment()).build())
 *     .build();
 * }</pre>
 */
public final class LangfuseSpanExporter implements SpanExporter {
  private static final Logger LOG = Logger.getLogger(LangfuseSpanExporter.class.getName());

  static final MediaType PROTOBUF = MediaType.get("application/x-protobuf");
  static final String USER_AGENT = "langfuse-otel-exporter-java";

  /** Returns a builder that merges the process environment when {@code build()} is called. */
  public static LangfuseSpanExporterBuilder builder() {
    return new LangfuseSpanExporterBuilder();
  }

  /**
   * Returns a builder seeded from a snapshot of the process environment, taken now. Explicit
   * settings applied before {@code build()} still win.
   */
  public static LangfuseSpanExporterBuilder fromEnvironment() {
    return fromEnvironment(Environment.system());
  }

  public static LangfuseSpanExporterBuilder fromEnvironment(Environment environment) {
    return builder().environment(environment);
  }

  /** Creates an exporter from explicit settings only, ignoring the environment. */
  public static LangfuseSpanExporter create(String host, String publicKey, String secretKey) {
    return builder().environment(Environment.empty())
        .host(host)
        .credentials(publicKey, secretKey)
        .build();
  }

  /** Creates an exporter entirely from environment variables. */
  public static LangfuseSpanExporter createFromEnvironment() {
    return fromEnvironment().build();
  }

  final ResolvedConfig config;
  final OkHttpClient client;
  final boolean ownsClient;
  final RuntimeGuard guard;
  final Headers headers;
  final AtomicBoolean shutdown = new AtomicBoolean();
  final Set<CompletableResultCode> inFlight = ConcurrentHashMap.newKeySet();

  LangfuseSpanExporter(ResolvedConfig config, boolean ownsClient, boolean runtimeGuard) {
    if (config == null) throw new NullPointerException("config == null");
    if (config.httpClient() == null) {
      throw new LangfuseConfigurationException(NO_HTTP_CLIENT,
          "No HTTP client configured for " + config.endpoint());
    }
    this.config = config;
    this.client = config.httpClient();
    this.ownsClient = ownsClient;
    this.guard = runtimeGuard ? new RuntimeGuard(client, config.timeout()) : null;

    Headers.Builder headers = new Headers.Builder();
    for (Map.Entry<String, String> entry : config.headers().entrySet()) {
      headers.set(entry.getKey(), entry.getValue());
    }
    headers.set("Authorization", config.authorization());
    headers.set("User-Agent", USER_AGENT);
    if (config.compression() == Compression.GZIP) headers.set("Content-Encoding", "gzip");
    this.headers = headers.build();
  }

  public ResolvedConfig getResolvedConfig() {
    return config;
  }

  @Override public CompletableResultCode export(Collection<SpanData> spans) {
    if (shutdown.get()) {
      LOG.log(Level.FINE, "Calling export() on a shutdown exporter");
      return CompletableResultCode.ofFailure();
    }
    if (spans.isEmpty()) return CompletableResultCode.ofSuccess();

    RequestBody body;
    try {
      body = encode(spans);
    } catch (IOException e) {
      LOG.log(Level.WARNING, "Unable to encode " + spans.size() + " spans", e);
      return CompletableResultCode.ofFailure();
    }
    Request request = new Request.Builder()
        .url(config.endpoint())
        .headers(headers)
        .post(body)
        .build();
    int spanCount = spans.size();
    if (guard == null) return send(client, request, spanCount);
    return guard.run(c -> send(c, request, spanCount));
  }

  RequestBody encode(Collection<SpanData> spans) throws IOException {
    TraceRequestMarshaler marshaler = TraceRequestMarshaler.create(spans);
    Buffer buffer = new Buffer();
    if (config.compression() == Compression.GZIP) {
      try (BufferedSink sink = Okio.buffer(new GzipSink(buffer))) {
        marshaler.writeBinaryTo(sink.outputStream());
      }
    } else {
      marshaler.writeBinaryTo(buffer.outputStream());
    }
    return RequestBody.create(buffer.readByteString(), PROTOBUF);
  }

  CompletableResultCode send(OkHttpClient client, Request request, int spanCount) {
    CompletableResultCode result = new CompletableResultCode();
    inFlight.add(result);
    result.whenComplete(() -> inFlight.remove(result));
    client.newCall(request).enqueue(new Callback() {
      @Override public void onFailure(Call call, IOException e) {
        LOG.log(Level.WARNING,
            "Failed to export " + spanCount + " spans to " + config.endpoint(), e);
        result.fail();
      }

      @Override public void onResponse(Call call, Response response) {
        try (ResponseBody responseBody = response.body()) {
          if (response.isSuccessful()) {
            result.succeed();
            return;
          }
          String message = responseBody != null ? responseBody.string() : "";
          LOG.log(Level.WARNING, "Failed to export {0} spans. Server responded with HTTP status "
              + "code {1}. Error message: {2}", new Object[] {spanCount, response.code(), message});
          result.fail();
        } catch (IOException e) {
          LOG.log(Level.WARNING, "Unable to read the export response", e);
          result.fail();
        }
      }
    });
    return result;
  }

  /** Completes when every export in flight has completed. */
  @Override public CompletableResultCode flush() {
    return CompletableResultCode.ofAll(new ArrayList<>(inFlight));
  }

  /**
   * Fails later exports and waits for those in flight. The HTTP client is released only when
   * this exporter created it.
   */
  @Override public CompletableResultCode shutdown() {
    if (!shutdown.compareAndSet(false, true)) {
      LOG.log(Level.FINE, "Calling shutdown() multiple times");
      return CompletableResultCode.ofSuccess();
    }
    CompletableResultCode result = new CompletableResultCode();
    flush().whenComplete(() -> {
      if (ownsClient) {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
      }
      result.succeed();
    });
    return result;
  }

  @Override public String toString() {
    return "LangfuseSpanExporter{endpoint=" + config.endpoint()
        + ", compression=" + config.compression().value()
        + ", timeout=" + config.timeout()
        + "}";
  }
}
