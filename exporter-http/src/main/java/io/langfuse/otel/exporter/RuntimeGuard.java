/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.langfuse.otel.exporter;

import io.opentelemetry.sdk.common.CompletableResultCode;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;

/**
 * Ensures an export is only dispatched while the HTTP client can run asynchronous calls.
 *
 * <p>OkHttp runs {@code enqueue}d calls on its dispatcher's executor. Once that executor is shut
 * down, for example by {@code client.dispatcher().executorService().shutdown()} elsewhere in the
 * application, every call is rejected at dispatch time. When that happens this guard creates a
 * private single thread dispatcher for the one operation, waits for the operation to complete and
 * then shuts the private dispatcher down. It keeps no state between calls, so concurrent
 * operations never interfere.
 */
public final class RuntimeGuard {
  private static final Logger LOG = Logger.getLogger(RuntimeGuard.class.getName());

  static final ThreadFactory THREAD_FACTORY = runnable -> {
    Thread thread = new Thread(runnable, "langfuse-exporter-guard");
    thread.setDaemon(true);
    return thread;
  };

  final OkHttpClient client;
  final Duration timeout;

  /**
   * @param timeout the longest a private dispatcher is kept alive for one operation
   */
  public RuntimeGuard(OkHttpClient client, Duration timeout) {
    if (client == null) throw new NullPointerException("client == null");
    if (timeout == null) throw new NullPointerException("timeout == null");
    this.client = client;
    this.timeout = timeout;
  }

  /** Returns true if the client's dispatcher can accept calls. */
  public static boolean hasActiveContext(OkHttpClient client) {
    if (client == null) throw new NullPointerException("client == null");
    return !client.dispatcher().executorService().isShutdown();
  }

  /**
   * Runs the operation against the client, or against a copy backed by a private dispatcher when
   * the client's own dispatcher has been shut down. In the latter case this blocks until the
   * operation completes or the timeout elapses.
   */
  public CompletableResultCode run(Function<OkHttpClient, CompletableResultCode> operation) {
    if (operation == null) throw new NullPointerException("operation == null");
    if (hasActiveContext(client)) return operation.apply(client);

    LOG.log(Level.FINE, "Dispatcher of {0} is shut down; using a private dispatcher", client);
    ExecutorService executor = Executors.newSingleThreadExecutor(THREAD_FACTORY);
    Dispatcher dispatcher = new Dispatcher(executor);
    try {
      OkHttpClient scoped = client.newBuilder().dispatcher(dispatcher).build();
      CompletableResultCode result = operation.apply(scoped);
      result.join(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!result.isDone()) {
        LOG.log(Level.WARNING, "Export did not complete within {0}; cancelling", timeout);
        dispatcher.cancelAll();
      }
      return result;
    } finally {
      executor.shutdown();
    }
  }

  @Override public String toString() {
    return "RuntimeGuard{timeout=" + timeout + "}";
  }
}
