package com.posthog.sdk.internal.http;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import okhttp3.ConnectionPool;
import okhttp3.Headers;
import okhttp3.OkHttpClient;

/**
 * Internal container for HTTP parameters used by SDK components. Includes logic for creating an
 * OkHttp client.
 * <p>
 * The public configuration API does not reference any OkHttp classes; {@code LocalEvaluationConfig}
 * is transformed into this when the SDK is constructing components.
 */
public final class HttpProperties {
  private static final long DEFAULT_TIMEOUT_MILLIS = 10000;

  private final long requestTimeoutMillis;
  private final Map<String, String> defaultHeaders;

  /**
   * Constructs an instance.
   *
   * @param requestTimeoutMillis upper bound for a whole call, from connecting to reading the body;
   *   zero or negative means the default
   * @param defaultHeaders headers to add to all requests
   */
  public HttpProperties(long requestTimeoutMillis, Map<String, String> defaultHeaders) {
    this.requestTimeoutMillis = requestTimeoutMillis <= 0 ? DEFAULT_TIMEOUT_MILLIS : requestTimeoutMillis;
    this.defaultHeaders = defaultHeaders == null ? Collections.emptyMap() : new HashMap<>(defaultHeaders);
  }

  /**
   * Returns a minimal set of properties.
   *
   * @return a default instance
   */
  public static HttpProperties defaults() {
    return new HttpProperties(0, null);
  }

  /**
   * Returns the timeout applied to each call.
   *
   * @return the timeout in milliseconds
   */
  public long getRequestTimeoutMillis() {
    return requestTimeoutMillis;
  }

  /**
   * Returns an immutable view of the default headers.
   *
   * @return the default headers
   */
  public Iterable<Map.Entry<String, String>> getDefaultHeaders() {
    return Collections.unmodifiableMap(defaultHeaders).entrySet();
  }

  /**
   * Applies the configured properties to an OkHttp client builder.
   *
   * @param builder the client builder
   */
  public void applyToHttpClientBuilder(OkHttpClient.Builder builder) {
    builder.connectionPool(new ConnectionPool(5, 5, TimeUnit.SECONDS));
    builder.connectTimeout(requestTimeoutMillis, TimeUnit.MILLISECONDS)
      .readTimeout(requestTimeoutMillis, TimeUnit.MILLISECONDS)
      .writeTimeout(requestTimeoutMillis, TimeUnit.MILLISECONDS)
      .callTimeout(requestTimeoutMillis, TimeUnit.MILLISECONDS);
    builder.retryOnConnectionFailure(false); // the poller's next tick is the retry
  }

  /**
   * Returns an OkHttp client builder initialized with the configured properties.
   *
   * @return a client builder
   */
  public OkHttpClient.Builder toHttpClientBuilder() {
    OkHttpClient.Builder builder = new OkHttpClient.Builder();
    applyToHttpClientBuilder(builder);
    return builder;
  }

  /**
   * Returns an OkHttp Headers builder initialized with the default headers.
   *
   * @return a Headers builder
   */
  public Headers.Builder toHeadersBuilder() {
    Headers.Builder builder = new Headers.Builder();
    for (Map.Entry<String, String> kv: getDefaultHeaders()) {
      builder.add(kv.getKey(), kv.getValue());
    }
    return builder;
  }

  /**
   * Attempts to completely shut down an OkHttp client.
   *
   * @param client the client to stop
   */
  public static void shutdownHttpClient(OkHttpClient client) {
    client.dispatcher().cancelAll();
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
  }
}
