package com.posthog.sdk.internal.http;

import com.google.common.collect.ImmutableMap;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import okhttp3.Headers;
import okhttp3.OkHttpClient;

@SuppressWarnings("javadoc")
public class HttpPropertiesTest {
  @Test
  public void requestTimeoutAppliesToEveryPhase() {
    HttpProperties hp = new HttpProperties(2500, null);
    OkHttpClient httpClient = hp.toHttpClientBuilder().build();
    try {
      assertEquals(2500, httpClient.connectTimeoutMillis());
      assertEquals(2500, httpClient.readTimeoutMillis());
      assertEquals(2500, httpClient.writeTimeoutMillis());
      assertEquals(2500, httpClient.callTimeoutMillis());
      assertFalse(httpClient.retryOnConnectionFailure());
    } finally {
      HttpProperties.shutdownHttpClient(httpClient);
    }
  }

  @Test
  public void nonPositiveTimeoutMeansDefault() {
    assertEquals(10000, new HttpProperties(0, null).getRequestTimeoutMillis());
    assertEquals(10000, new HttpProperties(-1, null).getRequestTimeoutMillis());
    assertEquals(10000, HttpProperties.defaults().getRequestTimeoutMillis());
  }

  @Test
  public void defaultHeaders() {
    HttpProperties hp = new HttpProperties(0, ImmutableMap.of("Authorization", "Bearer x", "User-Agent", "test/1"));
    Headers headers = hp.toHeadersBuilder().build();
    assertEquals("Bearer x", headers.get("Authorization"));
    assertEquals("test/1", headers.get("User-Agent"));
  }
}
