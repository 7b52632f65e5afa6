package com.posthog.sdk.server;

import com.google.common.annotations.VisibleForTesting;
import com.google.gson.stream.JsonReader;
import com.launchdarkly.logging.LDLogger;
import com.posthog.sdk.internal.http.HttpErrors.HttpErrorException;
import com.posthog.sdk.internal.http.HttpProperties;
import com.posthog.sdk.server.DataModel.DefinitionsSnapshot;
import com.posthog.sdk.server.subsystems.FlagDefinitionsRequestor;
import com.posthog.sdk.server.subsystems.SerializationException;

import java.io.IOException;
import java.net.URI;

import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Implementation of getting flag definitions from the local evaluation endpoint.
 */
final class DefaultFlagDefinitionsRequestor implements FlagDefinitionsRequestor {
  static final String LOCAL_EVALUATION_PATH = "api/feature_flag/local_evaluation/";

  private final OkHttpClient httpClient;
  @VisibleForTesting
  final HttpUrl requestUrl;
  private final Headers headers;
  private final LDLogger logger;

  /**
   * Creates a {@link DefaultFlagDefinitionsRequestor}.
   *
   * @param httpProperties timeout and default headers; the headers must include authorization
   * @param baseUri the service's base URI
   * @param projectApiKey identifies the project whose flags are fetched
   * @param logger to log with
   */
  DefaultFlagDefinitionsRequestor(HttpProperties httpProperties, URI baseUri, String projectApiKey, LDLogger logger) {
    this.logger = logger;
    HttpUrl base = HttpUrl.get(baseUri.toString());
    this.requestUrl = base.newBuilder()
        .addPathSegments(LOCAL_EVALUATION_PATH)
        .addQueryParameter("token", projectApiKey)
        .addQueryParameter("send_cohorts", null)
        .build();
    this.headers = httpProperties.toHeadersBuilder().build();
    this.httpClient = httpProperties.toHttpClientBuilder().build();
  }

  @Override
  public void close() {
    HttpProperties.shutdownHttpClient(httpClient);
  }

  @Override
  public DefinitionsSnapshot getDefinitions() throws IOException, HttpErrorException, SerializationException {
    Request request = new Request.Builder()
        .url(requestUrl)
        .headers(headers)
        .get()
        .build();

    logger.debug("Making request: {}", requestUrl.redact());

    try (Response response = httpClient.newCall(request).execute()) {
      logger.debug("Flag definitions response: {}", response.code());
      if (!response.isSuccessful()) {
        throw new HttpErrorException(response.code());
      }
      ResponseBody body = response.body();
      if (body == null) {
        throw new IOException("flag definitions response had no body");
      }
      DefinitionsSnapshot snapshot = JsonHelpers.deserialize(new JsonReader(body.charStream()),
          DefinitionsSnapshot.class);
      if (snapshot == null) {
        throw new SerializationException(new IOException("flag definitions response was empty"));
      }
      return snapshot;
    }
  }
}
