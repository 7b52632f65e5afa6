package com.posthog.sdk.server;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;
import com.launchdarkly.logging.LDLogger;
import com.posthog.sdk.internal.http.HttpProperties;
import com.posthog.sdk.server.subsystems.FlagDefinitionsRequestor;

import java.io.Closeable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A client that keeps flag definitions in memory and evaluates flags locally.
 * <p>
 * Creating the client performs one synchronous fetch of the definitions and then refreshes them in
 * the background at the configured poll interval. Applications should create a single instance and
 * {@link #close()} it on shutdown.
 * <p>
 * The convenience methods here report "could not be evaluated locally" as a null result and log the
 * reason; use {@link #getLocalEvaluator()} to receive {@link InconclusiveMatchException} instead.
 */
public final class LocalEvaluationClient implements Closeable {
  private final FlagCache flagCache;
  private final FlagPoller poller;
  private final LocalEvaluator evaluator;
  private final LDLogger baseLogger;
  private final LDLogger evaluationLogger;

  /**
   * Creates a client and starts polling the local evaluation endpoint.
   *
   * @param config the configuration
   */
  public LocalEvaluationClient(LocalEvaluationConfig config) {
    this(config, null);
  }

  /**
   * Creates a client that fetches definitions through the given requestor instead of over HTTP.
   *
   * @param config the configuration; the host and API keys are not used if a requestor is given
   * @param requestor the requestor, or null to use the local evaluation endpoint
   */
  public LocalEvaluationClient(LocalEvaluationConfig config, FlagDefinitionsRequestor requestor) {
    this.baseLogger = LDLogger.withAdapter(config.logAdapter, config.baseLoggerName);
    this.evaluationLogger = baseLogger.subLogger(Loggers.EVALUATION_LOGGER_NAME);
    this.flagCache = new FlagCache(baseLogger.subLogger(Loggers.CACHE_LOGGER_NAME));
    this.evaluator = new LocalEvaluator(flagCache, evaluationLogger);

    FlagDefinitionsRequestor requestorToUse = requestor != null ? requestor : createRequestor(config);
    this.poller = new FlagPoller(requestorToUse, flagCache, config.pollInterval,
        baseLogger.subLogger(Loggers.POLLER_LOGGER_NAME));
    poller.start();
    if (!flagCache.isInitialized()) {
      baseLogger.warn("Flag definitions were not loaded at startup; flags will be unknown until a poll succeeds");
    }
  }

  private FlagDefinitionsRequestor createRequestor(LocalEvaluationConfig config) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Authorization", "Bearer " + config.personalApiKey);
    headers.put("User-Agent", "posthog-java-server/" + Version.SDK_VERSION);
    HttpProperties httpProperties = new HttpProperties(config.requestTimeout.toMillis(), headers);
    return new DefaultFlagDefinitionsRequestor(httpProperties, config.host, config.projectApiKey,
        baseLogger.subLogger(Loggers.POLLER_LOGGER_NAME));
  }

  /**
   * Evaluates a flag.
   *
   * @param key the flag key
   * @param distinctId the subject's distinct ID
   * @param attributes the subject's attributes; may be null
   * @return the value, or null if the flag is unknown or cannot be evaluated locally
   */
  public FlagValue getFeatureFlag(String key, String distinctId, Map<String, JsonElement> attributes) {
    try {
      return evaluator.evaluateFlag(key, distinctId, attributes);
    } catch (InconclusiveMatchException e) {
      evaluationLogger.debug("Flag \"{}\" could not be evaluated locally: {}", key, e.getMessage());
      return null;
    }
  }

  /**
   * Tests whether a flag is enabled. Any variant counts as enabled.
   *
   * @param key the flag key
   * @param distinctId the subject's distinct ID
   * @param attributes the subject's attributes; may be null
   * @return true if enabled; false if disabled, unknown, or not locally decidable
   */
  public boolean isFeatureEnabled(String key, String distinctId, Map<String, JsonElement> attributes) {
    FlagValue value = getFeatureFlag(key, distinctId, attributes);
    return value != null && value.isEnabled();
  }

  /**
   * Evaluates every cached flag, leaving out the ones that cannot be evaluated locally.
   *
   * @param distinctId the subject's distinct ID
   * @param attributes the subject's attributes; may be null
   * @return an immutable map from flag key to value
   */
  public Map<String, FlagValue> getAllFlags(String distinctId, Map<String, JsonElement> attributes) {
    ImmutableMap.Builder<String, FlagValue> values = ImmutableMap.builder();
    for (Map.Entry<String, FlagEvaluation> e: evaluator.evaluateAllFlags(distinctId, attributes).entrySet()) {
      if (!e.getValue().isInconclusive()) {
        values.put(e.getKey(), e.getValue().getValue());
      }
    }
    return values.build();
  }

  /**
   * Returns the payload for the value a flag evaluates to.
   *
   * @param key the flag key
   * @param distinctId the subject's distinct ID
   * @param attributes the subject's attributes; may be null
   * @return the payload, or null if there is none or the flag cannot be evaluated locally
   */
  public JsonElement getFeatureFlagPayload(String key, String distinctId, Map<String, JsonElement> attributes) {
    try {
      return evaluator.getFlagPayload(key, distinctId, attributes);
    } catch (InconclusiveMatchException e) {
      evaluationLogger.debug("Payload of flag \"{}\" could not be evaluated locally: {}", key, e.getMessage());
      return null;
    }
  }

  public LocalEvaluator getLocalEvaluator() {
    return evaluator;
  }

  public FlagCache getFlagCache() {
    return flagCache;
  }

  /**
   * Stops background polling and releases network resources. Flags can still be evaluated against
   * the last definitions received.
   */
  @Override
  public void close() {
    baseLogger.info("Closing local evaluation client");
    poller.stop();
  }
}
