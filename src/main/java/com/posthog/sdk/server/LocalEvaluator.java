package com.posthog.sdk.server;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;
import com.launchdarkly.logging.LDLogger;
import com.posthog.sdk.server.DataModel.FeatureFlag;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evaluates flags against the definitions currently held in a {@link FlagCache}, without any
 * network I/O.
 * <p>
 * Each call reads one consistent cache state, so a call is never affected by a concurrent refresh
 * part-way through. Evaluation is synchronous and never blocks on a lock.
 */
public final class LocalEvaluator {
  private final FlagCache cache;
  private final ConditionEvaluator conditionEvaluator;
  private final LDLogger logger;

  /**
   * Creates an evaluator.
   *
   * @param cache the cache to read definitions from
   * @param logger the logger to use
   */
  public LocalEvaluator(FlagCache cache, LDLogger logger) {
    this(cache, Clock.systemUTC(), logger);
  }

  LocalEvaluator(FlagCache cache, Clock clock, LDLogger logger) {
    this.cache = cache;
    this.conditionEvaluator = new ConditionEvaluator(clock);
    this.logger = logger;
  }

  /**
   * Evaluates one flag.
   *
   * @param key the flag key
   * @param distinctId the subject's distinct ID
   * @param attributes the subject's attributes; null is treated as empty
   * @return the flag value, or null if the flag is not in the cache
   * @throws InconclusiveMatchException if the flag cannot be evaluated from the local data
   */
  public FlagValue evaluateFlag(String key, String distinctId, Map<String, JsonElement> attributes)
      throws InconclusiveMatchException {
    FlagCache.State state = cache.getState();
    FeatureFlag flag = key == null ? null : state.flags.get(key);
    if (flag == null) {
      logger.debug("Unknown feature flag \"{}\"", key);
      return null;
    }
    return matcherFor(state).evaluate(flag, distinctId, normalize(attributes));
  }

  /**
   * Evaluates every cached flag. A flag that cannot be evaluated locally does not affect the others.
   *
   * @param distinctId the subject's distinct ID
   * @param attributes the subject's attributes; null is treated as empty
   * @return a map from flag key to result, in cache order
   */
  public Map<String, FlagEvaluation> evaluateAllFlags(String distinctId, Map<String, JsonElement> attributes) {
    FlagCache.State state = cache.getState();
    FlagMatcher matcher = matcherFor(state);
    Map<String, JsonElement> attrs = normalize(attributes);
    Map<String, FlagEvaluation> results = new LinkedHashMap<>();
    for (FeatureFlag flag: state.flags.values()) {
      try {
        results.put(flag.getKey(), FlagEvaluation.of(matcher.evaluate(flag, distinctId, attrs)));
      } catch (InconclusiveMatchException e) {
        logger.debug("Flag \"{}\" is inconclusive locally: {}", flag.getKey(), e.getMessage());
        results.put(flag.getKey(), FlagEvaluation.inconclusive(e.getMessage()));
      } catch (Exception e) {
        logger.error("Unexpected error evaluating flag \"{}\": {}", flag.getKey(), e.toString());
        logger.debug(e.toString(), e);
        results.put(flag.getKey(), FlagEvaluation.inconclusive(e.toString()));
      }
    }
    return results;
  }

  /**
   * Returns the JSON payload attached to whatever value the flag evaluates to: the payload for the
   * variant, or the {@code "true"} payload for a plain enabled flag.
   *
   * @param key the flag key
   * @param distinctId the subject's distinct ID
   * @param attributes the subject's attributes; null is treated as empty
   * @return a copy of the payload that the caller may modify, or null if the flag is missing, false,
   *   or has no payload for its value
   * @throws InconclusiveMatchException if the flag cannot be evaluated from the local data
   */
  public JsonElement getFlagPayload(String key, String distinctId, Map<String, JsonElement> attributes)
      throws InconclusiveMatchException {
    FlagCache.State state = cache.getState();
    FeatureFlag flag = key == null ? null : state.flags.get(key);
    if (flag == null) {
      return null;
    }
    FlagValue value = matcherFor(state).evaluate(flag, distinctId, normalize(attributes));
    Map<String, JsonElement> payloads = flag.getFilters().getPayloads();
    JsonElement payload;
    if (value.getType() == FlagValue.Type.VARIANT) {
      payload = payloads.get(value.getVariant());
    } else {
      payload = value.booleanValue() ? payloads.get("true") : null;
    }
    return payload == null ? null : payload.deepCopy();
  }

  private FlagMatcher matcherFor(FlagCache.State state) {
    return new FlagMatcher(state.flags::get, conditionEvaluator, logger);
  }

  private static Map<String, JsonElement> normalize(Map<String, JsonElement> attributes) {
    return attributes == null ? ImmutableMap.of() : attributes;
  }
}
