package com.posthog.sdk.server;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;
import com.launchdarkly.logging.LDLogger;
import com.posthog.sdk.server.DataModel.FeatureFlag;
import com.posthog.sdk.server.DataModel.MultivariateSpec;
import com.posthog.sdk.server.DataModel.Operator;
import com.posthog.sdk.server.DataModel.PropertyCondition;
import com.posthog.sdk.server.DataModel.RuleGroup;
import com.posthog.sdk.server.DataModel.Variant;
import com.posthog.sdk.server.DataModelPreprocessing.FlagPreprocessed;

import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import static com.posthog.sdk.server.DataModelPreprocessing.dependencyFlagKey;
import static com.posthog.sdk.server.DataModelPreprocessing.hasKnownOverride;
import static com.posthog.sdk.server.DataModelPreprocessing.isFlagDependency;
import static com.posthog.sdk.server.DataModelPreprocessing.orderGroups;
import static com.posthog.sdk.server.DataModelPreprocessing.variantKeys;
import static com.posthog.sdk.server.FlagBucketing.ROLLOUT_SALT;
import static com.posthog.sdk.server.FlagBucketing.VARIANT_SALT;
import static com.posthog.sdk.server.FlagBucketing.bucket;

/**
 * Encapsulates the feature flag matching logic. The matcher has no knowledge of the rest of the SDK
 * environment; if a condition refers to another flag, it looks that flag up through the read-only
 * {@link Getters} interface provided in the constructor.
 */
final class FlagMatcher {
  private static final Map<String, JsonElement> NO_ATTRIBUTES = ImmutableMap.of();

  private final Getters getters;
  private final ConditionEvaluator conditionEvaluator;
  private final LDLogger logger;

  /**
   * An abstraction of getting flags by key. This ensures that FlagMatcher cannot modify the cache,
   * and simplifies testing.
   */
  static interface Getters {
    /**
     * @param key of the flag to get
     * @return the flag, or null if a flag with the given key doesn't exist
     */
    @Nullable
    FeatureFlag getFlag(String key);
  }

  FlagMatcher(Getters getters, ConditionEvaluator conditionEvaluator, LDLogger logger) {
    this.getters = getters;
    this.conditionEvaluator = conditionEvaluator;
    this.logger = logger;
  }

  /**
   * Evaluates a flag for a subject.
   *
   * @param flag the flag definition
   * @param distinctId the subject's distinct ID
   * @param attributes the subject's attributes
   * @return the flag value; never null
   * @throws InconclusiveMatchException if no rule group matched and at least one could not be decided
   */
  FlagValue evaluate(FeatureFlag flag, String distinctId, Map<String, JsonElement> attributes)
      throws InconclusiveMatchException {
    return evaluate(flag, distinctId, attributes, true);
  }

  private FlagValue evaluate(FeatureFlag flag, String distinctId, Map<String, JsonElement> attributes,
      boolean resolveDependencies) throws InconclusiveMatchException {
    if (!flag.isActive()) {
      return FlagValue.ofBoolean(false);
    }

    FlagPreprocessed preprocessed = flag.preprocessed;
    List<RuleGroup> groups = preprocessed == null ? orderGroups(flag.getFilters()) : preprocessed.orderedGroups;
    Set<String> knownVariants = preprocessed == null ? variantKeys(flag.getFilters().getMultivariate()) :
      preprocessed.variantKeys;

    String inconclusiveReason = null;
    for (RuleGroup group: groups) {
      boolean groupMatched;
      try {
        groupMatched = groupMatches(flag, group, distinctId, attributes, resolveDependencies);
      } catch (InconclusiveMatchException e) {
        logger.debug("Rule group of flag \"{}\" is inconclusive: {}", flag.getKey(), e.getMessage());
        inconclusiveReason = e.getMessage();
        continue;
      }
      if (groupMatched) {
        if (hasKnownOverride(group, knownVariants)) {
          return FlagValue.ofVariant(group.getVariant());
        }
        String variant = matchingVariant(flag, distinctId);
        return variant == null ? FlagValue.ofBoolean(true) : FlagValue.ofVariant(variant);
      }
    }

    if (inconclusiveReason != null) {
      throw new InconclusiveMatchException(
          "Can't determine if feature flag \"" + flag.getKey() + "\" is enabled with the given properties: "
          + inconclusiveReason);
    }
    return FlagValue.ofBoolean(false);
  }

  // Conditions are checked in order; the first one that is false or inconclusive decides.
  private boolean groupMatches(FeatureFlag flag, RuleGroup group, String distinctId,
      Map<String, JsonElement> attributes, boolean resolveDependencies) throws InconclusiveMatchException {
    for (PropertyCondition condition: group.getProperties()) {
      if (condition != null && !conditionMatches(condition, distinctId, attributes, resolveDependencies)) {
        return false;
      }
    }
    Double rollout = group.getRolloutPercentage();
    if (rollout != null && bucket(flag.getKey(), distinctId, ROLLOUT_SALT) > rollout / 100.0) {
      return false;
    }
    return true;
  }

  private boolean conditionMatches(PropertyCondition condition, String distinctId,
      Map<String, JsonElement> attributes, boolean resolveDependencies) throws InconclusiveMatchException {
    if (condition.isCohortCondition()) {
      throw new InconclusiveMatchException("Cohort condition on '" + condition.getKey()
          + "' can't be evaluated locally");
    }
    if (resolveDependencies && isFlagDependency(condition)) {
      return flagDependencyMatches(condition, distinctId);
    }
    return conditionEvaluator.matches(condition, attributes);
  }

  // The dependency is evaluated without attributes and without resolving its own dependencies, so
  // chains of flags cannot recurse.
  private boolean flagDependencyMatches(PropertyCondition condition, String distinctId)
      throws InconclusiveMatchException {
    String key = dependencyFlagKey(condition);
    FeatureFlag dependency = getters.getFlag(key);
    if (dependency == null) {
      throw new InconclusiveMatchException("Flag '" + key + "' not found in local cache");
    }
    FlagValue actual = evaluate(dependency, distinctId, NO_ATTRIBUTES, false);
    boolean matched = flagValueMatches(actual, condition.getValue());

    Operator op = condition.getOperator();
    if (op == Operator.EXACT) {
      return matched;
    }
    if (op == Operator.IS_NOT) {
      return !matched;
    }
    throw new InconclusiveMatchException("Unknown flag dependency operator: " + op);
  }

  static boolean flagValueMatches(FlagValue actual, JsonElement expected) {
    if (!expected.isJsonPrimitive()) {
      return false;
    }
    if (expected.getAsJsonPrimitive().isBoolean()) {
      boolean expectedBool = expected.getAsBoolean();
      if (actual.getType() == FlagValue.Type.BOOLEAN) {
        return actual.booleanValue() == expectedBool;
      }
      // any variant counts as enabled
      return expectedBool && !actual.getVariant().isEmpty();
    }
    if (expected.getAsJsonPrimitive().isString()) {
      String expectedString = expected.getAsString();
      if (actual.getType() == FlagValue.Type.VARIANT) {
        return actual.getVariant().equalsIgnoreCase(expectedString);
      }
      return expectedString.isEmpty() || expectedString.equals(String.valueOf(actual.booleanValue()));
    }
    return false;
  }

  // Walks the cumulative half-open ranges [low, high) in declared order.
  static String matchingVariant(FeatureFlag flag, String distinctId) {
    MultivariateSpec multivariate = flag.getFilters().getMultivariate();
    if (multivariate == null) {
      return null;
    }
    double hash = bucket(flag.getKey(), distinctId, VARIANT_SALT);
    double low = 0;
    for (Variant v: multivariate.getVariants()) {
      if (v == null) {
        continue;
      }
      double high = low + v.getRolloutPercentage() / 100.0;
      if (hash >= low && hash < high && v.getKey() != null) {
        return v.getKey();
      }
      low = high;
    }
    return null;
  }
}
