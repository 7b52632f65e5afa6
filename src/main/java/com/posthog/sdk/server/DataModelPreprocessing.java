package com.posthog.sdk.server;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.posthog.sdk.server.DataModel.FeatureFlag;
import com.posthog.sdk.server.DataModel.FlagFilters;
import com.posthog.sdk.server.DataModel.MultivariateSpec;
import com.posthog.sdk.server.DataModel.Operator;
import com.posthog.sdk.server.DataModel.PropertyCondition;
import com.posthog.sdk.server.DataModel.RuleGroup;
import com.posthog.sdk.server.DataModel.Variant;

import java.util.Set;
import java.util.regex.Pattern;

import static com.posthog.sdk.server.ConditionValues.valueToRegex;

/**
 * Additional information that we attach to our data model to reduce the overhead of feature flag
 * evaluations. The methods that create these objects are called by FeatureFlag.afterDeserialized(),
 * after the flag has been deserialized from JSON but before it has been made available to any other
 * code (so these methods do not need to be thread-safe).
 * <p>
 * If for some reason these methods have not been called before an evaluation happens, the evaluation
 * logic must still be able to work without the precomputed data.
 */
abstract class DataModelPreprocessing {
  private DataModelPreprocessing() {}

  static final String FLAG_DEPENDENCY_PREFIX = "$feature/";

  static final class FlagPreprocessed {
    final ImmutableList<RuleGroup> orderedGroups;
    final ImmutableSet<String> variantKeys;

    FlagPreprocessed(ImmutableList<RuleGroup> orderedGroups, ImmutableSet<String> variantKeys) {
      this.orderedGroups = orderedGroups;
      this.variantKeys = variantKeys;
    }
  }

  static final class ConditionPreprocessed {
    // Only meaningful for regex operators; null there means the pattern is malformed.
    final Pattern parsedRegex;

    ConditionPreprocessed(Pattern parsedRegex) {
      this.parsedRegex = parsedRegex;
    }
  }

  static void preprocessFlag(FeatureFlag f) {
    FlagFilters filters = f.getFilters();
    ImmutableSet<String> variantKeys = variantKeys(filters.getMultivariate());
    f.preprocessed = new FlagPreprocessed(orderGroups(filters), variantKeys);

    for (RuleGroup g: f.preprocessed.orderedGroups) {
      for (PropertyCondition c: g.getProperties()) {
        if (c != null) {
          preprocessCondition(c);
        }
      }
    }
  }

  static void preprocessCondition(PropertyCondition c) {
    Operator op = c.getOperator();
    if (op == Operator.REGEX || op == Operator.NOT_REGEX) {
      c.preprocessed = new ConditionPreprocessed(valueToRegex(c.getValue()));
    }
  }

  static ImmutableSet<String> variantKeys(MultivariateSpec multivariate) {
    if (multivariate == null) {
      return ImmutableSet.of();
    }
    ImmutableSet.Builder<String> keys = ImmutableSet.builder();
    for (Variant v: multivariate.getVariants()) {
      if (v != null && v.getKey() != null) {
        keys.add(v.getKey());
      }
    }
    return keys.build();
  }

  // Groups carrying a variant override go first; relative order is otherwise kept.
  static ImmutableList<RuleGroup> orderGroups(FlagFilters filters) {
    ImmutableList.Builder<RuleGroup> overrides = ImmutableList.builder();
    ImmutableList.Builder<RuleGroup> others = ImmutableList.builder();
    for (RuleGroup g: filters.getGroups()) {
      if (g == null) {
        continue;
      }
      if (g.getVariant() != null) {
        overrides.add(g);
      } else {
        others.add(g);
      }
    }
    return ImmutableList.<RuleGroup>builder().addAll(overrides.build()).addAll(others.build()).build();
  }

  static boolean hasKnownOverride(RuleGroup g, Set<String> variantKeys) {
    return g.getVariant() != null && variantKeys.contains(g.getVariant());
  }

  static boolean isFlagDependency(PropertyCondition c) {
    return c.getKey() != null && c.getKey().startsWith(FLAG_DEPENDENCY_PREFIX);
  }

  static String dependencyFlagKey(PropertyCondition c) {
    return c.getKey().substring(FLAG_DEPENDENCY_PREFIX.length());
  }
}
