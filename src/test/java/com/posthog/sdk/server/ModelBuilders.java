package com.posthog.sdk.server;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;
import com.posthog.sdk.server.DataModel.FeatureFlag;
import com.posthog.sdk.server.DataModel.FlagFilters;
import com.posthog.sdk.server.DataModel.MultivariateSpec;
import com.posthog.sdk.server.DataModel.Operator;
import com.posthog.sdk.server.DataModel.PropertyCondition;
import com.posthog.sdk.server.DataModel.RuleGroup;
import com.posthog.sdk.server.DataModel.Variant;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Arrays.asList;

@SuppressWarnings("javadoc")
public abstract class ModelBuilders {
  public static FlagBuilder flagBuilder(String key) {
    return new FlagBuilder(key);
  }

  public static GroupBuilder groupBuilder() {
    return new GroupBuilder();
  }

  public static PropertyCondition condition(String key, Operator op, Object value) {
    return new PropertyCondition(key, json(value), op, "person");
  }

  public static PropertyCondition cohortCondition(String cohortId) {
    return new PropertyCondition("id", json(cohortId), Operator.forName("in"), "cohort");
  }

  public static PropertyCondition flagDependency(String flagKey, Operator op, Object expected) {
    return new PropertyCondition("$feature/" + flagKey, json(expected), op, "flag");
  }

  public static Variant variant(String key, double rolloutPercentage) {
    return new Variant(key, rolloutPercentage);
  }

  /**
   * Builds an attribute map from alternating keys and values. Values go through {@link #json(Object)}.
   */
  public static Map<String, JsonElement> attributes(Object... keysAndValues) {
    Map<String, JsonElement> ret = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
      ret.put((String)keysAndValues[i], json(keysAndValues[i + 1]));
    }
    return ret;
  }

  public static JsonElement json(Object value) {
    if (value == null) {
      return JsonNull.INSTANCE;
    }
    if (value instanceof JsonElement) {
      return (JsonElement)value;
    }
    if (value instanceof String) {
      return new JsonPrimitive((String)value);
    }
    if (value instanceof Number) {
      return new JsonPrimitive((Number)value);
    }
    if (value instanceof Boolean) {
      return new JsonPrimitive((Boolean)value);
    }
    if (value instanceof List) {
      JsonArray a = new JsonArray();
      for (Object o: (List<?>)value) {
        a.add(json(o));
      }
      return a;
    }
    throw new IllegalArgumentException("can't convert " + value.getClass() + " to JSON");
  }

  public static class FlagBuilder {
    private final String key;
    private boolean active = true;
    private List<RuleGroup> groups = new ArrayList<>();
    private List<Variant> variants;
    private Map<String, JsonElement> payloads = new LinkedHashMap<>();
    private boolean disablePreprocessing = false;

    private FlagBuilder(String key) {
      this.key = key;
    }

    public FlagBuilder active(boolean active) {
      this.active = active;
      return this;
    }

    public FlagBuilder groups(RuleGroup... groups) {
      this.groups = new ArrayList<>(asList(groups));
      return this;
    }

    public FlagBuilder variants(Variant... variants) {
      this.variants = new ArrayList<>(asList(variants));
      return this;
    }

    public FlagBuilder payload(String valueKey, Object payload) {
      this.payloads.put(valueKey, json(payload));
      return this;
    }

    public FlagBuilder disablePreprocessing(boolean disable) {
      this.disablePreprocessing = disable;
      return this;
    }

    public FeatureFlag build() {
      FeatureFlag flag = new FeatureFlag(key, active, new FlagFilters(groups,
          variants == null ? null : new MultivariateSpec(variants), payloads));
      if (disablePreprocessing) {
        flag.preprocessed = null;
        for (RuleGroup g: groups) {
          for (PropertyCondition c: g.getProperties()) {
            c.preprocessed = null;
          }
        }
      }
      return flag;
    }
  }

  public static class GroupBuilder {
    private List<PropertyCondition> properties = new ArrayList<>();
    private Double rolloutPercentage;
    private String variant;

    public GroupBuilder properties(PropertyCondition... properties) {
      this.properties = ImmutableList.copyOf(properties);
      return this;
    }

    public GroupBuilder rollout(double rolloutPercentage) {
      this.rolloutPercentage = rolloutPercentage;
      return this;
    }

    public GroupBuilder variant(String variant) {
      this.variant = variant;
      return this;
    }

    public RuleGroup build() {
      return new RuleGroup(properties, rolloutPercentage, variant);
    }
  }
}
