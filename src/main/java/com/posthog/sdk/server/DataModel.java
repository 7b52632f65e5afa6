package com.posthog.sdk.server;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.TypeAdapter;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.annotations.SerializedName;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import com.posthog.sdk.server.DataModelPreprocessing.ConditionPreprocessed;
import com.posthog.sdk.server.DataModelPreprocessing.FlagPreprocessed;

import java.io.IOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.emptyList;
import static java.util.Collections.emptyMap;

// IMPLEMENTATION NOTES:
//
// - Classes that are deserialized reflectively by Gson need an empty constructor and non-final fields.
// There is also a constructor that takes all the fields; use that whenever these objects are created
// programmatically.
//
// - Collection getters never return null. The service may omit a collection or send an explicit null,
// and there is no semantic difference between that and an empty collection.
//
// - Collections are copied into immutable collections, with null elements and entries dropped, both by
// the all-fields constructors and after deserialization (freeze()). Nothing outside the object can
// change a flag once its precomputed data exists.
//
// - FeatureFlag carries a transient "preprocessed" field (see DataModelPreprocessing). It is populated
// by afterDeserialized() or by the all-fields constructor, and is never serialized.

/**
 * Contains the data model for feature flag definitions as delivered by the local evaluation endpoint.
 * <p>
 * Application code normally does not need these types; they are public so that a custom
 * {@link com.posthog.sdk.server.subsystems.FlagDefinitionsRequestor} or test code can build a
 * {@link DefinitionsSnapshot} and inject it into a {@link FlagCache}.
 */
public abstract class DataModel {
  private DataModel() {}

  static <T> ImmutableList<T> immutableCopy(List<T> list) {
    if (list == null) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<T> builder = ImmutableList.builder();
    for (T item: list) {
      if (item != null) {
        builder.add(item);
      }
    }
    return builder.build();
  }

  static <K, V> ImmutableMap<K, V> immutableCopy(Map<K, V> map) {
    if (map == null) {
      return ImmutableMap.of();
    }
    ImmutableMap.Builder<K, V> builder = ImmutableMap.builder();
    for (Map.Entry<K, V> e: map.entrySet()) {
      if (e.getKey() != null && e.getValue() != null) {
        builder.put(e.getKey(), e.getValue());
      }
    }
    return builder.build();
  }

  /**
   * A single feature flag definition.
   */
  @JsonAdapter(JsonHelpers.PostProcessingDeserializableTypeAdapterFactory.class)
  public static final class FeatureFlag implements JsonHelpers.PostProcessingDeserializable {
    private String key;
    private boolean active;
    private FlagFilters filters;

    transient FlagPreprocessed preprocessed;

    // We need this so Gson doesn't complain in certain java environments that restrict unsafe allocation
    FeatureFlag() {}

    /**
     * Creates a flag definition.
     *
     * @param key the flag key
     * @param active false if the flag is switched off
     * @param filters the targeting rules; null means no rule groups
     */
    public FeatureFlag(String key, boolean active, FlagFilters filters) {
      this.key = key;
      this.active = active;
      this.filters = filters;
      afterDeserialized();
    }

    public String getKey() {
      return key;
    }

    public boolean isActive() {
      return active;
    }

    // Guaranteed non-null
    public FlagFilters getFilters() {
      return filters == null ? FlagFilters.EMPTY : filters;
    }

    @Override
    public void afterDeserialized() {
      if (filters != null) {
        filters.freeze();
      }
      DataModelPreprocessing.preprocessFlag(this);
    }
  }

  /**
   * The targeting configuration of a flag: rule groups (OR-ed together), an optional multivariate
   * split, and the JSON payloads attached to its values.
   */
  public static final class FlagFilters {
    static final FlagFilters EMPTY = new FlagFilters(null, null, null);

    private List<RuleGroup> groups;
    private MultivariateSpec multivariate;
    private Map<String, JsonElement> payloads;

    FlagFilters() {}

    public FlagFilters(List<RuleGroup> groups, MultivariateSpec multivariate, Map<String, JsonElement> payloads) {
      this.groups = immutableCopy(groups);
      this.multivariate = multivariate;
      ImmutableMap.Builder<String, JsonElement> payloadsCopy = ImmutableMap.builder();
      for (Map.Entry<String, JsonElement> e: immutableCopy(payloads).entrySet()) {
        payloadsCopy.put(e.getKey(), e.getValue().deepCopy());
      }
      this.payloads = payloadsCopy.build();
    }

    void freeze() {
      groups = immutableCopy(groups);
      payloads = immutableCopy(payloads);
      for (RuleGroup g: groups) {
        g.freeze();
      }
      if (multivariate != null) {
        multivariate.freeze();
      }
    }

    // Guaranteed non-null
    public List<RuleGroup> getGroups() {
      return groups == null ? emptyList() : groups;
    }

    public MultivariateSpec getMultivariate() {
      return multivariate;
    }

    // Guaranteed non-null; the payload elements are shared and must not be modified
    public Map<String, JsonElement> getPayloads() {
      return payloads == null ? emptyMap() : payloads;
    }
  }

  /**
   * A rule group: every property condition must match (AND), then the subject must fall inside the
   * rollout percentage if one is set. An empty condition list always matches.
   */
  public static final class RuleGroup {
    private List<PropertyCondition> properties;
    @SerializedName("rollout_percentage")
    private Double rolloutPercentage;
    private String variant;

    RuleGroup() {}

    /**
     * Creates a rule group.
     *
     * @param properties the conditions; null means none
     * @param rolloutPercentage 0 to 100, or null for no rollout gate
     * @param variant a variant override, or null
     */
    public RuleGroup(List<PropertyCondition> properties, Double rolloutPercentage, String variant) {
      this.properties = immutableCopy(properties);
      this.rolloutPercentage = rolloutPercentage;
      this.variant = variant;
    }

    void freeze() {
      properties = immutableCopy(properties);
    }

    // Guaranteed non-null
    public List<PropertyCondition> getProperties() {
      return properties == null ? emptyList() : properties;
    }

    public Double getRolloutPercentage() {
      return rolloutPercentage;
    }

    public String getVariant() {
      return variant;
    }
  }

  /**
   * A comparison between one subject attribute and a value from the flag definition.
   */
  public static final class PropertyCondition {
    static final String COHORT_TYPE = "cohort";

    private String key;
    private JsonElement value;
    private Operator operator;
    private String type;

    transient ConditionPreprocessed preprocessed;

    PropertyCondition() {}

    /**
     * Creates a condition.
     *
     * @param key the attribute key
     * @param value the comparison value (a JSON scalar or array)
     * @param operator the operator; null means {@link Operator#EXACT}
     * @param type the property type, such as {@code "person"} or {@code "cohort"}; may be null
     */
    public PropertyCondition(String key, JsonElement value, Operator operator, String type) {
      this.key = key;
      this.value = value;
      this.operator = operator;
      this.type = type;
    }

    public String getKey() {
      return key;
    }

    // Guaranteed non-null
    public JsonElement getValue() {
      return value == null ? JsonNull.INSTANCE : value;
    }

    // Guaranteed non-null; an absent operator means "exact"
    public Operator getOperator() {
      return operator == null ? Operator.EXACT : operator;
    }

    public String getType() {
      return type;
    }

    boolean isCohortCondition() {
      return COHORT_TYPE.equals(type);
    }
  }

  /**
   * The variants of a multivariate flag, in the order their bucket ranges are laid out.
   */
  public static final class MultivariateSpec {
    private List<Variant> variants;

    MultivariateSpec() {}

    public MultivariateSpec(List<Variant> variants) {
      this.variants = immutableCopy(variants);
    }

    void freeze() {
      variants = immutableCopy(variants);
    }

    // Guaranteed non-null
    public List<Variant> getVariants() {
      return variants == null ? emptyList() : variants;
    }
  }

  /**
   * One variant of a multivariate flag.
   */
  public static final class Variant {
    private String key;
    @SerializedName("rollout_percentage")
    private double rolloutPercentage;

    Variant() {}

    public Variant(String key, double rolloutPercentage) {
      this.key = key;
      this.rolloutPercentage = rolloutPercentage;
    }

    public String getKey() {
      return key;
    }

    public double getRolloutPercentage() {
      return rolloutPercentage;
    }
  }

  /**
   * Cohort metadata. The SDK does not evaluate cohort expressions locally, so the properties are
   * kept as opaque JSON.
   */
  public static final class Cohort {
    private String id;
    private String name;
    private JsonElement properties;

    Cohort() {}

    public Cohort(String id, String name, JsonElement properties) {
      this.id = id;
      this.name = name;
      this.properties = properties;
    }

    public String getId() {
      return id;
    }

    public String getName() {
      return name;
    }

    // Guaranteed non-null; returns a copy
    public JsonElement getProperties() {
      return properties == null ? JsonNull.INSTANCE : properties.deepCopy();
    }
  }

  /**
   * Everything returned by one call to the local evaluation endpoint. A snapshot is always installed
   * into the cache as a whole.
   */
  @JsonAdapter(JsonHelpers.PostProcessingDeserializableTypeAdapterFactory.class)
  public static final class DefinitionsSnapshot implements JsonHelpers.PostProcessingDeserializable {
    private List<FeatureFlag> flags;
    @SerializedName("group_type_mapping")
    private Map<String, String> groupTypeMapping;
    private Map<String, Cohort> cohorts;

    DefinitionsSnapshot() {}

    public DefinitionsSnapshot(List<FeatureFlag> flags, Map<String, String> groupTypeMapping,
        Map<String, Cohort> cohorts) {
      this.flags = immutableCopy(flags);
      this.groupTypeMapping = immutableCopy(groupTypeMapping);
      this.cohorts = immutableCopy(cohorts);
    }

    @Override
    public void afterDeserialized() {
      flags = immutableCopy(flags);
      groupTypeMapping = immutableCopy(groupTypeMapping);
      cohorts = immutableCopy(cohorts);
    }

    /**
     * Shortcut for a snapshot that contains only flags.
     *
     * @param flags the flags
     * @return a snapshot
     */
    public static DefinitionsSnapshot ofFlags(FeatureFlag... flags) {
      return new DefinitionsSnapshot(Arrays.asList(flags), null, null);
    }

    // Guaranteed non-null
    public List<FeatureFlag> getFlags() {
      return flags == null ? emptyList() : flags;
    }

    // Guaranteed non-null
    public Map<String, String> getGroupTypeMapping() {
      return groupTypeMapping == null ? emptyMap() : groupTypeMapping;
    }

    // Guaranteed non-null
    public Map<String, Cohort> getCohorts() {
      return cohorts == null ? emptyMap() : cohorts;
    }
  }

  /**
   * This is an enum-like type rather than an enum because an operator the SDK does not know about
   * must not cause parsing of the whole definitions payload to fail. A condition with an unknown
   * operator evaluates as inconclusive. The implementation of each operator is in ConditionEvaluator.
   */
  @JsonAdapter(OperatorTypeAdapter.class)
  public static final class Operator {
    private final String name;
    private final boolean builtin;

    private static final Map<String, Operator> builtins = new HashMap<>();

    private Operator(String name, boolean builtin) {
      this.name = name;
      this.builtin = builtin;
    }

    private static Operator builtin(String name) {
      Operator op = new Operator(name, true);
      builtins.put(name, op);
      return op;
    }

    public static final Operator EXACT = builtin("exact");
    public static final Operator IS_NOT = builtin("is_not");
    public static final Operator IS_SET = builtin("is_set");
    public static final Operator IS_NOT_SET = builtin("is_not_set");
    public static final Operator ICONTAINS = builtin("icontains");
    public static final Operator NOT_ICONTAINS = builtin("not_icontains");
    public static final Operator REGEX = builtin("regex");
    public static final Operator NOT_REGEX = builtin("not_regex");
    public static final Operator GT = builtin("gt");
    public static final Operator GTE = builtin("gte");
    public static final Operator LT = builtin("lt");
    public static final Operator LTE = builtin("lte");
    public static final Operator IS_DATE_BEFORE = builtin("is_date_before");
    public static final Operator IS_DATE_AFTER = builtin("is_date_after");

    /**
     * Returns the operator with the given wire name. Names that are not built in produce an
     * operator that is not {@link #isBuiltin() built in}.
     *
     * @param name the operator name
     * @return an operator
     */
    public static Operator forName(String name) {
      Operator op = builtins.get(name);
      return op == null ? new Operator(name, false) : op;
    }

    public String name() {
      return name;
    }

    public boolean isBuiltin() {
      return builtin;
    }

    @Override
    public String toString() {
      return name;
    }

    @Override
    public boolean equals(Object other) {
      if (this.builtin) {
        // builtins are interned
        return this == other;
      }
      return other instanceof Operator && ((Operator)other).name.equals(this.name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  static final class OperatorTypeAdapter extends TypeAdapter<Operator> {
    @Override
    public void write(JsonWriter out, Operator value) throws IOException {
      if (value == null) {
        out.nullValue();
      } else {
        out.value(value.name());
      }
    }

    @Override
    public Operator read(JsonReader in) throws IOException {
      if (in.peek() == JsonToken.NULL) {
        in.nextNull();
        return null;
      }
      return Operator.forName(in.nextString());
    }
  }
}
