package com.posthog.sdk.server;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.posthog.sdk.server.DataModel.Operator;
import com.posthog.sdk.server.DataModel.PropertyCondition;
import com.posthog.sdk.server.DataModelPreprocessing.ConditionPreprocessed;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;

import static com.posthog.sdk.server.ConditionValues.isString;
import static com.posthog.sdk.server.ConditionValues.valueToDate;
import static com.posthog.sdk.server.ConditionValues.valueToDouble;
import static com.posthog.sdk.server.ConditionValues.valueToRegex;
import static com.posthog.sdk.server.ConditionValues.valueToString;

/**
 * Decides whether a single property condition holds for a subject's attributes.
 * <p>
 * A result of true or false is definite. When the attributes do not carry enough information to
 * decide, {@link InconclusiveMatchException} is thrown instead. Malformed condition values never
 * cause any other kind of exception.
 */
final class ConditionEvaluator {
  private static interface OperatorFn {
    boolean match(JsonElement attributeValue, PropertyCondition condition, Clock clock)
        throws InconclusiveMatchException;
  }

  private static final Map<Operator, OperatorFn> OPERATORS = new HashMap<>();
  static {
    OPERATORS.put(Operator.EXACT, (a, c, clock) -> applyExact(a, c.getValue()));
    OPERATORS.put(Operator.IS_NOT, (a, c, clock) -> !applyExact(a, c.getValue()));
    OPERATORS.put(Operator.IS_SET, (a, c, clock) -> true); // the attribute is known to be present
    OPERATORS.put(Operator.IS_NOT_SET, (a, c, clock) -> false);
    OPERATORS.put(Operator.ICONTAINS, (a, c, clock) -> applyIContains(a, c.getValue()));
    OPERATORS.put(Operator.NOT_ICONTAINS, (a, c, clock) -> !applyIContains(a, c.getValue()));
    OPERATORS.put(Operator.REGEX, ConditionEvaluator::applyRegex);
    OPERATORS.put(Operator.NOT_REGEX, ConditionEvaluator::applyNotRegex);
    OPERATORS.put(Operator.GT, numericComparison(delta -> delta > 0));
    OPERATORS.put(Operator.GTE, numericComparison(delta -> delta >= 0));
    OPERATORS.put(Operator.LT, numericComparison(delta -> delta < 0));
    OPERATORS.put(Operator.LTE, numericComparison(delta -> delta <= 0));
    OPERATORS.put(Operator.IS_DATE_BEFORE, dateComparison(delta -> delta < 0));
    OPERATORS.put(Operator.IS_DATE_AFTER, dateComparison(delta -> delta > 0));
  }

  private final Clock clock;

  /**
   * Creates an evaluator that resolves relative dates against the system UTC clock.
   */
  ConditionEvaluator() {
    this(Clock.systemUTC());
  }

  ConditionEvaluator(Clock clock) {
    this.clock = clock;
  }

  /**
   * Evaluates a condition.
   *
   * @param condition the condition
   * @param attributes the subject's attributes; a key mapped to a null value counts as present
   * @return true if the condition holds
   * @throws InconclusiveMatchException if the condition cannot be decided from these attributes
   */
  boolean matches(PropertyCondition condition, Map<String, JsonElement> attributes)
      throws InconclusiveMatchException {
    Operator op = condition.getOperator();
    String key = condition.getKey();
    if (key == null || !attributes.containsKey(key)) {
      if (op == Operator.IS_NOT_SET) {
        return true;
      }
      if (op == Operator.IS_SET) {
        return false;
      }
      throw new InconclusiveMatchException("Property '" + key + "' not found in provided properties");
    }
    JsonElement attributeValue = attributes.get(key);
    if (attributeValue == null) {
      attributeValue = JsonNull.INSTANCE;
    }

    OperatorFn fn = OPERATORS.get(op);
    if (fn == null) {
      throw new InconclusiveMatchException("Unknown operator: " + op);
    }
    return fn.match(attributeValue, condition, clock);
  }

  // An array condition value matches if any element does.
  static boolean applyExact(JsonElement attributeValue, JsonElement conditionValue) {
    if (conditionValue.isJsonArray()) {
      JsonArray values = conditionValue.getAsJsonArray();
      for (JsonElement v: values) {
        if (valuesEqual(v, attributeValue)) {
          return true;
        }
      }
      return false;
    }
    return valuesEqual(conditionValue, attributeValue);
  }

  static boolean valuesEqual(JsonElement a, JsonElement b) {
    if (isString(a) && isString(b)) {
      return a.getAsString().equalsIgnoreCase(b.getAsString());
    }
    return a.equals(b);
  }

  static boolean applyIContains(JsonElement attributeValue, JsonElement conditionValue) {
    String haystack = valueToString(attributeValue).toLowerCase(Locale.ROOT);
    String needle = valueToString(conditionValue).toLowerCase(Locale.ROOT);
    return haystack.contains(needle);
  }

  static boolean applyRegex(JsonElement attributeValue, PropertyCondition condition, Clock clock) {
    Pattern pattern = conditionPattern(condition);
    return pattern != null && pattern.matcher(valueToString(attributeValue)).find();
  }

  // A malformed pattern cannot match, so "does not match" holds.
  static boolean applyNotRegex(JsonElement attributeValue, PropertyCondition condition, Clock clock) {
    Pattern pattern = conditionPattern(condition);
    return pattern == null || !pattern.matcher(valueToString(attributeValue)).find();
  }

  private static Pattern conditionPattern(PropertyCondition condition) {
    // If preprocessed is non-null, we've already tried to compile the value, in which case a null
    // parsedRegex means it was not a valid pattern.
    ConditionPreprocessed preprocessed = condition.preprocessed;
    return preprocessed == null ? valueToRegex(condition.getValue()) : preprocessed.parsedRegex;
  }

  // Compares numerically when both sides are numbers or numeric strings; otherwise compares the
  // string forms lexicographically, which is what the service does too.
  static OperatorFn numericComparison(IntPredicate comparisonTest) {
    return (attributeValue, condition, clock) -> {
      Double attributeNumber = valueToDouble(attributeValue);
      Double conditionNumber = valueToDouble(condition.getValue());
      int delta;
      if (attributeNumber != null && conditionNumber != null) {
        double n1 = attributeNumber;
        double n2 = conditionNumber;
        if (Double.isNaN(n1) || Double.isNaN(n2)) {
          return false;
        }
        delta = n1 == n2 ? 0 : (n1 < n2 ? -1 : 1);
      } else {
        delta = valueToString(attributeValue).compareTo(valueToString(condition.getValue()));
      }
      return comparisonTest.test(delta);
    };
  }

  static OperatorFn dateComparison(IntPredicate comparisonTest) {
    return (attributeValue, condition, clock) -> {
      Instant now = clock.instant();
      Instant conditionDate = valueToDate(condition.getValue(), now);
      if (conditionDate == null) {
        throw new InconclusiveMatchException("Unable to parse target date value: " + condition.getValue());
      }
      Instant attributeDate = valueToDate(attributeValue, now);
      if (attributeDate == null) {
        throw new InconclusiveMatchException("Unable to parse property date value for '"
            + condition.getKey() + "': " + attributeValue);
      }
      return comparisonTest.test(attributeDate.compareTo(conditionDate));
    };
  }
}
