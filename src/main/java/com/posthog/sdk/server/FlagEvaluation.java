package com.posthog.sdk.server;

import java.util.Objects;

/**
 * The outcome of evaluating one flag as part of {@link LocalEvaluator#evaluateAllFlags}: either a
 * {@link FlagValue}, or the reason the flag could not be evaluated locally.
 */
public final class FlagEvaluation {
  private final FlagValue value;
  private final String inconclusiveReason;

  private FlagEvaluation(FlagValue value, String inconclusiveReason) {
    this.value = value;
    this.inconclusiveReason = inconclusiveReason;
  }

  /**
   * Returns a successful result.
   *
   * @param value the flag value; must not be null
   * @return a result
   */
  public static FlagEvaluation of(FlagValue value) {
    return new FlagEvaluation(Objects.requireNonNull(value, "value"), null);
  }

  /**
   * Returns an inconclusive result.
   *
   * @param reason the reason
   * @return a result
   */
  public static FlagEvaluation inconclusive(String reason) {
    return new FlagEvaluation(null, reason == null ? "" : reason);
  }

  public boolean isInconclusive() {
    return value == null;
  }

  /**
   * Returns the flag value, or null if the result is inconclusive.
   *
   * @return the flag value
   */
  public FlagValue getValue() {
    return value;
  }

  /**
   * Returns the reason the result is inconclusive, or null if it is not.
   *
   * @return the reason
   */
  public String getInconclusiveReason() {
    return inconclusiveReason;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof FlagEvaluation) {
      FlagEvaluation o = (FlagEvaluation)other;
      return Objects.equals(value, o.value) && Objects.equals(inconclusiveReason, o.inconclusiveReason);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, inconclusiveReason);
  }

  @Override
  public String toString() {
    return isInconclusive() ? "inconclusive(" + inconclusiveReason + ")" : value.toString();
  }
}
