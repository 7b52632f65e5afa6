package com.posthog.sdk.server;

/**
 * Thrown when a flag cannot be evaluated from the locally available data, for instance because a
 * condition refers to an attribute the caller did not supply.
 * <p>
 * This is not a fault: the caller can fall back to asking the service to evaluate the flag.
 */
@SuppressWarnings("serial")
public final class InconclusiveMatchException extends Exception {
  /**
   * Creates an instance.
   *
   * @param message why the evaluation could not be completed
   */
  public InconclusiveMatchException(String message) {
    super(message);
  }
}
