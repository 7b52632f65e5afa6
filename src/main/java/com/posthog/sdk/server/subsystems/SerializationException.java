package com.posthog.sdk.server.subsystems;

/**
 * General exception class for all errors in serializing or deserializing JSON.
 * <p>
 * The SDK uses this class to avoid depending on exception types from the underlying JSON framework
 * that it uses (currently Gson). It is unchecked; public client methods never throw it, so it is
 * only relevant when implementing a custom {@link FlagDefinitionsRequestor}.
 */
@SuppressWarnings("serial")
public class SerializationException extends RuntimeException {
  /**
   * Creates an instance.
   * @param cause the underlying exception
   */
  public SerializationException(Throwable cause) {
    super(cause);
  }
}
