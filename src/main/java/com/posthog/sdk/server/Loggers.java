package com.posthog.sdk.server;

/**
 * Stable logger names shared by implementation code in the {@code com.posthog.sdk.server} package.
 * <p>
 * Most class names in the SDK are package-private implementation details that are not meaningful to
 * users, so log output uses a base name (the client class, unless configured otherwise) plus one of
 * these sub-logger names for each area of functionality. That also makes it convenient to define
 * SLF4J logger name filters.
 */
abstract class Loggers {
  private Loggers() {}

  static final String BASE_LOGGER_NAME = LocalEvaluationClient.class.getName();
  static final String POLLER_LOGGER_NAME = "FlagPoller";
  static final String CACHE_LOGGER_NAME = "FlagCache";
  static final String EVALUATION_LOGGER_NAME = "Evaluation";
}
