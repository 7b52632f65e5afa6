package com.posthog.sdk.server;

import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.LDSLF4J;
import com.launchdarkly.logging.Logs;

import java.net.URI;
import java.time.Duration;

/**
 * Configuration for a {@link LocalEvaluationClient}. Instances must be constructed with a
 * {@link LocalEvaluationConfig.Builder}.
 */
public final class LocalEvaluationConfig {
  /**
   * The default value for {@link Builder#host(String)}.
   */
  public static final String DEFAULT_HOST = "https://us.i.posthog.com";

  /**
   * The default value for {@link Builder#pollInterval(Duration)}: 30 seconds.
   */
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(30);

  /**
   * The default value for {@link Builder#requestTimeout(Duration)}: 10 seconds.
   */
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

  final URI host;
  final String projectApiKey;
  final String personalApiKey;
  final Duration pollInterval;
  final Duration requestTimeout;
  final LDLogAdapter logAdapter;
  final String baseLoggerName;

  private LocalEvaluationConfig(Builder builder) {
    this.host = URI.create(builder.host);
    this.projectApiKey = builder.projectApiKey;
    this.personalApiKey = builder.personalApiKey;
    this.pollInterval = builder.pollInterval;
    this.requestTimeout = builder.requestTimeout;
    LDLogAdapter adapter = builder.logAdapter == null ? getDefaultLogAdapter() : builder.logAdapter;
    // If the adapter is for a framework like SLF4J that has its own external configuration system,
    // then calling Logs.level here has no effect.
    this.logAdapter = Logs.level(adapter, builder.logLevel == null ? LDLogLevel.INFO : builder.logLevel);
    this.baseLoggerName = builder.baseLoggerName == null ? Loggers.BASE_LOGGER_NAME : builder.baseLoggerName;
  }

  public URI getHost() {
    return host;
  }

  public String getProjectApiKey() {
    return projectApiKey;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public String getBaseLoggerName() {
    return baseLoggerName;
  }

  private static LDLogAdapter getDefaultLogAdapter() {
    // If SLF4J is present in the classpath, use that by default; otherwise use the console.
    try {
      Class.forName("org.slf4j.LoggerFactory");
      return LDSLF4J.adapter();
    } catch (ClassNotFoundException e) {
      return Logs.toConsole();
    }
  }

  /**
   * A builder that helps construct {@link LocalEvaluationConfig} objects. Builder calls can be
   * chained, enabling the following pattern:
   * <pre>
   * LocalEvaluationConfig config = new LocalEvaluationConfig.Builder()
   *     .projectApiKey("phc_...")
   *     .personalApiKey("phx_...")
   *     .pollInterval(Duration.ofMinutes(1))
   *     .build();
   * </pre>
   */
  public static final class Builder {
    private String host = DEFAULT_HOST;
    private String projectApiKey;
    private String personalApiKey;
    private Duration pollInterval = DEFAULT_POLL_INTERVAL;
    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    private LDLogAdapter logAdapter;
    private LDLogLevel logLevel;
    private String baseLoggerName;

    /**
     * Creates a builder with all configuration parameters set to the default.
     */
    public Builder() {
    }

    /**
     * Sets the base URI of the service. Trailing slashes are ignored. Null means the default.
     *
     * @param host the base URI, such as {@code https://eu.i.posthog.com}
     * @return the builder
     */
    public Builder host(String host) {
      if (host == null || host.trim().isEmpty()) {
        this.host = DEFAULT_HOST;
      } else {
        String h = host.trim();
        while (h.endsWith("/")) {
          h = h.substring(0, h.length() - 1);
        }
        this.host = h;
      }
      return this;
    }

    /**
     * Sets the project API key, which identifies the project whose flags are fetched. Required.
     *
     * @param projectApiKey the project API key
     * @return the builder
     */
    public Builder projectApiKey(String projectApiKey) {
      this.projectApiKey = projectApiKey;
      return this;
    }

    /**
     * Sets the personal API key that authorizes fetching flag definitions. Required.
     *
     * @param personalApiKey the personal API key
     * @return the builder
     */
    public Builder personalApiKey(String personalApiKey) {
      this.personalApiKey = personalApiKey;
      return this;
    }

    /**
     * Sets the time between flag definition fetches. Null, zero or negative means
     * {@link LocalEvaluationConfig#DEFAULT_POLL_INTERVAL}.
     *
     * @param pollInterval the interval
     * @return the builder
     */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = positiveOrDefault(pollInterval, DEFAULT_POLL_INTERVAL);
      return this;
    }

    /**
     * Sets the maximum duration of one flag definitions request. Null, zero or negative means
     * {@link LocalEvaluationConfig#DEFAULT_REQUEST_TIMEOUT}.
     *
     * @param requestTimeout the timeout
     * @return the builder
     */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = positiveOrDefault(requestTimeout, DEFAULT_REQUEST_TIMEOUT);
      return this;
    }

    /**
     * Specifies the implementation of logging to use.
     * <p>
     * The default is {@link com.launchdarkly.logging.LDSLF4J#adapter()} if SLF4J is in the classpath,
     * otherwise {@link Logs#toConsole()}.
     *
     * @param logAdapter an {@link LDLogAdapter}, or null for the default
     * @return the builder
     */
    public Builder logAdapter(LDLogAdapter logAdapter) {
      this.logAdapter = logAdapter;
      return this;
    }

    /**
     * Specifies the lowest level of logging to enable. This only applies to adapters, such as the
     * console, that have no level configuration of their own. The default is {@link LDLogLevel#INFO}.
     *
     * @param logLevel the minimum level
     * @return the builder
     */
    public Builder logLevel(LDLogLevel logLevel) {
      this.logLevel = logLevel;
      return this;
    }

    /**
     * Overrides the base logger name. The default is the full name of {@link LocalEvaluationClient}.
     * Sub-loggers such as "FlagPoller" are appended to it with a dot.
     *
     * @param baseLoggerName the name, or null for the default
     * @return the builder
     */
    public Builder baseLoggerName(String baseLoggerName) {
      this.baseLoggerName = baseLoggerName;
      return this;
    }

    /**
     * Builds the configured {@link LocalEvaluationConfig} object.
     *
     * @return the configuration
     * @throws IllegalStateException if either API key is missing
     * @throws IllegalArgumentException if the host is not a valid URI
     */
    public LocalEvaluationConfig build() {
      if (projectApiKey == null || projectApiKey.isEmpty()) {
        throw new IllegalStateException("projectApiKey is required");
      }
      if (personalApiKey == null || personalApiKey.isEmpty()) {
        throw new IllegalStateException("personalApiKey is required for local evaluation");
      }
      return new LocalEvaluationConfig(this);
    }

    private static Duration positiveOrDefault(Duration value, Duration defaultValue) {
      return value == null || value.isZero() || value.isNegative() ? defaultValue : value;
    }
  }
}
