package com.posthog.sdk.server;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.launchdarkly.logging.LDLogger;
import com.posthog.sdk.internal.http.HttpErrors.HttpErrorException;
import com.posthog.sdk.server.DataModel.DefinitionsSnapshot;
import com.posthog.sdk.server.subsystems.FlagDefinitionsRequestor;
import com.posthog.sdk.server.subsystems.SerializationException;

import java.io.Closeable;
import java.io.IOException;
import java.lang.ref.Cleaner;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import static com.posthog.sdk.internal.http.HttpErrors.logHttpError;
import static com.posthog.sdk.internal.http.HttpErrors.httpErrorDescription;

/**
 * Keeps a {@link FlagCache} up to date by fetching definitions on a fixed schedule.
 * <p>
 * A poller is started at most once and stopped at most once: {@code IDLE -> RUNNING -> STOPPED}.
 * Fetch failures are logged and the cache keeps its previous contents; polling continues at the next
 * interval. The poller runs on its own daemon thread, so one that is never stopped does not keep the
 * JVM alive, but owners should still call {@link #stop()} or {@link #close()}. A poller that becomes
 * unreachable without being stopped is stopped when the garbage collector reclaims it.
 */
public final class FlagPoller implements Closeable {
  private static final String ERROR_CONTEXT_MESSAGE = "on flag definitions request";
  private static final String WILL_RETRY_MESSAGE = "will retry at next scheduled poll interval";
  private static final long STOP_TIMEOUT_MILLIS = 30000;

  private static final Cleaner CLEANER = Cleaner.create(new ThreadFactoryBuilder()
      .setDaemon(true)
      .setNameFormat("PostHog-FlagPoller-Cleaner-%d")
      .build());

  enum State { IDLE, RUNNING, STOPPED }

  @VisibleForTesting final FlagDefinitionsRequestor requestor;
  @VisibleForTesting final Duration pollInterval;

  // The scheduled task references only the worker, so an abandoned poller can be collected and its
  // cleanup action can then stop the worker.
  private final Worker worker;
  private final Cleaner.Cleanable cleanable;

  /**
   * Creates a poller. Nothing happens until {@link #start()} is called.
   *
   * @param requestor fetches definitions; it is closed when the poller stops
   * @param cache the cache to keep up to date
   * @param pollInterval time between the end of one fetch and the start of the next
   * @param logger the logger to use
   */
  public FlagPoller(FlagDefinitionsRequestor requestor, FlagCache cache, Duration pollInterval, LDLogger logger) {
    if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException("poll interval must be positive");
    }
    this.requestor = requestor;
    this.pollInterval = pollInterval;
    this.worker = new Worker(requestor, cache, pollInterval, logger);
    this.cleanable = CLEANER.register(this, worker::stop);
  }

  /**
   * Fetches definitions once, synchronously, then schedules periodic fetches. A failure of the first
   * fetch is logged but does not prevent polling. Has no effect unless the poller is idle.
   */
  public void start() {
    worker.start();
  }

  /**
   * Stops polling. A fetch already in progress is allowed to finish, but its result is discarded;
   * once this method returns the cache will not be written again. The requestor is closed. Calling
   * this more than once has no further effect.
   */
  public void stop() {
    cleanable.clean(); // runs worker.stop() at most once
  }

  /**
   * Same as {@link #stop()}.
   */
  @Override
  public void close() {
    stop();
  }

  /**
   * Returns true between {@link #start()} and {@link #stop()}.
   *
   * @return true if running
   */
  public boolean isRunning() {
    return worker.getState() == State.RUNNING;
  }

  State getState() {
    return worker.getState();
  }

  private static final class Worker {
    private final FlagDefinitionsRequestor requestor;
    private final FlagCache cache;
    private final Duration pollInterval;
    private final LDLogger logger;

    private final Object lock = new Object();
    private State state = State.IDLE; // guarded by lock
    private ScheduledExecutorService scheduler; // guarded by lock
    private ScheduledFuture<?> task; // guarded by lock
    private volatile boolean loadedOnce;

    Worker(FlagDefinitionsRequestor requestor, FlagCache cache, Duration pollInterval, LDLogger logger) {
      this.requestor = requestor;
      this.cache = cache;
      this.pollInterval = pollInterval;
      this.logger = logger;
    }

    State getState() {
      synchronized (lock) {
        return state;
      }
    }

    void start() {
      synchronized (lock) {
        if (state != State.IDLE) {
          return;
        }
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat("PostHog-FlagPoller-%d")
            .build();
        scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory);
        state = State.RUNNING;
      }
      logger.info("Starting flag definitions polling with interval: {} milliseconds", pollInterval.toMillis());

      poll();

      synchronized (lock) {
        if (state == State.RUNNING) {
          long millis = pollInterval.toMillis();
          task = scheduler.scheduleWithFixedDelay(this::poll, millis, millis, TimeUnit.MILLISECONDS);
        }
      }
    }

    void stop() {
      ScheduledExecutorService executorToShutDown;
      synchronized (lock) {
        if (state == State.STOPPED) {
          return;
        }
        state = State.STOPPED;
        if (task != null) {
          task.cancel(false);
          task = null;
        }
        executorToShutDown = scheduler;
        scheduler = null;
      }
      logger.info("Stopping flag definitions polling");

      if (executorToShutDown != null) {
        executorToShutDown.shutdown();
        try {
          if (!executorToShutDown.awaitTermination(STOP_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
            logger.warn("Flag definitions request did not finish within {} milliseconds of stopping",
                STOP_TIMEOUT_MILLIS);
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }

      try {
        requestor.close();
      } catch (IOException e) {
        logger.warn("Error closing flag definitions requestor: {}", e.toString());
      }
    }

    private void poll() {
      try {
        DefinitionsSnapshot snapshot = requestor.getDefinitions();
        boolean stored = false;
        synchronized (lock) {
          if (state == State.RUNNING) {
            cache.replace(snapshot);
            stored = true;
          }
        }
        if (stored && !loadedOnce) {
          loadedOnce = true;
          logger.info("Loaded {} flag definitions", snapshot.getFlags().size());
        }
      } catch (HttpErrorException e) {
        logHttpError(logger, httpErrorDescription(e.getStatus()),
            ERROR_CONTEXT_MESSAGE, e.getStatus(), WILL_RETRY_MESSAGE);
      } catch (IOException e) {
        logHttpError(logger, e.toString(), ERROR_CONTEXT_MESSAGE, 0, WILL_RETRY_MESSAGE);
      } catch (SerializationException e) {
        logger.error("Flag definitions request received malformed data: {}", e.toString());
      } catch (Exception e) {
        logger.error("Unexpected error from flag poller: {}", e.toString());
        logger.debug(e.toString(), e);
      }
    }
  }
}
