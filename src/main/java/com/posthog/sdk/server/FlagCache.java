package com.posthog.sdk.server;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.launchdarkly.logging.LDLogger;
import com.posthog.sdk.server.DataModel.Cohort;
import com.posthog.sdk.server.DataModel.DefinitionsSnapshot;
import com.posthog.sdk.server.DataModel.FeatureFlag;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A thread-safe in-memory holder for the most recent set of flag definitions.
 * <p>
 * Each {@link #replace(DefinitionsSnapshot)} swaps in a complete new set; readers never see a mix of
 * old and new definitions. Reads do not lock, and the write lock is held only for the swap itself.
 */
public final class FlagCache {
  private volatile State state = State.EMPTY;
  private final Object writeLock = new Object();
  private final LDLogger logger;

  /**
   * Creates an empty cache that does not log.
   */
  public FlagCache() {
    this(LDLogger.none());
  }

  /**
   * Creates an empty cache.
   *
   * @param logger the logger to use
   */
  public FlagCache(LDLogger logger) {
    this.logger = logger;
  }

  /**
   * One consistent view of the cache. An evaluation that needs several lookups should take one of
   * these and use it throughout.
   */
  static final class State {
    static final State EMPTY = new State(ImmutableMap.of(), ImmutableMap.of(), ImmutableMap.of(), false);

    final ImmutableMap<String, FeatureFlag> flags;
    final ImmutableMap<String, String> groupTypeMapping;
    final ImmutableMap<String, Cohort> cohorts;
    final boolean initialized;

    State(ImmutableMap<String, FeatureFlag> flags, ImmutableMap<String, String> groupTypeMapping,
        ImmutableMap<String, Cohort> cohorts, boolean initialized) {
      this.flags = flags;
      this.groupTypeMapping = groupTypeMapping;
      this.cohorts = cohorts;
      this.initialized = initialized;
    }
  }

  /**
   * Replaces everything in the cache with the contents of a snapshot. Entries absent from the
   * snapshot are removed. Flags without a key are ignored, and if two flags share a key the later
   * one wins.
   *
   * @param snapshot the new definitions
   */
  public void replace(DefinitionsSnapshot snapshot) {
    // LinkedHashMap first, because ImmutableMap.Builder rejects duplicate keys
    Map<String, FeatureFlag> flags = new LinkedHashMap<>();
    for (FeatureFlag f: snapshot.getFlags()) {
      if (f != null && f.getKey() != null) {
        flags.put(f.getKey(), f);
      }
    }
    Map<String, Cohort> cohorts = new LinkedHashMap<>();
    for (Map.Entry<String, Cohort> e: snapshot.getCohorts().entrySet()) {
      if (e.getKey() != null && e.getValue() != null) {
        cohorts.put(e.getKey(), e.getValue());
      }
    }
    Map<String, String> groupTypes = new LinkedHashMap<>();
    for (Map.Entry<String, String> e: snapshot.getGroupTypeMapping().entrySet()) {
      if (e.getKey() != null && e.getValue() != null) {
        groupTypes.put(e.getKey(), e.getValue());
      }
    }
    State newState = new State(ImmutableMap.copyOf(flags), ImmutableMap.copyOf(groupTypes),
        ImmutableMap.copyOf(cohorts), true);
    synchronized (writeLock) {
      this.state = newState; // replaces everything atomically
    }
    logger.debug("Replaced flag definitions: {} flags, {} cohorts", flags.size(), cohorts.size());
  }

  /**
   * Returns a flag definition.
   *
   * @param key the flag key
   * @return the flag, or null if it is not in the cache
   */
  public FeatureFlag get(String key) {
    return key == null ? null : state.flags.get(key);
  }

  /**
   * Returns all flag definitions.
   *
   * @return an immutable list
   */
  public List<FeatureFlag> getAll() {
    return ImmutableList.copyOf(state.flags.values());
  }

  /**
   * Returns the mapping of group type index to group type name.
   *
   * @return an immutable map
   */
  public Map<String, String> getGroupTypeMapping() {
    return state.groupTypeMapping;
  }

  /**
   * Returns cohort metadata.
   *
   * @param id the cohort ID
   * @return the cohort, or null if it is not in the cache
   */
  public Cohort getCohort(String id) {
    return id == null ? null : state.cohorts.get(id);
  }

  /**
   * Returns all cohort metadata.
   *
   * @return an immutable map
   */
  public Map<String, Cohort> getCohorts() {
    return state.cohorts;
  }

  /**
   * Removes all definitions. The cache still counts as initialized if it was before.
   */
  public void clear() {
    synchronized (writeLock) {
      this.state = new State(ImmutableMap.of(), ImmutableMap.of(), ImmutableMap.of(), state.initialized);
    }
  }

  /**
   * Returns true if definitions have been stored at least once.
   *
   * @return true if initialized
   */
  public boolean isInitialized() {
    return state.initialized;
  }

  State getState() {
    return state;
  }
}
