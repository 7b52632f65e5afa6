package com.posthog.sdk.server;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * Encapsulates the deterministic hashing used for percentage rollouts and variant assignment.
 * <p>
 * The same subject and flag always land in the same bucket, and the computation matches the one
 * the service uses when it evaluates flags remotely, so it must not change.
 */
abstract class FlagBucketing {
  private FlagBucketing() {}

  /**
   * Salt for deciding whether a subject is inside a rule group's rollout percentage.
   */
  static final String ROLLOUT_SALT = "";

  /**
   * Salt for picking a variant of a multivariate flag.
   */
  static final String VARIANT_SALT = "variant";

  // 15 hex digits, not 16: the top bits are discarded
  private static final double LONG_SCALE = (double) 0xFFFFFFFFFFFFFFFL;

  /**
   * Maps a flag key, subject and salt to a value in [0, 1).
   *
   * @param flagKey the flag key
   * @param distinctId the subject's distinct ID
   * @param salt {@link #ROLLOUT_SALT} or {@link #VARIANT_SALT}
   * @return the bucket value
   */
  static double bucket(String flagKey, String distinctId, String salt) {
    String hash = DigestUtils.sha1Hex(flagKey + "." + distinctId + salt).substring(0, 15);
    long longVal = Long.parseLong(hash, 16);
    return longVal / LONG_SCALE;
  }
}
