package com.posthog.sdk.server;

abstract class Version {
  private Version() {}

  static final String SDK_VERSION = "1.0.0-SNAPSHOT";
}
