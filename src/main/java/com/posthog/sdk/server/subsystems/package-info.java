/**
 * Interfaces for implementing custom SDK components.
 */
package com.posthog.sdk.server.subsystems;
