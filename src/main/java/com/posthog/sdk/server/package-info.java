/**
 * The main package for the server-side SDK's local flag evaluation.
 * <p>
 * You will most often use {@link com.posthog.sdk.server.LocalEvaluationClient} (the client) and
 * {@link com.posthog.sdk.server.LocalEvaluationConfig} (configuration options for the client).
 * Lower-level access is available through {@link com.posthog.sdk.server.LocalEvaluator},
 * {@link com.posthog.sdk.server.FlagCache} and {@link com.posthog.sdk.server.FlagPoller}.
 */
package com.posthog.sdk.server;
