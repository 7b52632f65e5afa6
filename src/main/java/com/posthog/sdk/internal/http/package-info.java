/**
 * HTTP helpers shared by SDK components. Not part of the supported public API.
 */
package com.posthog.sdk.internal.http;
