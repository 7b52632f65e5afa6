package com.posthog.sdk.server.subsystems;

import com.posthog.sdk.internal.http.HttpErrors.HttpErrorException;
import com.posthog.sdk.server.DataModel.DefinitionsSnapshot;

import java.io.Closeable;
import java.io.IOException;

/**
 * Fetches the complete set of flag definitions from wherever they are published.
 * <p>
 * The SDK's implementation calls the local evaluation endpoint over HTTP. Tests, and applications
 * that distribute definitions some other way, can supply their own implementation to
 * {@link com.posthog.sdk.server.FlagPoller}.
 * <p>
 * Implementations must bound the duration of {@link #getDefinitions()} themselves; the poller does
 * not interrupt a call in progress.
 */
public interface FlagDefinitionsRequestor extends Closeable {
  /**
   * Fetches the current definitions.
   *
   * @return a complete snapshot; never null
   * @throws IOException for network errors
   * @throws HttpErrorException for HTTP error responses
   * @throws SerializationException if the response could not be parsed
   */
  DefinitionsSnapshot getDefinitions() throws IOException, HttpErrorException, SerializationException;
}
