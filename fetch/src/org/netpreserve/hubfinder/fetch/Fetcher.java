package org.netpreserve.hubfinder.fetch;

import org.netpreserve.hubfinder.util.Url;

import java.time.Duration;

/**
 * Fetches a single URL. Implementations must honour the timeout and abandon the request when the calling thread is
 * interrupted, which is how in-flight fetches are cancelled.
 */
public interface Fetcher {
    FetchResult fetch(Url url, Duration timeout) throws FetchException, InterruptedException;
}
