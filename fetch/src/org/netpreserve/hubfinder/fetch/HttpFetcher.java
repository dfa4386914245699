package org.netpreserve.hubfinder.fetch;

import org.netpreserve.hubfinder.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Fetcher backed by the JDK HTTP client. Redirects are followed here rather than by the client so that a URL seen
 * twice, or more than {@link #MAX_REDIRECTS} hops, can be reported as a redirect loop.
 */
public class HttpFetcher implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpFetcher.class);
    static final int MAX_REDIRECTS = 10;
    private static final Set<Integer> REDIRECT_STATUSES = Set.of(301, 302, 303, 307, 308);
    private final HttpClient httpClient;
    private final String userAgent;

    public HttpFetcher(String userAgent) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofSeconds(10))
                .build(), userAgent);
    }

    public HttpFetcher(HttpClient httpClient, String userAgent) {
        this.httpClient = httpClient;
        this.userAgent = userAgent;
    }

    @Override
    public FetchResult fetch(Url url, Duration timeout) throws FetchException, InterruptedException {
        long start = System.nanoTime();
        var visited = new HashSet<String>();
        Url current = url;
        HttpResponse<byte[]> response;
        while (true) {
            if (!visited.add(current.toString())) {
                throw new FetchException(FetchException.Kind.REDIRECT_LOOP,
                        "Redirect loop fetching " + url + " at " + current);
            }
            response = send(current, timeout);
            String location = response.headers().firstValue("Location").orElse(null);
            if (!REDIRECT_STATUSES.contains(response.statusCode()) || location == null) break;
            if (visited.size() > MAX_REDIRECTS) {
                throw new FetchException(FetchException.Kind.REDIRECT_LOOP,
                        "More than " + MAX_REDIRECTS + " redirects fetching " + url);
            }
            Url next = current.resolve(location);
            if (next == null || !next.isHttp()) {
                throw new FetchException(FetchException.Kind.STRUCTURAL,
                        "Bad redirect from " + current + " to " + location);
            }
            log.atDebug().addKeyValue("url", current).addKeyValue("location", next).log("Following redirect");
            current = next;
        }
        long durationMs = (System.nanoTime() - start) / 1_000_000;

        log.atDebug().addKeyValue("url", url)
                .addKeyValue("status", response.statusCode())
                .addKeyValue("durationMs", durationMs)
                .log("Fetched");

        return new FetchResult(response.statusCode(), url, current,
                response.body() == null ? new byte[0] : response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                durationMs);
    }

    private HttpResponse<byte[]> send(Url url, Duration timeout) throws FetchException, InterruptedException {
        URI uri;
        try {
            uri = url.toURI();
        } catch (URISyntaxException e) {
            throw new FetchException(FetchException.Kind.STRUCTURAL, "Malformed URL: " + url, e);
        }
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(uri)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new FetchException(FetchException.Kind.STRUCTURAL, "Unfetchable URL: " + url, e);
        }
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new FetchException(FetchException.Kind.TRANSIENT, "Timed out fetching " + url, e);
        } catch (IOException e) {
            throw new FetchException(FetchException.Kind.TRANSIENT, "I/O error fetching " + url + ": " + e.getMessage(), e);
        }
    }
}
