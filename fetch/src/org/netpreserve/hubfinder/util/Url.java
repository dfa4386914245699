package org.netpreserve.hubfinder.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import de.malkusch.whoisServerList.publicSuffixList.PublicSuffixList;
import de.malkusch.whoisServerList.publicSuffixList.PublicSuffixListFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * URL type which caches parsing.
 */
public class Url {
    private static final PublicSuffixList publicSuffixList = new PublicSuffixListFactory().build();
    private static final List<String> TRACKING_PARAMS = List.of("fbclid", "gclid", "mc_cid", "mc_eid");
    private final String url;
    private URI uri;

    @JsonCreator
    public Url(String url) {
        this.url = url;
    }

    public synchronized URI toURI() throws URISyntaxException {
        if (uri == null) {
            uri = new URI(url);
        }
        return uri;
    }

    /**
     * Returns true if the URL can be parsed as an absolute http(s) URL with a host.
     */
    public boolean isValid() {
        try {
            URI parsed = toURI();
            return isHttp() && parsed.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    public String host() {
        return parse().getHost();
    }

    /**
     * Registrable domain of the host (e.g. "bbc.co.uk" for "news.bbc.co.uk"), or the host itself if it has none.
     */
    public String domain() {
        String host = host();
        if (host == null) return null;
        String domain = publicSuffixList.getRegistrableDomain(host.toLowerCase(Locale.ROOT));
        if (domain == null) return host;
        return domain;
    }

    public String scheme() {
        return parse().getScheme();
    }

    @JsonValue
    public String toString() {
        return url;
    }

    private static boolean startsWithIgnoreCase(String str, String prefix) {
        return str.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    public boolean isHttp() {
        return startsWithIgnoreCase(url, "http:") ||
               startsWithIgnoreCase(url, "https:");
    }

    private Url withoutFragment() {
        int i = url.indexOf('#');
        if (i == -1) {
            return this;
        }
        return new Url(url.substring(0, i));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Url url1 = (Url) o;
        return url.equals(url1.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }

    private URI parse() {
        try {
            return toURI();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL: " + url, e);
        }
    }

    public String path() {
        String path = parse().getRawPath();
        return path == null ? "" : path;
    }

    public String query() {
        return parse().getRawQuery();
    }

    /**
     * Non-empty path segments, lower-cased.
     */
    public List<String> pathSegments() {
        var segments = new ArrayList<String>();
        for (String segment : path().split("/")) {
            if (!segment.isEmpty()) segments.add(segment.toLowerCase(Locale.ROOT));
        }
        return segments;
    }

    public boolean isRoot() {
        return pathSegments().isEmpty();
    }

    public String hostAndPort() {
        URI parsed = parse();
        return parsed.getPort() == -1 ? parsed.getHost() : parsed.getHost() + ":" + parsed.getPort();
    }

    public Url withPath(String path) {
        URI parsed = parse();
        if (!path.startsWith("/")) path = "/" + path;
        return new Url(parsed.getScheme() + "://" + hostAndPort() + path);
    }

    /**
     * Resolves a possibly relative reference against this URL. Returns null if the reference can't be parsed.
     */
    public Url resolve(String reference) {
        try {
            return new Url(parse().resolve(reference.trim()).toString()).withoutFragment();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Canonical form used for deduplication: lower-case scheme and host, no default port, no fragment, no tracking
     * parameters and no trailing slash except for the root path.
     */
    public Url normalize() {
        URI parsed = parse();
        String scheme = parsed.getScheme().toLowerCase(Locale.ROOT);
        var builder = new StringBuilder();
        builder.append(scheme).append("://").append(parsed.getHost().toLowerCase(Locale.ROOT));
        int port = parsed.getPort();
        if (port != -1 && !(port == 80 && scheme.equals("http")) && !(port == 443 && scheme.equals("https"))) {
            builder.append(':').append(port);
        }
        String path = path();
        if (path.isEmpty()) path = "/";
        if (path.length() > 1 && path.endsWith("/")) path = path.substring(0, path.length() - 1);
        builder.append(path);
        String query = parsed.getRawQuery();
        if (query != null) {
            String kept = String.join("&", Arrays.stream(query.split("&"))
                    .filter(param -> !param.isEmpty() && !isTrackingParam(param))
                    .toList());
            if (!kept.isEmpty()) builder.append('?').append(kept);
        }
        return new Url(builder.toString());
    }

    private static boolean isTrackingParam(String param) {
        String name = param.split("=", 2)[0].toLowerCase(Locale.ROOT);
        return name.startsWith("utm_") || TRACKING_PARAMS.contains(name);
    }

    public boolean sameHost(Url other) {
        return host() != null && other.host() != null && host().equalsIgnoreCase(other.host());
    }

    /**
     * True if both URLs are under the same registrable domain, so "www.example.com" and "news.example.com" match.
     */
    public boolean sameSite(Url other) {
        String domain = domain();
        return domain != null && domain.equalsIgnoreCase(other.domain());
    }
}
