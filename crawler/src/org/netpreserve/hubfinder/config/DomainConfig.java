package org.netpreserve.hubfinder.config;

import org.netpreserve.hubfinder.util.Url;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A news site to discover hubs on.
 *
 * @param url   the site's home page, predictions are built relative to it
 * @param hints country codes the site is known to cover, used to rank regions and cities
 */
public record DomainConfig(Url url, List<String> hints) {
    public DomainConfig {
        Objects.requireNonNull(url, "url");
        hints = hints == null ? List.of() : List.copyOf(hints);
    }

    public DomainConfig(Url url) {
        this(url, List.of());
    }

    /**
     * Host name used as the domain key for patterns, coverage and telemetry.
     */
    public String host() {
        return url.host().toLowerCase(Locale.ROOT);
    }
}
