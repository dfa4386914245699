package org.netpreserve.hubfinder.validate;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.fetch.FetchResult;
import org.netpreserve.hubfinder.util.Url;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-run LRU cache of fetched pages, keyed by normalized URL.
 */
public class ContentCache {
    private final Map<Url, FetchResult> entries;

    public ContentCache(int capacity) {
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Url, FetchResult> eldest) {
                return size() > capacity;
            }
        };
    }

    public synchronized @Nullable FetchResult get(Url url) {
        return entries.get(url.normalize());
    }

    public synchronized void put(Url url, FetchResult result) {
        entries.put(url.normalize(), result);
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }
}
