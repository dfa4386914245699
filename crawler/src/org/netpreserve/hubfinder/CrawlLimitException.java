package org.netpreserve.hubfinder;

public class CrawlLimitException extends Exception {
    public CrawlLimitException(String message) {
        super(message);
    }
}
