package org.netpreserve.hubfinder;

/**
 * A startup stage failed and the job never reached RUNNING.
 */
public class FatalCrawlException extends Exception {
    private final String stage;

    public FatalCrawlException(String stage, Throwable cause) {
        super("Startup failed at " + stage + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public String stage() {
        return stage;
    }
}
