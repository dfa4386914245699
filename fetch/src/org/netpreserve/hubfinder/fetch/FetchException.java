package org.netpreserve.hubfinder.fetch;

/**
 * A fetch that produced no usable response.
 */
public class FetchException extends Exception {
    private final Kind kind;

    public FetchException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FetchException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    public enum Kind {
        /**
         * Timeouts, connection failures, DNS hiccups. Worth retrying.
         */
        TRANSIENT,
        /**
         * The request itself is broken (e.g. malformed URL). Never retried.
         */
        STRUCTURAL,
        REDIRECT_LOOP
    }
}
