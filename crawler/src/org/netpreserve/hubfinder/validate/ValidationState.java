package org.netpreserve.hubfinder.validate;

public enum ValidationState {
    PENDING, FETCHED, CONFIRMED, REJECTED, INCONCLUSIVE;

    public boolean isTerminal() {
        return this == CONFIRMED || this == REJECTED;
    }
}
