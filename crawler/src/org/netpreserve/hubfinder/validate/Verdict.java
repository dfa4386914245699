package org.netpreserve.hubfinder.validate;

public enum Verdict {
    CONFIRMED, REJECTED, INCONCLUSIVE
}
