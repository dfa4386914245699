package org.netpreserve.hubfinder.validate;

import java.util.ArrayList;
import java.util.List;

import static org.netpreserve.hubfinder.validate.ValidationState.*;

/**
 * Tracks one candidate through PENDING → FETCHED → {CONFIRMED | REJECTED | INCONCLUSIVE}. An INCONCLUSIVE
 * validation may go back to PENDING once for a re-check, or be settled as REJECTED.
 */
public class HubValidation {
    private ValidationState state = PENDING;
    private final List<ValidationState> history = new ArrayList<>(List.of(PENDING));
    private boolean rechecked;

    public ValidationState state() {
        return state;
    }

    public List<ValidationState> history() {
        return List.copyOf(history);
    }

    public void transition(ValidationState next) {
        if (!isAllowed(state, next)) {
            throw new IllegalStateException("Illegal validation transition " + state + " -> " + next);
        }
        state = next;
        history.add(next);
    }

    public boolean canRecheck() {
        return state == INCONCLUSIVE && !rechecked;
    }

    public void recheck() {
        if (rechecked) throw new IllegalStateException("Validation was already re-checked");
        transition(PENDING);
        rechecked = true;
    }

    static boolean isAllowed(ValidationState from, ValidationState to) {
        return switch (from) {
            case PENDING -> to == FETCHED || to == REJECTED || to == INCONCLUSIVE;
            case FETCHED -> to == CONFIRMED || to == REJECTED || to == INCONCLUSIVE;
            case INCONCLUSIVE -> to == PENDING || to == REJECTED;
            case CONFIRMED, REJECTED -> false;
        };
    }
}
