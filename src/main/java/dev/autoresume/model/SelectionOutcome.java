package dev.autoresume.model;

import java.util.Optional;

/**
 * Terminal result of the selection checkpoint: either a frozen selection or
 * an explicit abort by the user.
 */
public record SelectionOutcome(SelectionResult result) {

    private static final SelectionOutcome ABORTED = new SelectionOutcome(null);

    public static SelectionOutcome frozen(SelectionResult result) {
        return new SelectionOutcome(result);
    }

    public static SelectionOutcome aborted() {
        return ABORTED;
    }

    public boolean isAborted() {
        return result == null;
    }

    public Optional<SelectionResult> selection() {
        return Optional.ofNullable(result);
    }
}
