package dev.autoresume.selection;

/**
 * States of the selection checkpoint. FROZEN and ABORTED are terminal.
 */
public enum SelectionState {
    PRESENTING,
    AWAITING_CHOICE,
    RESOLVING_MANUAL_ADDS,
    FROZEN,
    ABORTED;

    public boolean isTerminal() {
        return this == FROZEN || this == ABORTED;
    }
}
