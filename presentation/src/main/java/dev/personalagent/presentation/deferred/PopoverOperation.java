package dev.personalagent.presentation.deferred;

/**
 * Deferred popover visibility change.
 */
public interface PopoverOperation {

    record Show(AnchorBounds anchor) implements PopoverOperation {
    }

    record Hide() implements PopoverOperation {
    }
}
