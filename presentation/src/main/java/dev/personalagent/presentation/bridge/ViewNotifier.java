package dev.personalagent.presentation.bridge;

/**
 * Wakes the UI render loop so it drains pending view commands. Called from
 * background threads; implementations must only schedule a redraw.
 */
@FunctionalInterface
public interface ViewNotifier {

    ViewNotifier NONE = () -> {
    };

    void wake();
}
