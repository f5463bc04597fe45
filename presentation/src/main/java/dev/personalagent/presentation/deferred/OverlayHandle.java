package dev.personalagent.presentation.deferred;

/**
 * The native overlay (popover window) the platform layer provides. Methods
 * are only called from the UI thread, outside toolkit callbacks.
 */
public interface OverlayHandle {

    void show(AnchorBounds anchor);

    void hide();

    boolean isVisible();
}
