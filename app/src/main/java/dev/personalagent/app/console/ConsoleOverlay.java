package dev.personalagent.app.console;

import dev.personalagent.presentation.deferred.AnchorBounds;
import dev.personalagent.presentation.deferred.OverlayHandle;

import java.io.PrintStream;

/**
 * Stands in for the menu-bar popover window.
 */
public class ConsoleOverlay implements OverlayHandle {

    private final PrintStream out;
    private boolean visible;

    public ConsoleOverlay(PrintStream out) {
        this.out = out;
    }

    @Override
    public void show(AnchorBounds anchor) {
        visible = true;
        out.printf("[popover shown at %.0f,%.0f]%n", anchor.x(), anchor.y());
    }

    @Override
    public void hide() {
        visible = false;
        out.println("[popover hidden]");
    }

    @Override
    public boolean isVisible() {
        return visible;
    }
}
