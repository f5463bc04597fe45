package dev.personalagent.presentation.deferred;

/**
 * Screen rectangle an overlay is positioned against, typically the status
 * bar button that opened it.
 */
public record AnchorBounds(double x, double y, double width, double height) {
}
