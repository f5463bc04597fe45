package dev.personalagent.presentation;

import dev.personalagent.presentation.navigation.NavigationState;
import dev.personalagent.presentation.view.ViewCommand;

/**
 * The render layer's side of a frame: applies one command to its widget
 * state. Called on the UI thread only.
 */
@FunctionalInterface
public interface ViewCommandHandler {

    /**
     * @param navigation the navigation stack after the command's own
     *                   navigation effect, if any, was applied
     */
    void apply(ViewCommand command, NavigationState navigation);
}
