package dev.personalagent.presentation.navigation;

import dev.personalagent.core.event.ViewId;

import java.util.ArrayList;
import java.util.List;

/**
 * Stack of visited views. Never empty: the home view sits at the bottom and
 * cannot be popped. Owned by the UI thread; not thread-safe.
 */
public class NavigationState {

    private final List<ViewId> stack = new ArrayList<>();

    public NavigationState() {
        stack.add(ViewId.home());
    }

    /**
     * Pushes {@code to} unless it is already the current view.
     *
     * @return {@code true} if the stack changed
     */
    public boolean navigate(ViewId to) {
        if (to == current()) {
            return false;
        }
        stack.add(to);
        return true;
    }

    /**
     * Pops the current view unless only the home view is left.
     *
     * @return {@code true} if a view was popped
     */
    public boolean navigateBack() {
        if (!canGoBack()) {
            return false;
        }
        stack.remove(stack.size() - 1);
        return true;
    }

    public ViewId current() {
        return stack.get(stack.size() - 1);
    }

    public boolean canGoBack() {
        return stack.size() > 1;
    }

    public int stackDepth() {
        return stack.size();
    }

    /** Bottom first. */
    public List<ViewId> snapshot() {
        return List.copyOf(stack);
    }

    @Override
    public String toString() {
        return "NavigationState" + stack;
    }
}
