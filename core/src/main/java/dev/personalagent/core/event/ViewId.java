package dev.personalagent.core.event;

/**
 * Top-level views the router can show. {@link #CHAT} is the home view and
 * the permanent root of the navigation stack.
 */
public enum ViewId {
    CHAT,
    HISTORY,
    SETTINGS,
    PROFILE_EDITOR,
    MCP_ADD,
    MCP_CONFIGURE,
    MODEL_SELECTOR;

    public static ViewId home() {
        return CHAT;
    }
}
