package dev.personalagent.presentation.view;

import java.util.UUID;

/**
 * Confirmation dialogs. {@code subject} is the entity the dialog is about.
 */
public record ModalId(Kind kind, UUID subject) {

    public enum Kind {
        CONFIRM_DELETE_CONVERSATION,
        CONFIRM_DELETE_PROFILE,
        CONFIRM_DELETE_MCP
    }
}
