package dev.personalagent.core.event;

/**
 * Application lifecycle, configuration and system level failures.
 */
public interface SystemEvent extends AppEvent {

    record AppLaunched() implements SystemEvent {
    }

    /**
     * Last event of a session. Presenter loops exit after handling it.
     */
    record AppWillTerminate() implements SystemEvent {
    }

    record HotkeyChanged(String hotkey) implements SystemEvent {
    }

    /** Published by the UI once the popover change has been applied. */
    record PopoverShown() implements SystemEvent {
    }

    record PopoverHidden() implements SystemEvent {
    }

    /** {@code context} is optional extra detail and may be {@code null}. */
    record Error(String source, String error, String context) implements SystemEvent {
        public Error(String source, String error) {
            this(source, error, null);
        }
    }

    record ConfigLoaded() implements SystemEvent {
    }

    record ConfigSaved() implements SystemEvent {
    }

    record ModelsRegistryRefreshed(int providerCount, int modelCount) implements SystemEvent {
    }

    record ModelsRegistryRefreshFailed(String error) implements SystemEvent {
    }
}
