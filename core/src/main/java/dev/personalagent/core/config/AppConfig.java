package dev.personalagent.core.config;

/**
 * Root of {@code config.json}. Every section has defaults, so a missing or
 * partial file still yields a complete configuration.
 */
public class AppConfig {

    private boolean debugMode = false;
    private BusConfig bus = new BusConfig();
    private ChatConfig chat = new ChatConfig();
    private UiConfig ui = new UiConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public BusConfig getBus() {
        return bus;
    }

    public void setBus(BusConfig bus) {
        this.bus = bus;
    }

    public ChatConfig getChat() {
        return chat;
    }

    public void setChat(ChatConfig chat) {
        this.chat = chat;
    }

    public UiConfig getUi() {
        return ui;
    }

    public void setUi(UiConfig ui) {
        this.ui = ui;
    }
}
