package dev.personalagent.core.config;

public class BusConfig {

    private int capacity = 100;
    private int userEventCapacity = 256;
    private int viewCommandCapacity = 1024;

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public int getUserEventCapacity() {
        return userEventCapacity;
    }

    public void setUserEventCapacity(int userEventCapacity) {
        this.userEventCapacity = userEventCapacity;
    }

    public int getViewCommandCapacity() {
        return viewCommandCapacity;
    }

    public void setViewCommandCapacity(int viewCommandCapacity) {
        this.viewCommandCapacity = viewCommandCapacity;
    }
}
