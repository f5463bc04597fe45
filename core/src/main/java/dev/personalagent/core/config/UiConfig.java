package dev.personalagent.core.config;

public class UiConfig {

    private long frameIntervalMillis = 16;
    private int historyPageSize = 50;
    private int trendingMcpCount = 10;

    public long getFrameIntervalMillis() {
        return frameIntervalMillis;
    }

    public void setFrameIntervalMillis(long frameIntervalMillis) {
        this.frameIntervalMillis = frameIntervalMillis;
    }

    public int getHistoryPageSize() {
        return historyPageSize;
    }

    public void setHistoryPageSize(int historyPageSize) {
        this.historyPageSize = historyPageSize;
    }

    public int getTrendingMcpCount() {
        return trendingMcpCount;
    }

    public void setTrendingMcpCount(int trendingMcpCount) {
        this.trendingMcpCount = trendingMcpCount;
    }
}
