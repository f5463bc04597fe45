package dev.personalagent.core.event;

/**
 * The subscriber fell more than the bus capacity behind and the oldest unread
 * events were overwritten. The subscriber stays connected; the next receive
 * continues with the oldest event still retained.
 */
public class SubscriberLaggedException extends EventBusException {

    private final long skipped;

    public SubscriberLaggedException(long skipped) {
        super("Subscriber lagged, skipped " + skipped + " events");
        this.skipped = skipped;
    }

    public long getSkipped() {
        return skipped;
    }
}
