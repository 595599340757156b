package com.alterante.nearby.channel;

/**
 * Thrown when a subscriber fell behind and the oldest messages were dropped.
 * The subscription stays usable; the next receive returns the oldest retained message.
 */
public class ChannelLaggedException extends Exception {

    private final long skipped;

    public ChannelLaggedException(long skipped) {
        super("Receiver lagged, skipped " + skipped + " messages");
        this.skipped = skipped;
    }

    public long skipped() {
        return skipped;
    }
}
