package com.alterante.nearby.channel;

/**
 * Thrown by a receiver once its channel is closed and fully drained.
 */
public class ChannelClosedException extends Exception {

    public ChannelClosedException(String message) {
        super(message);
    }
}
