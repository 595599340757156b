package com.alterante.nearby.observe;

/**
 * Desktop integration (notification portal, tray). Fire-and-forget: implementations
 * must not block and must never call back into session state directly.
 */
public interface MilestoneSink {

    MilestoneSink NONE = new MilestoneSink() {
        @Override
        public void publish(Milestone milestone) {}

        @Override
        public void withdraw(String notificationId) {}
    };

    void publish(Milestone milestone);

    void withdraw(String notificationId);
}
