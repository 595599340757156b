package com.alterante.nearby.transfer;

import com.alterante.nearby.engine.EndpointInfo;
import com.alterante.nearby.observe.SessionObserver;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiscoveryRegistryTest {

    private final TransferStore store = new TransferStore();
    private final List<String> calls = new ArrayList<>();
    private final DiscoveryRegistry registry = new DiscoveryRegistry(store, new SessionObserver() {
        @Override
        public void outboundAdded(OutboundSession session) {
            calls.add("added " + session.id());
        }

        @Override
        public void endpointUpdated(OutboundSession session) {
            calls.add("updated " + session.id());
        }
    });

    @Test
    void sameEndpointTwiceGivesOneSessionWithLatestPresence() {
        registry.upsert(new EndpointInfo("dev1", "Pixel", "10.0.0.5", 4000, true));
        registry.upsert(new EndpointInfo("dev1", "Pixel", "10.0.0.5", 4000, false));

        assertEquals(1, store.outboundCount());
        OutboundSession s = store.outbound("dev1").orElseThrow();
        assertFalse(s.endpoint().present());
        assertEquals(List.of("added dev1", "updated dev1"), calls);
    }

    @Test
    void rediscoveryKeepsSessionState() {
        registry.upsert(new EndpointInfo("dev1", "Pixel", null, 0, true));
        OutboundSession s = store.outbound("dev1").orElseThrow();
        store.markSendFailed(s);

        registry.upsert(new EndpointInfo("dev1", "Pixel 8", "10.0.0.9", 4100, true));
        assertSame(s, store.outbound("dev1").orElseThrow());
        assertEquals(TransferState.FAILED, s.state());
        assertEquals("Pixel 8", s.endpoint().displayName());
    }

    @Test
    void endpointsNewestFirst() {
        registry.upsert(new EndpointInfo("a", null, null, 0, true));
        registry.upsert(new EndpointInfo("b", null, null, 0, true));
        assertEquals(List.of("b", "a"), registry.endpoints().stream().map(EndpointInfo::id).toList());
        assertEquals("Unknown device", registry.endpoints().get(0).displayName());
    }

    @Test
    void tracksDiscoveryFlag() {
        assertFalse(registry.isDiscoveryOn());
        registry.discoveryStarted();
        assertTrue(registry.isDiscoveryOn());
        registry.discoveryStopped();
        assertFalse(registry.isDiscoveryOn());
    }
}
