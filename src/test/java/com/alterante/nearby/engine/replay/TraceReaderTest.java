package com.alterante.nearby.engine.replay;

import com.alterante.nearby.engine.Direction;
import com.alterante.nearby.engine.PayloadKind;
import com.alterante.nearby.engine.ProtocolEvent;
import com.alterante.nearby.engine.ProtocolState;
import com.alterante.nearby.engine.Visibility;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TraceReaderTest {

    @TempDir
    Path tmp;

    private static List<TraceStep> parse(String text) throws Exception {
        return TraceReader.read(new StringReader(text));
    }

    @Test
    void readsEveryRecordType() throws Exception {
        List<TraceStep> steps = parse("""
                # comment

                {"type":"endpoint","id":"dev1","name":"Pixel","address":"10.0.0.5","port":4000,"present":false}
                {"type":"event","id":"t1","direction":"INBOUND","state":"WAITING_FOR_USER_CONSENT","kind":"text","preview":"hi","device":"Pixel"}
                {"type":"delay","ms":250}
                {"type":"await","on":"send"}
                {"type":"await","on":"action","timeoutMs":1000}
                {"type":"visibility","value":"invisible"}
                """);

        assertEquals(6, steps.size());
        TraceStep endpoint = steps.get(0);
        assertEquals(TraceStep.Kind.ENDPOINT, endpoint.kind());
        assertEquals("dev1", endpoint.endpoint().id());
        assertEquals(4000, endpoint.endpoint().port());
        assertFalse(endpoint.endpoint().present());

        ProtocolEvent event = steps.get(1).event();
        assertEquals(Direction.INBOUND, event.direction());
        assertEquals(ProtocolState.WAITING_FOR_USER_CONSENT, event.state());
        assertEquals(PayloadKind.TEXT, event.metadata().payloadKind());
        assertEquals("Pixel", event.deviceName());

        assertEquals(Duration.ofMillis(250), steps.get(2).duration());
        assertEquals(TraceStep.Kind.AWAIT_SEND, steps.get(3).kind());
        assertEquals(TraceReader.DEFAULT_AWAIT_TIMEOUT, steps.get(3).duration());
        assertEquals(Duration.ofSeconds(1), steps.get(4).duration());
        assertEquals(Visibility.INVISIBLE, steps.get(5).visibility());
    }

    @Test
    void acceptsCamelCaseStates() throws Exception {
        List<TraceStep> steps = parse("""
                {"type":"event","id":"dev1","direction":"outbound","state":"SentUkeyClientInit","pin":"42"}
                {"type":"event","id":"dev1","direction":"Outbound","state":"sending-files","total":10,"ack":5}
                """);
        assertEquals(ProtocolState.SENT_UKEY_CLIENT_INIT, steps.get(0).event().state());
        assertEquals("42", steps.get(0).event().pinCode());
        assertEquals(ProtocolState.SENDING_FILES, steps.get(1).event().state());
        assertEquals(5, steps.get(1).event().ackBytes());
    }

    @Test
    void eventWithoutDetailsHasNoMetadata() throws Exception {
        List<TraceStep> steps = parse("{\"type\":\"event\",\"id\":\"t1\",\"direction\":\"inbound\",\"state\":\"Finished\"}");
        assertNull(steps.get(0).event().metadata());
    }

    @Test
    void errorsCarryTheLineNumber() {
        TraceException unknownType = assertThrows(TraceException.class, () -> parse("""
                {"type":"delay","ms":1}
                {"type":"teleport"}
                """));
        assertEquals(2, unknownType.line());

        TraceException badJson = assertThrows(TraceException.class, () -> parse("{not json"));
        assertEquals(1, badJson.line());

        TraceException missingId = assertThrows(TraceException.class,
                () -> parse("{\"type\":\"event\",\"direction\":\"inbound\",\"state\":\"Finished\"}"));
        assertTrue(missingId.getMessage().contains("\"id\""));

        assertThrows(TraceException.class,
                () -> parse("{\"type\":\"event\",\"id\":\"t1\",\"direction\":\"sideways\",\"state\":\"Finished\"}"));
        assertThrows(TraceException.class, () -> parse("{\"type\":\"delay\",\"ms\":-5}"));
        assertThrows(TraceException.class, () -> parse("{\"type\":\"await\",\"on\":\"coffee\"}"));
    }

    @Test
    void readsFromFile() throws Exception {
        Path file = tmp.resolve("trace.ndjson");
        Files.writeString(file, "{\"type\":\"delay\",\"ms\":5}\n");
        assertEquals(1, TraceReader.read(file).size());
    }
}
