package com.alterante.nearby.engine.replay;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One line of a recorded engine trace, as read from NDJSON.
 *
 * <pre>
 * {"type":"endpoint","id":"dev1","name":"Pixel 7","address":"192.168.1.20","port":41234}
 * {"type":"event","id":"t1","direction":"inbound","state":"WAITING_FOR_USER_CONSENT","device":"Pixel 7","files":["a.jpg"],"total":2048,"pin":"1234"}
 * {"type":"delay","ms":250}
 * {"type":"await","on":"action","timeoutMs":5000}
 * {"type":"visibility","value":"INVISIBLE"}
 * </pre>
 *
 * Only the fields relevant to the record type are read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TraceRecord(
        @JsonProperty("type") String type,
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("address") String address,
        @JsonProperty("port") Integer port,
        @JsonProperty("present") Boolean present,
        @JsonProperty("direction") String direction,
        @JsonProperty("state") String state,
        @JsonProperty("device") String device,
        @JsonProperty("kind") String kind,
        @JsonProperty("files") List<String> files,
        @JsonProperty("total") Long total,
        @JsonProperty("ack") Long ack,
        @JsonProperty("pin") String pin,
        @JsonProperty("preview") String preview,
        @JsonProperty("text") String text,
        @JsonProperty("ms") Long ms,
        @JsonProperty("on") String on,
        @JsonProperty("timeoutMs") Long timeoutMs,
        @JsonProperty("value") String value) {
}
