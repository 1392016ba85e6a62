package com.streamhub.sse;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * JSON payloads of the peer signaling events.
 */
@Component
public class SignalingPayloads {

    private final ObjectMapper objectMapper;

    public SignalingPayloads(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String peerJoined(String peerId, Map<String, String> meta) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("peerId", peerId);
        payload.put("meta", meta != null ? meta : Map.of());
        return objectMapper.writeValueAsString(payload);
    }

    public String peerLeft(String peerId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("peerId", peerId);
        return objectMapper.writeValueAsString(payload);
    }

    /** Offer and answer share the same shape. */
    public String sessionDescription(String from, String to, String sdp) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", from);
        payload.put("to", to);
        payload.put("sdp", sdp);
        return objectMapper.writeValueAsString(payload);
    }

    public String iceCandidate(String from, String to, Map<String, String> candidate) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", from);
        payload.put("to", to);
        payload.put("candidate", candidate != null ? candidate : Map.of());
        return objectMapper.writeValueAsString(payload);
    }

    public String roomState(List<String> peers, Map<String, String> meta) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("peers", peers);
        payload.put("meta", meta != null ? meta : Map.of());
        return objectMapper.writeValueAsString(payload);
    }
}
