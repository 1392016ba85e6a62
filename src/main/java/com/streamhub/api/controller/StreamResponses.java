package com.streamhub.api.controller;

import java.util.UUID;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/**
 * Response wrapping shared by the stream endpoints.
 */
final class StreamResponses {

    static final String CONNECTION_ID_HEADER = "X-Connection-Id";
    static final String PEER_ID_HEADER = "X-Peer-Id";

    private StreamResponses() {}

    static String connectionIdOrNew(String connectionId) {
        return connectionId == null || connectionId.isBlank() ? UUID.randomUUID().toString() : connectionId;
    }

    static ResponseEntity<ResponseBodyEmitter> eventStream(
            ResponseBodyEmitter emitter, String connectionId, String peerId) {
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .cacheControl(CacheControl.noCache())
                .header(CONNECTION_ID_HEADER, connectionId)
                .header(PEER_ID_HEADER, peerId)
                // nginx buffers event streams otherwise
                .header("X-Accel-Buffering", "no")
                .body(emitter);
    }
}
