package com.streamhub.api.stream;

import com.streamhub.domain.model.SseEvent;
import com.streamhub.sse.SseEventFormatter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/**
 * One open event stream.
 *
 * <p>Live events are queued in id order as they are broadcast. Until the replay has been
 * written they stay queued; afterwards {@link #drain()} writes them, skipping any id already
 * sent. That way an event broadcast while the subscriber was joining is written exactly once,
 * whether it reached the stream through replay or live.
 */
class StreamHandle {

    private static final MediaType FRAME_TYPE = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final String connectionId;
    private final ResponseBodyEmitter emitter;
    private final SseEventFormatter formatter;
    private final Queue<SseEvent> pending = new ConcurrentLinkedQueue<>();

    private boolean started;
    private boolean closed;
    private long lastSentId;

    StreamHandle(String connectionId, ResponseBodyEmitter emitter, SseEventFormatter formatter) {
        this.connectionId = connectionId;
        this.emitter = emitter;
        this.formatter = formatter;
    }

    String getConnectionId() {
        return connectionId;
    }

    void enqueue(SseEvent event) {
        pending.add(event);
    }

    /**
     * Writes the retry hint and the replayed events, then whatever was queued meanwhile.
     */
    synchronized void start(long retryHintMs, List<SseEvent> replay) throws IOException {
        write(formatter.retryHint(retryHintMs));
        for (SseEvent event : replay) {
            send(event);
        }
        started = true;
        drainQueued();
    }

    synchronized void drain() throws IOException {
        if (started) {
            drainQueued();
        }
    }

    /**
     * @return false if the stream has not started or is already closed
     */
    synchronized boolean keepAlive() throws IOException {
        if (!started || closed) {
            return false;
        }
        write(formatter.comment("keepalive"));
        return true;
    }

    synchronized void complete() {
        if (!closed) {
            closed = true;
            emitter.complete();
        }
    }

    private void drainQueued() throws IOException {
        SseEvent event;
        while (!closed && (event = pending.poll()) != null) {
            send(event);
        }
    }

    private void send(SseEvent event) throws IOException {
        if (event.getId() <= lastSentId) {
            return;
        }
        write(formatter.format(event));
        lastSentId = event.getId();
    }

    private void write(String frame) throws IOException {
        if (closed) {
            return;
        }
        emitter.send(frame, FRAME_TYPE);
    }
}
