package com.streamhub.api.stream;

import com.streamhub.config.StreamHubProperties;
import com.streamhub.domain.model.SseEvent;
import com.streamhub.event.ConnectionRemovalReason;
import com.streamhub.event.ConnectionRemovedEvent;
import com.streamhub.event.SseBroadcastEvent;
import com.streamhub.exception.AdmissionRejectedException;
import com.streamhub.exception.ResourceNotFoundException;
import com.streamhub.observability.StreamMetricsService;
import com.streamhub.sse.RoomRegistry;
import com.streamhub.sse.SseEventFormatter;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/**
 * Open text/event-stream responses, keyed by connection id.
 *
 * <p>Broadcasts are handed over synchronously while the broadcasting thread still holds the
 * room monitor, so they queue in id order; the actual writes happen on the event executor.
 * A stream whose write fails or times out is dropped and its connection removed from the room.
 * Open streams get a periodic keepalive comment, and each one that goes through refreshes the
 * connection's activity so the idle sweep leaves listening clients alone.
 */
@Component
public class SseStreamRegistry {

    private static final Logger log = LoggerFactory.getLogger(SseStreamRegistry.class);

    private final Map<String, StreamHandle> streams = new ConcurrentHashMap<>();

    private final RoomRegistry roomRegistry;
    private final SseEventFormatter sseEventFormatter;
    private final StreamMetricsService streamMetricsService;
    private final StreamHubProperties properties;
    private final Executor eventExecutor;

    public SseStreamRegistry(
            RoomRegistry roomRegistry,
            SseEventFormatter sseEventFormatter,
            StreamMetricsService streamMetricsService,
            StreamHubProperties properties,
            @Qualifier("eventExecutor") Executor eventExecutor) {
        this.roomRegistry = roomRegistry;
        this.sseEventFormatter = sseEventFormatter;
        this.streamMetricsService = streamMetricsService;
        this.properties = properties;
        this.eventExecutor = eventExecutor;
    }

    /**
     * Opens a stream for a connection.
     *
     * <p>The stream is registered before {@code admission} runs so that events broadcast during
     * the join are queued rather than lost. If admission throws, the stream is discarded and the
     * exception propagates to the caller.
     *
     * @param admission attaches the connection to its room and returns the events to replay
     */
    public ResponseBodyEmitter open(String connectionId, Supplier<List<SseEvent>> admission) {
        ResponseBodyEmitter emitter =
                new ResponseBodyEmitter(properties.getSse().getEmitterTimeout().toMillis());
        StreamHandle handle = new StreamHandle(connectionId, emitter, sseEventFormatter);

        StreamHandle previous = streams.put(connectionId, handle);
        if (previous != null) {
            // Same connection id reconnecting: the new stream takes over
            previous.complete();
        }

        List<SseEvent> replay;
        try {
            replay = admission.get();
        } catch (AdmissionRejectedException e) {
            streams.remove(connectionId, handle);
            streamMetricsService.recordAdmissionRejected();
            throw e;
        } catch (RuntimeException e) {
            streams.remove(connectionId, handle);
            throw e;
        }

        emitter.onCompletion(() -> release(handle, null));
        emitter.onTimeout(() -> release(handle, "timeout"));
        emitter.onError(error -> release(handle, error.getMessage()));

        try {
            handle.start(properties.getSse().getRetryHintMs(), replay);
        } catch (IOException e) {
            log.warn("Stream {} failed during replay: {}", connectionId, e.getMessage());
            release(handle, e.getMessage());
            emitter.completeWithError(e);
        }
        log.debug("Stream opened for {} ({} replayed)", connectionId, replay.size());
        return emitter;
    }

    @EventListener
    public void onBroadcast(SseBroadcastEvent event) {
        for (String connectionId : event.getConnectionIds()) {
            StreamHandle handle = streams.get(connectionId);
            if (handle == null) {
                continue;
            }
            handle.enqueue(event.getEvent());
            eventExecutor.execute(() -> drain(handle));
        }
    }

    @EventListener
    public void onConnectionRemoved(ConnectionRemovedEvent event) {
        StreamHandle handle = streams.remove(event.getConnectionId());
        if (handle != null) {
            handle.complete();
            log.debug("Closed stream of removed connection {} ({})", event.getConnectionId(), event.getReason());
        }
    }

    @Scheduled(
            fixedRateString = "${streamhub.sse.keepalive-interval-ms:30000}",
            initialDelayString = "${streamhub.sse.keepalive-interval-ms:30000}")
    public void sendKeepAlives() {
        for (StreamHandle handle : streams.values()) {
            eventExecutor.execute(() -> keepAlive(handle));
        }
    }

    public boolean isOpen(String connectionId) {
        return streams.containsKey(connectionId);
    }

    public int getOpenStreamCount() {
        return streams.size();
    }

    private void drain(StreamHandle handle) {
        try {
            handle.drain();
        } catch (IOException | IllegalStateException e) {
            log.warn("Push to {} failed, dropping stream: {}", handle.getConnectionId(), e.getMessage());
            release(handle, e.getMessage());
            handle.complete();
        }
    }

    private void keepAlive(StreamHandle handle) {
        try {
            if (handle.keepAlive()) {
                roomRegistry.touchConnection(handle.getConnectionId());
            }
        } catch (IOException | IllegalStateException e) {
            log.warn("Keepalive to {} failed, dropping stream: {}", handle.getConnectionId(), e.getMessage());
            release(handle, e.getMessage());
            handle.complete();
        } catch (ResourceNotFoundException e) {
            log.debug("Keepalive for {} after its connection was removed", handle.getConnectionId());
        }
    }

    /**
     * Forgets the stream and, if it is still the current one for its connection, removes the
     * connection from its room.
     */
    private void release(StreamHandle handle, String reason) {
        if (!streams.remove(handle.getConnectionId(), handle)) {
            return;
        }
        if (reason != null) {
            log.debug("Stream {} closed: {}", handle.getConnectionId(), reason);
        }
        try {
            roomRegistry.removeConnection(handle.getConnectionId(), ConnectionRemovalReason.DISCONNECTED);
        } catch (ResourceNotFoundException e) {
            log.debug("Connection {} already removed", handle.getConnectionId());
        }
    }
}
