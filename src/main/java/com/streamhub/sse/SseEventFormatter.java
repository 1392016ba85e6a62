package com.streamhub.sse;

import com.streamhub.domain.model.SseEvent;
import org.springframework.stereotype.Component;

/**
 * Renders events in text/event-stream framing.
 *
 * <pre>
 *   id: 42
 *   event: peer-joined
 *   data: {"peerId":"alice","meta":{}}
 *   (blank line)
 * </pre>
 */
@Component
public class SseEventFormatter {

    public String format(SseEvent event) {
        StringBuilder frame = new StringBuilder(64 + (event.getData() != null ? event.getData().length() : 0));
        frame.append("id: ").append(event.getId()).append('\n');
        frame.append("event: ").append(event.getType().wireName()).append('\n');
        String data = event.getData() != null ? event.getData() : "";
        // A payload line break would end the field early, so each line gets its own data field
        for (String line : data.split("\r\n|\r|\n", -1)) {
            frame.append("data: ").append(line).append('\n');
        }
        frame.append('\n');
        return frame.toString();
    }

    public String retryHint(long retryMs) {
        return "retry: " + retryMs + "\n\n";
    }

    /** Comment line, ignored by EventSource clients. */
    public String comment(String text) {
        return ": " + text + "\n\n";
    }
}
