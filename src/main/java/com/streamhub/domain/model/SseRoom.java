package com.streamhub.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named topic with its subscribed connection ids and a bounded buffer of recent events.
 *
 * <p>{@code connectionIds} keeps insertion order and never holds the same id twice.
 * {@code eventBuffer} is ordered oldest first and never grows beyond {@code maxBufferSize}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SseRoom {

    private String roomId;

    @Builder.Default
    private List<String> connectionIds = new ArrayList<>();

    @Builder.Default
    private List<SseEvent> eventBuffer = new ArrayList<>();

    private int maxBufferSize;

    private Instant createdAt;

    private Instant lastActivity;
}
