package com.streamhub.domain.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of events carried on a room stream.
 *
 * <p>The wire name is what goes into the {@code event:} line of the stream, lower-case and
 * hyphenated. Signaling kinds come first, domain kinds after.
 */
public enum SseEventType {
    PEER_JOINED,
    PEER_LEFT,
    OFFER,
    ANSWER,
    ICE_CANDIDATE,
    ROOM_STATE,
    PRICE_UPDATE,
    NEWS_UPDATE,
    MARKET_SUMMARY;

    public String wireName() {
        return name().toLowerCase().replace('_', '-');
    }

    public boolean isSignal() {
        return this == OFFER || this == ANSWER || this == ICE_CANDIDATE;
    }

    public static Optional<SseEventType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.wireName().equalsIgnoreCase(wireName.trim()))
                .findFirst();
    }
}
