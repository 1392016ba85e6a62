package com.streamhub.sse;

public record RoomStats(String roomId, int connections, int bufferedEvents) {}
