package com.streamhub.sse;

/** Totals across all rooms. */
public record StreamStats(int rooms, int connections, long totalBufferedEvents) {}
