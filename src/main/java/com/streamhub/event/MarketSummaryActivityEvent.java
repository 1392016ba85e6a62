package com.streamhub.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published whenever the market summary is read or refreshed. The refresh scheduler reacts by
 * making sure its periodic task is running.
 */
public class MarketSummaryActivityEvent extends ApplicationEvent {

    private final boolean readerActivity;

    public MarketSummaryActivityEvent(Object source, boolean readerActivity) {
        super(source);
        this.readerActivity = readerActivity;
    }

    /** True for a client read, false for a refresh. */
    public boolean isReaderActivity() {
        return readerActivity;
    }
}
