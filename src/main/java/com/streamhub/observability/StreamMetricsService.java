package com.streamhub.observability;

import com.streamhub.domain.enums.SchedulerState;
import com.streamhub.event.SseBroadcastEvent;
import com.streamhub.market.SummaryRefreshScheduler;
import com.streamhub.sse.RoomRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer meters for the broker and the stock cache.
 * <ul>
 *   <li><b>sse.rooms</b>, <b>sse.connections</b>, <b>sse.buffered.events</b> (gauges)</li>
 *   <li><b>sse.events.broadcast</b> (counter)</li>
 *   <li><b>sse.admissions.rejected</b> (counter)</li>
 *   <li><b>stock.cache.hits</b>, <b>stock.cache.misses</b> (counters)</li>
 *   <li><b>market.provider.failures</b> (counter)</li>
 *   <li><b>market.summary.scheduler.active</b> (gauge 0/1)</li>
 * </ul>
 *
 * <p>Gauges are evaluated by Micrometer at scrape time.
 */
@Service
public class StreamMetricsService {

    private final Counter eventsBroadcastCounter;
    private final Counter admissionsRejectedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter providerFailureCounter;

    public StreamMetricsService(
            MeterRegistry meterRegistry, RoomRegistry roomRegistry, SummaryRefreshScheduler summaryRefreshScheduler) {
        this.eventsBroadcastCounter = Counter.builder("sse.events.broadcast")
                .description("Events appended to room buffers")
                .register(meterRegistry);

        this.admissionsRejectedCounter = Counter.builder("sse.admissions.rejected")
                .description("Subscriptions rejected because the room was full")
                .register(meterRegistry);

        this.cacheHitCounter = Counter.builder("stock.cache.hits")
                .description("Stock reads served from cache")
                .register(meterRegistry);

        this.cacheMissCounter = Counter.builder("stock.cache.misses")
                .description("Stock reads that went to the provider")
                .register(meterRegistry);

        this.providerFailureCounter = Counter.builder("market.provider.failures")
                .description("Failed market data provider calls")
                .register(meterRegistry);

        meterRegistry.gauge("sse.rooms", roomRegistry, registry -> registry.getStreamStats().rooms());
        meterRegistry.gauge("sse.connections", roomRegistry, registry -> registry.getStreamStats().connections());
        meterRegistry.gauge(
                "sse.buffered.events", roomRegistry, registry -> registry.getStreamStats().totalBufferedEvents());
        meterRegistry.gauge(
                "market.summary.scheduler.active",
                summaryRefreshScheduler,
                scheduler -> scheduler.getState() == SchedulerState.REFRESHING ? 1.0 : 0.0);
    }

    @EventListener
    @Order(20)
    public void onBroadcast(SseBroadcastEvent event) {
        eventsBroadcastCounter.increment();
    }

    public void recordAdmissionRejected() {
        admissionsRejectedCounter.increment();
    }

    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    public void recordProviderFailure() {
        providerFailureCounter.increment();
    }
}
