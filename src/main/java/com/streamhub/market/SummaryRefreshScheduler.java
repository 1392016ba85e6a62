package com.streamhub.market;

import com.streamhub.config.StreamHubProperties;
import com.streamhub.domain.enums.SchedulerState;
import com.streamhub.event.MarketSummaryActivityEvent;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Self-limiting periodic refresh of the market summary.
 *
 * <p>IDLE until the summary is read or refreshed, then REFRESHING: every refresh interval the
 * task refreshes the summary if a reader showed up within the activity window, otherwise it
 * cancels itself and goes back to IDLE. A failed refresh is logged and retried on the next tick.
 */
@Service
public class SummaryRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(SummaryRefreshScheduler.class);

    private final MarketSummaryService marketSummaryService;
    private final TaskScheduler taskScheduler;
    private final StreamHubProperties properties;
    private final Clock clock;

    private ScheduledFuture<?> refreshTask;

    private volatile Instant lastTickAt;
    private volatile String lastError;

    public SummaryRefreshScheduler(
            MarketSummaryService marketSummaryService,
            TaskScheduler taskScheduler,
            StreamHubProperties properties,
            Clock clock) {
        this.marketSummaryService = marketSummaryService;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener
    public void onSummaryActivity(MarketSummaryActivityEvent event) {
        ensureRunning();
    }

    /**
     * Starts the periodic task unless it is already running.
     *
     * @return true if a task was started
     */
    public synchronized boolean ensureRunning() {
        if (refreshTask != null && !refreshTask.isDone()) {
            return false;
        }
        Duration interval = properties.getSummary().getRefreshInterval();
        refreshTask = taskScheduler.scheduleAtFixedRate(this::tick, clock.instant().plus(interval), interval);
        log.info("Market summary refresh started (every {})", interval);
        return true;
    }

    /**
     * One scheduled run.
     */
    public void tick() {
        Instant now = clock.instant();
        lastTickAt = now;
        synchronized (this) {
            // Checked under the monitor so a concurrent ensureRunning waits for the stop to finish
            if (!marketSummaryService.hasRecentActivity(now)) {
                log.info(
                        "No market summary readers within {}, stopping refresh",
                        properties.getSummary().getActivityWindow());
                cancelTask();
                return;
            }
        }

        try {
            marketSummaryService.refreshSummaryViaProvider();
            lastError = null;
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            log.warn("Scheduled market summary refresh failed: {}", e.getMessage());
        }
    }

    /**
     * Cancels the periodic task.
     *
     * @return false if it was not running
     */
    public synchronized boolean stop() {
        if (refreshTask == null) {
            return false;
        }
        cancelTask();
        log.info("Market summary refresh stopped");
        return true;
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public synchronized SchedulerState getState() {
        return refreshTask != null && !refreshTask.isDone() ? SchedulerState.REFRESHING : SchedulerState.IDLE;
    }

    public Optional<Instant> getLastTickAt() {
        return Optional.ofNullable(lastTickAt);
    }

    public Optional<String> getLastError() {
        return Optional.ofNullable(lastError);
    }

    private void cancelTask() {
        if (refreshTask != null) {
            refreshTask.cancel(false);
            refreshTask = null;
        }
    }
}
