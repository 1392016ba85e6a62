package com.streamhub.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for stream fan-out. Broadcast events are written to open emitters on this pool
 * so a slow client never holds up the request that produced the event.
 *
 * <p>Tasks are submitted while the broadcaster holds the room monitor, so a saturated pool
 * must not run the write on the caller. A rejected drain is dropped instead: the event stays
 * queued on its stream and goes out with that stream's next drain.
 */
@Configuration
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Value("${streamhub.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${streamhub.async.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${streamhub.async.queue-capacity:1000}")
    private int queueCapacity;

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("fanout-");
        executor.setRejectedExecutionHandler((task, pool) ->
                log.warn("Fan-out queue full ({} pending), deferring a stream drain", pool.getQueue().size()));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
