package com.molcollab.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Infrastructure beans for the room actors and the recorder/replay clock.
 */
@Configuration
public class CollaborationConfig {

    private static final Logger logger = LoggerFactory.getLogger(CollaborationConfig.class);

    /**
     * Single source of wall time for recording timestamps and replay playback.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Pool shared by all room mailboxes. Each room still runs its tasks one at a time.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService roomExecutor(CollaborationProperties properties) {
        int threads = Math.max(1, properties.getRooms().getActorThreads());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "room-actor-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        logger.info("Room actor pool started with {} threads", threads);
        return Executors.newFixedThreadPool(threads, threadFactory);
    }
}
