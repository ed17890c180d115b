package com.example.onetwoone.config;

import com.example.onetwoone.service.LoggingRoomEventSink;
import com.example.onetwoone.service.RoomEventSink;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Core beans: timers, clock, randomness and the default room event sink. */
@Configuration
@EnableConfigurationProperties({ChatProperties.class, DebateProperties.class})
public class ChatConfig {

    /** Backs every segment timer and debate ticker; shut down with the context. */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService roomTimers() {
        return Executors.newScheduledThreadPool(2, new ThreadFactory() {
            private final AtomicInteger c = new AtomicInteger();
            @Override public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "room-timer-" + c.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random debateRandom() {
        return new Random();
    }

    @Bean
    @ConditionalOnMissingBean(RoomEventSink.class)
    public RoomEventSink roomEventSink() {
        return new LoggingRoomEventSink();
    }
}
