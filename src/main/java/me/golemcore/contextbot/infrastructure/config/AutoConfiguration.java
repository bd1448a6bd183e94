package me.golemcore.contextbot.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.contextbot.domain.model.RuntimeSettings;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core beans of the bot and the startup summary.
 *
 * <p>
 * Provides:
 * <ul>
 * <li>{@link RuntimeSettings} - validated process-wide settings</li>
 * <li>the event worker pool and the deadline scheduler</li>
 * <li>shared {@link Clock} and {@link ObjectMapper}</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public RuntimeSettings runtimeSettings(PromptLoader promptLoader) {
        return RuntimeSettingsFactory.create(properties, promptLoader.load(properties.getPrompts()));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService eventExecutor(RuntimeSettings runtimeSettings) {
        AtomicInteger counter = new AtomicInteger();
        int threads = runtimeSettings.eventWorkerThreads();
        // Bounded queue: once full, submissions are rejected and the user is told to retry
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(runtimeSettings.eventQueueCapacity()), r -> {
                    Thread t = new Thread(r, "event-worker-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService deadlineScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "event-deadline");
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore ContextBot '{}' starting...", properties.getName());
        log.info("QA service: {}", properties.getQa().getUrl());
        log.info("Room config database: {}", properties.getStorage().getDatabasePath());
    }
}
