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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the bot, bound from application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix, with one
 * nested class per subsystem:
 * <ul>
 * <li>{@link DefaultsProperties} - settings of rooms without stored
 * configuration</li>
 * <li>{@link ContextProperties} - context window bounds and pagination</li>
 * <li>{@link QaProperties} - QA service endpoint, credentials and limits</li>
 * <li>{@link StorageProperties} - room configuration database</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * </ul>
 *
 * <p>
 * Values are raw as configured. Components receive the validated
 * {@link me.golemcore.contextbot.domain.model.RuntimeSettings} built by
 * {@link RuntimeSettingsFactory} instead of reading this class.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private String name = "Clementine";
    private DefaultsProperties defaults = new DefaultsProperties();
    private ContextProperties context = new ContextProperties();
    private QaProperties qa = new QaProperties();
    private PromptsProperties prompts = new PromptsProperties();
    private FeedbackProperties feedback = new FeedbackProperties();
    private EventsProperties events = new EventsProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class DefaultsProperties {
        private String assistants = ""; // comma-separated
        private String prompt = "You are a helpful assistant.";
    }

    @Data
    public static class ContextProperties {
        private int min = 50;
        private int max = 250;
        private int hardMax = 1000;
        private int maxPages = 20;
    }

    @Data
    public static class QaProperties {
        private String url = "http://localhost:8000";
        private String apiToken;
        private int timeoutSeconds = 500;
        private String modelOverride;
        private int maxPayloadBytes = 200_000;
    }

    @Data
    public static class PromptsProperties {
        private String contextSystemLocation = "classpath:prompts/context_analysis_system_prompt.txt";
        private String userLocation = "classpath:prompts/default_user_prompt.txt";
    }

    @Data
    public static class FeedbackProperties {
        private int maxTrackedAnswers = 10_000;
    }

    @Data
    public static class EventsProperties {
        private int deadlineSeconds = 0; // 0 = QA timeout + 30s
        private int workerThreads = 8;
        private int queueCapacity = 100;
    }

    @Data
    public static class StorageProperties {
        private String databasePath = "./data/room_configs";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
