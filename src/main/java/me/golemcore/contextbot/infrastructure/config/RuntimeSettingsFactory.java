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
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Validates {@link BotProperties} into {@link RuntimeSettings}. Out-of-range
 * values are corrected rather than rejected, with a warning per correction,
 * so a misconfigured environment still starts.
 */
@Slf4j
public final class RuntimeSettingsFactory {

    static final int DEFAULT_CONTEXT_MIN = 50;
    static final int DEFAULT_CONTEXT_MAX = 250;
    static final int CONTEXT_MIN_CEILING = 1000;
    static final int CONTEXT_MAX_CEILING = 10_000;
    static final int DEFAULT_TIMEOUT_SECONDS = 500;
    static final int TIMEOUT_CEILING_SECONDS = 3600;
    static final int DEADLINE_SLACK_SECONDS = 30;

    private RuntimeSettingsFactory() {
    }

    public static RuntimeSettings create(BotProperties properties, PromptLoader.Prompts prompts) {
        BotProperties.ContextProperties context = properties.getContext();
        BotProperties.QaProperties qa = properties.getQa();

        int min = context.getMin();
        if (min <= 0) {
            log.warn("[Config] CONTEXT_MIN {} is not positive, using {}", min, DEFAULT_CONTEXT_MIN);
            min = DEFAULT_CONTEXT_MIN;
        } else if (min > CONTEXT_MIN_CEILING) {
            log.warn("[Config] CONTEXT_MIN {} is too large, using {}", min, CONTEXT_MIN_CEILING);
            min = CONTEXT_MIN_CEILING;
        }

        int max = context.getMax();
        if (max <= 0) {
            log.warn("[Config] CONTEXT_MAX {} is not positive, using {}", max, DEFAULT_CONTEXT_MAX);
            max = DEFAULT_CONTEXT_MAX;
        } else if (max > CONTEXT_MAX_CEILING) {
            log.warn("[Config] CONTEXT_MAX {} is too large, using {}", max, CONTEXT_MAX_CEILING);
            max = CONTEXT_MAX_CEILING;
        }
        if (max < min) {
            log.warn("[Config] CONTEXT_MAX {} is below CONTEXT_MIN {}, using {}", max, min, min);
            max = min;
        }

        int hardMax = context.getHardMax();
        if (hardMax < max) {
            log.warn("[Config] Extraction hard max {} is below CONTEXT_MAX {}, using {}", hardMax, max, max);
            hardMax = max;
        }

        int timeoutSeconds = qa.getTimeoutSeconds();
        if (timeoutSeconds <= 0) {
            log.warn("[Config] QA_TIMEOUT_SECONDS {} is not positive, using {}", timeoutSeconds,
                    DEFAULT_TIMEOUT_SECONDS);
            timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        } else if (timeoutSeconds > TIMEOUT_CEILING_SECONDS) {
            log.warn("[Config] QA_TIMEOUT_SECONDS {} is too large, using {}", timeoutSeconds,
                    TIMEOUT_CEILING_SECONDS);
            timeoutSeconds = TIMEOUT_CEILING_SECONDS;
        }

        int deadlineSeconds = properties.getEvents().getDeadlineSeconds();
        if (deadlineSeconds <= 0) {
            deadlineSeconds = timeoutSeconds + DEADLINE_SLACK_SECONDS;
        }

        return RuntimeSettings.builder()
                .botName(blankToNull(properties.getName()) != null ? properties.getName().trim() : "Clementine")
                .contextMin(min)
                .contextMax(max)
                .contextHardMax(hardMax)
                .maxHistoryPages(Math.max(1, context.getMaxPages()))
                .qaTimeout(Duration.ofSeconds(timeoutSeconds))
                .modelOverride(blankToNull(qa.getModelOverride()))
                .defaultAssistants(parseList(properties.getDefaults().getAssistants()))
                .defaultPrompt(properties.getDefaults().getPrompt())
                .contextAnalysisPrompt(prompts.contextSystemPrompt())
                .userPrompt(prompts.userPrompt())
                .maxPayloadBytes(Math.max(1, qa.getMaxPayloadBytes()))
                .maxTrackedAnswers(Math.max(1, properties.getFeedback().getMaxTrackedAnswers()))
                .eventDeadline(Duration.ofSeconds(deadlineSeconds))
                .eventWorkerThreads(Math.max(1, properties.getEvents().getWorkerThreads()))
                .eventQueueCapacity(Math.max(1, properties.getEvents().getQueueCapacity()))
                .build();
    }

    static List<String> parseList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .distinct()
                .toList();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
