package me.golemcore.contextbot.domain.model;

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

import lombok.Builder;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Process-wide settings, validated once at startup and passed to every
 * component that needs them.
 */
@Builder
public record RuntimeSettings(
        String botName,
        int contextMin,
        int contextMax,
        int contextHardMax,
        int maxHistoryPages,
        Duration qaTimeout,
        String modelOverride,
        List<String> defaultAssistants,
        String defaultPrompt,
        String contextAnalysisPrompt,
        String userPrompt,
        int maxPayloadBytes,
        int maxTrackedAnswers,
        Duration eventDeadline,
        int eventWorkerThreads,
        int eventQueueCapacity) {

    public RuntimeSettings {
        defaultAssistants = defaultAssistants == null ? List.of() : List.copyOf(defaultAssistants);
    }

    public Optional<String> findModelOverride() {
        return Optional.ofNullable(modelOverride);
    }

    public int clampContextSize(int size) {
        return Math.max(contextMin, Math.min(contextMax, size));
    }

    public boolean isContextSizeInBounds(int size) {
        return size >= contextMin && size <= contextMax;
    }
}
