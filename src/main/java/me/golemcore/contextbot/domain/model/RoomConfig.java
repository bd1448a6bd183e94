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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-room bot settings: target assistants, prompt override and context
 * window size.
 *
 * <p>
 * Instances are immutable snapshots. Every update produces a new instance that
 * replaces the stored row as a whole, so readers never observe a partially
 * applied change. A config that was never written has {@code null}
 * timestamps.
 */
@Builder(toBuilder = true)
public record RoomConfig(
        String roomId,
        List<String> assistants,
        String customPrompt,
        int contextSize,
        Instant createdAt,
        Instant updatedAt) {

    public RoomConfig {
        assistants = assistants == null ? List.of() : List.copyOf(assistants);
    }

    public Optional<String> findCustomPrompt() {
        return Optional.ofNullable(customPrompt);
    }

    public boolean hasAssistants() {
        return !assistants.isEmpty();
    }

    /**
     * Checks whether this config was loaded from a stored row rather than
     * synthesized from defaults.
     */
    public boolean isPersisted() {
        return updatedAt != null;
    }
}
