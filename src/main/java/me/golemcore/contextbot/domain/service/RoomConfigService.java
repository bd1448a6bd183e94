package me.golemcore.contextbot.domain.service;

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

import me.golemcore.contextbot.domain.exception.InvalidConfigurationException;
import me.golemcore.contextbot.domain.model.RoomConfig;
import me.golemcore.contextbot.domain.model.RoomConfigUpdate;
import me.golemcore.contextbot.domain.model.RoomConfigView;
import me.golemcore.contextbot.domain.model.RuntimeSettings;
import me.golemcore.contextbot.port.outbound.RoomConfigPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-room configuration store with validation and defaults.
 *
 * <p>
 * Reads of a room without a stored row return the process defaults and do not
 * create a row. Writes are read-merge-replace under a lock dedicated to the
 * room, so two updates of the same room never interleave while updates of
 * different rooms run in parallel. Readers take no lock: the row is replaced
 * by a single statement and every read returns a fresh snapshot.
 *
 * <p>
 * Storage failures propagate as
 * {@link me.golemcore.contextbot.domain.exception.StorageUnavailableException}
 * without retry.
 */
@Service
@Slf4j
public class RoomConfigService {

    static final int MAX_ASSISTANT_NAME_LENGTH = 100;
    static final int MAX_PROMPT_LENGTH = 5000;

    private final RoomConfigPort roomConfigPort;
    private final RuntimeSettings settings;
    private final Clock clock;
    private final Map<String, ReentrantLock> roomLocks = new ConcurrentHashMap<>();

    public RoomConfigService(RoomConfigPort roomConfigPort, RuntimeSettings settings, Clock clock) {
        this.roomConfigPort = roomConfigPort;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Returns the room's configuration, or the defaults if nothing was stored.
     */
    public RoomConfig get(String roomId) {
        requireRoomId(roomId);
        Optional<RoomConfig> stored = roomConfigPort.findById(roomId);
        if (stored.isPresent()) {
            log.debug("[RoomConfig] Using stored configuration for room {}", roomId);
            return normalizeStored(stored.get());
        }
        log.debug("[RoomConfig] Using default configuration for room {}", roomId);
        return defaults(roomId);
    }

    /**
     * Applies the fields present in {@code update} and stores the result.
     *
     * @throws InvalidConfigurationException
     *             if the update is empty or any field is invalid; nothing is
     *             written in that case
     */
    public RoomConfig upsert(String roomId, RoomConfigUpdate update) {
        requireRoomId(roomId);
        if (update == null || update.isEmpty()) {
            throw new InvalidConfigurationException("No configuration fields to update");
        }

        List<String> assistants = update.getAssistants() != null
                ? normalizeAssistants(update.getAssistants())
                : null;
        String prompt = update.getCustomPrompt() != null
                ? normalizePrompt(update.getCustomPrompt())
                : null;
        Integer contextSize = update.getContextSize();
        if (contextSize != null && !settings.isContextSizeInBounds(contextSize)) {
            throw new InvalidConfigurationException(String.format(
                    "Context size %d is outside the allowed range [%d-%d]",
                    contextSize, settings.contextMin(), settings.contextMax()));
        }

        ReentrantLock lock = roomLocks.computeIfAbsent(roomId, id -> new ReentrantLock());
        lock.lock();
        try {
            RoomConfig current = get(roomId);
            Instant now = clock.instant();
            RoomConfig.RoomConfigBuilder merged = current.toBuilder()
                    .createdAt(current.createdAt() != null ? current.createdAt() : now)
                    .updatedAt(nextUpdatedAt(current, now));
            if (assistants != null) {
                merged.assistants(assistants);
            }
            if (prompt != null) {
                merged.customPrompt(prompt.isEmpty() ? null : prompt);
            }
            if (contextSize != null) {
                merged.contextSize(contextSize);
            }

            RoomConfig result = merged.build();
            roomConfigPort.save(result);
            log.info("[RoomConfig] Saved configuration for room {} (assistants: {}, custom prompt: {}, context: {})",
                    roomId, result.assistants(), result.customPrompt() != null, result.contextSize());
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Overwrites the room's row with the defaults. The row itself is kept.
     */
    public RoomConfig resetToDefaults(String roomId) {
        requireRoomId(roomId);
        ReentrantLock lock = roomLocks.computeIfAbsent(roomId, id -> new ReentrantLock());
        lock.lock();
        try {
            Optional<RoomConfig> stored = roomConfigPort.findById(roomId);
            Instant now = clock.instant();
            RoomConfig reset = defaults(roomId).toBuilder()
                    .createdAt(stored.map(RoomConfig::createdAt).orElse(now))
                    .updatedAt(stored.map(config -> nextUpdatedAt(config, now)).orElse(now))
                    .build();
            roomConfigPort.save(reset);
            log.info("[RoomConfig] Reset room {} to defaults", roomId);
            return reset;
        } finally {
            lock.unlock();
        }
    }

    public RoomConfigView describe(String roomId) {
        RoomConfig config = get(roomId);
        return RoomConfigView.builder()
                .roomId(roomId)
                .assistants(config.assistants())
                .prompt(effectivePrompt(config))
                .customPrompt(config.customPrompt() != null)
                .contextSize(config.contextSize())
                .minContextSize(settings.contextMin())
                .maxContextSize(settings.contextMax())
                .stored(config.isPersisted())
                .build();
    }

    public List<RoomConfig> listAll() {
        return roomConfigPort.findAll().stream()
                .map(this::normalizeStored)
                .toList();
    }

    /**
     * Prompt sent with mention questions: the room's override, else the
     * default.
     */
    public String effectivePrompt(RoomConfig config) {
        return config.findCustomPrompt().orElse(settings.defaultPrompt());
    }

    private RoomConfig defaults(String roomId) {
        return RoomConfig.builder()
                .roomId(roomId)
                .assistants(settings.defaultAssistants())
                .contextSize(settings.contextMin())
                .build();
    }

    // Bounds may have changed since the row was written.
    private RoomConfig normalizeStored(RoomConfig stored) {
        int clamped = settings.clampContextSize(stored.contextSize());
        if (clamped == stored.contextSize()) {
            return stored;
        }
        log.warn("[RoomConfig] Stored context size {} for room {} is out of bounds [{}-{}], clamping to {}",
                stored.contextSize(), stored.roomId(), settings.contextMin(), settings.contextMax(), clamped);
        return stored.toBuilder().contextSize(clamped).build();
    }

    private Instant nextUpdatedAt(RoomConfig current, Instant now) {
        Instant previous = current.updatedAt();
        return previous != null && previous.isAfter(now) ? previous : now;
    }

    private List<String> normalizeAssistants(List<String> requested) {
        Set<String> unique = new LinkedHashSet<>();
        for (String assistant : requested) {
            String name = assistant == null ? "" : assistant.trim();
            if (name.isEmpty()) {
                throw new InvalidConfigurationException("Assistant names must not be blank");
            }
            if (name.length() > MAX_ASSISTANT_NAME_LENGTH) {
                throw new InvalidConfigurationException(String.format(
                        "Assistant name '%s...' exceeds %d characters",
                        name.substring(0, 20), MAX_ASSISTANT_NAME_LENGTH));
            }
            unique.add(name);
        }
        return new ArrayList<>(unique);
    }

    private String normalizePrompt(String requested) {
        String prompt = requested.trim();
        if (prompt.length() > MAX_PROMPT_LENGTH) {
            throw new InvalidConfigurationException(String.format(
                    "Prompt is %d characters long, the limit is %d", prompt.length(), MAX_PROMPT_LENGTH));
        }
        return prompt;
    }

    private static void requireRoomId(String roomId) {
        if (roomId == null || roomId.isBlank()) {
            throw new InvalidConfigurationException("Room id is required");
        }
    }
}
