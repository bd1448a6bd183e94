package me.golemcore.contextbot.adapter.outbound.storage;

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

import me.golemcore.contextbot.domain.exception.StorageUnavailableException;
import me.golemcore.contextbot.domain.model.RoomConfig;
import me.golemcore.contextbot.port.outbound.RoomConfigPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.DependsOn;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link RoomConfigPort} backed by the {@code room_configs} table of the
 * embedded H2 database. The assistant list is stored as a JSON array.
 *
 * <p>
 * A save is a single {@code MERGE} statement, so a row is always replaced as
 * a whole.
 */
@Repository
@DependsOn("databaseSchemaInitializer")
@Slf4j
public class H2RoomConfigRepository implements RoomConfigPort {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private static final String SELECT_COLUMNS = "SELECT room_id, assistant_list, system_prompt, context_size, "
            + "created_at, updated_at FROM room_configs";

    private static final String MERGE = "MERGE INTO room_configs "
            + "(room_id, assistant_list, system_prompt, context_size, created_at, updated_at) "
            + "KEY (room_id) VALUES (?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public H2RoomConfigRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<RoomConfig> findById(String roomId) {
        try {
            List<RoomConfig> rows = jdbcTemplate.query(SELECT_COLUMNS + " WHERE room_id = ?", this::mapRow, roomId);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to read configuration of room " + roomId, e);
        }
    }

    @Override
    public void save(RoomConfig config) {
        Instant updatedAt = config.updatedAt() != null ? config.updatedAt() : Instant.now();
        Instant createdAt = config.createdAt() != null ? config.createdAt() : updatedAt;
        try {
            jdbcTemplate.update(MERGE,
                    config.roomId(),
                    writeAssistants(config.assistants()),
                    config.customPrompt(),
                    config.contextSize(),
                    StorageTimestamps.toColumn(createdAt),
                    StorageTimestamps.toColumn(updatedAt));
            log.debug("[Storage] Saved room config {}", config.roomId());
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to save configuration of room " + config.roomId(), e);
        }
    }

    @Override
    public List<RoomConfig> findAll() {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY room_id", this::mapRow);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to list room configurations", e);
        }
    }

    private RoomConfig mapRow(ResultSet rs, int rowNum) throws SQLException {
        String roomId = rs.getString("room_id");
        return RoomConfig.builder()
                .roomId(roomId)
                .assistants(readAssistants(roomId, rs.getString("assistant_list")))
                .customPrompt(rs.getString("system_prompt"))
                .contextSize(rs.getInt("context_size"))
                .createdAt(StorageTimestamps.fromColumn(rs, "created_at"))
                .updatedAt(StorageTimestamps.fromColumn(rs, "updated_at"))
                .build();
    }

    private String writeAssistants(List<String> assistants) {
        try {
            return objectMapper.writeValueAsString(assistants);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize assistant list", e);
        }
    }

    private List<String> readAssistants(String roomId, String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("[Storage] Unreadable assistant list for room {}, treating as empty: {}", roomId,
                    e.getOriginalMessage());
            return List.of();
        }
    }
}
