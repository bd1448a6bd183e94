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
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the bot's tables in the embedded database on startup. Safe to run
 * against an existing database.
 */
@Component
@Slf4j
public class DatabaseSchemaInitializer {

    static final String CREATE_ROOM_CONFIGS = """
            CREATE TABLE IF NOT EXISTS room_configs (
                room_id        VARCHAR(255) PRIMARY KEY,
                assistant_list CLOB,
                system_prompt  CLOB,
                context_size   INT NOT NULL,
                created_at     TIMESTAMP WITH TIME ZONE NOT NULL,
                updated_at     TIMESTAMP WITH TIME ZONE NOT NULL
            )""";

    static final String CREATE_FEEDBACK_RECORDS = """
            CREATE TABLE IF NOT EXISTS feedback_records (
                answer_id   VARCHAR(255) NOT NULL,
                user_id     VARCHAR(255) NOT NULL,
                verdict     VARCHAR(16) NOT NULL,
                recorded_at TIMESTAMP WITH TIME ZONE NOT NULL,
                PRIMARY KEY (answer_id, user_id)
            )""";

    private final JdbcTemplate jdbcTemplate;

    public DatabaseSchemaInitializer(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @PostConstruct
    public void initialize() {
        try {
            jdbcTemplate.execute(CREATE_ROOM_CONFIGS);
            jdbcTemplate.execute(CREATE_FEEDBACK_RECORDS);
            log.info("[Storage] Schema ready");
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to initialize database schema", e);
        }
    }
}
