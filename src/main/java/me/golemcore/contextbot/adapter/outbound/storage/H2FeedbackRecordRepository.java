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
import me.golemcore.contextbot.domain.model.FeedbackRecord;
import me.golemcore.contextbot.domain.model.FeedbackVerdict;
import me.golemcore.contextbot.port.outbound.FeedbackRecordPort;
import org.springframework.context.annotation.DependsOn;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * {@link FeedbackRecordPort} backed by the {@code feedback_records} table. The
 * composite primary key keeps one vote per answer and user.
 */
@Repository
@DependsOn("databaseSchemaInitializer")
public class H2FeedbackRecordRepository implements FeedbackRecordPort {

    private static final String SELECT_COLUMNS = "SELECT answer_id, user_id, verdict, recorded_at "
            + "FROM feedback_records";

    private static final String MERGE = "MERGE INTO feedback_records (answer_id, user_id, verdict, recorded_at) "
            + "KEY (answer_id, user_id) VALUES (?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;

    public H2FeedbackRecordRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<FeedbackRecord> find(String answerId, String userId) {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + " WHERE answer_id = ? AND user_id = ?", this::mapRow,
                    answerId, userId).stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to read feedback on answer " + answerId, e);
        }
    }

    @Override
    public void save(FeedbackRecord record) {
        try {
            jdbcTemplate.update(MERGE, record.answerId(), record.userId(), record.verdict().name(),
                    StorageTimestamps.toColumn(record.recordedAt()));
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to save feedback on answer " + record.answerId(), e);
        }
    }

    @Override
    public List<FeedbackRecord> findByAnswer(String answerId) {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + " WHERE answer_id = ? ORDER BY user_id", this::mapRow,
                    answerId);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to read feedback on answer " + answerId, e);
        }
    }

    private FeedbackRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new FeedbackRecord(
                rs.getString("answer_id"),
                rs.getString("user_id"),
                FeedbackVerdict.valueOf(rs.getString("verdict")),
                StorageTimestamps.fromColumn(rs, "recorded_at"));
    }
}
