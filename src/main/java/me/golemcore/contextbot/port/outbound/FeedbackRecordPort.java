package me.golemcore.contextbot.port.outbound;

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

import me.golemcore.contextbot.domain.model.FeedbackRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of feedback votes keyed by {@code (answerId, userId)}.
 */
public interface FeedbackRecordPort {

    Optional<FeedbackRecord> find(String answerId, String userId);

    /**
     * Inserts the vote, or overwrites the existing vote of the same pair.
     */
    void save(FeedbackRecord record);

    List<FeedbackRecord> findByAnswer(String answerId);
}
