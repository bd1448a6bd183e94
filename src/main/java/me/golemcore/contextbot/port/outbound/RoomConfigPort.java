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

import me.golemcore.contextbot.domain.model.RoomConfig;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of per-room configuration, one row per room id. Failures
 * surface as {@link me.golemcore.contextbot.domain.exception.StorageUnavailableException}.
 */
public interface RoomConfigPort {

    Optional<RoomConfig> findById(String roomId);

    /**
     * Inserts or replaces the whole row in a single statement.
     */
    void save(RoomConfig config);

    List<RoomConfig> findAll();
}
