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
import lombok.Data;

/**
 * Raw message as delivered by the chat platform's history API, before name
 * resolution.
 */
@Data
@Builder
public class HistoryMessage {

    private String id;
    private String userId;
    private String text;
    private String timestamp;
    private String threadRef;
    private boolean botMessage;
    private String subtype; // join, leave, channel_topic, ...

    /**
     * Checks if this message was written by a person and carries text worth
     * sending as context.
     */
    public boolean isConversational() {
        return !botMessage && subtype == null && text != null && !text.isBlank();
    }
}
