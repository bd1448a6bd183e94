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
 * Event delivered by the chat transport.
 *
 * <p>
 * Reactions carry the reaction name and the id of the answer they were added
 * to; mentions and slash commands carry the question text.
 */
@Data
@Builder
public class InboundEvent {

    private InboundEventKind kind;
    private String roomId;
    private String userId;
    private String text;
    private String timestamp;
    private String threadRef;
    private String reaction;
    private String answerId;

    public boolean isInThread() {
        return threadRef != null && !threadRef.isBlank();
    }
}
