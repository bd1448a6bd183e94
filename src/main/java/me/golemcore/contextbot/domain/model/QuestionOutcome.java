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

import me.golemcore.contextbot.domain.exception.ErrorKind;
import lombok.Builder;
import lombok.Data;

/**
 * Result of answering one question: the rendered response on success, or the
 * failure kind plus the text to show the asking user.
 */
@Data
@Builder
public class QuestionOutcome {

    private boolean success;
    private OutgoingResponse response;
    private ErrorKind errorKind;
    private String userMessage;

    public static QuestionOutcome answered(OutgoingResponse response) {
        return QuestionOutcome.builder()
                .success(true)
                .response(response)
                .build();
    }

    public static QuestionOutcome failed(ErrorKind kind, String userMessage) {
        return QuestionOutcome.builder()
                .success(false)
                .errorKind(kind)
                .userMessage(userMessage)
                .build();
    }
}
