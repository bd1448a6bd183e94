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
 * Outcome of a single QA service call: either an {@link Answer} or a
 * classified failure.
 *
 * <p>
 * {@code detail} describes the failure for logs only (status line, truncated
 * body). It is never shown to users.
 */
@Data
@Builder
public class QaResult {

    private boolean success;
    private Answer answer;
    private ErrorKind errorKind;
    private Integer statusCode;
    private String detail;

    public static QaResult success(Answer answer) {
        return QaResult.builder()
                .success(true)
                .answer(answer)
                .build();
    }

    public static QaResult failure(ErrorKind kind, String detail) {
        return QaResult.builder()
                .success(false)
                .errorKind(kind)
                .detail(detail)
                .build();
    }

    public static QaResult failure(ErrorKind kind, int statusCode, String detail) {
        return QaResult.builder()
                .success(false)
                .errorKind(kind)
                .statusCode(statusCode)
                .detail(detail)
                .build();
    }
}
