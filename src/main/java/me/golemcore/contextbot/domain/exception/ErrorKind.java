package me.golemcore.contextbot.domain.exception;

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

/**
 * Failure categories shared by every component of the bot.
 *
 * <p>
 * Validation kinds are actionable by the user and never retried. Transient
 * kinds are reported with a generic "try again" message. {@link #UNAUTHORIZED}
 * is fatal for the process: it means the QA service credentials are wrong.
 */
public enum ErrorKind {

    INVALID_CONFIGURATION,
    STORAGE_UNAVAILABLE,
    CONTEXT_UNAVAILABLE,
    NO_ASSISTANT_CONFIGURED,
    TIMEOUT,
    UNAUTHORIZED,
    RATE_LIMITED,
    SERVICE_ERROR,
    MALFORMED_RESPONSE,
    UNKNOWN_ANSWER;

    public boolean isValidation() {
        return this == INVALID_CONFIGURATION || this == NO_ASSISTANT_CONFIGURED;
    }

    public boolean isTransient() {
        return this == TIMEOUT || this == RATE_LIMITED || this == SERVICE_ERROR || this == STORAGE_UNAVAILABLE;
    }

    public boolean isFatal() {
        return this == UNAUTHORIZED;
    }
}
