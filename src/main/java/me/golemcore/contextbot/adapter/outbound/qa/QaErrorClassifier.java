package me.golemcore.contextbot.adapter.outbound.qa;

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

import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * Maps QA service transport failures and HTTP statuses to {@link ErrorKind}s.
 */
public final class QaErrorClassifier {

    static final int MAX_DETAIL_LENGTH = 300;

    private QaErrorClassifier() {
    }

    /**
     * Classify a non-2xx HTTP status.
     */
    public static ErrorKind classifyStatus(int statusCode) {
        if (statusCode == 401 || statusCode == 403) {
            return ErrorKind.UNAUTHORIZED;
        }
        if (statusCode == 429) {
            return ErrorKind.RATE_LIMITED;
        }
        if (statusCode == 408 || statusCode == 504) {
            return ErrorKind.TIMEOUT;
        }
        return ErrorKind.SERVICE_ERROR;
    }

    /**
     * Classify an I/O failure before a response was received. OkHttp reports
     * call, read and write timeouts as {@link InterruptedIOException}.
     */
    public static ErrorKind classifyFailure(IOException failure) {
        if (failure instanceof InterruptedIOException) {
            return ErrorKind.TIMEOUT;
        }
        return ErrorKind.SERVICE_ERROR;
    }

    /**
     * Shortens a downstream body for log output.
     */
    public static String truncate(String body) {
        if (body == null) {
            return "";
        }
        String flat = body.replaceAll("\\s+", " ").trim();
        return flat.length() <= MAX_DETAIL_LENGTH ? flat : flat.substring(0, MAX_DETAIL_LENGTH) + "...";
    }
}
