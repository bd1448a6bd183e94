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

import java.util.Locale;
import java.util.Optional;

/**
 * A user's vote on an answer.
 */
public enum FeedbackVerdict {

    POSITIVE,
    NEGATIVE;

    /**
     * Maps a chat reaction name to a verdict. Reactions other than thumbs up
     * and thumbs down carry no verdict.
     */
    public static Optional<FeedbackVerdict> fromReaction(String reaction) {
        if (reaction == null) {
            return Optional.empty();
        }
        return switch (reaction.toLowerCase(Locale.ROOT)) {
        case "+1", "thumbsup" -> Optional.of(POSITIVE);
        case "-1", "thumbsdown" -> Optional.of(NEGATIVE);
        default -> Optional.empty();
        };
    }
}
