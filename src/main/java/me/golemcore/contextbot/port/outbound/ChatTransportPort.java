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

import me.golemcore.contextbot.domain.model.OutgoingResponse;

/**
 * Outbound side of the chat transport: rendering answers, user-visible errors
 * and the placeholder shown while a question is in progress.
 */
public interface ChatTransportPort {

    /**
     * Posts a temporary message that is later replaced through
     * {@link #update(String, OutgoingResponse)}.
     *
     * @return reference of the posted message, or {@code null} if it could not
     *         be posted
     */
    String postPlaceholder(String roomId, String threadRef, String text);

    /**
     * Replaces a posted placeholder with the given response.
     */
    void update(String placeholderRef, OutgoingResponse response);

    /**
     * Posts a response to the room (in the thread when one is set).
     */
    void sendResponse(OutgoingResponse response);

    /**
     * Shows an error only to the given user.
     */
    void sendEphemeralError(String roomId, String userId, String message);
}
