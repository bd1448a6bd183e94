package me.golemcore.contextbot.adapter.outbound.transport;

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
import me.golemcore.contextbot.port.outbound.ChatTransportPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Transport used when no chat platform is connected: responses are written to
 * the log instead of a channel.
 */
@Component
@Slf4j
public class LoggingChatTransportAdapter implements ChatTransportPort {

    private final AtomicLong placeholderCounter = new AtomicLong();

    @Override
    public String postPlaceholder(String roomId, String threadRef, String text) {
        String ref = "placeholder-" + placeholderCounter.incrementAndGet();
        log.info("[Transport] -> {}{}: {} ({})", roomId, threadRef != null ? "/" + threadRef : "", text, ref);
        return ref;
    }

    @Override
    public void update(String placeholderRef, OutgoingResponse response) {
        log.info("[Transport] {} replaced: {}{}", placeholderRef, response.getText(),
                response.hasFeedbackControls() ? " [feedback: " + response.getAnswerId() + "]" : "");
    }

    @Override
    public void sendResponse(OutgoingResponse response) {
        log.info("[Transport] -> {}{}: {}{}", response.getRoomId(),
                response.getThreadRef() != null ? "/" + response.getThreadRef() : "",
                response.getText(),
                response.hasFeedbackControls() ? " [feedback: " + response.getAnswerId() + "]" : "");
    }

    @Override
    public void sendEphemeralError(String roomId, String userId, String message) {
        log.info("[Transport] -> {} (only {}): {}", roomId, userId, message);
    }
}
