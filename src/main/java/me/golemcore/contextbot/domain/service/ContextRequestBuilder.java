package me.golemcore.contextbot.domain.service;

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

import me.golemcore.contextbot.domain.exception.NoAssistantConfiguredException;
import me.golemcore.contextbot.domain.model.ContextChunk;
import me.golemcore.contextbot.domain.model.ContextMessage;
import me.golemcore.contextbot.domain.model.ContextRequest;
import me.golemcore.contextbot.domain.model.ContextScope;
import me.golemcore.contextbot.domain.model.RoomConfig;
import me.golemcore.contextbot.domain.model.RuntimeSettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns a question and its context window into the request sent to the QA
 * service. No I/O; the same input always yields the same serialized bytes.
 *
 * <p>
 * Each message becomes a chunk {@code "name: text"} in chronological order.
 * When the serialized request exceeds the payload limit, the oldest chunks
 * are dropped until it fits; the newest context is always kept longest.
 */
@Component
@Slf4j
public class ContextRequestBuilder {

    private final RuntimeSettings settings;
    private final ObjectMapper objectMapper;

    public ContextRequestBuilder(RuntimeSettings settings, ObjectMapper objectMapper) {
        this.settings = settings;
        this.objectMapper = objectMapper;
    }

    /**
     * Builds a channel-scoped context question.
     */
    public ContextRequest build(String question, List<ContextMessage> messages, RoomConfig roomConfig,
            String modelOverride) {
        return buildContextQuestion(question, messages, roomConfig, modelOverride,
                ContextScope.channel(roomConfig.roomId()));
    }

    /**
     * Builds a context question. The context-analysis prompt goes out as the
     * system prompt; room prompt overrides do not apply.
     */
    public ContextRequest buildContextQuestion(String question, List<ContextMessage> messages,
            RoomConfig roomConfig, String modelOverride, ContextScope scope) {
        return assemble(question, messages, roomConfig, modelOverride, scope, null,
                settings.contextAnalysisPrompt());
    }

    /**
     * Builds a request carrying {@code prompt} as its instructions.
     *
     * @param question
     *            the user's question
     * @param messages
     *            context window, oldest first
     * @param roomConfig
     *            settings of the room asking; its assistants become the
     *            targets
     * @param modelOverride
     *            model to request, or {@code null}/blank to let the service
     *            choose
     * @param scope
     *            channel or thread, used for the session id
     * @param prompt
     *            instructions sent alongside the question
     * @throws NoAssistantConfiguredException
     *             if the room has no assistant
     */
    public ContextRequest build(String question, List<ContextMessage> messages, RoomConfig roomConfig,
            String modelOverride, ContextScope scope, String prompt) {
        return assemble(question, messages, roomConfig, modelOverride, scope, prompt, null);
    }

    private ContextRequest assemble(String question, List<ContextMessage> messages, RoomConfig roomConfig,
            String modelOverride, ContextScope scope, String prompt, String systemPrompt) {
        if (!roomConfig.hasAssistants()) {
            throw new NoAssistantConfiguredException("No assistant configured for room " + roomConfig.roomId());
        }

        List<ContextChunk> chunks = new ArrayList<>(messages.size());
        for (ContextMessage message : messages) {
            chunks.add(new ContextChunk(message.authorDisplayName() + ": " + message.text()));
        }

        ContextRequest.ContextRequestBuilder request = ContextRequest.builder()
                .question(question == null ? "" : question)
                .assistants(roomConfig.assistants())
                .model(modelOverride == null || modelOverride.isBlank() ? null : modelOverride)
                .sessionId(sessionIdFor(scope))
                .client(settings.botName())
                .prompt(prompt)
                .systemPrompt(systemPrompt)
                .userPrompt(blankToNull(settings.userPrompt()));

        int dropped = countChunksToDrop(request, chunks);
        if (dropped > 0) {
            log.debug("[QA] Request for room {} exceeds {} bytes, dropped {} oldest of {} chunks",
                    roomConfig.roomId(), settings.maxPayloadBytes(), dropped, chunks.size());
        }
        return request
                .chunks(chunks.subList(dropped, chunks.size()))
                .trimmedChunks(dropped)
                .build();
    }

    /**
     * Stable session id of a conversation: a name-based UUID of
     * {@code "room_thread"}, or {@code "room_room"} outside threads.
     */
    public static String sessionIdFor(ContextScope scope) {
        String thread = scope.isThread() ? scope.threadRef() : scope.roomId();
        String key = scope.roomId() + "_" + thread;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private int countChunksToDrop(ContextRequest.ContextRequestBuilder request, List<ContextChunk> chunks) {
        long size = serializedSize(request.chunks(List.of()).build());
        if (!chunks.isEmpty()) {
            size += chunks.size() - 1L; // separators
        }
        long[] chunkSizes = new long[chunks.size()];
        for (int i = 0; i < chunks.size(); i++) {
            chunkSizes[i] = serializedSize(chunks.get(i));
            size += chunkSizes[i];
        }

        int dropped = 0;
        while (size > settings.maxPayloadBytes() && dropped < chunks.size()) {
            size -= chunkSizes[dropped];
            if (dropped < chunks.size() - 1) {
                size -= 1;
            }
            dropped++;
        }
        return dropped;
    }

    private long serializedSize(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value).length;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize QA request", e);
        }
    }
}
