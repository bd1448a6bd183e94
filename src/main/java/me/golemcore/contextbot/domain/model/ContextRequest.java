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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

import java.util.List;

/**
 * Request sent to the QA service. Serialized as-is, with a fixed property
 * order, so two builds from the same input produce identical bytes.
 *
 * <p>
 * {@code model} is omitted from the payload when absent, leaving the choice
 * to the service. Mentions carry the room's instructions as {@code prompt};
 * context questions carry the context-analysis {@code system_prompt} instead,
 * which rooms cannot override. Both carry the shared {@code userPrompt}. {@code trimmedChunks} counts the oldest chunks dropped to
 * satisfy the payload size limit and is not sent.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "question", "chunks", "assistants", "model", "sessionId", "client", "prompt", "system_prompt",
        "userPrompt" })
public record ContextRequest(
        String question,
        List<ContextChunk> chunks,
        List<String> assistants,
        String model,
        String sessionId,
        String client,
        String prompt,
        @JsonProperty("system_prompt") String systemPrompt,
        String userPrompt,
        @JsonIgnore int trimmedChunks) {

    public ContextRequest {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        assistants = assistants == null ? List.of() : List.copyOf(assistants);
    }

    @JsonIgnore
    public boolean isTrimmed() {
        return trimmedChunks > 0;
    }
}
