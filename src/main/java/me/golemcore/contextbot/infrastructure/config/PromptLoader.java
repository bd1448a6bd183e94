package me.golemcore.contextbot.infrastructure.config;

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

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads the QA prompts from text resources once at startup.
 *
 * <p>
 * Locations come from {@code bot.prompts.*} and accept any Spring resource
 * prefix ({@code classpath:}, {@code file:}). A missing or empty prompt fails
 * startup.
 */
@Component
@Slf4j
public class PromptLoader {

    private final ResourceLoader resourceLoader;

    public PromptLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public Prompts load(BotProperties.PromptsProperties properties) {
        String contextSystemPrompt = read(properties.getContextSystemLocation(), "context system prompt");
        String userPrompt = read(properties.getUserLocation(), "user prompt");
        log.info("[Config] Loaded prompts: context system {} chars, user {} chars", contextSystemPrompt.length(),
                userPrompt.length());
        return new Prompts(contextSystemPrompt, userPrompt);
    }

    private String read(String location, String description) {
        if (location == null || location.isBlank()) {
            throw new IllegalStateException("No location configured for the " + description);
        }
        Resource resource = resourceLoader.getResource(location.trim());
        if (!resource.exists()) {
            throw new IllegalStateException("Missing " + description + " file: " + location);
        }
        String content;
        try (InputStream is = resource.getInputStream()) {
            content = new String(is.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + description + " from " + location, e);
        }
        if (content.isEmpty()) {
            throw new IllegalStateException("Empty " + description + " file: " + location);
        }
        log.debug("[Config] Loaded {} from {}", description, location);
        return content;
    }

    /**
     * Prompts sent with QA requests.
     *
     * @param contextSystemPrompt
     *            system prompt of context questions, never overridden per room
     * @param userPrompt
     *            user prompt shared by every request
     */
    public record Prompts(String contextSystemPrompt, String userPrompt) {
    }
}
