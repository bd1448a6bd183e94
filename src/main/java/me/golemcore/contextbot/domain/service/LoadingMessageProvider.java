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

import me.golemcore.contextbot.infrastructure.i18n.MessageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Supplies the placeholder text posted while a question is being answered.
 * Texts are the {@code loading.1}, {@code loading.2}, ... entries of the
 * message bundle; one is picked at random per question.
 */
@Component
@Slf4j
public class LoadingMessageProvider {

    static final String KEY_PREFIX = "loading.";

    private final List<String> messages;

    public LoadingMessageProvider(MessageService messageService) {
        List<String> loaded = new ArrayList<>();
        for (int i = 1; messageService.hasMessage(KEY_PREFIX + i); i++) {
            loaded.add(messageService.getMessage(KEY_PREFIX + i));
        }
        if (loaded.isEmpty()) {
            throw new IllegalStateException("Message bundle has no loading messages");
        }
        this.messages = List.copyOf(loaded);
        log.debug("[Events] Loaded {} loading messages", messages.size());
    }

    public String randomMessage() {
        return messages.get(ThreadLocalRandom.current().nextInt(messages.size()));
    }

    public List<String> getMessages() {
        return messages;
    }
}
