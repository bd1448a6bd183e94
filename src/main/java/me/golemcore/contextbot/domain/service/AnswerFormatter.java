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

import me.golemcore.contextbot.domain.model.Answer;
import me.golemcore.contextbot.domain.model.AnswerSource;
import me.golemcore.contextbot.infrastructure.i18n.MessageService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an answer as chat markup, with up to three source links.
 */
@Component
public class AnswerFormatter {

    static final int MAX_SOURCES = 3;

    private final MessageService messageService;

    public AnswerFormatter(MessageService messageService) {
        this.messageService = messageService;
    }

    public String format(Answer answer) {
        String text = answer.answerText() == null || answer.answerText().isBlank()
                ? messageService.getMessage("answer.empty")
                : answer.answerText();

        List<AnswerSource> sources = answer.sources().stream()
                .filter(source -> source.url() != null && !source.url().isBlank())
                .limit(MAX_SOURCES)
                .toList();
        if (sources.isEmpty()) {
            return text;
        }
        String links = sources.stream()
                .map(source -> "<" + source.url() + "|" + titleOf(source) + ">")
                .collect(Collectors.joining("\n"));
        return text + "\n\n" + messageService.getMessage("answer.sources") + "\n" + links;
    }

    private static String titleOf(AnswerSource source) {
        return source.title() == null || source.title().isBlank() ? "Source" : source.title();
    }
}
