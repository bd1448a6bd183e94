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

import me.golemcore.contextbot.domain.exception.ContextBotException;
import me.golemcore.contextbot.domain.exception.ErrorKind;
import me.golemcore.contextbot.domain.model.RuntimeSettings;
import me.golemcore.contextbot.infrastructure.i18n.MessageService;
import org.springframework.stereotype.Component;

/**
 * Chooses the text shown to a user for a failure. Validation failures get an
 * actionable message; everything else gets the generic retry message, never
 * the raw downstream error.
 */
@Component
public class ErrorMessageResolver {

    private final MessageService messageService;
    private final RuntimeSettings settings;

    public ErrorMessageResolver(MessageService messageService, RuntimeSettings settings) {
        this.messageService = messageService;
        this.settings = settings;
    }

    public String messageFor(ContextBotException exception) {
        if (exception.getKind() == ErrorKind.INVALID_CONFIGURATION) {
            return messageService.getMessage("error.invalid-configuration", exception.getMessage());
        }
        return messageFor(exception.getKind());
    }

    public String messageFor(ErrorKind kind) {
        return switch (kind) {
        case INVALID_CONFIGURATION -> messageService.getMessage("error.invalid-configuration", "");
        case NO_ASSISTANT_CONFIGURED -> messageService.getMessage("error.no-assistant");
        case CONTEXT_UNAVAILABLE -> messageService.getMessage("error.context-unavailable");
        case UNKNOWN_ANSWER -> messageService.getMessage("error.unknown-answer");
        default -> messageService.getMessage("error.generic", settings.botName());
        };
    }
}
