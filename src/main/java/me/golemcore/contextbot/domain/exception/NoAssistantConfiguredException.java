package me.golemcore.contextbot.domain.exception;

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

/**
 * Thrown when a question targets a room that has no assistant to route to.
 */
public class NoAssistantConfiguredException extends ContextBotException {

    public NoAssistantConfiguredException(String message) {
        super(ErrorKind.NO_ASSISTANT_CONFIGURED, message);
    }

    public NoAssistantConfiguredException(String message, Throwable cause) {
        super(ErrorKind.NO_ASSISTANT_CONFIGURED, message, cause);
    }
}
