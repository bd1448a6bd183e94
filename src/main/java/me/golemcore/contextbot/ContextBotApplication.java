package me.golemcore.contextbot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore ContextBot.
 *
 * <p>
 * ContextBot answers questions asked in chat rooms by forwarding them, with
 * the recent conversation as context, to a remote question-answering service.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Room configuration</b> - per-room assistants, prompt and context size
 * in an embedded H2 database</li>
 * <li><b>Context questions</b> - bounded, ordered, deduplicated history window
 * with resolved author names</li>
 * <li><b>QA gateway</b> - single-attempt HTTP calls with classified
 * failures</li>
 * <li><b>Feedback</b> - idempotent like/dislike votes on answers</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → ChatEventRouter
 * Domain Layer       → ContextQuestionService, RoomConfigService, FeedbackTracker
 * Infrastructure     → H2 storage, QA HTTP adapters, chat transport adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix, overridable through environment variables.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ContextBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextBotApplication.class, args);
    }

}
