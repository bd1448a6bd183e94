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

import me.golemcore.contextbot.domain.model.ContextScope;
import me.golemcore.contextbot.domain.model.HistoryPage;
import me.golemcore.contextbot.port.outbound.ChatHistoryPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * History adapter used when no chat platform is connected. Every channel
 * appears empty, so context questions get the "no context" reply.
 *
 * @see ChatHistoryPort
 */
@Component
@Slf4j
public class NoOpChatHistoryAdapter implements ChatHistoryPort {

    @Override
    public HistoryPage fetchPage(ContextScope scope, String cursor, int pageSize) {
        log.warn("NoOpChatHistoryAdapter: fetchPage() called for {} - no chat platform connected", scope.roomId());
        return HistoryPage.last(List.of());
    }
}
