package me.golemcore.contextbot.port.outbound;

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

/**
 * Paginated access to a room's (or thread's) message history on the chat
 * platform.
 */
public interface ChatHistoryPort {

    /**
     * Fetches one page of history, newest message first.
     *
     * @param scope
     *            channel or thread to read
     * @param cursor
     *            cursor returned with the previous page, {@code null} for the
     *            newest page
     * @param pageSize
     *            maximum number of messages wanted
     * @throws me.golemcore.contextbot.domain.exception.ContextUnavailableException
     *             if the history cannot be read (permission denied, unknown
     *             channel)
     */
    HistoryPage fetchPage(ContextScope scope, String cursor, int pageSize);
}
