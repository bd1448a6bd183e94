package me.golemcore.contextbot.port.inbound;

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

import me.golemcore.contextbot.domain.model.InboundEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point for events delivered by the chat transport (mentions, slash
 * commands, reactions). Events may arrive concurrently from many rooms.
 */
public interface ChatEventPort {

    /**
     * Handles one event end-to-end. The returned future completes once the
     * response (or error) was handed back to the transport. Cancelling it
     * aborts in-flight history and QA calls.
     */
    CompletableFuture<Void> onEvent(InboundEvent event);
}
