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

/**
 * Where conversation history is read from: the whole channel, or the replies
 * of one thread.
 */
public record ContextScope(String roomId, String threadRef) {

    public static ContextScope channel(String roomId) {
        return new ContextScope(roomId, null);
    }

    public static ContextScope thread(String roomId, String threadRef) {
        return new ContextScope(roomId, threadRef);
    }

    public boolean isThread() {
        return threadRef != null && !threadRef.isBlank();
    }
}
