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

import me.golemcore.contextbot.domain.exception.ContextUnavailableException;
import me.golemcore.contextbot.domain.model.ContextMessage;
import me.golemcore.contextbot.domain.model.ContextScope;
import me.golemcore.contextbot.domain.model.HistoryMessage;
import me.golemcore.contextbot.domain.model.HistoryPage;
import me.golemcore.contextbot.domain.model.RuntimeSettings;
import me.golemcore.contextbot.port.outbound.ChatHistoryPort;
import me.golemcore.contextbot.port.outbound.UserDirectoryPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.regex.Pattern;

/**
 * Builds the context window for a question: the most recent messages of a
 * channel or thread, oldest first, with authors resolved to display names.
 *
 * <p>
 * Pages are read newest first until enough conversational messages were
 * collected, the history ends, or the page limit is reached. Messages seen
 * twice across page boundaries are kept once (first occurrence). Bot and
 * system messages and messages without text are skipped and do not count
 * toward the limit.
 *
 * <p>
 * A failure on the first page means there is no context at all and raises
 * {@link ContextUnavailableException}. A failure on a later page ends
 * pagination and the messages collected so far are returned: a degraded
 * answer is preferred to none. Interruption of the calling thread discards
 * everything and raises {@link CancellationException}.
 */
@Service
@Slf4j
public class ContextWindowExtractor {

    static final int MAX_PAGE_SIZE = 200;

    private static final Pattern DECIMAL = Pattern.compile("\\d+(\\.\\d+)?");

    private static final Comparator<HistoryMessage> CHRONOLOGICAL = (left,
            right) -> compareTimestamps(left.getTimestamp(), right.getTimestamp());

    private final ChatHistoryPort chatHistoryPort;
    private final UserDirectoryPort userDirectoryPort;
    private final RuntimeSettings settings;

    public ContextWindowExtractor(ChatHistoryPort chatHistoryPort, UserDirectoryPort userDirectoryPort,
            RuntimeSettings settings) {
        this.chatHistoryPort = chatHistoryPort;
        this.userDirectoryPort = userDirectoryPort;
        this.settings = settings;
    }

    /**
     * Extracts at most {@code limit} messages (clamped to
     * {@code [1, hardMax]}) in chronological order.
     */
    public List<ContextMessage> extract(ContextScope scope, int limit) {
        int effectiveLimit = Math.max(1, Math.min(limit, settings.contextHardMax()));
        Map<String, HistoryMessage> collected = collect(scope, effectiveLimit);

        List<HistoryMessage> ordered = new ArrayList<>(collected.values());
        ordered.sort(CHRONOLOGICAL);
        if (ordered.size() > effectiveLimit) {
            ordered = ordered.subList(ordered.size() - effectiveLimit, ordered.size());
        }

        Map<String, String> names = new HashMap<>();
        List<ContextMessage> window = new ArrayList<>(ordered.size());
        for (HistoryMessage message : ordered) {
            checkCancelled();
            String name = names.computeIfAbsent(String.valueOf(message.getUserId()),
                    id -> resolveName(message.getUserId()));
            window.add(new ContextMessage(name, message.getText(), message.getTimestamp(), message.getThreadRef()));
        }
        log.debug("[Context] Extracted {} messages from {} (limit {})", window.size(), describe(scope),
                effectiveLimit);
        return window;
    }

    private Map<String, HistoryMessage> collect(ContextScope scope, int limit) {
        Map<String, HistoryMessage> collected = new LinkedHashMap<>();
        String cursor = null;
        int pages = 0;
        while (collected.size() < limit && pages < settings.maxHistoryPages()) {
            checkCancelled();
            int pageSize = Math.min(MAX_PAGE_SIZE, limit - collected.size());
            HistoryPage page;
            try {
                page = chatHistoryPort.fetchPage(scope, cursor, pageSize);
            } catch (RuntimeException e) { // NOSONAR - any transport failure ends pagination
                checkCancelled();
                if (pages == 0) {
                    throw e instanceof ContextUnavailableException contextUnavailable
                            ? contextUnavailable
                            : new ContextUnavailableException(
                                    "Failed to read history of " + describe(scope) + ": " + e.getMessage(), e);
                }
                log.debug("[Context] History of {} failed after {} pages, keeping {} messages: {}",
                        describe(scope), pages, collected.size(), e.getMessage());
                break;
            }
            pages++;
            for (HistoryMessage message : page.messages()) {
                if (message.isConversational()) {
                    collected.putIfAbsent(identityOf(message), message);
                }
            }
            if (!page.hasMore()) {
                break;
            }
            cursor = page.nextCursor();
        }
        checkCancelled();
        return collected;
    }

    private String resolveName(String userId) {
        if (userId == null || userId.isBlank()) {
            return "unknown";
        }
        try {
            return userDirectoryPort.resolveDisplayName(userId)
                    .filter(name -> !name.isBlank())
                    .orElse(userId);
        } catch (RuntimeException e) { // NOSONAR - a missing name must not fail the question
            log.debug("[Context] Could not resolve user {}: {}", userId, e.getMessage());
            return userId;
        }
    }

    private static String identityOf(HistoryMessage message) {
        return message.getId() != null ? message.getId() : message.getUserId() + "@" + message.getTimestamp();
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Context extraction cancelled");
        }
    }

    private static String describe(ContextScope scope) {
        return scope.isThread() ? scope.roomId() + "/" + scope.threadRef() : scope.roomId();
    }

    /**
     * Orders platform timestamps numerically when both parse as decimals
     * ("1700000000.000100"), lexicographically otherwise. Missing timestamps
     * sort first.
     */
    static int compareTimestamps(String left, String right) {
        if (left == null || right == null) {
            return left == null ? (right == null ? 0 : -1) : 1;
        }
        BigDecimal leftNumber = parseDecimal(left);
        BigDecimal rightNumber = parseDecimal(right);
        if (leftNumber != null && rightNumber != null) {
            return leftNumber.compareTo(rightNumber);
        }
        return left.compareTo(right);
    }

    private static BigDecimal parseDecimal(String value) {
        return DECIMAL.matcher(value).matches() ? new BigDecimal(value) : null;
    }
}
