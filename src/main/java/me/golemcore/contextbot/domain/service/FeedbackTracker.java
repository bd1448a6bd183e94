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

import me.golemcore.contextbot.domain.exception.UnknownAnswerException;
import me.golemcore.contextbot.domain.model.FeedbackRecord;
import me.golemcore.contextbot.domain.model.FeedbackVerdict;
import me.golemcore.contextbot.domain.model.RuntimeSettings;
import me.golemcore.contextbot.port.outbound.FeedbackRecordPort;
import me.golemcore.contextbot.port.outbound.FeedbackSinkPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Records like/dislike votes on answers issued by this process.
 *
 * <p>
 * One vote is kept per {@code (answerId, userId)}: a different verdict
 * overwrites the stored one, the same verdict again is a no-op. Votes of the
 * same pair are applied one at a time, in the order they arrive. Accepted
 * changes are forwarded to the QA service in the background; forwards of the
 * same pair are chained so the service sees them in that same order.
 * Forwarding failures are only logged.
 *
 * <p>
 * Issued answer ids are remembered in memory only, up to
 * {@code maxTrackedAnswers} (oldest forgotten first), so votes on answers from
 * before a restart are rejected.
 */
@Service
@Slf4j
public class FeedbackTracker {

    private static final int LOCK_STRIPES = 64;

    private final FeedbackRecordPort feedbackRecordPort;
    private final FeedbackSinkPort feedbackSinkPort;
    private final Clock clock;
    private final Map<String, Instant> issuedAnswers;
    private final ReentrantLock[] pairLocks = new ReentrantLock[LOCK_STRIPES];
    private final ConcurrentMap<String, CompletableFuture<Void>> forwardChains = new ConcurrentHashMap<>();

    public FeedbackTracker(FeedbackRecordPort feedbackRecordPort, FeedbackSinkPort feedbackSinkPort,
            RuntimeSettings settings, Clock clock) {
        this.feedbackRecordPort = feedbackRecordPort;
        this.feedbackSinkPort = feedbackSinkPort;
        this.clock = clock;
        int capacity = Math.max(1, settings.maxTrackedAnswers());
        this.issuedAnswers = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Instant> eldest) {
                return size() > capacity;
            }
        };
        for (int i = 0; i < LOCK_STRIPES; i++) {
            pairLocks[i] = new ReentrantLock(true);
        }
    }

    /**
     * Remembers an answer id handed out to users, making it eligible for
     * feedback.
     */
    public void registerAnswer(String answerId) {
        if (answerId == null || answerId.isBlank()) {
            return;
        }
        synchronized (issuedAnswers) {
            issuedAnswers.put(answerId, clock.instant());
        }
    }

    public boolean isIssued(String answerId) {
        synchronized (issuedAnswers) {
            return answerId != null && issuedAnswers.containsKey(answerId);
        }
    }

    /**
     * Records a vote.
     *
     * @throws UnknownAnswerException
     *             if the answer was not issued by this process
     */
    public void record(String answerId, String userId, FeedbackVerdict verdict) {
        if (userId == null || userId.isBlank() || verdict == null) {
            throw new IllegalArgumentException("Feedback requires a user and a verdict");
        }
        if (!isIssued(answerId)) {
            throw new UnknownAnswerException("Answer " + answerId + " was not issued by this bot");
        }

        String pairKey = pairKey(answerId, userId);
        ReentrantLock lock = pairLocks[Math.floorMod(pairKey.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            Optional<FeedbackRecord> existing = feedbackRecordPort.find(answerId, userId);
            if (existing.isPresent() && existing.get().verdict() == verdict) {
                log.debug("[Feedback] Repeated {} vote by {} on {}, nothing to do", verdict, userId, answerId);
                return;
            }
            FeedbackRecord accepted = new FeedbackRecord(answerId, userId, verdict, clock.instant());
            feedbackRecordPort.save(accepted);
            log.info("[Feedback] {} vote by {} on answer {}", accepted.verdict(), userId, answerId);
            enqueueForward(pairKey, accepted);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of pairs whose forwards are still in flight.
     */
    int pendingForwards() {
        return forwardChains.size();
    }

    // Called under the pair lock, so chain links are appended in receipt order
    private void enqueueForward(String pairKey, FeedbackRecord accepted) {
        CompletableFuture<Void> previous = forwardChains.get(pairKey);
        CompletableFuture<Void> start = previous != null ? previous : CompletableFuture.completedFuture(null);
        CompletableFuture<Void> chain = start.thenCompose(ignored -> forwardLogged(accepted));
        forwardChains.put(pairKey, chain);
        chain.whenComplete((ignored, error) -> forwardChains.remove(pairKey, chain));
    }

    private CompletableFuture<Void> forwardLogged(FeedbackRecord accepted) {
        CompletableFuture<Void> forwarded;
        try {
            forwarded = feedbackSinkPort.forward(accepted);
        } catch (RuntimeException e) {
            forwarded = CompletableFuture.failedFuture(e);
        }
        return forwarded.handle((ignored, error) -> {
            if (error != null) {
                log.warn("[Feedback] Failed to forward vote on {}: {}", accepted.answerId(), error.getMessage());
            }
            return null;
        });
    }

    private static String pairKey(String answerId, String userId) {
        return answerId + '\n' + userId;
    }
}
