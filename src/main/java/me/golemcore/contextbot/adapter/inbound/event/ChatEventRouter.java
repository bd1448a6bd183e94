package me.golemcore.contextbot.adapter.inbound.event;

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
import me.golemcore.contextbot.domain.model.ContextScope;
import me.golemcore.contextbot.domain.model.FeedbackVerdict;
import me.golemcore.contextbot.domain.model.InboundEvent;
import me.golemcore.contextbot.domain.model.InboundEventKind;
import me.golemcore.contextbot.domain.model.OutgoingResponse;
import me.golemcore.contextbot.domain.model.QuestionOutcome;
import me.golemcore.contextbot.domain.model.RuntimeSettings;
import me.golemcore.contextbot.domain.service.ContextQuestionService;
import me.golemcore.contextbot.domain.service.ErrorMessageResolver;
import me.golemcore.contextbot.domain.service.FeedbackTracker;
import me.golemcore.contextbot.domain.service.LoadingMessageProvider;
import me.golemcore.contextbot.port.inbound.ChatEventPort;
import me.golemcore.contextbot.port.outbound.ChatTransportPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Dispatches chat events to the question and feedback services.
 *
 * <p>
 * Questions (mentions and slash commands) run on the event worker pool, each
 * bounded by the event deadline. When the deadline passes, or the caller
 * cancels the returned future, the worker is interrupted, which aborts the
 * in-flight history read or QA call.
 *
 * <p>
 * A loading message is posted before a question is handed to the pool and is
 * later replaced by the answer or the error text. If it cannot be posted, the
 * answer is sent as a new message and errors go only to the asking user.
 * Exactly one of the worker, the deadline and a caller cancellation gets to
 * reply.
 *
 * <p>
 * Reactions are recorded on the calling thread so that votes arrive at the
 * store in the order they were delivered.
 */
@Component
@Slf4j
public class ChatEventRouter implements ChatEventPort {

    private final ContextQuestionService contextQuestionService;
    private final FeedbackTracker feedbackTracker;
    private final ChatTransportPort chatTransportPort;
    private final ErrorMessageResolver errorMessageResolver;
    private final LoadingMessageProvider loadingMessageProvider;
    private final RuntimeSettings settings;
    private final ExecutorService eventExecutor;
    private final ScheduledExecutorService deadlineScheduler;

    public ChatEventRouter(ContextQuestionService contextQuestionService,
            FeedbackTracker feedbackTracker,
            ChatTransportPort chatTransportPort,
            ErrorMessageResolver errorMessageResolver,
            LoadingMessageProvider loadingMessageProvider,
            RuntimeSettings settings,
            @Qualifier("eventExecutor") ExecutorService eventExecutor,
            @Qualifier("deadlineScheduler") ScheduledExecutorService deadlineScheduler) {
        this.contextQuestionService = contextQuestionService;
        this.feedbackTracker = feedbackTracker;
        this.chatTransportPort = chatTransportPort;
        this.errorMessageResolver = errorMessageResolver;
        this.loadingMessageProvider = loadingMessageProvider;
        this.settings = settings;
        this.eventExecutor = eventExecutor;
        this.deadlineScheduler = deadlineScheduler;
    }

    @Override
    public CompletableFuture<Void> onEvent(InboundEvent event) {
        if (event == null || event.getKind() == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Event kind is required"));
        }
        return switch (event.getKind()) {
        case MENTION, SLASH_COMMAND -> submitQuestion(event);
        case REACTION_ADDED -> handleReaction(event);
        };
    }

    private CompletableFuture<Void> submitQuestion(InboundEvent event) {
        QuestionReply reply = new QuestionReply(event, postPlaceholder(event));
        CompletableFuture<Void> completion = new CompletableFuture<>();
        Future<?> task;
        try {
            task = eventExecutor.submit(() -> runQuestion(event, reply, completion));
        } catch (RejectedExecutionException e) {
            log.warn("[Events] Event worker pool rejected {} in room {}", event.getKind(), event.getRoomId());
            if (reply.claim()) {
                deliverError(reply, errorMessageResolver.messageFor(ErrorKind.SERVICE_ERROR));
            }
            completion.completeExceptionally(e);
            return completion;
        }

        ScheduledFuture<?> deadline = deadlineScheduler.schedule(() -> {
            if (reply.claim()) {
                completion.completeExceptionally(new CancellationException("Event deadline exceeded"));
                log.warn("[Events] {} in room {} exceeded the {}s deadline, aborting", event.getKind(),
                        event.getRoomId(), settings.eventDeadline().toSeconds());
                task.cancel(true);
                deliverError(reply, errorMessageResolver.messageFor(ErrorKind.TIMEOUT));
            }
        }, settings.eventDeadline().toMillis(), TimeUnit.MILLISECONDS);

        completion.whenComplete((ignored, error) -> {
            deadline.cancel(false);
            if (completion.isCancelled()) {
                log.info("[Events] {} in room {} cancelled by caller", event.getKind(), event.getRoomId());
                task.cancel(true);
                if (reply.claim()) {
                    deliverError(reply, errorMessageResolver.messageFor(ErrorKind.SERVICE_ERROR));
                }
            }
        });
        return completion;
    }

    private void runQuestion(InboundEvent event, QuestionReply reply, CompletableFuture<Void> completion) {
        try {
            QuestionOutcome outcome = answer(event);
            if (!reply.claim()) {
                log.debug("[Events] Dropping late outcome for room {}", event.getRoomId());
                return;
            }
            if (outcome.isSuccess()) {
                deliverAnswer(reply, outcome.getResponse());
            } else {
                deliverError(reply, outcome.getUserMessage());
            }
            completion.complete(null);
        } catch (CancellationException e) {
            log.debug("[Events] {} in room {} aborted: {}", event.getKind(), event.getRoomId(), e.getMessage());
            completion.completeExceptionally(e);
        } catch (RuntimeException e) {
            log.error("[Events] Unexpected failure handling {} in room {}", event.getKind(), event.getRoomId(), e);
            if (reply.claim()) {
                deliverError(reply, errorMessageResolver.messageFor(ErrorKind.SERVICE_ERROR));
            }
            completion.completeExceptionally(e);
        }
    }

    private QuestionOutcome answer(InboundEvent event) {
        String question = event.getText() == null ? "" : event.getText().trim();
        if (event.getKind() == InboundEventKind.MENTION) {
            return contextQuestionService.answerMention(event.getRoomId(), replyThreadOf(event), question);
        }
        ContextScope scope = event.isInThread()
                ? ContextScope.thread(event.getRoomId(), event.getThreadRef())
                : ContextScope.channel(event.getRoomId());
        return contextQuestionService.answerContextQuestion(scope, event.getThreadRef(), question);
    }

    // Mentions are answered in a thread started on the mention itself
    private static String replyThreadOf(InboundEvent event) {
        if (event.getKind() == InboundEventKind.MENTION && !event.isInThread()) {
            return event.getTimestamp();
        }
        return event.getThreadRef();
    }

    private String postPlaceholder(InboundEvent event) {
        try {
            return chatTransportPort.postPlaceholder(event.getRoomId(), replyThreadOf(event),
                    loadingMessageProvider.randomMessage());
        } catch (RuntimeException e) {
            log.warn("[Events] Failed to post loading message in room {}: {}", event.getRoomId(), e.getMessage());
            return null;
        }
    }

    private void deliverAnswer(QuestionReply reply, OutgoingResponse response) {
        if (reply.placeholderRef() == null) {
            chatTransportPort.sendResponse(response);
            return;
        }
        chatTransportPort.update(reply.placeholderRef(), response);
    }

    private void deliverError(QuestionReply reply, String message) {
        InboundEvent event = reply.event();
        if (reply.placeholderRef() == null) {
            notifyUser(event, message);
            return;
        }
        try {
            chatTransportPort.update(reply.placeholderRef(), OutgoingResponse.builder()
                    .roomId(event.getRoomId())
                    .threadRef(replyThreadOf(event))
                    .text(message)
                    .build());
        } catch (RuntimeException e) {
            log.warn("[Events] Failed to replace loading message in room {}: {}", event.getRoomId(),
                    e.getMessage());
            notifyUser(event, message);
        }
    }

    private CompletableFuture<Void> handleReaction(InboundEvent event) {
        Optional<FeedbackVerdict> verdict = FeedbackVerdict.fromReaction(event.getReaction());
        if (verdict.isEmpty()) {
            log.debug("[Feedback] Ignoring reaction '{}' in room {}", event.getReaction(), event.getRoomId());
            return CompletableFuture.completedFuture(null);
        }
        try {
            feedbackTracker.record(event.getAnswerId(), event.getUserId(), verdict.get());
            return CompletableFuture.completedFuture(null);
        } catch (ContextBotException e) {
            log.info("[Feedback] Vote by {} on {} not recorded: {}", event.getUserId(), event.getAnswerId(),
                    e.getMessage());
            notifyUser(event, errorMessageResolver.messageFor(e));
            return CompletableFuture.failedFuture(e);
        } catch (IllegalArgumentException e) {
            log.warn("[Feedback] Malformed reaction event in room {}: {}", event.getRoomId(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    private void notifyUser(InboundEvent event, String message) {
        try {
            chatTransportPort.sendEphemeralError(event.getRoomId(), event.getUserId(), message);
        } catch (RuntimeException e) {
            log.warn("[Events] Failed to deliver error message to {} in room {}: {}", event.getUserId(),
                    event.getRoomId(), e.getMessage());
        }
    }

    /**
     * Reply slot of one question. Whoever claims it first (worker, deadline
     * or caller cancellation) is the only one to talk to the user.
     */
    private record QuestionReply(InboundEvent event, String placeholderRef, AtomicBoolean claimed) {

        QuestionReply(InboundEvent event, String placeholderRef) {
            this(event, placeholderRef, new AtomicBoolean(false));
        }

        boolean claim() {
            return claimed.compareAndSet(false, true);
        }
    }
}
