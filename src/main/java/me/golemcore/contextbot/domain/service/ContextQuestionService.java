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
import me.golemcore.contextbot.domain.model.Answer;
import me.golemcore.contextbot.domain.model.ContextMessage;
import me.golemcore.contextbot.domain.model.ContextRequest;
import me.golemcore.contextbot.domain.model.ContextScope;
import me.golemcore.contextbot.domain.model.OutgoingResponse;
import me.golemcore.contextbot.domain.model.QaResult;
import me.golemcore.contextbot.domain.model.QuestionOutcome;
import me.golemcore.contextbot.domain.model.RoomConfig;
import me.golemcore.contextbot.domain.model.RuntimeSettings;
import me.golemcore.contextbot.infrastructure.i18n.MessageService;
import me.golemcore.contextbot.port.outbound.QaGatewayPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Answers questions asked in a room: reads the room settings, extracts the
 * context window when the question is about the conversation, builds the
 * request and calls the QA service.
 *
 * <p>
 * Runs on the caller's thread and blocks on network I/O. The room config is
 * read once before any network call. Interrupting the thread aborts the
 * in-flight history read or QA call and surfaces as
 * {@link CancellationException}; every other failure is returned as a failed
 * {@link QuestionOutcome} carrying the user-facing text.
 */
@Service
@Slf4j
public class ContextQuestionService {

    private static final long RESULT_GRACE_MILLIS = 5_000L;

    private final RoomConfigService roomConfigService;
    private final ContextWindowExtractor contextWindowExtractor;
    private final ContextRequestBuilder contextRequestBuilder;
    private final QaGatewayPort qaGatewayPort;
    private final FeedbackTracker feedbackTracker;
    private final QaCredentialGuard credentialGuard;
    private final AnswerFormatter answerFormatter;
    private final ErrorMessageResolver errorMessageResolver;
    private final MessageService messageService;
    private final RuntimeSettings settings;

    public ContextQuestionService(RoomConfigService roomConfigService,
            ContextWindowExtractor contextWindowExtractor,
            ContextRequestBuilder contextRequestBuilder,
            QaGatewayPort qaGatewayPort,
            FeedbackTracker feedbackTracker,
            QaCredentialGuard credentialGuard,
            AnswerFormatter answerFormatter,
            ErrorMessageResolver errorMessageResolver,
            MessageService messageService,
            RuntimeSettings settings) {
        this.roomConfigService = roomConfigService;
        this.contextWindowExtractor = contextWindowExtractor;
        this.contextRequestBuilder = contextRequestBuilder;
        this.qaGatewayPort = qaGatewayPort;
        this.feedbackTracker = feedbackTracker;
        this.credentialGuard = credentialGuard;
        this.answerFormatter = answerFormatter;
        this.errorMessageResolver = errorMessageResolver;
        this.messageService = messageService;
        this.settings = settings;
    }

    /**
     * Answers a direct question (mention) without conversation history, using
     * the room's prompt.
     */
    public QuestionOutcome answerMention(String roomId, String replyThread, String question) {
        ContextScope scope = replyThread != null ? ContextScope.thread(roomId, replyThread)
                : ContextScope.channel(roomId);
        try {
            RoomConfig config = loadAnswerableConfig(roomId);
            ContextRequest request = contextRequestBuilder.build(question, List.of(), config,
                    settings.modelOverride(), scope, roomConfigService.effectivePrompt(config));
            return ask(request, roomId, replyThread);
        } catch (ContextBotException e) {
            return failed(roomId, e);
        }
    }

    /**
     * Answers a question about the recent conversation of {@code scope}.
     */
    public QuestionOutcome answerContextQuestion(ContextScope scope, String replyThread, String question) {
        String roomId = scope.roomId();
        try {
            RoomConfig config = loadAnswerableConfig(roomId);
            List<ContextMessage> window = contextWindowExtractor.extract(scope, config.contextSize());
            if (window.isEmpty()) {
                log.info("[Context] No conversation context found in room {}", roomId);
                return QuestionOutcome.answered(OutgoingResponse.builder()
                        .roomId(roomId)
                        .threadRef(replyThread)
                        .text(messageService.getMessage("context.empty"))
                        .build());
            }
            ContextRequest request = contextRequestBuilder.buildContextQuestion(question, window, config,
                    settings.modelOverride(), scope);
            return ask(request, roomId, replyThread);
        } catch (ContextBotException e) {
            return failed(roomId, e);
        }
    }

    // Everything a question needs is checked here, before any network call.
    private RoomConfig loadAnswerableConfig(String roomId) {
        if (credentialGuard.isBlocked()) {
            throw new ContextBotException(ErrorKind.UNAUTHORIZED, "QA calls are blocked: "
                    + credentialGuard.getBlockedReason());
        }
        RoomConfig config = roomConfigService.get(roomId);
        if (!config.hasAssistants()) {
            throw new ContextBotException(ErrorKind.NO_ASSISTANT_CONFIGURED,
                    "No assistant configured for room " + roomId);
        }
        return config;
    }

    private QuestionOutcome ask(ContextRequest request, String roomId, String replyThread) {
        log.debug("[QA] Asking {} with {} chunks for room {}", request.assistants(), request.chunks().size(),
                roomId);
        QaResult result = await(qaGatewayPort.ask(request, settings.qaTimeout()));

        if (!result.isSuccess()) {
            ErrorKind kind = result.getErrorKind();
            if (kind.isFatal()) {
                credentialGuard.block(result.getDetail());
            }
            log.warn("[QA] Question in room {} failed: {} ({})", roomId, kind, result.getDetail());
            return QuestionOutcome.failed(kind, errorMessageResolver.messageFor(kind));
        }

        Answer answer = result.getAnswer();
        feedbackTracker.registerAnswer(answer.answerId());
        log.info("[QA] Answered question in room {} (answer {})", roomId, answer.answerId());
        return QuestionOutcome.answered(OutgoingResponse.builder()
                .roomId(roomId)
                .threadRef(replyThread)
                .text(answerFormatter.format(answer))
                .answerId(answer.answerId())
                .build());
    }

    private QaResult await(CompletableFuture<QaResult> call) {
        long waitMillis = settings.qaTimeout().toMillis() + RESULT_GRACE_MILLIS;
        try {
            return call.get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Question cancelled while waiting for the QA service");
        } catch (TimeoutException e) {
            call.cancel(true);
            return QaResult.failure(ErrorKind.TIMEOUT, "No result after " + waitMillis + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return QaResult.failure(ErrorKind.SERVICE_ERROR, cause.getMessage());
        }
    }

    private QuestionOutcome failed(String roomId, ContextBotException e) {
        if (e.getKind().isValidation()) {
            log.info("[QA] Question in room {} rejected: {}", roomId, e.getMessage());
        } else {
            log.warn("[QA] Question in room {} failed: {}", roomId, e.getMessage());
        }
        return QuestionOutcome.failed(e.getKind(), errorMessageResolver.messageFor(e));
    }
}
