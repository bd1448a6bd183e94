package me.golemcore.contextbot.domain.service;

import me.golemcore.contextbot.domain.exception.ContextUnavailableException;
import me.golemcore.contextbot.domain.exception.ErrorKind;
import me.golemcore.contextbot.domain.model.Answer;
import me.golemcore.contextbot.domain.model.AnswerSource;
import me.golemcore.contextbot.domain.model.ContextRequest;
import me.golemcore.contextbot.domain.model.ContextScope;
import me.golemcore.contextbot.domain.model.HistoryMessage;
import me.golemcore.contextbot.domain.model.HistoryPage;
import me.golemcore.contextbot.domain.model.QaResult;
import me.golemcore.contextbot.domain.model.QuestionOutcome;
import me.golemcore.contextbot.domain.model.RoomConfig;
import me.golemcore.contextbot.domain.model.RuntimeSettings;
import me.golemcore.contextbot.infrastructure.i18n.MessageService;
import me.golemcore.contextbot.port.outbound.ChatHistoryPort;
import me.golemcore.contextbot.port.outbound.FeedbackRecordPort;
import me.golemcore.contextbot.port.outbound.FeedbackSinkPort;
import me.golemcore.contextbot.port.outbound.QaGatewayPort;
import me.golemcore.contextbot.port.outbound.RoomConfigPort;
import me.golemcore.contextbot.port.outbound.UserDirectoryPort;
import me.golemcore.contextbot.testsupport.TestSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ContextQuestionServiceTest {

    private static final String ROOM = "C2";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String GENERIC = "Oops, Clementine hit a snag. Please try again in a moment.";

    private RoomConfigPort roomConfigPort;
    private ChatHistoryPort chatHistoryPort;
    private QaGatewayPort qaGatewayPort;
    private FeedbackTracker feedbackTracker;
    private QaCredentialGuard credentialGuard;
    private RuntimeSettings settings;
    private ContextQuestionService service;

    @BeforeEach
    void setUp() {
        roomConfigPort = mock(RoomConfigPort.class);
        chatHistoryPort = mock(ChatHistoryPort.class);
        qaGatewayPort = mock(QaGatewayPort.class);
        UserDirectoryPort userDirectoryPort = mock(UserDirectoryPort.class);
        when(userDirectoryPort.resolveDisplayName(anyString()))
                .thenAnswer(invocation -> Optional.of("Name " + invocation.getArgument(0)));
        FeedbackSinkPort feedbackSinkPort = mock(FeedbackSinkPort.class);
        when(feedbackSinkPort.forward(any())).thenReturn(CompletableFuture.completedFuture(null));

        settings = TestSettings.defaults();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        MessageService messageService = new MessageService();
        credentialGuard = new QaCredentialGuard();
        feedbackTracker = new FeedbackTracker(mock(FeedbackRecordPort.class), feedbackSinkPort, settings, clock);

        service = new ContextQuestionService(
                new RoomConfigService(roomConfigPort, settings, clock),
                new ContextWindowExtractor(chatHistoryPort, userDirectoryPort, settings),
                new ContextRequestBuilder(settings, new ObjectMapper()),
                qaGatewayPort,
                feedbackTracker,
                credentialGuard,
                new AnswerFormatter(messageService),
                new ErrorMessageResolver(messageService, settings),
                messageService,
                settings);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private void givenRoom(List<String> assistants, int contextSize) {
        when(roomConfigPort.findById(ROOM)).thenReturn(Optional.of(RoomConfig.builder()
                .roomId(ROOM)
                .assistants(assistants)
                .contextSize(contextSize)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build()));
    }

    private void givenHistory(int size) {
        List<HistoryMessage> newestFirst = new ArrayList<>();
        for (int i = size - 1; i >= 0; i--) {
            newestFirst.add(HistoryMessage.builder()
                    .id("m" + i)
                    .userId("U" + (i % 4))
                    .text("message " + i)
                    .timestamp(String.format("1700000000.%06d", i))
                    .build());
        }
        when(chatHistoryPort.fetchPage(any(), any(), anyInt())).thenReturn(HistoryPage.last(newestFirst));
    }

    private void givenQaResult(QaResult result) {
        when(qaGatewayPort.ask(any(), any())).thenReturn(CompletableFuture.completedFuture(result));
    }

    private ContextRequest sentRequest() {
        ArgumentCaptor<ContextRequest> captor = ArgumentCaptor.forClass(ContextRequest.class);
        verify(qaGatewayPort).ask(captor.capture(), eq(Duration.ofSeconds(5)));
        return captor.getValue();
    }

    // ==================== context questions ====================

    @Test
    void roomWithoutAssistantsFailsBeforeAnyNetworkCall() {
        QuestionOutcome outcome = service.answerContextQuestion(ContextScope.channel(ROOM), null, "what happened?");

        assertFalse(outcome.isSuccess());
        assertEquals(ErrorKind.NO_ASSISTANT_CONFIGURED, outcome.getErrorKind());
        assertTrue(outcome.getUserMessage().startsWith("No assistant is configured"));
        verifyNoInteractions(chatHistoryPort, qaGatewayPort);
    }

    @Test
    void sendsMostRecentMessagesAsNamedChunks() {
        givenRoom(List.of("konflux"), 50);
        givenHistory(80);
        givenQaResult(QaResult.success(new Answer("The pipeline timed out.", "ans-7",
                List.of(new AnswerSource("https://docs/pipelines", "Pipelines")))));

        QuestionOutcome outcome = service.answerContextQuestion(ContextScope.channel(ROOM), null,
                "why did it fail?");

        ContextRequest request = sentRequest();
        assertEquals(50, request.chunks().size());
        assertEquals("Name U2: message 30", request.chunks().get(0).text());
        assertEquals("Name U3: message 79", request.chunks().get(49).text());
        assertEquals(List.of("konflux"), request.assistants());
        assertEquals(TestSettings.CONTEXT_PROMPT, request.systemPrompt());
        assertNull(request.prompt());
        assertNull(request.model());

        assertTrue(outcome.isSuccess());
        assertEquals("ans-7", outcome.getResponse().getAnswerId());
        assertTrue(outcome.getResponse().hasFeedbackControls());
        assertTrue(outcome.getResponse().getText().startsWith("The pipeline timed out."));
        assertTrue(outcome.getResponse().getText().contains("<https://docs/pipelines|Pipelines>"));
        assertTrue(feedbackTracker.isIssued("ans-7"));
    }

    @Test
    void threadQuestionRepliesInThread() {
        givenRoom(List.of("konflux"), 50);
        givenHistory(3);
        givenQaResult(QaResult.success(new Answer("ok", "ans-1", List.of())));

        QuestionOutcome outcome = service.answerContextQuestion(ContextScope.thread(ROOM, "1700.1"), "1700.1", "q");

        assertEquals("1700.1", outcome.getResponse().getThreadRef());
        assertEquals(ContextRequestBuilder.sessionIdFor(ContextScope.thread(ROOM, "1700.1")),
                sentRequest().sessionId());
    }

    @Test
    void emptyConversationAnswersWithoutCallingQa() {
        givenRoom(List.of("konflux"), 50);
        givenHistory(0);

        QuestionOutcome outcome = service.answerContextQuestion(ContextScope.channel(ROOM), null, "q");

        assertTrue(outcome.isSuccess());
        assertFalse(outcome.getResponse().hasFeedbackControls());
        assertTrue(outcome.getResponse().getText().contains("couldn't find any recent conversation"));
        verifyNoInteractions(qaGatewayPort);
    }

    @Test
    void unreadableHistoryReportsContextUnavailable() {
        givenRoom(List.of("konflux"), 50);
        when(chatHistoryPort.fetchPage(any(), any(), anyInt()))
                .thenThrow(new ContextUnavailableException("not_in_channel"));

        QuestionOutcome outcome = service.answerContextQuestion(ContextScope.channel(ROOM), null, "q");

        assertEquals(ErrorKind.CONTEXT_UNAVAILABLE, outcome.getErrorKind());
        verifyNoInteractions(qaGatewayPort);
    }

    // ==================== QA failures ====================

    @Test
    void rateLimitShowsGenericMessageNotRawBody() {
        givenRoom(List.of("konflux"), 50);
        givenHistory(5);
        givenQaResult(QaResult.failure(ErrorKind.RATE_LIMITED, 429, "HTTP 429: {\"detail\":\"slow down\"}"));

        QuestionOutcome outcome = service.answerContextQuestion(ContextScope.channel(ROOM), null, "q");

        assertFalse(outcome.isSuccess());
        assertEquals(ErrorKind.RATE_LIMITED, outcome.getErrorKind());
        assertEquals(GENERIC, outcome.getUserMessage());
        assertFalse(credentialGuard.isBlocked());
    }

    @Test
    void rejectedCredentialsBlockFurtherCalls() {
        givenRoom(List.of("konflux"), 50);
        givenHistory(5);
        givenQaResult(QaResult.failure(ErrorKind.UNAUTHORIZED, 401, "HTTP 401"));

        QuestionOutcome first = service.answerContextQuestion(ContextScope.channel(ROOM), null, "q");
        QuestionOutcome second = service.answerContextQuestion(ContextScope.channel(ROOM), null, "q");

        assertEquals(ErrorKind.UNAUTHORIZED, first.getErrorKind());
        assertEquals(ErrorKind.UNAUTHORIZED, second.getErrorKind());
        assertTrue(credentialGuard.isBlocked());
        verify(qaGatewayPort, times(1)).ask(any(), any());
    }

    @Test
    void failedGatewayFutureIsReportedAsServiceError() {
        givenRoom(List.of("konflux"), 50);
        givenHistory(5);
        when(qaGatewayPort.ask(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        QuestionOutcome outcome = service.answerContextQuestion(ContextScope.channel(ROOM), null, "q");

        assertEquals(ErrorKind.SERVICE_ERROR, outcome.getErrorKind());
        assertEquals(GENERIC, outcome.getUserMessage());
    }

    @Test
    void interruptedWaitCancelsQaCall() {
        givenRoom(List.of("konflux"), 50);
        givenHistory(5);
        CompletableFuture<QaResult> pending = new CompletableFuture<>();
        when(qaGatewayPort.ask(any(), any())).thenAnswer(invocation -> {
            Thread.currentThread().interrupt();
            return pending;
        });

        assertThrows(CancellationException.class,
                () -> service.answerContextQuestion(ContextScope.channel(ROOM), null, "q"));
        assertTrue(pending.isCancelled());
    }

    // ==================== mentions ====================

    @Test
    void mentionUsesRoomPromptWithoutHistory() {
        when(roomConfigPort.findById(ROOM)).thenReturn(Optional.of(RoomConfig.builder()
                .roomId(ROOM)
                .assistants(List.of("rhel"))
                .customPrompt("Answer like a pirate.")
                .contextSize(50)
                .build()));
        givenQaResult(QaResult.success(new Answer("Arr.", "ans-2", List.of())));

        QuestionOutcome outcome = service.answerMention(ROOM, "1700.5", "hello?");

        ContextRequest request = sentRequest();
        assertTrue(request.chunks().isEmpty());
        assertEquals("Answer like a pirate.", request.prompt());
        assertNull(request.systemPrompt());
        assertEquals("hello?", request.question());
        assertEquals("1700.5", outcome.getResponse().getThreadRef());
        verifyNoInteractions(chatHistoryPort);
    }

    @Test
    void mentionWithoutAssistantsIsRejected() {
        QuestionOutcome outcome = service.answerMention(ROOM, null, "hello?");

        assertEquals(ErrorKind.NO_ASSISTANT_CONFIGURED, outcome.getErrorKind());
        verifyNoInteractions(qaGatewayPort);
    }
}
