package me.golemcore.contextbot.adapter.outbound.qa;

import me.golemcore.contextbot.domain.exception.ErrorKind;
import me.golemcore.contextbot.domain.model.ContextChunk;
import me.golemcore.contextbot.domain.model.ContextRequest;
import me.golemcore.contextbot.domain.model.FeedbackRecord;
import me.golemcore.contextbot.domain.model.FeedbackVerdict;
import me.golemcore.contextbot.domain.model.QaResult;
import me.golemcore.contextbot.infrastructure.config.BotProperties;
import me.golemcore.contextbot.testsupport.TestSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the QA adapters against a real local HTTP server, so OkHttp's own
 * retry and follow-up handling is part of the call path.
 */
class HttpQaGatewayAdapterServerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final String ANSWER_JSON = "{\"answer_text\": \"late\", \"answer_id\": \"ans-2\"}";

    private MockWebServer server;
    private BotProperties properties;
    private HttpQaGatewayAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        properties = new BotProperties();
        properties.getQa().setUrl(server.url("/").toString());
        properties.getQa().setApiToken("secret-token");
        adapter = new HttpQaGatewayAdapter(properties, TestSettings.defaults(), new OkHttpClient(),
                new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private QaResult ask() throws Exception {
        ContextRequest request = ContextRequest.builder()
                .question("why did the build fail?")
                .chunks(List.of(new ContextChunk("Alice: lint is red")))
                .assistants(List.of("konflux"))
                .sessionId("session-1")
                .client(TestSettings.BOT_NAME)
                .prompt(TestSettings.CONTEXT_PROMPT)
                .build();
        return adapter.ask(request, TIMEOUT).get(10, TimeUnit.SECONDS);
    }

    private void enqueueAnswer() {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody(ANSWER_JSON));
    }

    @Test
    void shouldNotRetryUnavailableWithZeroRetryAfter() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(503)
                .setHeader("Retry-After", "0")
                .setBody("busy"));
        enqueueAnswer();

        QaResult result = ask();

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.SERVICE_ERROR, result.getErrorKind());
        assertEquals(503, result.getStatusCode());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void shouldNotFollowTemporaryRedirect() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(307)
                .setHeader("Location", HttpQaGatewayAdapter.CHAT_PATH));
        enqueueAnswer();

        QaResult result = ask();

        assertEquals(ErrorKind.SERVICE_ERROR, result.getErrorKind());
        assertEquals(307, result.getStatusCode());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void shouldNotFollowFoundRedirect() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(302)
                .setHeader("Location", "/elsewhere"));
        enqueueAnswer();

        QaResult result = ask();

        assertEquals(ErrorKind.SERVICE_ERROR, result.getErrorKind());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void shouldNotRetryRequestTimeoutStatus() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(408));
        enqueueAnswer();

        QaResult result = ask();

        assertEquals(ErrorKind.TIMEOUT, result.getErrorKind());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void shouldParseAnswerFromServer() throws Exception {
        enqueueAnswer();

        QaResult result = ask();

        assertTrue(result.isSuccess());
        assertEquals("ans-2", result.getAnswer().answerId());
        assertEquals(HttpQaGatewayAdapter.CHAT_PATH, server.takeRequest().getPath());
    }

    @Test
    void feedbackForwardShouldNotFollowRedirect() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(308)
                .setHeader("Location", HttpFeedbackSinkAdapter.FEEDBACK_PATH));
        server.enqueue(new MockResponse().setResponseCode(200));
        HttpFeedbackSinkAdapter sink = new HttpFeedbackSinkAdapter(properties, new OkHttpClient(),
                new ObjectMapper());

        ExecutionException failure = assertThrows(ExecutionException.class, () -> sink
                .forward(new FeedbackRecord("ans-1", "U1", FeedbackVerdict.POSITIVE, Instant.EPOCH))
                .get(10, TimeUnit.SECONDS));

        assertInstanceOf(IOException.class, failure.getCause());
        assertEquals(1, server.getRequestCount());
    }
}
