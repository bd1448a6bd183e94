package me.golemcore.contextbot.adapter.outbound.qa;

import me.golemcore.contextbot.domain.model.FeedbackRecord;
import me.golemcore.contextbot.domain.model.FeedbackVerdict;
import me.golemcore.contextbot.infrastructure.config.BotProperties;
import me.golemcore.contextbot.testsupport.http.OkHttpMockEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HttpFeedbackSinkAdapterTest {

    private OkHttpMockEngine httpEngine;
    private HttpFeedbackSinkAdapter adapter;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        BotProperties properties = new BotProperties();
        properties.getQa().setUrl("http://mock.qa.local");
        properties.getQa().setApiToken("secret-token");
        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(httpEngine)
                .build();
        adapter = new HttpFeedbackSinkAdapter(properties, client, new ObjectMapper());
    }

    private static FeedbackRecord vote(FeedbackVerdict verdict) {
        return new FeedbackRecord("ans-1", "U1", verdict, Instant.parse("2026-03-01T10:00:00Z"));
    }

    @Test
    void forwardsDislike() throws Exception {
        httpEngine.enqueueJson(200, "{}");

        adapter.forward(vote(FeedbackVerdict.NEGATIVE)).get(5, TimeUnit.SECONDS);

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/api/feedback", request.target());
        assertEquals("Bearer secret-token", request.headers().get("Authorization"));
        JsonNode body = new ObjectMapper().readTree(request.body());
        assertFalse(body.get("like").asBoolean());
        assertTrue(body.get("dislike").asBoolean());
        assertEquals("", body.get("feedback").asText());
        assertEquals("ans-1", body.get("interactionId").asText());
    }

    @Test
    void forwardsLike() throws Exception {
        httpEngine.enqueueJson(204, "");

        adapter.forward(vote(FeedbackVerdict.POSITIVE)).get(5, TimeUnit.SECONDS);

        JsonNode body = new ObjectMapper().readTree(httpEngine.takeRequest().body());
        assertTrue(body.get("like").asBoolean());
        assertFalse(body.get("dislike").asBoolean());
    }

    @Test
    void failsFutureOnErrorStatus() {
        httpEngine.enqueueJson(502, "");

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.forward(vote(FeedbackVerdict.POSITIVE)).get(5, TimeUnit.SECONDS));
        assertTrue(error.getCause().getMessage().contains("502"));
    }
}
