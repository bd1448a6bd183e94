package me.golemcore.contextbot.adapter.outbound.qa;

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

import me.golemcore.contextbot.domain.exception.ErrorKind;
import me.golemcore.contextbot.domain.model.Answer;
import me.golemcore.contextbot.domain.model.AnswerSource;
import me.golemcore.contextbot.domain.model.ContextRequest;
import me.golemcore.contextbot.domain.model.QaResult;
import me.golemcore.contextbot.domain.model.RuntimeSettings;
import me.golemcore.contextbot.infrastructure.config.BotProperties;
import me.golemcore.contextbot.port.outbound.QaGatewayPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * QA service adapter: posts a {@link ContextRequest} to
 * {@code POST /api/assistants/chat} with bearer authentication.
 *
 * <p>
 * The call is asynchronous on OkHttp's dispatcher. Cancelling the returned
 * future cancels the OkHttp call, which closes its connection. Exactly one
 * attempt is made: the derived client neither retries nor follows redirects,
 * and a {@code 503} loses its {@code Retry-After} header before OkHttp can
 * schedule a follow-up for it.
 *
 * <p>
 * Response format:
 *
 * <pre>
 * {"answer_text": "...", "answer_id": "...",
 *  "search_metadata": [{"metadata": {"citation_url": "...", "title": "..."}}]}
 * </pre>
 *
 * Nothing is logged here: failures are described in {@link QaResult#getDetail()}
 * and logged by the caller.
 *
 * @see me.golemcore.contextbot.port.outbound.QaGatewayPort
 */
@Component
public class HttpQaGatewayAdapter implements QaGatewayPort {

    static final String CHAT_PATH = "/api/assistants/chat";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String baseUrl;
    private final String apiToken;
    private final Duration defaultTimeout;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpQaGatewayAdapter(BotProperties properties, RuntimeSettings settings, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.baseUrl = stripTrailingSlash(properties.getQa().getUrl());
        this.apiToken = properties.getQa().getApiToken();
        this.defaultTimeout = settings.qaTimeout();
        this.objectMapper = objectMapper;

        // Dedicated client with the QA deadline and no silent follow-ups
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(defaultTimeout)
                .readTimeout(defaultTimeout)
                .retryOnConnectionFailure(false)
                .followRedirects(false)
                .followSslRedirects(false)
                .addNetworkInterceptor(HttpQaGatewayAdapter::dropRetryAfter)
                .build();
    }

    @Override
    public CompletableFuture<QaResult> ask(ContextRequest request, Duration timeout) {
        String body;
        try {
            body = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Failed to serialize QA request", e));
        }

        Request.Builder requestBuilder = new Request.Builder()
                .url(baseUrl + CHAT_PATH)
                .post(RequestBody.create(body, JSON));
        addAuthorizationHeader(requestBuilder);

        Call call = clientFor(timeout).newCall(requestBuilder.build());
        CompletableFuture<QaResult> result = new CompletableFuture<>();
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                call.cancel();
            }
        });

        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failedCall, IOException e) {
                result.complete(QaResult.failure(QaErrorClassifier.classifyFailure(e),
                        "Request failed: " + e.getMessage()));
            }

            @Override
            public void onResponse(Call completedCall, Response response) {
                try (response) {
                    result.complete(toResult(response));
                } catch (IOException e) {
                    result.complete(QaResult.failure(QaErrorClassifier.classifyFailure(e),
                            "Failed to read response: " + e.getMessage()));
                }
            }
        });
        return result;
    }

    private QaResult toResult(Response response) throws IOException {
        ResponseBody responseBody = response.body();
        String body = responseBody != null ? responseBody.string() : "";
        int code = response.code();
        if (!response.isSuccessful()) {
            return QaResult.failure(QaErrorClassifier.classifyStatus(code), code,
                    "HTTP " + code + ": " + QaErrorClassifier.truncate(body));
        }
        return parseAnswer(body);
    }

    private QaResult parseAnswer(String body) {
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return QaResult.failure(ErrorKind.MALFORMED_RESPONSE,
                    "Response is not JSON: " + QaErrorClassifier.truncate(body));
        }
        if (node == null || !node.isObject()) {
            return QaResult.failure(ErrorKind.MALFORMED_RESPONSE, "Response is not a JSON object");
        }

        JsonNode answerText = node.get("answer_text");
        JsonNode answerId = node.get("answer_id");
        if (answerText == null || !answerText.isTextual()) {
            return QaResult.failure(ErrorKind.MALFORMED_RESPONSE, "Response has no answer_text");
        }
        if (answerId == null || answerId.isNull() || answerId.asText().isBlank()) {
            return QaResult.failure(ErrorKind.MALFORMED_RESPONSE, "Response has no answer_id");
        }
        return QaResult.success(new Answer(answerText.asText(), answerId.asText(), parseSources(node)));
    }

    private List<AnswerSource> parseSources(JsonNode node) {
        JsonNode metadata = node.path("search_metadata");
        List<AnswerSource> sources = new ArrayList<>();
        if (!metadata.isArray()) {
            return sources;
        }
        for (JsonNode entry : metadata) {
            JsonNode source = entry.path("metadata");
            String url = source.path("citation_url").asText("");
            if (!url.isBlank()) {
                sources.add(new AnswerSource(url, source.path("title").asText("Source")));
            }
        }
        return sources;
    }

    private OkHttpClient clientFor(Duration timeout) {
        if (timeout == null || timeout.equals(defaultTimeout)) {
            return httpClient;
        }
        return httpClient.newBuilder()
                .callTimeout(timeout)
                .readTimeout(timeout)
                .build();
    }

    static Response dropRetryAfter(Interceptor.Chain chain) throws IOException {
        Response response = chain.proceed(chain.request());
        if (response.code() == 503 && response.header("Retry-After") != null) {
            return response.newBuilder().removeHeader("Retry-After").build();
        }
        return response;
    }

    private void addAuthorizationHeader(Request.Builder builder) {
        if (apiToken != null && !apiToken.isBlank()) {
            builder.header("Authorization", "Bearer " + apiToken);
        }
    }

    static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
