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

import me.golemcore.contextbot.domain.model.FeedbackRecord;
import me.golemcore.contextbot.domain.model.FeedbackVerdict;
import me.golemcore.contextbot.infrastructure.config.BotProperties;
import me.golemcore.contextbot.port.outbound.FeedbackSinkPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards accepted votes to the QA service ({@code POST /api/feedback}) so
 * it can rate its answers.
 */
@Component
@Slf4j
public class HttpFeedbackSinkAdapter implements FeedbackSinkPort {

    static final String FEEDBACK_PATH = "/api/feedback";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String baseUrl;
    private final String apiToken;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpFeedbackSinkAdapter(BotProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.baseUrl = HttpQaGatewayAdapter.stripTrailingSlash(properties.getQa().getUrl());
        this.apiToken = properties.getQa().getApiToken();
        this.httpClient = httpClient.newBuilder()
                .followRedirects(false)
                .followSslRedirects(false)
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<Void> forward(FeedbackRecord record) {
        boolean positive = record.verdict() == FeedbackVerdict.POSITIVE;
        String body;
        try {
            body = objectMapper.writeValueAsString(
                    new FeedbackRequest(positive, !positive, "", record.answerId()));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }

        Request.Builder requestBuilder = new Request.Builder()
                .url(baseUrl + FEEDBACK_PATH)
                .post(RequestBody.create(body, JSON));
        if (apiToken != null && !apiToken.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiToken);
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        httpClient.newCall(requestBuilder.build()).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                result.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (response.isSuccessful()) {
                        log.debug("[Feedback] Forwarded vote on {}", record.answerId());
                        result.complete(null);
                    } else {
                        result.completeExceptionally(new IOException("Feedback endpoint returned HTTP "
                                + response.code()));
                    }
                }
            }
        });
        return result;
    }

    // Request DTO
    record FeedbackRequest(boolean like, boolean dislike, String feedback, String interactionId) {
    }
}
