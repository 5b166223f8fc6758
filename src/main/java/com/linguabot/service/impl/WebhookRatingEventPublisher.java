package com.linguabot.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linguabot.model.RatingChangeEvent;
import com.linguabot.service.api.RatingEventPublisher;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;

/**
 * Delivers rating-change events as JSON POSTs to a configured webhook.
 * <p>
 * Requests are queued on OkHttp's dispatcher, so publishing never blocks the calling learner's turn.
 * Delivery is best effort: failures are logged and not retried. Without a webhook URL, events are
 * only logged.
 * </p>
 */
@Service
public class WebhookRatingEventPublisher implements RatingEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(WebhookRatingEventPublisher.class);

    private static final MediaType MEDIA_TYPE_JSON = MediaType.get("application/json; charset=utf-8");
    private static final long TIMEOUT_SECONDS = 10;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String webhookUrl;

    public WebhookRatingEventPublisher(ObjectMapper objectMapper,
                                       @Value("${app.notifications.webhook-url:}") String webhookUrl) {
        this.objectMapper = objectMapper;
        this.webhookUrl = webhookUrl;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(TIMEOUT_SECONDS))
                .writeTimeout(Duration.ofSeconds(TIMEOUT_SECONDS))
                .readTimeout(Duration.ofSeconds(TIMEOUT_SECONDS))
                .build();
    }

    @Override
    public void publish(RatingChangeEvent event) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.info("Rating change for {}: {} -> {} ({} -> {}, {})", event.userId(), event.oldScore(),
                    event.newScore(), event.oldLevel(), event.newLevel(), event.reason());
            return;
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize rating change for {}: {}", event.userId(), e.getMessage());
            return;
        }

        var request = new Request.Builder()
                .url(webhookUrl)
                .post(RequestBody.create(json, MEDIA_TYPE_JSON))
                .build();

        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.warn("Rating webhook delivery for {} failed: {}", event.userId(), e.getMessage());
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (!response.isSuccessful()) {
                        log.warn("Rating webhook rejected event for {} with code {}", event.userId(), response.code());
                    } else {
                        log.debug("Rating webhook accepted event for {}", event.userId());
                    }
                }
            }
        });
    }
}
