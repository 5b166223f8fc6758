package com.linguabot.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linguabot.TestFixtures;
import com.linguabot.model.Level;
import com.linguabot.model.RatingChangeEvent;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class WebhookRatingEventPublisherTest {

    private static final RatingChangeEvent EVENT = new RatingChangeEvent("mina", 90L, 114L, Level.NOVICE,
            Level.ELEMENTARY, "TEST", Instant.parse("2024-05-01T10:00:00Z"));

    private final ObjectMapper objectMapper = TestFixtures.objectMapper();

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("A rating change should be posted to the webhook as JSON")
    void testPostsEvent() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        var publisher = new WebhookRatingEventPublisher(objectMapper, server.url("/hooks/rating").toString());

        publisher.publish(EVENT);

        var request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/hooks/rating");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");

        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.get("userId").asText()).isEqualTo("mina");
        assertThat(body.get("oldScore").asLong()).isEqualTo(90L);
        assertThat(body.get("newScore").asLong()).isEqualTo(114L);
        assertThat(body.get("newLevel").asText()).isEqualTo("ELEMENTARY");
        assertThat(body.get("reason").asText()).isEqualTo("TEST");
    }

    @Test
    @DisplayName("A rejected delivery should not surface to the caller")
    void testRejectedDelivery() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500));
        var publisher = new WebhookRatingEventPublisher(objectMapper, server.url("/hooks/rating").toString());

        assertThatCode(() -> publisher.publish(EVENT)).doesNotThrowAnyException();
        assertThat(server.takeRequest(5, TimeUnit.SECONDS)).isNotNull();
    }

    @Test
    @DisplayName("Without a webhook URL the event should only be logged")
    void testNoWebhookConfigured() throws Exception {
        var publisher = new WebhookRatingEventPublisher(objectMapper, "");

        assertThatCode(() -> publisher.publish(EVENT)).doesNotThrowAnyException();
        assertThat(server.takeRequest(200, TimeUnit.MILLISECONDS)).isNull();
        assertThat(server.getRequestCount()).isZero();
    }
}
