/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
 */


package org.fireflyframework.scheduler.unit.notify;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.fireflyframework.scheduler.core.exception.WebhookDeliveryException;
import org.fireflyframework.scheduler.core.history.RunSerializer;
import org.fireflyframework.scheduler.core.model.JobRun;
import org.fireflyframework.scheduler.core.notify.WebhookFormat;
import org.fireflyframework.scheduler.core.notify.WebhookNotifier;
import org.fireflyframework.scheduler.core.resilience.WebhookResilienceDecorator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class WebhookNotifierTest {

    private MockWebServer server;
    private WebhookNotifier notifier;

    private final JobRun run = new JobRun(0, "done\n", "backup", Instant.parse("2024-02-02T02:02:02Z"),
            "cron", List.of("cleanup"), Duration.ofSeconds(3), Map.of());

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        notifier = new WebhookNotifier(WebClient.create(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private String url() {
        return server.url("/hook").toString();
    }

    @Test
    void generic_postsRunRecordAndReturnsBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("thanks"));

        StepVerifier.create(notifier.notify(run, url(), WebhookFormat.GENERIC))
                .expectNext("thanks")
                .verifyComplete();

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(request.getHeader(WebhookNotifier.JOB_HEADER)).isEqualTo("backup");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"name\":\"backup\"")
                .contains("\"triggered_by\":\"cron\"")
                .contains("\"triggered\":[\"cleanup\"]");
    }

    @Test
    void slack_postsTextSummary() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        StepVerifier.create(notifier.notify(run, url(), WebhookFormat.SLACK))
                .expectNext("ok")
                .verifyComplete();

        String body = server.takeRequest(5, TimeUnit.SECONDS).getBody().readUtf8();
        assertThat(body).isEqualTo("{\"text\":\"backup finished with status 0, triggered by cron\"}");
    }

    @Test
    void emptyResponseBody_emitsEmptyString() {
        server.enqueue(new MockResponse().setResponseCode(204));

        StepVerifier.create(notifier.notify(run, url(), WebhookFormat.GENERIC))
                .expectNext("")
                .verifyComplete();
    }

    @Test
    void errorStatus_failsWithDeliveryException() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("broken"));

        StepVerifier.create(notifier.notify(run, url(), WebhookFormat.GENERIC))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(WebhookDeliveryException.class);
                    var wde = (WebhookDeliveryException) e;
                    assertThat(wde.getStatusCode()).isEqualTo(500);
                    assertThat(wde.getUrl()).isEqualTo(url());
                    assertThat(wde.getMessage()).contains("broken");
                    assertThat(wde.getErrorCode()).isEqualTo("SCHEDULER_WEBHOOK_ERROR");
                })
                .verify(Duration.ofSeconds(10));
    }

    @Test
    void unreachableEndpoint_failsWithDeliveryException() throws IOException {
        String deadUrl = url();
        server.shutdown();

        StepVerifier.create(notifier.notify(run, deadUrl, WebhookFormat.GENERIC))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(WebhookDeliveryException.class);
                    assertThat(((WebhookDeliveryException) e).getStatusCode()).isEqualTo(-1);
                })
                .verify(Duration.ofSeconds(10));
    }

    @Test
    void slowEndpoint_timesOut() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("late").setBodyDelay(2, TimeUnit.SECONDS));
        var impatient = new WebhookNotifier(WebClient.create(), Duration.ofMillis(200));

        StepVerifier.create(impatient.notify(run, url(), WebhookFormat.GENERIC))
                .expectError(WebhookDeliveryException.class)
                .verify(Duration.ofSeconds(10));
    }

    @Test
    void circuitBreaker_opensAfterFailures() {
        var registry = CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build());
        var decorator = new WebhookResilienceDecorator(registry);
        var guarded = new WebhookNotifier(WebClient.create(), new RunSerializer(), Duration.ofSeconds(5), decorator);
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(500));

        for (int i = 0; i < 2; i++) {
            StepVerifier.create(guarded.notify(run, url(), WebhookFormat.GENERIC))
                    .expectError(WebhookDeliveryException.class)
                    .verify(Duration.ofSeconds(10));
        }
        assertThat(decorator.getCircuitBreaker(url()).getState()).isEqualTo(CircuitBreaker.State.OPEN);

        StepVerifier.create(guarded.notify(run, url(), WebhookFormat.GENERIC))
                .expectError(WebhookDeliveryException.class)
                .verify(Duration.ofSeconds(10));
        assertThat(server.getRequestCount()).isEqualTo(2);
    }
}
