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


package org.fireflyframework.scheduler.core.notify;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.exception.WebhookDeliveryException;
import org.fireflyframework.scheduler.core.history.RunSerializer;
import org.fireflyframework.scheduler.core.model.JobRun;
import org.fireflyframework.scheduler.core.resilience.WebhookResilienceDecorator;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Posts run outcomes to webhook endpoints.
 *
 * <p>The returned {@link Mono} emits the response body on a 2xx answer and fails
 * with {@link WebhookDeliveryException} otherwise, including on timeout and
 * connection errors. Deciding what a failure means is left to the caller.
 */
@Slf4j
public class WebhookNotifier {

    public static final String JOB_HEADER = "X-Scheduler-Job";

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient webClient;
    private final WebhookPayloads payloads;
    private final Duration timeout;
    private final WebhookResilienceDecorator decorator;

    public WebhookNotifier(WebClient webClient, RunSerializer serializer, Duration timeout,
                           WebhookResilienceDecorator decorator) {
        this.webClient = webClient;
        this.payloads = new WebhookPayloads(serializer);
        this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        this.decorator = decorator;
    }

    public WebhookNotifier(WebClient webClient, Duration timeout) {
        this(webClient, new RunSerializer(), timeout, null);
    }

    public Mono<String> notify(JobRun run, String url, WebhookFormat format) {
        Mono<String> call = Mono.defer(() -> webClient.post()
                        .uri(url)
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(JOB_HEADER, run.name())
                        .bodyValue(payloads.body(run, format))
                        .exchangeToMono(resp -> handleResponse(url, resp)))
                .timeout(timeout);
        if (decorator != null) {
            call = decorator.decorate(url, call);
        }
        return call
                .onErrorMap(e -> !(e instanceof WebhookDeliveryException), e -> new WebhookDeliveryException(url, e))
                .doOnNext(body -> log.debug("[notifier] response job={} url={} format={} body={}", run.name(), url, format, body));
    }

    private static Mono<String> handleResponse(String url, ClientResponse resp) {
        if (resp.statusCode().is2xxSuccessful()) {
            return resp.bodyToMono(String.class).defaultIfEmpty("");
        }
        int status = resp.statusCode().value();
        return resp.bodyToMono(String.class)
                .onErrorResume(ex -> Mono.empty())
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(new WebhookDeliveryException(url, status, body)));
    }
}
