package com.talentforge.service;

import com.talentforge.model.TranscriptionJobRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TranscriptionClient Tests")
class TranscriptionClientTest {

    private static final String URL = "http://transcriber.local/jobs";

    private final TranscriptionJobRequest request = TranscriptionJobRequest.builder()
            .uuid("4f1c2a7e-0000-0000-0000-000000000001")
            .recordingUrl("https://zoom.example/screen")
            .callbackUrl("http://localhost:8080/api/interviews/4f1c2a7e-0000-0000-0000-000000000001/transcript/callback")
            .build();

    private static ClientResponse response(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE)
                .body(body)
                .build();
    }

    private static TranscriptionClient client(ExchangeFunction exchange, int retries) {
        return new TranscriptionClient(WebClient.builder().exchangeFunction(exchange).build(), URL, retries, 1);
    }

    @Test
    @DisplayName("Should POST the job to the configured URL")
    void shouldPostJob() {
        List<ClientRequest> requests = new ArrayList<>();
        TranscriptionClient client = client(req -> {
            requests.add(req);
            return Mono.just(response(HttpStatus.ACCEPTED, "queued"));
        }, 3);

        String result = client.submit(request).block();

        assertThat(result).isEqualTo("queued");
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(requests.get(0).url().toString()).isEqualTo(URL);
    }

    @Test
    @DisplayName("Should retry server errors until the job is accepted")
    void shouldRetryServerErrors() {
        AtomicInteger calls = new AtomicInteger();
        TranscriptionClient client = client(req -> calls.incrementAndGet() < 3
                ? Mono.just(response(HttpStatus.SERVICE_UNAVAILABLE, "busy"))
                : Mono.just(response(HttpStatus.OK, "ok")), 3);

        assertThat(client.submit(request).block()).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("Should give up after the configured number of retries")
    void shouldGiveUpAfterRetries() {
        AtomicInteger calls = new AtomicInteger();
        TranscriptionClient client = client(req -> {
            calls.incrementAndGet();
            return Mono.just(response(HttpStatus.INTERNAL_SERVER_ERROR, "down"));
        }, 2);

        Throwable thrown = catchThrowable(() -> client.submit(request).block());

        assertThat(Exceptions.isRetryExhausted(thrown)).isTrue();
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("Should report unconfigured when no URL is set")
    void shouldReportUnconfigured() {
        TranscriptionClient client = new TranscriptionClient(WebClient.create(), " ", 3, 1);

        assertThat(client.isConfigured()).isFalse();
    }
}
