package com.talentforge.service;

import com.talentforge.model.TranscriptionJobRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Submits transcription jobs to the external transcription service.
 */
@Slf4j
@Component
public class TranscriptionClient {

    private final WebClient webClient;
    private final String transcriptionUrl;
    private final int submitRetries;
    private final Duration initialBackoff;

    public TranscriptionClient(WebClient webClient,
                               @Value("${pipeline.transcription-url:}") String transcriptionUrl,
                               @Value("${pipeline.submit-retries:3}") int submitRetries,
                               @Value("${pipeline.retry-backoff-ms:2000}") long retryBackoffMs) {
        this.webClient = webClient;
        this.transcriptionUrl = transcriptionUrl;
        this.submitRetries = submitRetries;
        this.initialBackoff = Duration.ofMillis(retryBackoffMs);
    }

    public boolean isConfigured() {
        return transcriptionUrl != null && !transcriptionUrl.isBlank();
    }

    /**
     * POSTs the job, retrying with exponential backoff. Errors after the
     * last retry are emitted to the subscriber.
     */
    public Mono<String> submit(TranscriptionJobRequest request) {
        log.info("[{}] Submitting transcription job to: {}", request.getUuid(), transcriptionUrl);

        return webClient.post()
                .uri(transcriptionUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .retryWhen(Retry.backoff(submitRetries, initialBackoff)
                        .maxBackoff(initialBackoff.multipliedBy(5))
                        .doBeforeRetry(signal ->
                            log.warn("[{}] Retrying transcription submit, attempt: {}",
                                    request.getUuid(), signal.totalRetries() + 1)))
                .doOnSuccess(response ->
                    log.info("[{}] Transcription job accepted. Response: {}", request.getUuid(), response));
    }
}
