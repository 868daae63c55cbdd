package com.talentforge.service;

import com.opencsv.CSVWriter;
import com.talentforge.exception.ResourceNotFoundException;
import com.talentforge.model.DeadLetterPage;
import com.talentforge.model.DeadLetterView;
import com.talentforge.model.WebhookEvent;
import com.talentforge.model.WebhookEventStatus;
import com.talentforge.model.WebhookProvider;
import com.talentforge.repository.WebhookEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Operator view of dead-lettered webhook events.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeadLetterService {

    static final int MAX_PAGE_SIZE = 100;
    private static final Duration MANUAL_RETRY_DELAY = Duration.ofMinutes(1);

    private final WebhookEventRepository repository;
    private final Clock clock;

    /**
     * @param page 1-based page number
     */
    public DeadLetterPage list(int page, int limit, String provider, String eventType) {
        int safePage = Math.max(page, 1);
        int safeLimit = Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);
        WebhookProvider providerFilter = provider != null && !provider.isBlank()
                ? WebhookProvider.fromKey(provider)
                : null;
        String typeFilter = eventType != null && !eventType.isBlank() ? eventType : null;

        Page<WebhookEvent> result = repository.search(WebhookEventStatus.DEAD_LETTER, providerFilter, typeFilter,
                PageRequest.of(safePage - 1, safeLimit, Sort.by(Sort.Direction.DESC, "createdAt")));

        List<DeadLetterView> views = result.getContent().stream()
                .map(DeadLetterView::from)
                .collect(Collectors.toList());

        return DeadLetterPage.builder()
                .deadLetters(views)
                .total(result.getTotalElements())
                .page(safePage)
                .totalPages(result.getTotalPages())
                .limit(safeLimit)
                .build();
    }

    /**
     * Puts a dead letter back into the retry queue with a fresh attempt budget.
     */
    public DeadLetterView requeue(UUID webhookEventId) {
        WebhookEvent entry = repository.findById(webhookEventId)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook event not found: " + webhookEventId));
        if (entry.getStatus() != WebhookEventStatus.DEAD_LETTER) {
            throw new IllegalArgumentException("Webhook event is not in dead letter queue (status: "
                    + entry.getStatus().name().toLowerCase() + ")");
        }

        if (repository.resetDeadLetter(webhookEventId, clock.instant().plus(MANUAL_RETRY_DELAY)) == 0) {
            throw new IllegalStateException("Webhook event changed while requeueing: " + webhookEventId);
        }
        log.info("[{}:{}] Dead letter requeued by operator", entry.getProvider().getKey(), entry.getEventId());

        return repository.findById(webhookEventId)
                .map(DeadLetterView::from)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook event not found: " + webhookEventId));
    }

    public String exportCsv() {
        List<WebhookEvent> deadLetters = repository.findAllByStatusOrderByCreatedAtDesc(WebhookEventStatus.DEAD_LETTER);
        StringWriter buffer = new StringWriter();

        try (CSVWriter writer = new CSVWriter(buffer)) {
            writer.writeNext(DeadLetterView.getCsvHeaders());
            for (WebhookEvent entry : deadLetters) {
                writer.writeNext(DeadLetterView.from(entry).toCsvRow());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write dead letter CSV", e);
        }

        log.info("Exported {} dead letters", deadLetters.size());
        return buffer.toString();
    }
}
