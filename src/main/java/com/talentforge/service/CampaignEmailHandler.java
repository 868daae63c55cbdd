package com.talentforge.service;

import com.talentforge.model.Campaign;
import com.talentforge.model.CampaignSend;
import com.talentforge.model.Candidate;
import com.talentforge.model.EmailWebhookEvent;
import com.talentforge.model.HandlerResult;
import com.talentforge.model.SuppressionReason;
import com.talentforge.model.WebhookProvider;
import com.talentforge.repository.CampaignRepository;
import com.talentforge.repository.CampaignSendRepository;
import com.talentforge.repository.CandidateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Email provider events against campaign sends. Mail that does not belong
 * to a campaign (transactional mail) is acknowledged and ignored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignEmailHandler implements WebhookEventHandler<EmailWebhookEvent> {

    static final String DEFAULT_BOUNCE_MESSAGE = "Email bounced";

    private final CampaignSendRepository sendRepository;
    private final CampaignRepository campaignRepository;
    private final CandidateRepository candidateRepository;
    private final CampaignMetricsUpdater metricsUpdater;
    private final SuppressionService suppressionService;

    @Override
    public WebhookProvider getProvider() {
        return WebhookProvider.EMAIL;
    }

    @Override
    public Class<EmailWebhookEvent> getEventClass() {
        return EmailWebhookEvent.class;
    }

    @Override
    @Transactional
    public HandlerResult handle(EmailWebhookEvent event) {
        Optional<CampaignSend> found = sendRepository.findFirstByProviderMessageId(event.getEmailId());
        if (found.isEmpty()) {
            log.info("[resend:{}] No campaign send for email {}, ignoring", event.getEventId(), event.getEmailId());
            return HandlerResult.unknownEntity(event.getEmailId());
        }

        CampaignSend send = found.get();
        Campaign campaign = campaignRepository.findById(send.getCampaignId()).orElse(null);
        Candidate candidate = candidateRepository.findById(send.getCandidateId()).orElse(null);
        if (campaign == null || candidate == null) {
            log.warn("[resend:{}] Send {} has no campaign or candidate, ignoring", event.getEventId(), send.getId());
            return HandlerResult.unknownEntity(event.getEmailId());
        }
        if (!Objects.equals(campaign.getCompanyId(), candidate.getCompanyId())) {
            log.warn("[resend:{}] Ownership mismatch for send {}: campaign company {} vs candidate company {}",
                    event.getEventId(), send.getId(), campaign.getCompanyId(), candidate.getCompanyId());
            return HandlerResult.noChange("ownership mismatch");
        }

        Instant at = event.getOccurredAt();
        switch (event.getType()) {
            case SENT:
                return HandlerResult.noChange("already marked sent");
            case DELIVERED:
                return outcome(metricsUpdater.recordDelivered(send, at), send, event);
            case OPENED:
                return outcome(metricsUpdater.recordOpened(send, at), send, event);
            case CLICKED:
                return outcome(metricsUpdater.recordClicked(send, at), send, event);
            case BOUNCED:
                return bounced(send, campaign, candidate, event);
            case COMPLAINED:
                boolean added = suppressionService.suppress(campaign.getCompanyId(), candidate.getEmail(),
                        SuppressionReason.COMPLAINT, send.getId().toString());
                return added ? HandlerResult.applied() : HandlerResult.noChange("already suppressed");
            case DELIVERY_DELAYED:
                log.info("[resend:{}] Delivery delayed for send {}", event.getEventId(), send.getId());
                return HandlerResult.noChange("delivery delayed");
            default:
                log.info("[resend:{}] Unhandled event type {}", event.getEventId(), event.getEventType());
                return HandlerResult.unhandledType(event.getEventType());
        }
    }

    private HandlerResult bounced(CampaignSend send, Campaign campaign, Candidate candidate, EmailWebhookEvent event) {
        String message = event.getBounceMessage() != null && !event.getBounceMessage().isBlank()
                ? event.getBounceMessage()
                : DEFAULT_BOUNCE_MESSAGE;
        boolean recorded = metricsUpdater.recordBounced(send, event.getOccurredAt(), message);

        boolean suppressed = suppressionService.suppress(campaign.getCompanyId(), candidate.getEmail(),
                SuppressionReason.BOUNCE, send.getId().toString());

        return recorded || suppressed ? HandlerResult.applied() : HandlerResult.noChange("bounce already recorded");
    }

    private HandlerResult outcome(boolean changed, CampaignSend send, EmailWebhookEvent event) {
        if (!changed) {
            log.info("[resend:{}] {} already recorded for send {}", event.getEventId(), event.getEventType(), send.getId());
            return HandlerResult.noChange(event.getEventType() + " already recorded");
        }
        return HandlerResult.applied();
    }
}
