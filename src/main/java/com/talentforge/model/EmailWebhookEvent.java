package com.talentforge.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class EmailWebhookEvent implements ProviderEvent {

    EmailEventType type;
    String eventType;
    String eventId;
    String emailId;
    Instant occurredAt;
    String bounceMessage;
    String bounceType;
    String clickedLink;

    @Override
    public WebhookProvider getProvider() {
        return WebhookProvider.EMAIL;
    }

    @Override
    public String getRelatedEntityRef() {
        return emailId;
    }
}
