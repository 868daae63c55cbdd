package com.talentforge.model;

import java.time.Instant;

/**
 * A verified, parsed webhook event. Implementations are per provider and
 * carry typed fields for their event family; handlers never see raw JSON.
 */
public interface ProviderEvent {

    WebhookProvider getProvider();

    /** Event type as the provider names it on the wire. */
    String getEventType();

    String getEventId();

    /** Reference used to find the owning entity (meeting id, email id). */
    String getRelatedEntityRef();

    Instant getOccurredAt();
}
