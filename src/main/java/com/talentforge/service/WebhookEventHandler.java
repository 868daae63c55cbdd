package com.talentforge.service;

import com.talentforge.model.HandlerResult;
import com.talentforge.model.ProviderEvent;
import com.talentforge.model.WebhookProvider;

/**
 * Applies one provider's events to durable state. Implementations run in a
 * single transaction per event and signal failure by throwing.
 */
public interface WebhookEventHandler<E extends ProviderEvent> {

    WebhookProvider getProvider();

    Class<E> getEventClass();

    HandlerResult handle(E event);
}
