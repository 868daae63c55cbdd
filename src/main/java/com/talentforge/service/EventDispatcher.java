package com.talentforge.service;

import com.talentforge.model.HandlerResult;
import com.talentforge.model.ProviderEvent;
import com.talentforge.model.WebhookProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a verified, deduplicated event to its provider's handler.
 */
@Slf4j
@Component
public class EventDispatcher {

    private final Map<WebhookProvider, WebhookEventHandler<?>> handlers = new EnumMap<>(WebhookProvider.class);

    public EventDispatcher(List<WebhookEventHandler<?>> handlers) {
        for (WebhookEventHandler<?> handler : handlers) {
            WebhookEventHandler<?> previous = this.handlers.put(handler.getProvider(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for " + handler.getProvider());
            }
        }
    }

    public HandlerResult dispatch(ProviderEvent event) {
        WebhookEventHandler<?> handler = handlers.get(event.getProvider());
        if (handler == null) {
            log.warn("[{}:{}] No handler registered", event.getProvider().getKey(), event.getEventId());
            return HandlerResult.unhandledType(event.getEventType());
        }

        HandlerResult result = invoke(handler, event);
        log.info("[{}:{}] {} -> {}{}", event.getProvider().getKey(), event.getEventId(),
                event.getEventType(), result.getOutcome(),
                result.getDetail() != null ? " (" + result.getDetail() + ")" : "");
        return result;
    }

    private static <E extends ProviderEvent> HandlerResult invoke(WebhookEventHandler<E> handler, ProviderEvent event) {
        return handler.handle(handler.getEventClass().cast(event));
    }
}
