package com.talentforge.model;

/**
 * External systems that push webhooks into the CRM.
 */
public enum WebhookProvider {

    /** Video-conferencing provider (Zoom). */
    VIDEO("zoom"),

    /** Email-delivery provider (Resend, signed through Svix). */
    EMAIL("resend");

    private final String key;

    WebhookProvider(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static WebhookProvider fromKey(String key) {
        for (WebhookProvider provider : values()) {
            if (provider.key.equalsIgnoreCase(key) || provider.name().equalsIgnoreCase(key)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + key);
    }
}
