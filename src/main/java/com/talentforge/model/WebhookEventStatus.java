package com.talentforge.model;

public enum WebhookEventStatus {
    RECEIVED,
    PROCESSING,
    COMPLETED,
    FAILED,
    DEAD_LETTER
}
