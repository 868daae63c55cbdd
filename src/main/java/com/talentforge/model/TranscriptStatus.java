package com.talentforge.model;

public enum TranscriptStatus {
    NONE,
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
