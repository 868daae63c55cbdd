package com.talentforge.exception;

public enum RejectionReason {
    MISSING_HEADERS,
    SIGNATURE_INVALID,
    TIMESTAMP_STALE,
    SECRET_NOT_CONFIGURED,
    MALFORMED_PAYLOAD;

    public boolean isAuthenticationFailure() {
        return this != MALFORMED_PAYLOAD;
    }
}
