package com.talentforge.model;

import java.util.Locale;

public enum SuppressionReason {
    UNSUBSCRIBE,
    BOUNCE,
    COMPLAINT,
    MANUAL;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
