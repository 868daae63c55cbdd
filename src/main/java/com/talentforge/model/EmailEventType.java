package com.talentforge.model;

import java.util.Arrays;

public enum EmailEventType {
    SENT("email.sent"),
    DELIVERED("email.delivered"),
    DELIVERY_DELAYED("email.delivery_delayed"),
    OPENED("email.opened"),
    CLICKED("email.clicked"),
    BOUNCED("email.bounced"),
    COMPLAINED("email.complained"),
    UNKNOWN(null);

    private final String wireName;

    EmailEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static EmailEventType fromWireName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(type -> name.equals(type.wireName))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
