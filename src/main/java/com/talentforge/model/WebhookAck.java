package com.talentforge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body returned to a webhook provider. Anything past signature and parse
 * validation is acknowledged with {@code received=true}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookAck {

    private boolean received;
    private Boolean cached;
    private Boolean processing;
    private String error;

    public static WebhookAck received() {
        return WebhookAck.builder().received(true).build();
    }

    public static WebhookAck cached() {
        return WebhookAck.builder().received(true).cached(true).build();
    }

    public static WebhookAck inProgress() {
        return WebhookAck.builder().received(true).processing(true).build();
    }

    public static WebhookAck rejected(String error) {
        return WebhookAck.builder().received(false).error(error).build();
    }
}
