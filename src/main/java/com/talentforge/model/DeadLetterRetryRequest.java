package com.talentforge.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterRetryRequest {

    @NotNull(message = "webhookEventId is required")
    private UUID webhookEventId;
}
