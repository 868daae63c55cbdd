package com.talentforge.exception;

import lombok.Getter;

/**
 * Requested status change is not in the entity's transition table.
 */
@Getter
public class TransitionRejectedException extends RuntimeException {

    private final String entity;
    private final String currentStatus;
    private final String attemptedStatus;

    public TransitionRejectedException(String entity, Enum<?> currentStatus, Enum<?> attemptedStatus) {
        super(String.format("Cannot move %s from %s to %s",
                entity, currentStatus.name().toLowerCase(), attemptedStatus.name().toLowerCase()));
        this.entity = entity;
        this.currentStatus = currentStatus.name().toLowerCase();
        this.attemptedStatus = attemptedStatus.name().toLowerCase();
    }
}
