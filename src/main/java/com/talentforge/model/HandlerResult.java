package com.talentforge.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of dispatching one event. Every outcome is a successful
 * observation as far as the ledger is concerned; failures are exceptions.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HandlerResult {

    public enum Outcome {
        /** Durable state changed. */
        APPLIED,
        /** Event seen, nothing to change (duplicate at domain level, logged-only type). */
        NO_CHANGE,
        /** No entity matches the related reference. */
        UNKNOWN_ENTITY,
        /** The requested status change is not in the transition table. */
        TRANSITION_REJECTED,
        /** Event type this service does not handle yet. */
        UNHANDLED_TYPE
    }

    private final Outcome outcome;
    private final UUID pipelineInterviewId;
    private final String detail;

    public static HandlerResult applied() {
        return new HandlerResult(Outcome.APPLIED, null, null);
    }

    public static HandlerResult appliedWithPipeline(UUID interviewId) {
        return new HandlerResult(Outcome.APPLIED, interviewId, null);
    }

    public static HandlerResult noChange(String detail) {
        return new HandlerResult(Outcome.NO_CHANGE, null, detail);
    }

    public static HandlerResult unknownEntity(String reference) {
        return new HandlerResult(Outcome.UNKNOWN_ENTITY, null, reference);
    }

    public static HandlerResult transitionRejected(String detail) {
        return new HandlerResult(Outcome.TRANSITION_REJECTED, null, detail);
    }

    public static HandlerResult unhandledType(String eventType) {
        return new HandlerResult(Outcome.UNHANDLED_TYPE, null, eventType);
    }

    public Optional<UUID> pipelineInterviewId() {
        return Optional.ofNullable(pipelineInterviewId);
    }
}
