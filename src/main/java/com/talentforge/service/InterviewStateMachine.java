package com.talentforge.service;

import com.talentforge.exception.TransitionRejectedException;
import com.talentforge.model.Interview;
import com.talentforge.model.InterviewStatus;
import com.talentforge.model.RecordingStatus;
import com.talentforge.model.TranscriptStatus;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Transition tables for the interview and its two sub-machines. The
 * interview and transcript tables reject anything they do not list;
 * recording status only ever moves forward.
 */
@Component
public class InterviewStateMachine {

    private static final Map<InterviewStatus, Set<InterviewStatus>> INTERVIEW_TRANSITIONS =
            new EnumMap<>(InterviewStatus.class);
    private static final Map<TranscriptStatus, Set<TranscriptStatus>> TRANSCRIPT_TRANSITIONS =
            new EnumMap<>(TranscriptStatus.class);

    static {
        INTERVIEW_TRANSITIONS.put(InterviewStatus.SCHEDULED,
                EnumSet.of(InterviewStatus.IN_PROGRESS, InterviewStatus.CANCELLED));
        INTERVIEW_TRANSITIONS.put(InterviewStatus.IN_PROGRESS,
                EnumSet.of(InterviewStatus.COMPLETED, InterviewStatus.CANCELLED));
        INTERVIEW_TRANSITIONS.put(InterviewStatus.COMPLETED, EnumSet.noneOf(InterviewStatus.class));
        INTERVIEW_TRANSITIONS.put(InterviewStatus.CANCELLED, EnumSet.noneOf(InterviewStatus.class));

        TRANSCRIPT_TRANSITIONS.put(TranscriptStatus.NONE, EnumSet.of(TranscriptStatus.PENDING));
        TRANSCRIPT_TRANSITIONS.put(TranscriptStatus.PENDING,
                EnumSet.of(TranscriptStatus.PROCESSING, TranscriptStatus.FAILED));
        TRANSCRIPT_TRANSITIONS.put(TranscriptStatus.PROCESSING,
                EnumSet.of(TranscriptStatus.COMPLETED, TranscriptStatus.FAILED));
        TRANSCRIPT_TRANSITIONS.put(TranscriptStatus.COMPLETED, EnumSet.noneOf(TranscriptStatus.class));
        TRANSCRIPT_TRANSITIONS.put(TranscriptStatus.FAILED, EnumSet.of(TranscriptStatus.PENDING));
    }

    public boolean canTransition(InterviewStatus from, InterviewStatus to) {
        return INTERVIEW_TRANSITIONS.getOrDefault(from, Collections.emptySet()).contains(to);
    }

    public boolean canTransition(TranscriptStatus from, TranscriptStatus to) {
        return TRANSCRIPT_TRANSITIONS.getOrDefault(from, Collections.emptySet()).contains(to);
    }

    /**
     * Applies {@code target} to the interview or throws without touching it.
     */
    public void transition(Interview interview, InterviewStatus target) {
        if (!canTransition(interview.getStatus(), target)) {
            throw new TransitionRejectedException("interview", interview.getStatus(), target);
        }
        interview.setStatus(target);
    }

    public void transitionTranscript(Interview interview, TranscriptStatus target) {
        if (!canTransition(interview.getTranscriptStatus(), target)) {
            throw new TransitionRejectedException("transcript", interview.getTranscriptStatus(), target);
        }
        interview.setTranscriptStatus(target);
    }

    /**
     * Moves the recording forward to {@code target}; returns false and
     * leaves the interview alone when it is already there or past it.
     */
    public boolean advanceRecording(Interview interview, RecordingStatus target) {
        if (!interview.getRecordingStatus().isBefore(target)) {
            return false;
        }
        interview.setRecordingStatus(target);
        return true;
    }

    public Set<InterviewStatus> allowedFrom(InterviewStatus from) {
        return Collections.unmodifiableSet(INTERVIEW_TRANSITIONS.getOrDefault(from, Collections.emptySet()));
    }
}
