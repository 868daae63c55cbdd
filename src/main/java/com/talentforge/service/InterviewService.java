package com.talentforge.service;

import com.talentforge.exception.ResourceNotFoundException;
import com.talentforge.exception.TransitionRejectedException;
import com.talentforge.model.Interview;
import com.talentforge.model.InterviewSnapshot;
import com.talentforge.model.InterviewStatus;
import com.talentforge.model.RescheduleRequest;
import com.talentforge.repository.InterviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * User-initiated interview changes. They share the webhook handlers' state
 * machine, so an illegal change surfaces here as a 422.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InterviewService {

    private final InterviewRepository interviewRepository;
    private final InterviewStateMachine stateMachine;
    private final Clock clock;

    @Transactional(readOnly = true)
    public InterviewSnapshot getInterview(UUID interviewId) {
        return InterviewSnapshot.from(load(interviewId));
    }

    @Transactional
    public InterviewSnapshot cancel(UUID interviewId) {
        Interview interview = load(interviewId);
        stateMachine.transition(interview, InterviewStatus.CANCELLED);
        log.info("[{}] Interview cancelled", interviewId);
        return InterviewSnapshot.from(interviewRepository.save(interview));
    }

    @Transactional
    public InterviewSnapshot reschedule(UUID interviewId, RescheduleRequest request) {
        Interview interview = load(interviewId);
        if (interview.getStatus() != InterviewStatus.SCHEDULED) {
            throw new TransitionRejectedException("interview", interview.getStatus(), InterviewStatus.SCHEDULED);
        }
        if (!request.getScheduledAt().isAfter(clock.instant())) {
            throw new IllegalArgumentException("Scheduled time must be in the future");
        }

        interview.setScheduledAt(request.getScheduledAt());
        if (request.getDurationMinutes() != null) {
            interview.setDurationMinutes(request.getDurationMinutes());
        }
        log.info("[{}] Interview rescheduled to {}", interviewId, request.getScheduledAt());
        return InterviewSnapshot.from(interviewRepository.save(interview));
    }

    private Interview load(UUID interviewId) {
        return interviewRepository.findById(interviewId)
                .orElseThrow(() -> new ResourceNotFoundException("Interview not found: " + interviewId));
    }
}
