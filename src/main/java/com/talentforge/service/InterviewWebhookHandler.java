package com.talentforge.service;

import com.talentforge.model.HandlerResult;
import com.talentforge.model.Interview;
import com.talentforge.model.InterviewStatus;
import com.talentforge.model.RecordingFile;
import com.talentforge.model.RecordingStatus;
import com.talentforge.model.TranscriptStatus;
import com.talentforge.model.VideoWebhookEvent;
import com.talentforge.model.WebhookProvider;
import com.talentforge.repository.InterviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Video provider events against the interview lifecycle. Guard conditions
 * make every handler safe to receive late or out of order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InterviewWebhookHandler implements WebhookEventHandler<VideoWebhookEvent> {

    private final InterviewRepository interviewRepository;
    private final InterviewStateMachine stateMachine;
    private final Clock clock;

    @Override
    public WebhookProvider getProvider() {
        return WebhookProvider.VIDEO;
    }

    @Override
    public Class<VideoWebhookEvent> getEventClass() {
        return VideoWebhookEvent.class;
    }

    @Override
    @Transactional
    public HandlerResult handle(VideoWebhookEvent event) {
        Optional<Interview> found = interviewRepository.findFirstByExternalMeetingRef(event.getMeetingId());
        if (found.isEmpty()) {
            log.info("[zoom:{}] No interview for meeting {}, ignoring", event.getEventId(), event.getMeetingId());
            return HandlerResult.unknownEntity(event.getMeetingId());
        }

        Interview interview = found.get();
        Instant receivedAt = event.getOccurredAt() != null ? event.getOccurredAt() : clock.instant();

        switch (event.getType()) {
            case RECORDING_STARTED:
                return advanceRecording(interview, event, RecordingStatus.IN_PROGRESS, receivedAt);
            case RECORDING_STOPPED:
                return advanceRecording(interview, event, RecordingStatus.PROCESSING, receivedAt);
            case RECORDING_PAUSED:
            case RECORDING_RESUMED:
                interview.recordWebhook(event.getEventType(), receivedAt);
                interviewRepository.save(interview);
                log.info("[{}] Recording {}", interview.getId(), event.getEventType());
                return HandlerResult.applied();
            case RECORDING_COMPLETED:
                return recordingCompleted(interview, event, receivedAt);
            case MEETING_STARTED:
                return meetingStarted(interview, event, receivedAt);
            case MEETING_ENDED:
                return meetingEnded(interview, event, receivedAt);
            default:
                log.info("[zoom:{}] Unhandled event type {}", event.getEventId(), event.getEventType());
                return HandlerResult.unhandledType(event.getEventType());
        }
    }

    private HandlerResult advanceRecording(Interview interview, VideoWebhookEvent event,
                                           RecordingStatus target, Instant receivedAt) {
        boolean advanced = stateMachine.advanceRecording(interview, target);
        interview.recordWebhook(event.getEventType(), receivedAt);
        interviewRepository.save(interview);

        if (!advanced) {
            log.info("[{}] Recording already {}, {} ignored",
                    interview.getId(), interview.getRecordingStatus(), event.getEventType());
            return HandlerResult.noChange("recording already " + interview.getRecordingStatus());
        }
        log.info("[{}] Recording status -> {}", interview.getId(), target);
        return HandlerResult.applied();
    }

    private HandlerResult recordingCompleted(Interview interview, VideoWebhookEvent event, Instant receivedAt) {
        boolean firstCompletion = interview.getRecordingStatus() != RecordingStatus.COMPLETED;
        Optional<RecordingFile> primary = event.primaryRecording();

        interview.setRecordingStatus(RecordingStatus.COMPLETED);
        interview.setRecordingUrl(primary.map(RecordingFile::getDownloadUrl).orElse(null));
        interview.setRecordingDurationSeconds(primary.map(RecordingFile::getDurationSeconds).orElse(null));
        interview.setRecordingFileSize(primary.map(RecordingFile::getFileSize).orElse(null));
        interview.setRecordingProcessedAt(clock.instant());
        interview.recordWebhook(event.getEventType(), receivedAt);

        TranscriptStatus transcriptStatus = interview.getTranscriptStatus();
        if (firstCompletion && stateMachine.canTransition(transcriptStatus, TranscriptStatus.PENDING)) {
            interview.setTranscriptStatus(TranscriptStatus.PENDING);
        }
        interviewRepository.save(interview);

        log.info("[{}] Recording completed: url={}, duration={}s",
                interview.getId(), interview.getRecordingUrl(), interview.getRecordingDurationSeconds());

        if (!firstCompletion) {
            return HandlerResult.applied();
        }
        return HandlerResult.appliedWithPipeline(interview.getId());
    }

    private HandlerResult meetingStarted(Interview interview, VideoWebhookEvent event, Instant receivedAt) {
        InterviewStatus current = interview.getStatus();
        interview.recordWebhook(event.getEventType(), receivedAt);

        if (current == InterviewStatus.IN_PROGRESS) {
            interviewRepository.save(interview);
            return HandlerResult.noChange("already in_progress");
        }
        if (!stateMachine.canTransition(current, InterviewStatus.IN_PROGRESS)) {
            interviewRepository.save(interview);
            log.warn("[{}] meeting.started rejected: interview is {}", interview.getId(), current);
            return HandlerResult.transitionRejected(current + " -> " + InterviewStatus.IN_PROGRESS);
        }

        stateMachine.transition(interview, InterviewStatus.IN_PROGRESS);
        interviewRepository.save(interview);
        log.info("[{}] Interview started", interview.getId());
        return HandlerResult.applied();
    }

    private HandlerResult meetingEnded(Interview interview, VideoWebhookEvent event, Instant receivedAt) {
        InterviewStatus current = interview.getStatus();
        interview.recordWebhook(event.getEventType(), receivedAt);

        // Only a running interview can end; anything else keeps its status
        if (current != InterviewStatus.IN_PROGRESS) {
            interviewRepository.save(interview);
            log.info("[{}] meeting.ended while {}, status unchanged", interview.getId(), current);
            return HandlerResult.noChange("status " + current);
        }

        stateMachine.transition(interview, InterviewStatus.COMPLETED);
        interviewRepository.save(interview);
        log.info("[{}] Interview completed", interview.getId());
        return HandlerResult.applied();
    }
}
