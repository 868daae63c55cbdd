package com.talentforge.service;

import com.talentforge.exception.ResourceNotFoundException;
import com.talentforge.model.Interview;
import com.talentforge.model.InterviewSnapshot;
import com.talentforge.model.TranscriptEntry;
import com.talentforge.model.TranscriptStatus;
import com.talentforge.model.TranscriptionCallback;
import com.talentforge.repository.InterviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Transcript sub-state of an interview: every status change goes through
 * the transcript transition table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TranscriptService {

    private final InterviewRepository interviewRepository;
    private final InterviewStateMachine stateMachine;
    private final Clock clock;

    /**
     * Pending to processing, just before a job is submitted.
     */
    @Transactional
    public Interview markProcessing(UUID interviewId) {
        Interview interview = load(interviewId);
        stateMachine.transitionTranscript(interview, TranscriptStatus.PROCESSING);
        log.info("[{}] Transcript processing", interviewId);
        return interviewRepository.save(interview);
    }

    @Transactional
    public void markFailed(UUID interviewId, String reason) {
        Interview interview = load(interviewId);
        stateMachine.transitionTranscript(interview, TranscriptStatus.FAILED);
        interviewRepository.save(interview);
        log.warn("[{}] Transcript failed: {}", interviewId, reason);
    }

    /**
     * Stores the transcription service's result.
     */
    @Transactional
    public InterviewSnapshot applyCallback(UUID interviewId, TranscriptionCallback callback) {
        if (callback.getUuid() != null && !callback.getUuid().equals(interviewId.toString())) {
            throw new IllegalArgumentException("Callback uuid does not match interview " + interviewId);
        }
        Interview interview = load(interviewId);

        if (!callback.isSuccessful()) {
            stateMachine.transitionTranscript(interview, TranscriptStatus.FAILED);
            log.warn("[{}] Transcription reported failure: {}", interviewId, callback.getErrorMessage());
            return InterviewSnapshot.from(interviewRepository.save(interview));
        }

        stateMachine.transitionTranscript(interview, TranscriptStatus.COMPLETED);
        List<TranscriptEntry> merged = mergeConsecutiveSpeakers(callback.getTranscripts());
        interview.setTranscript(generateFullText(merged));
        interview.setTranscriptProcessedAt(clock.instant());

        log.info("[{}] Transcript stored: {} entries merged into {}",
                interviewId, callback.getTranscripts() != null ? callback.getTranscripts().size() : 0, merged.size());
        return InterviewSnapshot.from(interviewRepository.save(interview));
    }

    /**
     * Merge consecutive entries from same speaker
     */
    public List<TranscriptEntry> mergeConsecutiveSpeakers(List<TranscriptEntry> entries) {
        if (entries == null || entries.size() <= 1) {
            return entries != null ? entries : new ArrayList<>();
        }

        List<TranscriptEntry> merged = new ArrayList<>();
        TranscriptEntry current = entries.get(0);
        StringBuilder textBuilder = new StringBuilder(current.getText() != null ? current.getText() : "");

        for (int i = 1; i < entries.size(); i++) {
            TranscriptEntry next = entries.get(i);
            String currentSpeaker = current.getSpeaker() != null ? current.getSpeaker() : "";
            String nextSpeaker = next.getSpeaker() != null ? next.getSpeaker() : "";

            if (nextSpeaker.equals(currentSpeaker)) {
                if (next.getText() != null && !next.getText().isEmpty()) {
                    textBuilder.append(" ").append(next.getText());
                }
            } else {
                merged.add(TranscriptEntry.builder()
                        .speaker(current.getSpeaker())
                        .text(textBuilder.toString().trim())
                        .timestamp(current.getTimestamp())
                        .build());

                current = next;
                textBuilder = new StringBuilder(current.getText() != null ? current.getText() : "");
            }
        }

        merged.add(TranscriptEntry.builder()
                .speaker(current.getSpeaker())
                .text(textBuilder.toString().trim())
                .timestamp(current.getTimestamp())
                .build());

        return merged;
    }

    /**
     * One line per entry: {@code [HH:mm:ss] Speaker: text}
     */
    public String generateFullText(List<TranscriptEntry> entries) {
        return entries.stream()
                .map(TranscriptEntry::toTranscriptLine)
                .collect(Collectors.joining("\n"));
    }

    private Interview load(UUID interviewId) {
        return interviewRepository.findById(interviewId)
                .orElseThrow(() -> new ResourceNotFoundException("Interview not found: " + interviewId));
    }
}
