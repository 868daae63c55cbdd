package com.talentforge.service;

import com.talentforge.model.Interview;
import com.talentforge.model.TranscriptStatus;
import com.talentforge.model.TranscriptionJobRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Post-recording pipeline: moves the transcript to processing and submits
 * the recording for transcription. Runs on the pipeline executor, never on
 * the webhook request thread.
 */
@Slf4j
@Service
public class TranscriptionPipelineService implements RecordingPipelineTrigger {

    private final TranscriptService transcriptService;
    private final TranscriptionClient transcriptionClient;
    private final String callbackBaseUrl;
    private final String callbackSecret;

    public TranscriptionPipelineService(TranscriptService transcriptService,
                                        TranscriptionClient transcriptionClient,
                                        @Value("${pipeline.callback-base-url:http://localhost:8080}") String callbackBaseUrl,
                                        @Value("${pipeline.callback-secret:}") String callbackSecret) {
        this.transcriptService = transcriptService;
        this.transcriptionClient = transcriptionClient;
        this.callbackBaseUrl = callbackBaseUrl;
        this.callbackSecret = callbackSecret;
    }

    @Async("pipelineTaskExecutor")
    @Override
    public void trigger(UUID interviewId) {
        try {
            run(interviewId);
        } catch (RuntimeException e) {
            log.error("[{}] Transcription pipeline failed: {}", interviewId, e.getMessage(), e);
        }
    }

    void run(UUID interviewId) {
        if (!transcriptionClient.isConfigured()) {
            log.warn("[{}] No transcription service configured, transcript stays {}",
                    interviewId, TranscriptStatus.PENDING);
            return;
        }

        Interview interview = transcriptService.markProcessing(interviewId);
        if (interview.getRecordingUrl() == null) {
            transcriptService.markFailed(interviewId, "No recording URL");
            return;
        }

        TranscriptionJobRequest request = TranscriptionJobRequest.builder()
                .uuid(interviewId.toString())
                .recordingUrl(interview.getRecordingUrl())
                .recordingDurationSeconds(interview.getRecordingDurationSeconds())
                .callbackUrl(callbackBaseUrl + "/api/interviews/" + interviewId + "/transcript/callback")
                .callbackSecret(callbackSecret)
                .build();

        try {
            transcriptionClient.submit(request).block();
        } catch (RuntimeException e) {
            log.error("[{}] Failed to submit transcription job: {}", interviewId, e.getMessage());
            transcriptService.markFailed(interviewId, e.getMessage());
        }
    }
}
