package com.talentforge.service;

import com.talentforge.model.Interview;
import com.talentforge.model.TranscriptionJobRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TranscriptionPipelineService Tests")
class TranscriptionPipelineServiceTest {

    private static final String BASE_URL = "https://talentforge.example";

    @Mock
    private TranscriptService transcriptService;

    @Mock
    private TranscriptionClient transcriptionClient;

    private TranscriptionPipelineService pipeline;
    private UUID interviewId;

    @BeforeEach
    void setUp() {
        pipeline = new TranscriptionPipelineService(transcriptService, transcriptionClient, BASE_URL, "cb-secret");
        interviewId = UUID.randomUUID();
    }

    private Interview interviewWithRecording(String url) {
        return Interview.builder().id(interviewId).recordingUrl(url).recordingDurationSeconds(1800L).build();
    }

    @Test
    @DisplayName("Should leave the transcript pending when no service is configured")
    void shouldSkipWhenUnconfigured() {
        when(transcriptionClient.isConfigured()).thenReturn(false);

        pipeline.run(interviewId);

        verifyNoInteractions(transcriptService);
        verify(transcriptionClient, never()).submit(any());
    }

    @Test
    @DisplayName("Should submit the recording with a callback URL for the interview")
    void shouldSubmitJob() {
        when(transcriptionClient.isConfigured()).thenReturn(true);
        when(transcriptService.markProcessing(interviewId)).thenReturn(interviewWithRecording("https://zoom.example/screen"));
        when(transcriptionClient.submit(any())).thenReturn(Mono.just("queued"));

        pipeline.run(interviewId);

        ArgumentCaptor<TranscriptionJobRequest> captor = ArgumentCaptor.forClass(TranscriptionJobRequest.class);
        verify(transcriptionClient).submit(captor.capture());
        assertThat(captor.getValue().getUuid()).isEqualTo(interviewId.toString());
        assertThat(captor.getValue().getRecordingUrl()).isEqualTo("https://zoom.example/screen");
        assertThat(captor.getValue().getCallbackUrl())
                .isEqualTo(BASE_URL + "/api/interviews/" + interviewId + "/transcript/callback");
        assertThat(captor.getValue().getCallbackSecret()).isEqualTo("cb-secret");
        verify(transcriptService, never()).markFailed(any(), anyString());
    }

    @Test
    @DisplayName("Should fail the transcript when there is no recording URL")
    void shouldFailWithoutRecordingUrl() {
        when(transcriptionClient.isConfigured()).thenReturn(true);
        when(transcriptService.markProcessing(interviewId)).thenReturn(interviewWithRecording(null));

        pipeline.run(interviewId);

        verify(transcriptService).markFailed(interviewId, "No recording URL");
        verify(transcriptionClient, never()).submit(any());
    }

    @Test
    @DisplayName("Should fail the transcript when submission keeps failing")
    void shouldFailOnSubmitError() {
        when(transcriptionClient.isConfigured()).thenReturn(true);
        when(transcriptService.markProcessing(interviewId)).thenReturn(interviewWithRecording("https://zoom.example/screen"));
        when(transcriptionClient.submit(any())).thenReturn(Mono.error(new IllegalStateException("Retries exhausted")));

        pipeline.run(interviewId);

        verify(transcriptService).markFailed(interviewId, "Retries exhausted");
    }

    @Test
    @DisplayName("Should log rather than propagate errors from the async entry point")
    void shouldContainErrorsInTrigger() {
        when(transcriptionClient.isConfigured()).thenReturn(true);
        when(transcriptService.markProcessing(interviewId)).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> pipeline.trigger(interviewId)).doesNotThrowAnyException();
    }
}
