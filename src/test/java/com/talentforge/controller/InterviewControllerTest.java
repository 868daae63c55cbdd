package com.talentforge.controller;

import com.talentforge.model.Interview;
import com.talentforge.model.InterviewStatus;
import com.talentforge.model.TranscriptStatus;
import com.talentforge.repository.InterviewRepository;
import com.talentforge.repository.WebhookEventRepository;
import com.talentforge.security.TranscriptCallbackAuthInterceptor;
import com.talentforge.service.RecordingPipelineTrigger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("InterviewController Tests")
class InterviewControllerTest {

    private static final String CALLBACK_SECRET = "test-callback-secret";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private InterviewRepository interviewRepository;

    @Autowired
    private WebhookEventRepository webhookEventRepository;

    @MockBean
    private RecordingPipelineTrigger pipelineTrigger;

    @BeforeEach
    void setUp() {
        interviewRepository.deleteAll();
        webhookEventRepository.deleteAll();
    }

    private Interview givenInterview(InterviewStatus status) {
        return interviewRepository.save(Interview.builder()
                .companyId(UUID.randomUUID())
                .externalMeetingRef("555")
                .status(status)
                .scheduledAt(Instant.now().plus(1, ChronoUnit.DAYS))
                .build());
    }

    @Test
    @DisplayName("Should return the interview lifecycle")
    void shouldGetInterview() throws Exception {
        Interview interview = givenInterview(InterviewStatus.SCHEDULED);

        mockMvc.perform(get("/api/interviews/{id}", interview.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("SCHEDULED"))
                .andExpect(jsonPath("$.data.recordingStatus").value("NONE"));
    }

    @Test
    @DisplayName("Should return 404 for an unknown interview")
    void shouldReturnNotFound() throws Exception {
        mockMvc.perform(get("/api/interviews/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Nested
    @DisplayName("Cancel")
    class Cancel {

        @Test
        @DisplayName("Should cancel a scheduled interview")
        void shouldCancelScheduled() throws Exception {
            Interview interview = givenInterview(InterviewStatus.SCHEDULED);

            mockMvc.perform(post("/api/interviews/{id}/cancel", interview.getId()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.status").value("CANCELLED"));
        }

        @Test
        @DisplayName("Should reject cancelling a completed interview with 422")
        void shouldRejectCancellingCompleted() throws Exception {
            Interview interview = givenInterview(InterviewStatus.COMPLETED);

            mockMvc.perform(post("/api/interviews/{id}/cancel", interview.getId()))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.data.currentStatus").value("completed"))
                    .andExpect(jsonPath("$.data.attemptedStatus").value("cancelled"));

            assertThat(interviewRepository.findById(interview.getId()).orElseThrow().getStatus())
                    .isEqualTo(InterviewStatus.COMPLETED);
        }
    }

    @Nested
    @DisplayName("Reschedule")
    class Reschedule {

        @Test
        @DisplayName("Should move a scheduled interview")
        void shouldReschedule() throws Exception {
            Interview interview = givenInterview(InterviewStatus.SCHEDULED);
            Instant newTime = Instant.now().plus(3, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS);

            mockMvc.perform(post("/api/interviews/{id}/reschedule", interview.getId())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"scheduledAt\":\"" + newTime + "\",\"durationMinutes\":45}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.durationMinutes").value(45));

            assertThat(interviewRepository.findById(interview.getId()).orElseThrow().getScheduledAt())
                    .isEqualTo(newTime);
        }

        @Test
        @DisplayName("Should reject rescheduling an interview that already started")
        void shouldRejectRunning() throws Exception {
            Interview interview = givenInterview(InterviewStatus.IN_PROGRESS);

            mockMvc.perform(post("/api/interviews/{id}/reschedule", interview.getId())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"scheduledAt\":\"" + Instant.now().plus(1, ChronoUnit.DAYS) + "\"}"))
                    .andExpect(status().isUnprocessableEntity());
        }

        @Test
        @DisplayName("Should reject a time in the past")
        void shouldRejectPastTime() throws Exception {
            Interview interview = givenInterview(InterviewStatus.SCHEDULED);

            mockMvc.perform(post("/api/interviews/{id}/reschedule", interview.getId())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"scheduledAt\":\"2020-01-01T00:00:00Z\"}"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("Transcript callback")
    class TranscriptCallback {

        private Interview processingInterview() {
            Interview interview = givenInterview(InterviewStatus.COMPLETED);
            interview.setTranscriptStatus(TranscriptStatus.PROCESSING);
            return interviewRepository.save(interview);
        }

        private String callbackBody(Interview interview) {
            return "{\"uuid\":\"" + interview.getId() + "\",\"status\":\"COMPLETED\",\"totalEntries\":2,"
                    + "\"transcripts\":[{\"speaker\":\"Interviewer\",\"text\":\"Hello\"},"
                    + "{\"speaker\":\"Candidate\",\"text\":\"Hi\"}]}";
        }

        @Test
        @DisplayName("Should store the transcript posted by the transcription service")
        void shouldAcceptTranscriptCallback() throws Exception {
            Interview interview = processingInterview();

            mockMvc.perform(post("/api/interviews/{id}/transcript/callback", interview.getId())
                            .header(TranscriptCallbackAuthInterceptor.SECRET_HEADER, CALLBACK_SECRET)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(callbackBody(interview)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.transcriptStatus").value("COMPLETED"));

            assertThat(interviewRepository.findById(interview.getId()).orElseThrow().getTranscript())
                    .isEqualTo("Interviewer: Hello\nCandidate: Hi");
        }

        @Test
        @DisplayName("Should reject a callback without the shared secret")
        void shouldRejectMissingSecret() throws Exception {
            Interview interview = processingInterview();

            mockMvc.perform(post("/api/interviews/{id}/transcript/callback", interview.getId())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(callbackBody(interview)))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.message").value("Unauthorized"));

            Interview stored = interviewRepository.findById(interview.getId()).orElseThrow();
            assertThat(stored.getTranscriptStatus()).isEqualTo(TranscriptStatus.PROCESSING);
            assertThat(stored.getTranscript()).isNull();
        }

        @Test
        @DisplayName("Should reject a callback carrying the wrong secret")
        void shouldRejectWrongSecret() throws Exception {
            Interview interview = processingInterview();

            mockMvc.perform(post("/api/interviews/{id}/transcript/callback", interview.getId())
                            .header(TranscriptCallbackAuthInterceptor.SECRET_HEADER, "guessed")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(callbackBody(interview)))
                    .andExpect(status().isUnauthorized());

            assertThat(interviewRepository.findById(interview.getId()).orElseThrow().getTranscriptStatus())
                    .isEqualTo(TranscriptStatus.PROCESSING);
        }
    }

    @Test
    @DisplayName("Should report health with ledger counts")
    void shouldReportHealth() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("UP"))
                .andExpect(jsonPath("$.data.webhookEvents.completed").value(0))
                .andExpect(jsonPath("$.data.deadLetters").value(0));
    }
}
