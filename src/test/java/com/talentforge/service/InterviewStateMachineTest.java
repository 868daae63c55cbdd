package com.talentforge.service;

import com.talentforge.exception.TransitionRejectedException;
import com.talentforge.model.Interview;
import com.talentforge.model.InterviewStatus;
import com.talentforge.model.RecordingStatus;
import com.talentforge.model.TranscriptStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InterviewStateMachine Tests")
class InterviewStateMachineTest {

    private final InterviewStateMachine stateMachine = new InterviewStateMachine();

    @Nested
    @DisplayName("Interview status")
    class InterviewStatusTransitions {

        @Test
        @DisplayName("Should only reach in_progress or cancelled from scheduled")
        void shouldLimitScheduledTransitions() {
            assertThat(stateMachine.allowedFrom(InterviewStatus.SCHEDULED)).containsExactlyInAnyOrder(InterviewStatus.IN_PROGRESS, InterviewStatus.CANCELLED);
        }

        @ParameterizedTest
        @EnumSource(InterviewStatus.class)
        @DisplayName("Should never leave completed")
        void shouldKeepCompletedTerminal(InterviewStatus target) {
            Interview interview = Interview.builder().status(InterviewStatus.COMPLETED).build();

            assertThatThrownBy(() -> stateMachine.transition(interview, target))
                    .isInstanceOf(TransitionRejectedException.class);
            assertThat(interview.getStatus()).isEqualTo(InterviewStatus.COMPLETED);
        }

        @Test
        @DisplayName("Should name current and attempted status when rejecting")
        void shouldDescribeRejection() {
            Interview interview = Interview.builder().status(InterviewStatus.CANCELLED).build();

            TransitionRejectedException ex = catchThrowableOfType(
                    () -> stateMachine.transition(interview, InterviewStatus.IN_PROGRESS),
                    TransitionRejectedException.class);

            assertThat(ex.getCurrentStatus()).isEqualTo("cancelled");
            assertThat(ex.getAttemptedStatus()).isEqualTo("in_progress");
        }

        @Test
        @DisplayName("Should apply a legal transition")
        void shouldApplyLegalTransition() {
            Interview interview = Interview.builder().status(InterviewStatus.IN_PROGRESS).build();

            stateMachine.transition(interview, InterviewStatus.COMPLETED);

            assertThat(interview.getStatus()).isEqualTo(InterviewStatus.COMPLETED);
        }
    }

    @Nested
    @DisplayName("Recording status")
    class RecordingStatusTransitions {

        @Test
        @DisplayName("Should advance forward, skipping steps if needed")
        void shouldAdvanceForward() {
            Interview interview = Interview.builder().recordingStatus(RecordingStatus.NONE).build();

            assertThat(stateMachine.advanceRecording(interview, RecordingStatus.PROCESSING)).isTrue();
            assertThat(interview.getRecordingStatus()).isEqualTo(RecordingStatus.PROCESSING);
        }

        @Test
        @DisplayName("Should never move backwards")
        void shouldNotRegress() {
            Interview interview = Interview.builder().recordingStatus(RecordingStatus.COMPLETED).build();

            assertThat(stateMachine.advanceRecording(interview, RecordingStatus.IN_PROGRESS)).isFalse();
            assertThat(interview.getRecordingStatus()).isEqualTo(RecordingStatus.COMPLETED);
        }
    }

    @Nested
    @DisplayName("Transcript status")
    class TranscriptStatusTransitions {

        @Test
        @DisplayName("Should follow pending, processing, completed")
        void shouldFollowHappyPath() {
            Interview interview = Interview.builder().transcriptStatus(TranscriptStatus.NONE).build();

            stateMachine.transitionTranscript(interview, TranscriptStatus.PENDING);
            stateMachine.transitionTranscript(interview, TranscriptStatus.PROCESSING);
            stateMachine.transitionTranscript(interview, TranscriptStatus.COMPLETED);

            assertThat(interview.getTranscriptStatus()).isEqualTo(TranscriptStatus.COMPLETED);
        }

        @Test
        @DisplayName("Should allow a failed transcript to be queued again")
        void shouldRequeueFailed() {
            assertThat(stateMachine.canTransition(TranscriptStatus.FAILED, TranscriptStatus.PENDING)).isTrue();
            assertThat(stateMachine.canTransition(TranscriptStatus.FAILED, TranscriptStatus.COMPLETED)).isFalse();
        }

        @Test
        @DisplayName("Should reject completing a transcript that never started processing")
        void shouldRejectSkippingProcessing() {
            Interview interview = Interview.builder().transcriptStatus(TranscriptStatus.PENDING).build();

            assertThatThrownBy(() -> stateMachine.transitionTranscript(interview, TranscriptStatus.COMPLETED))
                    .isInstanceOf(TransitionRejectedException.class)
                    .hasMessageContaining("pending");
        }
    }
}
