package com.talentforge.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result posted back by the transcription service once a job finishes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptionCallback {

    /** Interview id the job was submitted for. */
    private String uuid;

    /** {@code COMPLETED} or {@code FAILED}. */
    @NotBlank(message = "Status is required")
    private String status;

    private List<TranscriptEntry> transcripts;
    private int totalEntries;
    private String errorMessage;

    public boolean isSuccessful() {
        return "COMPLETED".equalsIgnoreCase(status);
    }
}
