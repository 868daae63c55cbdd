package com.talentforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptionJobRequest {

    private String uuid;
    private String recordingUrl;
    private Long recordingDurationSeconds;
    private String callbackUrl;

    /**
     * Echoed back in the callback's {@code X-Callback-Secret} header.
     */
    @ToString.Exclude
    private String callbackSecret;
}
