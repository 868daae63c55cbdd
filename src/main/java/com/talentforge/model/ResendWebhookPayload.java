package com.talentforge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Wire shape of an email-provider webhook body.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResendWebhookPayload {

    private String type;

    @JsonProperty("created_at")
    private String createdAt;

    private EmailData data;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmailData {

        @JsonProperty("email_id")
        private String emailId;

        private String from;
        private List<String> to;
        private String subject;

        @JsonProperty("created_at")
        private String createdAt;

        private Bounce bounce;
        private Click click;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Bounce {
        private String message;
        private String type;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Click {
        private String link;
    }
}
