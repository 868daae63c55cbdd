package com.talentforge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Wire shape of a video-provider webhook body.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ZoomWebhookPayload {

    private String event;

    @JsonProperty("event_ts")
    private Long eventTs;

    private Body payload;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Body {

        private String plainToken;

        @JsonProperty("account_id")
        private String accountId;

        private MeetingObject object;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MeetingObject {

        private String id;
        private String uuid;

        @JsonProperty("host_id")
        private String hostId;

        private String topic;

        @JsonProperty("start_time")
        private String startTime;

        private Integer duration;

        @JsonProperty("recording_files")
        private List<ZoomRecordingFile> recordingFiles;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ZoomRecordingFile {

        private String id;

        @JsonProperty("recording_start")
        private String recordingStart;

        @JsonProperty("recording_end")
        private String recordingEnd;

        @JsonProperty("file_type")
        private String fileType;

        @JsonProperty("file_size")
        private Long fileSize;

        @JsonProperty("play_url")
        private String playUrl;

        @JsonProperty("download_url")
        private String downloadUrl;

        private String status;

        @JsonProperty("recording_type")
        private String recordingType;
    }
}
