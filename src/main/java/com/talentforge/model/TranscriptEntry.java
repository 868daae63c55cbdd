package com.talentforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptEntry {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private String speaker;
    private String text;
    private LocalDateTime timestamp;

    public String toTranscriptLine() {
        String prefix = timestamp != null ? "[" + timestamp.format(TIMESTAMP_FORMAT) + "] " : "";
        return prefix + (speaker != null ? speaker : "Unknown") + ": " + (text != null ? text : "");
    }
}
