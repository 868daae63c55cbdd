package com.talentforge.model;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class RetrySweepResult {

    private int reclaimed;
    private int processed;
    private int succeeded;
    private int failed;
    private int deadLetters;
    private int skipped;

    public void recordSucceeded() {
        processed++;
        succeeded++;
    }

    public void recordFailed() {
        processed++;
        failed++;
    }

    public void recordDeadLetter() {
        processed++;
        deadLetters++;
    }

    public void recordSkipped() {
        skipped++;
    }
}
