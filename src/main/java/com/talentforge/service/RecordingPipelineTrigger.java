package com.talentforge.service;

import java.util.UUID;

/**
 * Hand-off into post-recording processing. Implementations return
 * immediately and own their failures.
 */
public interface RecordingPipelineTrigger {

    void trigger(UUID interviewId);
}
