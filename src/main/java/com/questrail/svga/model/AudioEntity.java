package com.questrail.svga.model;

import java.util.Objects;

/**
 * Audio cue. The audio data itself lives in {@link SvgaDocument#images()}
 * under {@code audioKey}; the codec passes cues through unchanged.
 */
public record AudioEntity(
        String audioKey,
        int startFrame,
        int endFrame,
        int startTime,
        int totalTime
) {
    public AudioEntity {
        audioKey = Objects.requireNonNullElse(audioKey, "");
    }
}
