package com.framescan.framescan.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Snapshot of a video's stream properties, taken once when a session attaches.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class VideoProperties {

    private final double frameRate;
    private final int totalFrames;
    private final int width;
    private final int height;
    private final double duration;

    private VideoProperties(double frameRate, int totalFrames, int width, int height, double duration) {
        this.frameRate = frameRate;
        this.totalFrames = totalFrames;
        this.width = width;
        this.height = height;
        this.duration = duration;
    }

    public static VideoProperties of(double frameRate, int totalFrames, int width, int height) {
        int frames = Math.max(0, totalFrames);
        double duration = frameRate > 0 ? frames / frameRate : 0.0;
        return new VideoProperties(frameRate, frames, width, height, duration);
    }

    /**
     * Frame index shown at the given playback time: {@code floor(timestamp * frameRate)}.
     */
    public long frameIndexAt(double timestamp) {
        return (long) Math.floor(timestamp * frameRate);
    }

    public boolean containsFrame(long frameIndex) {
        return frameIndex >= 0 && frameIndex < totalFrames;
    }
}
