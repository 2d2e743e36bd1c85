package com.framescan.framescan.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of classifying one frame of a session's video. Never stored; it is
 * forwarded to the client and dropped.
 */
@Getter
@ToString
public final class ClassificationResult {

    private final double timestamp;
    private final long frameIndex;
    private final String label;
    private final double confidence;
    private final boolean flagged;

    private ClassificationResult(double timestamp, long frameIndex, String label, double confidence, boolean flagged) {
        this.timestamp = timestamp;
        this.frameIndex = frameIndex;
        this.label = label;
        this.confidence = confidence;
        this.flagged = flagged;
    }

    /**
     * @param benignLabel the one label that is not flagged, compared ignoring case
     */
    public static ClassificationResult of(double timestamp, long frameIndex, Classification classification,
            String benignLabel) {
        String label = classification.getLabel();
        boolean flagged = label == null || !label.equalsIgnoreCase(benignLabel);
        return new ClassificationResult(timestamp, frameIndex, label, classification.getScore(), flagged);
    }
}
