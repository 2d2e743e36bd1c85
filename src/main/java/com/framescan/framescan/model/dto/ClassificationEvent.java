package com.framescan.framescan.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.framescan.framescan.model.ClassificationResult;

import lombok.Getter;

@Getter
public class ClassificationEvent extends SessionEvent {

    private final double timestamp;
    private final long frame;
    private final String label;
    private final double confidence;
    @JsonProperty("is_nsfw")
    private final boolean nsfw;

    public ClassificationEvent(ClassificationResult result) {
        this.timestamp = result.getTimestamp();
        this.frame = result.getFrameIndex();
        this.label = result.getLabel();
        this.confidence = result.getConfidence();
        this.nsfw = result.isFlagged();
    }

    @Override
    public String getType() {
        return CLASSIFICATION;
    }
}
