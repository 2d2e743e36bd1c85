package com.framescan.framescan.model.dto;

import com.framescan.framescan.model.VideoProperties;

import lombok.Getter;

@Getter
public class VideoInfoEvent extends SessionEvent {

    private final double fps;
    private final double duration;
    private final int totalFrames;
    private final int width;
    private final int height;

    public VideoInfoEvent(VideoProperties properties) {
        this.fps = properties.getFrameRate();
        this.duration = properties.getDuration();
        this.totalFrames = properties.getTotalFrames();
        this.width = properties.getWidth();
        this.height = properties.getHeight();
    }

    @Override
    public String getType() {
        return VIDEO_INFO;
    }
}
