package com.framescan.framescan.service.video;

import java.nio.file.Path;

import com.framescan.framescan.exception.VideoAccessException;

public interface VideoSourceFactory {

    VideoSource open(Path path) throws VideoAccessException;
}
