package com.framescan.framescan.service.video;

import java.nio.file.Path;

import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.framescan.framescan.exception.VideoAccessException;
import com.framescan.framescan.model.VideoProperties;

@Component
public class GrabberVideoSourceFactory implements VideoSourceFactory {

    private static final Logger logger = LoggerFactory.getLogger(GrabberVideoSourceFactory.class);

    private final FFmpegGrabberConfig grabberConfig;

    public GrabberVideoSourceFactory(FFmpegGrabberConfig grabberConfig) {
        this.grabberConfig = grabberConfig;
    }

    @Override
    public VideoSource open(Path path) throws VideoAccessException {
        FFmpegFrameGrabber grabber = new FFmpegFrameGrabber(path.toFile());
        try {
            grabberConfig.configureGrabber(grabber);

            VideoProperties properties = describe(grabber);

            logger.info("Opened {} - {}fps, {} frames, {}x{}", path.getFileName(),
                    properties.getFrameRate(), properties.getTotalFrames(),
                    properties.getWidth(), properties.getHeight());

            return new GrabberVideoSource(path.getFileName().toString(), grabber, properties);
        } catch (Exception e) {
            try {
                grabber.release();
            } catch (Exception releaseError) {
                logger.warn("Error releasing grabber after failed open of {}: {}", path, releaseError.getMessage());
            }
            throw new VideoAccessException("Could not open video " + path.getFileName(), e);
        }
    }

    /**
     * Stream properties of a started grabber.
     */
    static VideoProperties describe(FFmpegFrameGrabber grabber) {
        double frameRate = grabber.getFrameRate();
        int totalFrames = grabber.getLengthInVideoFrames();
        if (totalFrames <= 0 && frameRate > 0 && grabber.getLengthInTime() > 0) {
            // Some containers (webm) carry no frame count, only a duration in microseconds
            totalFrames = (int) Math.floor(grabber.getLengthInTime() / 1_000_000.0 * frameRate);
        }
        return VideoProperties.of(frameRate, totalFrames, grabber.getImageWidth(), grabber.getImageHeight());
    }
}
