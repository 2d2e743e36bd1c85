package com.framescan.framescan.service.video;

import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.FrameGrabber;
import org.springframework.stereotype.Component;

/**
 * Configures FFmpeg frame grabbers for random-access decoding of local video files
 */
@Component
class FFmpegGrabberConfig {

    /**
     * Configure and start a grabber for a file on disk
     *
     * @param grabber The FFmpegFrameGrabber to configure
     * @throws FrameGrabber.Exception if the container cannot be opened
     */
    public void configureGrabber(FFmpegFrameGrabber grabber) throws FrameGrabber.Exception {
        grabber.setImageMode(FrameGrabber.ImageMode.COLOR);

        // Decoding happens on the caller's thread
        grabber.setOption("threads", "1");

        // Analyse enough of the file to get reliable frame rate and frame count
        grabber.setOption("analyzeduration", "5000000");
        grabber.setOption("probesize", "5000000");

        // Tolerate damaged packets instead of failing the whole read
        grabber.setOption("err_detect", "ignore_err");
        grabber.setOption("fflags", "+discardcorrupt+genpts");
        grabber.setOption("allowed_media_types", "video");

        grabber.start();
    }
}
