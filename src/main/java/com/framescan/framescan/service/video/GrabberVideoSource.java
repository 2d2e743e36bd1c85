package com.framescan.framescan.service.video;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameGrabber;
import org.bytedeco.javacv.Java2DFrameConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.framescan.framescan.exception.VideoAccessException;
import com.framescan.framescan.model.VideoProperties;

/**
 * {@link VideoSource} backed by a started {@link FFmpegFrameGrabber}.
 */
class GrabberVideoSource implements VideoSource {

    private static final Logger logger = LoggerFactory.getLogger(GrabberVideoSource.class);

    private final String name;
    private final VideoProperties properties;
    private final Java2DFrameConverter converter = new Java2DFrameConverter();
    private volatile FFmpegFrameGrabber grabber;

    GrabberVideoSource(String name, FFmpegFrameGrabber grabber, VideoProperties properties) {
        this.name = name;
        this.grabber = grabber;
        this.properties = properties;
    }

    @Override
    public VideoProperties properties() {
        return properties;
    }

    @Override
    public void seekToFrame(long frameIndex) throws VideoAccessException {
        FFmpegFrameGrabber g = requireOpen();
        try {
            g.setVideoFrameNumber((int) frameIndex);
        } catch (FrameGrabber.Exception e) {
            throw new VideoAccessException("Seek to frame " + frameIndex + " failed for " + name, e);
        }
    }

    @Override
    public BufferedImage readFrame() throws VideoAccessException {
        FFmpegFrameGrabber g = requireOpen();
        Frame frame;
        try {
            frame = g.grabImage();
        } catch (FrameGrabber.Exception e) {
            throw new VideoAccessException("Frame decode failed for " + name, e);
        }
        if (frame == null || frame.image == null || frame.imageWidth <= 0 || frame.imageHeight <= 0) {
            return null;
        }
        return deepCopy(converter.convert(frame));
    }

    @Override
    public boolean isClosed() {
        return grabber == null;
    }

    @Override
    public synchronized void close() {
        FFmpegFrameGrabber g = grabber;
        if (g == null) {
            return;
        }
        grabber = null;

        try {
            g.stop();
            logger.debug("Grabber stopped for {}", name);
        } catch (Exception e) {
            logger.warn("Error stopping grabber for {}: {}", name, e.getMessage());
        }

        try {
            g.release();
            logger.debug("Grabber released for {}", name);
        } catch (Exception e) {
            logger.error("Error releasing grabber for {}: {}", name, e.getMessage(), e);
        }
    }

    private FFmpegFrameGrabber requireOpen() throws VideoAccessException {
        FFmpegFrameGrabber g = grabber;
        if (g == null) {
            throw VideoAccessException.closed(name);
        }
        return g;
    }

    /**
     * The converter reuses its buffer between calls, so hand out an independent copy.
     */
    private static BufferedImage deepCopy(BufferedImage original) {
        if (original == null) {
            return null;
        }
        BufferedImage copy = new BufferedImage(original.getWidth(), original.getHeight(),
                BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(original, 0, 0, null);
        } finally {
            g.dispose();
        }
        return copy;
    }
}
