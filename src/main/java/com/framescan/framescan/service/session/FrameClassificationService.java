package com.framescan.framescan.service.session;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.framescan.framescan.config.ScanProperties;
import com.framescan.framescan.exception.ClassifierException;
import com.framescan.framescan.exception.SessionError;
import com.framescan.framescan.exception.SessionException;
import com.framescan.framescan.exception.VideoAccessException;
import com.framescan.framescan.model.Classification;
import com.framescan.framescan.model.ClassificationResult;
import com.framescan.framescan.model.VideoProperties;
import com.framescan.framescan.service.classifier.ClassifierBootstrap;
import com.framescan.framescan.service.classifier.FrameClassifier;
import com.framescan.framescan.service.video.VideoSource;

/**
 * Classifies the frame of a session's video shown at a given playback time.
 * Shared by the ambient coordinator and by on-demand client requests; callers
 * for the same session serialize on the session's cursor lock.
 */
@Service
public class FrameClassificationService {

    private static final Logger logger = LoggerFactory.getLogger(FrameClassificationService.class);

    private final SessionRegistry registry;
    private final ClassifierBootstrap classifierBootstrap;
    private final String benignLabel;

    public FrameClassificationService(SessionRegistry registry, ClassifierBootstrap classifierBootstrap,
            ScanProperties properties) {
        this.registry = registry;
        this.classifierBootstrap = classifierBootstrap;
        this.benignLabel = properties.getClassifier().getBenignLabel();
    }

    public Optional<ClassificationResult> classifyAt(String sessionId, double timestamp) {
        return classifyAt(registry.require(sessionId), timestamp);
    }

    /**
     * @return empty when the timestamp maps past the last frame
     * @throws SessionException VIDEO_NOT_INITIALIZED, CLASSIFIER_UNAVAILABLE, VIDEO_CLOSED,
     *                          FRAME_READ_ERROR or CLASSIFICATION_FAILED
     */
    public Optional<ClassificationResult> classifyAt(ScanSession session, double timestamp) {
        VideoProperties properties = session.getProperties();
        if (session.getVideoSource() == null || properties == null) {
            throw new SessionException(SessionError.VIDEO_NOT_INITIALIZED);
        }
        FrameClassifier classifier = classifierBootstrap.requireClassifier();

        long frameIndex = properties.frameIndexAt(timestamp);
        if (!properties.containsFrame(frameIndex)) {
            logger.debug("Session {}: t={} maps to frame {} outside 0..{}, skipping",
                    session.getId(), timestamp, frameIndex, properties.getTotalFrames());
            return Optional.empty();
        }

        BufferedImage frame = readFrame(session, frameIndex);
        BufferedImage rgb = toRgb(frame);

        Classification classification;
        try {
            classification = classifier.classify(rgb);
        } catch (ClassifierException e) {
            throw new SessionException(SessionError.CLASSIFICATION_FAILED,
                    "Classification failed for frame " + frameIndex + ": " + e.getMessage(), e);
        }

        ClassificationResult result = ClassificationResult.of(timestamp, frameIndex, classification, benignLabel);
        logger.debug("Session {}: frame {} -> {} ({})", session.getId(), frameIndex,
                result.getLabel(), result.getConfidence());
        return Optional.of(result);
    }

    private BufferedImage readFrame(ScanSession session, long frameIndex) {
        BufferedImage frame;
        session.cursorLock().lock();
        try {
            VideoSource source = session.getVideoSource();
            if (session.isClosing() || source == null) {
                throw new SessionException(SessionError.VIDEO_CLOSED);
            }
            source.seekToFrame(frameIndex);
            frame = source.readFrame();
        } catch (VideoAccessException e) {
            if (e.isClosed()) {
                throw new SessionException(SessionError.VIDEO_CLOSED, e.getMessage(), e);
            }
            throw new SessionException(SessionError.FRAME_READ_ERROR,
                    "Could not read frame " + frameIndex + ": " + e.getMessage(), e);
        } finally {
            session.cursorLock().unlock();
        }

        if (frame == null) {
            throw new SessionException(SessionError.FRAME_READ_ERROR, "Could not read frame " + frameIndex);
        }
        return frame;
    }

    /**
     * Decoded frames are BGR; the classifier expects RGB.
     */
    static BufferedImage toRgb(BufferedImage frame) {
        if (frame.getType() == BufferedImage.TYPE_INT_RGB) {
            return frame;
        }
        BufferedImage rgb = new BufferedImage(frame.getWidth(), frame.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(frame, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
