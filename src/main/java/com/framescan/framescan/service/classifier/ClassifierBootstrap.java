package com.framescan.framescan.service.classifier;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.framescan.framescan.exception.SessionError;
import com.framescan.framescan.exception.SessionException;
import com.framescan.framescan.model.Classification;

import jakarta.annotation.PostConstruct;

/**
 * Tests the classifier once at startup. A failed self-test leaves the service
 * running with classification disabled instead of aborting startup.
 */
@Component
public class ClassifierBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ClassifierBootstrap.class);
    private static final int TEST_IMAGE_SIZE = 224;

    private final FrameClassifier classifier;
    private volatile boolean available = false;

    public ClassifierBootstrap(FrameClassifier classifier) {
        this.classifier = classifier;
    }

    @PostConstruct
    public void init() {
        try {
            Classification result = classifier.classify(selfTestImage());
            available = true;
            log.info("Classifier loaded and tested successfully (self-test: {} {})", result.getLabel(), result.getScore());
        } catch (Exception e) {
            available = false;
            log.error("Classifier failed to load. Classification will be unavailable. Cause: {}", e.getMessage());
        }
    }

    public boolean isAvailable() {
        return available;
    }

    /**
     * @throws SessionException with {@link SessionError#CLASSIFIER_UNAVAILABLE} if the startup self-test failed
     */
    public FrameClassifier requireClassifier() {
        if (!available) {
            throw new SessionException(SessionError.CLASSIFIER_UNAVAILABLE);
        }
        return classifier;
    }

    private static BufferedImage selfTestImage() {
        BufferedImage image = new BufferedImage(TEST_IMAGE_SIZE, TEST_IMAGE_SIZE, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.RED);
            g.fillRect(0, 0, TEST_IMAGE_SIZE, TEST_IMAGE_SIZE);
        } finally {
            g.dispose();
        }
        return image;
    }
}
