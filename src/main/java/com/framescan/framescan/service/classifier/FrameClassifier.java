package com.framescan.framescan.service.classifier;

import java.awt.image.BufferedImage;

import com.framescan.framescan.exception.ClassifierException;
import com.framescan.framescan.model.Classification;

/**
 * Image classification model, consumed as an opaque function.
 */
public interface FrameClassifier {

    /**
     * @param image frame in RGB channel order
     * @return the top prediction
     * @throws ClassifierException if the model could not produce a prediction
     */
    Classification classify(BufferedImage image);
}
