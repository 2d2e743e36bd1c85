package com.framescan.framescan.service.classifier;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.framescan.framescan.config.ScanProperties;
import com.framescan.framescan.exception.ClassifierException;
import com.framescan.framescan.model.Classification;

/**
 * Sends frames as JPEG to an image-classification inference endpoint that
 * answers with a list of {@code {label, score}} predictions.
 */
@Component
public class RemoteFrameClassifier implements FrameClassifier {

    private static final Logger logger = LoggerFactory.getLogger(RemoteFrameClassifier.class);

    private final RestTemplate restTemplate;
    private final String endpoint;

    public RemoteFrameClassifier(RestTemplateBuilder builder, ScanProperties properties) {
        ScanProperties.Classifier config = properties.getClassifier();
        this.endpoint = config.getEndpoint();
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofMillis(config.getConnectTimeoutMillis()))
                .setReadTimeout(Duration.ofMillis(config.getReadTimeoutMillis()))
                .build();
    }

    public boolean isConfigured() {
        return endpoint != null && !endpoint.isBlank();
    }

    @Override
    public Classification classify(BufferedImage image) {
        if (!isConfigured()) {
            throw new ClassifierException("No classifier endpoint configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.IMAGE_JPEG);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        Classification[] predictions;
        try {
            predictions = restTemplate.postForObject(endpoint, new HttpEntity<>(toJpeg(image), headers),
                    Classification[].class);
        } catch (RestClientException e) {
            throw new ClassifierException("Classifier request failed: " + e.getMessage(), e);
        }

        if (predictions == null || predictions.length == 0) {
            throw new ClassifierException("Classifier returned no predictions");
        }

        Classification top = Arrays.stream(predictions)
                .max(Comparator.comparingDouble(Classification::getScore))
                .orElseThrow();
        logger.debug("Classified frame as {} ({})", top.getLabel(), top.getScore());
        return top;
    }

    private static byte[] toJpeg(BufferedImage image) {
        try {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            if (!ImageIO.write(image, "jpg", baos)) {
                throw new ClassifierException("No JPEG writer for image type " + image.getType());
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new ClassifierException("Could not encode frame as JPEG", e);
        }
    }
}
