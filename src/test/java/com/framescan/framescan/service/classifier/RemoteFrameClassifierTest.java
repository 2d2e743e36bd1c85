package com.framescan.framescan.service.classifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.awt.image.BufferedImage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import com.framescan.framescan.config.ScanProperties;
import com.framescan.framescan.exception.ClassifierException;
import com.framescan.framescan.model.Classification;

class RemoteFrameClassifierTest {

    private static final String ENDPOINT = "http://classifier.local/predict";

    private RemoteFrameClassifier classifier;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        ScanProperties properties = new ScanProperties();
        properties.getClassifier().setEndpoint(ENDPOINT);
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        classifier = new RemoteFrameClassifier(new RestTemplateBuilder(customizer), properties);
        server = customizer.getServer();
    }

    private static BufferedImage frame() {
        return new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB);
    }

    @Test
    void picksTheHighestScoringPrediction() {
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentType(MediaType.IMAGE_JPEG))
                .andRespond(withSuccess(
                        "[{\"label\":\"normal\",\"score\":0.12},{\"label\":\"nsfw\",\"score\":0.88}]",
                        MediaType.APPLICATION_JSON));

        Classification top = classifier.classify(frame());

        assertEquals("nsfw", top.getLabel());
        assertEquals(0.88, top.getScore());
        server.verify();
    }

    @Test
    void serverErrorBecomesClassifierException() {
        server.expect(requestTo(ENDPOINT)).andRespond(withServerError());

        assertThrows(ClassifierException.class, () -> classifier.classify(frame()));
    }

    @Test
    void emptyPredictionListIsAnError() {
        server.expect(requestTo(ENDPOINT)).andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertThrows(ClassifierException.class, () -> classifier.classify(frame()));
    }

    @Test
    void unconfiguredEndpointFailsWithoutCallingOut() {
        RemoteFrameClassifier unconfigured = new RemoteFrameClassifier(new RestTemplateBuilder(), new ScanProperties());

        assertFalse(unconfigured.isConfigured());
        assertThrows(ClassifierException.class, () -> unconfigured.classify(frame()));
    }
}
