package com.framescan.framescan.model.dto;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.framescan.framescan.model.Classification;
import com.framescan.framescan.model.ClassificationResult;
import com.framescan.framescan.model.VideoProperties;

class SessionEventJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void classificationEventUsesTheWireFieldNames() throws Exception {
        ClassificationResult result = ClassificationResult.of(5.0, 150, new Classification("nsfw", 0.75), "normal");

        String json = mapper.writeValueAsString(new ClassificationEvent(result));
        JsonNode node = mapper.readTree(json);

        assertTrue(json.startsWith("{\"type\":\"classification\""));
        assertEquals(5.0, node.get("timestamp").asDouble());
        assertEquals(150, node.get("frame").asLong());
        assertEquals("nsfw", node.get("label").asText());
        assertEquals(0.75, node.get("confidence").asDouble());
        assertTrue(node.get("is_nsfw").asBoolean());
        assertFalse(node.has("nsfw"));
    }

    @Test
    void videoInfoCarriesStreamProperties() throws Exception {
        JsonNode node = mapper.readTree(mapper.writeValueAsString(
                new VideoInfoEvent(VideoProperties.of(25.0, 250, 640, 480))));

        assertEquals("video_info", node.get("type").asText());
        assertEquals(25.0, node.get("fps").asDouble());
        assertEquals(10.0, node.get("duration").asDouble());
        assertEquals(250, node.get("totalFrames").asInt());
        assertEquals(640, node.get("width").asInt());
        assertEquals(480, node.get("height").asInt());
    }

    @Test
    void pingHasOnlyAType() throws Exception {
        assertEquals("{\"type\":\"ping\"}", mapper.writeValueAsString(new PingEvent()));
    }

    @Test
    void inboundMessageIgnoresExtraFields() throws Exception {
        InboundMessage message = mapper.readValue(
                "{\"type\":\"process_frame\",\"timestamp\":2.5,\"client\":\"web\"}", InboundMessage.class);

        assertEquals(InboundMessage.PROCESS_FRAME, message.getType());
        assertEquals(2.5, message.getTimestamp());
    }
}
