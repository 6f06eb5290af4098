package com.mcpbuilder.core.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpbuilder.core.model.Frame;
import org.springframework.stereotype.Component;

/**
 * JSON encoding of {@link Frame}s on the wire.
 */
@Component
public class FrameCodec {

    private final ObjectMapper objectMapper;

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(Frame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Frame of type " + frame.type() + " is not serializable", e);
        }
    }

    public JsonNode decode(String payload) throws JsonProcessingException {
        return objectMapper.readTree(payload);
    }
}
