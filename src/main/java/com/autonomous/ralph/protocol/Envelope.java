package com.autonomous.ralph.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;

/**
 * One WebSocket text frame: {@code {"type": ..., "data": {...}}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Envelope {
    private String type;
    private JsonNode data;

    public static Envelope parse(ObjectMapper mapper, String text) throws IOException {
        Envelope envelope = mapper.readValue(text, Envelope.class);
        if (envelope.getData() == null) {
            envelope.setData(NullNode.getInstance());
        }
        return envelope;
    }

    public static String write(ObjectMapper mapper, String type, Object data) throws IOException {
        return mapper.writeValueAsString(new Envelope(type, mapper.valueToTree(data)));
    }

    public <T> T dataAs(ObjectMapper mapper, Class<T> payloadType) throws IOException {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return mapper.treeToValue(mapper.createObjectNode(), payloadType);
        }
        return mapper.treeToValue(data, payloadType);
    }
}
