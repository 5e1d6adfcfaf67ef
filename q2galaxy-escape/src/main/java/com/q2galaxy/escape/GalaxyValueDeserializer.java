package com.q2galaxy.escape;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Reads a {@link GalaxyValue} from a JSON scalar: null → absent, true/false → sentinels, string → text.
 * Numbers, arrays and objects are rejected; they are not coerced to text.
 */
public final class GalaxyValueDeserializer extends JsonDeserializer<GalaxyValue> {

    @Override
    public GalaxyValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);
        if (node == null || node.isNull()) {
            return GalaxyValue.ABSENT;
        }
        if (node.isBoolean()) {
            return GalaxyValue.of(node.booleanValue());
        }
        if (node.isTextual()) {
            return GalaxyValue.text(node.textValue());
        }
        return ctxt.reportInputMismatch(GalaxyValue.class,
                "Unsupported value type for escaping: JSON %s", node.getNodeType());
    }

    @Override
    public GalaxyValue getNullValue(DeserializationContext ctxt) {
        return GalaxyValue.ABSENT;
    }
}
