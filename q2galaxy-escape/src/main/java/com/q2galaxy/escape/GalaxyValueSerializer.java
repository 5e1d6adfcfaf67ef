package com.q2galaxy.escape;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes a {@link GalaxyValue} as the matching JSON scalar: null, true, false or a string.
 */
public final class GalaxyValueSerializer extends JsonSerializer<GalaxyValue> {

    @Override
    public void serialize(GalaxyValue value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        switch (value.getKind()) {
            case ABSENT:
                gen.writeNull();
                break;
            case TRUE:
                gen.writeBoolean(true);
                break;
            case FALSE:
                gen.writeBoolean(false);
                break;
            default:
                gen.writeString(value.asText());
        }
    }
}
