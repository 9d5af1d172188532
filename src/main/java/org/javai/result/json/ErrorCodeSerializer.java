package org.javai.result.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import org.javai.result.ErrorCode;

/**
 * Writes an error code as {@code {"$type": <class name>, "$name": <name>}}.
 */
final class ErrorCodeSerializer extends StdSerializer<ErrorCode> {

    static final String NAME_PROPERTY = "$name";

    ErrorCodeSerializer() {
        super(ErrorCode.class);
    }

    @Override
    public void serialize(ErrorCode value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject(value);
        gen.writeStringField(ErrorFields.TYPE_PROPERTY, value.getClass().getName());
        gen.writeStringField(NAME_PROPERTY, value.name());
        gen.writeEndObject();
    }
}
