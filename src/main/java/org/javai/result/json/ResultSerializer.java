package org.javai.result.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import org.javai.result.Result;

/**
 * Writes {@code {"isSuccess": true, "value": ...}} or {@code {"isSuccess": false, "error": {...}}}.
 * A null success value and the {@link Result#NONE} error of a success are omitted.
 */
final class ResultSerializer extends StdSerializer<Result<?>> {

    static final String SUCCESS_PROPERTY = "isSuccess";
    static final String VALUE_PROPERTY = "value";
    static final String ERROR_PROPERTY = "error";

    ResultSerializer() {
        super(Result.class, false);
    }

    @Override
    public void serialize(Result<?> value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject(value);
        gen.writeBooleanField(SUCCESS_PROPERTY, value.isSuccess());
        if (value.isFailure()) {
            provider.defaultSerializeField(ERROR_PROPERTY, value.error(), gen);
        } else if (value.value() != null) {
            provider.defaultSerializeField(VALUE_PROPERTY, value.value(), gen);
        }
        gen.writeEndObject();
    }
}
