package org.javai.result.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.util.Objects;
import org.javai.result.Error;
import org.javai.result.Result;

/**
 * Reads a result written by {@link ResultSerializer}.
 *
 * <p>An absent or null {@code error} stands for {@link Result#NONE}. The parts are checked
 * by {@link Result#of}: a failure without an error, or a success with a real error, is a
 * decoding failure.
 */
final class ResultDeserializer extends StdDeserializer<Result<?>> {

    private final Class<?> requestedType;
    private final JavaType valueType;

    ResultDeserializer(Class<?> requestedType, JavaType valueType) {
        super(Result.class);
        this.requestedType = Objects.requireNonNull(requestedType, "requestedType must not be null");
        this.valueType = Objects.requireNonNull(valueType, "valueType must not be null");
    }

    @Override
    public Result<?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.isExpectedStartObjectToken()) {
            throw new ErrorDecodingException(p, "Result must be serialized as an object");
        }
        JsonNode node = ctxt.readTree(p);
        JsonNode successNode = node.get(ResultSerializer.SUCCESS_PROPERTY);
        if (successNode == null || !successNode.isBoolean()) {
            throw new ErrorDecodingException(p, "Result requires a boolean isSuccess property");
        }
        boolean isSuccess = successNode.booleanValue();

        Error error = Result.NONE;
        JsonNode errorNode = node.get(ResultSerializer.ERROR_PROPERTY);
        if (errorNode != null && !errorNode.isNull()) {
            error = ctxt.readTreeAsValue(errorNode, Error.class);
        }

        Object value = null;
        JsonNode valueNode = node.get(ResultSerializer.VALUE_PROPERTY);
        if (isSuccess && valueNode != null && !valueNode.isNull()) {
            value = ctxt.readTreeAsValue(valueNode, valueType);
        }

        Result<?> result;
        try {
            result = Result.of(isSuccess, error, value);
        } catch (IllegalArgumentException e) {
            throw new ErrorDecodingException(p, e.getMessage(), e);
        }
        if (!requestedType.isInstance(result)) {
            throw new ErrorDecodingException(p,
                    "Decoded " + result.getClass().getSimpleName() + " is not a " + requestedType.getName());
        }
        return result;
    }
}
