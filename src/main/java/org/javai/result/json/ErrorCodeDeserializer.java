package org.javai.result.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.util.Objects;
import org.javai.result.ErrorCode;
import org.javai.result.Result;

/**
 * Reads an error code and returns the canonical singleton of its class, never a copy.
 * {@code $name} is informational; the class alone identifies the code.
 */
final class ErrorCodeDeserializer extends StdDeserializer<ErrorCode> {

    private final ErrorTypeRegistry registry;
    private final Class<?> requestedType;

    ErrorCodeDeserializer(ErrorTypeRegistry registry, Class<?> requestedType) {
        super(ErrorCode.class);
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.requestedType = Objects.requireNonNull(requestedType, "requestedType must not be null");
    }

    @Override
    public ErrorCode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.isExpectedStartObjectToken()) {
            throw new ErrorDecodingException(p, "ErrorCode must be serialized as an object");
        }
        JsonNode node = ctxt.readTree(p);
        JsonNode typeNode = node.get(ErrorFields.TYPE_PROPERTY);
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isEmpty()) {
            throw new ErrorDecodingException(p, "ErrorCode requires $type property");
        }

        Result<ErrorCode> resolved = registry.resolveCode(typeNode.asText());
        if (resolved.isFailure()) {
            throw new ErrorDecodingException(p, resolved.error().getDescription());
        }
        ErrorCode code = resolved.value();
        if (!requestedType.isInstance(code)) {
            throw new ErrorDecodingException(p,
                    "ErrorCode type '" + code.getClass().getName() + "' is not a " + requestedType.getName());
        }
        return code;
    }
}
