package org.javai.result.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.Objects;
import org.javai.result.Error;
import org.javai.result.Result;
import org.javai.result.json.ErrorTypeRegistry.ErrorVariant;

/**
 * Reads an error written by {@link ErrorSerializer} back into its exact runtime class.
 *
 * <p>The {@code $type} discriminator is resolved through the {@link ErrorTypeRegistry};
 * a name that cannot be resolved, or that resolves to something other than an error of the
 * requested type, is a decoding failure. There is no fallback to the base {@link Error}.
 */
final class ErrorDeserializer extends StdDeserializer<Error> {

    private final ErrorTypeRegistry registry;
    private final Class<?> requestedType;

    ErrorDeserializer(ErrorTypeRegistry registry, Class<?> requestedType) {
        super(Error.class);
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.requestedType = Objects.requireNonNull(requestedType, "requestedType must not be null");
    }

    @Override
    public Error deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.isExpectedStartObjectToken()) {
            throw new ErrorDecodingException(p, "Error must be serialized as an object");
        }
        ObjectNode node = (ObjectNode) ctxt.readTree(p);
        JsonNode typeNode = node.get(ErrorFields.TYPE_PROPERTY);
        if (typeNode == null) {
            throw new ErrorDecodingException(p, "Error serialization requires $type property");
        }
        if (!typeNode.isTextual() || typeNode.asText().isEmpty()) {
            throw new ErrorDecodingException(p, "Error $type cannot be null or empty");
        }

        Result<ErrorVariant<?>> resolved = registry.resolveError(typeNode.asText());
        if (resolved.isFailure()) {
            throw new ErrorDecodingException(p, resolved.error().getDescription());
        }
        ErrorVariant<?> variant = resolved.value();
        if (!requestedType.isAssignableFrom(variant.type())) {
            throw new ErrorDecodingException(p,
                    "Error type '" + variant.type().getName() + "' is not a " + requestedType.getName());
        }
        try {
            return variant.decoder().decode(new ErrorFields(variant.type(), node, ctxt));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ErrorDecodingException(p,
                    "Invalid payload for Error type '" + variant.type().getName() + "': " + e.getMessage(), e);
        }
    }
}
