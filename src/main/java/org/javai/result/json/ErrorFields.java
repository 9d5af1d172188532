package org.javai.result.json;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.result.Error;
import org.javai.result.ErrorCode;

/**
 * The fields of one serialized error, as seen by an {@link ErrorDecoder}.
 *
 * <p>Field names are matched case-insensitively, with an exact match preferred. The
 * {@code $type} discriminator is not a field. Values are decoded through the same
 * {@link DeserializationContext}, so an {@link ErrorCode} field resolves to its singleton.
 */
public final class ErrorFields {

    static final String TYPE_PROPERTY = "$type";

    private final Class<? extends Error> type;
    private final ObjectNode node;
    private final DeserializationContext context;

    ErrorFields(Class<? extends Error> type, ObjectNode node, DeserializationContext context) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.node = Objects.requireNonNull(node, "node must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    /**
     * The error variant being decoded.
     */
    public Class<? extends Error> type() {
        return type;
    }

    /**
     * The raw payload, including {@code $type}.
     */
    public ObjectNode node() {
        return node;
    }

    DeserializationContext context() {
        return context;
    }

    public String description() throws IOException {
        return require("description", String.class);
    }

    public ErrorCode code() throws IOException {
        return require("code", ErrorCode.class);
    }

    /**
     * Decodes a field that must be present.
     *
     * @throws ErrorDecodingException if the field is absent
     */
    public <V> V require(String name, Class<V> valueType) throws IOException {
        Optional<JsonNode> field = field(name);
        if (field.isEmpty()) {
            throw new ErrorDecodingException(context.getParser(),
                    "Error type '" + type.getName() + "' requires field '" + name + "'");
        }
        return decode(field.get(), context.constructType(valueType));
    }

    /**
     * Decodes a field that may be absent.
     */
    public <V> Optional<V> find(String name, Class<V> valueType) throws IOException {
        Optional<JsonNode> field = field(name);
        if (field.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(decode(field.get(), context.constructType(valueType)));
    }

    /**
     * Returns the node stored under {@code name}: the exact key if present, otherwise the
     * first key equal to it ignoring case.
     */
    Optional<JsonNode> field(String name) {
        if (TYPE_PROPERTY.equals(name)) {
            return Optional.empty();
        }
        JsonNode exact = node.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!TYPE_PROPERTY.equals(entry.getKey()) && entry.getKey().equalsIgnoreCase(name)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    <V> V decode(JsonNode value, JavaType valueType) throws IOException {
        return context.readTreeAsValue(value, valueType);
    }
}
