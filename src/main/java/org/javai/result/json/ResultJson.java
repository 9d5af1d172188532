package org.javai.result.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import java.util.Objects;
import org.javai.result.Error;
import org.javai.result.ErrorCode;
import org.javai.result.Result;

/**
 * Text encoding of results, errors and error codes.
 *
 * <p>A thin front for an {@link ObjectMapper} carrying the {@link ResultModule}. Decoding
 * failures surface as {@link ErrorDecodingException} (a {@link JsonProcessingException}).
 */
public final class ResultJson {

    private static final ResultJson DEFAULT = new ResultJson(ErrorTypeRegistry.shared());

    private final ObjectMapper mapper;

    /**
     * Uses a fresh mapper with {@link Jdk8Module}, so errors may carry {@code Optional} fields.
     */
    public ResultJson(ErrorTypeRegistry registry) {
        this(new ObjectMapper().registerModule(new Jdk8Module()), registry);
    }

    /**
     * Uses {@code mapper} as configured by the caller, adding the {@link ResultModule}.
     * Errors with {@code Optional} fields need {@link Jdk8Module} on that mapper.
     *
     * @throws IllegalStateException if {@code mapper} already has a {@link ResultModule}
     */
    public ResultJson(ObjectMapper mapper, ErrorTypeRegistry registry) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        ResultModule module = new ResultModule(registry);
        if (mapper.getRegisteredModuleIds().contains(module.getTypeId())) {
            throw new IllegalStateException(
                    "ObjectMapper already has a " + module.getModuleName() + "; its registry would replace this one");
        }
        this.mapper = mapper.registerModule(module);
    }

    /**
     * The instance backed by {@link ErrorTypeRegistry#shared()}.
     */
    public static ResultJson defaults() {
        return DEFAULT;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public String encode(Object value) throws JsonProcessingException {
        return mapper.writeValueAsString(value);
    }

    public Error decodeError(String json) throws JsonProcessingException {
        return mapper.readValue(json, Error.class);
    }

    public <E extends Error> E decodeError(String json, Class<E> type) throws JsonProcessingException {
        return mapper.readValue(json, type);
    }

    public ErrorCode decodeErrorCode(String json) throws JsonProcessingException {
        return mapper.readValue(json, ErrorCode.class);
    }

    public <T> Result<T> decodeResult(String json, Class<T> valueType) throws JsonProcessingException {
        return mapper.readValue(json, resultType(mapper.constructType(valueType)));
    }

    public <T> Result<T> decodeResult(String json, TypeReference<T> valueType) throws JsonProcessingException {
        return mapper.readValue(json, resultType(mapper.constructType(valueType)));
    }

    private JavaType resultType(JavaType valueType) {
        return mapper.getTypeFactory().constructParametricType(Result.class, valueType);
    }
}
