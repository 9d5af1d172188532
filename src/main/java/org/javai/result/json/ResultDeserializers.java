package org.javai.result.json;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.type.TypeFactory;
import java.util.Objects;
import org.javai.result.Error;
import org.javai.result.ErrorCode;
import org.javai.result.Result;

/**
 * Picks the codec deserializer for any requested subtype of {@link ErrorCode}, {@link Error}
 * or {@link Result}. The requested type travels with the deserializer so a payload naming
 * an unrelated subtype is rejected instead of cast.
 */
final class ResultDeserializers extends Deserializers.Base {

    private final ErrorTypeRegistry registry;

    ResultDeserializers(ErrorTypeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
        Class<?> raw = type.getRawClass();
        if (ErrorCode.class.isAssignableFrom(raw)) {
            return new ErrorCodeDeserializer(registry, raw);
        }
        if (Error.class.isAssignableFrom(raw)) {
            return new ErrorDeserializer(registry, raw);
        }
        if (Result.class.isAssignableFrom(raw)) {
            JavaType[] parameters = type.findTypeParameters(Result.class);
            JavaType valueType = parameters.length == 1 ? parameters[0] : TypeFactory.unknownType();
            return new ResultDeserializer(raw, valueType);
        }
        return null;
    }
}
