package org.javai.result.json;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.ser.Serializers;
import org.javai.result.Error;
import org.javai.result.ErrorCode;
import org.javai.result.Result;

/**
 * Picks the codec serializer for any subtype of {@link ErrorCode}, {@link Error} or {@link Result}.
 */
final class ResultSerializers extends Serializers.Base {

    private final ErrorCodeSerializer errorCodeSerializer = new ErrorCodeSerializer();
    private final ErrorSerializer errorSerializer = new ErrorSerializer();
    private final ResultSerializer resultSerializer = new ResultSerializer();

    @Override
    public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
        Class<?> raw = type.getRawClass();
        if (ErrorCode.class.isAssignableFrom(raw)) {
            return errorCodeSerializer;
        }
        if (Error.class.isAssignableFrom(raw)) {
            return errorSerializer;
        }
        if (Result.class.isAssignableFrom(raw)) {
            return resultSerializer;
        }
        return null;
    }
}
