package org.javai.result.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonMappingException;

/**
 * Thrown when a payload cannot be turned back into an {@link org.javai.result.Error},
 * {@link org.javai.result.ErrorCode} or {@link org.javai.result.Result}: a missing or empty
 * {@code $type}, a type that cannot be found or has the wrong supertype, a code without a
 * singleton {@code INSTANCE}, or an error type none of whose constructors accepts the payload.
 *
 * <p>Decoding never substitutes a default in these cases.
 */
public class ErrorDecodingException extends JsonMappingException {

    public ErrorDecodingException(JsonParser parser, String message) {
        super(parser, message);
    }

    public ErrorDecodingException(JsonParser parser, String message, Throwable cause) {
        super(parser, message, cause);
    }
}
