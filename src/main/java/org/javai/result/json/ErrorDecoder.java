package org.javai.result.json;

import java.io.IOException;
import org.javai.result.Error;

/**
 * Rebuilds one error variant from its decoded fields.
 * Registered with {@link ErrorTypeRegistry#register(Class, ErrorDecoder)}.
 *
 * @param <E> The error variant produced
 */
@FunctionalInterface
public interface ErrorDecoder<E extends Error> {

    E decode(ErrorFields fields) throws IOException;
}
