package org.javai.result.json;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Parameter;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.result.Error;

/**
 * Rebuilds an error by trying its public constructors against the decoded fields.
 *
 * <p>Candidates are ordered by parameter count, richest first; constructors with the same
 * count are ordered by their generic signature so the order never depends on reflection
 * order. For each parameter:
 * <ol>
 *   <li>the field whose name matches the parameter name (ignoring case) is decoded into
 *       the parameter's declared type;</li>
 *   <li>if there is no such field, an {@link Optional} parameter gets {@code Optional.empty()}
 *       and a parameter annotated {@code @JsonProperty(defaultValue = "...")} gets that
 *       default;</li>
 *   <li>otherwise the candidate is skipped.</li>
 * </ol>
 * A field that fails to decode, or a constructor that throws, disqualifies that candidate
 * only. The first candidate that binds every parameter and constructs wins. Nothing is
 * constructed until all arguments of a candidate are bound.
 *
 * <p>Parameter names come from {@code @JsonProperty} when present, otherwise from the
 * {@code MethodParameters} attribute, so error classes should be compiled with
 * {@code -parameters}.
 */
final class ConstructorProbe<E extends Error> implements ErrorDecoder<E> {

    private static final Logger log = LogManager.getLogger(ConstructorProbe.class);

    private static final Comparator<Constructor<?>> RICHEST_FIRST =
            Comparator.<Constructor<?>>comparingInt(Constructor::getParameterCount)
                    .reversed()
                    .thenComparing(Constructor::toGenericString);

    private final Class<E> type;
    private final List<Constructor<?>> candidates;

    ConstructorProbe(Class<E> type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.candidates = Arrays.stream(type.getConstructors())
                .sorted(RICHEST_FIRST)
                .toList();
    }

    @Override
    public E decode(ErrorFields fields) throws IOException {
        if (candidates.isEmpty()) {
            throw new ErrorDecodingException(fields.context().getParser(),
                    "Error type '" + type.getName() + "' has no public constructors");
        }
        for (Constructor<?> candidate : candidates) {
            Optional<Object[]> arguments = bind(candidate, fields);
            if (arguments.isEmpty()) {
                continue;
            }
            Optional<E> constructed = construct(candidate, arguments.get());
            if (constructed.isPresent()) {
                return constructed.get();
            }
        }
        throw new ErrorDecodingException(fields.context().getParser(),
                "Could not find a compatible constructor for Error type '" + type.getName() + "'");
    }

    private Optional<Object[]> bind(Constructor<?> candidate, ErrorFields fields) {
        Parameter[] parameters = candidate.getParameters();
        Object[] arguments = new Object[parameters.length];
        for (int i = 0; i < parameters.length; i++) {
            Parameter parameter = parameters[i];
            Optional<String> name = nameOf(parameter);
            if (name.isEmpty()) {
                log.debug("Skipping {}: parameter {} has no name; compile with -parameters",
                        candidate, i);
                return Optional.empty();
            }
            JavaType parameterType = fields.context().constructType(parameter.getParameterizedType());
            Optional<JsonNode> field = fields.field(name.get());
            try {
                if (field.isPresent()) {
                    arguments[i] = fields.decode(field.get(), parameterType);
                } else if (parameter.getType() == Optional.class) {
                    arguments[i] = Optional.empty();
                } else if (defaultValueOf(parameter).isPresent()) {
                    arguments[i] = fields.decode(new TextNode(defaultValueOf(parameter).get()), parameterType);
                } else {
                    log.debug("Skipping {}: no field for parameter '{}'", candidate, name.get());
                    return Optional.empty();
                }
            } catch (IOException | IllegalArgumentException e) {
                log.debug("Skipping {}: field '{}' did not decode as {}: {}",
                        candidate, name.get(), parameterType, e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.of(arguments);
    }

    private Optional<E> construct(Constructor<?> candidate, Object[] arguments) {
        try {
            // the class itself may be non-public, e.g. an error nested in a package-private holder
            candidate.trySetAccessible();
            return Optional.of(type.cast(candidate.newInstance(arguments)));
        } catch (InvocationTargetException e) {
            log.debug("Skipping {}: constructor threw {}", candidate, e.getCause().toString());
            return Optional.empty();
        } catch (ReflectiveOperationException | IllegalArgumentException | LinkageError e) {
            log.debug("Skipping {}: {}", candidate, e.toString());
            return Optional.empty();
        }
    }

    private static Optional<String> nameOf(Parameter parameter) {
        JsonProperty property = parameter.getAnnotation(JsonProperty.class);
        if (property != null && !property.value().isEmpty()) {
            return Optional.of(property.value());
        }
        return parameter.isNamePresent() ? Optional.of(parameter.getName()) : Optional.empty();
    }

    private static Optional<String> defaultValueOf(Parameter parameter) {
        JsonProperty property = parameter.getAnnotation(JsonProperty.class);
        if (property == null || property.defaultValue().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(property.defaultValue());
    }
}
