package org.javai.result.json;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.result.ApiError;
import org.javai.result.BusinessRuleViolationError;
import org.javai.result.ConfigurationError;
import org.javai.result.ConflictError;
import org.javai.result.Error;
import org.javai.result.ErrorCode;
import org.javai.result.NotFoundError;
import org.javai.result.Result;
import org.javai.result.UnauthorizedError;
import org.javai.result.UnhandledExceptionError;
import org.javai.result.ValidationError;

/**
 * Maps {@code $type} discriminators to error variants and to the canonical instance of
 * each error code.
 *
 * <p>The tag of a type is its {@link Class#getName() binary class name}. Each tag is bound
 * at most once; afterwards the binding is only read. Registering the same binding again is
 * a no-op, registering a different binding for a bound tag is rejected.
 *
 * <p>Variants registered with an explicit {@link ErrorDecoder} are rebuilt by it. Variants
 * registered by class alone, and variants found through discovery, are rebuilt by probing
 * their public constructors. When {@link CodecSettings#typeDiscovery()} is on, an unknown tag
 * is loaded as a class name, checked against the expected supertype, and cached. The class's
 * static initializer only runs after that check has passed.
 *
 * <p>{@link #shared()} is the process-wide registry used by default; it is created once,
 * with the built-in variants, the base {@link Error} type and the {@link Result#NONE} code.
 */
public final class ErrorTypeRegistry {

    private static final Logger log = LogManager.getLogger(ErrorTypeRegistry.class);

    private static final String INSTANCE_FIELD = "INSTANCE";
    private static final String INSTANCE_METHOD = "getInstance";

    private final Map<String, ErrorVariant<?>> variants = new ConcurrentHashMap<>();
    private final Map<String, ErrorCode> codes = new ConcurrentHashMap<>();
    private final CodecSettings settings;
    private final ClassLoader classLoader;

    /**
     * A variant type and the decoder that rebuilds it.
     */
    record ErrorVariant<E extends Error>(Class<E> type, ErrorDecoder<E> decoder) {

        ErrorVariant {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(decoder, "decoder must not be null");
        }
    }

    private ErrorTypeRegistry(CodecSettings settings, ClassLoader classLoader) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader must not be null");
    }

    /**
     * Creates a registry holding the built-in variants.
     *
     * @param settings how unregistered tags are resolved
     */
    public static ErrorTypeRegistry withBuiltIns(CodecSettings settings) {
        return withBuiltIns(settings, ErrorTypeRegistry.class.getClassLoader());
    }

    /**
     * Creates a registry holding the built-in variants, discovering types through
     * {@code classLoader}.
     */
    public static ErrorTypeRegistry withBuiltIns(CodecSettings settings, ClassLoader classLoader) {
        ErrorTypeRegistry registry = new ErrorTypeRegistry(settings, classLoader);
        registry.registerBuiltIns();
        return registry;
    }

    /**
     * The process-wide registry, configured from {@link CodecSettings#fromEnvironment()}.
     */
    public static ErrorTypeRegistry shared() {
        return Shared.INSTANCE;
    }

    private static final class Shared {
        static final ErrorTypeRegistry INSTANCE = withBuiltIns(CodecSettings.fromEnvironment());
    }

    public CodecSettings settings() {
        return settings;
    }

    // === Registration ===

    /**
     * Registers a variant rebuilt by constructor probing.
     */
    public <E extends Error> ErrorTypeRegistry register(Class<E> type) {
        return register(type, new ConstructorProbe<>(type));
    }

    /**
     * Registers a variant rebuilt by an explicit decoder.
     *
     * @throws IllegalStateException if the tag is already bound to another type
     */
    public <E extends Error> ErrorTypeRegistry register(Class<E> type, ErrorDecoder<E> decoder) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(decoder, "decoder must not be null");
        ErrorVariant<?> existing = variants.putIfAbsent(type.getName(), new ErrorVariant<>(type, decoder));
        if (existing != null && existing.type() != type) {
            throw new IllegalStateException("Tag '" + type.getName() + "' is already bound to " + existing.type());
        }
        return this;
    }

    /**
     * Registers the canonical instance of an error code under its class name.
     *
     * @throws IllegalStateException if a different instance is already bound to the tag
     */
    public ErrorTypeRegistry registerCode(ErrorCode code) {
        Objects.requireNonNull(code, "code must not be null");
        ErrorCode existing = codes.putIfAbsent(code.getClass().getName(), code);
        if (existing != null && existing != code) {
            throw new IllegalStateException("Tag '" + code.getClass().getName() + "' is already bound to another instance");
        }
        return this;
    }

    // === Resolution ===

    /**
     * Resolves a discriminator to an error variant.
     * Fails with a {@link org.javai.result.NotFoundError} if the tag is unknown and cannot be
     * discovered, or a {@link org.javai.result.ValidationError} if it names a class that is
     * not an {@link Error}.
     */
    Result<ErrorVariant<?>> resolveError(String tag) {
        ErrorVariant<?> variant = variants.get(tag);
        if (variant != null) {
            return Result.success(variant);
        }
        return discover(tag, Error.class).map(type -> {
            ErrorVariant<?> discovered = discoveredVariant(type.asSubclass(Error.class));
            ErrorVariant<?> raced = variants.putIfAbsent(tag, discovered);
            return raced != null ? raced : discovered;
        });
    }

    /**
     * Resolves a discriminator to the canonical instance of an error code.
     */
    Result<ErrorCode> resolveCode(String tag) {
        ErrorCode code = codes.get(tag);
        if (code != null) {
            return Result.success(code);
        }
        return discover(tag, ErrorCode.class)
                .bind(type -> singletonOf(type.asSubclass(ErrorCode.class)))
                .tap(found -> codes.putIfAbsent(tag, found))
                .map(found -> codes.get(tag));
    }

    private <E extends Error> ErrorVariant<E> discoveredVariant(Class<E> type) {
        return new ErrorVariant<>(type, new ConstructorProbe<>(type));
    }

    private Result<Class<?>> discover(String tag, Class<?> expected) {
        if (!settings.permits(tag)) {
            return Result.failure(Error.notFound(
                    "Unknown or invalid " + expected.getSimpleName() + " type: '" + tag + "'"));
        }
        Class<?> type;
        try {
            type = Class.forName(tag, false, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            return Result.failure(Error.notFound(
                    "Unknown or invalid " + expected.getSimpleName() + " type: '" + tag + "'"));
        }
        if (!expected.isAssignableFrom(type)) {
            return Result.failure(Error.validation(
                    "Type '" + tag + "' is not a subtype of " + expected.getName()));
        }
        log.debug("Discovered {} type {}", expected.getSimpleName(), tag);
        return Result.success(type);
    }

    private static Result<ErrorCode> singletonOf(Class<? extends ErrorCode> type) {
        try {
            for (Field field : type.getDeclaredFields()) {
                if (field.getName().equals(INSTANCE_FIELD) && Modifier.isStatic(field.getModifiers())) {
                    field.trySetAccessible();
                    return instanceValue(type, field.get(null), "field");
                }
            }
            for (Method method : type.getDeclaredMethods()) {
                if (method.getName().equals(INSTANCE_METHOD)
                        && method.getParameterCount() == 0
                        && Modifier.isStatic(method.getModifiers())) {
                    method.trySetAccessible();
                    return instanceValue(type, method.invoke(null), "method");
                }
            }
        } catch (ReflectiveOperationException | LinkageError e) {
            // a failing static initializer surfaces here as ExceptionInInitializerError
            return Result.failure(Error.configuration(
                    "Cannot read singleton instance of '" + type.getName() + "': " + e));
        }
        return Result.failure(Error.configuration(
                "ErrorCode type '" + type.getName() + "' does not have a static INSTANCE field or getInstance() method"));
    }

    private static Result<ErrorCode> instanceValue(Class<? extends ErrorCode> type, Object value, String accessor) {
        if (!type.isInstance(value)) {
            return Result.failure(Error.configuration(
                    "Failed to retrieve singleton instance from '" + type.getName() + "' " + accessor));
        }
        return Result.success((ErrorCode) value);
    }

    private void registerBuiltIns() {
        register(Error.class, fields -> new Error(fields.code(), fields.description()));
        register(ApiError.class, fields -> new ApiError(fields.description()));
        register(BusinessRuleViolationError.class, fields -> new BusinessRuleViolationError(fields.description()));
        register(ConfigurationError.class, fields -> new ConfigurationError(fields.description()));
        register(ConflictError.class, fields -> new ConflictError(fields.description()));
        register(NotFoundError.class, fields -> new NotFoundError(fields.description()));
        register(UnauthorizedError.class, fields -> new UnauthorizedError(fields.description()));
        register(UnhandledExceptionError.class, fields -> new UnhandledExceptionError(fields.description()));
        register(ValidationError.class, fields -> new ValidationError(fields.description()));

        registerCode(Result.NONE.getCode());
        registerCode(ApiError.CODE);
        registerCode(BusinessRuleViolationError.CODE);
        registerCode(ConfigurationError.CODE);
        registerCode(ConflictError.CODE);
        registerCode(NotFoundError.CODE);
        registerCode(UnauthorizedError.CODE);
        registerCode(UnhandledExceptionError.CODE);
        registerCode(ValidationError.CODE);
    }
}
