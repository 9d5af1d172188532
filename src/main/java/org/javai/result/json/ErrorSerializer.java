package org.javai.result.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.result.Error;

/**
 * Writes any error as {@code $type} followed by every readable property of its runtime
 * class.
 *
 * <p>Properties are found by Jackson's bean introspection of the concrete class, not of
 * {@link Error}, so getters added by a subtype are written without registering anything.
 * Properties annotated {@code @JsonIgnore} are skipped. Values go back through the
 * provider, which is how {@code code} ends up in the error code format.
 */
final class ErrorSerializer extends StdSerializer<Error> {

    private final Map<Class<?>, List<BeanPropertyDefinition>> properties = new ConcurrentHashMap<>();

    ErrorSerializer() {
        super(Error.class);
    }

    @Override
    public void serialize(Error value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject(value);
        gen.writeStringField(ErrorFields.TYPE_PROPERTY, value.getClass().getName());
        for (BeanPropertyDefinition property : propertiesOf(value.getClass(), provider.getConfig())) {
            provider.defaultSerializeField(property.getName(), property.getAccessor().getValue(value), gen);
        }
        gen.writeEndObject();
    }

    private List<BeanPropertyDefinition> propertiesOf(Class<?> type, SerializationConfig config) {
        return properties.computeIfAbsent(type, key -> introspect(key, config));
    }

    private static List<BeanPropertyDefinition> introspect(Class<?> type, SerializationConfig config) {
        BeanDescription description = config.introspect(config.constructType(type));
        List<BeanPropertyDefinition> readable = description.findProperties().stream()
                .filter(BeanPropertyDefinition::couldSerialize)
                .filter(property -> property.getAccessor() != null)
                .toList();
        if (config.canOverrideAccessModifiers()) {
            for (BeanPropertyDefinition property : readable) {
                AnnotatedMember accessor = property.getAccessor();
                accessor.fixAccess(config.isEnabled(MapperFeature.OVERRIDE_PUBLIC_ACCESS_MODIFIERS));
            }
        }
        return readable;
    }
}
