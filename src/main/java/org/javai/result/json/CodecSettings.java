package org.javai.result.json;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Settings for resolving {@code $type} discriminators that are not explicitly registered.
 *
 * <p>Configuration is read from system properties with environment variable fallbacks:
 * <ul>
 *   <li>{@code result.json.type-discovery} / {@code RESULT_JSON_TYPE_DISCOVERY} - load
 *       unregistered types by class name (default {@code true})</li>
 *   <li>{@code result.json.allowed-packages} / {@code RESULT_JSON_ALLOWED_PACKAGES} -
 *       comma-separated package prefixes discovered types must belong to (default: any)</li>
 * </ul>
 *
 * @param typeDiscovery whether unregistered {@code $type} names may be loaded by class name
 * @param allowedPackages package prefixes a discovered type must start with; empty means any
 */
public record CodecSettings(boolean typeDiscovery, List<String> allowedPackages) {

    public static final String TYPE_DISCOVERY_PROPERTY = "result.json.type-discovery";
    public static final String TYPE_DISCOVERY_ENV = "RESULT_JSON_TYPE_DISCOVERY";
    public static final String ALLOWED_PACKAGES_PROPERTY = "result.json.allowed-packages";
    public static final String ALLOWED_PACKAGES_ENV = "RESULT_JSON_ALLOWED_PACKAGES";

    public CodecSettings {
        allowedPackages = allowedPackages == null ? List.of() : List.copyOf(allowedPackages);
    }

    /**
     * Discovery on, no package restriction.
     */
    public static CodecSettings defaults() {
        return new CodecSettings(true, List.of());
    }

    /**
     * Only explicitly registered types are decoded.
     */
    public static CodecSettings registeredOnly() {
        return new CodecSettings(false, List.of());
    }

    /**
     * Resolves settings from system properties, falling back to environment variables
     * and then to {@link #defaults()}.
     */
    public static CodecSettings fromEnvironment() {
        String discovery = resolveConfig(TYPE_DISCOVERY_PROPERTY, TYPE_DISCOVERY_ENV);
        String packages = resolveConfig(ALLOWED_PACKAGES_PROPERTY, ALLOWED_PACKAGES_ENV);
        return new CodecSettings(
                discovery == null || Boolean.parseBoolean(discovery.trim()),
                packages == null ? List.of() : splitPackages(packages));
    }

    /**
     * Returns true if a type with this fully qualified name may be loaded by discovery.
     */
    public boolean permits(String className) {
        Objects.requireNonNull(className, "className must not be null");
        if (!typeDiscovery) {
            return false;
        }
        if (allowedPackages.isEmpty()) {
            return true;
        }
        return allowedPackages.stream().anyMatch(prefix -> className.startsWith(prefix + "."));
    }

    private static List<String> splitPackages(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String resolveConfig(String sysProp, String envVar) {
        String value = System.getProperty(sysProp);
        if (value == null || value.isBlank()) {
            value = System.getenv(envVar);
        }
        if (value == null || value.isBlank()) {
            return null;
        }
        return value;
    }
}
