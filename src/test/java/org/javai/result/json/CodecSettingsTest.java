package org.javai.result.json;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CodecSettingsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(CodecSettings.TYPE_DISCOVERY_PROPERTY);
        System.clearProperty(CodecSettings.ALLOWED_PACKAGES_PROPERTY);
    }

    @Test
    void defaults_permitAnyType() {
        assertThat(CodecSettings.defaults().permits("com.example.MyError")).isTrue();
    }

    @Test
    void registeredOnly_permitsNothing() {
        assertThat(CodecSettings.registeredOnly().permits("com.example.MyError")).isFalse();
    }

    @Test
    void allowedPackages_matchWholePackagePrefix() {
        CodecSettings settings = new CodecSettings(true, List.of("com.example"));

        assertThat(settings.permits("com.example.MyError")).isTrue();
        assertThat(settings.permits("com.example.sub.MyError")).isTrue();
        assertThat(settings.permits("com.examples.MyError")).isFalse();
    }

    @Test
    void fromEnvironment_readsSystemProperties() {
        System.setProperty(CodecSettings.TYPE_DISCOVERY_PROPERTY, "false");
        System.setProperty(CodecSettings.ALLOWED_PACKAGES_PROPERTY, " com.a , ,com.b ");

        CodecSettings settings = CodecSettings.fromEnvironment();

        assertThat(settings.typeDiscovery()).isFalse();
        assertThat(settings.allowedPackages()).containsExactly("com.a", "com.b");
    }

    @Test
    void nullPackages_meanNoRestriction() {
        assertThat(new CodecSettings(true, null).allowedPackages()).isEmpty();
    }
}
