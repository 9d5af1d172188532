package org.javai.result.json;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.javai.result.ConflictError;
import org.javai.result.Error;
import org.junit.jupiter.api.Test;

class ConstructorProbeTest {

    private final ResultJson json = new ResultJson(ErrorTypeRegistry.withBuiltIns(CodecSettings.defaults()));

    public static final class RegionalError extends Error {
        private final String region;

        public RegionalError(String description, String region) {
            super(ConflictError.CODE, description);
            if (region.equals("nowhere")) {
                throw new IllegalArgumentException("unknown region");
            }
            this.region = region;
        }

        public RegionalError(String description) {
            super(ConflictError.CODE, description);
            this.region = "global";
        }

        public String getRegion() {
            return region;
        }
    }

    public static final class RetryLaterError extends Error {
        private final int attempts;

        public RetryLaterError(String description, @JsonProperty(defaultValue = "3") int attempts) {
            super(ConflictError.CODE, description);
            this.attempts = attempts;
        }

        public int getAttempts() {
            return attempts;
        }
    }

    public static final class RenamedFieldError extends Error {
        private final String orderId;

        public RenamedFieldError(String description, @JsonProperty("order") String orderId) {
            super(ConflictError.CODE, description);
            this.orderId = orderId;
        }

        @JsonProperty("order")
        public String getOrderId() {
            return orderId;
        }
    }

    public static final class SecretError extends Error {
        private final String secret;

        public SecretError(String description, String secret) {
            super(ConflictError.CODE, description);
            this.secret = secret;
        }

        public SecretError(String description) {
            this(description, "redacted");
        }

        @JsonIgnore
        public String getSecret() {
            return secret;
        }
    }

    public static final class NoPublicConstructorError extends Error {
        private NoPublicConstructorError(String description) {
            super(ConflictError.CODE, description);
        }

        static NoPublicConstructorError of(String description) {
            return new NoPublicConstructorError(description);
        }
    }

    private static String payload(Class<?> type, String fields) {
        return "{\"$type\":\"" + type.getName() + "\"," + fields + "}";
    }

    @Test
    void decode_allFieldsPresent_usesRichestConstructor() throws Exception {
        RegionalError decoded = json.decodeError(
                payload(RegionalError.class, "\"description\":\"d\",\"region\":\"eu\""), RegionalError.class);

        assertThat(decoded.getRegion()).isEqualTo("eu");
    }

    @Test
    void decode_fieldMissing_fallsBackToSmallerConstructor() throws Exception {
        RegionalError decoded = json.decodeError(
                payload(RegionalError.class, "\"description\":\"d\""), RegionalError.class);

        assertThat(decoded.getRegion()).isEqualTo("global");
    }

    @Test
    void decode_constructorThrows_fallsBackToNextCandidate() throws Exception {
        RegionalError decoded = json.decodeError(
                payload(RegionalError.class, "\"description\":\"d\",\"region\":\"nowhere\""), RegionalError.class);

        assertThat(decoded.getRegion()).isEqualTo("global");
    }

    @Test
    void decode_fieldOfWrongShape_fallsBackToNextCandidate() throws Exception {
        RegionalError decoded = json.decodeError(
                payload(RegionalError.class, "\"description\":\"d\",\"region\":{\"nested\":true}"), RegionalError.class);

        assertThat(decoded.getRegion()).isEqualTo("global");
    }

    @Test
    void decode_missingFieldWithDefaultValue_usesDefault() throws Exception {
        RetryLaterError decoded = json.decodeError(
                payload(RetryLaterError.class, "\"description\":\"later\""), RetryLaterError.class);

        assertThat(decoded.getAttempts()).isEqualTo(3);
    }

    @Test
    void decode_presentFieldWithDefaultValue_usesField() throws Exception {
        RetryLaterError decoded = json.decodeError(
                payload(RetryLaterError.class, "\"description\":\"later\",\"attempts\":7"), RetryLaterError.class);

        assertThat(decoded.getAttempts()).isEqualTo(7);
    }

    @Test
    void decode_jsonPropertyName_bindsRenamedField() throws Exception {
        RenamedFieldError error = new RenamedFieldError("d", "O-1");

        RenamedFieldError decoded = json.decodeError(json.encode(error), RenamedFieldError.class);

        assertThat(json.mapper().readTree(json.encode(error)).has("order")).isTrue();
        assertThat(decoded.getOrderId()).isEqualTo("O-1");
    }

    @Test
    void encode_jsonIgnoreProperty_isNotWritten() throws Exception {
        String encoded = json.encode(new SecretError("d", "s3cr3t"));

        assertThat(encoded).doesNotContain("s3cr3t");
        assertThat(json.decodeError(encoded, SecretError.class).getSecret()).isEqualTo("redacted");
    }

    @Test
    void decode_noPublicConstructor_fails() throws Exception {
        String encoded = json.encode(NoPublicConstructorError.of("d"));

        assertThatThrownBy(() -> json.decodeError(encoded))
                .isInstanceOf(ErrorDecodingException.class)
                .hasMessageContaining("has no public constructors");
    }

    @Test
    void decode_noCompatibleConstructor_fails() {
        assertThatThrownBy(() -> json.decodeError(payload(RegionalError.class, "\"region\":\"eu\"")))
                .isInstanceOf(ErrorDecodingException.class)
                .hasMessageContaining("Could not find a compatible constructor");
    }
}
