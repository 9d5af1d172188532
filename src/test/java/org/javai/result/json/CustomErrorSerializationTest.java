package org.javai.result.json;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Optional;
import org.javai.result.Error;
import org.javai.result.ErrorCode;
import org.javai.result.Result;
import org.junit.jupiter.api.Test;

class CustomErrorSerializationTest {

    @Test
    void discovered_customError_roundTripsWithExtraField() throws Exception {
        ResultJson json = new ResultJson(ErrorTypeRegistry.withBuiltIns(CodecSettings.defaults()));
        CustomerNotFoundError error = new CustomerNotFoundError("Customer C-17 not found", "C-17");

        String encoded = json.encode(Result.<String>failure(error));
        Result<String> decoded = json.decodeResult(encoded, String.class);

        assertThat(decoded.error()).isInstanceOf(CustomerNotFoundError.class);
        CustomerNotFoundError restored = (CustomerNotFoundError) decoded.error();
        assertThat(restored.getCustomerId()).isEqualTo("C-17");
        assertThat(restored.getDescription()).isEqualTo("Customer C-17 not found");
        assertThat(restored.getCode()).isSameAs(CustomerNotFoundError.Code.INSTANCE);
        assertThat(restored).isEqualTo(error);
        assertThat(restored).hasSameHashCodeAs(error);
    }

    @Test
    void equals_customErrorsWithDifferentExtraField_areNotEqual() {
        assertThat(new CustomerNotFoundError("gone", "C-1")).isNotEqualTo(new CustomerNotFoundError("gone", "C-2"));
        assertThat(new CustomerNotFoundError("gone", "C-1")).isEqualTo(new CustomerNotFoundError("gone", "C-1"));
    }

    @Test
    void resultJson_mapperAlreadyCarryingModule_isRejected() {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new ResultModule(ErrorTypeRegistry.withBuiltIns(CodecSettings.defaults())));

        assertThatThrownBy(() -> new ResultJson(mapper, ErrorTypeRegistry.withBuiltIns(CodecSettings.registeredOnly())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ResultModule");
    }

    @Test
    void resultJson_callerMapper_usesGivenRegistry() throws Exception {
        ResultJson strict = new ResultJson(new ObjectMapper(), ErrorTypeRegistry.withBuiltIns(CodecSettings.registeredOnly()));
        String encoded = strict.encode(new CustomerNotFoundError("gone", "C-1"));

        assertThatThrownBy(() -> strict.decodeError(encoded))
                .isInstanceOf(ErrorDecodingException.class)
                .hasMessageContaining("Unknown or invalid");
    }

    @Test
    void encode_customError_writesSubtypeProperties() throws Exception {
        ResultJson json = new ResultJson(ErrorTypeRegistry.withBuiltIns(CodecSettings.defaults()));

        JsonNode node = json.mapper().readTree(json.encode(new CustomerNotFoundError("gone", "C-1")));

        assertThat(node.get("$type").asText()).isEqualTo(CustomerNotFoundError.class.getName());
        assertThat(node.get("customerId").asText()).isEqualTo("C-1");
        assertThat(node.get("code").get("$type").asText()).isEqualTo(CustomerNotFoundError.Code.class.getName());
    }

    @Test
    void decode_customCode_resolvesToSingleton() throws Exception {
        ResultJson json = new ResultJson(ErrorTypeRegistry.withBuiltIns(CodecSettings.defaults()));

        assertThat(json.decodeErrorCode(json.encode(CustomerNotFoundError.Code.INSTANCE)))
                .isSameAs(CustomerNotFoundError.Code.INSTANCE);
        assertThat(json.decodeErrorCode(json.encode(PaymentDeclinedError.Code.getInstance())))
                .isSameAs(PaymentDeclinedError.Code.getInstance());
    }

    @Test
    void decode_richestConstructorWins() throws Exception {
        ResultJson json = new ResultJson(ErrorTypeRegistry.withBuiltIns(CodecSettings.defaults()));
        PaymentDeclinedError error = new PaymentDeclinedError("declined", "insufficient funds", Optional.of("acme"));

        PaymentDeclinedError decoded = json.decodeError(json.encode(error), PaymentDeclinedError.class);

        assertThat(decoded.getDeclineReason()).isEqualTo("insufficient funds");
        assertThat(decoded.getProcessor()).contains("acme");
    }

    @Test
    void decode_missingOptionalField_bindsEmpty() throws Exception {
        ResultJson json = new ResultJson(ErrorTypeRegistry.withBuiltIns(CodecSettings.defaults()));
        String payload = "{\"$type\":\"" + PaymentDeclinedError.class.getName() + "\","
                + "\"description\":\"declined\",\"declineReason\":\"expired card\"}";

        PaymentDeclinedError decoded = json.decodeError(payload, PaymentDeclinedError.class);

        assertThat(decoded.getDeclineReason()).isEqualTo("expired card");
        assertThat(decoded.getProcessor()).isEmpty();
    }

    @Test
    void decode_fieldNamesIgnoreCase() throws Exception {
        ResultJson json = new ResultJson(ErrorTypeRegistry.withBuiltIns(CodecSettings.defaults()));
        String payload = "{\"$type\":\"" + CustomerNotFoundError.class.getName() + "\","
                + "\"Description\":\"gone\",\"CUSTOMERID\":\"C-9\"}";

        CustomerNotFoundError decoded = json.decodeError(payload, CustomerNotFoundError.class);

        assertThat(decoded.getCustomerId()).isEqualTo("C-9");
        assertThat(decoded.getDescription()).isEqualTo("gone");
    }

    @Test
    void registeredOnly_unregisteredCustomError_fails() throws Exception {
        ResultJson discovering = new ResultJson(ErrorTypeRegistry.withBuiltIns(CodecSettings.defaults()));
        ResultJson strict = new ResultJson(ErrorTypeRegistry.withBuiltIns(CodecSettings.registeredOnly()));
        String encoded = discovering.encode(new CustomerNotFoundError("gone", "C-1"));

        assertThatThrownBy(() -> strict.decodeError(encoded))
                .isInstanceOf(ErrorDecodingException.class)
                .hasMessageContaining("Unknown or invalid");
    }

    @Test
    void registeredOnly_explicitRegistration_decodes() throws Exception {
        ErrorTypeRegistry registry = ErrorTypeRegistry.withBuiltIns(CodecSettings.registeredOnly())
                .register(CustomerNotFoundError.class)
                .registerCode(CustomerNotFoundError.Code.INSTANCE);
        ResultJson json = new ResultJson(registry);

        Error decoded = json.decodeError(json.encode(new CustomerNotFoundError("gone", "C-1")));

        assertThat(decoded).isInstanceOf(CustomerNotFoundError.class);
    }

    @Test
    void register_customDecoder_isUsed() throws Exception {
        ErrorTypeRegistry registry = ErrorTypeRegistry.withBuiltIns(CodecSettings.registeredOnly())
                .register(CustomerNotFoundError.class, fields -> new CustomerNotFoundError(
                        fields.description(),
                        fields.find("customerId", String.class).orElse("anonymous")))
                .registerCode(CustomerNotFoundError.Code.INSTANCE);
        ResultJson json = new ResultJson(registry);
        String payload = "{\"$type\":\"" + CustomerNotFoundError.class.getName() + "\",\"description\":\"gone\"}";

        CustomerNotFoundError decoded = json.decodeError(payload, CustomerNotFoundError.class);

        assertThat(decoded.getCustomerId()).isEqualTo("anonymous");
    }

    @Test
    void allowedPackages_rejectsTypesOutsideThem() throws Exception {
        ResultJson json = new ResultJson(ErrorTypeRegistry.withBuiltIns(
                new CodecSettings(true, List.of("com.example.errors"))));
        String encoded = json.encode(new CustomerNotFoundError("gone", "C-1"));

        assertThatThrownBy(() -> json.decodeError(encoded))
                .isInstanceOf(ErrorDecodingException.class);
    }

    @Test
    void register_sameTypeTwice_isAccepted() {
        ErrorTypeRegistry registry = ErrorTypeRegistry.withBuiltIns(CodecSettings.defaults());

        assertThat(registry.register(CustomerNotFoundError.class)).isSameAs(registry);
        assertThat(registry.register(CustomerNotFoundError.class)).isSameAs(registry);
    }

    static final class LocalCode extends ErrorCode {
        LocalCode() {
            super("Local");
        }
    }

    @Test
    void registerCode_secondInstanceOfSameCode_isRejected() {
        ErrorTypeRegistry registry = ErrorTypeRegistry.withBuiltIns(CodecSettings.defaults());
        LocalCode first = new LocalCode();
        registry.registerCode(first);

        assertThat(registry.registerCode(first)).isSameAs(registry);
        assertThatThrownBy(() -> registry.registerCode(new LocalCode()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already bound");
    }
}
