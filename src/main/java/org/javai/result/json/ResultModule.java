package org.javai.result.json;

import com.fasterxml.jackson.databind.module.SimpleModule;
import java.util.Objects;

/**
 * Jackson module for {@link org.javai.result.Result}, {@link org.javai.result.Error} and
 * {@link org.javai.result.ErrorCode}.
 *
 * <pre>{@code
 * ObjectMapper mapper = new ObjectMapper().registerModule(new ResultModule());
 * String json = mapper.writeValueAsString(Result.failure(Error.notFound("User 7 not found")));
 * Result<Integer> back = mapper.readValue(json, new TypeReference<Result<Integer>>() {});
 * }</pre>
 *
 * <p>Without arguments the module resolves types through {@link ErrorTypeRegistry#shared()}.
 */
public class ResultModule extends SimpleModule {

    private final ErrorTypeRegistry registry;

    public ResultModule() {
        this(ErrorTypeRegistry.shared());
    }

    public ResultModule(ErrorTypeRegistry registry) {
        super("ResultModule");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public ErrorTypeRegistry registry() {
        return registry;
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        context.addSerializers(new ResultSerializers());
        context.addDeserializers(new ResultDeserializers(registry));
    }
}
