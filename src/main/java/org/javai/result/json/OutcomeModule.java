package org.javai.result.json;

import com.fasterxml.jackson.databind.module.SimpleModule;
import org.javai.result.Outcome;

/**
 * Jackson module reading and writing {@link Outcome} in its discriminated wire shape:
 *
 * <pre>{@code
 * {"ok":true,"value":42}
 * {"ok":false,"error":"not found"}
 * }</pre>
 *
 * <p>A success never carries an {@code error} field and a failure never carries a
 * {@code value} field. When reading, the value and error types are taken from the declared
 * target type:
 *
 * <pre>{@code
 * ObjectMapper mapper = new ObjectMapper().registerModule(new OutcomeModule());
 * Outcome<User, String> user = mapper.readValue(json, new TypeReference<Outcome<User, String>>() {});
 * }</pre>
 */
public class OutcomeModule extends SimpleModule {

    static final String OK_FIELD = "ok";
    static final String VALUE_FIELD = "value";
    static final String ERROR_FIELD = "error";

    public OutcomeModule() {
        super("OutcomeModule");
        addSerializer(new OutcomeSerializer());
        addDeserializer(Outcome.class, new OutcomeDeserializer());
    }
}
