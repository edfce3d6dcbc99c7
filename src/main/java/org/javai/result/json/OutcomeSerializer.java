package org.javai.result.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import org.javai.result.Outcome;

final class OutcomeSerializer extends StdSerializer<Outcome<?, ?>> {

    OutcomeSerializer() {
        super(Outcome.class, false);
    }

    @Override
    public void serialize(Outcome<?, ?> outcome, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        if (outcome instanceof Outcome.Success<?, ?> success) {
            gen.writeBooleanField(OutcomeModule.OK_FIELD, true);
            provider.defaultSerializeField(OutcomeModule.VALUE_FIELD, success.value(), gen);
        } else {
            Outcome.Failure<?, ?> failure = (Outcome.Failure<?, ?>) outcome;
            gen.writeBooleanField(OutcomeModule.OK_FIELD, false);
            provider.defaultSerializeField(OutcomeModule.ERROR_FIELD, failure.error(), gen);
        }
        gen.writeEndObject();
    }
}
