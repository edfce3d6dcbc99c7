package org.javai.result.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import org.javai.result.Outcome;

/**
 * Reads the {@code ok}/{@code value}/{@code error} shape. The contextual instance knows the
 * declared value and error types; an uncontextualized one reads both as untyped values.
 */
final class OutcomeDeserializer extends StdDeserializer<Outcome<?, ?>> implements ContextualDeserializer {

    private final JavaType valueType;
    private final JavaType errorType;

    OutcomeDeserializer() {
        this(null, null);
    }

    private OutcomeDeserializer(JavaType valueType, JavaType errorType) {
        super(Outcome.class);
        this.valueType = valueType;
        this.errorType = errorType;
    }

    @Override
    public JsonDeserializer<?> createContextual(DeserializationContext ctxt, BeanProperty property) {
        JavaType type = ctxt.getContextualType();
        if (type == null && property != null) {
            type = property.getType();
        }
        if (type == null) {
            return this;
        }
        return new OutcomeDeserializer(type.containedTypeOrUnknown(0), type.containedTypeOrUnknown(1));
    }

    @Override
    public Outcome<?, ?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        JsonNode ok = node == null ? null : node.get(OutcomeModule.OK_FIELD);
        if (ok == null || !ok.isBoolean()) {
            return ctxt.reportInputMismatch(this, "Expected an object with a boolean '%s' field", OutcomeModule.OK_FIELD);
        }
        if (ok.booleanValue()) {
            return Outcome.success(read(ctxt, node.get(OutcomeModule.VALUE_FIELD), valueType));
        }
        JsonNode error = node.get(OutcomeModule.ERROR_FIELD);
        if (error == null) {
            return ctxt.reportInputMismatch(this, "A failed outcome requires an '%s' field", OutcomeModule.ERROR_FIELD);
        }
        return Outcome.failure(read(ctxt, error, errorType));
    }

    private static Object read(DeserializationContext ctxt, JsonNode field, JavaType type) throws IOException {
        if (field == null || field.isNull()) {
            return null;
        }
        JavaType target = type != null ? type : ctxt.constructType(Object.class);
        return ctxt.readTreeAsValue(field, target);
    }
}
