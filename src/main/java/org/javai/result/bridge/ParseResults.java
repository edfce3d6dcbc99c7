package org.javai.result.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Objects;
import org.javai.result.Outcome;

/**
 * Converts validator results into outcomes.
 *
 * <pre>{@code
 * Outcome<User, List<Violation>> user = ParseResults.toOutcome(validator.parse(input));
 * }</pre>
 */
public final class ParseResults {

    static final String SUCCESS_FIELD = "success";
    static final String DATA_FIELD = "data";
    static final String ERROR_FIELD = "error";

    private ParseResults() {
    }

    /**
     * Selects the data of a successful parse or the error of a failed one.
     *
     * @param parseResult the validator's result
     * @return Success with the data, or Failure with the error, which is passed through even when null
     */
    public static <T, E> Outcome<T, E> toOutcome(ParseResult<? extends T, ? extends E> parseResult) {
        Objects.requireNonNull(parseResult, "parseResult must not be null");
        if (parseResult.success()) {
            return Outcome.success(parseResult.data());
        }
        return Outcome.failure(parseResult.error());
    }

    /**
     * Reads a validator result that has already been serialized to JSON, such as
     * {@code {"success":true,"data":{"id":1}}} or {@code {"success":false,"error":"bad"}}.
     * A missing {@code data} field reads as JSON null.
     *
     * @param node the serialized result
     * @return Success with the {@code data} node, or Failure with the {@code error} node
     * @throws IllegalArgumentException if the node has no boolean {@code success} field,
     *         or a failed result has no {@code error} field
     */
    public static Outcome<JsonNode, JsonNode> fromJson(JsonNode node) {
        Objects.requireNonNull(node, "node must not be null");
        JsonNode flag = node.get(SUCCESS_FIELD);
        if (flag == null || !flag.isBoolean()) {
            throw new IllegalArgumentException("Expected a boolean '" + SUCCESS_FIELD + "' field in " + node);
        }
        if (flag.booleanValue()) {
            JsonNode data = node.get(DATA_FIELD);
            return Outcome.success(data == null ? NullNode.getInstance() : data);
        }
        JsonNode error = node.get(ERROR_FIELD);
        if (error == null) {
            throw new IllegalArgumentException("Failed result has no '" + ERROR_FIELD + "' field: " + node);
        }
        return Outcome.failure(error);
    }
}
