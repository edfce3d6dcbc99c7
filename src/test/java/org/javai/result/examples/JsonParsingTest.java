package org.javai.result.examples;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.result.Outcome;
import org.javai.result.boundary.Boundary;
import org.javai.result.combinator.Outcomes;
import org.javai.result.pipe.OutcomePipe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Demonstrates parsing JSON with ObjectMapper through outcomes.
 */
public class JsonParsingTest {

    record User(String name, int age) {}

    private Boundary<String> boundary;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        boundary = Boundary.of(
                (operation, e) -> e instanceof JsonProcessingException ? "malformed" : operation + " failed",
                (operation, e) -> {});
        objectMapper = new ObjectMapper();
    }

    @Test
    void validJson_parsesSuccessfully() {
        String json = """
            {"name": "Alice", "age": 30}
            """;

        Outcome<User, Exception> outcome = Outcome.perform(() -> objectMapper.readValue(json, User.class));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.unwrap()).isEqualTo(new User("Alice", 30));
    }

    @Test
    void invalidJson_returnsFailure() {
        Outcome<User, Exception> outcome = Outcome.perform(() -> objectMapper.readValue("not valid json", User.class));

        assertThat(outcome.isFailure()).isTrue();
        assertThat(outcome.<Exception>mapOrElse(u -> null, e -> e)).isInstanceOf(JsonProcessingException.class);
    }

    @Test
    void classifiedBoundary_turnsParseErrorsIntoTypedErrors() {
        Outcome<User, String> outcome = boundary.call("Json.parse",
                () -> objectMapper.readValue("{\"name\":", User.class));

        assertThat(outcome).isEqualTo(Outcome.failure("malformed"));
    }

    @Test
    void pipeline_validatesParsedUser() {
        Outcome<String, String> adult = OutcomePipe.pipe(
                parse("{\"name\": \"Alice\", \"age\": 30}"),
                this::requireAdult,
                user -> Outcome.success(user.name()));
        Outcome<String, String> minor = OutcomePipe.pipe(
                parse("{\"name\": \"Tim\", \"age\": 12}"),
                this::requireAdult,
                user -> Outcome.success(user.name()));

        assertThat(adult.unwrap()).isEqualTo("Alice");
        assertThat(Outcomes.<String, String>unwrapOr("anonymous").apply(minor)).isEqualTo("anonymous");
        assertThat(minor).isEqualTo(Outcome.failure("Tim is under age"));
    }

    private Outcome<User, String> parse(String json) {
        return boundary.call("Json.parse", () -> objectMapper.readValue(json, User.class));
    }

    private Outcome<User, String> requireAdult(User user) {
        return user.age() >= 18 ? Outcome.success(user) : Outcome.failure(user.name() + " is under age");
    }
}
