package org.javai.result.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import org.javai.result.Outcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OutcomeModuleTest {

	private final ObjectMapper mapper = new ObjectMapper().registerModule(new OutcomeModule());

	record User(String name, int age) {}

	record Envelope(String requestId, Outcome<User, String> result) {}

	@Test
	void success_writesOkAndValueOnly() throws Exception {
		JsonNode node = mapper.readTree(mapper.writeValueAsString(Outcome.success(42)));

		assertThat(node.get("ok").booleanValue()).isTrue();
		assertThat(node.get("value").intValue()).isEqualTo(42);
		assertThat(node.has("error")).isFalse();
	}

	@Test
	void failure_writesOkAndErrorOnly() throws Exception {
		JsonNode node = mapper.readTree(mapper.writeValueAsString(Outcome.failure("not found")));

		assertThat(node.get("ok").booleanValue()).isFalse();
		assertThat(node.get("error").textValue()).isEqualTo("not found");
		assertThat(node.has("value")).isFalse();
	}

	@Test
	void successWithNullValue_writesExplicitNull() throws Exception {
		assertThat(mapper.writeValueAsString(Outcome.success()))
				.isEqualTo("{\"ok\":true,\"value\":null}");
	}

	@Test
	void read_resolvesDeclaredTypes() throws Exception {
		Outcome<User, String> ok = mapper.readValue(
				"{\"ok\":true,\"value\":{\"name\":\"Alice\",\"age\":30}}",
				new TypeReference<Outcome<User, String>>() {});
		Outcome<User, String> failed = mapper.readValue(
				"{\"ok\":false,\"error\":\"expired\"}",
				new TypeReference<Outcome<User, String>>() {});

		assertThat(ok).isEqualTo(Outcome.success(new User("Alice", 30)));
		assertThat(failed).isEqualTo(Outcome.failure("expired"));
	}

	@Test
	void read_nestedInRecord() throws Exception {
		Envelope envelope = new Envelope("r-1", Outcome.success(new User("Bob", 41)));

		Envelope read = mapper.readValue(mapper.writeValueAsString(envelope), Envelope.class);

		assertThat(read).isEqualTo(envelope);
	}

	@Test
	void read_genericValueTypes() throws Exception {
		Outcome<List<Integer>, String> outcome = mapper.readValue(
				"{\"ok\":true,\"value\":[1,2,3]}",
				new TypeReference<Outcome<List<Integer>, String>>() {});

		assertThat(outcome.unwrap()).containsExactly(1, 2, 3);
	}

	@Test
	void read_rejectsMissingDiscriminator() {
		assertThatThrownBy(() -> mapper.readValue("{\"value\":1}",
				new TypeReference<Outcome<Integer, String>>() {}))
				.isInstanceOf(MismatchedInputException.class)
				.hasMessageContaining("ok");
	}

	@Test
	void read_explicitNullErrorIsFailure() throws Exception {
		Outcome<Integer, String> outcome = mapper.readValue("{\"ok\":false,\"error\":null}",
				new TypeReference<Outcome<Integer, String>>() {});

		assertThat(outcome).isEqualTo(Outcome.failure(null));
		assertThat(mapper.writeValueAsString(outcome)).isEqualTo("{\"ok\":false,\"error\":null}");
	}

	@Test
	void read_rejectsFailureWithoutError() {
		assertThatThrownBy(() -> mapper.readValue("{\"ok\":false}",
				new TypeReference<Outcome<Integer, String>>() {}))
				.isInstanceOf(MismatchedInputException.class)
				.hasMessageContaining("error");
	}
}
