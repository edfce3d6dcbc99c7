package org.javai.result;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class OptionTest {

    @Test
    void from_coalescesNullToNone() {
        Option<Integer> value = Option.from((Integer) null);

        assertThat(value).isSameAs(Option.none());
        assertThat(Option.from(null)).isSameAs(Option.none());
    }

    @Test
    void from_keepsFalsyValuesPresent() {
        assertThat(Option.from(0)).isEqualTo(Option.some(0));
        assertThat(Option.from(false)).isEqualTo(Option.some(false));
        assertThat(Option.from("")).isEqualTo(Option.some(""));
    }

    @Test
    void from_normalizesPresentNullOption() {
        assertThat(Option.from(Option.<String>some(null))).isSameAs(Option.none());
        assertThat(Option.from(Option.<String>none())).isSameAs(Option.none());
        assertThat(Option.from(Option.some("a"))).isEqualTo(Option.some("a"));
    }

    @Test
    void none_isSingleSentinel() {
        assertThat(Option.<String>none()).isSameAs(Option.<Integer>none());
        assertThat(Option.none()).hasToString("None");
    }

    @Test
    void isSome_trueForPresentValuesIncludingNull() {
        assertThat(Option.some(42).isSome()).isTrue();
        assertThat(Option.some(false).isSome()).isTrue();
        assertThat(Option.some(null).isSome()).isTrue();
        assertThat(Option.none().isSome()).isFalse();
    }

    @Test
    void isNone_trueOnlyForSentinel() {
        assertThat(Option.none().isNone()).isTrue();
        assertThat(Option.some(null).isNone()).isFalse();
        assertThat(Option.some("").isNone()).isFalse();
    }

    @Test
    void isNullish_matchesBothEmptyRepresentations() {
        assertThat(Option.none().isNullish()).isTrue();
        assertThat(Option.some(null).isNullish()).isTrue();
        assertThat(Option.some(0).isNullish()).isFalse();
    }

    @Test
    void unwrap_returnsPresentValue() {
        assertThat(Option.some(42).unwrap()).isEqualTo(42);
        assertThat(Option.some(null).unwrap()).isNull();
    }

    @Test
    void unwrap_throwsForNone() {
        Option<Integer> value = Option.none();

        assertThatThrownBy(value::unwrap)
                .isInstanceOf(OptionAbsentException.class)
                .isInstanceOf(UnwrapException.class)
                .hasMessageContaining("absent")
                .extracting(e -> ((UnwrapException) e).reason())
                .isEqualTo("Option is None");
    }

    @Test
    void unwrapOr_andUnwrapOrElse() {
        assertThat(Option.some(42).unwrapOr(0)).isEqualTo(42);
        assertThat(Option.<Integer>none().unwrapOr(0)).isEqualTo(0);
        assertThat(Option.some(42).unwrapOrElse(() -> 0)).isEqualTo(42);
        assertThat(Option.<Integer>none().unwrapOrElse(() -> 99)).isEqualTo(99);
    }

    @Test
    void map_transformsSomeAndSkipsNone() {
        AtomicInteger calls = new AtomicInteger();

        assertThat(Option.some(42).map(x -> x * 2)).isEqualTo(Option.some(84));
        assertThat(Option.<Integer>none().map(x -> calls.incrementAndGet())).isSameAs(Option.none());
        assertThat(calls).hasValue(0);
    }

    @Test
    void mapOr_defaultComesFirst() {
        assertThat(Option.some(42).mapOr(0, x -> x * 2)).isEqualTo(84);
        assertThat(Option.<Integer>none().mapOr(0, x -> x * 2)).isEqualTo(0);
    }

    @Test
    void mapOrElse_defaultComesLast() {
        assertThat(Option.some(42).mapOrElse(x -> 0, 84)).isEqualTo(0);
        assertThat(Option.<Integer>none().mapOrElse(x -> 0, 84)).isEqualTo(84);
    }

    @Test
    void flatMap_andFilter() {
        assertThat(Option.some("42").flatMap(s -> Option.some(s.length()))).isEqualTo(Option.some(2));
        assertThat(Option.some("42").flatMap(s -> Option.<Integer>none())).isSameAs(Option.none());
        assertThat(Option.some(4).filter(x -> x % 2 == 0)).isEqualTo(Option.some(4));
        assertThat(Option.some(3).filter(x -> x % 2 == 0)).isSameAs(Option.none());
        assertThat(Option.<Integer>none().filter(x -> true)).isSameAs(Option.none());
    }

    @Test
    void okOr_convertsToOutcome() {
        assertThat(Option.some(1).okOr("missing")).isEqualTo(Outcome.success(1));
        assertThat(Option.<Integer>none().okOr("missing")).isEqualTo(Outcome.failure("missing"));
    }

    @Test
    void jdkOptionalInterop() {
        assertThat(Option.some("a").toOptional()).contains("a");
        assertThat(Option.some(null).toOptional()).isEmpty();
        assertThat(Option.none().toOptional()).isEmpty();
        assertThat(Option.fromOptional(Optional.of("a"))).isEqualTo(Option.some("a"));
        assertThat(Option.fromOptional(Optional.empty())).isSameAs(Option.none());
    }
}
