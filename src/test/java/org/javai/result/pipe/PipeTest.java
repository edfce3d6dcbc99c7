package org.javai.result.pipe;

import org.javai.result.Option;
import org.javai.result.Outcome;
import org.javai.result.combinator.Outcomes;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

class PipeTest {

    @Test
    void pipe_threadsValueThroughStepsInOrder() {
        List<String> order = new ArrayList<>();

        String result = Pipe.pipe(3,
                (Integer x) -> {
                    order.add("first");
                    return x + 1;
                },
                (Integer x) -> {
                    order.add("second");
                    return x * 10;
                },
                (Integer x) -> {
                    order.add("third");
                    return "n=" + x;
                });

        assertThat(result).isEqualTo("n=40");
        assertThat(order).containsExactly("first", "second", "third");
    }

    @Test
    void pipe_withoutSteps_returnsValue() {
        Outcome<Integer, String> failed = Outcome.failure("e");

        assertThat(Pipe.pipe("same")).isEqualTo("same");
        assertThat(Pipe.pipe(failed)).isSameAs(failed);
    }

    @Test
    void pipe_acceptsEightTypedSteps() {
        Integer result = Pipe.pipe(0,
                (Integer x) -> x + 1,
                (Integer x) -> x + 1,
                (Integer x) -> x + 1,
                (Integer x) -> x + 1,
                (Integer x) -> x + 1,
                (Integer x) -> x + 1,
                (Integer x) -> x + 1,
                (Integer x) -> x + 1);

        assertThat(result).isEqualTo(8);
    }

    @Test
    void pipe_doesNotShortCircuitOnFailureOrNone() {
        AtomicInteger calls = new AtomicInteger();

        Outcome<Integer, String> outcome = Pipe.pipe(
                Outcome.<Integer, String>failure("error"),
                Outcomes.map((Integer x) -> x + 1),
                (Outcome<Integer, String> o) -> {
                    calls.incrementAndGet();
                    return o;
                });
        Option<Integer> option = Pipe.pipe(
                Option.<Integer>none(),
                (Option<Integer> o) -> {
                    calls.incrementAndGet();
                    return o;
                });

        assertThat(outcome).isEqualTo(Outcome.failure("error"));
        assertThat(option).isSameAs(Option.none());
        assertThat(calls).hasValue(2);
    }

    @Test
    void flow_isPipeWithoutInitialValue() {
        Function<String, Integer> parseAndDouble = Pipe.flow(
                (String s) -> s.trim(),
                (String s) -> Integer.parseInt(s),
                (Integer x) -> x * 2);

        assertThat(parseAndDouble.apply(" 21 ")).isEqualTo(42);
        assertThat(parseAndDouble.apply("5")).isEqualTo(Pipe.pipe("5", (String s) -> s.trim(), (String s) -> Integer.parseInt(s), (Integer x) -> x * 2));
    }

    @Test
    void pipeAll_handlesChainsLongerThanEight() {
        List<Function<Object, Object>> steps = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            steps.add(x -> (Integer) x + 1);
        }
        steps.add(x -> "total " + x);

        assertThat(Pipe.pipeAll(0, steps)).isEqualTo("total 12");
        assertThat(Pipe.pipeAll("unchanged", List.of())).isEqualTo("unchanged");
        assertThat(Pipe.flowAll(steps).apply(100)).isEqualTo("total 112");
    }

    @Test
    void pipeAll_failsAtRunTimeOnTypeMismatch() {
        List<Function<Object, Object>> steps = List.of(x -> (Integer) x + 1);

        assertThatThrownBy(() -> Pipe.pipeAll("not a number", steps))
                .isInstanceOf(ClassCastException.class);
    }

    @Test
    void pipeAsync_awaitsEachStepBeforeTheNext() {
        List<String> order = new ArrayList<>();

        CompletableFuture<String> result = Pipe.pipeAsync(1,
                (Integer x) -> CompletableFuture.supplyAsync(() -> {
                    order.add("first");
                    return x + 1;
                }),
                (Integer x) -> CompletableFuture.supplyAsync(() -> {
                    order.add("second");
                    return x * 10;
                }),
                (Integer x) -> CompletableFuture.completedFuture("n=" + x));

        assertThat(result.join()).isEqualTo("n=20");
        assertThat(order).containsExactly("first", "second");
    }

    @Test
    void pipeAsync_propagatesStepFailureAndSkipsRemainingSteps() {
        AtomicInteger calls = new AtomicInteger();
        IllegalStateException boom = new IllegalStateException("boom");

        CompletableFuture<Integer> result = Pipe.pipeAsync(1,
                (Integer x) -> CompletableFuture.<Integer>failedFuture(boom),
                (Integer x) -> {
                    calls.incrementAndGet();
                    return CompletableFuture.completedFuture(x);
                });

        assertThatThrownBy(result::join)
                .isInstanceOf(CompletionException.class)
                .hasCause(boom);
        assertThat(calls).hasValue(0);
    }

    @Test
    void pipeAsync_turnsSynchronousThrowIntoFailedFuture() {
        CompletableFuture<Integer> result = Pipe.pipeAsync(1,
                (Integer x) -> {
                    throw new IllegalArgumentException("rejected");
                });

        assertThat(result).isCompletedExceptionally();
    }

    @Test
    void flowAsync_andPipeAllAsync() {
        Function<Integer, CompletableFuture<String>> describe = Pipe.flowAsync(
                (Integer x) -> CompletableFuture.completedFuture(x * 2),
                (Integer x) -> CompletableFuture.completedFuture("value " + x));
        List<Function<Object, CompletionStage<?>>> steps = List.of(
                x -> CompletableFuture.completedFuture((Integer) x + 1),
                x -> CompletableFuture.supplyAsync(() -> "value " + x));

        assertThat(describe.apply(21).join()).isEqualTo("value 42");
        assertThat(Pipe.pipeAllAsync(41, steps).join()).isEqualTo("value 42");
        assertThat(Pipe.flowAllAsync(steps).apply(1).join()).isEqualTo("value 2");
    }
}
