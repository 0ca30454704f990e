package github.sarthakdev143.reel_factory.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs an attempt against an ordered list of candidates and stops at the first one that succeeds.
 * Every failed candidate is kept in the outcome so callers can log or test individual causes.
 */
public final class FirstSuccess {

    private FirstSuccess() {
    }

    @FunctionalInterface
    public interface Attempt<C, R> {

        R run(C candidate) throws Exception;
    }

    public record Failure<C>(C candidate, Exception error) {
    }

    public record Outcome<C, R>(C candidate, R value, List<Failure<C>> failures) {

        public Outcome {
            failures = List.copyOf(failures);
        }

        public boolean succeeded() {
            return candidate != null;
        }

        public Optional<R> result() {
            return succeeded() ? Optional.ofNullable(value) : Optional.empty();
        }

        public String describeFailures() {
            return failures.stream()
                    .map(failure -> failure.candidate() + ": " + failure.error().getMessage())
                    .collect(Collectors.joining("; "));
        }
    }

    public static <C, R> Outcome<C, R> tryInOrder(List<C> candidates, Attempt<C, R> attempt)
            throws InterruptedException {
        List<Failure<C>> failures = new ArrayList<>();
        for (C candidate : candidates) {
            try {
                R value = attempt.run(candidate);
                return new Outcome<>(candidate, value, failures);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                failures.add(new Failure<>(candidate, e));
            }
        }
        return new Outcome<>(null, null, failures);
    }
}
