package com.cronq.internal;

import java.time.Duration;

/**
 * How an execution attempt ended.
 */
public sealed interface AttemptOutcome permits AttemptOutcome.Success, AttemptOutcome.Failure,
        AttemptOutcome.Timeout, AttemptOutcome.DeserializationError {

    static AttemptOutcome success() {
        return Success.INSTANCE;
    }

    static AttemptOutcome failure(Throwable error) {
        return new Failure(describe(error));
    }

    static AttemptOutcome timeout(Duration budget) {
        return new Timeout("execution expired after " + budget);
    }

    static AttemptOutcome deserializationError(PayloadDeserializationException error) {
        return new DeserializationError(describe(error));
    }

    /**
     * Text recorded as {@code last_error}, {@code null} for a success.
     */
    String errorMessage();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null ? error.getClass().getName() : error.getClass().getName() + ": " + message;
    }

    final class Success implements AttemptOutcome {

        private static final Success INSTANCE = new Success();

        private Success() {
        }

        @Override
        public String errorMessage() {
            return null;
        }

        @Override
        public String toString() {
            return "Success";
        }
    }

    record Failure(String errorMessage) implements AttemptOutcome {
    }

    record Timeout(String errorMessage) implements AttemptOutcome {
    }

    record DeserializationError(String errorMessage) implements AttemptOutcome {
    }
}
