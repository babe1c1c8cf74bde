package com.github.anirbanmu.classcal.calendar.google;

import com.github.anirbanmu.classcal.calendar.CalendarSinkException;

public sealed interface CalendarResult<T> {
    record Success<T>(T value) implements CalendarResult<T> {
    }

    record Failure<T>(String message, int statusCode, Throwable exception) implements CalendarResult<T> {
        public Failure(String message) {
            this(message, -1, null);
        }

        public Failure(String message, Throwable exception) {
            this(message, -1, exception);
        }

        public Failure(String message, int statusCode) {
            this(message, statusCode, null);
        }

        <U> Failure<U> cast() {
            return new Failure<>(message, statusCode, exception);
        }
    }

    default T orThrow() {
        if (this instanceof Failure<T> f) {
            throw new CalendarSinkException(f.message(), f.statusCode(), f.exception());
        }
        return ((Success<T>) this).value();
    }
}
