package io.detabase.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Marker values for partial updates. Any other value in an update mapping is a plain replacement.
 *
 * <pre>{@code
 * client.update("user-1", Map.of(
 *         "name", "Ada",
 *         "logins", UpdateOperation.increment(),
 *         "tags", UpdateOperation.append("admin"),
 *         "tmp", UpdateOperation.trim()));
 * }</pre>
 */
public sealed interface UpdateOperation
        permits UpdateOperation.Trim, UpdateOperation.Increment, UpdateOperation.Append, UpdateOperation.Prepend {

    enum Kind { TRIM, INCREMENT, APPEND, PREPEND }

    Kind kind();

    /**
     * Removes the attribute.
     */
    record Trim() implements UpdateOperation {
        @Override
        public Kind kind() {
            return Kind.TRIM;
        }
    }

    /**
     * Adds {@code delta} to a numeric attribute.
     *
     * @param delta the amount to add, may be negative
     */
    record Increment(Number delta) implements UpdateOperation {
        public Increment {
            Objects.requireNonNull(delta, "delta");
        }

        @Override
        public Kind kind() {
            return Kind.INCREMENT;
        }
    }

    /**
     * Appends values to a list attribute.
     *
     * @param values the values to append
     */
    record Append(List<Object> values) implements UpdateOperation {
        public Append {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public Kind kind() {
            return Kind.APPEND;
        }
    }

    /**
     * Prepends values to a list attribute.
     *
     * @param values the values to prepend
     */
    record Prepend(List<Object> values) implements UpdateOperation {
        public Prepend {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public Kind kind() {
            return Kind.PREPEND;
        }
    }

    static UpdateOperation trim() {
        return new Trim();
    }

    static UpdateOperation increment() {
        return new Increment(1);
    }

    static UpdateOperation increment(Number delta) {
        return new Increment(delta);
    }

    /**
     * A {@link List} is appended element by element; any other value is appended as one element.
     */
    static UpdateOperation append(Object value) {
        return new Append(asList(value));
    }

    /**
     * A {@link List} is prepended element by element; any other value is prepended as one element.
     */
    static UpdateOperation prepend(Object value) {
        return new Prepend(asList(value));
    }

    private static List<Object> asList(Object value) {
        if (value instanceof List) {
            return new ArrayList<>((List<?>) value);
        }
        List<Object> single = new ArrayList<>(1);
        single.add(value);
        return single;
    }
}
