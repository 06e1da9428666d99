package com.afttsync.domain.model;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * An extracted attribute value that is either present or absent.
 *
 * <p>Blank text never becomes a present value: {@link #ofText(String)} maps it to absent,
 * so downstream code can tell "not observed" from a real value without string heuristics.
 */
public final class Field<T> {

    private static final Field<?> ABSENT = new Field<>(null);

    private final T value;

    private Field(T value) {
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> Field<T> absent() {
        return (Field<T>) ABSENT;
    }

    /**
     * Wraps a value; {@code null} becomes absent.
     */
    public static <T> Field<T> of(T value) {
        return value == null ? absent() : new Field<>(value);
    }

    /**
     * Wraps trimmed text; {@code null} and blank text become absent.
     */
    public static Field<String> ofText(String text) {
        if (text == null) {
            return absent();
        }
        String trimmed = text.replace('\u00a0', ' ').trim();
        return trimmed.isEmpty() ? absent() : new Field<>(trimmed);
    }

    public boolean isPresent() {
        return value != null;
    }

    public boolean isAbsent() {
        return value == null;
    }

    public T get() {
        if (value == null) {
            throw new NoSuchElementException("Field is absent");
        }
        return value;
    }

    public T orElse(T fallback) {
        return value != null ? value : fallback;
    }

    public <R> Field<R> map(Function<? super T, ? extends R> mapper) {
        return value == null ? absent() : Field.of(mapper.apply(value));
    }

    /**
     * Returns this field when present, otherwise the other one.
     */
    public Field<T> or(Field<T> other) {
        return value != null ? this : other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Field<?> other)) {
            return false;
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "absent" : "present(" + value + ")";
    }
}
