package net.moznion.schedsync;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A value slot of a JSON-shaped record that tells apart a member which is not there at all
 * from a member which is there and explicitly {@code null}.
 * <p>
 * {@link Optional} cannot carry this difference, so payload members whose absent variant is
 * observable by consumers are read through this type.
 *
 * @param <T> type of the value
 */
public final class OptionalField<T> {
    private enum State {
        MISSING,
        NULL,
        PRESENT,
    }

    private static final OptionalField<?> MISSING = new OptionalField<>(State.MISSING, null);
    private static final OptionalField<?> NULL = new OptionalField<>(State.NULL, null);

    private final State state;
    private final T value;

    private OptionalField(final State state, final T value) {
        this.state = state;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> OptionalField<T> missing() {
        return (OptionalField<T>) MISSING;
    }

    @SuppressWarnings("unchecked")
    public static <T> OptionalField<T> explicitNull() {
        return (OptionalField<T>) NULL;
    }

    public static <T> OptionalField<T> of(final T value) {
        return new OptionalField<>(State.PRESENT, Objects.requireNonNull(value));
    }

    public static <T> OptionalField<T> ofNullable(final T value) {
        return value == null ? explicitNull() : of(value);
    }

    public boolean isMissing() {
        return state == State.MISSING;
    }

    public boolean isNull() {
        return state == State.NULL;
    }

    public boolean isPresent() {
        return state == State.PRESENT;
    }

    public T get() {
        if (state != State.PRESENT) {
            throw new NoSuchElementException("No value present [state=" + state + ']');
        }
        return value;
    }

    /**
     * Applies the mapper to a present value. Missing and explicit null are handed back as they
     * are, so the absent variant of the input survives the mapping.
     */
    public <U> OptionalField<U> map(final Function<? super T, ? extends U> mapper) {
        if (state != State.PRESENT) {
            @SuppressWarnings("unchecked")
            final OptionalField<U> self = (OptionalField<U>) this;
            return self;
        }
        return ofNullable(mapper.apply(value));
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OptionalField)) {
            return false;
        }
        final OptionalField<?> that = (OptionalField<?>) o;
        return state == that.state && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, value);
    }

    @Override
    public String toString() {
        switch (state) {
            case MISSING:
                return "OptionalField.missing";
            case NULL:
                return "OptionalField.null";
            default:
                return "OptionalField[" + value + ']';
        }
    }
}
