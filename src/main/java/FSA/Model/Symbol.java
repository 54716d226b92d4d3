package FSA.Model;

import java.util.Objects;

/**
 * An alphabet element. Two symbols are equal when they display the same value, whatever their ids.
 */
public record Symbol(String id, String value) {
    /** Values that mark an empty (epsilon) transition. */
    public static final String EPSILON = "ε";

    public Symbol {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(value, "value");
    }

    public boolean isEmpty() {
        return value.isEmpty() || EPSILON.equals(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Symbol other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return id + "=" + value;
    }
}
