package FSA.Model;

import java.util.Locale;

/**
 * Single-tag role used at the boundaries (serialized documents, role updates).
 * Internally a {@link State} carries two independent facets instead.
 */
public enum StateRole {
    INITIAL, FINAL, NORMAL;

    public static StateRole parse(String role) {
        if (role == null) {
            throw new InvalidRoleException(null);
        }
        return switch (role.trim().toLowerCase(Locale.ROOT)) {
            case "initial" -> INITIAL;
            case "final" -> FINAL;
            case "normal" -> NORMAL;
            default -> throw new InvalidRoleException(role);
        };
    }

    /**
     * Collapses both facets into one tag. A state that is both initial and final reports {@link #INITIAL}.
     */
    public static StateRole of(State state) {
        if (state.isInitial()) {
            return INITIAL;
        }
        return state.isFinal() ? FINAL : NORMAL;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
