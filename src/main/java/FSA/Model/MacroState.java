package FSA.Model;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A set of source-automaton state ids used as one state during subset construction.
 * The empty set is a distinguished value, {@link #EMPTY}, with a reserved name that no member set can produce.
 */
public final class MacroState {
    public static final String EMPTY_NAME = "∅";
    public static final MacroState EMPTY = new MacroState(new TreeSet<>());

    private final SortedSet<String> members;

    private MacroState(SortedSet<String> members) {
        this.members = Collections.unmodifiableSortedSet(members);
    }

    public static MacroState of(Collection<String> ids) {
        return ids.isEmpty() ? EMPTY : new MacroState(new TreeSet<>(ids));
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public SortedSet<String> members() {
        return members;
    }

    /**
     * @return {@code {id1,id2,...}} over the sorted members, or {@link #EMPTY_NAME}
     */
    public String name() {
        return isEmpty() ? EMPTY_NAME : "{" + String.join(",", members) + "}";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MacroState other && members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return name();
    }
}
