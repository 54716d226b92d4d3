package FSA.Model;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Snapshot of an automaton's transition relation keyed by (source state id, symbol value).
 * Destinations keep the insertion order of the transitions. Not updated by later mutations.
 */
public final class TransitionIndex {
    private final Map<String, Map<String, Set<String>>> successors = new HashMap<>();

    TransitionIndex(Automaton automaton) {
        for (Transition t : automaton.getTransitions()) {
            String value = automaton.getSymbol(t.symbol()).value();
            successors.computeIfAbsent(t.source(), k -> new HashMap<>())
                      .computeIfAbsent(value, k -> new LinkedHashSet<>())
                      .add(t.destination());
        }
    }

    /**
     * @return destinations reachable from {@code state} on {@code value}, empty if none
     */
    public Set<String> successors(String state, String value) {
        Map<String, Set<String>> bySymbol = successors.get(state);
        if (bySymbol == null) {
            return Collections.emptySet();
        }
        Set<String> dests = bySymbol.get(value);
        return dests == null ? Collections.emptySet() : Collections.unmodifiableSet(dests);
    }

    /**
     * @return the first destination on {@code value}, or null when the transition is undefined
     */
    public String successor(String state, String value) {
        Set<String> dests = successors(state, value);
        return dests.isEmpty() ? null : dests.iterator().next();
    }

    public boolean hasSuccessor(String state, String value) {
        return !successors(state, value).isEmpty();
    }

    /**
     * @return outgoing destinations grouped by symbol value
     */
    public Map<String, Set<String>> outgoing(String state) {
        Map<String, Set<String>> bySymbol = successors.get(state);
        return bySymbol == null ? Collections.emptyMap() : Collections.unmodifiableMap(bySymbol);
    }
}
