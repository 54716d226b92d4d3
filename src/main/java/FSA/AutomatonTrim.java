package FSA;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

import FSA.Model.Automaton;
import FSA.Model.State;
import FSA.Model.Symbol;
import FSA.Model.Transition;
import FSA.Model.TransitionIndex;

public class AutomatonTrim {
    public static final String SUFFIX = "_trim";

    private AutomatonTrim() {}

    /**
     * @return ids of the states reachable from any initial state, in discovery order
     */
    public static Set<String> accessibleStates(Automaton automaton) {
        final TransitionIndex index = automaton.transitionIndex();
        final Set<String> visited = new LinkedHashSet<>();
        final Deque<String> stack = new ArrayDeque<>();
        for (State s : automaton.getInitialStates()) {
            stack.push(s.getId());
        }
        while (!stack.isEmpty()) {
            String curr = stack.pop();
            if (!visited.add(curr)) {
                continue;
            }
            for (Set<String> dests : index.outgoing(curr).values()) {
                for (String d : dests) {
                    if (!visited.contains(d)) {
                        stack.push(d);
                    }
                }
            }
        }
        return visited;
    }

    /**
     * Copy of the automaton restricted to its accessible states. State, symbol and transition ids are kept.
     */
    public static Automaton trim(Automaton automaton) {
        final Set<String> accessible = accessibleStates(automaton);
        final Automaton out = new Automaton(automaton.getName() + SUFFIX);
        for (Symbol s : automaton.getSymbols()) {
            out.addSymbol(s);
        }
        for (State s : automaton.getStates()) {
            if (accessible.contains(s.getId())) {
                out.addState(s.getId(), s.getLabel(), s.isInitial(), s.isFinal());
            }
        }
        for (Transition t : automaton.getTransitions()) {
            if (accessible.contains(t.source())) {
                // destinations of accessible states are accessible too
                out.addTransition(t);
            }
        }
        return out;
    }

    /**
     * @return number of states that {@link #trim} would drop
     */
    public static int countInaccessible(Automaton automaton) {
        return automaton.size() - accessibleStates(automaton).size();
    }
}
