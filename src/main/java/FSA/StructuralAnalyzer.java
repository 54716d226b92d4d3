package FSA;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import FSA.Model.Automaton;
import FSA.Model.State;
import FSA.Model.Symbol;
import FSA.Model.Transition;
import FSA.Model.TransitionIndex;

/**
 * Determinism and completeness predicates, and the completion transform.
 */
public class StructuralAnalyzer {
    public static final String SINK_ID = "PUITS";
    public static final String SINK_LABEL = "Sink state";

    private StructuralAnalyzer() {}

    /**
     * Exactly one initial state, no empty-symbol transitions, and at most one destination per
     * (state, symbol) pair.
     */
    public static boolean isDeterministic(Automaton automaton) {
        if (automaton.getInitialStates().size() != 1) {
            return false;
        }
        for (Transition t : automaton.getTransitions()) {
            if (automaton.getSymbol(t.symbol()).isEmpty()) {
                return false;
            }
        }
        TransitionIndex index = automaton.transitionIndex();
        for (State s : automaton.getStates()) {
            for (Set<String> dests : index.outgoing(s.getId()).values()) {
                if (dests.size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Every state has an outgoing transition for every symbol of the alphabet.
     */
    public static boolean isComplete(Automaton automaton) {
        return isComplete(automaton, automaton.transitionIndex());
    }

    private static boolean isComplete(Automaton automaton, TransitionIndex index) {
        for (State s : automaton.getStates()) {
            for (Symbol symbol : automaton.getSymbols()) {
                if (!index.hasSuccessor(s.getId(), symbol.value())) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Completes the automaton in place: a fresh sink state receives every missing transition and loops on
     * every symbol. Does nothing when the automaton is already complete.
     * @param automaton - automaton to complete, mutated
     * @return the same automaton
     */
    public static Automaton complete(Automaton automaton) {
        TransitionIndex index = automaton.transitionIndex();
        if (isComplete(automaton, index)) {
            return automaton;
        }
        String sink = automaton.freshStateId(SINK_ID);
        // snapshot of the original states, the sink is handled by the self-loops below
        State[] original = automaton.getStates().toArray(new State[0]);
        automaton.addState(sink, SINK_LABEL, false, false);

        Map<String, Symbol> alphabet = distinctValues(automaton);
        for (State s : original) {
            for (Symbol symbol : alphabet.values()) {
                if (!index.hasSuccessor(s.getId(), symbol.value())) {
                    automaton.addTransition(s.getId(), sink, symbol.id());
                }
            }
        }
        for (Symbol symbol : alphabet.values()) {
            automaton.addTransition(sink, sink, symbol.id());
        }
        return automaton;
    }

    /**
     * @return the first symbol of each distinct value, in alphabet order
     */
    static Map<String, Symbol> distinctValues(Automaton automaton) {
        Map<String, Symbol> byValue = new LinkedHashMap<>();
        for (Symbol s : automaton.getSymbols()) {
            byValue.putIfAbsent(s.value(), s);
        }
        return byValue;
    }
}
