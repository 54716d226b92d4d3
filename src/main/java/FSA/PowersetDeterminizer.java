package FSA;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSA.Model.Automaton;
import FSA.Model.DeterminizeRecord;
import FSA.Model.MacroState;
import FSA.Model.State;
import FSA.Model.Symbol;
import FSA.Model.TransitionIndex;

/**
 * Subset construction. The output is deterministic and complete: a successor set that is empty leads to
 * the shared {@link MacroState#EMPTY} sink instead of being left undefined.
 * <p>
 * Transitions on an empty symbol ({@link Symbol#isEmpty()}) are followed through epsilon-closure and do not
 * appear in the output, whose alphabet holds only the non-empty symbols.
 */
public class PowersetDeterminizer {
    public static boolean DEBUG = false;
    public static final String SUFFIX = "_AFD";
    private static final long STATES_EXPLORED_PERIOD = 1000L;

    private PowersetDeterminizer() {}

    /**
     * Determinize with a FIFO worklist, so state creation order (and thus naming) is reproducible.
     * @param nfa - source automaton, not modified
     * @return - a fresh deterministic, complete automaton accepting the same language
     */
    public static Automaton determinize(Automaton nfa) {
        final Automaton out = new Automaton(nfa.getName() + SUFFIX);
        final List<String> emptyValues = new ArrayList<>(2);
        for (Symbol s : nfa.getSymbols()) {
            if (s.isEmpty()) {
                if (!emptyValues.contains(s.value())) {
                    emptyValues.add(s.value());
                }
            } else {
                out.addSymbol(s);
            }
        }
        final Map<String, Symbol> alphabet = StructuralAnalyzer.distinctValues(out);
        final TransitionIndex index = nfa.transitionIndex();
        final Set<String> finals = new LinkedHashSet<>();
        for (State s : nfa.getFinalStates()) {
            finals.add(s.getId());
        }

        Map<MacroState, String> outStateMap = new HashMap<>();
        Deque<DeterminizeRecord> queue = new ArrayDeque<>();

        Set<String> initIds = new LinkedHashSet<>();
        for (State s : nfa.getInitialStates()) {
            initIds.add(s.getId());
        }
        MacroState init = MacroState.of(closure(initIds, index, emptyValues));
        String initOut = addMacroState(out, init, true, finals);
        outStateMap.put(init, initOut);
        if (!init.isEmpty()) {
            queue.offer(new DeterminizeRecord(init, initOut));
        }

        long statesExplored = 0;
        while (!queue.isEmpty()) {
            DeterminizeRecord curr = queue.poll();
            MacroState inState = curr.inputState();

            for (Symbol sym : alphabet.values()) {
                Set<String> succIds = new LinkedHashSet<>();
                for (String member : inState.members()) {
                    succIds.addAll(index.successors(member, sym.value()));
                }
                MacroState succ = MacroState.of(closure(succIds, index, emptyValues));
                String outSucc = outStateMap.get(succ);
                if (outSucc == null) {
                    // add new state to DFA; the empty macro-state is terminal and never explored
                    outSucc = addMacroState(out, succ, false, finals);
                    outStateMap.put(succ, outSucc);
                    if (!succ.isEmpty()) {
                        queue.offer(new DeterminizeRecord(succ, outSucc));
                    }
                }
                out.addTransition(curr.outputState(), outSucc, sym.id());
            }
            statesExplored++;
            if (DEBUG && statesExplored % STATES_EXPLORED_PERIOD == 0) {
                System.out.println("DEBUG: Explored " + statesExplored + " macro-states - "
                    + queue.size() + " left in queue - " + out.size() + " states added");
            }
        }

        String empty = outStateMap.get(MacroState.EMPTY);
        if (empty != null) {
            for (Symbol sym : alphabet.values()) {
                out.addTransition(empty, empty, sym.id());
            }
        }
        if (DEBUG) {
            System.out.println("DEBUG: Determinized " + nfa.size() + " states into " + out.size());
        }
        return out;
    }

    private static String addMacroState(Automaton out, MacroState macro, boolean initial, Set<String> finals) {
        boolean accepting = false;
        for (String member : macro.members()) {
            if (finals.contains(member)) {
                accepting = true;
                break;
            }
        }
        // member ids may contain ',' or braces, so two member sets can share a name
        String name = macro.name();
        String id = out.freshStateId(name);
        out.addState(id, name, initial, accepting);
        return id;
    }

    /**
     * @return {@code ids} plus every state reachable from them through empty-symbol transitions
     */
    private static Set<String> closure(Set<String> ids, TransitionIndex index, List<String> emptyValues) {
        if (emptyValues.isEmpty()) {
            return ids;
        }
        final Set<String> closed = new LinkedHashSet<>(ids);
        final Deque<String> stack = new ArrayDeque<>(ids);
        while (!stack.isEmpty()) {
            String curr = stack.pop();
            for (String value : emptyValues) {
                for (String d : index.successors(curr, value)) {
                    if (closed.add(d)) {
                        stack.push(d);
                    }
                }
            }
        }
        return closed;
    }
}
