package FSA;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSA.Model.Automaton;
import FSA.Model.MacroState;
import FSA.Model.PreconditionFailedException;
import FSA.Model.State;
import FSA.Model.Symbol;
import FSA.Model.TransitionIndex;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * DFA minimization: reachability pruning followed by Moore-style partition refinement and a quotient
 * construction.
 * <p>
 * Precondition: the input is deterministic (checked) and complete (assumed). An undefined transition
 * contributes {@code -1} to a signature and produces no transition in the quotient.
 */
public class PartitionMinimizer {
    public static boolean DEBUG = false;
    public static final String SUFFIX = "_min";
    public static final String BLOCK_PREFIX = "B";
    static final int UNDEFINED = -1;

    private PartitionMinimizer() {}

    public static Automaton minimize(Automaton dfa) {
        checkDeterministic(dfa);
        final TransitionIndex index = dfa.transitionIndex();
        final List<List<String>> partition = refine(dfa, AutomatonTrim.accessibleStates(dfa), index);
        final Object2IntMap<String> blockOf = blockIndex(partition);

        final Automaton out = new Automaton(dfa.getName() + SUFFIX);
        for (Symbol s : dfa.getSymbols()) {
            out.addSymbol(s);
        }
        for (int i = 0; i < partition.size(); i++) {
            boolean initial = false;
            boolean accepting = false;
            for (String member : partition.get(i)) {
                State s = dfa.getState(member);
                initial |= s.isInitial();
                accepting |= s.isFinal();
            }
            out.addState(BLOCK_PREFIX + i, MacroState.of(partition.get(i)).name(), initial, accepting);
        }

        final Map<String, Symbol> alphabet = StructuralAnalyzer.distinctValues(dfa);
        for (int i = 0; i < partition.size(); i++) {
            // all members agree on target blocks, any representative will do
            String representative = partition.get(i).get(0);
            for (Symbol sym : alphabet.values()) {
                String dest = index.successor(representative, sym.value());
                if (dest != null) {
                    out.addTransition(BLOCK_PREFIX + i, BLOCK_PREFIX + blockOf.getInt(dest), sym.id());
                }
            }
        }
        return out;
    }

    /**
     * True iff minimizing does not reduce the number of states.
     */
    public static boolean isMinimal(Automaton dfa) {
        return minimize(dfa).size() == dfa.size();
    }

    /**
     * @return the coarsest stable partition of the reachable states, blocks in creation order
     */
    public static List<List<String>> refine(Automaton dfa) {
        checkDeterministic(dfa);
        return refine(dfa, AutomatonTrim.accessibleStates(dfa), dfa.transitionIndex());
    }

    /**
     * Per-state signatures with respect to the given partition: for each symbol value in sorted order, the
     * index of the block holding the successor, or {@code -1}.
     */
    public static Map<String, IntList> signatures(Automaton dfa, List<List<String>> partition) {
        final TransitionIndex index = dfa.transitionIndex();
        final Object2IntMap<String> blockOf = blockIndex(partition);
        final List<String> values = dfa.symbolValues();
        final Map<String, IntList> result = new LinkedHashMap<>();
        for (List<String> block : partition) {
            for (String state : block) {
                result.put(state, signature(state, values, index, blockOf));
            }
        }
        return result;
    }

    private static List<List<String>> refine(Automaton dfa, Set<String> reachable, TransitionIndex index) {
        final List<String> values = dfa.symbolValues();
        final List<String> finals = new ArrayList<>();
        final List<String> others = new ArrayList<>();
        for (State s : dfa.getStates()) {
            if (reachable.contains(s.getId())) {
                (s.isFinal() ? finals : others).add(s.getId());
            }
        }
        List<List<String>> partition = new ArrayList<>(2);
        if (!finals.isEmpty()) {
            partition.add(finals);
        }
        if (!others.isEmpty()) {
            partition.add(others);
        }

        int rounds = 0;
        while (true) {
            final Object2IntMap<String> blockOf = blockIndex(partition);
            final List<List<String>> refined = new ArrayList<>(partition.size());
            for (List<String> block : partition) {
                Map<IntList, List<String>> subBlocks = new LinkedHashMap<>();
                for (String state : block) {
                    subBlocks.computeIfAbsent(signature(state, values, index, blockOf), k -> new ArrayList<>())
                             .add(state);
                }
                refined.addAll(subBlocks.values());
            }
            rounds++;
            if (refined.size() == partition.size()) {
                break;
            }
            partition = refined;
        }
        if (DEBUG) {
            System.out.println("DEBUG: Partition refinement stable after " + rounds + " rounds: "
                + reachable.size() + " -> " + partition.size() + " blocks");
        }
        return partition;
    }

    private static IntList signature(String state, List<String> values, TransitionIndex index,
                                     Object2IntMap<String> blockOf) {
        final IntList sig = new IntArrayList(values.size());
        for (String value : values) {
            String dest = index.successor(state, value);
            sig.add(dest == null ? UNDEFINED : blockOf.getInt(dest));
        }
        return sig;
    }

    private static Object2IntMap<String> blockIndex(List<List<String>> partition) {
        final Object2IntMap<String> blockOf = new Object2IntOpenHashMap<>();
        blockOf.defaultReturnValue(UNDEFINED);
        for (int i = 0; i < partition.size(); i++) {
            for (String state : partition.get(i)) {
                blockOf.put(state, i);
            }
        }
        return blockOf;
    }

    private static void checkDeterministic(Automaton dfa) {
        if (!StructuralAnalyzer.isDeterministic(dfa)) {
            throw new PreconditionFailedException(
                "Automaton '" + dfa.getName() + "' must be deterministic to be minimized; determinize it first.");
        }
    }
}
