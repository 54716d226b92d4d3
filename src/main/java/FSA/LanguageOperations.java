package FSA;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import FSA.Model.Automaton;
import FSA.Model.NoInitialStateException;
import FSA.Model.PreconditionFailedException;
import FSA.Model.State;
import FSA.Model.Symbol;
import FSA.Model.Transition;
import FSA.Model.TransitionIndex;

/**
 * Membership, bounded enumeration, product constructions, complement and equivalence.
 * <p>
 * Simulation and the product constructions assume deterministic automata; the product of partial automata
 * is itself partial. Complement checks that its input is deterministic and complete.
 */
public class LanguageOperations {
    /** Word length up to which {@link #equivalent(Automaton, Automaton)} searches for a difference. */
    public static final int EQUIVALENCE_DEPTH = 5;

    private LanguageOperations() {}

    /**
     * Runs a word in which every code point is one symbol value.
     */
    public static boolean simulate(Automaton automaton, String word) {
        List<String> symbols = new ArrayList<>(word.length());
        word.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        return simulate(automaton, symbols);
    }

    /**
     * Runs a word given as a sequence of symbol values from the first initial state.
     * @return true iff the run reaches a final state; false when some transition is missing
     * @throws NoInitialStateException - when the automaton has no initial state
     */
    public static boolean simulate(Automaton automaton, List<String> word) {
        return simulate(automaton, startState(automaton), automaton.transitionIndex(), word);
    }

    private static boolean simulate(Automaton automaton, String start, TransitionIndex index, List<String> word) {
        String curr = start;
        for (String value : word) {
            curr = index.successor(curr, value);
            if (curr == null) {
                return false;
            }
        }
        return automaton.getState(curr).isFinal();
    }

    private static String startState(Automaton automaton) {
        List<State> initials = automaton.getInitialStates();
        if (initials.isEmpty()) {
            throw new NoInitialStateException(automaton.getName());
        }
        return initials.get(0).getId();
    }

    /**
     * Every accepted word of at most {@code maxLength} symbols, by increasing number of symbols, then in
     * lexicographic order of the concatenated string. A string spelled by several symbol sequences is
     * listed once, at its shortest sequence. Enumerates {@code |alphabet|^length} candidates per length.
     */
    public static List<String> acceptedWords(Automaton automaton, int maxLength) {
        final Set<String> accepted = new LinkedHashSet<>();
        if (maxLength < 0) {
            return new ArrayList<>();
        }
        final String start = startState(automaton);
        final TransitionIndex index = automaton.transitionIndex();
        final List<String> values = automaton.symbolValues();

        for (int length = 0; length <= maxLength; length++) {
            if (length > 0 && values.isEmpty()) {
                break;
            }
            int[] digits = new int[length];
            String[] word = new String[length];
            // multi-character values make the symbol order differ from the string order
            TreeSet<String> bucket = new TreeSet<>();
            boolean more = true;
            while (more) {
                for (int i = 0; i < length; i++) {
                    word[i] = values.get(digits[i]);
                }
                List<String> candidate = Arrays.asList(word);
                if (simulate(automaton, start, index, candidate)) {
                    bucket.add(String.join("", candidate));
                }
                // odometer increment, last position fastest
                more = false;
                for (int i = length - 1; i >= 0; i--) {
                    if (++digits[i] < values.size()) {
                        more = true;
                        break;
                    }
                    digits[i] = 0;
                }
            }
            accepted.addAll(bucket);
        }
        return new ArrayList<>(accepted);
    }

    /**
     * Product automaton whose states are final when either component is final.
     */
    public static Automaton union(Automaton a1, Automaton a2) {
        return product(a1, a2, a1.getName() + "_union_" + a2.getName(), false);
    }

    /**
     * Product automaton whose states are final when both components are final.
     */
    public static Automaton intersection(Automaton a1, Automaton a2) {
        return product(a1, a2, a1.getName() + "_inter_" + a2.getName(), true);
    }

    /**
     * Product construction. State {@code (p, q)} is named {@code p_q} (suffixed if that id is taken), is
     * initial iff both components are, and carries one transition per pair of component transitions on the
     * same symbol value.
     */
    private static Automaton product(Automaton a1, Automaton a2, String name, boolean bothFinal) {
        final Automaton out = new Automaton(name);
        copyAlphabets(out, a1, a2);

        final Map<String, Map<String, String>> pairs = new HashMap<>();
        for (State e1 : a1.getStates()) {
            Map<String, String> row = pairs.computeIfAbsent(e1.getId(), k -> new HashMap<>());
            for (State e2 : a2.getStates()) {
                String id = out.freshStateId(e1.getId() + "_" + e2.getId());
                boolean accepting = bothFinal ? e1.isFinal() && e2.isFinal() : e1.isFinal() || e2.isFinal();
                out.addState(id, "(" + e1.getId() + ", " + e2.getId() + ")", e1.isInitial() && e2.isInitial(), accepting);
                row.put(e2.getId(), id);
            }
        }

        for (Transition t1 : a1.getTransitions()) {
            String value = a1.getSymbol(t1.symbol()).value();
            String symbolId = out.symbolForValue(value).id();
            for (Transition t2 : a2.getTransitions()) {
                if (value.equals(a2.getSymbol(t2.symbol()).value())) {
                    String source = pairs.get(t1.source()).get(t2.source());
                    String dest = pairs.get(t1.destination()).get(t2.destination());
                    out.addTransition(source, dest, symbolId);
                }
            }
        }
        return out;
    }

    /**
     * All symbols of {@code a1}, then the symbols of {@code a2} whose value {@code a1} lacks.
     */
    private static void copyAlphabets(Automaton out, Automaton a1, Automaton a2) {
        for (Symbol s : a1.getSymbols()) {
            out.addSymbol(s);
        }
        for (Symbol s : a2.getSymbols()) {
            if (out.symbolForValue(s.value()) == null) {
                String id = s.id();
                int i = 1;
                while (out.containsSymbol(id)) {
                    id = s.id() + "_" + i++;
                }
                out.addSymbol(id, s.value());
            }
        }
    }

    /**
     * Same states, transitions and initial state; final states flipped.
     * @throws PreconditionFailedException - when the automaton is not deterministic and complete
     */
    public static Automaton complement(Automaton automaton) {
        if (!StructuralAnalyzer.isDeterministic(automaton) || !StructuralAnalyzer.isComplete(automaton)) {
            throw new PreconditionFailedException("Automaton '" + automaton.getName()
                + "' must be deterministic and complete to be complemented.");
        }
        final Automaton comp = new Automaton(automaton.getName() + "_complement");
        for (Symbol s : automaton.getSymbols()) {
            comp.addSymbol(s);
        }
        for (State s : automaton.getStates()) {
            comp.addState(s.getId(), s.getLabel(), s.isInitial(), !s.isFinal());
        }
        for (Transition t : automaton.getTransitions()) {
            comp.addTransition(t);
        }
        return comp;
    }

    /**
     * Bounded equivalence: both differences {@code A1 \ A2} and {@code A2 \ A1} accept no word of length at
     * most {@link #EQUIVALENCE_DEPTH}.
     * <p>
     * This is an approximation. Automata differing only on longer words are reported equivalent, and only
     * words over symbol values shared by both alphabets are compared. Use
     * {@link #equivalentExact(Automaton, Automaton)} for a decision.
     */
    public static boolean equivalent(Automaton a1, Automaton a2) {
        return equivalent(a1, a2, EQUIVALENCE_DEPTH);
    }

    public static boolean equivalent(Automaton a1, Automaton a2, int depth) {
        final Automaton diff1 = intersection(a1, complement(a2));
        final Automaton diff2 = intersection(a2, complement(a1));
        return acceptedWords(diff1, depth).isEmpty() && acceptedWords(diff2, depth).isEmpty();
    }

    /**
     * Exact language equality over the union of both alphabets. Inputs may be non-deterministic or partial.
     */
    public static boolean equivalentExact(Automaton a1, Automaton a2) {
        return AutomataLibBridge.testEquivalence(a1, a2);
    }
}
