package FSA;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import FSA.Model.Automaton;
import FSA.Model.PreconditionFailedException;
import FSA.Model.State;
import FSA.Model.Symbol;
import FSA.Model.Transition;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import net.automatalib.word.Word;

/**
 * Conversions to AutomataLib's compact automata, whose input symbols are our symbol values.
 */
public class AutomataLibBridge {
    private AutomataLibBridge() {}

    /**
     * @return sorted distinct non-empty symbol values of all given automata
     */
    public static Alphabet<String> alphabetOf(Automaton... automata) {
        TreeSet<String> values = new TreeSet<>();
        for (Automaton a : automata) {
            for (Symbol s : a.getSymbols()) {
                if (!s.isEmpty()) {
                    values.add(s.value());
                }
            }
        }
        return Alphabets.fromCollection(new ArrayList<>(values));
    }

    public static CompactNFA<String> toCompactNFA(Automaton automaton) {
        return toCompactNFA(automaton, alphabetOf(automaton));
    }

    /**
     * Automata with empty-symbol transitions are determinized first, the compact automata having no
     * epsilon transitions.
     * @param alphabet - must contain every non-empty symbol value of the automaton
     */
    public static CompactNFA<String> toCompactNFA(Automaton automaton, Alphabet<String> alphabet) {
        if (hasEmptyTransition(automaton)) {
            automaton = PowersetDeterminizer.determinize(automaton);
        }
        final CompactNFA<String> nfa = new CompactNFA<>(alphabet, automaton.size());
        final Map<String, Integer> mapping = new HashMap<>();
        for (State s : automaton.getStates()) {
            int q = nfa.addState(s.isFinal());
            if (s.isInitial()) {
                nfa.setInitial(q, true);
            }
            mapping.put(s.getId(), q);
        }
        for (Transition t : automaton.getTransitions()) {
            String value = automaton.getSymbol(t.symbol()).value();
            nfa.addTransition(mapping.get(t.source()), value, mapping.get(t.destination()));
        }
        return nfa;
    }

    /**
     * Precondition: the automaton is deterministic. Undefined transitions stay undefined.
     */
    public static CompactDFA<String> toCompactDFA(Automaton automaton) {
        if (!StructuralAnalyzer.isDeterministic(automaton)) {
            throw new PreconditionFailedException(
                "Automaton '" + automaton.getName() + "' is not deterministic.");
        }
        final Alphabet<String> alphabet = alphabetOf(automaton);
        final CompactDFA<String> dfa = new CompactDFA<>(alphabet, automaton.size());
        final Map<String, Integer> mapping = new HashMap<>();
        for (State s : automaton.getStates()) {
            Integer q = s.isInitial() ? dfa.addInitialState(s.isFinal()) : dfa.addState(s.isFinal());
            mapping.put(s.getId(), q);
        }
        for (Transition t : automaton.getTransitions()) {
            String value = automaton.getSymbol(t.symbol()).value();
            dfa.setTransition(mapping.get(t.source()), value, mapping.get(t.destination()));
        }
        return dfa;
    }

    /**
     * Decides language equality over the union of both alphabets; neither automaton needs to be
     * deterministic or complete.
     */
    public static boolean testEquivalence(Automaton a1, Automaton a2) {
        final Alphabet<String> alphabet = alphabetOf(a1, a2);
        final CompactDFA<String> d1 = determinize(a1, alphabet);
        final CompactDFA<String> d2 = determinize(a2, alphabet);
        return Automata.testEquivalence(d1, d2, alphabet);
    }

    /**
     * @return a word accepted by exactly one of the automata, as symbol values, or null if equivalent
     */
    public static List<String> separatingWord(Automaton a1, Automaton a2) {
        final Alphabet<String> alphabet = alphabetOf(a1, a2);
        final CompactDFA<String> d1 = determinize(a1, alphabet);
        final CompactDFA<String> d2 = determinize(a2, alphabet);
        Word<String> word = Automata.findSeparatingWord(d1, d2, alphabet);
        return word == null ? null : word.asList();
    }

    private static boolean hasEmptyTransition(Automaton automaton) {
        for (Transition t : automaton.getTransitions()) {
            if (automaton.getSymbol(t.symbol()).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private static CompactDFA<String> determinize(Automaton automaton, Alphabet<String> alphabet) {
        return NFAs.determinize(toCompactNFA(automaton, alphabet), alphabet);
    }
}
