package FSA;

import FSA.Model.Automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Fixtures and random automata shared by the tests.
 */
public class TestAutomata {
    public static final List<String> AB = List.of("a", "b");

    /**
     * q0 (initial) --a--> q1 (final), alphabet {a}; partial.
     */
    public static Automaton singleA() {
        Automaton a = new Automaton("single_a");
        a.addSymbol("sym_0", "a");
        a.addState("q0", "start", true, false);
        a.addState("q1", "end", false, true);
        a.addTransition("t0", "q0", "q1", "sym_0");
        return a;
    }

    /**
     * q0 has two transitions on 'a', to q1 and to q2 (final).
     */
    public static Automaton forkOnA() {
        Automaton a = new Automaton("fork");
        a.addSymbol("sym_0", "a");
        a.addState("q0", "q0", true, false);
        a.addState("q1", "q1", false, false);
        a.addState("q2", "q2", false, true);
        a.addTransition("t0", "q0", "q1", "sym_0");
        a.addTransition("t1", "q0", "q2", "sym_0");
        return a;
    }

    /**
     * Complete DFA accepting exactly {@code word} over {@code alphabet}.
     */
    public static Automaton exactly(String name, String word, List<String> alphabet) {
        Automaton a = new Automaton(name);
        for (int i = 0; i < alphabet.size(); i++) {
            a.addSymbol("sym_" + i, alphabet.get(i));
        }
        for (int i = 0; i <= word.length(); i++) {
            a.addState("s" + i, "s" + i, i == 0, i == word.length());
        }
        for (int i = 0; i < word.length(); i++) {
            String value = String.valueOf(word.charAt(i));
            a.addTransition("s" + i, "s" + (i + 1), a.symbolForValue(value).id());
        }
        return StructuralAnalyzer.complete(a);
    }

    /**
     * Complete DFA over {a} accepting the words of length at least {@code n}.
     */
    public static Automaton atLeast(String name, int n) {
        Automaton a = new Automaton(name);
        a.addSymbol("sym_0", "a");
        for (int i = 0; i <= n; i++) {
            a.addState("c" + i, "c" + i, i == 0, i == n);
        }
        for (int i = 0; i < n; i++) {
            a.addTransition("c" + i, "c" + (i + 1), "sym_0");
        }
        a.addTransition("c" + n, "c" + n, "sym_0");
        return a;
    }

    /**
     * Random automaton in the style of Tabakov and Vardi: state q0 is initial and final, {@code acceptNum - 1}
     * other states are final, and each letter gets {@code edgeNum} distinct random edges.
     * Not necessarily connected, deterministic or complete.
     */
    public static Automaton generateNFA(Random r, int size, int edgeNum, int acceptNum, List<String> alphabet) {
        assert acceptNum > 0 && acceptNum <= size;
        assert edgeNum >= 0 && edgeNum <= size * size;

        Automaton result = new Automaton("random");
        for (int i = 0; i < alphabet.size(); i++) {
            result.addSymbol("sym_" + i, alphabet.get(i));
        }
        List<Integer> others = new ArrayList<>();
        for (int i = 1; i < size; i++) {
            others.add(i);
        }
        Collections.shuffle(others, r);
        List<Integer> finals = others.subList(0, acceptNum - 1);
        for (int i = 0; i < size; i++) {
            result.addState("q" + i, "q" + i, i == 0, i == 0 || finals.contains(i));
        }

        List<Integer> edges = new ArrayList<>();
        for (int i = 0; i < size * size; i++) {
            edges.add(i);
        }
        for (int s = 0; s < alphabet.size(); s++) {
            Collections.shuffle(edges, r);
            for (int edgeIndex : edges.subList(0, edgeNum)) {
                result.addTransition("q" + (edgeIndex / size), "q" + (edgeIndex % size), "sym_" + s);
            }
        }
        return result;
    }

    public static Automaton getRandomAutomaton(int randomSeed, int size) {
        final float td = 1.25f;
        final float ad = 0.5f;
        return generateNFA(new Random(randomSeed), size, Math.round(td * size), Math.max(1, Math.round(ad * size)), AB);
    }

    /**
     * Every word over {@code alphabet} of length at most {@code maxLength}.
     */
    public static List<List<String>> allWords(List<String> alphabet, int maxLength) {
        List<List<String>> result = new ArrayList<>();
        List<List<String>> layer = new ArrayList<>();
        layer.add(List.of());
        result.addAll(layer);
        for (int length = 1; length <= maxLength; length++) {
            List<List<String>> next = new ArrayList<>();
            for (List<String> prefix : layer) {
                for (String s : alphabet) {
                    List<String> word = new ArrayList<>(prefix);
                    word.add(s);
                    next.add(word);
                }
            }
            result.addAll(next);
            layer = next;
        }
        return result;
    }
}
