package FSA;

import FSA.Model.Automaton;
import FSA.Model.State;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class StructuralAnalyzerTest {
  @Test
  void testDeterminism() {
    Assertions.assertTrue(StructuralAnalyzer.isDeterministic(TestAutomata.singleA()));
    Assertions.assertFalse(StructuralAnalyzer.isDeterministic(TestAutomata.forkOnA()));

    // no initial state
    Automaton a = TestAutomata.singleA();
    a.setInitial("q0", false);
    Assertions.assertFalse(StructuralAnalyzer.isDeterministic(a));

    // two initial states
    a = TestAutomata.singleA();
    a.setInitial("q1", true);
    Assertions.assertFalse(StructuralAnalyzer.isDeterministic(a));

    // epsilon transition
    a = TestAutomata.singleA();
    a.addSymbol("eps", "ε");
    Assertions.assertTrue(StructuralAnalyzer.isDeterministic(a)); // unused symbol is harmless
    a.addTransition("t1", "q1", "q0", "eps");
    Assertions.assertFalse(StructuralAnalyzer.isDeterministic(a));

    // two symbol ids with the same value behave as one symbol
    a = TestAutomata.singleA();
    a.addSymbol("sym_dup", "a");
    a.addTransition("t1", "q0", "q0", "sym_dup");
    Assertions.assertFalse(StructuralAnalyzer.isDeterministic(a));
  }

  @Test
  void testCompleteness() {
    Automaton a = TestAutomata.singleA();
    Assertions.assertFalse(StructuralAnalyzer.isComplete(a));
    a.addTransition("t1", "q1", "q1", "sym_0");
    Assertions.assertTrue(StructuralAnalyzer.isComplete(a));

    // vacuously complete
    Assertions.assertTrue(StructuralAnalyzer.isComplete(new Automaton("empty")));
  }

  @Test
  void testComplete() {
    Automaton a = TestAutomata.singleA();
    a.addSymbol("sym_1", "b");
    Automaton completed = StructuralAnalyzer.complete(a);
    Assertions.assertSame(a, completed);
    Assertions.assertTrue(StructuralAnalyzer.isComplete(a));
    Assertions.assertTrue(StructuralAnalyzer.isDeterministic(a));

    State sink = a.getState(StructuralAnalyzer.SINK_ID);
    Assertions.assertFalse(sink.isInitial());
    Assertions.assertFalse(sink.isFinal());
    // q0/b, q1/a, q1/b and two self-loops
    Assertions.assertEquals(1 + 3 + 2, a.getTransitions().size());

    // already complete: no-op
    int transitions = a.getTransitions().size();
    StructuralAnalyzer.complete(a);
    Assertions.assertEquals(3, a.size());
    Assertions.assertEquals(transitions, a.getTransitions().size());
  }

  @Test
  void testSinkNameIsFresh() {
    Automaton a = TestAutomata.singleA();
    a.addState("PUITS", "taken", false, false);
    a.addState("PUITS1", "taken", false, false);
    StructuralAnalyzer.complete(a);
    Assertions.assertTrue(a.containsState("PUITS2"));
    Assertions.assertEquals(StructuralAnalyzer.SINK_LABEL, a.getState("PUITS2").getLabel());
    Assertions.assertTrue(StructuralAnalyzer.isComplete(a));
  }

  @Test
  void testCompleteRandom() {
    for (int seed = 0; seed < 20; seed++) {
      Automaton a = TestAutomata.getRandomAutomaton(seed, 4);
      Assertions.assertTrue(StructuralAnalyzer.isComplete(StructuralAnalyzer.complete(a)));
    }
  }
}
