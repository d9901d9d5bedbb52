package NFA2DFA;

import NFA2DFA.Model.DFAState;
import NFA2DFA.Model.Transition;
import NFA2DFA.Registry.Registry;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class DFATransitionTableTest {
  private static DFAState<Integer> state(Integer... states) {
    return new DFAState<>(Set.of(states));
  }

  @Test
  void testStateIds() {
    DFATransitionTable<Integer, Character> dfa = PowersetDeterminizer.determinize(ExampleAutomata.threeStates());
    Assertions.assertEquals(6, dfa.size());
    Assertions.assertEquals(0, dfa.getStateId(dfa.getInitialState()));
    Assertions.assertEquals(2, dfa.getStateId(state(1, 2)));
    Assertions.assertEquals(5, dfa.getStateId(state(3, 2, 1)));
    Assertions.assertEquals(Registry.MISSING_ELEMENT, dfa.getStateId(state(1, 3)));
    Assertions.assertFalse(dfa.isAccepting(state(1, 3))); // not a state of this DFA
    for (int q = 0; q < dfa.size(); q++) {
      Assertions.assertEquals(q, dfa.getStateId(dfa.getStates().get(q)));
    }
  }

  @Test
  void testTransitionsView() {
    DFATransitionTable<Integer, Character> dfa = PowersetDeterminizer.determinize(ExampleAutomata.partial());
    Assertions.assertEquals(state(1), dfa.getTransitions().get(Transition.of(state(0), 'a')));
    Assertions.assertFalse(dfa.getTransitions().containsKey(Transition.of(state(0), 'b')));
    assertThrows(UnsupportedOperationException.class, () -> dfa.getTransitions().clear());
    assertThrows(UnsupportedOperationException.class, () -> dfa.getStates().clear());
    Assertions.assertNull(dfa.getSuccessor(state(0), 'z'));
    Assertions.assertEquals("{ 0 } / a -> { 1 }\n", dfa.toString());
  }

  @Test
  void testAccepts() {
    Automaton<Integer, Character> nfa = ExampleAutomata.abb();
    DFATransitionTable<Integer, Character> dfa = PowersetDeterminizer.determinize(nfa);
    Assertions.assertTrue(dfa.accepts(List.of('a', 'b', 'b')));
    Assertions.assertTrue(dfa.accepts(List.of('b', 'b', 'a', 'b', 'b')));
    Assertions.assertFalse(dfa.accepts(List.of('a', 'b')));
    Assertions.assertFalse(dfa.accepts(List.of()));
    Assertions.assertFalse(dfa.accepts(List.of('a', 'x')));

    for (List<Character> word : ExampleAutomata.wordsUpTo(nfa.getInputAlphabet(), 7)) {
      Assertions.assertEquals(nfa.accepts(word), dfa.accepts(word), word::toString);
    }
  }

  @Test
  void testCompactDFAExport() {
    DFATransitionTable<Integer, Character> dfa = PowersetDeterminizer.determinize(ExampleAutomata.threeStates());
    CompactDFA<Character> compact = dfa.toCompactDFA();
    Assertions.assertEquals(6, compact.size());
    Assertions.assertEquals(dfa.getInputAlphabet(), compact.getInputAlphabet());
    Assertions.assertEquals(Integer.valueOf(0), compact.getInitialState());
    // renumbered states follow discovery order
    Assertions.assertEquals(Integer.valueOf(dfa.getStateId(state(1, 2))), compact.getState(List.of('b', 'a')));
    Assertions.assertEquals(Integer.valueOf(dfa.getStateId(state(2, 3))), compact.getState(List.of('b', 'a', 'b')));
    for (List<Character> word : ExampleAutomata.wordsUpTo(dfa.getInputAlphabet(), 6)) {
      Assertions.assertEquals(dfa.accepts(word), compact.accepts(word), word::toString);
    }
  }

  @Test
  void testCompactDFAExportStaysPartial() {
    DFATransitionTable<Integer, Character> dfa = PowersetDeterminizer.determinize(ExampleAutomata.partial());
    CompactDFA<Character> compact = dfa.toCompactDFA();
    Assertions.assertEquals(2, compact.size());
    Assertions.assertNull(compact.getState(List.of('b')));
    Assertions.assertTrue(compact.accepts(List.of('a')));
    Assertions.assertFalse(compact.accepts(List.of('a', 'a')));
  }
}
