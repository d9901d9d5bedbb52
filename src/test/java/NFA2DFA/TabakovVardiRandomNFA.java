package NFA2DFA;

import NFA2DFA.Model.Transition;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.common.util.random.RandomUtil;

import java.util.Map;
import java.util.Random;
import java.util.Set;

public class TabakovVardiRandomNFA {
    /**
     * Generate random NFA using Tabakov and Vardi's approach, described in the paper
     * <a href="https://doi.org/10.1007/11591191_28">Experimental Evaluation of Classical Automata Constructions</a>
     * by Deian Tabakov and Moshe Y. Vardi, extended with random epsilon transitions.
     *
     * @param r
     *      random instance
     * @param size
     *      number of states
     * @param edgeNum
     *      number of edges (per letter)
     * @param epsilonNum
     *      number of epsilon edges
     * @param acceptNum
     *      number of accepting states (at least one)
     * @param alphabet
     *      alphabet
     * @return
     *      a random NFA over states 0..size-1, not necessarily connected
     */
    public static Automaton<Integer, Integer> generateNFA(
            Random r, int size, int edgeNum, int epsilonNum, int acceptNum, Alphabet<Integer> alphabet) {
        assert acceptNum > 0 && acceptNum <= size;
        assert edgeNum >= 0 && edgeNum <= size*size;

        Automaton.Builder<Integer, Integer> builder = Automaton.builder(alphabet);
        for (int i = 0; i < size; i++) {
            builder.addState(i);
        }
        // per the paper, the first state is always initial and accepting
        builder.setInitial(0).setAccepting(0);

        // We want exactly acceptNum-1 other final states, from the elements [1,size).
        for (int f : RandomUtil.distinctIntegers(r, acceptNum - 1, 1, size)) {
            builder.setAccepting(f);
        }

        for (int a: alphabet) {
            for (int edgeIndex: RandomUtil.distinctIntegers(r, edgeNum, size*size)) {
                builder.addTransition(edgeIndex / size, a, edgeIndex % size);
            }
        }
        for (int edgeIndex: RandomUtil.distinctIntegers(r, epsilonNum, size*size)) {
            builder.addEpsilonTransition(edgeIndex / size, edgeIndex % size);
        }
        return builder.create();
    }

    public static Automaton<Integer, Integer> getRandomAutomaton(int randomSeed, int size, boolean withEpsilon) {
        final float td = 1.25f;
        final float ad = 0.5f;
        final float ed = withEpsilon ? 0.5f : 0f;
        final Random random = new Random(randomSeed);
        final Alphabet<Integer> alphabet = Alphabets.integers(0, 1);
        return generateNFA(random, size, Math.round(td * size), Math.round(ed * size),
            Math.max(1, Math.round(ad * size)), alphabet);
    }

    /**
     * Copy an epsilon-free automaton over states 0..n-1 into an AutomataLib NFA.
     */
    public static CompactNFA<Integer> toCompactNFA(Automaton<Integer, Integer> nfa) {
        CompactNFA<Integer> out = new CompactNFA<>(nfa.getInputAlphabet(), nfa.size());
        for (int i = 0; i < nfa.size(); i++) {
            out.addState(nfa.isAccepting(i));
        }
        out.setInitial((int) nfa.getInitialState(), true);
        for (Map.Entry<Transition<Integer, Integer>, Set<Integer>> e : nfa.getTransitions().entrySet()) {
            if (e.getKey().isEpsilon()) {
                throw new IllegalArgumentException("Epsilon transitions are not supported: " + e.getKey());
            }
            int from = e.getKey().state();
            int symbol = e.getKey().symbol();
            for (int to : e.getValue()) {
                out.addTransition(from, symbol, to);
            }
        }
        return out;
    }
}
