package NFA2DFA;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import NFA2DFA.Model.Transition;
import net.automatalib.alphabet.Alphabet;

/**
 * The powerset view of an {@link Automaton}: epsilon-closures and successors of sets of states.
 * <p>
 * Sets of states are {@link BitSet}s over the automaton's dense state IDs. Epsilon and symbol
 * adjacency are tabulated once, so a closure costs time linear in the epsilon edges it visits.
 * Instances are immutable after construction.
 *
 * @param <S> state type
 * @param <I> input symbol type
 */
public final class PowersetView<S, I> {
    private final Automaton<S, I> automaton;
    private final Alphabet<I> alphabet;

    private final int initialId;
    private final BitSet acceptingIds;
    private final BitSet[] epsilonSuccessors; // [stateId], null if none
    private final BitSet[][] successors;      // [symbolIdx][stateId], null if none

    PowersetView(Automaton<S, I> automaton) {
        this.automaton = automaton;
        this.alphabet = automaton.getInputAlphabet();
        final int n = automaton.size();

        this.initialId = automaton.getStateId(automaton.getInitialState());
        this.acceptingIds = new BitSet(n);
        for (S s : automaton.getAcceptingStates()) {
            acceptingIds.set(automaton.getStateId(s));
        }

        this.epsilonSuccessors = new BitSet[n];
        this.successors = new BitSet[alphabet.size()][n];
        for (Map.Entry<Transition<S, I>, Set<S>> e : automaton.getTransitions().entrySet()) {
            final Transition<S, I> key = e.getKey();
            final int from = automaton.getStateId(key.state());
            final BitSet[] row = key.isEpsilon() ? epsilonSuccessors : successors[alphabet.getSymbolIndex(key.symbol())];
            BitSet targets = row[from];
            if (targets == null) {
                targets = new BitSet(n);
                row[from] = targets;
            }
            for (S to : e.getValue()) {
                targets.set(automaton.getStateId(to));
            }
        }
    }

    public Automaton<S, I> getAutomaton() {
        return automaton;
    }

    /**
     * @return epsilon-closure of the initial state, i.e. the start state of the subset construction
     */
    public BitSet getInitialState() {
        final BitSet init = new BitSet();
        init.set(initialId);
        return epsilonClosure(init);
    }

    /**
     * Epsilon-closure of the states reachable from {@code stateSet} on {@code symbol}.
     * @return possibly empty set; empty for symbols outside the input alphabet
     */
    public BitSet getSuccessor(BitSet stateSet, I symbol) {
        checkRange(stateSet);
        if (!alphabet.contains(symbol)) {
            return new BitSet();
        }
        return getSuccessorAt(stateSet, alphabet.getSymbolIndex(symbol));
    }

    BitSet getSuccessorAt(BitSet stateSet, int symbolIdx) {
        return epsilonClosure(moveAt(stateSet, symbolIdx));
    }

    BitSet moveAt(BitSet stateSet, int symbolIdx) {
        final BitSet[] row = successors[symbolIdx];
        final BitSet result = new BitSet();
        for (int s = stateSet.nextSetBit(0); s >= 0; s = stateSet.nextSetBit(s + 1)) {
            if (row[s] != null) {
                result.or(row[s]);
            }
        }
        return result;
    }

    public boolean isAccepting(BitSet stateSet) {
        checkRange(stateSet);
        return stateSet.intersects(acceptingIds);
    }

    /**
     * Smallest superset of {@code seed} closed under epsilon transitions.
     * The argument is not modified.
     */
    public BitSet epsilonClosure(BitSet seed) {
        checkRange(seed);
        final BitSet closure = (BitSet) seed.clone();
        final Deque<Integer> stack = new ArrayDeque<>();
        for (int s = seed.nextSetBit(0); s >= 0; s = seed.nextSetBit(s + 1)) {
            stack.push(s);
        }

        while (!stack.isEmpty()) {
            final BitSet targets = epsilonSuccessors[stack.pop()];
            if (targets == null) {
                continue;
            }
            for (int t = targets.nextSetBit(0); t >= 0; t = targets.nextSetBit(t + 1)) {
                if (!closure.get(t)) {
                    closure.set(t);
                    stack.push(t);
                }
            }
        }
        return closure;
    }

    public Set<S> epsilonClosure(S state) {
        return epsilonClosure(Collections.singleton(state));
    }

    public Set<S> epsilonClosure(Collection<? extends S> seed) {
        return toStates(epsilonClosure(toBitSet(seed)));
    }

    /**
     * Run the automaton on a word, tracking the closed set of current states.
     */
    public boolean accepts(Iterable<? extends I> word) {
        BitSet current = getInitialState();
        for (I symbol : word) {
            current = getSuccessor(current, symbol);
            if (current.isEmpty()) {
                return false;
            }
        }
        return isAccepting(current);
    }

    /**
     * @throws IllegalArgumentException if one of the states is not declared by the automaton
     */
    public BitSet toBitSet(Collection<? extends S> stateSet) {
        final BitSet result = new BitSet(automaton.size());
        for (S s : stateSet) {
            final int id = automaton.getStateId(s);
            if (id < 0) {
                throw new IllegalArgumentException("Undeclared state: " + s);
            }
            result.set(id);
        }
        return result;
    }

    public Set<S> toStates(BitSet stateSet) {
        checkRange(stateSet);
        final Set<S> result = new LinkedHashSet<>();
        for (int s = stateSet.nextSetBit(0); s >= 0; s = stateSet.nextSetBit(s + 1)) {
            result.add(automaton.getState(s));
        }
        return Collections.unmodifiableSet(result);
    }

    private void checkRange(BitSet stateSet) {
        if (stateSet.length() > automaton.size()) {
            throw new IllegalArgumentException("Undeclared state ID: " + (stateSet.length() - 1));
        }
    }
}
