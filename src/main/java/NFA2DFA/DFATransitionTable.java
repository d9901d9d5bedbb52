package NFA2DFA;

import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import NFA2DFA.Model.DFAState;
import NFA2DFA.Model.Transition;
import NFA2DFA.Registry.Registry;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Result of the subset construction: a partial DFA whose states are sets of NFA states.
 * <p>
 * States are numbered in discovery order; the start state has ID 0. A missing transition
 * stands for the implicit, non-accepting dead state and is never materialized.
 *
 * @param <S> NFA state type
 * @param <I> input symbol type
 */
public final class DFATransitionTable<S, I> {
    private final Alphabet<I> alphabet;
    private final List<DFAState<S>> states;
    private final Object2IntMap<DFAState<S>> stateIds;
    private final BitSet accepting;
    private final int[][] successors; // [stateId][symbolIdx], Registry.MISSING_ELEMENT if undefined
    private final Map<Transition<DFAState<S>, I>, DFAState<S>> transitions;

    DFATransitionTable(Alphabet<I> alphabet, List<DFAState<S>> states, BitSet accepting, int[][] successors) {
        this.alphabet = alphabet;
        this.states = List.copyOf(states);
        this.accepting = (BitSet) accepting.clone();
        this.successors = successors;

        this.stateIds = new Object2IntOpenHashMap<>(states.size());
        this.stateIds.defaultReturnValue(Registry.MISSING_ELEMENT);
        for (int q = 0; q < states.size(); q++) {
            stateIds.put(states.get(q), q);
        }

        final Map<Transition<DFAState<S>, I>, DFAState<S>> table = new LinkedHashMap<>();
        for (int q = 0; q < states.size(); q++) {
            for (int a = 0; a < alphabet.size(); a++) {
                int succ = successors[q][a];
                if (succ != Registry.MISSING_ELEMENT) {
                    table.put(Transition.of(states.get(q), alphabet.getSymbol(a)), states.get(succ));
                }
            }
        }
        this.transitions = Collections.unmodifiableMap(table);
    }

    public DFAState<S> getInitialState() {
        return states.get(0);
    }

    /**
     * @return all DFA states, in discovery order
     */
    public List<DFAState<S>> getStates() {
        return states;
    }

    public Map<Transition<DFAState<S>, I>, DFAState<S>> getTransitions() {
        return transitions;
    }

    public Alphabet<I> getInputAlphabet() {
        return alphabet;
    }

    public int size() {
        return states.size();
    }

    /**
     * @return the successor, or {@code null} if the transition leads to the dead state
     */
    public DFAState<S> getSuccessor(DFAState<S> state, I symbol) {
        return transitions.get(Transition.of(state, symbol));
    }

    /**
     * A DFA state accepts iff it contains an accepting NFA state.
     */
    public boolean isAccepting(DFAState<S> state) {
        int id = getStateId(state);
        return id != Registry.MISSING_ELEMENT && accepting.get(id);
    }

    public Set<DFAState<S>> getAcceptingStates() {
        final Set<DFAState<S>> result = new LinkedHashSet<>();
        for (int q = accepting.nextSetBit(0); q >= 0; q = accepting.nextSetBit(q + 1)) {
            result.add(states.get(q));
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Canonical number of a DFA state: its position in discovery order.
     * @return state ID, or {@link Registry#MISSING_ELEMENT} if the set is not a state of this DFA
     */
    public int getStateId(DFAState<S> state) {
        return stateIds.getInt(state);
    }

    public boolean accepts(Iterable<? extends I> word) {
        int q = 0;
        for (I symbol : word) {
            if (!alphabet.contains(symbol)) {
                return false;
            }
            q = successors[q][alphabet.getSymbolIndex(symbol)];
            if (q == Registry.MISSING_ELEMENT) {
                return false;
            }
        }
        return accepting.get(q);
    }

    /**
     * Copy into an AutomataLib DFA, using the canonical state IDs. The copy stays partial:
     * dead-state transitions are left undefined.
     */
    public CompactDFA<I> toCompactDFA() {
        final CompactDFA<I> out = new CompactDFA<>(alphabet, states.size());
        out.addInitialState(accepting.get(0));
        for (int q = 1; q < states.size(); q++) {
            out.addState(accepting.get(q));
        }
        for (int q = 0; q < states.size(); q++) {
            for (int a = 0; a < alphabet.size(); a++) {
                int succ = successors[q][a];
                if (succ != Registry.MISSING_ELEMENT) {
                    out.setTransition(q, a, succ);
                }
            }
        }
        return out;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        for (Map.Entry<Transition<DFAState<S>, I>, DFAState<S>> e : transitions.entrySet()) {
            sb.append(e.getKey().state()).append(" / ").append(e.getKey().symbol())
                .append(" -> ").append(e.getValue()).append('\n');
        }
        return sb.toString();
    }
}
