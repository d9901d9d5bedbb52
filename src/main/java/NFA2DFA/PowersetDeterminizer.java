package NFA2DFA;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import NFA2DFA.Model.Cancellation;
import NFA2DFA.Model.DFAState;
import NFA2DFA.Model.DeterminizeRecord;
import NFA2DFA.Registry.AddressRegistry;
import NFA2DFA.Registry.Registry;
import net.automatalib.alphabet.Alphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset construction of an epsilon-NFA.
 * <p>
 * Each DFA state is the epsilon-closure of a set of NFA states reachable from the initial
 * state. Unexplored DFA states are kept in a FIFO queue, so states are numbered and reported
 * in breadth-first discovery order. Successor sets that are empty are not recorded.
 */
public class PowersetDeterminizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PowersetDeterminizer.class);
    private static final long STATES_EXPLORED_PERIOD = 10000L;

    private final Cancellation cancellation;

    public PowersetDeterminizer() {
        this(new Cancellation());
    }

    public PowersetDeterminizer(Cancellation cancellation) {
        this.cancellation = cancellation;
    }

    /**
     * Determinize without limits.
     */
    public static <S, I> DFATransitionTable<S, I> determinize(Automaton<S, I> nfa) {
        return new PowersetDeterminizer().convert(nfa);
    }

    /**
     * @throws CancelledDeterminizationException if this determinizer's {@link Cancellation} trips
     */
    public <S, I> DFATransitionTable<S, I> convert(Automaton<S, I> nfa) {
        return convert(nfa, new AddressRegistry());
    }

    <S, I> DFATransitionTable<S, I> convert(Automaton<S, I> nfa, Registry registry) {
        final PowersetView<S, I> powerset = nfa.powersetView();
        final Alphabet<I> inputs = nfa.getInputAlphabet();
        final int symbolNum = inputs.size();

        final List<BitSet> discovered = new ArrayList<>();
        final List<int[]> rows = new ArrayList<>();
        final Deque<DeterminizeRecord> queue = new ArrayDeque<>();

        BitSet init = powerset.getInitialState();
        registry.put(init, 0);
        discovered.add(init);
        queue.addLast(new DeterminizeRecord(init, 0));

        long statesExplored = 0;
        while (!queue.isEmpty()) {
            if (cancellation.isInterrupted() || cancellation.isAboveThreshold(discovered.size())) {
                LOGGER.debug("Cancelled ({}) after {} DFA states", cancellation.cancelLabel(), discovered.size());
                throw new CancelledDeterminizationException(cancellation.cancelLabel(), discovered.size());
            }

            DeterminizeRecord curr = queue.pollFirst();
            BitSet inState = curr.inputState();

            final int[] row = new int[symbolNum];
            Arrays.fill(row, Registry.MISSING_ELEMENT);
            for (int a = 0; a < symbolNum; a++) {
                BitSet succ = powerset.getSuccessorAt(inState, a);
                if (succ.isEmpty()) {
                    continue; // dead state
                }
                int outSucc = registry.get(succ);
                if (outSucc == Registry.MISSING_ELEMENT) {
                    // add new state to DFA and to queue
                    outSucc = discovered.size();
                    registry.put(succ, outSucc);
                    discovered.add(succ);
                    queue.addLast(new DeterminizeRecord(succ, outSucc));
                }
                row[a] = outSucc;
            }
            // FIFO order: states are finished in the order they were numbered
            rows.add(row);
            statesExplored++;

            if (statesExplored % STATES_EXPLORED_PERIOD == 0) {
                LOGGER.debug("Explored {} states - {} states left in queue - {} states added",
                    statesExplored, queue.size(), discovered.size());
            }
        }

        final List<DFAState<S>> states = new ArrayList<>(discovered.size());
        final BitSet accepting = new BitSet(discovered.size());
        for (int q = 0; q < discovered.size(); q++) {
            BitSet stateSet = discovered.get(q);
            states.add(new DFAState<>(powerset.toStates(stateSet)));
            accepting.set(q, powerset.isAccepting(stateSet));
        }

        LOGGER.debug("Determinized NFA of {} states into DFA of {} states", nfa.size(), states.size());
        return new DFATransitionTable<>(inputs, states, accepting, rows.toArray(new int[0][]));
    }
}
