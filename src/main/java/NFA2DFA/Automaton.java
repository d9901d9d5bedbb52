package NFA2DFA;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import NFA2DFA.MalformedAutomatonException.Violation;
import NFA2DFA.Model.Transition;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.common.util.HashUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable nondeterministic finite automaton with epsilon transitions.
 * <p>
 * An automaton is the tuple (states, alphabet, accepting states, initial state, transitions).
 * Epsilon is not a member of the input alphabet: epsilon transitions are keyed by a
 * {@link Transition} without symbol and are added through the dedicated builder methods.
 * Instances are created by {@link Builder#create()}, which rejects descriptions that break
 * the structural invariants with a {@link MalformedAutomatonException}.
 *
 * @param <S> state type, compared by {@code equals}/{@code hashCode}
 * @param <I> input symbol type
 */
public final class Automaton<S, I> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Automaton.class);

    private final Set<S> states;
    private final Alphabet<I> alphabet;
    private final Set<S> acceptingStates;
    private final S initialState;
    private final Map<Transition<S, I>, Set<S>> transitions;

    // dense IDs, in declaration order
    private final List<S> idToState;
    private final Object2IntMap<S> stateIds;

    private volatile PowersetView<S, I> powersetView;

    private Automaton(Builder<S, I> builder) {
        // own copy: the caller's alphabet may be a growing one
        this.alphabet = Alphabets.fromCollection(new ArrayList<>(builder.alphabet));
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(builder.states));
        this.acceptingStates = Collections.unmodifiableSet(new LinkedHashSet<>(builder.acceptingStates));
        this.initialState = builder.initialState;

        final Map<Transition<S, I>, Set<S>> relation = new LinkedHashMap<>(HashUtil.capacity(builder.transitions.size()));
        for (Map.Entry<Transition<S, I>, Set<S>> e : builder.transitions.entrySet()) {
            relation.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
        }
        this.transitions = Collections.unmodifiableMap(relation);

        this.idToState = List.copyOf(this.states);
        this.stateIds = new Object2IntOpenHashMap<>(this.idToState.size());
        this.stateIds.defaultReturnValue(-1);
        for (int i = 0; i < idToState.size(); i++) {
            stateIds.put(idToState.get(i), i);
        }
    }

    public static <S, I> Builder<S, I> builder(Alphabet<I> alphabet) {
        return new Builder<>(alphabet);
    }

    /**
     * Destinations of a single state on a symbol.
     * @return destination states, empty if no transition is recorded
     */
    public Set<S> move(S state, I symbol) {
        return transitions.getOrDefault(Transition.of(state, symbol), Collections.emptySet());
    }

    /**
     * Union of {@link #move(Object, Object)} over a set of states.
     */
    public Set<S> move(Collection<? extends S> from, I symbol) {
        Objects.requireNonNull(symbol, "symbol");
        final Set<S> result = new LinkedHashSet<>();
        for (S s : from) {
            result.addAll(move(s, symbol));
        }
        return result;
    }

    public Set<S> epsilonMove(S state) {
        return transitions.getOrDefault(Transition.epsilon(state), Collections.emptySet());
    }

    public Set<S> epsilonMove(Collection<? extends S> from) {
        final Set<S> result = new LinkedHashSet<>();
        for (S s : from) {
            result.addAll(epsilonMove(s));
        }
        return result;
    }

    public Set<S> getStates() {
        return states;
    }

    public Alphabet<I> getInputAlphabet() {
        return alphabet;
    }

    public Set<S> getAcceptingStates() {
        return acceptingStates;
    }

    public S getInitialState() {
        return initialState;
    }

    public Map<Transition<S, I>, Set<S>> getTransitions() {
        return transitions;
    }

    public boolean isAccepting(S state) {
        return acceptingStates.contains(state);
    }

    public int size() {
        return states.size();
    }

    /**
     * @return dense ID of a declared state, or -1 if the state is not declared
     */
    public int getStateId(S state) {
        return stateIds.getInt(state);
    }

    public S getState(int id) {
        return idToState.get(id);
    }

    /**
     * An automaton is deterministic if it has no epsilon transition and at most one destination
     * per state and symbol. It need not be complete.
     */
    public boolean isDeterministic() {
        for (Map.Entry<Transition<S, I>, Set<S>> e : transitions.entrySet()) {
            if (e.getKey().isEpsilon() || e.getValue().size() > 1) {
                return false;
            }
        }
        return true;
    }

    /**
     * Epsilon-closure and powerset successor operator of this automaton. Built on first use.
     */
    public PowersetView<S, I> powersetView() {
        PowersetView<S, I> view = this.powersetView;
        if (view == null) {
            view = new PowersetView<>(this);
            this.powersetView = view;
        }
        return view;
    }

    public boolean accepts(Iterable<? extends I> word) {
        return powersetView().accepts(word);
    }

    @Override
    public String toString() {
        return "Automaton{states=" + states + ", alphabet=" + alphabet + ", initial=" + initialState
            + ", accepting=" + acceptingStates + ", transitions=" + transitions + '}';
    }

    /**
     * Mutable description of an {@link Automaton}. States referenced by transitions,
     * the initial state and the accepting states must be declared explicitly.
     */
    public static final class Builder<S, I> {
        private final Alphabet<I> alphabet;
        private final Set<S> states = new LinkedHashSet<>();
        private final Set<S> acceptingStates = new LinkedHashSet<>();
        private final Map<Transition<S, I>, Set<S>> transitions = new LinkedHashMap<>();
        private S initialState;

        private Builder(Alphabet<I> alphabet) {
            this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
        }

        public Builder<S, I> addState(S state) {
            states.add(Objects.requireNonNull(state, "state"));
            return this;
        }

        public Builder<S, I> addStates(Collection<? extends S> newStates) {
            for (S s : newStates) {
                addState(s);
            }
            return this;
        }

        public Builder<S, I> setInitial(S state) {
            this.initialState = Objects.requireNonNull(state, "state");
            return this;
        }

        public Builder<S, I> setAccepting(S state) {
            acceptingStates.add(Objects.requireNonNull(state, "state"));
            return this;
        }

        public Builder<S, I> setAcceptingStates(Collection<? extends S> accepting) {
            for (S s : accepting) {
                setAccepting(s);
            }
            return this;
        }

        public Builder<S, I> addTransition(S from, I symbol, S to) {
            return addTransitions(from, symbol, Collections.singleton(to));
        }

        public Builder<S, I> addTransitions(S from, I symbol, Collection<? extends S> to) {
            return put(Transition.of(from, symbol), to);
        }

        public Builder<S, I> addEpsilonTransition(S from, S to) {
            return addEpsilonTransitions(from, Collections.singleton(to));
        }

        public Builder<S, I> addEpsilonTransitions(S from, Collection<? extends S> to) {
            return put(Transition.epsilon(from), to);
        }

        private Builder<S, I> put(Transition<S, I> key, Collection<? extends S> to) {
            if (to.isEmpty()) {
                return this; // absent key already means "no transition"
            }
            final Set<S> destinations = transitions.computeIfAbsent(key, k -> new LinkedHashSet<>());
            for (S s : to) {
                destinations.add(Objects.requireNonNull(s, "destination state"));
            }
            return this;
        }

        /**
         * Validate the description and create the immutable automaton.
         * @throws MalformedAutomatonException if a structural invariant is broken
         */
        public Automaton<S, I> create() {
            validate();
            final Automaton<S, I> automaton = new Automaton<>(this);
            LOGGER.debug("Created automaton: {} states, {} symbols, {} transition keys",
                automaton.size(), alphabet.size(), automaton.transitions.size());
            return automaton;
        }

        private void validate() {
            for (I symbol : alphabet) {
                if (symbol == null) {
                    throw new MalformedAutomatonException(Violation.EPSILON_IN_ALPHABET,
                        "the input alphabet must not contain the epsilon (null) symbol");
                }
            }
            if (initialState == null) {
                throw new MalformedAutomatonException(Violation.MISSING_INITIAL_STATE, "no initial state set");
            }
            if (!states.contains(initialState)) {
                throw new MalformedAutomatonException(Violation.UNDECLARED_INITIAL_STATE,
                    "initial state " + initialState + " is not a declared state");
            }
            for (S s : acceptingStates) {
                if (!states.contains(s)) {
                    throw new MalformedAutomatonException(Violation.UNDECLARED_ACCEPTING_STATE,
                        "accepting state " + s + " is not a declared state");
                }
            }
            for (Map.Entry<Transition<S, I>, Set<S>> e : transitions.entrySet()) {
                final Transition<S, I> key = e.getKey();
                if (!states.contains(key.state())) {
                    throw new MalformedAutomatonException(Violation.UNDECLARED_TRANSITION_STATE,
                        "transition " + key + " leaves undeclared state " + key.state());
                }
                if (!key.isEpsilon() && !alphabet.contains(key.symbol())) {
                    throw new MalformedAutomatonException(Violation.UNDECLARED_SYMBOL,
                        "transition " + key + " reads symbol " + key.symbol() + " outside the input alphabet");
                }
                for (S to : e.getValue()) {
                    if (!states.contains(to)) {
                        throw new MalformedAutomatonException(Violation.UNDECLARED_TRANSITION_STATE,
                            "transition " + key + " enters undeclared state " + to);
                    }
                }
            }
        }
    }
}
