package NFA2DFA.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A state of the determinized automaton: a non-empty set of original NFA states.
 * Two DFA states are the same iff their underlying sets are equal.
 * @param states underlying NFA states, unmodifiable
 * @param <S> NFA state type
 */
public record DFAState<S>(Set<S> states) {

    public DFAState {
        if (states.isEmpty()) {
            throw new IllegalArgumentException("DFA state must contain at least one NFA state");
        }
        states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
    }

    public boolean contains(S state) {
        return states.contains(state);
    }

    public int size() {
        return states.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (S s : sortedMembers()) {
            sb.append(' ').append(s);
        }
        return sb.append(" }").toString();
    }

    // natural order if the members are mutually comparable, insertion order otherwise
    private List<S> sortedMembers() {
        final List<S> members = new ArrayList<>(states);
        try {
            members.sort(null);
        } catch (ClassCastException e) {
            return new ArrayList<>(states);
        }
        return members;
    }
}
