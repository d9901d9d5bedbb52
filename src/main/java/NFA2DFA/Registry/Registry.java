package NFA2DFA.Registry;

import java.util.BitSet;

public interface Registry {
    int MISSING_ELEMENT = -1;

    /**
     * Get the DFA state ID registered for a set of NFA states.
     * @param stateSet NFA state IDs
     * @return DFA state ID or MISSING_ELEMENT if the set was never registered.
     */
    int get(BitSet stateSet);

    /**
     * Register a new set of NFA states under a (fixed) DFA state ID.
     * The set must not be mutated afterwards.
     * @param stateSet NFA state IDs
     * @param stateID DFA state ID
     */
    void put(BitSet stateSet, int stateID);

    /**
     * @return number of registered sets
     */
    int size();
}
