package NFA2DFA.Registry;

import java.util.BitSet;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

public class AddressRegistry implements Registry {
    private final Object2IntMap<BitSet> key2Address;

    public AddressRegistry() {
        this.key2Address = new Object2IntOpenHashMap<>();
        this.key2Address.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
    }

    @Override
    public int get(BitSet stateSet) {
        return key2Address.getInt(stateSet);
    }

    @Override
    public void put(BitSet stateSet, int stateID) {
        if (stateID < 0) {
            throw new IllegalArgumentException("Negative state ID: " + stateID);
        }
        int previous = key2Address.putIfAbsent(stateSet, stateID);
        if (previous != MISSING_ELEMENT) {
            throw new IllegalStateException("State set " + stateSet + " already registered as " + previous);
        }
    }

    @Override
    public int size() {
        return key2Address.size();
    }

    @Override
    public String toString() {
        return "Address";
    }
}
