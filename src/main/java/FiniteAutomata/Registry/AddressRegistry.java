package FiniteAutomata.Registry;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Hash-based registry. Keys must not be mutated after registration.
 */
public class AddressRegistry<K> implements Registry<K> {
    private final Object2IntMap<K> key2Address;
    private final IntList stateIDs;

    public AddressRegistry() {
        this.key2Address = new Object2IntOpenHashMap<>();
        this.key2Address.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.stateIDs = new IntArrayList();
    }

    @Override
    public int get(K key) {
        int address = key2Address.getInt(key);
        return address < 0 ? address : this.stateIDs.getInt(address);
    }

    @Override
    public void put(K key, int stateID) {
        int address = key2Address.getInt(key);
        if (address >= 0) {
            this.stateIDs.set(address, stateID);
            return;
        }
        this.key2Address.put(key, this.stateIDs.size());
        this.stateIDs.add(stateID);
    }

    @Override
    public int size() {
        return this.stateIDs.size();
    }

    @Override
    public String toString() {
        return "AddressRegistry [size=" + size() + "]";
    }
}
