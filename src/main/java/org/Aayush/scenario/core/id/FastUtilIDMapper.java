package org.Aayush.scenario.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * {@link IDMapper} backed by a fastutil open hash map.
 *
 * <p>Immutable after construction and safe for concurrent reads.</p>
 */
public class FastUtilIDMapper implements IDMapper {

    private static final int MISSING = -1;

    // String -> index, no boxing on lookup
    private final Object2IntOpenHashMap<String> forward;
    private final String[] reverse;

    /**
     * Builds the mapper, assigning index {@code i} to {@code orderedIds.get(i)}.
     *
     * @param orderedIds distinct, non-null ids.
     * @throws IllegalArgumentException on null input, null ids or duplicates.
     */
    public FastUtilIDMapper(List<String> orderedIds) {
        if (orderedIds == null) {
            throw new IllegalArgumentException("orderedIds cannot be null");
        }
        int size = orderedIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (int i = 0; i < size; i++) {
            String id = orderedIds.get(i);
            if (id == null) {
                throw new IllegalArgumentException("id at position " + i + " is null");
            }
            if (forward.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate id detected: " + id);
            }
            forward.put(id, i);
            reverse[i] = id;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String externalId) {
        if (externalId == null) {
            throw new IllegalArgumentException("externalId cannot be null");
        }
        int index = forward.getInt(externalId);
        if (index == MISSING) {
            throw new UnknownIDException("Unknown id: " + externalId);
        }
        return index;
    }

    @Override
    public String toExternal(int internalId) {
        if (internalId < 0 || internalId >= reverse.length) {
            throw new IndexOutOfBoundsException("Index out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String externalId) {
        return externalId != null && forward.containsKey(externalId);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
