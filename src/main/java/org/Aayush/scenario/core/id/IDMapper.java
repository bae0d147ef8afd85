package org.Aayush.scenario.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping between graph string ids and dense integer indices.
 *
 * <p>Indices follow the order in which ids were supplied, so iteration over
 * {@code 0..size-1} replays the source document order. The path search relies on
 * that to keep equal-cost tie-breaks reproducible.</p>
 */
public interface IDMapper {

    /**
     * Converts a graph id to its dense index.
     *
     * @param externalId node or edge id as found in the network description.
     * @return dense index in {@code [0, size)}.
     * @throws UnknownIDException if the id was never registered.
     */
    int toInternal(String externalId);

    /**
     * Converts a dense index back to its graph id.
     *
     * @param internalId dense index.
     * @return the id registered at that index.
     * @throws IndexOutOfBoundsException if the index is outside {@code [0, size)}.
     */
    String toExternal(int internalId);

    /**
     * Checks whether a graph id has been registered.
     */
    boolean containsExternal(String externalId);

    /**
     * Returns the number of registered ids.
     */
    int size();

    /**
     * Raised when an id cannot be found in the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Creates the default immutable implementation, assigning indices in list order.
     *
     * @param orderedIds distinct, non-null ids.
     * @return immutable mapper.
     */
    static IDMapper ofOrdered(List<String> orderedIds) {
        return new FastUtilIDMapper(orderedIds);
    }
}
