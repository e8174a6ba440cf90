package com.landscape.connect.storage;

import com.landscape.connect.core.model.DistanceEntry;
import com.landscape.connect.core.model.Minimum;
import com.landscape.connect.core.model.MinimumId;
import com.landscape.connect.core.model.TransitionState;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Narrow persistence contract for minima, transition states and computed distances.
 * Writes issued while a transaction from {@link #begin()} is active belong to it.
 */
public interface EntityStore extends TransactionScope {

    Optional<Minimum> getMinimum(MinimumId id);

    /**
     * Returns the minimum or throws if it is unknown.
     *
     * @throws StoreException if no minimum has this id
     */
    default Minimum requireMinimum(MinimumId id) {
        return getMinimum(id).orElseThrow(() -> new StoreException("Unknown minimum: " + id));
    }

    List<Minimum> minima();

    void addMinimum(Minimum minimum);

    void addTransitionState(TransitionState transitionState);

    List<TransitionState> transitionStates();

    /**
     * Writes many distances in one call. Existing entries for the same pair are kept.
     */
    void bulkWriteDistances(Collection<DistanceEntry> entries);

    default void writeDistance(DistanceEntry entry) {
        bulkWriteDistances(List.of(entry));
    }

    /**
     * Returns every persisted distance entry.
     */
    List<DistanceEntry> allDistances();

    /**
     * Removes {@code drop} and rewrites its transition states and distances onto {@code keep}.
     * Where {@code keep} already has a distance to the same partner, that value is kept.
     *
     * @return the transition states that referenced {@code drop}, after rewriting
     */
    List<TransitionState> mergeMinimum(MinimumId keep, MinimumId drop);
}
