package com.landscape.connect.storage;

import com.landscape.connect.core.model.DistanceEntry;
import com.landscape.connect.core.model.Minimum;
import com.landscape.connect.core.model.MinimumId;
import com.landscape.connect.core.model.MinimumPair;
import com.landscape.connect.core.model.TransitionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of {@link EntityStore} with single-level transactions.
 *
 * <p>Outside a transaction every write is applied immediately. While a transaction is
 * active, writes are staged and become visible to readers of this store at once, but
 * are only kept if the transaction commits. Thread-safe via synchronization.</p>
 */
public class InMemoryEntityStore implements EntityStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEntityStore.class);

    private final Map<MinimumId, Minimum> minima = new LinkedHashMap<>();
    private final Map<Long, TransitionState> transitionStates = new LinkedHashMap<>();
    private final Map<MinimumPair, Double> distances = new LinkedHashMap<>();

    private Transaction active;
    private long bulkWrites;

    @Override
    public synchronized StoreTransaction begin() {
        if (active != null) {
            throw new StoreException("A transaction is already active on this store");
        }
        active = new Transaction();
        return active;
    }

    @Override
    public synchronized Optional<Minimum> getMinimum(MinimumId id) {
        if (active != null && active.minima.containsKey(id)) {
            return Optional.of(active.minima.get(id));
        }
        return Optional.ofNullable(minima.get(id));
    }

    @Override
    public synchronized List<Minimum> minima() {
        List<Minimum> result = new ArrayList<>(minima.values());
        if (active != null) {
            active.minima.values().stream()
                    .filter(m -> !minima.containsKey(m.getId()))
                    .forEach(result::add);
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public synchronized void addMinimum(Minimum minimum) {
        if (active != null) {
            active.minima.put(minimum.getId(), minimum);
        } else {
            minima.put(minimum.getId(), minimum);
        }
    }

    @Override
    public synchronized void addTransitionState(TransitionState transitionState) {
        if (active != null) {
            active.transitionStates.put(transitionState.id(), transitionState);
        } else {
            transitionStates.put(transitionState.id(), transitionState);
        }
    }

    @Override
    public synchronized List<TransitionState> transitionStates() {
        List<TransitionState> result = new ArrayList<>(transitionStates.values());
        if (active != null) {
            result.addAll(active.transitionStates.values());
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public synchronized void bulkWriteDistances(Collection<DistanceEntry> entries) {
        Map<MinimumPair, Double> target = active != null ? active.distances : distances;
        for (DistanceEntry entry : entries) {
            if (!distances.containsKey(entry.pair())) {
                target.putIfAbsent(entry.pair(), entry.distance());
            }
        }
        bulkWrites++;
        log.debug("store.distancesWritten count={} transactional={}", entries.size(), active != null);
    }

    @Override
    public synchronized List<DistanceEntry> allDistances() {
        List<DistanceEntry> result = new ArrayList<>(distances.size());
        distances.forEach((pair, d) -> result.add(new DistanceEntry(pair, d)));
        if (active != null) {
            active.distances.forEach((pair, d) -> result.add(new DistanceEntry(pair, d)));
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public synchronized List<TransitionState> mergeMinimum(MinimumId keep, MinimumId drop) {
        if (active != null) {
            throw new StoreException("Minima cannot be merged inside an open transaction");
        }
        if (keep.equals(drop)) {
            throw new IllegalArgumentException("Cannot merge a minimum into itself: " + keep);
        }
        if (!minima.containsKey(keep)) {
            throw new StoreException("Unknown minimum to keep: " + keep);
        }
        minima.remove(drop);

        List<TransitionState> repointed = new ArrayList<>();
        for (Map.Entry<Long, TransitionState> entry : transitionStates.entrySet()) {
            TransitionState ts = entry.getValue();
            if (ts.touches(drop)) {
                TransitionState moved = ts.repoint(drop, keep);
                entry.setValue(moved);
                repointed.add(moved);
            }
        }

        Map<MinimumPair, Double> moved = new LinkedHashMap<>();
        Iterator<Map.Entry<MinimumPair, Double>> it = distances.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<MinimumPair, Double> entry = it.next();
            MinimumPair pair = entry.getKey();
            if (!pair.contains(drop)) {
                continue;
            }
            it.remove();
            MinimumId partner = pair.other(drop);
            if (!partner.equals(keep)) {
                moved.put(MinimumPair.of(keep, partner), entry.getValue());
            }
        }
        moved.forEach(distances::putIfAbsent);

        log.info("store.minimumMerged keep={} drop={} transitionStates={}", keep, drop, repointed.size());
        return repointed;
    }

    /**
     * Returns the distance persisted for the pair, ignoring any open transaction.
     */
    public synchronized Optional<Double> committedDistance(MinimumId a, MinimumId b) {
        return Optional.ofNullable(distances.get(MinimumPair.of(a, b)));
    }

    public synchronized int committedDistanceCount() {
        return distances.size();
    }

    /**
     * Returns how many bulk distance writes were issued.
     */
    public synchronized long bulkWriteCount() {
        return bulkWrites;
    }

    public synchronized boolean inTransaction() {
        return active != null;
    }

    private final class Transaction implements StoreTransaction {
        private final Map<MinimumId, Minimum> minima = new LinkedHashMap<>();
        private final Map<Long, TransitionState> transitionStates = new LinkedHashMap<>();
        private final Map<MinimumPair, Double> distances = new LinkedHashMap<>();
        private boolean open = true;

        @Override
        public void commit() {
            synchronized (InMemoryEntityStore.this) {
                ensureOpen();
                InMemoryEntityStore.this.minima.putAll(minima);
                InMemoryEntityStore.this.transitionStates.putAll(transitionStates);
                distances.forEach(InMemoryEntityStore.this.distances::putIfAbsent);
                log.debug("store.committed minima={} transitionStates={} distances={}",
                        minima.size(), transitionStates.size(), distances.size());
                finish();
            }
        }

        @Override
        public void rollback() {
            synchronized (InMemoryEntityStore.this) {
                ensureOpen();
                log.debug("store.rolledBack minima={} transitionStates={} distances={}",
                        minima.size(), transitionStates.size(), distances.size());
                finish();
            }
        }

        @Override
        public boolean isActive() {
            synchronized (InMemoryEntityStore.this) {
                return open;
            }
        }

        private void ensureOpen() {
            if (!open) {
                throw new IllegalStateException("Transaction is already closed");
            }
        }

        private void finish() {
            open = false;
            active = null;
        }
    }
}
