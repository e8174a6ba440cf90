package com.landscape.connect.audit;

import com.landscape.connect.core.model.MinimumId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only ledger of duplicate-minimum merges. Lets callers holding an id of a
 * merged-away minimum find the minimum that superseded it.
 */
public class MergeLedger {
    private static final Logger log = LoggerFactory.getLogger(MergeLedger.class);

    private final List<MergeRecord> records = new CopyOnWriteArrayList<>();

    public MergeRecord record(MergeRecord mergeRecord) {
        records.add(mergeRecord);
        log.info("Merge recorded: {} -> {} (distance: {}, triggeredBy: {})",
                mergeRecord.dropMinimumId(),
                mergeRecord.keepMinimumId(),
                mergeRecord.distance(),
                mergeRecord.triggeredBy());
        return mergeRecord;
    }

    /**
     * Creates and records a new merge.
     */
    public MergeRecord recordMerge(MinimumId keep, MinimumId drop, Double distance,
                                   String triggeredBy, String reason) {
        return record(MergeRecord.builder()
                .keepMinimumId(keep)
                .dropMinimumId(drop)
                .distance(distance)
                .triggeredBy(triggeredBy)
                .reason(reason)
                .build());
    }

    public List<MergeRecord> getAllRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public List<MergeRecord> getRecordsForKeep(MinimumId keep) {
        return records.stream()
                .filter(r -> r.keepMinimumId().equals(keep))
                .collect(Collectors.toList());
    }

    public int size() {
        return records.size();
    }

    /**
     * Returns the minimum that currently stands for {@code id}, following merges.
     * Ids that were never merged away resolve to themselves.
     */
    public MinimumId resolveCanonical(MinimumId id) {
        MinimumId current = id;
        Set<MinimumId> seen = new HashSet<>();
        while (seen.add(current)) {
            MinimumId next = null;
            for (MergeRecord record : records) {
                if (record.dropMinimumId().equals(current)) {
                    next = record.keepMinimumId();
                }
            }
            if (next == null) {
                return current;
            }
            current = next;
        }
        throw new IllegalStateException("Merge cycle detected starting at minimum " + id);
    }

    /**
     * Returns every minimum merged, directly or transitively, into {@code id}.
     */
    public List<MinimumId> getMergeChain(MinimumId id) {
        List<MinimumId> chain = new ArrayList<>();
        collectMergeChain(id, chain);
        return chain;
    }

    private void collectMergeChain(MinimumId id, List<MinimumId> chain) {
        for (MergeRecord record : getRecordsForKeep(id)) {
            chain.add(record.dropMinimumId());
            collectMergeChain(record.dropMinimumId(), chain);
        }
    }
}
