package com.landscape.connect.cache;

import com.landscape.connect.core.model.MinimumId;

/**
 * Listener for duplicate-minimum merges. Implementations repoint any state that
 * references the dropped minimum.
 */
public interface MergeListener {

    /**
     * Called after {@code drop} has been folded into {@code keep}.
     */
    void onMerge(MinimumId keep, MinimumId drop);
}
