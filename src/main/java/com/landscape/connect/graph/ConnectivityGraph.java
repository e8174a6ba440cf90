package com.landscape.connect.graph;

import com.landscape.connect.core.model.MinimumId;

import java.util.Set;

/**
 * Read contract over the graph of minima joined by known transition states.
 * The graph is mutated by the driver independently of the distance graph.
 */
public interface ConnectivityGraph {

    /**
     * Returns true if a chain of known transition states joins the two minima.
     * A minimum is always connected to itself. Unknown minima are connected to nothing else.
     */
    boolean areConnected(MinimumId a, MinimumId b);

    /**
     * Returns the connected component containing {@code minimum}; a singleton if the
     * minimum is unknown or isolated.
     */
    Set<MinimumId> connectedComponent(MinimumId minimum);

    /**
     * Checks whether the minimum is a node of this graph.
     */
    boolean contains(MinimumId minimum);

    /**
     * Returns all minima known to the graph.
     */
    Set<MinimumId> minima();
}
