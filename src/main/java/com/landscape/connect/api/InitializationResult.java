package com.landscape.connect.api;

/**
 * Summary of {@link ConnectionPlanner#initialize}.
 *
 * @param startEndDistance distance between the start and end minima
 * @param minimaScanned    minima considered for admission besides the endpoints
 * @param nodesAdmitted    nodes in the distance graph afterwards
 */
public record InitializationResult(double startEndDistance, int minimaScanned, int nodesAdmitted) {
}
