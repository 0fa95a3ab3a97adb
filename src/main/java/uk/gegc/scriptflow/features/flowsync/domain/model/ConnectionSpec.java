package uk.gegc.scriptflow.features.flowsync.domain.model;

/**
 * Connection between two entries of a flattened node list, addressed by their global index.
 */
public record ConnectionSpec(int sourceIndex, String sourcePin, int targetIndex, String targetPin) {
}
