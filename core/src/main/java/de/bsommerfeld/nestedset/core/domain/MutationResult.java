package de.bsommerfeld.nestedset.core.domain;

/**
 * Outcome of an explicit mutation.
 *
 * @param nodeId id of the mutated node
 * @param moved  whether any bound actually changed
 * @param bounds the node's committed position
 */
public record MutationResult(long nodeId, boolean moved, NodeBounds bounds) {
}
