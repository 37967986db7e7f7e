package de.bsommerfeld.nestedset.db;

/**
 * Thrown when a node is looked up by id and no such row exists.
 */
public class NodeNotFoundException extends RuntimeException {

    private final long nodeId;

    public NodeNotFoundException(long nodeId) {
        super("No tree node with id " + nodeId);
        this.nodeId = nodeId;
    }

    public long getNodeId() {
        return nodeId;
    }
}
