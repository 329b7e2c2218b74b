package org.neuralchilli.symdag.core;

/**
 * Thrown when a node id is referenced that the graph does not contain.
 */
public class NodeNotFoundException extends RuntimeException {

    private final String nodeId;

    public NodeNotFoundException(String nodeId) {
        super("Node not found: " + nodeId);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
