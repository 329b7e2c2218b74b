package org.neuralchilli.symdag.core;

/**
 * Thrown when adding an edge would create a cycle in a {@link Dag}.
 * Carries the rejected edge; the DAG is rolled back to its state before the call.
 */
public class CycleDetectedException extends RuntimeException {

    private final Object source;
    private final Object target;

    public CycleDetectedException(Object source, Object target) {
        this(source, target, null);
    }

    public CycleDetectedException(Object source, Object target, Throwable cause) {
        super("Adding edge '" + source + "' -> '" + target + "' would create a cycle in the DAG", cause);
        this.source = source;
        this.target = target;
    }

    /**
     * Source endpoint of the rejected edge.
     */
    public Object source() {
        return source;
    }

    public Object target() {
        return target;
    }

    public boolean isSelfLoop() {
        return source != null && source.equals(target);
    }
}
