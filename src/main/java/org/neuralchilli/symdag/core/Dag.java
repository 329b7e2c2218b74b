package org.neuralchilli.symdag.core;

import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.symdag.domain.DagStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Directed acyclic graph over an opaque key type.
 * Storage is a JGraphT {@link DirectedAcyclicGraph}, which keeps a topological
 * index and refuses any edge that would close a cycle. A refused edge is
 * rolled back together with any endpoint the same call created.
 *
 * @param <K> node key, typically a synthetic id
 */
public class Dag<K> {

    private static final Logger log = LoggerFactory.getLogger(Dag.class);

    private final DirectedAcyclicGraph<K, DefaultEdge> graph = new DirectedAcyclicGraph<>(DefaultEdge.class);
    private final Graph<K, DefaultEdge> view = new AsUnmodifiableGraph<>(graph);

    /**
     * Add a node. No-op if already present.
     */
    public void addNode(K node) {
        Objects.requireNonNull(node, "Node cannot be null");
        graph.addVertex(node);
    }

    /**
     * Remove a node and every edge from or to it. No-op if absent.
     */
    public void removeNode(K node) {
        if (node != null) {
            graph.removeVertex(node);
        }
    }

    /**
     * Add an edge, creating missing endpoints.
     *
     * @throws CycleDetectedException if the edge would create a cycle; the
     *                                graph is left exactly as before the call
     */
    public void addEdge(K source, K target) {
        Objects.requireNonNull(source, "Edge source cannot be null");
        Objects.requireNonNull(target, "Edge target cannot be null");

        boolean sourceAdded = graph.addVertex(source);
        boolean targetAdded = graph.addVertex(target);

        if (graph.containsEdge(source, target)) {
            return;
        }

        try {
            graph.addEdge(source, target);
        } catch (IllegalArgumentException e) {
            // JGraphT rejects self-loops and edges that would induce a cycle
            if (sourceAdded) {
                graph.removeVertex(source);
            }
            if (targetAdded) {
                graph.removeVertex(target);
            }

            log.debug("Rejected edge {} -> {}: would create a cycle", source, target);
            throw new CycleDetectedException(source, target, e);
        }

        log.trace("Added edge: {} -> {}", source, target);
    }

    /**
     * Remove an edge. No-op if absent.
     */
    public void removeEdge(K source, K target) {
        if (hasNode(source) && hasNode(target)) {
            graph.removeEdge(source, target);
        }
    }

    public boolean hasEdge(K source, K target) {
        return hasNode(source) && hasNode(target) && graph.containsEdge(source, target);
    }

    public boolean hasNode(K node) {
        return node != null && graph.containsVertex(node);
    }

    /**
     * All nodes, in insertion order.
     */
    public List<K> getNodes() {
        return List.copyOf(graph.vertexSet());
    }

    /**
     * Direct successors of a node. Empty if the node is absent.
     */
    public List<K> getNeighbors(K node) {
        if (!hasNode(node)) {
            return List.of();
        }
        return Graphs.successorListOf(graph, node);
    }

    /**
     * Direct predecessors of a node. Empty if the node is absent.
     */
    public List<K> getPredecessors(K node) {
        if (!hasNode(node)) {
            return List.of();
        }
        return Graphs.predecessorListOf(graph, node);
    }

    public int getIndegree(K node) {
        return hasNode(node) ? graph.inDegreeOf(node) : 0;
    }

    public int getOutdegree(K node) {
        return hasNode(node) ? graph.outDegreeOf(node) : 0;
    }

    /**
     * Kahn's algorithm via JGraphT: repeatedly remove a node with no remaining
     * incoming edges. For every edge u -> v, u comes before v.
     */
    public List<K> topologicalSort() {
        List<K> order = new ArrayList<>(graph.vertexSet().size());
        TopologicalOrderIterator<K, DefaultEdge> iterator = new TopologicalOrderIterator<>(graph);

        while (iterator.hasNext()) {
            order.add(iterator.next());
        }

        if (order.size() != graph.vertexSet().size()) {
            // Unreachable through the public API
            throw new IllegalStateException("Topological sort failed - graph contains a cycle");
        }

        return order;
    }

    /**
     * Depth-first cycle search over the whole graph.
     * Always false for a graph built through {@link #addEdge}.
     */
    public boolean hasCycle() {
        return new CycleDetector<>(graph).detectCycles();
    }

    /**
     * Nodes with no incoming edges.
     */
    public Set<K> getRoots() {
        Set<K> roots = new LinkedHashSet<>();
        for (K node : graph.vertexSet()) {
            if (graph.inDegreeOf(node) == 0) {
                roots.add(node);
            }
        }
        return roots;
    }

    /**
     * Nodes with no outgoing edges.
     */
    public Set<K> getLeaves() {
        Set<K> leaves = new LinkedHashSet<>();
        for (K node : graph.vertexSet()) {
            if (graph.outDegreeOf(node) == 0) {
                leaves.add(node);
            }
        }
        return leaves;
    }

    /**
     * Kahn layers: each level holds the nodes whose predecessors all sit in earlier levels.
     */
    public List<Set<K>> getLevels() {
        List<Set<K>> levels = new ArrayList<>();
        Map<K, Integer> indegree = new HashMap<>();
        Set<K> current = new LinkedHashSet<>();

        for (K node : graph.vertexSet()) {
            int in = graph.inDegreeOf(node);
            indegree.put(node, in);
            if (in == 0) {
                current.add(node);
            }
        }

        while (!current.isEmpty()) {
            levels.add(current);
            Set<K> next = new LinkedHashSet<>();

            for (K node : current) {
                for (K successor : Graphs.successorListOf(graph, node)) {
                    if (indegree.merge(successor, -1, Integer::sum) == 0) {
                        next.add(successor);
                    }
                }
            }

            current = next;
        }

        return levels;
    }

    public DagStatistics getStatistics() {
        List<Set<K>> levels = getLevels();
        int maxWidth = levels.stream()
                .mapToInt(Set::size)
                .max()
                .orElse(0);

        return new DagStatistics(
                graph.vertexSet().size(),
                graph.edgeSet().size(),
                getRoots().size(),
                getLeaves().size(),
                levels.size(),
                maxWidth
        );
    }

    public int size() {
        return graph.vertexSet().size();
    }

    public int edgeCount() {
        return graph.edgeSet().size();
    }

    public boolean isEmpty() {
        return graph.vertexSet().isEmpty();
    }

    public void clear() {
        graph.removeAllVertices(new ArrayList<>(graph.vertexSet()));
    }

    /**
     * Read-only JGraphT view for traversal-based tooling.
     */
    public Graph<K, DefaultEdge> asGraph() {
        return view;
    }

    @Override
    public String toString() {
        return "Dag[nodes=" + size() + ", edges=" + edgeCount() + "]";
    }
}
