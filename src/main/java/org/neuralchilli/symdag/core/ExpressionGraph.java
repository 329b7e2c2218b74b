package org.neuralchilli.symdag.core;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.neuralchilli.symdag.domain.DagStatistics;
import org.neuralchilli.symdag.domain.ExpressionNode;
import org.neuralchilli.symdag.domain.NodeType;
import org.neuralchilli.symdag.domain.NumericValue;
import org.neuralchilli.symdag.domain.OperatorKind;
import org.neuralchilli.symdag.domain.Rational;
import org.neuralchilli.symdag.util.Tokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Expression parsed into a hash-consed DAG.
 * <p>
 * Structurally identical subexpressions are interned to a single node: leaves
 * by symbol or value, operators by operator plus child ids. Nested ADD and
 * MULTIPLY chains are flattened into one n-ary node, and their interning key
 * ignores operand order, so "a+b" and "b+a" share a node. The evaluation
 * order kept for a commutative node is the one it was first built with.
 * <p>
 * Edges point from an operator to its operands. The DAG only knows the set of
 * operands; the authoritative order lives in {@link #childrenOf(String)}.
 * <p>
 * Not thread-safe: parse mutates every table in place.
 */
public class ExpressionGraph {

    private static final Logger log = LoggerFactory.getLogger(ExpressionGraph.class);

    public static final int DEFAULT_MAX_DEPTH = 512;

    private static final ExpressionParser PARSER = new ExpressionParser();
    private static final ExpressionEvaluator EVALUATOR = new ExpressionEvaluator();

    private final int maxDepth;

    private final Dag<String> dag = new Dag<>();
    private final Map<String, ExpressionNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<String>> orderedChildren = new HashMap<>();
    private final Map<String, Integer> depths = new HashMap<>();

    // Construction-time intern tables
    private final Map<String, String> leafIntern = new HashMap<>();
    private final Map<String, String> operatorIntern = new HashMap<>();

    private String root;
    private long idCounter;

    public ExpressionGraph() {
        this(DEFAULT_MAX_DEPTH);
    }

    public ExpressionGraph(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Max depth must be positive, got: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Parse a new graph from the given text.
     */
    public static ExpressionGraph of(String expression) {
        ExpressionGraph graph = new ExpressionGraph();
        graph.parse(expression);
        return graph;
    }

    /**
     * Replace the contents of this graph with the parsed expression.
     *
     * @throws ParseException           if the text is not a well-formed expression;
     *                                  the graph is left empty
     * @throws ExpressionDepthException if nesting exceeds the depth limit;
     *                                  the graph is left empty
     */
    public void parse(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("Expression cannot be null");
        }

        clear();

        try {
            List<String> postfix = PARSER.toPostfix(PARSER.tokenize(expression));
            log.trace("Postfix for '{}': {}", expression, postfix);

            root = fold(postfix);
        } catch (RuntimeException e) {
            clear();
            throw e;
        }

        log.debug("Parsed expression '{}': {} nodes, {} edges, root {}",
                expression, dag.size(), dag.edgeCount(), root);
    }

    private String fold(List<String> postfix) {
        Deque<String> stack = new ArrayDeque<>();

        for (String token : postfix) {
            if (Tokens.isNumber(token)) {
                stack.push(internConstant(token, Tokens.parseNumber(token)));
                continue;
            }

            OperatorKind op = OperatorKind.fromToken(token);

            if (op == OperatorKind.NONE) {
                if (!Tokens.isVariable(token)) {
                    throw new ParseException(
                            ParseException.Reason.UNKNOWN_TOKEN,
                            "Unknown token: " + token,
                            token
                    );
                }
                stack.push(internVariable(token));
            } else if (op.isUnary()) {
                if (stack.isEmpty()) {
                    throw new ParseException(
                            ParseException.Reason.MISSING_OPERAND,
                            "Unary operator '" + token + "' has no operand",
                            token
                    );
                }
                String operand = stack.pop();
                stack.push(internOperator(op, List.of(operand)));
            } else {
                if (stack.size() < 2) {
                    throw new ParseException(
                            ParseException.Reason.MISSING_OPERAND,
                            "Binary operator '" + token + "' requires two operands",
                            token
                    );
                }
                String right = stack.pop();
                String left = stack.pop();
                stack.push(internOperator(op, List.of(left, right)));
            }
        }

        if (stack.size() != 1) {
            throw new ParseException(
                    ParseException.Reason.MULTIPLE_ROOTS,
                    stack.isEmpty()
                            ? "Invalid expression: nothing to parse"
                            : "Invalid expression: " + stack.size() + " disconnected subexpressions"
            );
        }

        return stack.pop();
    }

    /**
     * Add (or find) a variable leaf.
     *
     * @return id of the interned node
     */
    public String addVariable(String name) {
        if (!Tokens.isVariable(name) || OperatorKind.isOperatorToken(name)) {
            throw new IllegalArgumentException("Not a valid variable name: " + name);
        }
        return internVariable(name);
    }

    /**
     * Add (or find) a constant leaf.
     *
     * @return id of the interned node
     */
    public String addConstant(NumericValue value) {
        if (value == null) {
            throw new IllegalArgumentException("Constant value cannot be null");
        }
        NumericValue normalized = value.normalize();
        return internConstant(normalized.render(), normalized);
    }

    /**
     * Add (or find) an operator over existing nodes, in evaluation order.
     *
     * @return id of the interned node, which may be an existing one
     * @throws NodeNotFoundException if an operand id is not in this graph
     */
    public String addOperator(OperatorKind op, List<String> operands) {
        if (op == null || op == OperatorKind.NONE) {
            throw new IllegalArgumentException("Operator cannot be null or NONE");
        }
        if (operands == null || !op.acceptsArity(operands.size())) {
            throw new IllegalArgumentException(
                    "Operator " + op + " does not accept " + (operands == null ? 0 : operands.size()) + " operand(s)"
            );
        }
        for (String operand : operands) {
            if (!nodes.containsKey(operand)) {
                throw new NodeNotFoundException(operand);
            }
        }
        return internOperator(op, operands);
    }

    /**
     * Make an existing node the expression root.
     */
    public void setRoot(String id) {
        if (!nodes.containsKey(id)) {
            throw new NodeNotFoundException(id);
        }
        root = id;
    }

    String internVariable(String name) {
        return internLeaf("var:" + name, ExpressionNode.variable(name));
    }

    String internConstant(String symbol, NumericValue value) {
        return internLeaf("const:" + value.render(), ExpressionNode.constant(symbol, value));
    }

    String internConstant(NumericValue value) {
        NumericValue normalized = value.normalize();
        return internConstant(normalized.render(), normalized);
    }

    private String internLeaf(String key, ExpressionNode node) {
        String existing = leafIntern.get(key);
        if (existing != null) {
            return existing;
        }

        String id = nextId();
        nodes.put(id, node);
        depths.put(id, 1);
        dag.addNode(id);
        leafIntern.put(key, id);

        log.trace("Interned leaf {} as {}", key, id);
        return id;
    }

    /**
     * Intern an operator node. ADD and MULTIPLY operands that are themselves
     * the same operator are replaced by their own operands first.
     */
    String internOperator(OperatorKind op, List<String> operands) {
        List<String> ordered = op.isAssociative() ? flatten(op, operands) : List.copyOf(operands);

        String key = operatorKey(op, ordered);
        String existing = operatorIntern.get(key);
        if (existing != null) {
            return existing;
        }

        int depth = 1;
        for (String child : ordered) {
            depth = Math.max(depth, depths.get(child) + 1);
        }
        if (depth > maxDepth) {
            throw new ExpressionDepthException(maxDepth);
        }

        String id = nextId();
        nodes.put(id, ExpressionNode.operator(op));
        depths.put(id, depth);
        dag.addNode(id);
        orderedChildren.put(id, List.copyOf(ordered));

        for (String child : ordered) {
            dag.addEdge(id, child);
        }

        operatorIntern.put(key, id);

        log.trace("Interned operator {} as {}", key, id);
        return id;
    }

    private List<String> flatten(OperatorKind op, List<String> operands) {
        List<String> flat = new ArrayList<>();

        for (String child : operands) {
            ExpressionNode node = nodes.get(child);
            List<String> grandchildren = orderedChildren.get(child);

            if (node != null && node.operator() == op && !node.unary() && grandchildren != null) {
                flat.addAll(grandchildren);
            } else {
                flat.add(child);
            }
        }

        return flat;
    }

    private String operatorKey(OperatorKind op, List<String> operands) {
        List<String> ids = operands;
        if (op.isCommutative()) {
            ids = new ArrayList<>(operands);
            Collections.sort(ids);
        }
        return op.name() + "|" + String.join(",", ids);
    }

    private String nextId() {
        return "node_" + (++idCounter);
    }

    /**
     * Evaluate with no variable bindings.
     */
    public double evaluate() {
        return evaluate(Map.of());
    }

    /**
     * Evaluate in floating point.
     *
     * @throws EvaluationException if nothing is parsed, a variable is unbound,
     *                             or a division by zero occurs
     */
    public double evaluate(Map<String, Double> bindings) {
        return EVALUATOR.evaluate(this, bindings);
    }

    public NumericValue evaluateExact() {
        return evaluateExact(Map.of());
    }

    /**
     * Evaluate keeping integers and rationals exact where possible.
     *
     * @throws EvaluationException                                        as {@link #evaluate(Map)}
     * @throws org.neuralchilli.symdag.domain.RationalArithmeticException if exact arithmetic overflows
     */
    public NumericValue evaluateExact(Map<String, NumericValue> bindings) {
        return EVALUATOR.evaluateExact(this, bindings);
    }

    /**
     * Check if the expression is variable-free and evaluates to an exact value.
     */
    public boolean isRationalExpression() {
        if (root == null || !reachableOfType(NodeType.VARIABLE).isEmpty()) {
            return false;
        }
        try {
            return evaluateExact().isExact();
        } catch (EvaluationException | ArithmeticException e) {
            log.debug("Expression is not rational: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Exact value of a variable-free expression.
     *
     * @throws IllegalStateException if the expression has no exact value
     */
    public Rational toRational() {
        NumericValue value = evaluateExact();
        if (!value.isExact()) {
            throw new IllegalStateException("Expression has no exact rational value: " + value.render());
        }
        return value.toRational();
    }

    /**
     * Rebuild this expression in a fresh graph through the interning routines.
     * Every sharing opportunity is realized and nodes unreachable from the
     * root (such as chains absorbed by flattening) are dropped.
     */
    public ExpressionGraph canonicalize() {
        String start = requireRoot();

        ExpressionGraph out = new ExpressionGraph(maxDepth);
        Map<String, String> cloned = new HashMap<>();
        out.root = cloneInto(out, start, cloned);

        log.debug("Canonicalized graph: {} -> {} nodes", size(), out.size());
        return out;
    }

    private String cloneInto(ExpressionGraph out, String id, Map<String, String> cloned) {
        String done = cloned.get(id);
        if (done != null) {
            return done;
        }

        ExpressionNode node = requireNode(id);
        String copy;

        if (node.isVariable()) {
            copy = out.internVariable(node.symbol());
        } else if (node.isConstant()) {
            copy = out.internConstant(node.symbol(), node.value());
        } else {
            List<String> operands = new ArrayList<>();
            for (String child : childrenOf(id)) {
                operands.add(cloneInto(out, child, cloned));
            }
            copy = out.internOperator(node.operator(), operands);
        }

        cloned.put(id, copy);
        return copy;
    }

    /**
     * Fold constant subexpressions into a fresh graph. Intermediate constants
     * produced while folding are not kept.
     */
    public ExpressionGraph simplify() {
        requireRoot();
        ExpressionGraph folded = new ExpressionGraph(maxDepth);
        folded.root = new ConstantFolder(this, folded).fold(root);
        ExpressionGraph out = folded.canonicalize();

        log.debug("Simplified graph: {} -> {} nodes", size(), out.size());
        return out;
    }

    String requireRoot() {
        if (root == null) {
            throw EvaluationException.emptyExpression();
        }
        return root;
    }

    ExpressionNode requireNode(String id) {
        ExpressionNode node = nodes.get(id);
        if (node == null) {
            throw new NodeNotFoundException(id);
        }
        return node;
    }

    public Optional<String> getRoot() {
        return Optional.ofNullable(root);
    }

    public Optional<ExpressionNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * Operands of a node in evaluation order. Empty for leaves.
     *
     * @throws NodeNotFoundException if the id is not in this graph
     */
    public List<String> childrenOf(String id) {
        if (!nodes.containsKey(id)) {
            throw new NodeNotFoundException(id);
        }
        return orderedChildren.getOrDefault(id, List.of());
    }

    /**
     * Variable names in this graph, in creation order.
     */
    public List<String> getVariables() {
        return symbolsOf(NodeType.VARIABLE);
    }

    /**
     * Constant symbols in this graph, in creation order.
     */
    public List<String> getConstants() {
        return symbolsOf(NodeType.CONSTANT);
    }

    /**
     * Operator symbols in this graph, in creation order.
     */
    public List<String> getOperators() {
        return symbolsOf(NodeType.OPERATOR);
    }

    private List<String> symbolsOf(NodeType type) {
        return nodes.values().stream()
                .filter(node -> node.type() == type)
                .map(ExpressionNode::symbol)
                .collect(Collectors.toList());
    }

    private Set<String> reachableOfType(NodeType type) {
        Set<String> found = new LinkedHashSet<>();
        Set<String> seen = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(root);

        while (!pending.isEmpty()) {
            String id = pending.pop();
            if (!seen.add(id)) {
                continue;
            }
            if (nodes.get(id).type() == type) {
                found.add(id);
            }
            childrenOf(id).forEach(pending::push);
        }

        return found;
    }

    /**
     * Check if a root is set, the graph is non-empty and it is acyclic.
     */
    public boolean isValid() {
        return root != null && nodes.containsKey(root) && !dag.isEmpty() && !dag.hasCycle();
    }

    public int size() {
        return dag.size();
    }

    public boolean isEmpty() {
        return dag.isEmpty();
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Read-only view of the underlying DAG, operator -> operand edges.
     */
    public Graph<String, DefaultEdge> getGraph() {
        return dag.asGraph();
    }

    public List<String> topologicalOrder() {
        return dag.topologicalSort();
    }

    public DagStatistics getStatistics() {
        return dag.getStatistics();
    }

    /**
     * Reset every table at once.
     */
    public void clear() {
        dag.clear();
        nodes.clear();
        orderedChildren.clear();
        depths.clear();
        leafIntern.clear();
        operatorIntern.clear();
        root = null;
        idCounter = 0;
    }

    @Override
    public String toString() {
        return "ExpressionGraph[nodes=" + size() + ", root=" + root + "]";
    }
}
