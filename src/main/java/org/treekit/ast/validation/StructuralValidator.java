package org.treekit.ast.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treekit.ast.core.Node;
import org.treekit.ast.diagnostics.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A cycle-safe validator.
 * <p>
 * Each run tracks every node by identity as {@link VisitState#UNVISITED},
 * {@link VisitState#IN_PROGRESS} or {@link VisitState#DONE}. A child that is still in progress
 * closes a cycle: the validator reports one ERROR diagnostic for it and does not descend into the
 * child again. A child that is already done was reached through a second path (a shared leaf, for
 * example) and is walked again, which is harmless because it cannot lead back into the current
 * path.
 * <p>
 * The reported cycle path is the in-progress walk stack from the repeated node down to the node
 * whose child closed the cycle. Every back edge yields its own diagnostic, but overlapping cycles
 * that share a back edge are reported once, through whichever path the walk took first.
 */
public class StructuralValidator extends NodeValidator {

    private static final Logger LOG = LoggerFactory.getLogger(StructuralValidator.class);

    static final String CYCLE_MESSAGE = "Circular reference detected in AST";
    static final String CYCLE_HELP = "AST nodes should form a tree structure without cycles";

    private final Map<Node, VisitState> states = new IdentityHashMap<>();
    private final List<Node> path = new ArrayList<>();
    private final List<List<Node>> cycles = new ArrayList<>();
    private final List<Diagnostic> structural = new ArrayList<>();

    /**
     * Validates the graph rooted at {@code root}, detecting cycles. Findings accumulate like in
     * {@link NodeValidator#validate(Node)}; visit states are reset for every run.
     *
     * @param root The root node.
     */
    @Override
    public void validate(Node root) {
        states.clear();
        path.clear();
        walk(root);
    }

    private void walk(Node node) {
        states.put(node, VisitState.IN_PROGRESS);
        path.add(node);
        check(node);

        for (Node child : node.children()) {
            if (stateOf(child) == VisitState.IN_PROGRESS) {
                reportCycle(child);
            } else {
                walk(child);
            }
        }

        path.remove(path.size() - 1);
        states.put(node, VisitState.DONE);
    }

    private void reportCycle(Node repeated) {
        int start = indexOnPath(repeated);
        List<Node> cycle = new ArrayList<>(path.subList(start, path.size()));
        cycle.add(repeated);
        cycles.add(Collections.unmodifiableList(cycle));

        Diagnostic.Builder builder = Diagnostic.error(CYCLE_MESSAGE)
                .primary(repeated.span(), "cycle starts and ends here")
                .help(CYCLE_HELP);
        for (int i = 0; i < cycle.size(); i++) {
            Node step = cycle.get(i);
            if (step != repeated) {
                builder.secondary(step.span(), "part of cycle (step " + (i + 1) + ")");
            }
        }
        Diagnostic diagnostic = builder.build();
        structural.add(diagnostic);
        diagnostics().report(diagnostic);
        LOG.debug("Cycle of length {} detected at {}", cycle.size() - 1, repeated.span());
    }

    private int indexOnPath(Node node) {
        for (int i = 0; i < path.size(); i++) {
            if (path.get(i) == node) {
                return i;
            }
        }
        throw new IllegalStateException("In-progress node is not on the walk path");
    }

    /**
     * @param node A node of the last run.
     * @return Its state; {@link VisitState#UNVISITED} for nodes the run never reached.
     */
    public VisitState stateOf(Node node) {
        return states.getOrDefault(node, VisitState.UNVISITED);
    }

    /**
     * @return The detected cycle paths; each starts and ends with the repeated node.
     */
    public List<List<Node>> cycles() {
        return Collections.unmodifiableList(cycles);
    }

    /**
     * @return The cycle diagnostics.
     */
    public List<Diagnostic> structuralDiagnostics() {
        return Collections.unmodifiableList(structural);
    }

    /**
     * @return The diagnostics produced by node hooks and rules.
     */
    public List<Diagnostic> customDiagnostics() {
        Set<Diagnostic> cycleFindings = Collections.newSetFromMap(new IdentityHashMap<>());
        cycleFindings.addAll(structural);
        List<Diagnostic> custom = new ArrayList<>();
        for (Diagnostic d : getDiagnostics()) {
            if (!cycleFindings.contains(d)) {
                custom.add(d);
            }
        }
        return custom;
    }

    /**
     * @return Custom diagnostics followed by structural diagnostics.
     */
    public List<Diagnostic> allDiagnostics() {
        List<Diagnostic> all = customDiagnostics();
        all.addAll(structural);
        return all;
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    @Override
    public void clear() {
        super.clear();
        states.clear();
        path.clear();
        cycles.clear();
        structural.clear();
    }
}
