package org.treekit.ast.validation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.treekit.ast.diagnostics.Diagnostic;
import org.treekit.ast.diagnostics.Label;
import org.treekit.ast.diagnostics.Severity;
import org.treekit.ast.testing.GraphNode;
import org.treekit.junit.extensions.logging.ExpectLog;
import org.treekit.junit.extensions.logging.LogLevel;
import org.treekit.junit.extensions.logging.LogWatchExtension;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class StructuralValidatorTest {

    private StructuralValidator validator;

    @BeforeEach
    void setUp() {
        validator = new StructuralValidator();
    }

    @Test
    void acyclicTreeHasNoCycleDiagnostics() {
        GraphNode root = new GraphNode("root", 0);
        GraphNode left = new GraphNode("left", 1);
        GraphNode right = new GraphNode("right", 2);
        root.add(left.add(new GraphNode("leaf", 3))).add(right);

        validator.validate(root);

        assertThat(validator.structuralDiagnostics()).isEmpty();
        assertThat(validator.hasCycles()).isFalse();
        assertThat(validator.isValid()).isTrue();
        assertThat(validator.stateOf(root)).isEqualTo(VisitState.DONE);
        assertThat(validator.stateOf(left)).isEqualTo(VisitState.DONE);
    }

    @Test
    @ExpectLog(level = LogLevel.DEBUG, loggerPattern = ".*StructuralValidator", messagePattern = "Cycle of length 2 detected.*")
    void twoNodeCycleIsReportedOnce() {
        GraphNode a = new GraphNode("A", 0);
        GraphNode b = new GraphNode("B", 1);
        a.add(b);
        b.add(a);

        validator.validate(a);

        assertThat(validator.structuralDiagnostics()).hasSize(1);
        assertThat(validator.cycles()).singleElement().satisfies(path -> assertThat(path).containsExactly(a, b, a));
        Diagnostic cycle = validator.structuralDiagnostics().get(0);
        assertThat(cycle.severity()).isEqualTo(Severity.ERROR);
        assertThat(cycle.message()).isEqualTo("Circular reference detected in AST");
        assertThat(cycle.primarySpan()).contains(a.span());
        assertThat(cycle.labels().get(0).message()).isEqualTo("cycle starts and ends here");
        assertThat(cycle.secondaryLabels()).extracting(Label::message).containsExactly("part of cycle (step 2)");
        assertThat(cycle.secondaryLabels()).extracting(Label::span).containsExactly(b.span());
        assertThat(cycle.helpText()).contains("AST nodes should form a tree structure without cycles");
        assertThat(validator.isValid()).isFalse();
    }

    @Test
    void selfLoopIsACycle() {
        GraphNode a = new GraphNode("A", 0);
        a.add(a);

        validator.validate(a);

        assertThat(validator.cycles()).singleElement().satisfies(path -> assertThat(path).containsExactly(a, a));
        assertThat(validator.structuralDiagnostics().get(0).labels()).hasSize(1);
    }

    @Test
    void cycleBelowTheRootStartsAtTheRepeatedNode() {
        GraphNode a = new GraphNode("A", 0);
        GraphNode b = new GraphNode("B", 1);
        GraphNode c = new GraphNode("C", 2);
        a.add(b);
        b.add(c);
        c.add(b);

        validator.validate(a);

        assertThat(validator.structuralDiagnostics()).hasSize(1);
        assertThat(validator.cycles().get(0)).containsExactly(b, c, b);
        Diagnostic cycle = validator.structuralDiagnostics().get(0);
        assertThat(cycle.primarySpan()).contains(b.span());
        assertThat(cycle.secondaryLabels()).extracting(Label::span).containsExactly(c.span());
        assertThat(validator.stateOf(a)).isEqualTo(VisitState.DONE);
        assertThat(validator.stateOf(c)).isEqualTo(VisitState.DONE);
    }

    @Test
    void sharedNodeReachedTwiceIsNotACycle() {
        GraphNode shared = new GraphNode("shared", 5);
        GraphNode root = new GraphNode("root", 0)
                .add(new GraphNode("x", 1).add(shared))
                .add(new GraphNode("y", 2).add(shared));

        validator.validate(root);

        assertThat(validator.hasCycles()).isFalse();
        assertThat(validator.stateOf(shared)).isEqualTo(VisitState.DONE);
    }

    @Test
    void eachBackEdgeIsReported() {
        GraphNode a = new GraphNode("A", 0);
        GraphNode b = new GraphNode("B", 1);
        GraphNode c = new GraphNode("C", 2);
        a.add(b).add(c);
        b.add(a);
        c.add(a);

        validator.validate(a);

        assertThat(validator.cycles()).hasSize(2);
        assertThat(validator.cycles().get(0)).containsExactly(a, b, a);
        assertThat(validator.cycles().get(1)).containsExactly(a, c, a);
    }

    @Test
    void unreachedNodesStayUnvisited() {
        GraphNode root = new GraphNode("root", 0);

        validator.validate(root);

        assertThat(validator.stateOf(new GraphNode("other", 9))).isEqualTo(VisitState.UNVISITED);
    }

    @Test
    void customAndStructuralDiagnosticsAreSeparated() {
        Diagnostic custom = Diagnostic.warning("suspicious").build();
        GraphNode a = new GraphNode("A", 0).withFinding(custom);
        GraphNode b = new GraphNode("B", 1);
        a.add(b);
        b.add(a);

        validator.validate(a);

        assertThat(validator.customDiagnostics()).containsExactly(custom);
        assertThat(validator.structuralDiagnostics()).hasSize(1);
        assertThat(validator.allDiagnostics()).hasSize(2);
        assertThat(validator.allDiagnostics().get(0)).isSameAs(custom);
    }

    @Test
    void clearForgetsEverything() {
        GraphNode a = new GraphNode("A", 0);
        a.add(a);
        validator.validate(a);

        validator.clear();

        assertThat(validator.cycles()).isEmpty();
        assertThat(validator.allDiagnostics()).isEmpty();
        assertThat(validator.stateOf(a)).isEqualTo(VisitState.UNVISITED);
    }
}
