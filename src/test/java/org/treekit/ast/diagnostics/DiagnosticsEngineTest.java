package org.treekit.ast.diagnostics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.treekit.ast.api.Span;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DiagnosticsEngineTest {

    private static final Span SPAN = Span.of(1, 0, 4);

    private DiagnosticsEngine engine;

    @BeforeEach
    void setUp() {
        engine = new DiagnosticsEngine();
    }

    @Test
    void builderKeepsPrimaryLabelFirst() {
        Diagnostic d = Diagnostic.error("Broken")
                .secondary(Span.of(1, 8, 9), "related")
                .primary(SPAN, "here")
                .help("fix it")
                .note("first note")
                .build();

        assertThat(d.severity()).isEqualTo(Severity.ERROR);
        assertThat(d.labels()).hasSize(2);
        assertThat(d.labels().get(0).primary()).isTrue();
        assertThat(d.primarySpan()).contains(SPAN);
        assertThat(d.secondaryLabels()).extracting(Label::message).containsExactly("related");
        assertThat(d.helpText()).contains("fix it");
        assertThat(d.notes()).containsExactly("first note");
        assertThat(d).hasToString("error: Broken at 0-4");
    }

    @Test
    void secondPrimaryReplacesTheFirst() {
        Diagnostic d = Diagnostic.warning("w").primary(SPAN, "a").primary(Span.of(1, 5, 6), "b").build();

        assertThat(d.labels()).singleElement().satisfies(l -> assertThat(l.message()).isEqualTo("b"));
    }

    @Test
    void emptyEngineReportsPassed() {
        assertThat(engine.isEmpty()).isTrue();
        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.summary()).isEqualTo("Validation passed: no errors found");
    }

    @Test
    void countsAndGroupsBySeverity() {
        engine.report(Diagnostic.error("e1").primary(SPAN, "here").build());
        engine.reportAll(List.of(
                Diagnostic.error("e2").build(),
                Diagnostic.warning("w1").build(),
                Diagnostic.info("i1").build()));

        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.count(Severity.ERROR)).isEqualTo(2);
        assertThat(engine.withSeverity(Severity.WARNING)).extracting(Diagnostic::message).containsExactly("w1");
        assertThat(engine.bySeverity()).containsOnlyKeys(Severity.ERROR, Severity.WARNING, Severity.INFO);
        assertThat(engine.summary()).isEqualTo("Validation failed: 2 errors, 1 warnings, 1 info");
    }

    @Test
    void findingsBelowErrorStillPass() {
        engine.reportAll(List.of(
                Diagnostic.warning("w1").build(),
                Diagnostic.hint("h1").build(),
                Diagnostic.hint("h2").build()));

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.summary()).isEqualTo("Validation passed: 1 warnings, 2 hints");
    }

    @Test
    void diagnosticsViewIsReadOnlyAndClearResets() {
        engine.report(Diagnostic.hint("h").build());

        assertThatThrownBy(() -> engine.getDiagnostics().clear()).isInstanceOf(UnsupportedOperationException.class);

        engine.clear();
        assertThat(engine.getDiagnostics()).isEmpty();
    }
}
