package org.irlens.report;

import org.irlens.compare.CompareOptions;
import org.irlens.compare.MismatchReason;
import org.irlens.ir.IrNode;
import org.irlens.ir.tir.TirBuilder;
import org.irlens.ir.tir.TirSamples;
import org.irlens.render.RenderConfig;
import org.irlens.render.RequestOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class MismatchReporterTest {

    private MismatchReporter reporter;

    @BeforeEach
    void setUp() {
        reporter = MismatchReporter.withDefaults();
    }

    @Test
    void report_equalTrees_isEmpty() {
        IrNode lhs = TirSamples.copy2d(new TirBuilder(), 128);
        IrNode rhs = TirSamples.copy2d(new TirBuilder(), 128);

        assertThat(reporter.report(lhs, rhs, CompareOptions.DEFAULT, RenderConfig.DEFAULT)).isEmpty();
    }

    @Test
    void report_valueMismatch_underlinesBothSides() {
        IrNode lhs = TirSamples.copy2d(new TirBuilder(), 128);
        IrNode rhs = TirSamples.copy2d(new TirBuilder(), 256);

        MismatchReport report = reporter.report(lhs, rhs, CompareOptions.DEFAULT, RenderConfig.DEFAULT).orElseThrow();

        assertThat(report.mismatch().reason()).isEqualTo(MismatchReason.VALUE_MISMATCH);
        assertThat(report.lhsValue()).isEqualTo("128");
        assertThat(report.rhsValue()).isEqualTo("256");
        RequestOutcome left = report.lhs().outcomes().get(0);
        RequestOutcome right = report.rhs().outcomes().get(0);
        assertThat(left.spans().get(0).extract(report.lhs().text())).isEqualTo("128");
        assertThat(right.spans().get(0).extract(report.rhs().text())).isEqualTo("256");
        assertThat(left.spans().get(0).startColumn()).isEqualTo(right.spans().get(0).startColumn());
    }

    @Test
    void format_listsReasonPathsAndBothRenders() {
        IrNode lhs = TirSamples.copy2d(new TirBuilder(), 128);
        IrNode rhs = TirSamples.copy2d(new TirBuilder(), 256);

        String text = reporter.report(lhs, rhs, CompareOptions.DEFAULT, RenderConfig.DEFAULT).orElseThrow().format();

        List<String> lines = text.lines().toList();
        assertThat(lines.get(0)).isEqualTo("Structural mismatch: VALUE_MISMATCH");
        assertThat(lines.get(1)).isEqualTo("  lhs: <root>.buffer_map[b].shape[1].value = 128");
        assertThat(lines.get(2)).isEqualTo("  rhs: <root>.buffer_map[b].shape[1].value = 256");
        assertThat(lines).containsSubsequence(
                "--- lhs",
                "    B = T.match_buffer(b, (128, 128), \"float32\")",
                " ".repeat(32) + "^^^",
                "--- rhs",
                "    B = T.match_buffer(b, (128, 256), \"float32\")",
                " ".repeat(32) + "^^^");
    }

    @Test
    void report_extraField_underlinesEnclosingNodeOnShorterSide() {
        TirBuilder left = new TirBuilder();
        TirBuilder right = new TirBuilder();
        IrNode lhs = left.block("b", List.of(), left.evaluate(left.intImm(0)));
        IrNode rhs = right.block("b", List.of(),
                Map.of("pragma", right.arena().strLeaf("x")), right.evaluate(right.intImm(0)));

        Optional<MismatchReport> report = reporter.report(lhs, rhs, CompareOptions.DEFAULT, RenderConfig.DEFAULT);

        assertThat(report).isPresent();
        assertThat(report.get().mismatch().reason()).isEqualTo(MismatchReason.EXTRA_FIELD);
        assertThat(report.get().lhsValue()).isEqualTo("b");
        assertThat(report.get().rhsValue()).isEqualTo("mapping(1)");
        assertThat(report.get().lhs().outcomes().get(0).fallback()).isFalse();
    }

    @Test
    void report_alphaMode_acceptsRenamedLoopVariable() {
        IrNode lhs = TirSamples.loopOver(new TirBuilder(), "i");
        IrNode rhs = TirSamples.loopOver(new TirBuilder(), "k");

        assertThat(reporter.report(lhs, rhs, CompareOptions.ALPHA_EQUIVALENT, RenderConfig.DEFAULT)).isEmpty();
        assertThat(reporter.report(lhs, rhs, CompareOptions.DEFAULT, RenderConfig.DEFAULT))
                .hasValueSatisfying(r -> assertThat(r.mismatch().reason()).isEqualTo(MismatchReason.VALUE_MISMATCH));
    }
}
