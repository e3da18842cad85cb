package org.irlens.render;

import org.irlens.api.AnnotationOnExpressionException;
import org.irlens.api.IrErrorCode;
import org.irlens.api.PathNotFoundException;
import org.irlens.api.UnderlineTargetNotFoundException;
import org.irlens.compare.MismatchRecord;
import org.irlens.compare.StructuralComparator;
import org.irlens.ir.IrArena;
import org.irlens.ir.IrNode;
import org.irlens.ir.schema.SchemaRegistry;
import org.irlens.ir.tir.TirBuilder;
import org.irlens.ir.tir.TirSamples;
import org.irlens.path.NodePath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AnnotatedRendererTest {

    private SchemaRegistry schemas;
    private AnnotatedRenderer renderer;
    private TirBuilder tb;

    @BeforeEach
    void setUp() {
        schemas = SchemaRegistry.initializeWithDefaults();
        renderer = new AnnotatedRenderer(schemas, NodePrinterRegistry.initializeWithDefaults());
        tb = new TirBuilder();
    }

    @Test
    void render_withSugar_printsGridAndRemap() {
        RenderResult result = renderer.render(TirSamples.copy2d(tb, 256), RenderConfig.DEFAULT);

        assertThat(result.text()).isEqualTo(String.join("\n",
                "@T.prim_func",
                "def main(a: T.handle, b: T.handle):",
                "    A = T.match_buffer(a, (128, 128), \"float32\")",
                "    B = T.match_buffer(b, (128, 256), \"float32\")",
                "    for i, j in T.grid(128, 128):",
                "        with T.block(\"update\"):",
                "            vi, vj = T.axis.remap(\"SS\", [i, j])",
                "            B[vi, vj] = A[vi, vj]",
                ""));
        assertThat(result.outcomes()).isEmpty();
    }

    @Test
    void render_withoutSugar_printsEveryNode() {
        RenderResult result = renderer.render(TirSamples.copy2d(tb, 256), RenderConfig.DEFAULT.withSyntaxSugar(false));

        assertThat(result.lines()).contains(
                "    B = T.match_buffer(b, (T.int32(128), T.int32(256)), \"float32\")",
                "    for i in T.serial(T.int32(0), T.int32(128)):",
                "        for j in T.serial(T.int32(0), T.int32(128)):",
                "                vi = T.axis.spatial(T.int32(128), i)",
                "                vj = T.axis.spatial(T.int32(128), j)");
    }

    @Test
    @DisplayName("Each side of a 128 vs 256 mismatch is underlined at its own value")
    void render_mismatchPath_placesCaretUnderValue() throws Exception {
        IrNode lhs = TirSamples.copy2d(tb, 128);
        IrNode rhs = TirSamples.copy2d(new TirBuilder(), 256);
        MismatchRecord mismatch = new StructuralComparator(schemas).compare(lhs, rhs, false).orElseThrow();

        RenderResult left = renderer.render(lhs, RenderConfig.DEFAULT, List.of(RenderTarget.of(mismatch.lhsPath())), List.of());
        RenderResult right = renderer.render(rhs, RenderConfig.DEFAULT, List.of(RenderTarget.of(mismatch.rhsPath())), List.of());

        assertCaretUnder(left, "    B = T.match_buffer(b, (128, 128), \"float32\")", 32, "128");
        assertCaretUnder(right, "    B = T.match_buffer(b, (128, 256), \"float32\")", 32, "256");
        Span span = right.outcomes().get(0).spans().get(0);
        assertThat(span.extract(right.text())).isEqualTo("256");
        assertThat(span.startLine()).isEqualTo(4);
        assertThat(span.startColumn()).isEqualTo(33);
        assertThat(span.endColumn()).isEqualTo(36);
        assertThat(right.outcomes().get(0).fallback()).isFalse();
    }

    private static void assertCaretUnder(RenderResult result, String line, int column, String token) {
        List<String> lines = result.lines();
        int at = lines.indexOf(line);
        assertThat(at).isNotNegative();
        assertThat(line.indexOf(token, column)).isEqualTo(column);
        assertThat(lines.get(at + 1)).isEqualTo(" ".repeat(column) + "^".repeat(token.length()));
    }

    @Test
    void render_letDtypeMismatch_underlinesDtypeWithoutFallback() throws Exception {
        TirBuilder rb = new TirBuilder();
        IrNode.Composite x32 = tb.var("x", "int32");
        IrNode.Composite x64 = rb.var("x", "int64");
        IrNode lhs = tb.letStmt(x32, tb.intImm(1), tb.evaluate(x32));
        IrNode rhs = rb.letStmt(x64, rb.intImm(1), rb.evaluate(x64));
        MismatchRecord mismatch = new StructuralComparator(schemas).compare(lhs, rhs, false).orElseThrow();
        RenderConfig plain = RenderConfig.DEFAULT.withSyntaxSugar(false);

        RenderResult left = renderer.render(lhs, plain, List.of(RenderTarget.of(mismatch.lhsPath())), List.of());
        RenderResult right = renderer.render(rhs, plain, List.of(RenderTarget.of(mismatch.rhsPath())), List.of());

        assertThat(mismatch.lhsPath()).hasToString("<root>.var.dtype");
        assertCaretUnder(left, "x: T.int32 = T.int32(1)", 3, "T.int32");
        assertCaretUnder(right, "x: T.int64 = T.int32(1)", 3, "T.int64");
        assertThat(left.outcomes().get(0).fallback()).isFalse();
        assertThat(right.outcomes().get(0).fallback()).isFalse();
    }

    @Test
    @DisplayName("A path through one of two structurally equal keys underlines that entry")
    void render_duplicateNamedParams_pathUnderlinesResolvedEntry() throws Exception {
        IrNode.Composite first = tb.handleVar("a");
        IrNode.Composite second = tb.handleVar("a");
        IrNode.Composite bufA = tb.buffer("A", "float32", 16);
        IrNode.Composite bufB = tb.buffer("B", "float32", 16);
        IrNode func = tb.primFunc("f", List.of(first, second),
                List.of(IrArena.entry(first, bufA), IrArena.entry(second, bufB)),
                tb.bufferStore(bufB, tb.bufferLoad(bufA, tb.intImm(0)), tb.intImm(0)));
        NodePath secondName = NodePath.root().field("buffer_map").key(second).field("name");
        NodePath secondBuffer = NodePath.root().field("buffer_map").key(second);

        RenderResult result = renderer.render(func, RenderConfig.DEFAULT, List.of(RenderTarget.of(secondName)), List.of());

        assertCaretUnder(result, "    B = T.match_buffer(a, (16,), \"float32\")", 4, "B");
        RequestOutcome outcome = result.outcomes().get(0);
        assertThat(outcome.fallback()).isFalse();
        assertThat(outcome.spans().get(0).extract(result.text())).isEqualTo("B");
        assertThat(result.spans().entryAt(secondBuffer).orElseThrow().node()).isSameAs(bufB);
    }

    @Test
    @DisplayName("Identity underline marks every use of a shared parameter; path underline marks one")
    void render_sharedParameter_identityVersusPath() throws Exception {
        IrNode.Composite func = TirSamples.sharedParam(tb);
        IrNode n = ((IrNode.Sequence) func.field("params").orElseThrow()).get(0);

        RenderResult byIdentity = renderer.render(func, RenderConfig.DEFAULT, List.of(RenderTarget.of(n)), List.of());
        RenderResult byPath = renderer.render(func, RenderConfig.DEFAULT,
                List.of(RenderTarget.of(NodePath.root().field("body").field("seq").index(0).field("value"))), List.of());

        assertThat(byIdentity.lines()).containsExactly(
                "@T.prim_func",
                "def f(n: T.int32, x: T.handle):",
                "      ^^^^^^^^^^",
                "    X = T.match_buffer(x, (16,), \"int32\")",
                "    X[0] = n",
                "           ^",
                "    X[1] = n + 1",
                "           ^");
        assertThat(byIdentity.outcomes().get(0).spans()).hasSize(3);
        assertThat(byIdentity.spansOf(n)).hasSize(3);

        assertThat(byPath.lines()).containsExactly(
                "@T.prim_func",
                "def f(n: T.int32, x: T.handle):",
                "    X = T.match_buffer(x, (16,), \"int32\")",
                "    X[0] = n",
                "           ^",
                "    X[1] = n + 1");
        assertThat(byPath.outcomes().get(0).spans()).hasSize(1);
    }

    @Test
    void render_singleOccurrence_pathAndIdentityProduceSameText() throws Exception {
        IrNode.Composite func = TirSamples.copy2d(tb, 256);
        NodePath path = NodePath.root().field("body").field("extent");
        IrNode extent = func.field("body").flatMap(b -> ((IrNode.Composite) b).field("extent")).orElseThrow();

        RenderResult byPath = renderer.render(func, RenderConfig.DEFAULT, List.of(RenderTarget.of(path)), List.of());
        RenderResult byIdentity = renderer.render(func, RenderConfig.DEFAULT, List.of(RenderTarget.of(extent)), List.of());

        assertThat(byIdentity.text()).isEqualTo(byPath.text());
    }

    @Test
    @DisplayName("Four nested statements are annotated outer to inner, each directly above its line")
    void render_nestedStatements_annotationsAboveEachLine() throws Exception {
        IrNode func = TirSamples.nestedBlocks(tb, 16);
        NodePath outerBlock = NodePath.root().field("body");
        NodePath outerLoop = outerBlock.field("body");
        NodePath innerLoop = outerLoop.field("body");
        NodePath innerBlock = innerLoop.field("body");
        RenderConfig config = RenderConfig.DEFAULT.withSyntaxSugar(false);

        RenderResult result = renderer.render(func, config, List.of(), List.of(
                AnnotationRequest.of(RenderTarget.of(innerBlock), "inner block"),
                AnnotationRequest.of(RenderTarget.of(outerBlock), "outer block"),
                AnnotationRequest.of(RenderTarget.of(innerLoop), "inner loop"),
                AnnotationRequest.of(RenderTarget.of(outerLoop), "outer loop")));

        List<String> lines = result.lines();
        int outerBlockLine = lines.indexOf("    # outer block");
        int outerLoopLine = lines.indexOf("        # outer loop");
        int innerLoopLine = lines.indexOf("            # inner loop");
        int innerBlockLine = lines.indexOf("                # inner block");
        assertThat(lines.get(outerBlockLine + 1)).isEqualTo("    with T.block(\"outer\"):");
        assertThat(lines.get(outerLoopLine + 1)).startsWith("        for i in T.serial(");
        assertThat(lines.get(innerLoopLine + 1)).startsWith("            for j in T.serial(");
        assertThat(lines.get(innerBlockLine + 1)).isEqualTo("                with T.block(\"inner\"):");
        assertThat(outerBlockLine).isPositive().isLessThan(outerLoopLine);
        assertThat(outerLoopLine).isLessThan(innerLoopLine);
        assertThat(innerLoopLine).isLessThan(innerBlockLine);
        assertThat(result.anyFallback()).isFalse();
    }

    @Test
    void render_annotationWithoutLabel_usesKindCounter() throws Exception {
        IrNode func = TirSamples.nestedBlocks(tb, 16);
        NodePath innerLoop = NodePath.root().field("body").field("body").field("body");

        AnnotationRequest request = AnnotationRequest.numbered(RenderTarget.of(innerLoop));
        RenderResult result = renderer.render(func, RenderConfig.DEFAULT.withSyntaxSugar(false), List.of(), List.of(request));

        assertThat(request.explicitLabel()).isEmpty();
        assertThat(result.lines()).contains("            # for #2");
        assertThat(result.outcomes().get(0).label()).isEqualTo("for #2");
    }

    @Test
    void render_annotationOnExpression_fails() {
        IrNode func = TirSamples.sharedParam(tb);
        NodePath expression = NodePath.root().field("body").field("seq").index(1).field("value");

        assertThatThrownBy(() -> renderer.render(func, RenderConfig.DEFAULT, List.of(),
                List.of(AnnotationRequest.of(RenderTarget.of(expression), "nope"))))
                .isInstanceOf(AnnotationOnExpressionException.class)
                .satisfies(e -> {
                    AnnotationOnExpressionException error = (AnnotationOnExpressionException) e;
                    assertThat(error.code()).isEqualTo(IrErrorCode.ANNOTATION_ON_EXPRESSION);
                    assertThat(error.kind()).isEqualTo("add");
                });
    }

    @Test
    void render_annotationOnStatement_labelPrecedesStatementLine() throws Exception {
        IrNode func = TirSamples.sharedParam(tb);
        NodePath second = NodePath.root().field("body").field("seq").index(1);

        RenderResult result = renderer.render(func, RenderConfig.DEFAULT, List.of(),
                List.of(AnnotationRequest.of(RenderTarget.of(second), "increments")));

        List<String> lines = result.lines();
        assertThat(lines.get(lines.indexOf("    X[1] = n + 1") - 1)).isEqualTo("    # increments");
    }

    @Test
    void render_unknownPath_failsBeforePrinting() {
        IrNode func = TirSamples.sharedParam(tb);

        assertThatThrownBy(() -> renderer.render(func, RenderConfig.DEFAULT,
                List.of(RenderTarget.of(NodePath.root().field("nope"))), List.of()))
                .isInstanceOf(PathNotFoundException.class);
    }

    @Test
    void render_foreignNode_fails() {
        IrNode func = TirSamples.sharedParam(tb);
        IrNode stranger = tb.intVar("n");

        assertThatThrownBy(() -> renderer.render(func, RenderConfig.DEFAULT, List.of(RenderTarget.of(stranger)), List.of()))
                .isInstanceOf(UnderlineTargetNotFoundException.class)
                .extracting(e -> ((UnderlineTargetNotFoundException) e).handle())
                .isEqualTo(stranger.handle());
    }

    @Test
    void render_isDeterministic() throws Exception {
        IrNode func = TirSamples.copy2d(tb, 256);
        List<RenderTarget> underline = List.of(RenderTarget.of(NodePath.root().field("body").field("extent")));

        RenderResult first = renderer.render(func, RenderConfig.DEFAULT, underline, List.of());
        RenderResult second = renderer.render(func, RenderConfig.DEFAULT, underline, List.of());

        assertThat(second.text()).isEqualTo(first.text());
        assertThat(second.spans().entries()).extracting(SpanTable.Entry::span)
                .containsExactlyElementsOf(first.spans().entries().stream().map(SpanTable.Entry::span).toList());
    }

    @Test
    @DisplayName("A loop folded into T.grid falls back to the enclosing loop's span")
    void render_foldedGridLoop_fallsBackToOuterLoop() throws Exception {
        IrNode func = TirSamples.copy2d(tb, 256);
        NodePath inner = NodePath.root().field("body").field("body");

        RenderResult result = renderer.render(func, RenderConfig.DEFAULT, List.of(RenderTarget.of(inner)),
                List.of(AnnotationRequest.of(RenderTarget.of(inner), "inner loop")));

        assertThat(result.outcomes()).allMatch(RequestOutcome::fallback);
        assertThat(result.anyFallback()).isTrue();
        assertThat(result.outcomes().get(0).renderedPaths()).containsExactly(NodePath.root().field("body"));
        assertThat(result.outcomes().get(0).spans().get(0).isMultiLine()).isTrue();
        assertThat(result.lines()).containsSubsequence(
                "    # inner loop",
                "    for i, j in T.grid(128, 128):",
                "    ^^^^^^^^^^^^^^^^^^^^^^^^^^^^^");
    }

    @Test
    void render_foldedGridLoop_keepsSpanOfItsVariable() throws Exception {
        IrNode func = TirSamples.copy2d(tb, 256);
        NodePath innerVar = NodePath.root().field("body").field("body").field("loop_var");

        RenderResult result = renderer.render(func, RenderConfig.DEFAULT, List.of(RenderTarget.of(innerVar)), List.of());

        assertThat(result.outcomes().get(0).fallback()).isFalse();
        assertThat(result.outcomes().get(0).spans().get(0).extract(result.text())).isEqualTo("j");
    }

    @Test
    void render_foldedAxisBinding_fallsBackToRemapLine() throws Exception {
        IrNode func = TirSamples.copy2d(tb, 256);
        NodePath axes = NodePath.root().field("body").field("body").field("body").field("axes");

        RenderResult folded = renderer.render(func, RenderConfig.DEFAULT,
                List.of(RenderTarget.of(axes.index(1).field("extent"))), List.of());
        RenderResult kept = renderer.render(func, RenderConfig.DEFAULT,
                List.of(RenderTarget.of(axes.index(1).field("value"))), List.of());

        RequestOutcome fallback = folded.outcomes().get(0);
        assertThat(fallback.fallback()).isTrue();
        assertThat(fallback.renderedPaths()).containsExactly(axes);
        assertThat(fallback.spans().get(0).extract(folded.text())).isEqualTo("vi, vj = T.axis.remap(\"SS\", [i, j])");
        assertThat(kept.outcomes().get(0).fallback()).isFalse();
        assertThat(kept.outcomes().get(0).spans().get(0).extract(kept.text())).isEqualTo("j");
    }

    @Test
    void render_foldedNodesHaveNoOwnSpan() {
        IrNode.Composite func = TirSamples.copy2d(tb, 256);
        IrNode innerLoop = ((IrNode.Composite) func.field("body").orElseThrow()).field("body").orElseThrow();

        RenderResult sugared = renderer.render(func, RenderConfig.DEFAULT);
        RenderResult plain = renderer.render(func, RenderConfig.DEFAULT.withSyntaxSugar(false));

        assertThat(sugared.spansOf(innerLoop)).isEmpty();
        assertThat(plain.spansOf(innerLoop)).hasSize(1);
    }

    @Test
    @DisplayName("Carets count display columns, so wide characters before a target shift it by two")
    void render_wideCharacters_alignCaretsByDisplayWidth() throws Exception {
        IrNode.Composite n = tb.intVar("n");
        IrNode.Composite call = tb.call("print", tb.stringImm("日本"), n);
        IrNode func = tb.primFunc("g", List.of(n), List.of(), tb.evaluate(call));
        NodePath target = NodePath.root().field("body").field("value").field("args").index(1);

        RenderResult result = renderer.render(func, RenderConfig.DEFAULT, List.of(RenderTarget.of(target)), List.of());

        List<String> lines = result.lines();
        int at = lines.indexOf("    T.evaluate(T.print(\"日本\", n))");
        assertThat(lines.get(at + 1)).isEqualTo(" ".repeat(31) + "^");
        Span span = result.outcomes().get(0).spans().get(0);
        assertThat(span.startColumn()).isEqualTo(32);
        assertThat(span.extract(result.text())).isEqualTo("n");
    }

    @Test
    void render_longSignature_wrapsOneParameterPerLine() {
        RenderResult result = renderer.render(TirSamples.sharedParam(tb), RenderConfig.DEFAULT.withLineWidth(20));

        assertThat(result.lines()).startsWith(
                "@T.prim_func",
                "def f(",
                "    n: T.int32,",
                "    x: T.handle,",
                "):",
                "    X = T.match_buffer(x, (16,), \"int32\")");
    }

    @Test
    void render_metadata_onlyWhenRequested() {
        IrNode func = tb.primFunc("h", List.of(), List.of(),
                Map.of("global_symbol", tb.arena().strLeaf("h")), tb.evaluate(tb.intImm(0)));

        RenderResult hidden = renderer.render(func, RenderConfig.DEFAULT);
        RenderResult shown = renderer.render(func, RenderConfig.DEFAULT.withShowMetadata(true));

        assertThat(hidden.text()).doesNotContain("func_attr");
        assertThat(shown.lines()).contains("    T.func_attr({\"global_symbol\": \"h\"})");
    }

    @Test
    void render_spanTable_indexesByPathIgnoringAttrSegments() {
        IrNode func = TirSamples.copy2d(tb, 256);
        NodePath value = NodePath.root().field("body").field("extent").attr("value");

        RenderResult result = renderer.render(func, RenderConfig.DEFAULT);

        assertThat(result.spans().spanAt(value)).isPresent();
        assertThat(result.spans().spanAt(value.withFieldsOnly())).isEqualTo(result.spans().spanAt(value));
        assertThat(result.spans().spanAt(NodePath.root()).orElseThrow().startLine()).isEqualTo(1);
    }

    @Test
    void render_infixOperators_parenthesizeNestedOperands() {
        IrNode.Composite a = tb.intVar("a");
        IrNode.Composite b = tb.intVar("b");
        IrNode expr = tb.add(tb.mul(a, b), tb.binary("min", a, tb.intImm(3)));

        assertThat(renderer.render(tb.evaluate(expr), RenderConfig.DEFAULT).text())
                .isEqualTo("T.evaluate((a * b) + T.min(a, 3))\n");
        assertThat(renderer.render(tb.evaluate(expr), RenderConfig.DEFAULT.withSyntaxSugar(false)).text())
                .isEqualTo("T.evaluate(T.add(T.mul(a, b), T.min(a, T.int32(3))))\n");
    }
}
