package org.irlens.report;

import org.irlens.api.IrLensException;
import org.irlens.compare.CompareOptions;
import org.irlens.compare.MismatchRecord;
import org.irlens.compare.StructuralComparator;
import org.irlens.ir.IrNode;
import org.irlens.ir.IrNodes;
import org.irlens.ir.schema.SchemaRegistry;
import org.irlens.path.NodePath;
import org.irlens.path.PathResolver;
import org.irlens.render.AnnotatedRenderer;
import org.irlens.render.NodePrinterRegistry;
import org.irlens.render.RenderConfig;
import org.irlens.render.RenderResult;
import org.irlens.render.RenderTarget;

import java.util.List;
import java.util.Optional;

/**
 * Compares two trees and, when they diverge, turns the mismatch into a {@link MismatchReport}
 * with each side rendered and underlined at its own path.
 */
public class MismatchReporter {

    private final StructuralComparator comparator;
    private final AnnotatedRenderer renderer;

    public MismatchReporter(StructuralComparator comparator, AnnotatedRenderer renderer) {
        this.comparator = comparator;
        this.renderer = renderer;
    }

    /**
     * @return A reporter for the built-in TIR kinds.
     */
    public static MismatchReporter withDefaults() {
        SchemaRegistry schemas = SchemaRegistry.initializeWithDefaults();
        return new MismatchReporter(new StructuralComparator(schemas),
                new AnnotatedRenderer(schemas, NodePrinterRegistry.initializeWithDefaults()));
    }

    /**
     * @param lhs The left tree.
     * @param rhs The right tree.
     * @param options Comparison options.
     * @param config Rendering options for both sides.
     * @return The report, or empty if the trees are structurally equal.
     */
    public Optional<MismatchReport> report(IrNode lhs, IrNode rhs, CompareOptions options, RenderConfig config) {
        return comparator.compare(lhs, rhs, options).map(mismatch -> build(mismatch, lhs, rhs, config));
    }

    /**
     * Builds a report for a record produced by comparing {@code lhs} with {@code rhs}.
     *
     * @throws IllegalStateException if the record's paths do not resolve in the given trees.
     */
    public MismatchReport build(MismatchRecord mismatch, IrNode lhs, IrNode rhs, RenderConfig config) {
        return new MismatchReport(mismatch,
                describe(lhs, mismatch.lhsPath()),
                describe(rhs, mismatch.rhsPath()),
                underlined(lhs, mismatch.lhsPath(), config),
                underlined(rhs, mismatch.rhsPath(), config));
    }

    private RenderResult underlined(IrNode root, NodePath path, RenderConfig config) {
        try {
            return renderer.render(root, config, List.of(RenderTarget.of(path)), List.of());
        } catch (IrLensException e) {
            throw new IllegalStateException("Mismatch path " + path + " does not address the compared tree", e);
        }
    }

    private static String describe(IrNode root, NodePath path) {
        return PathResolver.tryResolve(root, path).map(IrNodes::describe).orElse("<unresolved>");
    }
}
