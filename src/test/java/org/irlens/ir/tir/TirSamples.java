package org.irlens.ir.tir;

import org.irlens.ir.IrArena;
import org.irlens.ir.IrNode;

import java.util.List;

/**
 * Small TIR functions shared by tests.
 */
public final class TirSamples {

    private TirSamples() {}

    /**
     * A 2-d elementwise copy. With sugar it renders as:
     * <pre>
     * &#64;T.prim_func
     * def main(a: T.handle, b: T.handle):
     *     A = T.match_buffer(a, (128, 128), "float32")
     *     B = T.match_buffer(b, (128, bDim1), "float32")
     *     for i, j in T.grid(128, 128):
     *         with T.block("update"):
     *             vi, vj = T.axis.remap("SS", [i, j])
     *             B[vi, vj] = A[vi, vj]
     * </pre>
     */
    public static IrNode.Composite copy2d(TirBuilder tb, long bDim1) {
        IrNode.Composite a = tb.handleVar("a");
        IrNode.Composite b = tb.handleVar("b");
        IrNode.Composite bufA = tb.buffer("A", "float32", 128, 128);
        IrNode.Composite bufB = tb.buffer("B", "float32", 128, bDim1);
        IrNode.Composite i = tb.intVar("i");
        IrNode.Composite j = tb.intVar("j");
        IrNode.Composite vi = tb.intVar("vi");
        IrNode.Composite vj = tb.intVar("vj");
        IrNode.Composite block = tb.block("update",
                List.of(tb.spatial(vi, 128, i), tb.spatial(vj, 128, j)),
                tb.bufferStore(bufB, tb.bufferLoad(bufA, vi, vj), vi, vj));
        IrNode.Composite body = tb.serial(i, 128, tb.serial(j, 128, block));
        return tb.primFunc("main", List.of(a, b),
                List.of(IrArena.entry(a, bufA), IrArena.entry(b, bufB)), body);
    }

    /**
     * A function whose int parameter {@code n} is used by two statements:
     * <pre>
     * &#64;T.prim_func
     * def f(n: T.int32, x: T.handle):
     *     X = T.match_buffer(x, (16,), "int32")
     *     X[0] = n
     *     X[1] = n + 1
     * </pre>
     */
    public static IrNode.Composite sharedParam(TirBuilder tb) {
        IrNode.Composite n = tb.intVar("n");
        IrNode.Composite x = tb.handleVar("x");
        IrNode.Composite bufX = tb.buffer("X", "int32", 16);
        IrNode.Composite body = tb.seq(
                tb.bufferStore(bufX, n, tb.intImm(0)),
                tb.bufferStore(bufX, tb.add(n, tb.intImm(1)), tb.intImm(1)));
        return tb.primFunc("f", List.of(n, x), List.of(IrArena.entry(x, bufX)), body);
    }

    /**
     * An outer block containing loop i, loop j and an inner block: four nested statements.
     * Loops run over {@code extent}.
     */
    public static IrNode.Composite nestedBlocks(TirBuilder tb, long extent) {
        IrNode.Composite a = tb.handleVar("a");
        IrNode.Composite bufA = tb.buffer("A", "float32", extent, extent);
        IrNode.Composite i = tb.intVar("i");
        IrNode.Composite j = tb.intVar("j");
        IrNode.Composite vi = tb.intVar("vi");
        IrNode.Composite vj = tb.intVar("vj");
        IrNode.Composite inner = tb.block("inner",
                List.of(tb.spatial(vi, extent, i), tb.spatial(vj, extent, j)),
                tb.bufferStore(bufA, tb.floatImm(0.0), vi, vj));
        IrNode.Composite outer = tb.block("outer", List.of(), tb.serial(i, extent, tb.serial(j, extent, inner)));
        return tb.primFunc("main", List.of(a), List.of(IrArena.entry(a, bufA)), outer);
    }

    /**
     * A single serial loop over {@code loopVar} storing it into a buffer bound to a fresh
     * parameter. Used for alpha-equivalence tests.
     */
    public static IrNode.Composite loopOver(TirBuilder tb, String loopVarName) {
        IrNode.Composite a = tb.handleVar("a");
        IrNode.Composite bufA = tb.buffer("A", "int32", 8);
        IrNode.Composite k = tb.intVar(loopVarName);
        IrNode.Composite body = tb.serial(k, 8, tb.bufferStore(bufA, k, k));
        return tb.primFunc("main", List.of(a), List.of(IrArena.entry(a, bufA)), body);
    }
}
