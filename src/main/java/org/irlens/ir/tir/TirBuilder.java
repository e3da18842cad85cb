package org.irlens.ir.tir;

import org.irlens.ir.IrArena;
import org.irlens.ir.IrNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fluent front end for building trees of the built-in TIR kinds. Every node is allocated
 * in the builder's {@link IrArena}; reusing a returned node at several positions creates a
 * shared reference (e.g. a variable used twice).
 */
public final class TirBuilder {

    public static final String INT32 = "int32";
    public static final String FLOAT32 = "float32";
    public static final String HANDLE = "handle";

    private final IrArena arena;

    public TirBuilder() {
        this(new IrArena());
    }

    public TirBuilder(IrArena arena) {
        this.arena = arena;
    }

    public IrArena arena() {
        return arena;
    }

    // region Expressions

    public IrNode.Composite var(String name, String dtype) {
        return node(TirKinds.VAR, "name", arena.strLeaf(name), "dtype", arena.strLeaf(dtype));
    }

    public IrNode.Composite intVar(String name) {
        return var(name, INT32);
    }

    public IrNode.Composite handleVar(String name) {
        return var(name, HANDLE);
    }

    public IrNode.Composite intImm(long value) {
        return intImm(INT32, value);
    }

    public IrNode.Composite intImm(String dtype, long value) {
        return node(TirKinds.INT_IMM, "dtype", arena.strLeaf(dtype), "value", arena.intLeaf(value));
    }

    public IrNode.Composite floatImm(double value) {
        return floatImm(FLOAT32, value);
    }

    public IrNode.Composite floatImm(String dtype, double value) {
        return node(TirKinds.FLOAT_IMM, "dtype", arena.strLeaf(dtype), "value", arena.floatLeaf(value));
    }

    public IrNode.Composite stringImm(String value) {
        return node(TirKinds.STRING_IMM, "value", arena.strLeaf(value));
    }

    /**
     * @param op A binary operator kind, see {@link TirKinds#binaryOps()}.
     */
    public IrNode.Composite binary(String op, IrNode a, IrNode b) {
        if (!TirKinds.isBinaryOp(op)) {
            throw new IllegalArgumentException("Not a binary operator kind: " + op);
        }
        return node(op, "a", a, "b", b);
    }

    public IrNode.Composite add(IrNode a, IrNode b) {
        return binary("add", a, b);
    }

    public IrNode.Composite sub(IrNode a, IrNode b) {
        return binary("sub", a, b);
    }

    public IrNode.Composite mul(IrNode a, IrNode b) {
        return binary("mul", a, b);
    }

    public IrNode.Composite lt(IrNode a, IrNode b) {
        return binary("lt", a, b);
    }

    /**
     * Creates a buffer with constant int32 dimensions.
     */
    public IrNode.Composite buffer(String name, String dtype, long... dims) {
        List<IrNode> shape = new ArrayList<>(dims.length);
        for (long dim : dims) {
            shape.add(intImm(dim));
        }
        return buffer(name, dtype, shape);
    }

    public IrNode.Composite buffer(String name, String dtype, List<IrNode> shape) {
        return node(TirKinds.BUFFER, "name", arena.strLeaf(name), "shape", arena.sequence(shape), "dtype", arena.strLeaf(dtype));
    }

    public IrNode.Composite bufferLoad(IrNode buffer, IrNode... indices) {
        return node(TirKinds.BUFFER_LOAD, "buffer", buffer, "indices", arena.sequence(indices));
    }

    public IrNode.Composite call(String op, IrNode... args) {
        return node(TirKinds.CALL, "op", arena.strLeaf(op), "args", arena.sequence(args));
    }

    // endregion

    // region Statements

    public IrNode.Composite bufferStore(IrNode buffer, IrNode value, IrNode... indices) {
        return node(TirKinds.BUFFER_STORE, "buffer", buffer, "indices", arena.sequence(indices), "value", value);
    }

    public IrNode.Composite evaluate(IrNode value) {
        return node(TirKinds.EVALUATE, "value", value);
    }

    public IrNode.Composite seq(IrNode... statements) {
        return seq(Arrays.asList(statements));
    }

    public IrNode.Composite seq(List<IrNode> statements) {
        return node(TirKinds.SEQ_STMT, "seq", arena.sequence(statements));
    }

    /**
     * Creates a serial loop starting at zero.
     */
    public IrNode.Composite serial(IrNode loopVar, long extent, IrNode body) {
        return forLoop(loopVar, intImm(0), intImm(extent), "serial", body);
    }

    /**
     * @param kind Loop kind, e.g. {@code serial}, {@code parallel}, {@code vectorized}, {@code unroll}.
     */
    public IrNode.Composite forLoop(IrNode loopVar, IrNode min, IrNode extent, String kind, IrNode body) {
        return node(TirKinds.FOR,
                "loop_var", loopVar, "kind", arena.strLeaf(kind), "min", min, "extent", extent, "body", body);
    }

    public IrNode.Composite letStmt(IrNode var, IrNode value, IrNode body) {
        return node(TirKinds.LET_STMT, "var", var, "value", value, "body", body);
    }

    public IrNode.Composite block(String name, List<IrNode> axes, IrNode body) {
        return block(name, axes, Map.of(), body);
    }

    /**
     * @param annotations Block annotations; an empty map omits the field.
     */
    public IrNode.Composite block(String name, List<IrNode> axes, Map<String, IrNode> annotations, IrNode body) {
        Map<String, IrNode> fields = new LinkedHashMap<>();
        fields.put("name", arena.strLeaf(name));
        fields.put("axes", arena.sequence(axes));
        if (!annotations.isEmpty()) {
            fields.put("annotations", stringKeyed(annotations));
        }
        fields.put("body", body);
        return arena.composite(TirKinds.BLOCK, fields);
    }

    public IrNode.Composite axis(IrNode var, String iterType, IrNode extent, IrNode value) {
        return node(TirKinds.AXIS_BINDING, "var", var, "iter_type", arena.strLeaf(iterType), "extent", extent, "value", value);
    }

    public IrNode.Composite spatial(IrNode var, long extent, IrNode value) {
        return axis(var, "spatial", intImm(extent), value);
    }

    public IrNode.Composite reduce(IrNode var, long extent, IrNode value) {
        return axis(var, "reduce", intImm(extent), value);
    }

    public IrNode.Composite primFunc(String name, List<IrNode> params, List<IrNode.Mapping.Entry> bufferMap, IrNode body) {
        return primFunc(name, params, bufferMap, Map.of(), body);
    }

    /**
     * @param bufferMap Parameter variable to buffer entries, in signature order.
     * @param attrs Function attributes; an empty map omits the field.
     */
    public IrNode.Composite primFunc(String name, List<IrNode> params, List<IrNode.Mapping.Entry> bufferMap,
                                     Map<String, IrNode> attrs, IrNode body) {
        Map<String, IrNode> fields = new LinkedHashMap<>();
        fields.put("name", arena.strLeaf(name));
        fields.put("params", arena.sequence(params));
        if (!attrs.isEmpty()) {
            fields.put("attrs", stringKeyed(attrs));
        }
        fields.put("buffer_map", arena.mapping(bufferMap));
        fields.put("body", body);
        return arena.composite(TirKinds.PRIM_FUNC, fields);
    }

    // endregion

    private IrNode.Mapping stringKeyed(Map<String, IrNode> values) {
        List<IrNode.Mapping.Entry> entries = new ArrayList<>();
        values.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> entries.add(IrArena.entry(arena.strLeaf(e.getKey()), e.getValue())));
        return arena.mapping(entries);
    }

    private IrNode.Composite node(String kind, Object... namesAndValues) {
        Map<String, IrNode> fields = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            fields.put((String) namesAndValues[i], (IrNode) namesAndValues[i + 1]);
        }
        return arena.composite(kind, fields);
    }
}
