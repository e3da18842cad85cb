package org.irlens.ir.tir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Kind tags of the built-in TIR-like node kinds.
 */
public final class TirKinds {

    public static final String PRIM_FUNC = "prim_func";
    public static final String VAR = "var";
    public static final String BUFFER = "buffer";
    public static final String INT_IMM = "int_imm";
    public static final String FLOAT_IMM = "float_imm";
    public static final String STRING_IMM = "string_imm";
    public static final String BUFFER_LOAD = "buffer_load";
    public static final String CALL = "call";

    public static final String SEQ_STMT = "seq_stmt";
    public static final String FOR = "for";
    public static final String LET_STMT = "let_stmt";
    public static final String BLOCK = "block";
    public static final String AXIS_BINDING = "axis_binding";
    public static final String BUFFER_STORE = "buffer_store";
    public static final String EVALUATE = "evaluate";

    /** Binary operator kinds mapped to their infix symbol; empty symbol means call form only. */
    private static final Map<String, String> BINARY_OPS;

    static {
        Map<String, String> ops = new LinkedHashMap<>();
        ops.put("add", "+");
        ops.put("sub", "-");
        ops.put("mul", "*");
        ops.put("div", "/");
        ops.put("mod", "%");
        ops.put("min", "");
        ops.put("max", "");
        ops.put("lt", "<");
        ops.put("le", "<=");
        ops.put("gt", ">");
        ops.put("ge", ">=");
        ops.put("eq", "==");
        ops.put("ne", "!=");
        ops.put("and", "and");
        ops.put("or", "or");
        BINARY_OPS = Collections.unmodifiableMap(ops);
    }

    private TirKinds() {}

    /**
     * @return All binary operator kinds, in registration order.
     */
    public static Iterable<String> binaryOps() {
        return BINARY_OPS.keySet();
    }

    public static boolean isBinaryOp(String kind) {
        return BINARY_OPS.containsKey(kind);
    }

    /**
     * @param kind A binary operator kind.
     * @return The infix symbol, or empty if the operator only has a call form.
     */
    public static Optional<String> infixSymbol(String kind) {
        String symbol = BINARY_OPS.get(kind);
        return symbol == null || symbol.isEmpty() ? Optional.empty() : Optional.of(symbol);
    }
}
