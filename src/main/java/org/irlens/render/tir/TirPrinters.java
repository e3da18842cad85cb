package org.irlens.render.tir;

import org.irlens.ir.tir.TirKinds;
import org.irlens.render.NodePrinterRegistry;

/**
 * Registers the printers of the built-in TIR kinds.
 */
public final class TirPrinters {

    private TirPrinters() {}

    public static void registerDefaults(NodePrinterRegistry registry) {
        registry.register(TirKinds.PRIM_FUNC, new PrimFuncPrinter());
        registry.register(TirKinds.VAR, new VarPrinter());
        registry.register(TirKinds.BUFFER, new BufferPrinter());
        registry.register(TirKinds.INT_IMM, new IntImmPrinter());
        registry.register(TirKinds.FLOAT_IMM, new FloatImmPrinter());
        registry.register(TirKinds.STRING_IMM, new StringImmPrinter());
        BinaryOpPrinter binary = new BinaryOpPrinter();
        for (String op : TirKinds.binaryOps()) {
            registry.register(op, binary);
        }
        registry.register(TirKinds.BUFFER_LOAD, new BufferLoadPrinter());
        registry.register(TirKinds.CALL, new CallPrinter());
        registry.register(TirKinds.SEQ_STMT, new SeqStmtPrinter());
        registry.register(TirKinds.FOR, new ForPrinter());
        registry.register(TirKinds.LET_STMT, new LetStmtPrinter());
        registry.register(TirKinds.BLOCK, new BlockPrinter());
        registry.register(TirKinds.AXIS_BINDING, new AxisBindingPrinter());
        registry.register(TirKinds.BUFFER_STORE, new BufferStorePrinter());
        registry.register(TirKinds.EVALUATE, new EvaluatePrinter());
    }
}
