package org.irlens.ir.tir;

import org.irlens.ir.schema.NodeKindSchema;
import org.irlens.ir.schema.SchemaRegistry;

import static org.irlens.ir.schema.FieldDescriptor.attribute;
import static org.irlens.ir.schema.FieldDescriptor.binder;
import static org.irlens.ir.schema.FieldDescriptor.child;
import static org.irlens.ir.schema.FieldDescriptor.metadata;
import static org.irlens.ir.schema.FieldDescriptor.nameHint;

/**
 * Schemas of the built-in TIR kinds. Field order here is the order in which the printer
 * emits the fields, which keeps comparator paths and rendered tokens aligned.
 */
public final class TirSchemas {

    private TirSchemas() {}

    /**
     * Registers every built-in kind.
     * @param registry The registry to populate.
     */
    public static void registerDefaults(SchemaRegistry registry) {
        registry.register(NodeKindSchema.statement(TirKinds.PRIM_FUNC,
                child("name"), binder("params"), metadata("attrs"), child("buffer_map"), child("body")).scoped());

        registry.register(NodeKindSchema.expression(TirKinds.VAR, nameHint("name"), child("dtype")).asVariable());
        registry.register(NodeKindSchema.expression(TirKinds.BUFFER, child("name"), child("shape"), child("dtype")));
        registry.register(NodeKindSchema.expression(TirKinds.INT_IMM, child("dtype"), attribute("value")));
        registry.register(NodeKindSchema.expression(TirKinds.FLOAT_IMM, child("dtype"), attribute("value")));
        registry.register(NodeKindSchema.expression(TirKinds.STRING_IMM, attribute("value")));
        for (String op : TirKinds.binaryOps()) {
            registry.register(NodeKindSchema.expression(op, child("a"), child("b")));
        }
        registry.register(NodeKindSchema.expression(TirKinds.BUFFER_LOAD, child("buffer"), child("indices")));
        registry.register(NodeKindSchema.expression(TirKinds.CALL, child("op"), child("args")));

        registry.register(NodeKindSchema.statement(TirKinds.SEQ_STMT, child("seq")));
        registry.register(NodeKindSchema.statement(TirKinds.FOR,
                binder("loop_var"), child("kind"), child("min"), child("extent"), child("body")).scoped());
        registry.register(NodeKindSchema.statement(TirKinds.LET_STMT,
                binder("var"), child("value"), child("body")).scoped());
        registry.register(NodeKindSchema.statement(TirKinds.BLOCK,
                child("name"), child("axes"), metadata("annotations"), child("body")).scoped());
        registry.register(NodeKindSchema.statement(TirKinds.AXIS_BINDING,
                binder("var"), child("iter_type"), child("extent"), child("value")));
        registry.register(NodeKindSchema.statement(TirKinds.BUFFER_STORE,
                child("buffer"), child("indices"), child("value")));
        registry.register(NodeKindSchema.statement(TirKinds.EVALUATE, child("value")));
    }
}
