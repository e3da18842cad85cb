package org.irlens.ir.schema;

import org.irlens.api.IrErrorCode;
import org.irlens.api.MalformedTreeException;
import org.irlens.ir.IrNode;
import org.irlens.ir.tir.TirSchemas;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping node kinds to their {@link NodeKindSchema}. This is the fixed table
 * that comparator, resolver walk and renderer all consult; none of them infers field
 * order or classification on its own.
 * <p>
 * Populate the registry before sharing it. Lookups are read-only and may then run on any
 * number of threads.
 */
public final class SchemaRegistry {

    private final Map<String, NodeKindSchema> byKind = new LinkedHashMap<>();

    private SchemaRegistry() {}

    /**
     * @return An empty registry; callers register their own kinds.
     */
    public static SchemaRegistry initialize() {
        return new SchemaRegistry();
    }

    /**
     * @return A registry pre-populated with the built-in TIR kinds.
     */
    public static SchemaRegistry initializeWithDefaults() {
        SchemaRegistry registry = initialize();
        TirSchemas.registerDefaults(registry);
        return registry;
    }

    /**
     * Registers a kind.
     *
     * @param schema The schema to register.
     * @return This registry, for chaining.
     * @throws IllegalArgumentException if the kind is already registered.
     */
    public SchemaRegistry register(NodeKindSchema schema) {
        if (byKind.putIfAbsent(schema.kind(), schema) != null) {
            throw new IllegalArgumentException("Kind '" + schema.kind() + "' is already registered");
        }
        return this;
    }

    public Optional<NodeKindSchema> lookup(String kind) {
        return Optional.ofNullable(byKind.get(kind));
    }

    public Collection<NodeKindSchema> all() {
        return Collections.unmodifiableCollection(byKind.values());
    }

    /**
     * Returns the schema of a composite node after checking that every field it carries is
     * declared.
     *
     * @param node The composite node.
     * @param location Human-readable location used in the error message.
     * @return The schema of the node's kind.
     * @throws MalformedTreeException if the kind is unknown or a field is undeclared.
     */
    public NodeKindSchema validate(IrNode.Composite node, String location) {
        NodeKindSchema schema = byKind.get(node.kind());
        if (schema == null) {
            throw new MalformedTreeException(IrErrorCode.UNKNOWN_NODE_KIND,
                    "No schema registered for kind '" + node.kind() + "'", location);
        }
        for (String fieldName : node.fields().keySet()) {
            if (!schema.declares(fieldName)) {
                throw new MalformedTreeException(IrErrorCode.UNDECLARED_FIELD,
                        "Kind '" + node.kind() + "' does not declare field '" + fieldName + "'", location);
            }
        }
        return schema;
    }

    /**
     * @param node Any node.
     * @return {@code true} if the node is a composite of a registered statement kind.
     */
    public boolean isStatement(IrNode node) {
        if (!(node instanceof IrNode.Composite composite)) return false;
        NodeKindSchema schema = byKind.get(composite.kind());
        return schema != null && schema.isStatement();
    }
}
