package org.irlens.ir.schema;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The schema of one composite node kind: its fields in canonical order, whether it is a
 * statement or an expression, whether it opens a binding scope, and whether its nodes are
 * variables (so that they can be compared up to renaming).
 * <p>
 * The canonical field order is the order both comparison and printing follow, so a path
 * reported by the comparator and the token the renderer underlines always agree.
 *
 * @param kind The kind tag.
 * @param fields Declared fields in canonical order.
 * @param category Statement or expression.
 * @param opensScope Whether bound variables introduced below this node are scoped to it.
 * @param variable Whether nodes of this kind are variables.
 */
public record NodeKindSchema(
        String kind,
        List<FieldDescriptor> fields,
        NodeCategory category,
        boolean opensScope,
        boolean variable
) {

    public NodeKindSchema {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(category, "category");
        fields = List.copyOf(fields);
        Set<String> seen = new HashSet<>();
        for (FieldDescriptor field : fields) {
            if (!seen.add(field.name())) {
                throw new IllegalArgumentException("Kind '" + kind + "' declares field '" + field.name() + "' twice");
            }
        }
    }

    public static NodeKindSchema statement(String kind, FieldDescriptor... fields) {
        return new NodeKindSchema(kind, List.of(fields), NodeCategory.STATEMENT, false, false);
    }

    public static NodeKindSchema expression(String kind, FieldDescriptor... fields) {
        return new NodeKindSchema(kind, List.of(fields), NodeCategory.EXPRESSION, false, false);
    }

    /**
     * @return A copy of this schema that opens a binding scope.
     */
    public NodeKindSchema scoped() {
        return new NodeKindSchema(kind, fields, category, true, variable);
    }

    /**
     * @return A copy of this schema whose nodes are variables.
     */
    public NodeKindSchema asVariable() {
        return new NodeKindSchema(kind, fields, category, opensScope, true);
    }

    public boolean isStatement() {
        return category == NodeCategory.STATEMENT;
    }

    public boolean declares(String fieldName) {
        return field(fieldName).isPresent();
    }

    public Optional<FieldDescriptor> field(String fieldName) {
        for (FieldDescriptor field : fields) {
            if (field.name().equals(fieldName)) return Optional.of(field);
        }
        return Optional.empty();
    }
}
