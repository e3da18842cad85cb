package org.irlens.api;

/**
 * Thrown when an annotation targets a node whose kind is not statement-like. The renderer
 * never moves such an annotation to an enclosing statement on its own.
 */
public class AnnotationOnExpressionException extends IrLensException {

    private final String target;
    private final String kind;

    /**
     * @param target Human-readable description of the requested target.
     * @param kind The kind of the resolved node, or a leaf/sequence/mapping description.
     */
    public AnnotationOnExpressionException(String target, String kind) {
        super(IrErrorCode.ANNOTATION_ON_EXPRESSION,
                "Cannot annotate " + target + ": '" + kind + "' is not a statement kind");
        this.target = target;
        this.kind = kind;
    }

    public String target() {
        return target;
    }

    public String kind() {
        return kind;
    }
}
