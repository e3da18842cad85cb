package org.irlens.render;

import java.util.Objects;
import java.util.Optional;

/**
 * Attach a comment line above the statement a target resolves to.
 *
 * @param target The statement to annotate.
 * @param label The comment text; {@code null} selects the default {@code "<kind> #<n>"} label.
 */
public record AnnotationRequest(RenderTarget target, String label) {

    public AnnotationRequest {
        Objects.requireNonNull(target, "target");
    }

    public static AnnotationRequest of(RenderTarget target, String label) {
        return new AnnotationRequest(target, label);
    }

    /**
     * An annotation labelled with the statement's kind and per-kind visitation number.
     */
    public static AnnotationRequest numbered(RenderTarget target) {
        return new AnnotationRequest(target, null);
    }

    public Optional<String> explicitLabel() {
        return Optional.ofNullable(label);
    }
}
