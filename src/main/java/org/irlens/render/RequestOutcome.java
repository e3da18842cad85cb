package org.irlens.render;

import org.irlens.path.NodePath;

import java.util.List;

/**
 * What became of one underline or annotation request.
 *
 * @param type Underline or annotation.
 * @param target The request's target as given.
 * @param label The annotation text actually used; {@code null} for underlines.
 * @param paths Every path the target resolved to.
 * @param renderedPaths Per path, the path whose span was used. Differs from the requested
 *                      path where the node was folded.
 * @param spans Per path, the span that was marked, in final-text coordinates.
 * @param fallback Whether any occurrence was folded and marked via an ancestor.
 */
public record RequestOutcome(
        Type type,
        RenderTarget target,
        String label,
        List<NodePath> paths,
        List<NodePath> renderedPaths,
        List<Span> spans,
        boolean fallback
) {

    public enum Type {
        UNDERLINE,
        ANNOTATION
    }

    public RequestOutcome {
        paths = List.copyOf(paths);
        renderedPaths = List.copyOf(renderedPaths);
        spans = List.copyOf(spans);
    }
}
