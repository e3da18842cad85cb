package org.irlens.render;

import com.typesafe.config.Config;

/**
 * Rendering options.
 *
 * @param syntaxSugar Use shorthand forms that fold several logical nodes into one token.
 * @param lineWidth Preferred maximum line width; function signatures wrap beyond it.
 * @param showMetadata Print metadata fields such as function and block attributes.
 * @param indentSpaces Spaces per indentation level.
 */
public record RenderConfig(boolean syntaxSugar, int lineWidth, boolean showMetadata, int indentSpaces) {

    /** Sugar on, 100 columns, metadata hidden, four-space indent. */
    public static final RenderConfig DEFAULT = new RenderConfig(true, 100, false, 4);

    public RenderConfig {
        if (lineWidth < 1) throw new IllegalArgumentException("lineWidth must be positive: " + lineWidth);
        if (indentSpaces < 0) throw new IllegalArgumentException("indentSpaces must not be negative: " + indentSpaces);
    }

    /**
     * Reads options from an {@code irlens.render} style config subtree.
     *
     * @param config A config containing {@code syntax-sugar}, {@code line-width},
     *               {@code show-metadata} and {@code indent-spaces}.
     * @return The options.
     */
    public static RenderConfig fromConfig(Config config) {
        return new RenderConfig(
                config.getBoolean("syntax-sugar"),
                config.getInt("line-width"),
                config.getBoolean("show-metadata"),
                config.getInt("indent-spaces"));
    }

    public RenderConfig withSyntaxSugar(boolean enabled) {
        return new RenderConfig(enabled, lineWidth, showMetadata, indentSpaces);
    }

    public RenderConfig withLineWidth(int width) {
        return new RenderConfig(syntaxSugar, width, showMetadata, indentSpaces);
    }

    public RenderConfig withShowMetadata(boolean enabled) {
        return new RenderConfig(syntaxSugar, lineWidth, enabled, indentSpaces);
    }
}
