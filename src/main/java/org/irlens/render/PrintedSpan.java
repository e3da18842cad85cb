package org.irlens.render;

import org.irlens.ir.IrNode;
import org.irlens.path.NodePath;

/**
 * A span recorded while printing, still in base-text coordinates (before overlay lines are
 * inserted).
 */
record PrintedSpan(NodePath path, IrNode node, TextBuffer.Position start, TextBuffer.Position end, int ordinal) {}
