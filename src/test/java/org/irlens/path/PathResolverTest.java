package org.irlens.path;

import org.irlens.api.IrErrorCode;
import org.irlens.api.PathNotFoundException;
import org.irlens.ir.IrNode;
import org.irlens.ir.tir.TirBuilder;
import org.irlens.ir.tir.TirSamples;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class PathResolverTest {

    private TirBuilder tb;
    private IrNode.Composite func;

    @BeforeEach
    void setUp() {
        tb = new TirBuilder();
        func = TirSamples.copy2d(tb, 256);
    }

    @Test
    void emptyPathResolvesToRoot() throws Exception {
        assertSame(func, PathResolver.resolve(func, NodePath.root()));
    }

    @Test
    void resolvesThroughKeyFieldIndexAndAttr() throws Exception {
        IrNode b = new TirBuilder().handleVar("b");
        NodePath path = NodePath.root().field("buffer_map").key(b).field("shape").index(1).attr("value");

        IrNode.Leaf leaf = (IrNode.Leaf) PathResolver.resolve(func, path);

        assertEquals("256", leaf.value().literal());
    }

    @Test
    void fieldAndAttrResolveTheSameChild() throws Exception {
        NodePath base = NodePath.root().field("body").field("extent");

        assertSame(PathResolver.resolve(func, base.attr("value")), PathResolver.resolve(func, base.field("value")));
    }

    @Test
    void missingFieldReportsResolvedPrefix() {
        NodePath path = NodePath.root().field("body").field("nope").index(0);

        PathNotFoundException e = assertThrows(PathNotFoundException.class, () -> PathResolver.resolve(func, path));

        assertEquals(IrErrorCode.PATH_NOT_FOUND, e.code());
        assertEquals(1, e.resolvedPrefixLength());
        assertEquals(NodePath.root().field("body"), e.validPrefix());
    }

    @Test
    void indexOutOfBoundsFails() {
        NodePath path = NodePath.root().field("params").index(2);

        PathNotFoundException e = assertThrows(PathNotFoundException.class, () -> PathResolver.resolve(func, path));

        assertEquals(1, e.resolvedPrefixLength());
        assertTrue(e.getMessage().contains("out of bounds"));
    }

    @Test
    void wrongSegmentTypeFails() {
        NodePath path = NodePath.root().index(0);

        PathNotFoundException e = assertThrows(PathNotFoundException.class, () -> PathResolver.resolve(func, path));

        assertEquals(0, e.resolvedPrefixLength());
    }

    @Test
    void unknownKeyFails() {
        NodePath path = NodePath.root().field("buffer_map").key(tb.handleVar("zzz"));

        assertThrows(PathNotFoundException.class, () -> PathResolver.resolve(func, path));
        assertTrue(PathResolver.tryResolve(func, path).isEmpty());
    }
}
