package org.irlens.ir;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class IrArenaTest {

    @Test
    void handles_areSequentialWithinAnArena() {
        IrArena arena = new IrArena();

        IrNode a = arena.intLeaf(1);
        IrNode b = arena.intLeaf(1);

        assertThat(a.handle()).isEqualTo(new NodeHandle(arena.id(), 0));
        assertThat(b.handle()).isEqualTo(new NodeHandle(arena.id(), 1));
        assertThat(arena.size()).isEqualTo(2);
        assertThat(arena.get(b.handle())).containsSame(b);
    }

    @Test
    void get_foreignOrOutOfRangeHandle_isEmpty() {
        IrArena arena = new IrArena();
        IrArena other = new IrArena();
        IrNode node = other.strLeaf("x");

        assertThat(arena.id()).isNotEqualTo(other.id());
        assertThat(arena.get(node.handle())).isEmpty();
        assertThat(other.get(new NodeHandle(other.id(), 5))).isEmpty();
    }

    @Test
    void composite_keepsConstructionOrderAndIsImmutable() {
        IrArena arena = new IrArena();
        Map<String, IrNode> fields = new LinkedHashMap<>();
        fields.put("z", arena.intLeaf(1));
        fields.put("a", arena.intLeaf(2));

        IrNode.Composite node = arena.composite("k", fields);
        fields.clear();

        assertThat(node.fields().keySet()).containsExactly("z", "a");
        assertThat(node.children()).hasSize(2);
        assertThatThrownBy(() -> node.fields().put("b", arena.intLeaf(3)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void mappingFind_prefersIdentityThenStructure() {
        IrArena arena = new IrArena();
        IrNode key1 = arena.strLeaf("k");
        IrNode key2 = arena.strLeaf("k");
        IrNode.Mapping mapping = arena.mapping(List.of(
                IrArena.entry(key1, arena.intLeaf(1)),
                IrArena.entry(key2, arena.intLeaf(2))));

        assertThat(mapping.find(key2)).containsSame(mapping.entries().get(1));
        assertThat(mapping.find(arena.strLeaf("k")).orElseThrow().key()).isSameAs(key1);
        assertThat(mapping.find(arena.strLeaf("other"))).isEmpty();
    }

    @Test
    void containers_copyTheirContents_soNoNodeCanContainItself() {
        IrArena arena = new IrArena();
        List<IrNode> elements = new ArrayList<>(List.of(arena.intLeaf(1)));
        Map<String, IrNode> fields = new LinkedHashMap<>();
        fields.put("value", arena.intLeaf(2));

        IrNode.Sequence sequence = arena.sequence(elements);
        IrNode.Composite composite = arena.composite("evaluate", fields);
        elements.add(sequence);
        fields.put("value", composite);

        assertThat(sequence.elements()).hasSize(1).doesNotContain(sequence);
        assertThat(composite.fields().get("value")).isInstanceOf(IrNode.Leaf.class);
    }
}
