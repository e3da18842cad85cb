package org.irlens.ir;

/**
 * Stable identity of a node: the arena that allocated it and its index in that arena.
 * Handles compare by value, which makes them safe map keys for identity-based lookups
 * where structurally equal nodes must stay distinct.
 *
 * @param arenaId The id of the allocating {@link IrArena}.
 * @param index The allocation index within that arena.
 */
public record NodeHandle(int arenaId, int index) {

    @Override
    public String toString() {
        return "#" + arenaId + ":" + index;
    }
}
