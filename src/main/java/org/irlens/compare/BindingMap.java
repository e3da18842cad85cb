package org.irlens.compare;

import org.irlens.ir.IrNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * A scoped bijection between bound variables of the left and right tree. A scope is
 * pushed when the comparison enters a binder node (a function, loop, let or block) and
 * popped when it leaves; lookups search from the innermost scope outwards, so inner
 * bindings shadow outer ones.
 * <p>
 * Variables are keyed by identity. One instance serves exactly one comparison call.
 */
public class BindingMap {

    private static final Logger log = LoggerFactory.getLogger(BindingMap.class);

    /**
     * One lexical scope.
     */
    private static final class Scope {
        private final Map<IrNode, IrNode> lhsToRhs = new IdentityHashMap<>();
        private final Map<IrNode, IrNode> rhsToLhs = new IdentityHashMap<>();
    }

    private final Deque<Scope> scopes = new ArrayDeque<>();

    public BindingMap() {
        scopes.push(new Scope());
    }

    /**
     * Enters a new scope.
     */
    public void enterScope() {
        scopes.push(new Scope());
        log.trace("Entered binding scope, depth {}", scopes.size());
    }

    /**
     * Leaves the current scope. The outermost scope is never removed.
     */
    public void leaveScope() {
        if (scopes.size() > 1) {
            scopes.pop();
        }
        log.trace("Left binding scope, depth {}", scopes.size());
    }

    /**
     * @return The number of open scopes, including the outermost one.
     */
    public int depth() {
        return scopes.size();
    }

    /**
     * Records that two variables occupy corresponding binder positions.
     *
     * @param lhs The variable of the left tree.
     * @param rhs The variable of the right tree.
     */
    public void bind(IrNode lhs, IrNode rhs) {
        Scope scope = scopes.peek();
        scope.lhsToRhs.put(lhs, rhs);
        scope.rhsToLhs.put(rhs, lhs);
    }

    /**
     * @param lhs A variable of the left tree.
     * @return The right-tree variable it is bound to, searching innermost scope first.
     */
    public Optional<IrNode> rhsFor(IrNode lhs) {
        for (Iterator<Scope> it = scopes.iterator(); it.hasNext(); ) {
            IrNode found = it.next().lhsToRhs.get(lhs);
            if (found != null) return Optional.of(found);
        }
        return Optional.empty();
    }

    /**
     * @param rhs A variable of the right tree.
     * @return The left-tree variable it is bound to, searching innermost scope first.
     */
    public Optional<IrNode> lhsFor(IrNode rhs) {
        for (Iterator<Scope> it = scopes.iterator(); it.hasNext(); ) {
            IrNode found = it.next().rhsToLhs.get(rhs);
            if (found != null) return Optional.of(found);
        }
        return Optional.empty();
    }

    /**
     * Checks whether two variable references correspond under the bindings in scope. Two
     * unbound references correspond only if they are the same node.
     *
     * @param lhs A variable of the left tree.
     * @param rhs A variable of the right tree.
     * @return {@code true} if the references correspond.
     */
    public boolean corresponds(IrNode lhs, IrNode rhs) {
        Optional<IrNode> mappedRhs = rhsFor(lhs);
        Optional<IrNode> mappedLhs = lhsFor(rhs);
        if (mappedRhs.isEmpty() && mappedLhs.isEmpty()) {
            return lhs == rhs;
        }
        return mappedRhs.isPresent() && mappedRhs.get() == rhs
                && mappedLhs.isPresent() && mappedLhs.get() == lhs;
    }
}
