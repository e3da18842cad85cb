package org.irlens.api;

import org.irlens.ir.NodeHandle;

/**
 * Thrown when an identity-based render request names a node that never occurs in the
 * tree being rendered. A request that matches nothing is reported instead of ignored.
 */
public class UnderlineTargetNotFoundException extends IrLensException {

    private final NodeHandle handle;

    public UnderlineTargetNotFoundException(NodeHandle handle) {
        super(IrErrorCode.UNDERLINE_TARGET_NOT_FOUND,
                "Node " + handle + " does not occur in the rendered tree");
        this.handle = handle;
    }

    public NodeHandle handle() {
        return handle;
    }
}
