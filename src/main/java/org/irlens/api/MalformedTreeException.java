package org.irlens.api;

/**
 * Thrown when an input tree violates its schema: a field its kind does not declare, or
 * a kind without a schema. Cycles need no check here, since {@link org.irlens.ir.IrArena} only
 * links nodes that already exist. These indicate a defect in whoever built
 * the tree and are not recoverable within the call that detected them.
 */
public class MalformedTreeException extends RuntimeException {

    private final IrErrorCode code;
    private final String location;

    /**
     * @param code The error code.
     * @param message The detail message.
     * @param location Human-readable path of the node where the problem was detected.
     */
    public MalformedTreeException(IrErrorCode code, String message, String location) {
        super(String.format("%s at %s", message, location));
        this.code = code;
        this.location = location;
    }

    public IrErrorCode code() {
        return code;
    }

    public String location() {
        return location;
    }
}
