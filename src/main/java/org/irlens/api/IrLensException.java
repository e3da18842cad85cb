package org.irlens.api;

/**
 * Base class of the checked exceptions thrown when a caller breaks the contract of the
 * resolver, renderer or codec. Every instance carries an {@link IrErrorCode}.
 */
public class IrLensException extends Exception {

    private final IrErrorCode code;

    /**
     * Constructs a new exception with the given code and detail message.
     * @param code The error code.
     * @param message The detail message.
     */
    public IrLensException(IrErrorCode code, String message) {
        super(message, null);
        this.code = code;
    }

    /**
     * Constructs a new exception with the given code, detail message and cause.
     * @param code The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public IrLensException(IrErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * @return The error code identifying this failure.
     */
    public IrErrorCode code() {
        return code;
    }
}
