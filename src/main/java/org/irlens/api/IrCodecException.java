package org.irlens.api;

/**
 * Thrown when a JSON document cannot be decoded into a tree, path or mismatch record.
 */
public class IrCodecException extends IrLensException {

    public IrCodecException(String message) {
        super(IrErrorCode.INVALID_JSON, message);
    }

    public IrCodecException(String message, Throwable cause) {
        super(IrErrorCode.INVALID_JSON, message, cause);
    }
}
