package org.irlens.api;

import org.irlens.path.NodePath;

/**
 * Thrown by the path resolver when a segment of a {@link NodePath} cannot be applied.
 * The exception records how many leading segments did resolve, so callers can report
 * "valid up to here".
 */
public class PathNotFoundException extends IrLensException {

    private final NodePath path;
    private final int resolvedPrefixLength;

    /**
     * @param path The path that failed to resolve.
     * @param resolvedPrefixLength Number of leading segments that resolved successfully.
     * @param reason Why the next segment could not be applied.
     */
    public PathNotFoundException(NodePath path, int resolvedPrefixLength, String reason) {
        super(IrErrorCode.PATH_NOT_FOUND,
                String.format("Path %s is valid only up to %s: %s",
                        path, path.prefix(resolvedPrefixLength), reason));
        this.path = path;
        this.resolvedPrefixLength = resolvedPrefixLength;
    }

    public NodePath path() {
        return path;
    }

    /**
     * @return The number of leading segments that resolved before the failure.
     */
    public int resolvedPrefixLength() {
        return resolvedPrefixLength;
    }

    /**
     * @return The longest prefix of the path that still resolves.
     */
    public NodePath validPrefix() {
        return path.prefix(resolvedPrefixLength);
    }
}
