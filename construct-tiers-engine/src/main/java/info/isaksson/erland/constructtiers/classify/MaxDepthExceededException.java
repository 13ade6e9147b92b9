package info.isaksson.erland.constructtiers.classify;

import info.isaksson.erland.constructtiers.ir.SourceLocation;

/** The tree nests deeper than the configured maximum. */
public final class MaxDepthExceededException extends ClassificationException {

    public static final String CODE = "MAX_DEPTH_EXCEEDED";

    public final int depth;
    public final int maxDepth;

    public MaxDepthExceededException(String file, int nodeId, SourceLocation location, int depth, int maxDepth) {
        super(CODE, file, nodeId, location, "tree depth " + depth + " exceeds maximum " + maxDepth);
        this.depth = depth;
        this.maxDepth = maxDepth;
    }
}
