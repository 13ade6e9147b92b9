package info.isaksson.erland.constructtiers.classify;

import info.isaksson.erland.constructtiers.ir.SourceLocation;

/** A node's children or attributes violate its kind's structural contract. */
public final class MalformedNodeException extends ClassificationException {

    public static final String CODE = "MALFORMED_NODE";

    public MalformedNodeException(String file, int nodeId, SourceLocation location, String message) {
        super(CODE, file, nodeId, location, message);
    }

    public MalformedNodeException(String file, int nodeId, SourceLocation location, String message, Throwable cause) {
        super(CODE, file, nodeId, location, message, cause);
    }
}
