package info.isaksson.erland.constructtiers.classify;

import info.isaksson.erland.constructtiers.ir.SourceLocation;

/**
 * Classification of one file failed. The file produces no report; other files are unaffected.
 */
public abstract class ClassificationException extends Exception {

    /** Error code stable across versions. */
    public final String code;
    public final String file;
    /** Offending node, or null for file-level failures. */
    public final Integer nodeId;
    public final SourceLocation location;

    protected ClassificationException(String code, String file, Integer nodeId, SourceLocation location, String message) {
        this(code, file, nodeId, location, message, null);
    }

    protected ClassificationException(String code, String file, Integer nodeId, SourceLocation location, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.file = file;
        this.nodeId = nodeId;
        this.location = location;
    }
}
