package info.isaksson.erland.constructtiers.classify;

import info.isaksson.erland.constructtiers.ir.SourceLocation;

/** Strict validation found Native constructs. Points at the first one in source order. */
public final class NativeConstructsNotAllowedException extends ClassificationException {

    public static final String CODE = "NATIVE_CONSTRUCTS_NOT_ALLOWED";

    public final int nativeCount;

    public NativeConstructsNotAllowedException(String file, int firstNodeId, SourceLocation firstLocation, int nativeCount) {
        super(CODE, file, firstNodeId, firstLocation,
                nativeCount + " Native construct(s) not allowed in strict mode, first at " + firstLocation);
        this.nativeCount = nativeCount;
    }
}
