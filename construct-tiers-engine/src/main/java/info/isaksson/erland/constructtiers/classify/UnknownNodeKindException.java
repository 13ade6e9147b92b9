package info.isaksson.erland.constructtiers.classify;

import info.isaksson.erland.constructtiers.ir.SourceLocation;

/** A node kind the rule table does not list, under {@code strictUnknownKinds}. */
public final class UnknownNodeKindException extends ClassificationException {

    public static final String CODE = "UNKNOWN_NODE_KIND";

    public final String tag;

    public UnknownNodeKindException(String file, int nodeId, String tag, SourceLocation location) {
        super(CODE, file, nodeId, location, "node kind '" + tag + "' is not listed in the rule table");
        this.tag = tag;
    }
}
