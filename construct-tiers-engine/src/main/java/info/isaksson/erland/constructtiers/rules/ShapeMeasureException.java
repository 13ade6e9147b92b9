package info.isaksson.erland.constructtiers.rules;

/** A node attribute consulted by a rule is not an integer or boolean. */
public final class ShapeMeasureException extends RuntimeException {

    public final int nodeId;
    public final String attribute;
    public final String value;

    public ShapeMeasureException(int nodeId, String attribute, String value) {
        super("attribute '" + attribute + "' of node " + nodeId + " is not an integer or boolean: '" + value + "'");
        this.nodeId = nodeId;
        this.attribute = attribute;
        this.value = value;
    }
}
