package info.isaksson.erland.constructtiers.rules;

import info.isaksson.erland.constructtiers.ir.Node;
import info.isaksson.erland.constructtiers.ir.NodeKind;

import java.util.Locale;

/** A node as seen by rule predicates: the node itself plus its position in the tree. */
public final class NodeShape {
    public final Node node;
    public final int depth;

    public NodeShape(Node node, int depth) {
        if (node == null) throw new IllegalArgumentException("node must not be null");
        this.node = node;
        this.depth = depth;
    }

    public NodeKind kind() {
        return node.kind();
    }

    /**
     * @throws ShapeMeasureException if an attribute measure reads a non-numeric value
     */
    public int measure(ShapeMeasure measure) {
        switch (measure.source) {
            case CHILDREN:
                return node.childCount();
            case DEPTH:
                return depth;
            case PRESENCE:
                return presence(measure.attribute);
            default:
                return attributeValue(measure.attribute);
        }
    }

    private int presence(String key) {
        String raw = node.attribute(key);
        if (raw == null) return 0;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        return v.isEmpty() || "0".equals(v) || "false".equals(v) ? 0 : 1;
    }

    private int attributeValue(String key) {
        String raw = node.attribute(key);
        if (raw == null) return 0;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(v)) return 1;
        if ("false".equals(v) || v.isEmpty()) return 0;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new ShapeMeasureException(node.id, key, raw);
        }
    }
}
