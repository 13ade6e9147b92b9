package info.isaksson.erland.constructtiers.rules;

import java.util.Objects;

/**
 * An integer-valued structural measure of a node that rule predicates constrain.
 *
 * <ul>
 *   <li>{@code children} - number of child nodes (operands of a comparison, items of a with)</li>
 *   <li>{@code depth} - nesting depth from the file root, root = 0</li>
 *   <li>{@code attr.<name>} - integer attribute; {@code true}/{@code false} read as 1/0, absent as 0</li>
 *   <li>{@code has.<name>} - 1 if the attribute carries a value, 0 if it is absent, blank, {@code 0} or
 *       {@code false}; the value itself may be any text</li>
 * </ul>
 */
public final class ShapeMeasure {

    public enum Source { CHILDREN, DEPTH, ATTRIBUTE, PRESENCE }

    private static final String ATTR_PREFIX = "attr.";
    private static final String HAS_PREFIX = "has.";

    public static final ShapeMeasure CHILDREN = new ShapeMeasure(Source.CHILDREN, null);
    public static final ShapeMeasure DEPTH = new ShapeMeasure(Source.DEPTH, null);

    public final Source source;
    /** Attribute key for {@link Source#ATTRIBUTE} and {@link Source#PRESENCE}, else null. */
    public final String attribute;

    private ShapeMeasure(Source source, String attribute) {
        this.source = source;
        this.attribute = attribute;
    }

    public static ShapeMeasure attribute(String key) {
        if (key == null || key.isBlank()) throw new RuleTableException("attribute measure needs a key");
        return new ShapeMeasure(Source.ATTRIBUTE, key.trim());
    }

    public static ShapeMeasure presence(String key) {
        if (key == null || key.isBlank()) throw new RuleTableException("presence measure needs a key");
        return new ShapeMeasure(Source.PRESENCE, key.trim());
    }

    /** Parses {@code children}, {@code depth}, {@code attr.<name>} or {@code has.<name>}. */
    public static ShapeMeasure parse(String key) {
        if (key == null) throw new RuleTableException("measure must not be null");
        String k = key.trim();
        if ("children".equals(k)) return CHILDREN;
        if ("depth".equals(k)) return DEPTH;
        if (k.startsWith(ATTR_PREFIX)) return attribute(k.substring(ATTR_PREFIX.length()));
        if (k.startsWith(HAS_PREFIX)) return presence(k.substring(HAS_PREFIX.length()));
        throw new RuleTableException("unknown shape measure '" + key + "' (expected children, depth, attr.<name> or has.<name>)");
    }

    public String key() {
        switch (source) {
            case CHILDREN: return "children";
            case DEPTH: return "depth";
            case PRESENCE: return HAS_PREFIX + attribute;
            default: return ATTR_PREFIX + attribute;
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShapeMeasure)) return false;
        ShapeMeasure that = (ShapeMeasure) o;
        return source == that.source && Objects.equals(attribute, that.attribute);
    }

    @Override public int hashCode() {
        return Objects.hash(source, attribute);
    }

    @Override public String toString() {
        return key();
    }
}
