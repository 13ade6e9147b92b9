package info.isaksson.erland.constructtiers.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conjunction of {@link ShapeConstraint}s. The empty predicate matches every node.
 *
 * <p>Constraints on the same measure are intersected into one interval, which makes overlap
 * between two predicates decidable: they overlap unless some measure constrained by both has
 * disjoint intervals.</p>
 */
public final class ShapePredicate {

    public static final ShapePredicate ANY = new ShapePredicate(List.of());

    private final List<ShapeConstraint> constraints;
    private final Map<ShapeMeasure, long[]> intervals;

    private ShapePredicate(List<ShapeConstraint> constraints) {
        this.constraints = List.copyOf(constraints);
        Map<ShapeMeasure, long[]> byMeasure = new LinkedHashMap<>();
        for (ShapeConstraint c : this.constraints) {
            long[] iv = byMeasure.computeIfAbsent(c.shapeMeasure(), m -> new long[] {Long.MIN_VALUE, Long.MAX_VALUE});
            iv[0] = Math.max(iv[0], c.lower());
            iv[1] = Math.min(iv[1], c.upper());
        }
        this.intervals = Collections.unmodifiableMap(byMeasure);
    }

    /**
     * @throws RuleTableException if the constraints cannot all hold at once
     */
    public static ShapePredicate of(List<ShapeConstraint> constraints) {
        if (constraints == null || constraints.isEmpty()) return ANY;
        List<ShapeConstraint> cs = new ArrayList<>(constraints.size());
        for (ShapeConstraint c : constraints) {
            if (c == null) throw new RuleTableException("null shape constraint");
            cs.add(c);
        }
        ShapePredicate p = new ShapePredicate(cs);
        for (Map.Entry<ShapeMeasure, long[]> e : p.intervals.entrySet()) {
            if (e.getValue()[0] > e.getValue()[1]) {
                throw new RuleTableException("unsatisfiable constraints on " + e.getKey() + ": " + cs);
            }
        }
        return p;
    }

    public static ShapePredicate of(ShapeConstraint... constraints) {
        return of(List.of(constraints));
    }

    public List<ShapeConstraint> constraints() {
        return constraints;
    }

    public boolean isAny() {
        return constraints.isEmpty();
    }

    /**
     * @throws ShapeMeasureException if a consulted attribute is not numeric
     */
    public boolean matches(NodeShape shape) {
        for (Map.Entry<ShapeMeasure, long[]> e : intervals.entrySet()) {
            int v = shape.measure(e.getKey());
            if (v < e.getValue()[0] || v > e.getValue()[1]) return false;
        }
        return true;
    }

    /** True if some node shape could satisfy both predicates. */
    public boolean overlaps(ShapePredicate other) {
        for (Map.Entry<ShapeMeasure, long[]> e : intervals.entrySet()) {
            long[] theirs = other.intervals.get(e.getKey());
            if (theirs == null) continue;
            long[] ours = e.getValue();
            if (ours[1] < theirs[0] || theirs[1] < ours[0]) return false;
        }
        return true;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShapePredicate)) return false;
        return constraints.equals(((ShapePredicate) o).constraints);
    }

    @Override public int hashCode() {
        return constraints.hashCode();
    }

    @Override public String toString() {
        if (constraints.isEmpty()) return "any";
        StringBuilder sb = new StringBuilder();
        for (ShapeConstraint c : constraints) {
            if (sb.length() > 0) sb.append(" and ");
            sb.append(c);
        }
        return sb.toString();
    }
}
