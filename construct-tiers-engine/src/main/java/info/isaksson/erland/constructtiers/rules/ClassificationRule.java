package info.isaksson.erland.constructtiers.rules;

import info.isaksson.erland.constructtiers.ir.NodeKind;

import java.util.Objects;

/**
 * Maps nodes of one kind whose shape satisfies {@link #predicate} to a tier.
 *
 * <p>The default rule has no kind and no predicate; it catches everything no other rule claims.</p>
 */
public final class ClassificationRule {
    public final String id;
    /** Null only for the default rule. */
    public final NodeKind kind;
    public final RulePriority priority;
    public final Tier tier;
    public final String rationale;
    public final ShapePredicate predicate;

    public ClassificationRule(String id, NodeKind kind, RulePriority priority, Tier tier, String rationale, ShapePredicate predicate) {
        if (id == null || id.isBlank()) throw new RuleTableException("rule id must not be blank");
        if (priority == null) throw new RuleTableException("rule " + id + " has no priority");
        if (tier == null) throw new RuleTableException("rule " + id + " has no tier");
        if (priority == RulePriority.DEFAULT) {
            if (kind != null) throw new RuleTableException("default rule " + id + " must not name a kind");
            if (predicate != null && !predicate.isAny()) {
                throw new RuleTableException("default rule " + id + " must not have shape constraints");
            }
            if (tier != Tier.NATIVE) {
                throw new RuleTableException("default rule " + id + " must classify Native, not " + tier.displayName());
            }
        } else if (kind == null) {
            throw new RuleTableException("rule " + id + " must name a kind");
        }
        this.id = id.trim();
        this.kind = kind;
        this.priority = priority;
        this.tier = tier;
        this.rationale = rationale == null ? "" : rationale;
        this.predicate = predicate == null ? ShapePredicate.ANY : predicate;
    }

    public static ClassificationRule override(String id, NodeKind kind, Tier tier, String rationale, ShapeConstraint... when) {
        return new ClassificationRule(id, kind, RulePriority.OVERRIDE, tier, rationale, ShapePredicate.of(when));
    }

    public static ClassificationRule specific(String id, NodeKind kind, Tier tier, String rationale, ShapeConstraint... when) {
        return new ClassificationRule(id, kind, RulePriority.SPECIFIC, tier, rationale, ShapePredicate.of(when));
    }

    public static ClassificationRule defaultRule(String id, String rationale) {
        return new ClassificationRule(id, null, RulePriority.DEFAULT, Tier.NATIVE, rationale, ShapePredicate.ANY);
    }

    /** Same priority, same kind and overlapping shapes. */
    public boolean conflictsWith(ClassificationRule other) {
        return priority == other.priority
                && kind == other.kind
                && predicate.overlaps(other.predicate);
    }

    /**
     * @throws ShapeMeasureException if a consulted attribute is not numeric
     */
    public boolean matches(NodeShape shape) {
        if (kind != null && kind != shape.kind()) return false;
        return predicate.matches(shape);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassificationRule)) return false;
        ClassificationRule that = (ClassificationRule) o;
        return id.equals(that.id) &&
                kind == that.kind &&
                priority == that.priority &&
                tier == that.tier &&
                rationale.equals(that.rationale) &&
                predicate.equals(that.predicate);
    }

    @Override public int hashCode() {
        return Objects.hash(id, kind, priority, tier, rationale, predicate);
    }

    @Override public String toString() {
        return id + "[" + priority + " " + (kind == null ? "*" : kind.tag()) + " when " + predicate + " -> " + tier.displayName() + "]";
    }
}
