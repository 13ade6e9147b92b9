package info.isaksson.erland.constructtiers.rules;

/** Outcome of a rule table lookup for one node. */
public final class RuleMatch {
    public final ClassificationRule rule;

    /** The node's kind has no override or specific rule in the table. */
    public final boolean unknownKind;

    /** The kind is known but no rule covered this node's shape. */
    public final boolean unmatchedShape;

    RuleMatch(ClassificationRule rule, boolean unknownKind, boolean unmatchedShape) {
        this.rule = rule;
        this.unknownKind = unknownKind;
        this.unmatchedShape = unmatchedShape;
    }

    public Tier tier() {
        return rule.tier;
    }

    public String ruleId() {
        return rule.id;
    }

    public String rationale() {
        return rule.rationale;
    }

    public boolean isDefault() {
        return rule.priority == RulePriority.DEFAULT;
    }
}
