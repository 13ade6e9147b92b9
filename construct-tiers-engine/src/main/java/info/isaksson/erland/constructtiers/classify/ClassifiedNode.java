package info.isaksson.erland.constructtiers.classify;

import info.isaksson.erland.constructtiers.ir.Node;
import info.isaksson.erland.constructtiers.rules.ClassificationRule;
import info.isaksson.erland.constructtiers.rules.Tier;

/**
 * A node with its resolved tiers.
 *
 * <p>{@link #ownTier} comes from the node's rule alone; {@link #effectiveTier} is the worst tier
 * anywhere in its subtree. When a child raised the effective tier, {@link #escalatedBy} names the
 * first such child.</p>
 */
public final class ClassifiedNode {
    public static final int NOT_ESCALATED = -1;

    public final Node node;
    public final Tier ownTier;
    public final ClassificationRule rule;
    public final Tier effectiveTier;
    public final int escalatedBy;
    public final int depth;

    ClassifiedNode(Node node, Tier ownTier, ClassificationRule rule, Tier effectiveTier, int escalatedBy, int depth) {
        this.node = node;
        this.ownTier = ownTier;
        this.rule = rule;
        this.effectiveTier = effectiveTier;
        this.escalatedBy = escalatedBy;
        this.depth = depth;
    }

    public int id() {
        return node.id;
    }

    public String ruleId() {
        return rule.id;
    }

    public String rationale() {
        return rule.rationale;
    }

    public boolean isEscalated() {
        return escalatedBy != NOT_ESCALATED;
    }

    @Override public String toString() {
        return node.tag + "#" + node.id + "[" + ownTier.displayName() + "/" + effectiveTier.displayName() + " by " + rule.id + "]";
    }
}
