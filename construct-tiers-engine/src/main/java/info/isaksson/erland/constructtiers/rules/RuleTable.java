package info.isaksson.erland.constructtiers.rules;

import info.isaksson.erland.constructtiers.ir.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable lookup from a node to the rule that decides its tier.
 *
 * <p>Resolution order: the {@link OverrideResolver} first, then the specific rules of the
 * node's kind, then the single default rule (Native). Conflicting registrations are rejected
 * while the table is built, never at lookup time.</p>
 *
 * <p>A built table holds no mutable state and may be shared by any number of threads.</p>
 */
public final class RuleTable {

    private static final Logger LOG = LoggerFactory.getLogger(RuleTable.class);

    public static final String DEFAULT_RULE_ID = "default.unlisted-kind";
    public static final String DEFAULT_RULE_RATIONALE =
            "unlisted construct: assumed not portable until a rule vets it";

    private final ClassifierOptions options;
    private final OverrideResolver overrides;
    private final Map<NodeKind, List<ClassificationRule>> specific;
    private final ClassificationRule defaultRule;
    private final List<ClassificationRule> rules;

    private RuleTable(ClassifierOptions options,
                      OverrideResolver overrides,
                      Map<NodeKind, List<ClassificationRule>> specific,
                      ClassificationRule defaultRule,
                      List<ClassificationRule> rules) {
        this.options = options;
        this.overrides = overrides;
        this.specific = specific;
        this.defaultRule = defaultRule;
        this.rules = rules;
    }

    /**
     * Resolve the rule for one node.
     *
     * @throws ShapeMeasureException if a rule consults an attribute that is not numeric
     */
    public RuleMatch classify(NodeShape shape) {
        if (shape == null) throw new IllegalArgumentException("shape must not be null");
        NodeKind kind = shape.kind();
        if (!knows(kind)) {
            return new RuleMatch(defaultRule, true, false);
        }

        ClassificationRule override = overrides.resolve(shape);
        if (override != null) return new RuleMatch(override, false, false);

        List<ClassificationRule> candidates = specific.get(kind);
        if (candidates != null) {
            for (ClassificationRule r : candidates) {
                if (r.predicate.matches(shape)) return new RuleMatch(r, false, false);
            }
        }
        return new RuleMatch(defaultRule, false, true);
    }

    /** True if the kind has at least one override or specific rule. */
    public boolean knows(NodeKind kind) {
        if (kind == null || kind == NodeKind.UNKNOWN) return false;
        return overrides.hasOverrides(kind) || specific.containsKey(kind);
    }

    public ClassifierOptions options() {
        return options;
    }

    public TierOrder tierOrder() {
        return options.tierOrder;
    }

    public OverrideResolver overrides() {
        return overrides;
    }

    public List<ClassificationRule> specificRules(NodeKind kind) {
        List<ClassificationRule> r = specific.get(kind);
        return r == null ? List.of() : r;
    }

    public ClassificationRule defaultRule() {
        return defaultRule;
    }

    /** All rules in registration order, default rule last. */
    public List<ClassificationRule> rules() {
        return rules;
    }

    public ClassificationRule rule(String id) {
        for (ClassificationRule r : rules) {
            if (r.id.equals(id)) return r;
        }
        return null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects rules and checks each registration against the ones before it.
     */
    public static final class Builder {
        private ClassifierOptions options = ClassifierOptions.defaults();
        private final Map<String, ClassificationRule> byId = new LinkedHashMap<>();
        private ClassificationRule defaultRule;

        private Builder() {}

        public Builder options(ClassifierOptions options) {
            this.options = options == null ? ClassifierOptions.defaults() : options;
            return this;
        }

        /**
         * @throws RuleConflictException if the rule reuses an id, is a second default rule, or
         *                               overlaps a rule of the same kind and priority
         */
        public Builder add(ClassificationRule rule) {
            if (rule == null) throw new RuleTableException("rule must not be null");
            ClassificationRule sameId = byId.get(rule.id);
            if (sameId != null) {
                throw new RuleConflictException(sameId.id, rule.id, "duplicate rule id '" + rule.id + "'");
            }
            if (rule.priority == RulePriority.DEFAULT) {
                if (defaultRule != null) {
                    throw new RuleConflictException(defaultRule.id, rule.id,
                            "two default rules: '" + defaultRule.id + "' and '" + rule.id + "'");
                }
                defaultRule = rule;
            } else {
                for (ClassificationRule existing : byId.values()) {
                    if (existing.conflictsWith(rule)) {
                        throw new RuleConflictException(existing.id, rule.id,
                                "rules '" + existing.id + "' (" + existing.predicate + ") and '" + rule.id + "' ("
                                        + rule.predicate + ") both claim " + rule.kind.tag() + " at priority " + rule.priority);
                    }
                }
            }
            byId.put(rule.id, rule);
            return this;
        }

        public Builder addAll(List<ClassificationRule> rules) {
            for (ClassificationRule r : rules) add(r);
            return this;
        }

        public Builder override(String id, NodeKind kind, Tier tier, String rationale, ShapeConstraint... when) {
            return add(ClassificationRule.override(id, kind, tier, rationale, when));
        }

        public Builder specific(String id, NodeKind kind, Tier tier, String rationale, ShapeConstraint... when) {
            return add(ClassificationRule.specific(id, kind, tier, rationale, when));
        }

        public Builder defaultRule(String id, String rationale) {
            return add(ClassificationRule.defaultRule(id, rationale));
        }

        public RuleTable build() {
            ClassificationRule fallback = defaultRule != null
                    ? defaultRule
                    : ClassificationRule.defaultRule(DEFAULT_RULE_ID, DEFAULT_RULE_RATIONALE);

            List<ClassificationRule> overrideRules = new ArrayList<>();
            Map<NodeKind, List<ClassificationRule>> specific = new EnumMap<>(NodeKind.class);
            List<ClassificationRule> all = new ArrayList<>();
            for (ClassificationRule r : byId.values()) {
                if (r.priority == RulePriority.OVERRIDE) {
                    overrideRules.add(r);
                } else if (r.priority == RulePriority.SPECIFIC) {
                    specific.computeIfAbsent(r.kind, k -> new ArrayList<>()).add(r);
                } else {
                    continue;
                }
                all.add(r);
            }
            for (Map.Entry<NodeKind, List<ClassificationRule>> e : specific.entrySet()) {
                e.setValue(List.copyOf(e.getValue()));
            }
            all.add(fallback);

            RuleTable table = new RuleTable(
                    options,
                    OverrideResolver.of(overrideRules),
                    Collections.unmodifiableMap(specific),
                    fallback,
                    List.copyOf(all)
            );
            LOG.debug("Built rule table: {} overrides, {} specific rules over {} kinds, default '{}', {}",
                    overrideRules.size(), all.size() - overrideRules.size() - 1, specific.size(), fallback.id, options);
            return table;
        }
    }
}
