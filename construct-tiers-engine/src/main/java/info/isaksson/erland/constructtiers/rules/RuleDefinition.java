package info.isaksson.erland.constructtiers.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.constructtiers.ir.NodeKind;

import java.util.List;
import java.util.Objects;

/** Declarative form of a {@link ClassificationRule}, as written in rule-set files. */
@JsonPropertyOrder({"id","kind","priority","tier","rationale","when"})
public final class RuleDefinition {
    public final String id;

    /** Kind tag or enum name; omitted for the default rule. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String kind;

    public final RulePriority priority;
    public final Tier tier;
    public final String rationale;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<ShapeConstraint> when;

    @JsonCreator
    public RuleDefinition(
            @JsonProperty("id") String id,
            @JsonProperty("kind") String kind,
            @JsonProperty("priority") RulePriority priority,
            @JsonProperty("tier") Tier tier,
            @JsonProperty("rationale") String rationale,
            @JsonProperty("when") List<ShapeConstraint> when
    ) {
        this.id = id;
        this.kind = kind;
        this.priority = priority == null ? RulePriority.SPECIFIC : priority;
        this.tier = tier;
        this.rationale = rationale;
        this.when = when == null ? List.of() : List.copyOf(when);
    }

    public static RuleDefinition of(ClassificationRule rule) {
        return new RuleDefinition(
                rule.id,
                rule.kind == null ? null : rule.kind.tag(),
                rule.priority,
                rule.tier,
                rule.rationale,
                rule.predicate.constraints()
        );
    }

    /**
     * @throws RuleTableException if the kind is not part of the vocabulary or the rule is invalid
     */
    public ClassificationRule toRule() {
        NodeKind k = null;
        if (kind != null) {
            k = NodeKind.fromTag(kind);
            if (k == NodeKind.UNKNOWN) {
                throw new RuleTableException("rule " + id + " names unknown node kind '" + kind + "'");
            }
        }
        return new ClassificationRule(id, k, priority, tier, rationale, ShapePredicate.of(when));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RuleDefinition)) return false;
        RuleDefinition that = (RuleDefinition) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(kind, that.kind) &&
                priority == that.priority &&
                tier == that.tier &&
                Objects.equals(rationale, that.rationale) &&
                Objects.equals(when, that.when);
    }

    @Override public int hashCode() {
        return Objects.hash(id, kind, priority, tier, rationale, when);
    }
}
