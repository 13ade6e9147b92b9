package info.isaksson.erland.constructtiers.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.constructtiers.rules.Tier;

import java.util.Objects;

/**
 * How one node got its tiers: the deciding rule and, if a child raised the effective tier,
 * which child.
 */
@JsonPropertyOrder({"nodeId","kind","ownTier","effectiveTier","ruleId","escalatedBy"})
public final class TrailEntry {
    public final int nodeId;
    public final String kind;
    public final Tier ownTier;
    public final Tier effectiveTier;
    public final String ruleId;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final Integer escalatedBy;

    @JsonCreator
    public TrailEntry(
            @JsonProperty("nodeId") int nodeId,
            @JsonProperty("kind") String kind,
            @JsonProperty("ownTier") Tier ownTier,
            @JsonProperty("effectiveTier") Tier effectiveTier,
            @JsonProperty("ruleId") String ruleId,
            @JsonProperty("escalatedBy") Integer escalatedBy
    ) {
        this.nodeId = nodeId;
        this.kind = kind;
        this.ownTier = ownTier;
        this.effectiveTier = effectiveTier;
        this.ruleId = ruleId;
        this.escalatedBy = escalatedBy;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrailEntry)) return false;
        TrailEntry that = (TrailEntry) o;
        return nodeId == that.nodeId &&
                Objects.equals(kind, that.kind) &&
                ownTier == that.ownTier &&
                effectiveTier == that.effectiveTier &&
                Objects.equals(ruleId, that.ruleId) &&
                Objects.equals(escalatedBy, that.escalatedBy);
    }

    @Override public int hashCode() {
        return Objects.hash(nodeId, kind, ownTier, effectiveTier, ruleId, escalatedBy);
    }
}
