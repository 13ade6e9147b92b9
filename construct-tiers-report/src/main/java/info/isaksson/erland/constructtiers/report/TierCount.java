package info.isaksson.erland.constructtiers.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.constructtiers.rules.Tier;

import java.util.Objects;

/** Number of nodes whose own tier is {@link #tier}. */
@JsonPropertyOrder({"tier","count"})
public final class TierCount {
    public final Tier tier;
    public final int count;

    @JsonCreator
    public TierCount(
            @JsonProperty("tier") Tier tier,
            @JsonProperty("count") int count
    ) {
        this.tier = Objects.requireNonNull(tier, "tier must not be null");
        this.count = count;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TierCount)) return false;
        TierCount that = (TierCount) o;
        return count == that.count && tier == that.tier;
    }

    @Override public int hashCode() {
        return Objects.hash(tier, count);
    }

    @Override public String toString() {
        return tier.displayName() + "=" + count;
    }
}
