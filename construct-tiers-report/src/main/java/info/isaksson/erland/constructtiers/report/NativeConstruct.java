package info.isaksson.erland.constructtiers.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.constructtiers.ir.SourceLocation;

import java.util.Objects;

/** A node whose own tier is Native, with the rule that made it so. */
@JsonPropertyOrder({"nodeId","kind","location","ruleId","rationale"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NativeConstruct {
    public final int nodeId;

    /** Kind tag as produced by the front end. */
    public final String kind;

    public final SourceLocation location;
    public final String ruleId;

    /** Null when the report was emitted without rationale. */
    public final String rationale;

    @JsonCreator
    public NativeConstruct(
            @JsonProperty("nodeId") int nodeId,
            @JsonProperty("kind") String kind,
            @JsonProperty("location") SourceLocation location,
            @JsonProperty("ruleId") String ruleId,
            @JsonProperty("rationale") String rationale
    ) {
        this.nodeId = nodeId;
        this.kind = kind;
        this.location = location;
        this.ruleId = ruleId;
        this.rationale = rationale;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NativeConstruct)) return false;
        NativeConstruct that = (NativeConstruct) o;
        return nodeId == that.nodeId &&
                Objects.equals(kind, that.kind) &&
                Objects.equals(location, that.location) &&
                Objects.equals(ruleId, that.ruleId) &&
                Objects.equals(rationale, that.rationale);
    }

    @Override public int hashCode() {
        return Objects.hash(nodeId, kind, location, ruleId, rationale);
    }

    @Override public String toString() {
        return kind + "#" + nodeId + " at " + location + " (" + ruleId + ")";
    }
}
