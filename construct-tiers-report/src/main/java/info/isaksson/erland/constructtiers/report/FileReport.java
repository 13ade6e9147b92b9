package info.isaksson.erland.constructtiers.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.constructtiers.classify.ClassificationWarning;
import info.isaksson.erland.constructtiers.rules.Tier;

import java.util.List;
import java.util.Objects;

/**
 * Portability report for one source file.
 *
 * <p>{@link #tierCounts} counts own tiers and lists every tier, in the rule table's tier order,
 * including zero counts. {@link #nativeConstructs} is sorted by location, then node id.
 * {@link #trail} is null when the report was emitted without rationale.</p>
 */
@JsonPropertyOrder({"file","language","aggregateTier","nodeCount","maxDepth","variableCount","tierCounts","nativeConstructs","warnings","trail"})
public final class FileReport {
    public final String file;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String language;

    public final Tier aggregateTier;
    public final int nodeCount;
    public final int maxDepth;

    /** Distinct variable names referenced by the file. */
    public final int variableCount;

    public final List<TierCount> tierCounts;
    public final List<NativeConstruct> nativeConstructs;
    public final List<ClassificationWarning> warnings;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final List<TrailEntry> trail;

    @JsonCreator
    public FileReport(
            @JsonProperty("file") String file,
            @JsonProperty("language") String language,
            @JsonProperty("aggregateTier") Tier aggregateTier,
            @JsonProperty("nodeCount") int nodeCount,
            @JsonProperty("maxDepth") int maxDepth,
            @JsonProperty("variableCount") int variableCount,
            @JsonProperty("tierCounts") List<TierCount> tierCounts,
            @JsonProperty("nativeConstructs") List<NativeConstruct> nativeConstructs,
            @JsonProperty("warnings") List<ClassificationWarning> warnings,
            @JsonProperty("trail") List<TrailEntry> trail
    ) {
        this.file = file;
        this.language = language;
        this.aggregateTier = aggregateTier;
        this.nodeCount = nodeCount;
        this.maxDepth = maxDepth;
        this.variableCount = variableCount;
        this.tierCounts = tierCounts == null ? List.of() : List.copyOf(tierCounts);
        this.nativeConstructs = nativeConstructs == null ? List.of() : List.copyOf(nativeConstructs);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.trail = trail == null ? null : List.copyOf(trail);
    }

    /** Own-tier count for one tier, 0 if absent. */
    public int count(Tier tier) {
        for (TierCount c : tierCounts) {
            if (c.tier == tier) return c.count;
        }
        return 0;
    }

    public boolean hasNativeConstructs() {
        return !nativeConstructs.isEmpty();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileReport)) return false;
        FileReport that = (FileReport) o;
        return nodeCount == that.nodeCount &&
                maxDepth == that.maxDepth &&
                variableCount == that.variableCount &&
                Objects.equals(file, that.file) &&
                Objects.equals(language, that.language) &&
                aggregateTier == that.aggregateTier &&
                Objects.equals(tierCounts, that.tierCounts) &&
                Objects.equals(nativeConstructs, that.nativeConstructs) &&
                Objects.equals(warnings, that.warnings) &&
                Objects.equals(trail, that.trail);
    }

    @Override public int hashCode() {
        return Objects.hash(file, language, aggregateTier, nodeCount, maxDepth, variableCount, tierCounts, nativeConstructs, warnings, trail);
    }

    @Override public String toString() {
        return file + ": " + aggregateTier.displayName() + " " + tierCounts;
    }
}
