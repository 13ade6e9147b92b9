package info.isaksson.erland.constructtiers.core;

import info.isaksson.erland.constructtiers.report.FileReport;
import info.isaksson.erland.constructtiers.rules.Tier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a multi-file run.
 *
 * <p>{@link #outcomes} follow the input order, skipping files that were cancelled before they
 * started. Those are listed in {@link #cancelled}, also in input order.</p>
 */
public final class ClassificationRun {
    public final List<FileOutcome> outcomes;
    public final List<String> cancelled;

    ClassificationRun(List<FileOutcome> outcomes, List<String> cancelled) {
        this.outcomes = List.copyOf(outcomes);
        this.cancelled = List.copyOf(cancelled);
    }

    public List<FileReport> reports() {
        List<FileReport> out = new ArrayList<>();
        for (FileOutcome o : outcomes) {
            if (o.succeeded()) out.add(o.report);
        }
        return Collections.unmodifiableList(out);
    }

    public List<ClassificationError> failures() {
        List<ClassificationError> out = new ArrayList<>();
        for (FileOutcome o : outcomes) {
            if (!o.succeeded()) out.add(o.error);
        }
        return Collections.unmodifiableList(out);
    }

    public boolean wasCancelled() {
        return !cancelled.isEmpty();
    }

    /** Number of reported files per aggregate tier. */
    public Map<Tier, Integer> aggregateCounts() {
        Map<Tier, Integer> counts = new EnumMap<>(Tier.class);
        for (Tier t : Tier.values()) counts.put(t, 0);
        for (FileReport r : reports()) counts.merge(r.aggregateTier, 1, Integer::sum);
        return Collections.unmodifiableMap(counts);
    }
}
