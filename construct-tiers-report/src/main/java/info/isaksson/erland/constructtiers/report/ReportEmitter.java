package info.isaksson.erland.constructtiers.report;

import info.isaksson.erland.constructtiers.classify.ClassifiedNode;
import info.isaksson.erland.constructtiers.classify.ClassifiedTree;
import info.isaksson.erland.constructtiers.ir.SourceLocation;
import info.isaksson.erland.constructtiers.rules.Tier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a {@link ClassifiedTree} into a {@link FileReport}.
 *
 * <p>The emitter only reads the tree; it never reclassifies. Output depends on nothing but the
 * tree and the options it was classified with.</p>
 */
public final class ReportEmitter {

    private static final Comparator<ClassifiedNode> BY_SOURCE = Comparator
            .comparing((ClassifiedNode c) -> c.node.location, SourceLocation.ORDER)
            .thenComparingInt(ClassifiedNode::id);

    public FileReport emit(ClassifiedTree tree) {
        if (tree == null) throw new IllegalArgumentException("tree must not be null");
        boolean rationale = tree.options.includeRationale;

        Map<Tier, Integer> counts = new EnumMap<>(Tier.class);
        List<ClassifiedNode> natives = new ArrayList<>();
        for (ClassifiedNode c : tree.nodes) {
            counts.merge(c.ownTier, 1, Integer::sum);
            if (c.ownTier == Tier.NATIVE) natives.add(c);
        }

        List<TierCount> tierCounts = new ArrayList<>();
        for (Tier t : tree.options.tierOrder.ascending()) {
            tierCounts.add(new TierCount(t, counts.getOrDefault(t, 0)));
        }

        natives.sort(BY_SOURCE);
        List<NativeConstruct> nativeConstructs = new ArrayList<>(natives.size());
        for (ClassifiedNode c : natives) {
            nativeConstructs.add(new NativeConstruct(
                    c.id(), c.node.tag, c.node.location, c.ruleId(), rationale ? c.rationale() : null));
        }

        List<TrailEntry> trail = null;
        if (rationale) {
            trail = new ArrayList<>(tree.nodes.size());
            for (ClassifiedNode c : tree.nodes) {
                trail.add(new TrailEntry(c.id(), c.node.tag, c.ownTier, c.effectiveTier, c.ruleId(),
                        c.isEscalated() ? c.escalatedBy : null));
            }
        }

        return new FileReport(
                tree.file(),
                tree.arena.language,
                tree.aggregateTier(),
                tree.nodes.size(),
                tree.maxDepth,
                tree.variables.size(),
                tierCounts,
                nativeConstructs,
                tree.warnings,
                trail
        );
    }
}
