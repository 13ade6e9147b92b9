package info.isaksson.erland.constructtiers.rules;

import info.isaksson.erland.constructtiers.ir.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of override rules: structural predicates that look past the kind tag and pre-empt
 * the kind's specific rules (a comparison with three operands is not an ordinary comparison).
 *
 * <p>Overrides of the same kind never overlap, so at most one can match a node.</p>
 */
public final class OverrideResolver {

    private final Map<NodeKind, List<ClassificationRule>> byKind;

    private OverrideResolver(Map<NodeKind, List<ClassificationRule>> byKind) {
        this.byKind = byKind;
    }

    static OverrideResolver of(List<ClassificationRule> overrides) {
        Map<NodeKind, List<ClassificationRule>> m = new EnumMap<>(NodeKind.class);
        for (ClassificationRule r : overrides) {
            if (r.priority != RulePriority.OVERRIDE) {
                throw new RuleTableException("rule " + r.id + " is not an override");
            }
            m.computeIfAbsent(r.kind, k -> new ArrayList<>()).add(r);
        }
        for (Map.Entry<NodeKind, List<ClassificationRule>> e : m.entrySet()) {
            e.setValue(List.copyOf(e.getValue()));
        }
        return new OverrideResolver(Collections.unmodifiableMap(m));
    }

    /**
     * The override claiming this node, or null.
     *
     * @throws ShapeMeasureException if a consulted attribute is not numeric
     */
    public ClassificationRule resolve(NodeShape shape) {
        List<ClassificationRule> candidates = byKind.get(shape.kind());
        if (candidates == null) return null;
        for (ClassificationRule r : candidates) {
            if (r.predicate.matches(shape)) return r;
        }
        return null;
    }

    public boolean hasOverrides(NodeKind kind) {
        return byKind.containsKey(kind);
    }

    public List<ClassificationRule> overridesFor(NodeKind kind) {
        List<ClassificationRule> rules = byKind.get(kind);
        return rules == null ? List.of() : rules;
    }

    public int size() {
        int n = 0;
        for (List<ClassificationRule> rules : byKind.values()) n += rules.size();
        return n;
    }
}
