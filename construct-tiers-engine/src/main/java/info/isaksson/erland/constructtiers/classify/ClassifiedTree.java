package info.isaksson.erland.constructtiers.classify;

import info.isaksson.erland.constructtiers.ir.NodeArena;
import info.isaksson.erland.constructtiers.rules.ClassifierOptions;
import info.isaksson.erland.constructtiers.rules.Tier;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Result of classifying one file: every node of the arena with its tiers, plus warnings. */
public final class ClassifiedTree {
    public final NodeArena arena;
    /** Indexed by node id. */
    public final List<ClassifiedNode> nodes;
    public final ClassifierOptions options;
    public final List<ClassificationWarning> warnings;
    public final int maxDepth;

    /** Distinct identifiers of the file's {@code Name} nodes, sorted. */
    public final List<String> variables;

    ClassifiedTree(NodeArena arena, List<ClassifiedNode> nodes, ClassifierOptions options,
                   List<ClassificationWarning> warnings, int maxDepth, Set<String> variables) {
        this.arena = arena;
        this.nodes = List.copyOf(nodes);
        this.options = options;
        this.warnings = List.copyOf(warnings);
        this.maxDepth = maxDepth;
        this.variables = List.copyOf(variables);
    }

    public String file() {
        return arena.file;
    }

    public ClassifiedNode node(int id) {
        return nodes.get(id);
    }

    public ClassifiedNode root() {
        return nodes.get(arena.root);
    }

    public Tier aggregateTier() {
        return root().effectiveTier;
    }

    /**
     * Chain of nodes from the root down to the node whose own tier set the aggregate,
     * following {@link ClassifiedNode#escalatedBy}.
     */
    public List<ClassifiedNode> escalationPath() {
        List<ClassifiedNode> path = new ArrayList<>();
        ClassifiedNode cur = root();
        path.add(cur);
        while (cur.isEscalated()) {
            cur = nodes.get(cur.escalatedBy);
            path.add(cur);
        }
        return path;
    }
}
