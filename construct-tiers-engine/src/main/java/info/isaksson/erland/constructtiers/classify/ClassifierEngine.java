package info.isaksson.erland.constructtiers.classify;

import info.isaksson.erland.constructtiers.ir.Node;
import info.isaksson.erland.constructtiers.ir.NodeArena;
import info.isaksson.erland.constructtiers.ir.NodeKind;
import info.isaksson.erland.constructtiers.ir.SourceLocation;
import info.isaksson.erland.constructtiers.rules.ClassifierOptions;
import info.isaksson.erland.constructtiers.rules.NodeShape;
import info.isaksson.erland.constructtiers.rules.RuleMatch;
import info.isaksson.erland.constructtiers.rules.RuleTable;
import info.isaksson.erland.constructtiers.rules.ShapeMeasureException;
import info.isaksson.erland.constructtiers.rules.Tier;
import info.isaksson.erland.constructtiers.rules.TierOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classifies every node of a file in one post-order pass.
 *
 * <p>Children are resolved before their parent; a node's effective tier is the worst of its own
 * tier and its children's effective tiers, so tiers only escalate towards the root. The
 * traversal uses an explicit stack, so tree depth is limited only by
 * {@link ClassifierOptions#maxDepth}.</p>
 *
 * <p>The engine keeps no state between calls. One instance may classify many files concurrently.</p>
 */
public final class ClassifierEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ClassifierEngine.class);

    /** Attribute holding the identifier of a {@code Name} node. */
    public static final String NAME_ATTRIBUTE = "name";

    private final RuleTable table;

    public ClassifierEngine(RuleTable table) {
        if (table == null) throw new IllegalArgumentException("table must not be null");
        this.table = table;
    }

    public RuleTable table() {
        return table;
    }

    /**
     * @throws MalformedNodeException      if a node violates its kind's structural contract
     * @throws UnknownNodeKindException    for an unlisted kind under {@code strictUnknownKinds}
     * @throws MaxDepthExceededException   if the tree is deeper than {@code maxDepth}
     * @throws NativeConstructsNotAllowedException in {@code STRICT} mode when Native constructs are present
     * @throws TooManyVariablesException  if the file names more distinct variables than {@code maxVariables}
     */
    public ClassifiedTree classify(NodeArena arena) throws ClassificationException {
        if (arena == null) throw new IllegalArgumentException("arena must not be null");

        ClassifierOptions options = table.options();
        ClassificationWarnings warnings = new ClassificationWarnings();
        int n = arena.size();
        ClassifiedNode[] out = new ClassifiedNode[n];
        int[] depth = new int[n];
        int deepest = 0;
        int unknown = 0;
        Set<String> variables = new TreeSet<>();

        // frame = {nodeId, next child index}
        Deque<int[]> stack = new ArrayDeque<>();
        enter(arena, arena.root, 0, options);
        stack.push(new int[] {arena.root, 0});
        while (!stack.isEmpty()) {
            int[] frame = stack.peek();
            Node node = arena.node(frame[0]);
            if (frame[1] < node.children.size()) {
                int child = node.children.get(frame[1]++);
                depth[child] = depth[node.id] + 1;
                enter(arena, child, depth[child], options);
                stack.push(new int[] {child, 0});
                continue;
            }
            stack.pop();
            deepest = Math.max(deepest, depth[node.id]);
            ClassifiedNode c = classifyNode(arena, node, depth[node.id], out, warnings);
            if (c.rule == table.defaultRule() && !table.knows(node.kind())) unknown++;
            String variable = variableName(node);
            if (variable != null) variables.add(variable);
            out[node.id] = c;
        }

        if (unknown > 0) {
            LOG.warn("{}: {} node(s) of unlisted kinds classified Native by default", arena.file, unknown);
        }
        checkFileConstraints(arena, out, deepest, variables.size(), options, warnings);

        ClassifiedTree tree = new ClassifiedTree(arena, Arrays.asList(out), options, warnings.toDeterministicList(),
                deepest, variables);
        LOG.debug("{}: {} nodes, aggregate {}", arena.file, n, tree.aggregateTier().displayName());
        return tree;
    }

    /** Identifier of a {@code Name} node, or null for any other node. */
    private static String variableName(Node node) {
        if (node.kind() != NodeKind.NAME) return null;
        String name = node.attribute(NAME_ATTRIBUTE);
        return name == null || name.isBlank() ? null : name;
    }

    private static void enter(NodeArena arena, int id, int depth, ClassifierOptions options) throws ClassificationException {
        Node node = arena.node(id);
        if (depth > options.maxDepth) {
            throw new MaxDepthExceededException(arena.file, id, node.location, depth, options.maxDepth);
        }
        NodeKind kind = node.kind();
        if (!kind.acceptsChildCount(node.childCount())) {
            throw new MalformedNodeException(arena.file, id, node.location,
                    node.tag + " node " + id + " at " + node.location + " has " + node.childCount()
                            + " children, expected " + kind.describeArity());
        }
    }

    private ClassifiedNode classifyNode(NodeArena arena, Node node, int depth, ClassifiedNode[] out,
                                        ClassificationWarnings warnings) throws ClassificationException {
        RuleMatch match;
        try {
            match = table.classify(new NodeShape(node, depth));
        } catch (ShapeMeasureException e) {
            throw new MalformedNodeException(arena.file, node.id, node.location,
                    node.tag + " node " + node.id + " at " + node.location + ": " + e.getMessage(), e);
        }

        if (match.unknownKind) {
            if (table.options().strictUnknownKinds) {
                throw new UnknownNodeKindException(arena.file, node.id, node.tag, node.location);
            }
            LOG.debug("{}: unlisted kind '{}' at {}", arena.file, node.tag, node.location);
            warnings.warnNode(ClassificationWarning.UNKNOWN_NODE_KIND,
                    "node kind '" + node.tag + "' is not listed; classified Native", node);
        } else if (match.unmatchedShape) {
            warnings.warnNode(ClassificationWarning.UNMATCHED_SHAPE,
                    "no rule covers this " + node.tag + " shape; classified Native", node);
        }

        TierOrder order = table.tierOrder();
        Tier own = match.tier();
        Tier effective = own;
        int escalatedBy = ClassifiedNode.NOT_ESCALATED;
        for (Integer child : node.children) {
            Tier childTier = out[child].effectiveTier;
            if (order.compare(childTier, effective) > 0) {
                effective = childTier;
                escalatedBy = child;
            }
        }
        return new ClassifiedNode(node, own, match.rule, effective, escalatedBy, depth);
    }

    private static void checkFileConstraints(NodeArena arena, ClassifiedNode[] out, int deepest, int variableCount,
                                             ClassifierOptions options, ClassificationWarnings warnings)
            throws ClassificationException {
        int nativeCount = 0;
        ClassifiedNode first = null;
        Comparator<ClassifiedNode> bySource = Comparator
                .comparing((ClassifiedNode c) -> c.node.location, SourceLocation.ORDER)
                .thenComparingInt(ClassifiedNode::id);
        for (ClassifiedNode c : out) {
            if (c.ownTier != Tier.NATIVE) continue;
            nativeCount++;
            if (first == null || bySource.compare(c, first) < 0) first = c;
        }

        switch (options.validationMode) {
            case STRICT:
                if (first != null) {
                    throw new NativeConstructsNotAllowedException(arena.file, first.id(), first.node.location, nativeCount);
                }
                break;
            case STANDARD:
                if (nativeCount > 0) {
                    warnings.warnFile(ClassificationWarning.NATIVE_CONSTRUCTS_PRESENT,
                            nativeCount + " Native construct(s) present", "count", nativeCount);
                }
                break;
            default:
                break;
        }

        if (variableCount > options.maxVariables) {
            throw new TooManyVariablesException(arena.file, variableCount, options.maxVariables);
        }

        if (deepest > options.deepNestingThreshold) {
            warnings.warnFile(ClassificationWarning.DEEP_NESTING,
                    "tree depth " + deepest + " exceeds " + options.deepNestingThreshold, "depth", deepest);
        }
        if (out.length > options.largeTreeThreshold) {
            warnings.warnFile(ClassificationWarning.LARGE_TREE,
                    "tree has " + out.length + " nodes, more than " + options.largeTreeThreshold, "nodes", out.length);
        }
    }
}
