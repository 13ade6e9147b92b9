package info.isaksson.erland.constructtiers.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The syntax tree of one source file, stored as a flat arena of {@link Node}s indexed by id.
 *
 * <p>Parent/child links are ids, never object references. The constructor checks that the
 * links form a single tree rooted at {@link #root}: ids are dense and match their position,
 * every child id exists, each node except the root has exactly one parent and every node is
 * reachable from the root. A violation throws {@link IllegalArgumentException}.</p>
 */
@JsonPropertyOrder({"file","language","root","nodes"})
public final class NodeArena {
    public final String file;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String language;

    public final int root;
    public final List<Node> nodes;

    @JsonCreator
    public NodeArena(
            @JsonProperty("file") String file,
            @JsonProperty("language") String language,
            @JsonProperty("root") int root,
            @JsonProperty("nodes") List<Node> nodes
    ) {
        if (file == null || file.isBlank()) throw new IllegalArgumentException("file must not be blank");
        this.file = file;
        this.language = language;
        this.root = root;
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        validateTree();
    }

    public Node node(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IllegalArgumentException("no node with id " + id + " in " + file);
        }
        return nodes.get(id);
    }

    public Node rootNode() {
        return node(root);
    }

    public int size() {
        return nodes.size();
    }

    private void validateTree() {
        int n = nodes.size();
        if (n == 0) throw new IllegalArgumentException("tree for " + file + " has no nodes");
        if (root < 0 || root >= n) {
            throw new IllegalArgumentException("root id " + root + " out of range in " + file);
        }

        int[] parent = new int[n];
        Arrays.fill(parent, -1);
        for (int i = 0; i < n; i++) {
            Node node = nodes.get(i);
            if (node == null) throw new IllegalArgumentException("null node at index " + i + " in " + file);
            if (node.id != i) {
                throw new IllegalArgumentException("node at index " + i + " has id " + node.id + " in " + file);
            }
            for (Integer child : node.children) {
                if (child < 0 || child >= n) {
                    throw new IllegalArgumentException("node " + i + " references missing child " + child + " in " + file);
                }
                if (child == i) {
                    throw new IllegalArgumentException("node " + i + " lists itself as a child in " + file);
                }
                if (parent[child] != -1) {
                    throw new IllegalArgumentException("node " + child + " has two parents (" + parent[child] + ", " + i + ") in " + file);
                }
                parent[child] = i;
            }
        }
        if (parent[root] != -1) {
            throw new IllegalArgumentException("root " + root + " has parent " + parent[root] + " in " + file);
        }

        // With single parents and a parentless root, full reachability rules out cycles.
        boolean[] seen = new boolean[n];
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(root);
        int reached = 0;
        while (!stack.isEmpty()) {
            int id = stack.pop();
            if (seen[id]) continue;
            seen[id] = true;
            reached++;
            for (Integer child : nodes.get(id).children) stack.push(child);
        }
        if (reached != n) {
            for (int i = 0; i < n; i++) {
                if (!seen[i]) {
                    throw new IllegalArgumentException("node " + i + " is not reachable from root " + root + " in " + file);
                }
            }
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeArena)) return false;
        NodeArena that = (NodeArena) o;
        return root == that.root &&
                Objects.equals(file, that.file) &&
                Objects.equals(language, that.language) &&
                Objects.equals(nodes, that.nodes);
    }

    @Override public int hashCode() {
        return Objects.hash(file, language, root, nodes);
    }

    public static Builder builder(String file) {
        return new Builder(file);
    }

    /**
     * Builds an arena bottom-up: children are added before their parent, and each
     * {@code add} returns the new node's id.
     */
    public static final class Builder {
        private final String file;
        private String language;
        private final List<Node> nodes = new ArrayList<>();

        private Builder(String file) {
            this.file = file;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public int add(NodeKind kind, int... children) {
            return add(kind, Map.of(), null, children);
        }

        public int add(NodeKind kind, SourceLocation location, int... children) {
            return add(kind, Map.of(), location, children);
        }

        public int add(NodeKind kind, Map<String, String> attributes, SourceLocation location, int... children) {
            return add(kind.tag(), attributes, location, children);
        }

        /** Adds a node by raw front-end tag; unrecognized tags become {@link NodeKind#UNKNOWN}. */
        public int add(String tag, Map<String, String> attributes, SourceLocation location, int... children) {
            int id = nodes.size();
            List<Integer> ids = new ArrayList<>(children.length);
            for (int c : children) ids.add(c);
            nodes.add(new Node(id, tag, ids, attributes == null ? Map.of() : new LinkedHashMap<>(attributes), location));
            return id;
        }

        public int size() {
            return nodes.size();
        }

        /** Builds with the most recently added node as root. */
        public NodeArena build() {
            return build(nodes.size() - 1);
        }

        public NodeArena build(int root) {
            return new NodeArena(file, language, root, nodes);
        }
    }
}
