package info.isaksson.erland.constructtiers.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One syntax construct, stored flat inside a {@link NodeArena}.
 *
 * <p>Children are node ids in the owning arena, in source order. Attributes carry kind-specific
 * metadata such as {@code bases} for a class definition or {@code arguments} for a decorator.</p>
 */
@JsonPropertyOrder({"id","kind","children","attributes","location"})
public final class Node {
    public final int id;

    private final NodeKind resolvedKind;

    /** Tag as produced by the front end. */
    @JsonProperty("kind")
    public final String tag;

    public final List<Integer> children;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, String> attributes;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final SourceLocation location;

    @JsonCreator
    public Node(
            @JsonProperty("id") int id,
            @JsonProperty("kind") String tag,
            @JsonProperty("children") List<Integer> children,
            @JsonProperty("attributes") Map<String, String> attributes,
            @JsonProperty("location") SourceLocation location
    ) {
        this.id = id;
        this.resolvedKind = NodeKind.fromTag(tag);
        this.tag = (tag == null || tag.isBlank()) ? this.resolvedKind.tag() : tag.trim();
        if (children != null && children.contains(null)) {
            String file = location == null || location.file == null ? "" : " in " + location.file;
            throw new IllegalArgumentException("node " + id + " has a null child id" + file);
        }
        this.children = children == null ? List.of() : List.copyOf(children);
        this.attributes = (attributes == null || attributes.isEmpty())
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(attributes));
        this.location = location;
    }

    public Node(int id, NodeKind kind, List<Integer> children, Map<String, String> attributes, SourceLocation location) {
        this(id, Objects.requireNonNull(kind, "kind must not be null").tag(), children, attributes, location);
    }

    /** Resolved kind; {@link NodeKind#UNKNOWN} when the front-end tag is not recognized. */
    public NodeKind kind() {
        return resolvedKind;
    }

    public int childCount() {
        return children.size();
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node)) return false;
        Node that = (Node) o;
        return id == that.id &&
                Objects.equals(tag, that.tag) &&
                Objects.equals(children, that.children) &&
                Objects.equals(attributes, that.attributes) &&
                Objects.equals(location, that.location);
    }

    @Override public int hashCode() {
        return Objects.hash(id, tag, children, attributes, location);
    }

    @Override public String toString() {
        return "Node{" + id + ":" + tag + "}";
    }
}
