package info.isaksson.erland.constructtiers.classify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** A non-fatal deterministic warning produced while classifying a file. */
@JsonPropertyOrder({"code","message","context"})
public final class ClassificationWarning {

    public static final String UNKNOWN_NODE_KIND = "UNKNOWN_NODE_KIND";
    public static final String UNMATCHED_SHAPE = "UNMATCHED_SHAPE";
    public static final String NATIVE_CONSTRUCTS_PRESENT = "NATIVE_CONSTRUCTS_PRESENT";
    public static final String DEEP_NESTING = "DEEP_NESTING";
    public static final String LARGE_TREE = "LARGE_TREE";

    /** Warning code stable across versions. */
    public final String code;

    /** Human-readable message. */
    public final String message;

    /** Structured context, key-sorted. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, String> context;

    @JsonCreator
    public ClassificationWarning(
            @JsonProperty("code") String code,
            @JsonProperty("message") String message,
            @JsonProperty("context") Map<String, String> context
    ) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new TreeMap<>(context));
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassificationWarning)) return false;
        ClassificationWarning that = (ClassificationWarning) o;
        return code.equals(that.code) && message.equals(that.message) && context.equals(that.context);
    }

    @Override public int hashCode() {
        return Objects.hash(code, message, context);
    }

    @Override public String toString() {
        return code + ": " + message + (context.isEmpty() ? "" : " " + context);
    }
}
