package info.isaksson.erland.constructtiers.ir;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Closed vocabulary of language-agnostic node kinds.
 *
 * <p>Front ends tag nodes with either the enum name ({@code ASYNC_FUNCTION_DEF}) or the
 * CamelCase tag ({@code AsyncFunctionDef}). Anything else maps to {@link #UNKNOWN}; the raw
 * tag stays on the node so reports can still name it.</p>
 *
 * <p>Each kind carries its arity contract (allowed child count). The classifier rejects nodes
 * that violate it.</p>
 */
public enum NodeKind {
    MODULE("Module", 0, Arity.UNBOUNDED),
    BLOCK("Block", 0, Arity.UNBOUNDED),
    EXPR("Expr", 1, 1),
    PASS("Pass", 0, 0),
    LITERAL("Literal", 0, 0),
    NAME("Name", 0, 0),
    LIST("List", 0, Arity.UNBOUNDED),
    DICT("Dict", 0, Arity.UNBOUNDED),
    SET("Set", 0, Arity.UNBOUNDED),
    TUPLE("Tuple", 0, Arity.UNBOUNDED),
    PAIR("Pair", 2, 2),
    BINARY_OP("BinaryOp", 2, 2),
    UNARY_OP("UnaryOp", 1, 1),
    BOOL_OP("BoolOp", 2, Arity.UNBOUNDED),
    COMPARE("Compare", 2, Arity.UNBOUNDED),
    CALL("Call", 1, Arity.UNBOUNDED),
    KEYWORD("Keyword", 1, 1),
    IF("If", 2, 3),
    RETURN("Return", 0, 1),
    ASSIGN("Assign", 2, Arity.UNBOUNDED),
    AUG_ASSIGN("AugAssign", 2, 2),
    ATTRIBUTE("Attribute", 1, 1),
    SUBSCRIPT("Subscript", 2, 2),
    WHILE("While", 2, 3),
    FOR("For", 3, 4),
    LAMBDA("Lambda", 1, Arity.UNBOUNDED),
    FUNCTION_DEF("FunctionDef", 0, Arity.UNBOUNDED),
    PARAM("Param", 0, 1),
    COMPREHENSION("Comprehension", 2, Arity.UNBOUNDED),
    GENERATOR_EXPR("GeneratorExpr", 2, Arity.UNBOUNDED),
    TRY("Try", 1, Arity.UNBOUNDED),
    EXCEPT_HANDLER("ExceptHandler", 1, Arity.UNBOUNDED),
    WITH("With", 2, Arity.UNBOUNDED),
    WITH_ITEM("WithItem", 1, 2),
    CLASS_DEF("ClassDef", 0, Arity.UNBOUNDED),
    DECORATOR("Decorator", 0, Arity.UNBOUNDED),
    ASYNC_FUNCTION_DEF("AsyncFunctionDef", 0, Arity.UNBOUNDED),
    AWAIT("Await", 1, 1),
    ASYNC_FOR("AsyncFor", 3, 4),
    ASYNC_WITH("AsyncWith", 2, Arity.UNBOUNDED),
    YIELD("Yield", 0, 1),
    YIELD_FROM("YieldFrom", 1, 1),
    GLOBAL("Global", 0, 0),
    NONLOCAL("Nonlocal", 0, 0),
    UNKNOWN("Unknown", 0, Arity.UNBOUNDED);

    private static final Map<String, NodeKind> BY_TAG = new HashMap<>();

    static {
        for (NodeKind k : values()) {
            BY_TAG.put(k.tag, k);
            BY_TAG.put(k.name(), k);
        }
    }

    private final String tag;
    private final int minChildren;
    private final int maxChildren;

    NodeKind(String tag, int minChildren, int maxChildren) {
        this.tag = tag;
        this.minChildren = minChildren;
        this.maxChildren = maxChildren;
    }

    /** CamelCase tag used in trees and reports. */
    public String tag() {
        return tag;
    }

    public int minChildren() {
        return minChildren;
    }

    /** Upper bound on children, or {@link Arity#UNBOUNDED}. */
    public int maxChildren() {
        return maxChildren;
    }

    public boolean acceptsChildCount(int count) {
        return count >= minChildren && count <= maxChildren;
    }

    /** Human-readable arity, e.g. {@code "exactly 2"} or {@code "at least 2"}. */
    public String describeArity() {
        if (minChildren == maxChildren) return "exactly " + minChildren;
        if (maxChildren == Arity.UNBOUNDED) return "at least " + minChildren;
        return "between " + minChildren + " and " + maxChildren;
    }

    /**
     * Resolve a front-end tag. Accepts the CamelCase tag or the enum name (case-insensitive for
     * the latter). Unrecognized and blank tags resolve to {@link #UNKNOWN}.
     */
    public static NodeKind fromTag(String tag) {
        if (tag == null || tag.isBlank()) return UNKNOWN;
        String t = tag.trim();
        NodeKind k = BY_TAG.get(t);
        if (k != null) return k;
        k = BY_TAG.get(t.toUpperCase(Locale.ROOT));
        return k == null ? UNKNOWN : k;
    }

    /** Arity constants. */
    public static final class Arity {
        public static final int UNBOUNDED = Integer.MAX_VALUE;

        private Arity() {}
    }
}
