package info.isaksson.erland.constructtiers.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Run configuration, fixed when the rule table is built.
 *
 * <p>Null constructor arguments fall back to the defaults, so a rule-set file only needs to name
 * the options it changes.</p>
 */
@JsonPropertyOrder({"strictUnknownKinds","includeRationale","tierOrder","validationMode","maxDepth","maxVariables","deepNestingThreshold","largeTreeThreshold"})
public final class ClassifierOptions {

    public static final int DEFAULT_MAX_DEPTH = 1000;
    public static final int DEFAULT_MAX_VARIABLES = 10_000;
    public static final int DEFAULT_DEEP_NESTING_THRESHOLD = 100;
    public static final int DEFAULT_LARGE_TREE_THRESHOLD = 1000;

    /** When true an unknown node kind fails the file instead of defaulting to Native with a warning. */
    public final boolean strictUnknownKinds;

    /** When false reports carry only tiers, counts and locations. */
    public final boolean includeRationale;

    public final TierOrder tierOrder;
    public final ValidationMode validationMode;

    /** Trees nested deeper than this fail classification. */
    public final int maxDepth;

    /** Files naming more distinct variables than this fail classification. */
    public final int maxVariables;

    public final int deepNestingThreshold;
    public final int largeTreeThreshold;

    @JsonCreator
    public ClassifierOptions(
            @JsonProperty("strictUnknownKinds") Boolean strictUnknownKinds,
            @JsonProperty("includeRationale") Boolean includeRationale,
            @JsonProperty("tierOrder") TierOrder tierOrder,
            @JsonProperty("validationMode") ValidationMode validationMode,
            @JsonProperty("maxDepth") Integer maxDepth,
            @JsonProperty("maxVariables") Integer maxVariables,
            @JsonProperty("deepNestingThreshold") Integer deepNestingThreshold,
            @JsonProperty("largeTreeThreshold") Integer largeTreeThreshold
    ) {
        this.strictUnknownKinds = strictUnknownKinds != null && strictUnknownKinds;
        this.includeRationale = includeRationale == null || includeRationale;
        this.tierOrder = tierOrder == null ? TierOrder.DEFAULT : tierOrder;
        this.validationMode = validationMode == null ? ValidationMode.STANDARD : validationMode;
        this.maxDepth = positive("maxDepth", maxDepth, DEFAULT_MAX_DEPTH);
        this.maxVariables = positive("maxVariables", maxVariables, DEFAULT_MAX_VARIABLES);
        this.deepNestingThreshold = positive("deepNestingThreshold", deepNestingThreshold, DEFAULT_DEEP_NESTING_THRESHOLD);
        this.largeTreeThreshold = positive("largeTreeThreshold", largeTreeThreshold, DEFAULT_LARGE_TREE_THRESHOLD);
    }

    public static ClassifierOptions defaults() {
        return new ClassifierOptions(null, null, null, null, null, null, null, null);
    }

    public ClassifierOptions withStrictUnknownKinds(boolean strict) {
        return new ClassifierOptions(strict, includeRationale, tierOrder, validationMode, maxDepth, maxVariables, deepNestingThreshold, largeTreeThreshold);
    }

    public ClassifierOptions withIncludeRationale(boolean include) {
        return new ClassifierOptions(strictUnknownKinds, include, tierOrder, validationMode, maxDepth, maxVariables, deepNestingThreshold, largeTreeThreshold);
    }

    public ClassifierOptions withTierOrder(TierOrder order) {
        return new ClassifierOptions(strictUnknownKinds, includeRationale, order, validationMode, maxDepth, maxVariables, deepNestingThreshold, largeTreeThreshold);
    }

    public ClassifierOptions withValidationMode(ValidationMode mode) {
        return new ClassifierOptions(strictUnknownKinds, includeRationale, tierOrder, mode, maxDepth, maxVariables, deepNestingThreshold, largeTreeThreshold);
    }

    public ClassifierOptions withMaxDepth(int depth) {
        return new ClassifierOptions(strictUnknownKinds, includeRationale, tierOrder, validationMode, depth, maxVariables, deepNestingThreshold, largeTreeThreshold);
    }

    public ClassifierOptions withMaxVariables(int max) {
        return new ClassifierOptions(strictUnknownKinds, includeRationale, tierOrder, validationMode, maxDepth, max, deepNestingThreshold, largeTreeThreshold);
    }

    public ClassifierOptions withWarningThresholds(int deepNesting, int largeTree) {
        return new ClassifierOptions(strictUnknownKinds, includeRationale, tierOrder, validationMode, maxDepth, maxVariables, deepNesting, largeTree);
    }

    private static int positive(String name, Integer value, int fallback) {
        if (value == null) return fallback;
        if (value <= 0) throw new RuleTableException(name + " must be positive, was " + value);
        return value;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassifierOptions)) return false;
        ClassifierOptions that = (ClassifierOptions) o;
        return strictUnknownKinds == that.strictUnknownKinds &&
                includeRationale == that.includeRationale &&
                maxDepth == that.maxDepth &&
                maxVariables == that.maxVariables &&
                deepNestingThreshold == that.deepNestingThreshold &&
                largeTreeThreshold == that.largeTreeThreshold &&
                tierOrder.equals(that.tierOrder) &&
                validationMode == that.validationMode;
    }

    @Override public int hashCode() {
        return Objects.hash(strictUnknownKinds, includeRationale, tierOrder, validationMode, maxDepth, maxVariables, deepNestingThreshold, largeTreeThreshold);
    }

    @Override
    public String toString() {
        return "ClassifierOptions{" +
                "strictUnknownKinds=" + strictUnknownKinds +
                ", includeRationale=" + includeRationale +
                ", tierOrder=" + tierOrder +
                ", validationMode=" + validationMode +
                ", maxDepth=" + maxDepth +
                ", maxVariables=" + maxVariables +
                ", deepNestingThreshold=" + deepNestingThreshold +
                ", largeTreeThreshold=" + largeTreeThreshold +
                '}';
    }
}
