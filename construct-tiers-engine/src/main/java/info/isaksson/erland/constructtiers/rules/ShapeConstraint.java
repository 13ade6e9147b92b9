package info.isaksson.erland.constructtiers.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** {@code min <= measure <= max}; a missing bound is open. */
@JsonPropertyOrder({"measure","min","max"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ShapeConstraint {

    /** Measure key, e.g. {@code children} or {@code attr.bases}. */
    public final String measure;
    public final Integer min;
    public final Integer max;

    private final ShapeMeasure shapeMeasure;

    @JsonCreator
    public ShapeConstraint(
            @JsonProperty("measure") String measure,
            @JsonProperty("min") Integer min,
            @JsonProperty("max") Integer max
    ) {
        this(ShapeMeasure.parse(measure), min, max);
    }

    public ShapeConstraint(ShapeMeasure measure, Integer min, Integer max) {
        if (measure == null) throw new RuleTableException("constraint measure must not be null");
        if (min == null && max == null) throw new RuleTableException("constraint on " + measure + " has no bounds");
        this.shapeMeasure = measure;
        this.measure = measure.key();
        this.min = min;
        this.max = max;
    }

    public static ShapeConstraint atLeast(ShapeMeasure measure, int min) {
        return new ShapeConstraint(measure, min, null);
    }

    public static ShapeConstraint atMost(ShapeMeasure measure, int max) {
        return new ShapeConstraint(measure, null, max);
    }

    public static ShapeConstraint exactly(ShapeMeasure measure, int value) {
        return new ShapeConstraint(measure, value, value);
    }

    public ShapeMeasure shapeMeasure() {
        return shapeMeasure;
    }

    long lower() {
        return min == null ? Long.MIN_VALUE : min;
    }

    long upper() {
        return max == null ? Long.MAX_VALUE : max;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShapeConstraint)) return false;
        ShapeConstraint that = (ShapeConstraint) o;
        return shapeMeasure.equals(that.shapeMeasure) && Objects.equals(min, that.min) && Objects.equals(max, that.max);
    }

    @Override public int hashCode() {
        return Objects.hash(shapeMeasure, min, max);
    }

    @Override public String toString() {
        if (min != null && min.equals(max)) return measure + " == " + min;
        if (max == null) return measure + " >= " + min;
        if (min == null) return measure + " <= " + max;
        return min + " <= " + measure + " <= " + max;
    }
}
