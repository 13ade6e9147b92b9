package info.isaksson.erland.constructtiers.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A complete declarative rule set: options plus rules. Builds a {@link RuleTable}.
 */
@JsonPropertyOrder({"schemaVersion","options","rules"})
public final class RuleSetDefinition {

    public static final String SCHEMA_VERSION = "1.0";

    public final String schemaVersion;
    public final ClassifierOptions options;
    public final List<RuleDefinition> rules;

    @JsonCreator
    public RuleSetDefinition(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("options") ClassifierOptions options,
            @JsonProperty("rules") List<RuleDefinition> rules
    ) {
        this.schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
        this.options = options == null ? ClassifierOptions.defaults() : options;
        this.rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static RuleSetDefinition of(RuleTable table) {
        List<RuleDefinition> defs = new ArrayList<>();
        for (ClassificationRule r : table.rules()) defs.add(RuleDefinition.of(r));
        return new RuleSetDefinition(SCHEMA_VERSION, table.options(), defs);
    }

    public RuleSetDefinition withOptions(ClassifierOptions options) {
        return new RuleSetDefinition(schemaVersion, options, rules);
    }

    /**
     * @throws RuleTableException on any configuration error, {@link RuleConflictException} on conflicts
     */
    public RuleTable toRuleTable() {
        if (!SCHEMA_VERSION.equals(schemaVersion)) {
            throw new RuleTableException("unsupported rule-set schemaVersion " + schemaVersion + " (expected " + SCHEMA_VERSION + ")");
        }
        RuleTable.Builder b = RuleTable.builder().options(options);
        for (RuleDefinition d : rules) {
            if (d == null) throw new RuleTableException("null rule definition");
            b.add(d.toRule());
        }
        return b.build();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RuleSetDefinition)) return false;
        RuleSetDefinition that = (RuleSetDefinition) o;
        return Objects.equals(schemaVersion, that.schemaVersion) &&
                Objects.equals(options, that.options) &&
                Objects.equals(rules, that.rules);
    }

    @Override public int hashCode() {
        return Objects.hash(schemaVersion, options, rules);
    }
}
