package info.isaksson.erland.constructtiers.rules;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * The rule set shipped with the engine ({@code default-rules.json} on the classpath).
 */
public final class DefaultRuleSet {

    public static final String RESOURCE = "/info/isaksson/erland/constructtiers/rules/default-rules.json";

    public static final String CHAINED_COMPARISON = "compare.chained";
    public static final String BINARY_COMPARISON = "compare.binary";
    public static final String DECORATOR_WITH_ARGUMENTS = "decorator.with-arguments";
    public static final String DECORATOR = "decorator";

    private DefaultRuleSet() {}

    public static RuleSetDefinition definition() {
        try (InputStream in = DefaultRuleSet.class.getResourceAsStream(RESOURCE)) {
            if (in == null) throw new IllegalStateException("missing classpath resource " + RESOURCE);
            return RuleSetJson.read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("could not read " + RESOURCE, e);
        }
    }

    public static RuleTable table() {
        return definition().toRuleTable();
    }

    public static RuleTable table(ClassifierOptions options) {
        return definition().withOptions(options).toRuleTable();
    }
}
