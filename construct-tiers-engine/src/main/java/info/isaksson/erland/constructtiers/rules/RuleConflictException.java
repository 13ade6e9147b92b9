package info.isaksson.erland.constructtiers.rules;

/**
 * Two rules with the same priority claim overlapping shapes of the same kind (or share an id).
 */
public final class RuleConflictException extends RuleTableException {

    public final String firstRuleId;
    public final String secondRuleId;

    public RuleConflictException(String firstRuleId, String secondRuleId, String message) {
        super(message);
        this.firstRuleId = firstRuleId;
        this.secondRuleId = secondRuleId;
    }
}
