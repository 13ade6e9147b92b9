package info.isaksson.erland.constructtiers.rules;

/** Rule priority, highest first: overrides pre-empt kind rules, which pre-empt the default. */
public enum RulePriority {
    OVERRIDE,
    SPECIFIC,
    DEFAULT
}
