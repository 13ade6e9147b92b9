package info.isaksson.erland.constructtiers.rules;

/** How Native constructs affect a file's outcome. */
public enum ValidationMode {
    /** Any Native construct fails the file. */
    STRICT,
    /** Native constructs are allowed and reported with a warning. */
    STANDARD,
    /** Native constructs are allowed silently. */
    PERMISSIVE
}
