package info.isaksson.erland.constructtiers.rules;

/**
 * A rule table could not be built. Configuration errors abort the run before any file is
 * classified.
 */
public class RuleTableException extends RuntimeException {

    public RuleTableException(String message) {
        super(message);
    }

    public RuleTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
