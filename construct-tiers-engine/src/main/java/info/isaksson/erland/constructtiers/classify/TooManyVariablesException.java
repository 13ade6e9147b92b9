package info.isaksson.erland.constructtiers.classify;

/** The file references more distinct variables than the configured maximum. */
public final class TooManyVariablesException extends ClassificationException {

    public static final String CODE = "TOO_MANY_VARIABLES";

    public final int count;
    public final int maxVariables;

    public TooManyVariablesException(String file, int count, int maxVariables) {
        super(CODE, file, null, null, file + " references " + count + " distinct variables, maximum is " + maxVariables);
        this.count = count;
        this.maxVariables = maxVariables;
    }
}
