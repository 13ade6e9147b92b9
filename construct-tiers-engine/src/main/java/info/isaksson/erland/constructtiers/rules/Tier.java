package info.isaksson.erland.constructtiers.rules;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Portability tier of a construct.
 *
 * <p>The declaration order is the default ranking (Core &lt; Extended &lt; Native); aggregation
 * goes through {@link TierOrder} so a rule table can rank the tiers differently.</p>
 */
public enum Tier {
    /** Universally portable. */
    CORE("Core"),
    /** Portable with emulation. */
    EXTENDED("Extended"),
    /** Language-specific, not mechanically portable. */
    NATIVE("Native");

    private final String displayName;

    Tier(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** Parses a tier by enum or display name, ignoring case. */
    @JsonCreator
    public static Tier fromName(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("tier name must not be blank");
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown tier: " + name, e);
        }
    }
}
