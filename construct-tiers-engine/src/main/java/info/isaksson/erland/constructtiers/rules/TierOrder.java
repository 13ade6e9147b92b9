package info.isaksson.erland.constructtiers.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Total order over the tiers, lowest first. "Worse" means higher in this order.
 */
public final class TierOrder {

    public static final TierOrder DEFAULT = new TierOrder(List.of(Tier.CORE, Tier.EXTENDED, Tier.NATIVE));

    private final List<Tier> ascending;
    private final int[] rank = new int[Tier.values().length];

    private TierOrder(List<Tier> ascending) {
        this.ascending = List.copyOf(ascending);
        for (int i = 0; i < this.ascending.size(); i++) {
            rank[this.ascending.get(i).ordinal()] = i;
        }
    }

    /**
     * Builds an order from tier names, lowest first. Every tier must appear exactly once.
     *
     * @throws RuleTableException if the names are not a permutation of the tiers
     */
    @JsonCreator
    public static TierOrder of(List<String> names) {
        if (names == null || names.isEmpty()) return DEFAULT;
        List<Tier> tiers = new ArrayList<>(names.size());
        Set<Tier> seen = EnumSet.noneOf(Tier.class);
        for (String name : names) {
            Tier t;
            try {
                t = Tier.fromName(name);
            } catch (IllegalArgumentException e) {
                throw new RuleTableException("invalid tier order " + names + ": " + e.getMessage(), e);
            }
            if (!seen.add(t)) throw new RuleTableException("invalid tier order " + names + ": " + t + " listed twice");
            tiers.add(t);
        }
        if (tiers.size() != Tier.values().length) {
            throw new RuleTableException("invalid tier order " + names + ": every tier must be ranked");
        }
        return new TierOrder(tiers);
    }

    public static TierOrder of(Tier... ascending) {
        List<String> names = new ArrayList<>();
        for (Tier t : ascending) names.add(t.name());
        return of(names);
    }

    public int compare(Tier a, Tier b) {
        return Integer.compare(rank[a.ordinal()], rank[b.ordinal()]);
    }

    public Tier max(Tier a, Tier b) {
        return compare(a, b) >= 0 ? a : b;
    }

    public Tier lowest() {
        return ascending.get(0);
    }

    public Tier highest() {
        return ascending.get(ascending.size() - 1);
    }

    public List<Tier> ascending() {
        return ascending;
    }

    @JsonValue
    public List<String> names() {
        List<String> out = new ArrayList<>(ascending.size());
        for (Tier t : ascending) out.add(t.name());
        return out;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TierOrder)) return false;
        return ascending.equals(((TierOrder) o).ascending);
    }

    @Override public int hashCode() {
        return ascending.hashCode();
    }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Tier t : ascending) {
            if (sb.length() > 0) sb.append(" < ");
            sb.append(t.displayName());
        }
        return sb.toString();
    }
}
