package com.kgraph.resolution.rules;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The stripping rules for one entity type.
 *
 * <p>Rules run over a folded key (lowercase, no diacritics, punctuation turned to spaces)
 * and are re-applied until the key stops changing, so stacked suffixes such as
 * "foo co ltd" are removed in one call.</p>
 */
public class NormalizationProfile {

    private static final int MAX_PASSES = 5;

    private final String name;
    private final List<NormalizationRule> rules;

    public NormalizationProfile(String name, List<NormalizationRule> rules) {
        this.name = name;
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    /**
     * A profile that leaves keys untouched.
     */
    public static NormalizationProfile identity(String name) {
        return new NormalizationProfile(name, List.of());
    }

    public String getName() {
        return name;
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Strips this profile's affixes from a folded key.
     * The result may be empty; callers decide what to fall back to.
     */
    public String strip(String foldedKey) {
        String current = foldedKey;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = current;
            for (NormalizationRule rule : rules) {
                next = rule.apply(next).trim();
            }
            next = next.replaceAll("\\s+", " ");
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        return current;
    }

    @Override
    public String toString() {
        return "NormalizationProfile{name='" + name + "', rules=" + rules.size() + '}';
    }
}
