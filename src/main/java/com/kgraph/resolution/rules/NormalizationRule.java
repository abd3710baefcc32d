package com.kgraph.resolution.rules;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Removes a set of whole words from a folded comparison key.
 *
 * <p>Words are given in folded form ("inc", "s a"), so the rule matches whatever punctuation the
 * surface form had. A rule removes its words where its {@link Anchor} allows: at the start of the
 * key, at the end, or anywhere as a separate word. Rules run in priority order (lower number first)
 * inside a {@link NormalizationProfile}.</p>
 */
public final class NormalizationRule {

    public enum Anchor {
        LEADING,
        TRAILING,
        ANYWHERE
    }

    private static final Pattern FOLDED_WORDS = Pattern.compile("[\\p{Ll}\\p{Lo}\\p{N}]+( [\\p{Ll}\\p{Lo}\\p{N}]+)*");

    private final String name;
    private final Anchor anchor;
    private final List<String> words;
    private final int priority;
    private final Pattern pattern;

    private NormalizationRule(String name, Anchor anchor, List<String> words, int priority) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.anchor = Objects.requireNonNull(anchor, "anchor is required");
        if (words == null || words.isEmpty()) {
            throw new IllegalArgumentException("Rule " + name + " needs at least one word");
        }
        for (String word : words) {
            if (word == null || !FOLDED_WORDS.matcher(word).matches()) {
                throw new IllegalArgumentException("Rule " + name + ": '" + word
                        + "' is not a folded word (lowercase letters and digits, single spaces)");
            }
        }
        this.words = List.copyOf(words);
        this.priority = priority;
        this.pattern = compile(anchor, this.words);
    }

    /**
     * Strips one of {@code words} from the start of the key.
     */
    public static NormalizationRule leading(String name, int priority, String... words) {
        return new NormalizationRule(name, Anchor.LEADING, List.of(words), priority);
    }

    /**
     * Strips one of {@code words} from the end of the key.
     */
    public static NormalizationRule trailing(String name, int priority, String... words) {
        return new NormalizationRule(name, Anchor.TRAILING, List.of(words), priority);
    }

    /**
     * Drops every standalone occurrence of {@code words}.
     */
    public static NormalizationRule anywhere(String name, int priority, String... words) {
        return new NormalizationRule(name, Anchor.ANYWHERE, List.of(words), priority);
    }

    private static Pattern compile(Anchor anchor, List<String> words) {
        StringBuilder alternatives = new StringBuilder();
        for (String word : words) {
            if (alternatives.length() > 0) {
                alternatives.append('|');
            }
            alternatives.append(word.replace(" ", "\\s+"));
        }
        String group = "(?:" + alternatives + ")";
        switch (anchor) {
            case LEADING:
                return Pattern.compile("^" + group + "\\s+");
            case TRAILING:
                return Pattern.compile("\\s+" + group + "$");
            default:
                return Pattern.compile("(?<!\\S)" + group + "(?!\\S)");
        }
    }

    public String getName() {
        return name;
    }

    public Anchor getAnchor() {
        return anchor;
    }

    public List<String> getWords() {
        return words;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Applies this rule to a folded key. A leading or trailing word is only stripped when something
     * else remains, so "the" on its own stays "the".
     */
    public String apply(String foldedKey) {
        if (foldedKey == null) {
            return null;
        }
        String result = pattern.matcher(foldedKey).replaceAll("");
        return anchor == Anchor.ANYWHERE ? result.trim() : result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((NormalizationRule) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "NormalizationRule{name='" + name + "', anchor=" + anchor.name().toLowerCase(Locale.ROOT)
                + ", words=" + words + ", priority=" + priority + '}';
    }
}
