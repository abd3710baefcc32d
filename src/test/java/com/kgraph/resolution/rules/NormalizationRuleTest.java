package com.kgraph.resolution.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NormalizationRule Tests")
class NormalizationRuleTest {

    @Test
    @DisplayName("Trailing rules should strip only a final word")
    void trailing() {
        NormalizationRule rule = NormalizationRule.trailing("org-inc", 10, "inc", "incorporated");

        assertEquals("apple", rule.apply("apple inc"));
        assertEquals("apple", rule.apply("apple incorporated"));
        assertEquals("inc apple", rule.apply("inc apple"));
        assertEquals("apple zinc", rule.apply("apple zinc"));
        assertEquals("inc", rule.apply("inc"));
    }

    @Test
    @DisplayName("Leading rules should strip only a first word")
    void leading() {
        NormalizationRule rule = NormalizationRule.leading("person-honorific", 10, "dr", "mr");

        assertEquals("jane smith", rule.apply("dr jane smith"));
        assertEquals("drake", rule.apply("drake"));
        assertEquals("jane mr smith", rule.apply("jane mr smith"));
    }

    @Test
    @DisplayName("Multi-word affixes should match folded spacing")
    void multiWord() {
        NormalizationRule rule = NormalizationRule.trailing("org-sa", 10, "s a");

        assertEquals("societe generale", rule.apply("societe generale s a"));
        assertEquals("societe generale", rule.apply("societe generale s   a"));
    }

    @Test
    @DisplayName("Anywhere rules should drop every standalone occurrence")
    void anywhere() {
        NormalizationRule rule = NormalizationRule.anywhere("org-and", 20, "and");

        assertEquals("johnson  johnson", rule.apply("johnson and johnson"));
        assertEquals("anderson brand", rule.apply("anderson brand"));
        assertEquals("", rule.apply("and"));
        assertNull(rule.apply(null));
    }

    @Test
    @DisplayName("The profile should collapse the spacing left behind")
    void profileCollapsesSpaces() {
        NormalizationProfile profile = new NormalizationProfile("test", List.of(
                NormalizationRule.anywhere("org-and", 20, "and"),
                NormalizationRule.trailing("org-co", 10, "co")));

        assertEquals("johnson johnson", profile.strip("johnson and johnson co"));
        assertEquals(List.of("org-co", "org-and"), profile.getRules().stream().map(NormalizationRule::getName).toList());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Inc", "inc.", " inc", "inc  ltd", ""})
    @DisplayName("Words must be given folded")
    void rejectsUnfoldedWords(String word) {
        assertThrows(IllegalArgumentException.class, () -> NormalizationRule.trailing("bad", 10, word));
    }

    @Test
    @DisplayName("A rule needs a name and at least one word")
    void validation() {
        assertThrows(NullPointerException.class, () -> NormalizationRule.leading(null, 10, "the"));
        assertThrows(IllegalArgumentException.class, () -> NormalizationRule.leading("empty", 10));
    }
}
