package com.kgraph.resolution.rules;

import com.kgraph.resolution.core.model.Candidate;
import com.kgraph.resolution.core.model.EntityType;
import com.kgraph.resolution.core.model.RawMention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns raw mentions into candidates: classifies the type and computes the comparison key.
 *
 * <p>The key is folded (diacritics removed, lowercased, punctuation turned into spaces,
 * whitespace collapsed) and then stripped by the type's {@link NormalizationProfile}.
 * If stripping leaves nothing, the folded form is used. The surface form is kept verbatim.</p>
 */
public class CandidateNormalizer {
    private static final Logger log = LoggerFactory.getLogger(CandidateNormalizer.class);

    public static final int MAX_SURFACE_LENGTH = 1000;

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern APOSTROPHES = Pattern.compile("['’`]");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final NormalizationProfiles profiles;
    private final TypeInference typeInference;

    public CandidateNormalizer() {
        this(NormalizationProfiles.defaults(), new ContextKeywordTypeInference());
    }

    public CandidateNormalizer(NormalizationProfiles profiles, TypeInference typeInference) {
        this.profiles = Objects.requireNonNull(profiles, "profiles is required");
        this.typeInference = Objects.requireNonNull(typeInference, "typeInference is required");
    }

    /**
     * Normalizes one mention.
     *
     * @throws MalformedMentionException if the mention has no usable surface form or offsets
     */
    public Candidate normalize(RawMention mention) {
        Objects.requireNonNull(mention, "mention is required");
        validate(mention);

        EntityType type = classify(mention);
        String folded = fold(mention.surfaceForm());
        if (folded.isEmpty()) {
            throw new MalformedMentionException(mention.mentionId(), "surface form has no letters or digits");
        }
        String key = profiles.forType(type).strip(folded);
        if (key.isEmpty()) {
            key = folded;
        }

        log.debug("normalize.completed mentionId={} surface='{}' key='{}' type={}",
                mention.mentionId(), mention.surfaceForm(), key, type);
        return new Candidate(key, mention.surfaceForm(), type, mention);
    }

    /**
     * Computes the comparison key of an arbitrary string, as for a mention of {@code type}.
     * Used to key search queries.
     */
    public String keyFor(String text, EntityType type) {
        String folded = fold(text);
        String key = profiles.forType(type).strip(folded);
        return key.isEmpty() ? folded : key;
    }

    EntityType classify(RawMention mention) {
        return EntityType.fromLabel(mention.declaredType())
                .orElseGet(() -> typeInference.infer(mention.surfaceForm(), mention.context()));
    }

    /**
     * Lowercases, removes diacritics and apostrophes, folds other punctuation to single spaces.
     */
    public static String fold(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        String unmarked = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        String lower = unmarked.toLowerCase(Locale.ROOT);
        String noApostrophes = APOSTROPHES.matcher(lower).replaceAll("");
        return NON_WORD.matcher(noApostrophes).replaceAll(" ").trim();
    }

    private static void validate(RawMention mention) {
        String surface = mention.surfaceForm();
        if (surface == null || surface.isBlank()) {
            throw new MalformedMentionException(mention.mentionId(), "surface form is blank");
        }
        if (surface.length() > MAX_SURFACE_LENGTH) {
            throw new MalformedMentionException(mention.mentionId(),
                    "surface form exceeds " + MAX_SURFACE_LENGTH + " characters");
        }
        for (int i = 0; i < surface.length(); i++) {
            char c = surface.charAt(i);
            if (Character.isISOControl(c) && !Character.isWhitespace(c)) {
                throw new MalformedMentionException(mention.mentionId(), "surface form contains control characters");
            }
        }
        if (mention.startOffset() < 0 || mention.endOffset() <= mention.startOffset()) {
            throw new MalformedMentionException(mention.mentionId(),
                    "invalid offsets [" + mention.startOffset() + ", " + mention.endOffset() + ")");
        }
    }
}
