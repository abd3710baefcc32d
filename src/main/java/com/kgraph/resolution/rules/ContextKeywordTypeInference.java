package com.kgraph.resolution.rules;

import com.kgraph.resolution.core.model.EntityType;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword-based fallback classifier.
 *
 * <p>Cues in the surface form win: a leading honorific means {@link EntityType#PERSON},
 * a trailing legal form means {@link EntityType#ORGANIZATION}. Otherwise the words of the
 * context window vote; a single winning type is returned, a tie or no vote gives
 * {@link EntityType#UNKNOWN}.</p>
 */
public class ContextKeywordTypeInference implements TypeInference {

    private static final Pattern HONORIFIC = Pattern.compile(
            "^(mr|mrs|ms|miss|dr|prof|sir)\\.?\\s+\\S", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEGAL_SUFFIX = Pattern.compile(
            "[\\s,]+(inc|incorporated|corp|corporation|co|company|ltd|limited|llc|plc|gmbh|ag|sa|sas|sarl|nv|bv)\\.?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Map<EntityType, Set<String>> CONTEXT_CUES = new EnumMap<>(Map.of(
            EntityType.PERSON, Set.of("ceo", "founder", "cofounder", "president", "chairman", "he", "she",
                    "his", "her", "said", "born", "mr", "mrs", "ms", "dr"),
            EntityType.ORGANIZATION, Set.of("company", "corporation", "firm", "startup", "subsidiary",
                    "acquired", "acquisition", "shares", "headquartered", "inc", "ltd", "llc"),
            EntityType.LOCATION, Set.of("city", "country", "capital", "region", "located", "province", "state")
    ));

    @Override
    public EntityType infer(String surfaceForm, String context) {
        if (surfaceForm != null) {
            String surface = surfaceForm.trim();
            if (HONORIFIC.matcher(surface).find()) {
                return EntityType.PERSON;
            }
            if (LEGAL_SUFFIX.matcher(surface).find()) {
                return EntityType.ORGANIZATION;
            }
        }
        if (context == null || context.isBlank()) {
            return EntityType.UNKNOWN;
        }

        Map<EntityType, Integer> votes = new EnumMap<>(EntityType.class);
        for (String word : WORD.split(context.toLowerCase(Locale.ROOT))) {
            for (Map.Entry<EntityType, Set<String>> cue : CONTEXT_CUES.entrySet()) {
                if (cue.getValue().contains(word)) {
                    votes.merge(cue.getKey(), 1, Integer::sum);
                }
            }
        }

        EntityType best = EntityType.UNKNOWN;
        int bestVotes = 0;
        boolean tied = false;
        for (Map.Entry<EntityType, Integer> vote : votes.entrySet()) {
            if (vote.getValue() > bestVotes) {
                best = vote.getKey();
                bestVotes = vote.getValue();
                tied = false;
            } else if (vote.getValue() == bestVotes) {
                tied = true;
            }
        }
        return tied ? EntityType.UNKNOWN : best;
    }
}
