package com.kgraph.resolution.extraction;

/**
 * External named-entity and relation extractor.
 *
 * <p>Implementations may throw {@link TransientExtractionException} for failures worth
 * retrying (rate limits, timeouts, unavailable service). Any other exception fails the
 * chunk without retry.</p>
 */
@FunctionalInterface
public interface ExtractionCapability {

    /**
     * Extracts entity mentions and relations from a piece of text.
     *
     * @param text the text to analyze, at most one chunk long
     * @return mentions with offsets relative to {@code text}, and relations between them
     */
    ExtractionResult extract(String text);

    /**
     * Whether the extractor can take requests right now. Checked once per document before any
     * chunk is sent; the default assumes an in-process extractor that is always ready.
     */
    default boolean isAvailable() {
        return true;
    }
}
