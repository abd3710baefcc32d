package com.kgraph.resolution.similarity;

import com.kgraph.resolution.core.model.EntityType;

/**
 * Blocks on the type plus the first characters of the first key token,
 * e.g. {@code PERSON|tim} for both "tim cook" and "timothy cook".
 */
public class TokenPrefixBlockingKeyStrategy implements BlockingKeyStrategy {

    private static final int DEFAULT_PREFIX_LENGTH = 3;

    private final int prefixLength;

    public TokenPrefixBlockingKeyStrategy() {
        this(DEFAULT_PREFIX_LENGTH);
    }

    public TokenPrefixBlockingKeyStrategy(int prefixLength) {
        if (prefixLength < 1) {
            throw new IllegalArgumentException("prefixLength must be >= 1");
        }
        this.prefixLength = prefixLength;
    }

    @Override
    public String blockingKey(EntityType type, String normalizedKey) {
        String key = normalizedKey == null ? "" : normalizedKey.trim();
        int space = key.indexOf(' ');
        String firstToken = space < 0 ? key : key.substring(0, space);
        String prefix = firstToken.length() <= prefixLength ? firstToken : firstToken.substring(0, prefixLength);
        return type.name() + "|" + prefix;
    }
}
