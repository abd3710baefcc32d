package com.kgraph.resolution.rules;

/**
 * Thrown when a mention cannot be turned into a candidate. The mention is dropped.
 */
public class MalformedMentionException extends RuntimeException {

    private final String mentionId;

    public MalformedMentionException(String mentionId, String reason) {
        super("Malformed mention " + mentionId + ": " + reason);
        this.mentionId = mentionId;
    }

    public String getMentionId() {
        return mentionId;
    }
}
