package com.herzen.oracle.service;

public class GenerationFailedException extends RuntimeException {
    private final String patternId;
    private final int attempts;

    public GenerationFailedException(String patternId, int attempts, String lastFailure) {
        super("No valid question for pattern " + patternId + " after " + attempts + " attempts"
                + (lastFailure == null ? "" : "; last failure: " + lastFailure));
        this.patternId = patternId;
        this.attempts = attempts;
    }

    public String patternId() {
        return patternId;
    }

    public int attempts() {
        return attempts;
    }
}
