package com.herzen.oracle.service;

public class PatternNotFoundException extends RuntimeException {
    private final String patternId;

    public PatternNotFoundException(String patternId) {
        super("Pattern not found: " + patternId);
        this.patternId = patternId;
    }

    public String patternId() {
        return patternId;
    }
}
