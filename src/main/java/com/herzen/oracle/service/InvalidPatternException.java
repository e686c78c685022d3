package com.herzen.oracle.service;

import com.herzen.oracle.validation.ValidationModels.PatternIssue;

import java.util.List;
import java.util.stream.Collectors;

public class InvalidPatternException extends RuntimeException {
    private final List<PatternIssue> issues;

    public InvalidPatternException(String patternId, List<PatternIssue> issues) {
        super("Invalid pattern " + patternId + ": " + issues.stream()
                .map(i -> i.code() + " " + i.field() + " (" + i.message() + ")")
                .collect(Collectors.joining("; ")));
        this.issues = List.copyOf(issues);
    }

    public List<PatternIssue> issues() {
        return issues;
    }
}
