package com.herzen.oracle.sandbox;

public class SandboxException extends RuntimeException {
    public static final String EMPTY_EXPRESSION = "EMPTY_EXPRESSION";
    public static final String EXPRESSION_TOO_LONG = "EXPRESSION_TOO_LONG";
    public static final String SYNTAX_ERROR = "SYNTAX_ERROR";
    public static final String DISALLOWED_SYNTAX = "DISALLOWED_SYNTAX";
    public static final String UNKNOWN_IDENTIFIER = "UNKNOWN_IDENTIFIER";
    public static final String DISALLOWED_CALL = "DISALLOWED_CALL";
    public static final String DISALLOWED_ATTRIBUTE = "DISALLOWED_ATTRIBUTE";
    public static final String DISALLOWED_ASSIGNMENT = "DISALLOWED_ASSIGNMENT";
    public static final String TOO_MANY_STATEMENTS = "TOO_MANY_STATEMENTS";
    public static final String STEP_BUDGET_EXCEEDED = "STEP_BUDGET_EXCEEDED";
    public static final String SEQUENCE_TOO_LONG = "SEQUENCE_TOO_LONG";

    private final String code;

    public SandboxException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
