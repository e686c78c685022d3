package com.herzen.oracle.sandbox;

import com.herzen.oracle.sandbox.SandboxModels.Token;
import com.herzen.oracle.sandbox.SandboxModels.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class ExpressionTokenizer {
    private static final List<String> OPERATORS = List.of(
            "**", "//", "==", "!=", "<=", ">=", ":=", "<<", ">>", "->",
            "+", "-", "*", "/", "%", "<", ">", "(", ")", "[", "]", "{", "}",
            ",", ":", ".", "=", "&", "|", "^", "~", "@", ";"
    );
    private static final Set<String> DISALLOWED_STRING_PREFIXES = Set.of(
            "f", "b", "rb", "br", "fr", "rf"
    );

    private final String input;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) {
                tokens.add(new Token(TokenType.EOF, "", null, pos));
                return tokens;
            }
            char c = input.charAt(pos);
            if (Character.isDigit(c) || (c == '.' && pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1)))) {
                tokens.add(readNumber());
            } else if (c == '\'' || c == '"') {
                tokens.add(readString(false));
            } else if (Character.isLetter(c) || c == '_') {
                int start = pos;
                while (pos < input.length() && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
                    pos++;
                }
                String name = input.substring(start, pos);
                if (pos < input.length() && (input.charAt(pos) == '\'' || input.charAt(pos) == '"')) {
                    String prefix = name.toLowerCase();
                    if (DISALLOWED_STRING_PREFIXES.contains(prefix)) {
                        throw new SandboxException(SandboxException.DISALLOWED_SYNTAX,
                                "Disallowed syntax: " + prefix + "-string literal at position " + start);
                    }
                    if (prefix.equals("r") || prefix.equals("u")) {
                        Token str = readString(prefix.equals("r"));
                        tokens.add(new Token(TokenType.STRING, str.text(), str.literal(), start));
                        continue;
                    }
                }
                tokens.add(new Token(TokenType.NAME, name, null, start));
            } else {
                tokens.add(readOperator());
            }
        }
    }

    private void skipWhitespaceAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#') {
                while (pos < input.length() && input.charAt(pos) != '\n') pos++;
            } else {
                return;
            }
        }
    }

    private Token readNumber() {
        int start = pos;
        boolean isFloat = false;
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) pos++;
        if (pos < input.length() && input.charAt(pos) == '.') {
            isFloat = true;
            pos++;
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) pos++;
        }
        if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-')) pos++;
            if (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                isFloat = true;
                while (pos < input.length() && Character.isDigit(input.charAt(pos))) pos++;
            } else {
                pos = mark;
            }
        }
        if (pos < input.length() && (input.charAt(pos) == 'j' || input.charAt(pos) == 'J')) {
            throw new SandboxException(SandboxException.DISALLOWED_SYNTAX,
                    "Disallowed syntax: complex literal at position " + start);
        }
        if (pos < input.length() && (Character.isLetter(input.charAt(pos)) || input.charAt(pos) == '_')) {
            throw new SandboxException(SandboxException.SYNTAX_ERROR,
                    "Invalid number literal at position " + start);
        }
        String text = input.substring(start, pos);
        if (isFloat) {
            return new Token(TokenType.NUMBER, text, Double.parseDouble(text), start);
        }
        try {
            return new Token(TokenType.NUMBER, text, Long.parseLong(text), start);
        } catch (NumberFormatException e) {
            throw new SandboxException(SandboxException.SYNTAX_ERROR, "Integer literal too large: " + text);
        }
    }

    private Token readString(boolean raw) {
        int start = pos;
        char quote = input.charAt(pos++);
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == quote) {
                return new Token(TokenType.STRING, input.substring(start, pos), sb.toString(), start);
            }
            if (c == '\\' && pos < input.length()) {
                char n = input.charAt(pos++);
                if (raw) {
                    sb.append('\\').append(n);
                    continue;
                }
                switch (n) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '0' -> sb.append('\0');
                    case '\\' -> sb.append('\\');
                    case '\'' -> sb.append('\'');
                    case '"' -> sb.append('"');
                    default -> sb.append('\\').append(n);
                }
            } else {
                sb.append(c);
            }
        }
        throw new SandboxException(SandboxException.SYNTAX_ERROR, "Unterminated string literal at position " + start);
    }

    private Token readOperator() {
        for (String op : OPERATORS) {
            if (input.startsWith(op, pos)) {
                Token token = new Token(TokenType.OPERATOR, op, null, pos);
                pos += op.length();
                return token;
            }
        }
        throw new SandboxException(SandboxException.SYNTAX_ERROR,
                "Unexpected character '" + input.charAt(pos) + "' at position " + pos);
    }
}
