package com.herzen.oracle.sandbox;

import com.herzen.oracle.sandbox.SandboxModels.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class ExpressionParser {
    private static final int MAX_DEPTH = 100;

    private static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "lambda", "yield", "await", "import", "from", "def", "class", "for", "while", "del", "global",
            "nonlocal", "assert", "pass", "raise", "return", "try", "with", "async", "as", "except",
            "finally", "elif", "break", "continue"
    );
    private static final Set<String> EXPRESSION_KEYWORDS = Set.of("if", "else", "and", "or", "not", "in", "is");
    private static final Set<String> BITWISE_OPERATORS = Set.of("|", "^", "&", "<<", ">>");

    private final List<Token> tokens;
    private int index;
    private int depth;

    private ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Node parse(String expression) {
        ExpressionParser parser = new ExpressionParser(new ExpressionTokenizer(expression).tokenize());
        Node node = parser.parseExpressionList();
        parser.expectEnd();
        return node;
    }

    public static boolean isKeyword(String name) {
        return STATEMENT_KEYWORDS.contains(name) || EXPRESSION_KEYWORDS.contains(name)
                || name.equals("True") || name.equals("False") || name.equals("None");
    }

    private Node parseExpressionList() {
        Node first = parseExpression();
        if (!peek().is(",")) return first;
        List<Node> items = new ArrayList<>();
        items.add(first);
        while (match(",")) {
            if (atExpressionEnd()) break;
            items.add(parseExpression());
        }
        return new TupleLiteral(List.copyOf(items));
    }

    private void expectEnd() {
        Token t = peek();
        if (t.type() == TokenType.EOF) return;
        if (t.is("=")) throw disallowed("assignment", t);
        if (t.is(";")) throw disallowed("multiple statements", t);
        if (t.is(":=")) throw disallowed("assignment expression ':='", t);
        if (t.is("for")) throw disallowed("comprehension", t);
        if (t.is("->")) throw disallowed("annotation", t);
        throw unexpected(t);
    }

    private Node parseExpression() {
        enter();
        try {
            if (peek().is("lambda")) throw disallowed("lambda", peek());
            Node body = parseOr();
            if (match("if")) {
                Node test = parseOr();
                expect("else");
                Node orElse = parseExpression();
                return new Conditional(test, body, orElse);
            }
            if (peek().is(":=")) throw disallowed("assignment expression ':='", peek());
            return body;
        } finally {
            depth--;
        }
    }

    private Node parseOr() {
        Node left = parseAnd();
        if (!peek().is("or")) return left;
        List<Node> values = new ArrayList<>();
        values.add(left);
        while (match("or")) {
            values.add(parseAnd());
        }
        return new BoolOp(BoolOperator.OR, List.copyOf(values));
    }

    private Node parseAnd() {
        Node left = parseNot();
        if (!peek().is("and")) return left;
        List<Node> values = new ArrayList<>();
        values.add(left);
        while (match("and")) {
            values.add(parseNot());
        }
        return new BoolOp(BoolOperator.AND, List.copyOf(values));
    }

    private Node parseNot() {
        if (match("not")) {
            enter();
            try {
                return new UnaryOp(UnaryOperator.NOT, parseNot());
            } finally {
                depth--;
            }
        }
        return parseComparison();
    }

    private Node parseComparison() {
        Node left = parseBitwise();
        List<CompareOperator> ops = new ArrayList<>();
        List<Node> comparators = new ArrayList<>();
        while (true) {
            CompareOperator op = matchCompareOperator();
            if (op == null) break;
            ops.add(op);
            comparators.add(parseBitwise());
        }
        if (ops.isEmpty()) return left;
        return new Compare(left, List.copyOf(ops), List.copyOf(comparators));
    }

    private CompareOperator matchCompareOperator() {
        Token t = peek();
        if (t.type() == TokenType.OPERATOR) {
            CompareOperator op = switch (t.text()) {
                case "==" -> CompareOperator.EQ;
                case "!=" -> CompareOperator.NOT_EQ;
                case "<" -> CompareOperator.LT;
                case "<=" -> CompareOperator.LT_E;
                case ">" -> CompareOperator.GT;
                case ">=" -> CompareOperator.GT_E;
                default -> null;
            };
            if (op != null) index++;
            return op;
        }
        if (t.is("in")) {
            index++;
            return CompareOperator.IN;
        }
        if (t.is("not") && peekAt(1).is("in")) {
            index += 2;
            return CompareOperator.NOT_IN;
        }
        if (t.is("is")) {
            index++;
            return match("not") ? CompareOperator.IS_NOT : CompareOperator.IS;
        }
        return null;
    }

    private Node parseBitwise() {
        Node left = parseArith();
        Token t = peek();
        if (t.type() == TokenType.OPERATOR && BITWISE_OPERATORS.contains(t.text())) {
            throw disallowed("bitwise operator '" + t.text() + "'", t);
        }
        return left;
    }

    private Node parseArith() {
        Node left = parseTerm();
        while (true) {
            if (match("+")) left = new BinOp(left, BinaryOperator.ADD, parseTerm());
            else if (match("-")) left = new BinOp(left, BinaryOperator.SUB, parseTerm());
            else return left;
        }
    }

    private Node parseTerm() {
        Node left = parseFactor();
        while (true) {
            if (match("*")) left = new BinOp(left, BinaryOperator.MUL, parseFactor());
            else if (match("/")) left = new BinOp(left, BinaryOperator.DIV, parseFactor());
            else if (match("//")) left = new BinOp(left, BinaryOperator.FLOOR_DIV, parseFactor());
            else if (match("%")) left = new BinOp(left, BinaryOperator.MOD, parseFactor());
            else if (peek().is("@")) throw disallowed("matrix multiplication", peek());
            else return left;
        }
    }

    private Node parseFactor() {
        enter();
        try {
            if (match("-")) return new UnaryOp(UnaryOperator.MINUS, parseFactor());
            if (match("+")) return new UnaryOp(UnaryOperator.PLUS, parseFactor());
            if (peek().is("~")) throw disallowed("bitwise operator '~'", peek());
            return parsePower();
        } finally {
            depth--;
        }
    }

    private Node parsePower() {
        Node base = parsePrimary();
        if (match("**")) {
            return new BinOp(base, BinaryOperator.POW, parseFactor());
        }
        return base;
    }

    private Node parsePrimary() {
        Node node = parseAtom();
        while (true) {
            if (match("(")) {
                node = new Call(node, parseArguments());
            } else if (match("[")) {
                node = new Subscript(node, parseSubscriptIndex());
                expect("]");
            } else if (match(".")) {
                Token name = next();
                if (name.type() != TokenType.NAME) throw unexpected(name);
                node = new Attribute(node, name.text());
            } else {
                return node;
            }
        }
    }

    private List<Node> parseArguments() {
        List<Node> args = new ArrayList<>();
        if (match(")")) return List.of();
        while (true) {
            Token t = peek();
            if (t.is("*") || t.is("**")) throw disallowed("starred argument", t);
            if (t.type() == TokenType.NAME && peekAt(1).is("=")) throw disallowed("keyword argument '" + t.text() + "'", t);
            args.add(parseExpression());
            if (peek().is("for")) throw disallowed("generator expression", peek());
            if (match(")")) return List.copyOf(args);
            expect(",");
            if (match(")")) return List.copyOf(args);
        }
    }

    private Node parseSubscriptIndex() {
        Node first = parseSliceItem();
        if (!peek().is(",")) return first;
        List<Node> items = new ArrayList<>();
        items.add(first);
        while (match(",")) {
            if (peek().is("]")) break;
            items.add(parseSliceItem());
        }
        return new TupleLiteral(List.copyOf(items));
    }

    private Node parseSliceItem() {
        Node lower = null;
        if (!peek().is(":")) {
            lower = parseExpression();
            if (!peek().is(":")) return lower;
        }
        expect(":");
        Node upper = null;
        if (!peek().is(":") && !peek().is("]") && !peek().is(",")) {
            upper = parseExpression();
        }
        Node step = null;
        if (match(":")) {
            if (!peek().is("]") && !peek().is(",")) {
                step = parseExpression();
            }
        }
        return new Slice(lower, upper, step);
    }

    private Node parseAtom() {
        Token t = next();
        switch (t.type()) {
            case NUMBER:
                return new Constant(t.literal());
            case STRING: {
                StringBuilder sb = new StringBuilder((String) t.literal());
                while (peek().type() == TokenType.STRING) {
                    sb.append((String) next().literal());
                }
                return new Constant(sb.toString());
            }
            case NAME:
                return parseNameAtom(t);
            case OPERATOR:
                return parseBracketAtom(t);
            default:
                throw new SandboxException(SandboxException.SYNTAX_ERROR, "Unexpected end of expression");
        }
    }

    private Node parseNameAtom(Token t) {
        switch (t.text()) {
            case "True":
                return new Constant(Boolean.TRUE);
            case "False":
                return new Constant(Boolean.FALSE);
            case "None":
                return new Constant(null);
            default:
                break;
        }
        if (STATEMENT_KEYWORDS.contains(t.text())) throw disallowed("'" + t.text() + "'", t);
        if (EXPRESSION_KEYWORDS.contains(t.text())) throw unexpected(t);
        if (peek().is(":=")) throw disallowed("assignment expression ':='", peek());
        return new Name(t.text());
    }

    private Node parseBracketAtom(Token t) {
        enter();
        try {
            switch (t.text()) {
                case "(":
                    return parseParenthesized();
                case "[":
                    return parseList();
                case "{":
                    return parseBrace();
                case "*":
                    throw disallowed("starred expression", t);
                default:
                    throw unexpected(t);
            }
        } finally {
            depth--;
        }
    }

    private Node parseParenthesized() {
        if (match(")")) return new TupleLiteral(List.of());
        Node first = parseExpression();
        if (peek().is("for")) throw disallowed("generator expression", peek());
        if (match(")")) return first;
        List<Node> items = new ArrayList<>();
        items.add(first);
        while (match(",")) {
            if (peek().is(")")) break;
            items.add(parseExpression());
        }
        expect(")");
        return new TupleLiteral(List.copyOf(items));
    }

    private Node parseList() {
        if (match("]")) return new ListLiteral(List.of());
        Node first = parseExpression();
        if (peek().is("for")) throw disallowed("list comprehension", peek());
        List<Node> items = new ArrayList<>();
        items.add(first);
        while (match(",")) {
            if (peek().is("]")) break;
            items.add(parseExpression());
        }
        expect("]");
        return new ListLiteral(List.copyOf(items));
    }

    private Node parseBrace() {
        if (match("}")) return new DictLiteral(List.of(), List.of());
        if (peek().is("**")) throw disallowed("dict unpacking", peek());
        Node firstKey = parseExpression();
        if (!match(":")) {
            if (peek().is("for")) throw disallowed("set comprehension", peek());
            throw disallowed("set literal", peek());
        }
        List<Node> keys = new ArrayList<>();
        List<Node> values = new ArrayList<>();
        keys.add(firstKey);
        values.add(parseExpression());
        if (peek().is("for")) throw disallowed("dict comprehension", peek());
        while (match(",")) {
            if (peek().is("}")) break;
            keys.add(parseExpression());
            expect(":");
            values.add(parseExpression());
        }
        expect("}");
        return new DictLiteral(List.copyOf(keys), List.copyOf(values));
    }

    private boolean atExpressionEnd() {
        Token t = peek();
        return t.type() == TokenType.EOF || t.is(")") || t.is("]") || t.is("}") || t.is("=") || t.is(";");
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw new SandboxException(SandboxException.SYNTAX_ERROR, "Expression nested too deeply");
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(index);
        if (t.type() != TokenType.EOF) index++;
        return t;
    }

    private boolean match(String text) {
        if (peek().is(text)) {
            index++;
            return true;
        }
        return false;
    }

    private void expect(String text) {
        if (!match(text)) {
            Token t = peek();
            if (t.type() == TokenType.EOF) {
                throw new SandboxException(SandboxException.SYNTAX_ERROR, "Expected '" + text + "' but expression ended");
            }
            throw new SandboxException(SandboxException.SYNTAX_ERROR,
                    "Expected '" + text + "' but found '" + t.text() + "' at position " + t.position());
        }
    }

    private SandboxException disallowed(String what, Token at) {
        return new SandboxException(SandboxException.DISALLOWED_SYNTAX,
                "Disallowed syntax: " + what + " at position " + at.position());
    }

    private SandboxException unexpected(Token t) {
        if (t.type() == TokenType.EOF) {
            return new SandboxException(SandboxException.SYNTAX_ERROR, "Unexpected end of expression");
        }
        return new SandboxException(SandboxException.SYNTAX_ERROR,
                "Unexpected token '" + t.text() + "' at position " + t.position());
    }
}
