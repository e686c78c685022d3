package com.herzen.oracle.sandbox;

import java.util.List;

public class SandboxModels {
    public enum TokenType { NUMBER, STRING, NAME, OPERATOR, EOF }

    public record Token(TokenType type, String text, Object literal, int position) {
        public boolean is(String value) {
            return (type == TokenType.OPERATOR || type == TokenType.NAME) && text.equals(value);
        }
    }

    /** Every node kind the parser can produce. Anything else is rejected while parsing. */
    public enum NodeKind {
        CONSTANT, NAME, ATTRIBUTE, UNARY_OP, BINARY_OP, BOOL_OP, COMPARE, CONDITIONAL,
        CALL, TUPLE, LIST, DICT, SUBSCRIPT, SLICE
    }

    public enum UnaryOperator {
        PLUS("+"), MINUS("-"), NOT("not");

        private final String symbol;

        UnaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public enum BinaryOperator {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), FLOOR_DIV("//"), MOD("%"), POW("**");

        private final String symbol;

        BinaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public enum BoolOperator { AND, OR }

    public enum CompareOperator {
        EQ("=="), NOT_EQ("!="), LT("<"), LT_E("<="), GT(">"), GT_E(">="), IN("in"), NOT_IN("not in"), IS("is"), IS_NOT("is not");

        private final String symbol;

        CompareOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public sealed interface Node permits Constant, Name, Attribute, UnaryOp, BinOp, BoolOp, Compare,
            Conditional, Call, TupleLiteral, ListLiteral, DictLiteral, Subscript, Slice {
        NodeKind kind();
    }

    public record Constant(Object value) implements Node {
        public NodeKind kind() { return NodeKind.CONSTANT; }
    }

    public record Name(String id) implements Node {
        public NodeKind kind() { return NodeKind.NAME; }
    }

    public record Attribute(Node value, String attr) implements Node {
        public NodeKind kind() { return NodeKind.ATTRIBUTE; }
    }

    public record UnaryOp(UnaryOperator op, Node operand) implements Node {
        public NodeKind kind() { return NodeKind.UNARY_OP; }
    }

    public record BinOp(Node left, BinaryOperator op, Node right) implements Node {
        public NodeKind kind() { return NodeKind.BINARY_OP; }
    }

    public record BoolOp(BoolOperator op, List<Node> values) implements Node {
        public NodeKind kind() { return NodeKind.BOOL_OP; }
    }

    public record Compare(Node left, List<CompareOperator> ops, List<Node> comparators) implements Node {
        public NodeKind kind() { return NodeKind.COMPARE; }
    }

    public record Conditional(Node test, Node body, Node orElse) implements Node {
        public NodeKind kind() { return NodeKind.CONDITIONAL; }
    }

    public record Call(Node func, List<Node> args) implements Node {
        public NodeKind kind() { return NodeKind.CALL; }
    }

    public record TupleLiteral(List<Node> elements) implements Node {
        public NodeKind kind() { return NodeKind.TUPLE; }
    }

    public record ListLiteral(List<Node> elements) implements Node {
        public NodeKind kind() { return NodeKind.LIST; }
    }

    public record DictLiteral(List<Node> keys, List<Node> values) implements Node {
        public NodeKind kind() { return NodeKind.DICT; }
    }

    public record Subscript(Node value, Node index) implements Node {
        public NodeKind kind() { return NodeKind.SUBSCRIPT; }
    }

    /** Only valid as the index of a {@link Subscript}; any bound may be null. */
    public record Slice(Node lower, Node upper, Node step) implements Node {
        public NodeKind kind() { return NodeKind.SLICE; }
    }
}
