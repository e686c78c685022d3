package com.herzen.oracle.sandbox;

import com.herzen.oracle.sandbox.SandboxModels.*;

import java.util.HashSet;
import java.util.Set;

public class SandboxPolicy {
    private final Set<String> allowedNames;
    private final boolean allowRandom;

    public SandboxPolicy(Set<String> contextNames, boolean allowRandom) {
        this.allowRandom = allowRandom;
        this.allowedNames = new HashSet<>(contextNames);
        allowedNames.addAll(SandboxEnvironment.builtinNames());
        allowedNames.addAll(SandboxEnvironment.mathMemberNames());
        allowedNames.add(SandboxEnvironment.MATH);
        if (allowRandom) allowedNames.add(SandboxEnvironment.RANDOM);
    }

    public void check(Node node) {
        if (node == null) return;
        switch (node.kind()) {
            case CONSTANT -> {
            }
            case NAME -> checkName(((Name) node).id());
            case ATTRIBUTE -> checkAttribute((Attribute) node);
            case UNARY_OP -> check(((UnaryOp) node).operand());
            case BINARY_OP -> {
                BinOp bin = (BinOp) node;
                check(bin.left());
                check(bin.right());
            }
            case BOOL_OP -> ((BoolOp) node).values().forEach(this::check);
            case COMPARE -> {
                Compare cmp = (Compare) node;
                check(cmp.left());
                cmp.comparators().forEach(this::check);
            }
            case CONDITIONAL -> {
                Conditional cond = (Conditional) node;
                check(cond.test());
                check(cond.body());
                check(cond.orElse());
            }
            case CALL -> {
                Call call = (Call) node;
                checkCallTarget(call.func());
                call.args().forEach(this::check);
            }
            case TUPLE -> ((TupleLiteral) node).elements().forEach(this::check);
            case LIST -> ((ListLiteral) node).elements().forEach(this::check);
            case DICT -> {
                DictLiteral dict = (DictLiteral) node;
                dict.keys().forEach(this::check);
                dict.values().forEach(this::check);
            }
            case SUBSCRIPT -> {
                Subscript sub = (Subscript) node;
                check(sub.value());
                check(sub.index());
            }
            case SLICE -> {
                Slice slice = (Slice) node;
                check(slice.lower());
                check(slice.upper());
                check(slice.step());
            }
        }
    }

    private void checkName(String id) {
        if (id.startsWith("__")) {
            throw new SandboxException(SandboxException.UNKNOWN_IDENTIFIER, "Disallowed identifier: " + id);
        }
        if (!allowedNames.contains(id)) {
            throw new SandboxException(SandboxException.UNKNOWN_IDENTIFIER, "Unknown identifier: " + id);
        }
    }

    private void checkAttribute(Attribute attribute) {
        if (attribute.value() instanceof Name owner) {
            if (owner.id().equals(SandboxEnvironment.MATH)) {
                if (!SandboxEnvironment.mathMemberNames().contains(attribute.attr())) {
                    throw new SandboxException(SandboxException.DISALLOWED_ATTRIBUTE,
                            "Disallowed math member: " + attribute.attr());
                }
                return;
            }
            if (owner.id().equals(SandboxEnvironment.RANDOM) && allowRandom) {
                if (!SandboxEnvironment.randomMemberNames().contains(attribute.attr())) {
                    throw new SandboxException(SandboxException.DISALLOWED_ATTRIBUTE,
                            "Disallowed random member: " + attribute.attr());
                }
                return;
            }
        }
        throw new SandboxException(SandboxException.DISALLOWED_ATTRIBUTE,
                "Disallowed attribute access: ." + attribute.attr());
    }

    private void checkCallTarget(Node func) {
        if (func instanceof Name name) {
            if (!SandboxEnvironment.builtinNames().contains(name.id())
                    && !SandboxEnvironment.mathMemberNames().contains(name.id())) {
                throw new SandboxException(SandboxException.DISALLOWED_CALL, "Disallowed function call: " + name.id());
            }
            return;
        }
        if (func instanceof Attribute attribute && attribute.value() instanceof Name owner) {
            if (owner.id().equals(SandboxEnvironment.MATH)) {
                if (!SandboxEnvironment.mathMemberNames().contains(attribute.attr())) {
                    throw new SandboxException(SandboxException.DISALLOWED_CALL,
                            "Disallowed math function: " + attribute.attr());
                }
                return;
            }
            if (owner.id().equals(SandboxEnvironment.RANDOM) && allowRandom) {
                if (!SandboxEnvironment.randomMemberNames().contains(attribute.attr())) {
                    throw new SandboxException(SandboxException.DISALLOWED_CALL,
                            "Disallowed random function: " + attribute.attr());
                }
                return;
            }
        }
        throw new SandboxException(SandboxException.DISALLOWED_CALL, "Disallowed call target");
    }
}
