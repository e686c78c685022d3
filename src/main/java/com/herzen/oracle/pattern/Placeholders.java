package com.herzen.oracle.pattern;

import com.herzen.oracle.sandbox.SandboxValues;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Placeholders {
    private static final Pattern TOKEN = Pattern.compile("\\{([^{}]*)}");

    private Placeholders() {}

    /** Names referenced by the text, in order of first appearance. */
    public static Set<String> references(String text) {
        Set<String> names = new LinkedHashSet<>();
        if (text == null) return names;
        Matcher m = TOKEN.matcher(text);
        while (m.find()) names.add(m.group(1));
        return names;
    }

    /** Empty when the text references a name that has no value. */
    public static Optional<String> substitute(String text, Map<String, ?> values) {
        Matcher m = TOKEN.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String name = m.group(1);
            if (!values.containsKey(name)) return Optional.empty();
            m.appendReplacement(out, Matcher.quoteReplacement(literal(values.get(name))));
        }
        m.appendTail(out);
        return Optional.of(out.toString());
    }

    public static String replaceAll(String text, String replacement) {
        return TOKEN.matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
    }

    static String literal(Object value) {
        String text = SandboxValues.str(value);
        if (value instanceof Long l && l < 0) return "(" + text + ")";
        if (value instanceof Double d && (d < 0 || (d == 0.0 && 1 / d < 0))) return "(" + text + ")";
        return text;
    }
}
