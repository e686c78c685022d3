package com.herzen.oracle.pattern;

import com.herzen.oracle.sandbox.EvaluationException;
import com.herzen.oracle.sandbox.ExpressionEvaluator;
import com.herzen.oracle.sandbox.SandboxException;
import com.herzen.oracle.sandbox.SandboxValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class TemplateRenderer {
    private static final Logger log = LoggerFactory.getLogger(TemplateRenderer.class);
    private static final int MAX_NESTING = 4;

    private final ExpressionEvaluator evaluator;

    public TemplateRenderer(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public String render(String text, Map<String, ?> context) {
        if (text == null || text.isEmpty()) return "";
        return render(text, context, 0);
    }

    // Inner spans are rendered within the template text only; substituted values are never scanned again.
    private String render(String text, Map<String, ?> context, int depth) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            int close = c == '{' ? matchingBrace(text, i) : -1;
            if (close < 0) {
                out.append(c);
                i++;
                continue;
            }
            String placeholder = text.substring(i, close + 1);
            String inner = text.substring(i + 1, close);
            if (depth + 1 >= MAX_NESTING && inner.indexOf('{') >= 0) {
                out.append(placeholder);
            } else {
                String expression = inner.indexOf('{') >= 0 ? render(inner, context, depth + 1) : inner;
                out.append(replacement(expression, placeholder, context));
            }
            i = close + 1;
        }
        return out.toString();
    }

    private static int matchingBrace(String text, int open) {
        int depth = 0;
        for (int j = open; j < text.length(); j++) {
            char c = text.charAt(j);
            if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return j;
            }
        }
        return -1;
    }

    private String replacement(String inner, String placeholder, Map<String, ?> context) {
        String expression = inner.strip();
        try {
            return SandboxValues.str(evaluator.evaluate(expression, context));
        } catch (SandboxException e) {
            if (isViolation(e)) {
                log.warn("Placeholder {} rejected by sandbox: {}", placeholder, e.getMessage());
            } else {
                log.debug("Placeholder {} not evaluated: {}", placeholder, e.getMessage());
            }
        } catch (EvaluationException e) {
            log.debug("Placeholder {} failed to evaluate: {}", placeholder, e.getMessage());
        }
        if (context.containsKey(expression)) {
            return SandboxValues.str(context.get(expression));
        }
        return placeholder;
    }

    private static boolean isViolation(SandboxException e) {
        return switch (e.code()) {
            case SandboxException.SYNTAX_ERROR, SandboxException.UNKNOWN_IDENTIFIER, SandboxException.EMPTY_EXPRESSION -> false;
            default -> true;
        };
    }
}
