package com.herzen.oracle.solver;

import com.herzen.oracle.sandbox.ExpressionEvaluator;
import com.herzen.oracle.sandbox.ExpressionParser;
import com.herzen.oracle.sandbox.SandboxEnvironment;
import com.herzen.oracle.sandbox.SandboxException;
import com.herzen.oracle.solver.SolverModels.SolverRun;
import com.herzen.oracle.solver.SolverModels.SolverStep;
import com.herzen.oracle.solver.SolverModels.StepKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class SolverExecutor {
    /** Name under which a pattern's solver result joins its resolved variables. */
    public static final String RESULT_VARIABLE = "solver_result";
    private static final Logger log = LoggerFactory.getLogger(SolverExecutor.class);
    private static final Pattern ASSIGNMENT = Pattern.compile("^([A-Za-z_]\\w*)\\s*=(?!=)\\s*(.+)$", Pattern.DOTALL);
    private static final Pattern RETURN = Pattern.compile("^return(?:(?=[\\s(\\[{'\"-])(.*))?$", Pattern.DOTALL);
    private static final int LOGGED_CODE_LENGTH = 180;
    private static final int LOGGED_CONTEXT_KEYS = 20;

    private final ExpressionEvaluator evaluator;

    public SolverExecutor(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public Object execute(String code, Map<String, ?> context) {
        return trace(code, context).result();
    }

    public SolverRun trace(String code, Map<String, ?> context) {
        Map<String, ?> ctx = context == null ? Map.of() : context;
        String logged = truncate(code);
        log.info("Solver run start: code={} context_keys={}", logged, ctx.keySet().stream().limit(LOGGED_CONTEXT_KEYS).toList());
        try {
            SolverRun run = run(code, ctx);
            log.info("Solver run success: code={} result={}", logged, run.result());
            return run;
        } catch (RuntimeException e) {
            log.warn("Solver run failed: code={} error={}", logged, e.getMessage());
            throw e;
        }
    }

    /** Parses and checks every statement without running any of them. */
    public void check(String code, Set<String> contextNames) {
        Set<String> names = new HashSet<>(contextNames);
        for (String statement : statements(code)) {
            Matcher ret = RETURN.matcher(statement);
            if (ret.matches()) {
                if (ret.group(1) != null && !ret.group(1).isBlank()) {
                    evaluator.compile(ret.group(1), names, false);
                }
                continue;
            }
            Matcher assignment = ASSIGNMENT.matcher(statement);
            if (assignment.matches()) {
                checkTarget(assignment.group(1));
                evaluator.compile(assignment.group(2), names, false);
                names.add(assignment.group(1));
                continue;
            }
            evaluator.compile(statement, names, false);
        }
    }

    private List<String> statements(String code) {
        List<String> statements = split(code == null ? "" : code);
        if (statements.isEmpty()) {
            throw new SandboxException(SandboxException.EMPTY_EXPRESSION, "Empty solver code");
        }
        int max = evaluator.limits().maxStatements();
        if (statements.size() > max) {
            throw new SandboxException(SandboxException.TOO_MANY_STATEMENTS,
                    "Too many statements: " + statements.size() + " > " + max);
        }
        return statements;
    }

    private SolverRun run(String code, Map<String, ?> context) {
        List<String> statements = statements(code);
        Map<String, Object> scope = new LinkedHashMap<>(context);
        List<SolverStep> steps = new ArrayList<>();
        Object last = null;
        for (String statement : statements) {
            Matcher ret = RETURN.matcher(statement);
            if (ret.matches()) {
                String expression = ret.group(1) == null ? "" : ret.group(1).strip();
                Object value = expression.isEmpty() ? null : evaluator.evaluate(expression, scope);
                steps.add(new SolverStep(StepKind.RETURN, expression, null, value));
                return new SolverRun(value, List.copyOf(steps));
            }
            Matcher assignment = ASSIGNMENT.matcher(statement);
            if (assignment.matches()) {
                String target = assignment.group(1);
                checkTarget(target);
                String expression = assignment.group(2).strip();
                last = evaluator.evaluate(expression, scope);
                scope.put(target, last);
                steps.add(new SolverStep(StepKind.ASSIGNMENT, expression, target, last));
                continue;
            }
            last = evaluator.evaluate(statement, scope);
            steps.add(new SolverStep(StepKind.EXPRESSION, statement, null, last));
        }
        return new SolverRun(last, List.copyOf(steps));
    }

    private void checkTarget(String target) {
        if (target.startsWith("__")
                || ExpressionParser.isKeyword(target)
                || SandboxEnvironment.builtinNames().contains(target)
                || SandboxEnvironment.mathMemberNames().contains(target)
                || target.equals(SandboxEnvironment.MATH)
                || target.equals(SandboxEnvironment.RANDOM)) {
            throw new SandboxException(SandboxException.DISALLOWED_ASSIGNMENT, "Cannot assign to '" + target + "'");
        }
    }

    static List<String> split(String code) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == '\\' && i + 1 < code.length()) {
                    current.append(code.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (c == ';') {
                addStatement(statements, current);
            } else {
                current.append(c);
            }
        }
        addStatement(statements, current);
        return statements;
    }

    private static void addStatement(List<String> statements, StringBuilder current) {
        String statement = current.toString().strip();
        if (!statement.isEmpty()) statements.add(statement);
        current.setLength(0);
    }

    private static String truncate(String code) {
        if (code == null) return "";
        return code.length() <= LOGGED_CODE_LENGTH ? code : code.substring(0, LOGGED_CODE_LENGTH) + "...";
    }
}
