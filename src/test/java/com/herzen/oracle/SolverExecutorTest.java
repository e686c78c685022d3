package com.herzen.oracle;

import com.herzen.oracle.sandbox.EvaluationException;
import com.herzen.oracle.sandbox.ExpressionEvaluator;
import com.herzen.oracle.sandbox.SandboxException;
import com.herzen.oracle.sandbox.SandboxLimits;
import com.herzen.oracle.solver.SolverExecutor;
import com.herzen.oracle.solver.SolverModels.StepKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(OutputCaptureExtension.class)
class SolverExecutorTest {
    private final SolverExecutor solver = new SolverExecutor(new ExpressionEvaluator(SandboxLimits.defaults(), null));

    @Test
    void runsAssignmentsAndReturnsResult() {
        assertEquals(14L, solver.execute("x = a + b; y = x * 2; return y", Map.of("a", 3, "b", 4)));
    }

    @Test
    void returnsLastValueWithoutReturnStatement() {
        assertEquals(10L, solver.execute("x = 4; x + 6", Map.of()));
        assertEquals(5L, solver.execute("x = 5", Map.of()));
        assertNull(solver.execute("x = 1; return", Map.of()));
    }

    @Test
    void stopsAtReturn() {
        assertEquals(1L, solver.execute("return 1; 1 / 0", Map.of()));
    }

    @Test
    void keepsSemicolonsInsideStrings() {
        assertEquals("a;b", solver.execute("s = 'a;b'; return s", Map.of()));
    }

    @Test
    void doesNotMutateCallerContext() {
        Map<String, Object> context = new HashMap<>(Map.of("a", 1));
        solver.execute("a = 5; b = a * 2; return b", context);
        assertEquals(Map.of("a", 1), context);
    }

    @Test
    void comparisonIsNotAssignment() {
        assertEquals(true, solver.execute("x == 3", Map.of("x", 3)));
    }

    @Test
    void tracesSteps() {
        var run = solver.trace("x = a + b; x * 2; return x - 1", Map.of("a", 3, "b", 4));
        assertEquals(6L, run.result());
        assertEquals(List.of(StepKind.ASSIGNMENT, StepKind.EXPRESSION, StepKind.RETURN),
                run.steps().stream().map(s -> s.kind()).toList());
        assertEquals(List.of("Step: x = a + b = 7", "Evaluate: x * 2 = 14", "Final: x - 1 = 6"), run.describe());
    }

    @Test
    void enforcesStatementLimitBeforeRunning() {
        String code = "x = 1; ".repeat(21) + "return x";
        SandboxException ex = assertThrows(SandboxException.class, () -> solver.execute(code, Map.of()));
        assertEquals(SandboxException.TOO_MANY_STATEMENTS, ex.code());
    }

    @Test
    void rejectsEmptyCode() {
        assertEquals(SandboxException.EMPTY_EXPRESSION,
                assertThrows(SandboxException.class, () -> solver.execute(" ; ; ", Map.of())).code());
    }

    @Test
    void rejectsAssignmentToReservedNames() {
        for (String code : List.of("abs = 1", "math = 2", "sqrt = 3", "__x = 4", "True = 5")) {
            SandboxException ex = assertThrows(SandboxException.class, () -> solver.execute(code, Map.of()), code);
            assertEquals(SandboxException.DISALLOWED_ASSIGNMENT, ex.code(), code);
        }
    }

    @Test
    void appliesSandboxToEveryStatement() {
        SandboxException ex = assertThrows(SandboxException.class,
                () -> solver.execute("x = 1; y = __import__('os'); return y", Map.of()));
        assertEquals(SandboxException.DISALLOWED_CALL, ex.code());
    }

    @Test
    void checksCodeWithoutRunningIt() {
        assertDoesNotThrow(() -> solver.check("d = b ** 2 - 4 * a * c; return d", Set.of("a", "b", "c")));
        SandboxException ex = assertThrows(SandboxException.class, () -> solver.check("return e1 + 1", Set.of("a")));
        assertEquals(SandboxException.UNKNOWN_IDENTIFIER, ex.code());
    }

    @Test
    void logsEachRunWithTruncatedCode(CapturedOutput output) {
        String code = "total_value = first_value + second_value; ".repeat(5) + "return total_value";
        assertEquals(3L, solver.execute(code, Map.of("first_value", 1, "second_value", 2)));

        String logged = code.substring(0, 180) + "...";
        assertTrue(output.getOut().contains("Solver run start: code=" + logged), output.getOut());
        assertTrue(output.getOut().contains("Solver run success: code=" + logged + " result=3"), output.getOut());
        assertFalse(output.getOut().contains(code));
    }

    @Test
    void logsFailureBeforeRethrowing(CapturedOutput output) {
        assertThrows(EvaluationException.class, () -> solver.execute("x = 1 / 0", Map.of()));
        assertTrue(output.getOut().contains("Solver run failed: code=x = 1 / 0 error="), output.getOut());
        assertTrue(output.getOut().contains("division by zero"), output.getOut());
    }
}
