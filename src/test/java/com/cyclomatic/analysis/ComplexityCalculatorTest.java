package com.cyclomatic.analysis;

import com.cyclomatic.model.DecisionTally;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityCalculatorTest {

    private final ComplexityCalculator calculator = new ComplexityCalculator();

    private int complexityOf(final String body) {
        return calculator.calculate(ParsedSnippets.function("class A { void f(boolean a, boolean b, boolean c, int x) { " + body + " } }"));
    }

    @Test
    void emptyTallyGivesOne() {
        assertEquals(1, ComplexityCalculator.fromTally(DecisionTally.EMPTY));
    }

    @Test
    void eachDecisionPointAddsOne() {
        DecisionTally tally = DecisionTally.EMPTY;
        for (int decisions = 0; decisions < 10; decisions++) {
            assertEquals(1 + decisions, ComplexityCalculator.fromTally(tally));
            tally = tally.plus(DecisionTally.DECISION_POINT);
        }
    }

    @Test
    void arithmeticDoesNotChangeComplexity() {
        assertEquals(1, calculator.calculate(ParsedSnippets.function("class A { int f(int x){ return x + 1; } }")));
    }

    @Test
    void nestedIfsCountIndependently() {
        assertEquals(3, complexityOf("if (a) { if (b) {} }"));
    }

    @Test
    void shortCircuitChainingCompounds() {
        assertEquals(4, complexityOf("if (a && b || c) {}"));
    }

    @Test
    void loopsCount() {
        assertEquals(2, complexityOf("for (int i = 0; i < x; i++) {}"));
        assertEquals(2, complexityOf("for (char ch : \"abc\".toCharArray()) {}"));
        assertEquals(2, complexityOf("while (x > 0) { x--; }"));
    }

    @Test
    void doWhileIsNotADecisionPoint() {
        assertEquals(1, complexityOf("do { x--; } while (x > 0);"));
        assertEquals(2, complexityOf("do { x--; } while (x > 0 && a);"));
    }

    @Test
    void switchArmsCountSeparately() {
        assertEquals(4, complexityOf("switch (x) { case 1: break; case 2: break; default: break; }"));
        assertEquals(4, complexityOf("int y = switch (x) { case 1, 2 -> 10; case 3 -> 20; default -> 0; };"));
    }

    @Test
    void ternaryCounts() {
        assertEquals(3, complexityOf("int y = a ? (b ? 1 : 2) : 3;"));
    }

    @Test
    void shortCircuitInAssignmentCounts() {
        assertEquals(2, complexityOf("boolean y = a || b;"));
        assertEquals(2, complexityOf("c = a && b;"));
    }

    @Test
    void lambdaDecisionsCountTowardEnclosingFunction() {
        assertEquals(3, complexityOf("Runnable r = () -> { if (a) {} while (b) {} };"));
    }

    @Test
    void catchAndReturnAreNotDecisionPoints() {
        assertEquals(1, complexityOf("try { x = 1; } catch (RuntimeException e) { return; }"));
    }
}
