package iq180.rpn;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import iq180.Level;
import iq180.Operator;
import iq180.search.ShapeEnumerator;
import iq180.search.ShapeMode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RPNTest {
	static List<Token> rpn(Object... items) {
		List<Token> tokens = new ArrayList<>();
		for (Object item : items) {
			if (item instanceof Number n)
				tokens.add(Token.number(n.longValue()));
			else
				tokens.add(Token.op(Operator.bySymbol((String) item)));
		}
		return tokens;
	}

	@Test
	void missingOperandsYieldNoResult() {
		assertNull(RPN.evaluate(rpn(3, "+")));
		assertNull(RPN.evaluate(rpn("+")));
		assertNull(RPN.evaluate(rpn("sqrt")));
		assertNull(RPN.evaluate(rpn(2, "root")));
	}

	@Test
	void finalStackMustHoldOneValue() {
		assertNull(RPN.evaluate(rpn()));
		assertNull(RPN.evaluate(rpn(1, 2)));
		assertNull(RPN.evaluate(rpn(1, 2, 3, "+")));
		assertEquals(4L, RPN.evaluate(rpn(4)));
	}

	@Test
	void subtractionNeverGoesNegative() {
		assertEquals(2L, RPN.evaluate(rpn(5, 3, "-")));
		assertEquals(0L, RPN.evaluate(rpn(3, 3, "-")));
		assertNull(RPN.evaluate(rpn(3, 5, "-")));
		assertNull(RPN.evaluate(rpn(9, 1, 5, "-", "-", 3, 9, "-", "+")));
	}

	@Test
	void divisionMustBeExact() {
		assertEquals(4L, RPN.evaluate(rpn(8, 2, "/")));
		assertEquals(0L, RPN.evaluate(rpn(0, 5, "/")));
		assertNull(RPN.evaluate(rpn(7, 2, "/")));
		assertNull(RPN.evaluate(rpn(5, 0, "/")));
	}

	@Test
	void powerIsCappedAtCeiling() {
		assertEquals(1024L, RPN.evaluate(rpn(2, 10, "^")));
		assertEquals(10_000L, RPN.evaluate(rpn(10, 4, "^")));
		assertNull(RPN.evaluate(rpn(10, 5, "^")));
		assertNull(RPN.evaluate(rpn(2, 100, "^")));
		assertEquals(1L, RPN.evaluate(rpn(0, 0, "^")));
		assertEquals(1L, RPN.evaluate(rpn(1, 3_628_800, "^")));
		assertEquals(0L, RPN.evaluate(rpn(0, 7, "^")));
	}

	@Test
	void rootRequiresIntegerResult() {
		assertEquals(2L, RPN.evaluate(rpn(8, 3, "root")));
		assertEquals(4L, RPN.evaluate(rpn(16, 2, "root")));
		assertEquals(3L, RPN.evaluate(rpn(81, 4, "root")));
		assertEquals(0L, RPN.evaluate(rpn(0, 2, "root")));
		assertNull(RPN.evaluate(rpn(8, 2, "root")));
		assertNull(RPN.evaluate(rpn(5, 1, "root")));
		assertNull(RPN.evaluate(rpn(5, 0, "root")));
	}

	@Test
	void sqrtRequiresPerfectSquare() {
		assertEquals(4L, RPN.evaluate(rpn(16, "sqrt")));
		assertEquals(0L, RPN.evaluate(rpn(0, "sqrt")));
		assertNull(RPN.evaluate(rpn(15, "sqrt")));
		assertEquals(3_000_000_000L, RPN.exactSqrt(9_000_000_000_000_000_000L));
		assertNull(RPN.exactSqrt(-4));
	}

	@Test
	void sqrtNearLongRangeTerminates() {
		assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
			assertNull(RPN.exactSqrt(Long.MAX_VALUE));
			assertEquals(3_037_000_499L, RPN.exactSqrt(3_037_000_499L * 3_037_000_499L));
			assertNull(RPN.exactSqrt(3_037_000_499L * 3_037_000_499L + 1));
			assertNull(RPN.evaluate(rpn(Long.MAX_VALUE, "sqrt")));
		});
	}

	@Test
	void factorialIsBounded() {
		assertEquals(120L, RPN.evaluate(rpn(5, "!")));
		assertEquals(1L, RPN.evaluate(rpn(0, "!")));
		assertEquals(720L, RPN.evaluate(rpn(3, "!", "!")));
		assertNull(RPN.evaluate(rpn(11, "!")));
		assertNull(RPN.evaluate(rpn(4, "!", "!")));
	}

	@Test
	void multiplicationOverflowIsRejected() {
		assertNull(RPN.evaluate(rpn(Long.MAX_VALUE, 2, "*")));
		assertNull(RPN.evaluate(rpn(Long.MAX_VALUE, 1, "+")));
	}

	@Test
	void acceptedValuesAreNonNegative() {
		final var ops = Level.THREE.operators();
		final var shapes = new ShapeEnumerator(ShapeMode.ALL_TREES);
		int accepted = 0;
		for (List<Operator> combo : ShapeEnumerator.operatorCombinations(ops, 3)) {
			for (List<Token> candidate : shapes.candidates(List.of(7L, 3L, 2L, 9L), combo)) {
				final var value = RPN.evaluate(candidate);
				if (value != null) {
					accepted++;
					assertTrue(value >= 0, candidate::toString);
				}
			}
		}
		assertTrue(accepted > 0);
	}

	@Test
	void rendersWithMinimalParentheses() {
		assertEquals("4", RPN.toInfix(rpn(4)));
		assertEquals("(1+2)*3", RPN.toInfix(rpn(1, 2, "+", 3, "*")));
		assertEquals("2*3+4", RPN.toInfix(rpn(2, 3, "*", 4, "+")));
		assertEquals("1-2-3", RPN.toInfix(rpn(1, 2, "-", 3, "-")));
		assertEquals("1-(2+3)", RPN.toInfix(rpn(1, 2, 3, "+", "-")));
		assertEquals("8/(4/2)", RPN.toInfix(rpn(8, 4, 2, "/", "/")));
		assertEquals("2^3^2", RPN.toInfix(rpn(2, 3, "^", 2, "^")));
		assertEquals("(1+2)*(3+4)", RPN.toInfix(rpn(1, 2, "+", 3, 4, "+", "*")));
	}

	@Test
	void rendersRootAndUnaryOperators() {
		assertEquals("3 root 8", RPN.toInfix(rpn(8, 3, "root")));
		assertEquals("3 root (2^3)", RPN.toInfix(rpn(2, 3, "^", 3, "root")));
		assertEquals("sqrt(16)+2", RPN.toInfix(rpn(16, "sqrt", 2, "+")));
		assertEquals("sqrt(7+9)", RPN.toInfix(rpn(7, 9, "+", "sqrt")));
		assertEquals("3!", RPN.toInfix(rpn(3, "!")));
		assertEquals("(2+1)!", RPN.toInfix(rpn(2, 1, "+", "!")));
		assertEquals("", RPN.toInfix(rpn()));
	}
}
