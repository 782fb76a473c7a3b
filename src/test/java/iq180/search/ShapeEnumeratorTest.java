package iq180.search;

import java.util.List;

import iq180.Operator;
import org.junit.jupiter.api.Test;

import static iq180.Operator.ADD;
import static iq180.Operator.DIVIDE;
import static iq180.Operator.MULTIPLY;
import static iq180.Operator.SUBTRACT;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class ShapeEnumeratorTest {
	@Test
	void combinationsRepeatOperatorsInOrder() {
		final var combos = ShapeEnumerator.operatorCombinations(List.of(ADD, SUBTRACT), 2);
		assertEquals(List.of(List.of(ADD, ADD), List.of(ADD, SUBTRACT), List.of(SUBTRACT, ADD),
				List.of(SUBTRACT, SUBTRACT)), combos);
		assertEquals(64, ShapeEnumerator.operatorCombinations(List.of(ADD, SUBTRACT, MULTIPLY, DIVIDE), 3).size());
		assertEquals(List.of(List.of()), ShapeEnumerator.operatorCombinations(List.of(ADD), 0));
	}

	@Test
	void fixedShapesDependOnLength() {
		final var shapes = new ShapeEnumerator(ShapeMode.FIXED);
		assertEquals(List.of("n"), shapes.templates(1));
		assertEquals(List.of("nnono"), shapes.templates(3));
		assertEquals(List.of("nnonono", "nnonnoo"), shapes.templates(4));
		assertEquals(List.of("nnononono", "nnonnoono"), shapes.templates(5));
	}

	@Test
	void candidatesFillNumbersAndOperatorsLeftToRight() {
		final var shapes = new ShapeEnumerator(ShapeMode.FIXED);
		final var candidates = shapes.candidates(List.of(1L, 2L, 3L, 4L), List.of(ADD, MULTIPLY, SUBTRACT));
		assertEquals(2, candidates.size());
		assertEquals("[1, 2, +, 3, *, 4, -]", candidates.get(0).toString());
		assertEquals("[1, 2, +, 3, 4, *, -]", candidates.get(1).toString());

		final var five = shapes.candidates(List.of(1L, 2L, 3L, 4L, 5L), List.of(ADD, MULTIPLY, SUBTRACT, DIVIDE));
		assertEquals("[1, 2, +, 3, 4, *, -, 5, /]", five.get(1).toString());
	}

	@Test
	void allTreesFollowCatalanNumbers() {
		final var shapes = new ShapeEnumerator(ShapeMode.ALL_TREES);
		assertEquals(1, shapes.templates(2).size());
		assertEquals(2, shapes.templates(3).size());
		assertEquals(5, shapes.templates(4).size());
		assertEquals(14, shapes.templates(5).size());
		assertEquals(ShapeEnumerator.leftFold(4), shapes.templates(4).get(0));
	}

	@Test
	void singleNumberNeedsNoOperator() {
		final var shapes = new ShapeEnumerator(ShapeMode.FIXED);
		final List<Operator> none = List.of();
		assertEquals("[[9]]", shapes.candidates(List.of(9L), none).toString());
	}
}
