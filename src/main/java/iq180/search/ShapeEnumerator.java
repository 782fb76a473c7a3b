package iq180.search;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import iq180.Operator;
import iq180.rpn.Token;

/**
 * Builds candidate RPN expressions from a permutation and an operator
 * assignment. A shape is a template over {@code n} (number slot) and
 * {@code o} (operator slot); numbers and operators fill it left to right.
 */
public final class ShapeEnumerator {
	private static final char NUMBER_SLOT = 'n';
	private static final char OPERATOR_SLOT = 'o';

	private final ShapeMode mode;
	private final Map<Integer, List<String>> templatesBySize = new HashMap<>();

	public ShapeEnumerator(ShapeMode mode) {
		this.mode = mode;
	}

	/**
	 * Every ordered assignment of {@code length} operators drawn with
	 * repetition from {@code operators}; the first position varies slowest.
	 */
	public static List<List<Operator>> operatorCombinations(List<Operator> operators, int length) {
		List<List<Operator>> combos = new ArrayList<>();
		combos.add(List.of());
		for (int i = 0; i < length; i++) {
			List<List<Operator>> next = new ArrayList<>(combos.size() * operators.size());
			for (List<Operator> prefix : combos) {
				for (Operator op : operators) {
					List<Operator> combo = new ArrayList<>(prefix);
					combo.add(op);
					next.add(combo);
				}
			}
			combos = next;
		}
		return combos;
	}

	public List<String> templates(int size) {
		return templatesBySize.computeIfAbsent(size,
				n -> mode == ShapeMode.ALL_TREES ? List.copyOf(trees(n)) : fixedShapes(n));
	}

	/** Candidates for one permutation and one assignment, in shape order. */
	public List<List<Token>> candidates(List<Long> permutation, List<Operator> assignment) {
		List<List<Token>> out = new ArrayList<>();
		for (String template : templates(permutation.size())) {
			out.add(fill(template, permutation, assignment));
		}
		return out;
	}

	private static List<String> fixedShapes(int size) {
		List<String> shapes = new ArrayList<>();
		shapes.add(leftFold(size));
		if (size == 4)
			shapes.add("nnonnoo");
		if (size == 5)
			shapes.add("nnonnoono");
		return List.copyOf(shapes);
	}

	static String leftFold(int size) {
		return NUMBER_SLOT + "no".repeat(Math.max(0, size - 1));
	}

	// left subtree sizes run from largest to smallest so the left fold comes first
	private static List<String> trees(int leaves) {
		List<String> out = new ArrayList<>();
		if (leaves == 1) {
			out.add(String.valueOf(NUMBER_SLOT));
			return out;
		}
		for (int left = leaves - 1; left >= 1; left--) {
			for (String l : trees(left)) {
				for (String r : trees(leaves - left)) {
					out.add(l + r + OPERATOR_SLOT);
				}
			}
		}
		return out;
	}

	private static List<Token> fill(String template, List<Long> numbers, List<Operator> operators) {
		List<Token> rpn = new ArrayList<>(template.length());
		int ni = 0;
		int oi = 0;
		for (int i = 0; i < template.length(); i++) {
			if (template.charAt(i) == NUMBER_SLOT)
				rpn.add(Token.number(numbers.get(ni++)));
			else
				rpn.add(Token.op(operators.get(oi++)));
		}
		return rpn;
	}
}
