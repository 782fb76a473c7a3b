package iq180.rpn;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import iq180.Factorial;
import iq180.Operator;

/**
 * Evaluates and renders expressions in Reverse Polish Notation under the
 * puzzle's integer rules, and converts player-typed infix back to RPN with
 * the Shunting-yard algorithm.
 */
public final class RPN {
	public static final long POWER_CEILING = 10_000L;
	public static final double ROOT_TOLERANCE = 1e-5;

	private static final int OPERAND_PRECEDENCE = 4;

	private RPN() {
	}

	/**
	 * Evaluate RPN tokens and return the numeric result.
	 * Returns null when any operator rule is violated, an operator lacks
	 * operands, or the final stack does not hold exactly one value.
	 */
	public static Long evaluate(List<Token> rpn) {
		Deque<Long> stack = new ArrayDeque<>();
		for (Token tk : rpn) {
			if (tk.isNumber()) {
				stack.push(tk.number());
				continue;
			}
			Operator op = tk.operator();
			if (stack.size() < op.arity())
				return null;
			Long res;
			if (op.isUnary()) {
				res = applyUnary(op, stack.pop());
			} else {
				long b = stack.pop();
				long a = stack.pop();
				res = applyBinary(op, a, b);
			}
			if (res == null)
				return null;
			stack.push(res);
		}

		if (stack.size() != 1)
			return null;
		return stack.pop();
	}

	/**
	 * Exact integer square root, or null when {@code a} is negative or not a
	 * perfect square.
	 */
	public static Long exactSqrt(long a) {
		if (a < 0)
			return null;
		long r = (long) Math.sqrt((double) a);
		// correct floating error around large perfect squares; compare by
		// division so squares near Long.MAX_VALUE cannot overflow
		while (r > 0 && r > a / r)
			r--;
		while (r + 1 <= a / (r + 1))
			r++;
		return r * r == a ? r : null;
	}

	private static Long applyUnary(Operator op, long a) {
		switch (op) {
			case FACTORIAL: {
				if (a < 0)
					return null;
				long f = Factorial.of(a);
				return f == Factorial.UNBOUNDED ? null : f;
			}
			case SQRT:
				return exactSqrt(a);
			default:
				return null;
		}
	}

	private static Long applyBinary(Operator op, long a, long b) {
		switch (op) {
			case ADD:
				if (b > 0 && a > Long.MAX_VALUE - b)
					return null;
				return a + b;
			case SUBTRACT:
				if (a < b)
					return null; // no negative intermediate results
				return a - b;
			case MULTIPLY:
				if (a != 0 && Math.abs(b) > Long.MAX_VALUE / Math.abs(a))
					return null;
				return a * b;
			case DIVIDE:
				if (b == 0 || a % b != 0)
					return null;
				return a / b;
			case POWER:
				return power(a, b);
			case ROOT:
				return root(a, b);
			default:
				return null;
		}
	}

	private static Long power(long base, long exponent) {
		if (exponent < 0)
			return null;
		if (exponent == 0)
			return 1L;
		if (base == 0 || base == 1)
			return base;
		long res = 1;
		for (long i = 0; i < exponent; i++) {
			res *= base;
			if (Math.abs(res) > POWER_CEILING)
				return null;
		}
		return res;
	}

	private static Long root(long radicand, long degree) {
		if (degree < 2 || radicand < 0)
			return null;
		double res = Math.pow(radicand, 1.0 / degree);
		long rounded = Math.round(res);
		if (Math.abs(res - rounded) > ROOT_TOLERANCE)
			return null;
		return rounded;
	}

	private record Infix(String text, int prec) {
	}

	/**
	 * Render RPN tokens as a minimally parenthesized infix string. The input is
	 * assumed to evaluate successfully; it is not validated again.
	 */
	public static String toInfix(List<Token> rpn) {
		Deque<Infix> stack = new ArrayDeque<>();
		for (Token tk : rpn) {
			if (tk.isNumber()) {
				stack.push(new Infix(Long.toString(tk.number()), OPERAND_PRECEDENCE));
				continue;
			}
			Operator op = tk.operator();
			if (op.isUnary()) {
				Infix a = stack.pop();
				String text;
				if (op == Operator.FACTORIAL)
					text = wrap(a, a.prec() < OPERAND_PRECEDENCE) + "!";
				else
					text = "sqrt(" + a.text() + ")";
				stack.push(new Infix(text, OPERAND_PRECEDENCE));
				continue;
			}
			Infix b = stack.pop();
			Infix a = stack.pop();
			int opPrec = op.precedence();
			// the operand printed on the left only needs parentheses when it binds
			// looser; the one printed on the right also when it binds equally
			String text;
			if (op == Operator.ROOT)
				text = wrap(b, b.prec() < opPrec) + " root " + wrap(a, a.prec() <= opPrec);
			else
				text = wrap(a, a.prec() < opPrec) + op.symbol() + wrap(b, b.prec() <= opPrec);
			stack.push(new Infix(text, opPrec));
		}
		return stack.isEmpty() ? "" : stack.peek().text();
	}

	private static String wrap(Infix e, boolean parenthesize) {
		return parenthesize ? "(" + e.text() + ")" : e.text();
	}

	/**
	 * Convert infix tokens to RPN using the Shunting-yard algorithm. All binary
	 * operators are left-associative; {@code sqrt} is a prefix function and
	 * {@code !} a postfix operator.
	 *
	 * @throws InfixParseException on mismatched parentheses or unknown tokens
	 */
	public static List<Token> shuntingYard(List<String> tokens) {
		List<Token> output = new ArrayList<>();
		Deque<String> ops = new ArrayDeque<>();

		for (String tk : tokens) {
			if (isOpenParen(tk)) {
				ops.push(tk);
				continue;
			}
			if (isCloseParen(tk)) {
				processCloseParen(tokens, output, ops);
				continue;
			}
			Operator op = Operator.bySymbol(tk);
			if (op == Operator.FACTORIAL) {
				output.add(Token.op(op));
				continue;
			}
			if (op == Operator.SQRT) {
				ops.push(tk);
				continue;
			}
			if (op != null) {
				while (!ops.isEmpty() && !isOpenParen(ops.peek())
						&& Operator.bySymbol(ops.peek()).precedence() >= op.precedence()) {
					output.add(Token.op(Operator.bySymbol(ops.pop())));
				}
				ops.push(tk);
				continue;
			}
			// operand
			output.add(Token.number(parseNumber(tk, tokens)));
		}
		while (!ops.isEmpty()) {
			String o = ops.pop();
			if (isOpenParen(o))
				throw new InfixParseException("unbalanced parentheses", String.join(" ", tokens));
			output.add(Token.op(Operator.bySymbol(o)));
		}
		return degreeLast(output);
	}

	/**
	 * Infix {@code root} is written degree first while the evaluator expects
	 * the radicand first, so swap the operand runs of every root. Malformed
	 * sequences are returned unchanged for the evaluator to reject.
	 */
	private static List<Token> degreeLast(List<Token> rpn) {
		Deque<List<Token>> stack = new ArrayDeque<>();
		for (Token tk : rpn) {
			if (tk.isNumber()) {
				stack.push(List.of(tk));
				continue;
			}
			Operator op = tk.operator();
			if (stack.size() < op.arity())
				return rpn;
			List<Token> combined = new ArrayList<>();
			if (op.isUnary()) {
				combined.addAll(stack.pop());
			} else {
				List<Token> b = stack.pop();
				List<Token> a = stack.pop();
				combined.addAll(op == Operator.ROOT ? b : a);
				combined.addAll(op == Operator.ROOT ? a : b);
			}
			combined.add(tk);
			stack.push(combined);
		}
		if (stack.size() != 1)
			return rpn;
		return stack.pop();
	}

	private static long parseNumber(String tk, List<String> tokens) {
		try {
			return Long.parseLong(tk);
		} catch (NumberFormatException ex) {
			throw new InfixParseException("invalid operand '" + tk + "'", String.join(" ", tokens), ex);
		}
	}

	private static boolean isOpenParen(String tk) {
		return tk.equals("(");
	}

	private static boolean isCloseParen(String tk) {
		return tk.equals(")");
	}

	private static void processCloseParen(List<String> tokens, List<Token> output, Deque<String> ops) {
		while (!ops.isEmpty() && !isOpenParen(ops.peek()))
			output.add(Token.op(Operator.bySymbol(ops.pop())));
		if (ops.isEmpty())
			throw new InfixParseException("unbalanced parentheses", String.join(" ", tokens));
		ops.pop();
		// a function call closes together with its argument list
		if (!ops.isEmpty() && Operator.bySymbol(ops.peek()) == Operator.SQRT)
			output.add(Token.op(Operator.bySymbol(ops.pop())));
	}
}
