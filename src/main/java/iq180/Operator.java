package iq180;

/**
 * Operators a candidate expression may use. Precedence drives infix rendering
 * and parsing; weight is the operator's contribution to a solution's score.
 */
public enum Operator {
	ADD("+", 2, 1, 1),
	SUBTRACT("-", 2, 1, 1),
	MULTIPLY("*", 2, 2, 1),
	DIVIDE("/", 2, 2, 1),
	POWER("^", 2, 3, 5),
	SQRT("sqrt", 1, 4, 6),
	ROOT("root", 2, 3, 7),
	FACTORIAL("!", 1, 4, 8);

	private final String symbol;
	private final int arity;
	private final int precedence;
	private final int weight;

	Operator(String symbol, int arity, int precedence, int weight) {
		this.symbol = symbol;
		this.arity = arity;
		this.precedence = precedence;
		this.weight = weight;
	}

	public String symbol() {
		return symbol;
	}

	public int arity() {
		return arity;
	}

	public boolean isUnary() {
		return arity == 1;
	}

	public int precedence() {
		return precedence;
	}

	public int weight() {
		return weight;
	}

	/**
	 * Look up an operator by its symbol. Returns null for anything that is not
	 * an operator symbol.
	 */
	public static Operator bySymbol(String symbol) {
		for (Operator op : values()) {
			if (op.symbol.equals(symbol))
				return op;
		}
		return null;
	}
}
