package iq180;

import java.util.List;

import static iq180.Operator.ADD;
import static iq180.Operator.DIVIDE;
import static iq180.Operator.FACTORIAL;
import static iq180.Operator.MULTIPLY;
import static iq180.Operator.POWER;
import static iq180.Operator.ROOT;
import static iq180.Operator.SQRT;
import static iq180.Operator.SUBTRACT;

/**
 * Difficulty tiers. Each tier extends the operator set of the one below it.
 */
public enum Level {
	BASIC("B", List.of(ADD, SUBTRACT, MULTIPLY, DIVIDE)),
	ONE("1", List.of(ADD, SUBTRACT, MULTIPLY, DIVIDE, POWER)),
	TWO("2", List.of(ADD, SUBTRACT, MULTIPLY, DIVIDE, POWER, SQRT, ROOT)),
	THREE("3", List.of(ADD, SUBTRACT, MULTIPLY, DIVIDE, POWER, SQRT, ROOT, FACTORIAL));

	private final String code;
	private final List<Operator> operators;

	Level(String code, List<Operator> operators) {
		this.code = code;
		this.operators = operators;
	}

	public String code() {
		return code;
	}

	public List<Operator> operators() {
		return operators;
	}

	public boolean allows(Operator op) {
		return operators.contains(op);
	}

	/** Single-operand sqrt/factorial pre-reduction applies from level 2 up. */
	public boolean allowsUnary() {
		return allows(SQRT) || allows(FACTORIAL);
	}

	public boolean allowsSummation() {
		return this == THREE;
	}

	/** The lower of this level and {@code ceiling}. */
	public Level cappedAt(Level ceiling) {
		return ordinal() <= ceiling.ordinal() ? this : ceiling;
	}

	public static Level fromCode(String code) {
		for (Level level : values()) {
			if (level.code.equalsIgnoreCase(code))
				return level;
		}
		throw new IllegalArgumentException("unknown level: " + code);
	}
}
