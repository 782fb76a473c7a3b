package iq180.rpn;

import com.fasterxml.jackson.annotation.JsonValue;
import iq180.Operator;

/**
 * One element of an RPN expression: either a non-negative number or an
 * operator. {@code operator} is null for number tokens.
 */
public record Token(long number, Operator operator) {

	public static Token number(long value) {
		return new Token(value, null);
	}

	public static Token op(Operator operator) {
		return new Token(0, operator);
	}

	public boolean isNumber() {
		return operator == null;
	}

	@JsonValue
	public Object jsonValue() {
		return isNumber() ? (Object) number : operator.symbol();
	}

	@Override
	public String toString() {
		return isNumber() ? Long.toString(number) : operator.symbol();
	}
}
