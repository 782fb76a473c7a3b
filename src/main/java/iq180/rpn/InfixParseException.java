package iq180.rpn;

/**
 * Exception thrown when a typed infix expression cannot be tokenized or
 * converted to RPN.
 */
public class InfixParseException extends RuntimeException {
	private final String input;

	public InfixParseException(String message, String input) {
		super(message + ": " + input);
		this.input = input;
	}

	public InfixParseException(String message, String input, Throwable cause) {
		super(message + ": " + input, cause);
		this.input = input;
	}

	public String getInput() {
		return input;
	}
}
