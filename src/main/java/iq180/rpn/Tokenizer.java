package iq180.rpn;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical analyzer for player-typed answers.
 * Accepts the plain operator spellings as well as the display glyphs
 * ({@code ×}, {@code ÷}, {@code √}) so printed solutions can be read back.
 */
public final class Tokenizer {
	private static final Pattern OPERAND = Pattern.compile("\\d+|[A-Za-z]+");

	private Tokenizer() {
	}

	/**
	 * Tokenize an input string into numbers, operator symbols and parentheses.
	 *
	 * @throws InfixParseException on characters or words that are not part of
	 *                             the expression language
	 */
	public static List<String> tokenize(String input) {
		List<String> tokens = new ArrayList<>();
		int i = 0;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (Character.isWhitespace(c)) {
				i++;
				continue;
			}
			String symbol = symbolFor(c);
			if (symbol != null) {
				tokens.add(symbol);
				i++;
				continue;
			}
			Matcher m = OPERAND.matcher(input.substring(i));
			if (!m.lookingAt())
				throw new InfixParseException("unexpected character '" + c + "' at " + i, input);
			String tok = m.group();
			if (Character.isLetter(tok.charAt(0)) && !isWordOperator(tok))
				throw new InfixParseException("unknown word '" + tok + "'", input);
			tokens.add(tok);
			i += tok.length();
		}
		return tokens;
	}

	private static String symbolFor(char c) {
		switch (c) {
			case '(':
			case ')':
			case '+':
			case '-':
			case '*':
			case '/':
			case '^':
			case '!':
				return String.valueOf(c);
			case '×':
				return "*";
			case '÷':
				return "/";
			case '√':
				return "sqrt";
			default:
				return null;
		}
	}

	private static boolean isWordOperator(String word) {
		return word.equals("sqrt") || word.equals("root");
	}
}
