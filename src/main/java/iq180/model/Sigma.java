package iq180.model;

/**
 * A closed-form sum {@code Σ body} for the index running from {@code start}
 * to {@code end} inclusive.
 */
public record Sigma(long start, long end, String body) {
	public static final String INDEX = "i";

	public static Sigma ofIndex(long start, long end) {
		return new Sigma(start, end, INDEX);
	}

	/**
	 * Sum of the consecutive integers {@code start..end}, or null when it does
	 * not fit in a long.
	 */
	public static Long sum(long start, long end) {
		try {
			final long count = Math.addExact(Math.subtractExact(end, start), 1);
			final long ends = Math.addExact(start, end);
			// exactly one of the two factors is even
			if (count % 2 == 0)
				return Math.multiplyExact(count / 2, ends);
			return Math.multiplyExact(count, ends / 2);
		} catch (ArithmeticException ex) {
			return null;
		}
	}
}
