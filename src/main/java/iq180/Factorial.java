package iq180;

/**
 * Factorial restricted to {@code [0, 10]} so that intermediate values stay
 * small enough to keep the search bounded.
 */
public final class Factorial {
	public static final int MAX_ARGUMENT = 10;

	/** Returned for any argument outside {@code [0, MAX_ARGUMENT]}. */
	public static final long UNBOUNDED = -1L;

	private Factorial() {
	}

	public static long of(long n) {
		if (n < 0 || n > MAX_ARGUMENT)
			return UNBOUNDED;
		long result = 1;
		for (long i = 2; i <= n; i++) {
			result *= i;
		}
		return result;
	}
}
