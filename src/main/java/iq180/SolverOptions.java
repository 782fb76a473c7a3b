package iq180;

import iq180.search.ShapeMode;

/**
 * Tunables of a search.
 *
 * @param shapeMode         which bracketings are enumerated
 * @param maxExactSolutions how many exact solutions a result keeps
 * @param sigmaMaxSpan      largest {@code end - start} tried by the summation
 *                          extension
 */
public record SolverOptions(ShapeMode shapeMode, int maxExactSolutions, int sigmaMaxSpan) {
	public static final int DEFAULT_MAX_EXACT_SOLUTIONS = 3;
	public static final int DEFAULT_SIGMA_MAX_SPAN = 20;

	public SolverOptions {
		if (shapeMode == null)
			throw new IllegalArgumentException("shapeMode cannot be null");
		if (maxExactSolutions < 1)
			throw new IllegalArgumentException("maxExactSolutions must be positive: " + maxExactSolutions);
		if (sigmaMaxSpan < 1)
			throw new IllegalArgumentException("sigmaMaxSpan must be positive: " + sigmaMaxSpan);
	}

	public static SolverOptions defaults() {
		return new SolverOptions(ShapeMode.FIXED, DEFAULT_MAX_EXACT_SOLUTIONS, DEFAULT_SIGMA_MAX_SPAN);
	}

	public SolverOptions withShapeMode(ShapeMode mode) {
		return new SolverOptions(mode, maxExactSolutions, sigmaMaxSpan);
	}

	public SolverOptions withMaxExactSolutions(int max) {
		return new SolverOptions(shapeMode, max, sigmaMaxSpan);
	}

	public SolverOptions withSigmaMaxSpan(int span) {
		return new SolverOptions(shapeMode, maxExactSolutions, span);
	}
}
