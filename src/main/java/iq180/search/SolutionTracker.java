package iq180.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import iq180.model.Closest;
import iq180.model.SearchResult;
import iq180.model.Sigma;
import iq180.model.Solution;
import iq180.model.SolutionType;
import iq180.rpn.RPN;
import iq180.rpn.Token;

/**
 * Accumulates the results of one search: at most one exact solution per value,
 * where the first one found is kept, and the single closest candidate, where
 * ties keep the earlier one.
 */
public final class SolutionTracker {
	/** Score of a solution that is a bare summation. */
	public static final int SIGMA_SCORE = 100;

	private final long target;
	private final int maxExactSolutions;
	private final Map<Long, Solution> solutions = new LinkedHashMap<>();
	private Closest closest;

	public SolutionTracker(long target, int maxExactSolutions) {
		this.target = target;
		this.maxExactSolutions = maxExactSolutions;
	}

	public long target() {
		return target;
	}

	/**
	 * Record an evaluated candidate. The infix text and score are only computed
	 * when the candidate is kept.
	 */
	public void update(long value, List<Token> rpn, SolutionType type, Sigma sigma) {
		final var distance = Math.abs(value - target);
		final var closer = isCloser(distance);
		final var fresh = isFreshExact(value);
		if (!closer && !fresh)
			return;
		final var solution = new Solution(value, RPN.toInfix(rpn), rpn, type, sigma, score(rpn));
		keep(solution, distance, closer, fresh);
	}

	/** Record a solution found by a nested search, keeping its own score. */
	public void merge(Solution solution) {
		final var distance = Math.abs(solution.value() - target);
		keep(solution, distance, isCloser(distance), isFreshExact(solution.value()));
	}

	/**
	 * Record that the sum {@code start..end} alone reaches the target. Replaces
	 * any exact solution already held.
	 */
	public void putSigma(long start, long end) {
		solutions.put(target, new Solution(target, "", List.of(), SolutionType.SIGMA, Sigma.ofIndex(start, end),
				SIGMA_SCORE));
	}

	private void keep(Solution solution, long distance, boolean closer, boolean fresh) {
		if (closer)
			closest = new Closest(solution, distance);
		if (fresh)
			solutions.put(solution.value(), solution);
	}

	private boolean isCloser(long distance) {
		return closest == null || distance < closest.distance();
	}

	private boolean isFreshExact(long value) {
		return value == target && !solutions.containsKey(value);
	}

	/** Sum of token weights: 1 per number, the operator's weight otherwise. */
	public static int score(List<Token> rpn) {
		int score = 0;
		for (Token tk : rpn) {
			score += tk.isNumber() ? 1 : tk.operator().weight();
		}
		return score;
	}

	public SearchResult result() {
		List<Solution> exact = new ArrayList<>();
		for (Solution s : solutions.values()) {
			if (s.value() == target)
				exact.add(s);
		}
		exact.sort(Comparator.comparingInt(Solution::score));
		if (exact.size() > maxExactSolutions)
			exact = exact.subList(0, maxExactSolutions);
		return new SearchResult(exact, closest);
	}
}
