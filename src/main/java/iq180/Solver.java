package iq180;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import iq180.model.SearchResult;
import iq180.model.Sigma;
import iq180.model.Solution;
import iq180.model.SolutionType;
import iq180.rpn.RPN;
import iq180.rpn.Token;
import iq180.rpn.Tokenizer;
import iq180.search.Permutations;
import iq180.search.ShapeEnumerator;
import iq180.search.SolutionTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Searches for expressions over a set of numbers that reach a target.
 *
 * <p>
 * Every distinct permutation is combined with every operator assignment of the
 * level and every shape; valid candidates feed a {@link SolutionTracker}. From
 * level 2 single numbers are additionally pre-reduced by sqrt or factorial and
 * the search is repeated on the reduced set. At level 3 two numbers may be
 * replaced by the sum of the integers between them.
 */
public final class Solver {
	private static final Logger LOG = LoggerFactory.getLogger(Solver.class);

	/** Inputs above this size make the search run for a very long time. */
	private static final int PRACTICAL_SIZE = 5;

	private final SolverOptions options;

	public Solver(SolverOptions options) {
		if (options == null)
			throw new IllegalArgumentException("options cannot be null");
		this.options = options;
	}

	public static SearchResult findSolutions(List<Long> numbers, long target, Level level) {
		return new Solver(SolverOptions.defaults()).solve(numbers, target, level);
	}

	public SearchResult solve(List<Long> numbers, long target, Level level) {
		validate(numbers, level);
		if (numbers.size() > PRACTICAL_SIZE)
			LOG.warn("searching {} numbers at level {}; this may take very long", numbers.size(), level.code());

		final var search = new Search(target);
		final var result = search.run(List.copyOf(numbers), level);
		LOG.debug("level {} target {} numbers {}: {} candidates, {} sub-searches, {} exact",
				level.code(), target, numbers, search.evaluated, search.memo.size(), result.exactSolutions().size());
		return result;
	}

	/**
	 * Evaluate a player's infix answer under the puzzle rules.
	 *
	 * @return the value, or empty when some step breaks an evaluation rule
	 * @throws IllegalArgumentException when the answer uses an operator the
	 *                                  level does not offer, or does not use
	 *                                  each number exactly once
	 * @throws iq180.rpn.InfixParseException when the answer cannot be parsed
	 */
	public static Optional<Long> check(String expression, List<Long> numbers, Level level) {
		final var rpn = RPN.shuntingYard(Tokenizer.tokenize(expression));
		List<Long> used = new ArrayList<>();
		for (Token tk : rpn) {
			if (tk.isNumber()) {
				used.add(tk.number());
			} else if (!level.allows(tk.operator())) {
				throw new IllegalArgumentException(
						"operator " + tk.operator().symbol() + " is not available at level " + level.code());
			}
		}
		if (!sorted(used).equals(sorted(numbers)))
			throw new IllegalArgumentException("expression must use each of " + numbers + " exactly once, found " + used);
		return Optional.ofNullable(RPN.evaluate(rpn));
	}

	private static void validate(List<Long> numbers, Level level) {
		if (level == null)
			throw new IllegalArgumentException("level cannot be null");
		if (numbers == null || numbers.isEmpty())
			throw new IllegalArgumentException("numbers cannot be empty");
		for (Long n : numbers) {
			if (n == null || n < 0)
				throw new IllegalArgumentException("numbers must be non-negative: " + numbers);
		}
	}

	private static List<Long> sorted(List<Long> numbers) {
		List<Long> copy = new ArrayList<>(numbers);
		Collections.sort(copy);
		return copy;
	}

	private record SubSearchKey(List<Long> numbers, Level level) {
	}

	/** State of one top-level call; nested searches share its memo. */
	private final class Search {
		private final long target;
		private final ShapeEnumerator shapes = new ShapeEnumerator(options.shapeMode());
		private final Map<SubSearchKey, List<Solution>> memo = new HashMap<>();
		private long evaluated;

		Search(long target) {
			this.target = target;
		}

		SearchResult run(List<Long> numbers, Level level) {
			final var tracker = new SolutionTracker(target, options.maxExactSolutions());
			final var permutations = Permutations.of(numbers);
			final var combos = ShapeEnumerator.operatorCombinations(level.operators(), numbers.size() - 1);
			for (List<Long> p : permutations) {
				for (List<Operator> combo : combos) {
					for (List<Token> rpn : shapes.candidates(p, combo)) {
						evaluated++;
						final var value = RPN.evaluate(rpn);
						if (value != null)
							tracker.update(value, rpn, SolutionType.NORMAL, null);
					}
				}
				if (level.allowsUnary())
					decorate(p, level, tracker);
			}
			if (level.allowsSummation())
				summation(permutations, level, tracker);
			return tracker.result();
		}

		// The nested search sees the reduced value as a plain number, so its
		// expressions show e.g. 3 where sqrt(9) was applied. A factorial applies
		// to what a successful sqrt left at the position, so 9 yields 3 and 3!.
		private void decorate(List<Long> p, Level level, SolutionTracker tracker) {
			for (int i = 0; i < p.size(); i++) {
				long current = p.get(i);
				if (level.allows(Operator.SQRT)) {
					final var root = RPN.exactSqrt(current);
					if (root != null) {
						substitute(p, i, current, root, level, tracker);
						current = root;
					}
				}
				if (level.allows(Operator.FACTORIAL)) {
					final var factorial = Factorial.of(current);
					if (factorial != Factorial.UNBOUNDED)
						substitute(p, i, current, factorial, level, tracker);
				}
			}
		}

		private void substitute(List<Long> p, int index, long current, long replacement, Level level,
				SolutionTracker tracker) {
			if (replacement == current)
				return; // fixed point: the nested search would repeat the one for current
			List<Long> reduced = new ArrayList<>(p);
			reduced.set(index, replacement);
			for (Solution s : subSearch(reduced, level)) {
				tracker.merge(s);
			}
		}

		private void summation(List<List<Long>> permutations, Level level, SolutionTracker tracker) {
			final var subLevel = level.cappedAt(Level.TWO);
			for (List<Long> p : permutations) {
				for (int i = 0; i < p.size(); i++) {
					for (int j = 0; j < p.size(); j++) {
						if (i == j)
							continue;
						final long start = p.get(i);
						final long end = p.get(j);
						if (start >= end || end - start > options.sigmaMaxSpan())
							continue;

						final var sum = Sigma.sum(start, end);
						if (sum == null) {
							LOG.trace("sum {}..{} exceeds the long range", start, end);
							continue;
						}
						List<Long> rest = new ArrayList<>();
						for (int k = 0; k < p.size(); k++) {
							if (k != i && k != j)
								rest.add(p.get(k));
						}
						rest.add(sum);

						final var sigma = Sigma.ofIndex(start, end);
						for (Solution s : subSearch(rest, subLevel)) {
							tracker.merge(new Solution(s.value(), s.expression(), s.rpn(), SolutionType.SIGMA, sigma,
									SolutionTracker.SIGMA_SCORE + s.score()));
						}
						if (sum == target)
							tracker.putSigma(start, end);
					}
				}
			}
		}

		/**
		 * Exact solutions for {@code numbers}, computed once per multiset and
		 * level. A key already being searched yields nothing.
		 */
		private List<Solution> subSearch(List<Long> numbers, Level level) {
			final var key = new SubSearchKey(List.copyOf(sorted(numbers)), level);
			final var cached = memo.get(key);
			if (cached != null) {
				LOG.trace("reusing sub-search {} at level {}", key.numbers(), level.code());
				return cached;
			}
			memo.put(key, List.of());
			final var exact = run(numbers, level).exactSolutions();
			memo.put(key, exact);
			return exact;
		}
	}
}
