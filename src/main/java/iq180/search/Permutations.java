package iq180.search;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Generates the distinct orderings of a number sequence. Orderings that only
 * differ by swapping equal values are produced once.
 */
public final class Permutations {

	private Permutations() {
	}

	/**
	 * All distinct permutations, in generation order. The first element is the
	 * input order itself.
	 */
	public static List<List<Long>> of(List<Long> numbers) {
		return new ArrayList<>(new LinkedHashSet<>(insertEverywhere(numbers)));
	}

	private static List<List<Long>> insertEverywhere(List<Long> numbers) {
		List<List<Long>> all = new ArrayList<>();
		if (numbers.isEmpty()) {
			all.add(List.of());
			return all;
		}
		final var first = numbers.get(0);
		for (List<Long> perm : insertEverywhere(numbers.subList(1, numbers.size()))) {
			for (int i = 0; i <= perm.size(); i++) {
				List<Long> withFirst = new ArrayList<>(perm);
				withFirst.add(i, first);
				all.add(List.copyOf(withFirst));
			}
		}
		return all;
	}
}
