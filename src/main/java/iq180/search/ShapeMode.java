package iq180.search;

/** Which bracketings of a permutation are tried. */
public enum ShapeMode {
	/**
	 * Left fold for any length, plus {@code (a?b)?(c?d)} for four numbers and
	 * {@code ((a?b)?(c?d))?e} for five.
	 */
	FIXED,
	/** Every full binary tree over the numbers. */
	ALL_TREES
}
