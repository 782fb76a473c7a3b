package iq180.search;

import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class PermutationsTest {
	@Test
	void repeatedValuesCollapse() {
		final var perms = Permutations.of(List.of(2L, 2L, 3L));
		assertEquals(3, perms.size());
		assertEquals(3, new HashSet<>(perms).size());
	}

	@Test
	void distinctValuesGiveFactorialCount() {
		assertEquals(24, Permutations.of(List.of(1L, 2L, 3L, 4L)).size());
		assertEquals(12, Permutations.of(List.of(1L, 5L, 9L, 9L)).size());
		assertEquals(1, Permutations.of(List.of(7L, 7L, 7L)).size());
	}

	@Test
	void inputOrderComesFirst() {
		assertEquals(List.of(4L, 1L, 3L), Permutations.of(List.of(4L, 1L, 3L)).get(0));
		assertEquals(List.of(List.of(5L)), Permutations.of(List.of(5L)));
	}
}
