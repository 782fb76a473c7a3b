package iq180.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one search: the best exact solutions in ascending score order and
 * the closest candidate, which is null when no candidate ever evaluated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResult(List<Solution> exactSolutions, Closest closest) {
	public SearchResult {
		exactSolutions = List.copyOf(exactSolutions);
	}
}
