package iq180.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import iq180.rpn.Token;

/**
 * One candidate expression and its value. For {@link SolutionType#SIGMA}
 * solutions {@code expression} and {@code rpn} hold the part combined with the
 * sum; both are empty when the sum alone reaches the value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Solution(long value, String expression, List<Token> rpn, SolutionType type, Sigma sigma, int score) {
	public Solution {
		rpn = List.copyOf(rpn);
	}
}
