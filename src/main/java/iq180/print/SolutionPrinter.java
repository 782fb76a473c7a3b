package iq180.print;

import iq180.model.Closest;
import iq180.model.Sigma;
import iq180.model.Solution;
import iq180.model.SolutionType;

/**
 * Renders solutions for people: spaced operators, {@code ×}, {@code ÷} and
 * {@code √} glyphs, and a {@code Σ} prefix for summation solutions.
 */
public final class SolutionPrinter {

	public String print(Solution solution) {
		StringBuilder out = new StringBuilder();
		if (solution.type() == SolutionType.SIGMA && solution.sigma() != null) {
			out.append(printSigma(solution.sigma()));
			if (!solution.expression().isEmpty()) {
				out.append(" → ").append(format(solution.expression()));
			}
		} else {
			out.append(format(solution.expression()));
		}
		return out.append(" = ").append(solution.value()).toString();
	}

	public String print(Closest closest) {
		return print(closest.solution()) + " (off by " + closest.distance() + ")";
	}

	public String printSigma(Sigma sigma) {
		return "Σ(i=" + sigma.start() + ".." + sigma.end() + ") (" + format(sigma.body()) + ")";
	}

	/** Cosmetic substitution only; the expression text is not re-parsed. */
	public static String format(String expression) {
		if (expression == null)
			return "";
		return expression
				.replace("*", " × ")
				.replace("/", " ÷ ")
				.replace("+", " + ")
				.replace("-", " - ")
				.replace("sqrt", "√");
	}
}
