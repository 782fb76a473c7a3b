package iq180;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import iq180.model.SearchResult;
import iq180.model.Solution;
import iq180.print.SolutionPrinter;
import iq180.rpn.InfixParseException;
import iq180.search.ShapeMode;

/**
 * Command line front end.
 *
 * <pre>
 * App [--level B|1|2|3] [--all-shapes] [--json] [--check EXPR] TARGET N1 [N2 ...]
 * </pre>
 */
public class App {
	static final int EXIT_OK = 0;
	static final int EXIT_USAGE = 2;

	private static final String USAGE = "Usage: App [--level B|1|2|3] [--all-shapes] [--json] [--check EXPR] TARGET N1 [N2 ...]";

	private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	static int run(String[] args, PrintStream out, PrintStream err) {
		final Request request;
		try {
			request = parse(args);
		} catch (IllegalArgumentException e) {
			err.println("error: " + e.getMessage());
			err.println(USAGE);
			return EXIT_USAGE;
		}

		try {
			if (request.check != null) {
				printCheck(request, out);
			} else {
				final var options = SolverOptions.defaults().withShapeMode(request.shapeMode);
				final var result = new Solver(options).solve(request.numbers, request.target, request.level);
				out.println(request.json ? toJson(result) : describe(result));
			}
			return EXIT_OK;
		} catch (InfixParseException | IllegalArgumentException e) {
			err.println("error: " + e.getMessage());
			return EXIT_USAGE;
		}
	}

	private static final class Request {
		Level level = Level.BASIC;
		ShapeMode shapeMode = ShapeMode.FIXED;
		boolean json;
		String check;
		long target;
		List<Long> numbers = new ArrayList<>();
	}

	private static Request parse(String[] args) {
		final var request = new Request();
		List<String> positional = new ArrayList<>();
		for (int i = 0; i < args.length; i++) {
			switch (args[i]) {
				case "--level":
					request.level = Level.fromCode(valueAfter(args, i++));
					break;
				case "--all-shapes":
					request.shapeMode = ShapeMode.ALL_TREES;
					break;
				case "--json":
					request.json = true;
					break;
				case "--check":
					request.check = valueAfter(args, i++);
					break;
				default:
					positional.add(args[i]);
			}
		}
		if (positional.size() < 2)
			throw new IllegalArgumentException("expected a target and at least one number");
		request.target = parseLong(positional.get(0));
		for (String s : positional.subList(1, positional.size())) {
			request.numbers.add(parseLong(s));
		}
		return request;
	}

	private static String valueAfter(String[] args, int i) {
		if (i + 1 >= args.length)
			throw new IllegalArgumentException("missing value for " + args[i]);
		return args[i + 1];
	}

	private static long parseLong(String s) {
		try {
			return Long.parseLong(s);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("not an integer: " + s, e);
		}
	}

	private static void printCheck(Request request, PrintStream out) {
		final var value = Solver.check(request.check, request.numbers, request.level);
		if (value.isEmpty()) {
			out.println(request.check + " is not valid at level " + request.level.code());
			return;
		}
		final long distance = Math.abs(value.get() - request.target);
		out.println(SolutionPrinter.format(request.check) + " = " + value.get()
				+ (distance == 0 ? " (correct)" : " (off by " + distance + ")"));
	}

	static String describe(SearchResult result) {
		final var printer = new SolutionPrinter();
		StringBuilder sb = new StringBuilder();
		String nl = System.lineSeparator();
		if (!result.exactSolutions().isEmpty()) {
			int rank = 1;
			for (Solution s : result.exactSolutions()) {
				sb.append(rank++).append(". ").append(printer.print(s))
						.append("  [score ").append(s.score()).append("]").append(nl);
			}
		} else if (result.closest() != null) {
			sb.append("no exact solution; closest: ").append(printer.print(result.closest())).append(nl);
		} else {
			sb.append("no valid expression").append(nl);
		}
		return sb.toString().stripTrailing();
	}

	static String toJson(SearchResult result) {
		try {
			return MAPPER.writeValueAsString(result);
		} catch (JsonProcessingException e) {
			throw new UncheckedIOException(e);
		}
	}
}
