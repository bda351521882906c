package org.javai.pda;

import java.util.List;
import java.util.Objects;
import org.javai.pda.search.AcceptanceResult;

/**
 * Capabilities shared by automata: self-validation and membership queries.
 * <p>
 * Input is a sequence of symbols. The {@code String} overloads treat every code point
 * as one symbol, so {@code "(())"} is the four symbols {@code ( ( ) )}.
 */
public interface Automaton {

	/**
	 * Checks that the automaton is internally consistent.
	 *
	 * @throws AutomatonException describing the first violation found
	 */
	void validate();

	/**
	 * Runs an acceptance query and reports the full outcome.
	 */
	AcceptanceResult evaluate(List<String> input);

	/**
	 * Returns whether the input is accepted. Rejection is a normal outcome, not an error.
	 *
	 * @throws AutomatonException of kind {@link ErrorKind#SEARCH_BUDGET_EXHAUSTED} if no
	 *         decision was reached within the configured budget
	 */
	default boolean accepts(List<String> input) {
		AcceptanceResult result = evaluate(input);
		if (result instanceof AcceptanceResult.Undetermined undetermined) {
			throw new AutomatonException(ErrorKind.SEARCH_BUDGET_EXHAUSTED,
					"no decision after exploring " + undetermined.explored() + " configurations");
		}
		return result.isAccepted();
	}

	default AcceptanceResult evaluate(String input) {
		return evaluate(symbols(input));
	}

	default boolean accepts(String input) {
		return accepts(symbols(input));
	}

	/**
	 * Like {@link #accepts(List)}, but a rejected input raises an error.
	 *
	 * @throws AutomatonException of kind {@link ErrorKind#REJECTION} if the input is rejected
	 */
	default void requireAccepted(List<String> input) {
		if (!accepts(input)) {
			throw new AutomatonException(ErrorKind.REJECTION, "the automaton did not accept the input " + input);
		}
	}

	default void requireAccepted(String input) {
		requireAccepted(symbols(input));
	}

	/**
	 * Splits a string into one symbol per code point.
	 */
	static List<String> symbols(String input) {
		return Objects.requireNonNull(input, "input must not be null")
				.codePoints()
				.mapToObj(Character::toString)
				.toList();
	}
}
