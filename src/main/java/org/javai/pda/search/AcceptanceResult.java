package org.javai.pda.search;

/**
 * Outcome of an acceptance query. Sealed so every outcome is handled.
 * <ul>
 *   <li>{@link Accepted} - an accepting configuration was reached</li>
 *   <li>{@link Rejected} - every reachable configuration was explored without accepting</li>
 *   <li>{@link Undetermined} - the search budget ran out before a decision</li>
 * </ul>
 * Each outcome records how many configurations were expanded.
 */
public sealed interface AcceptanceResult {

	long explored();

	default boolean isAccepted() {
		return this instanceof Accepted;
	}

	record Accepted(long explored) implements AcceptanceResult {
	}

	/**
	 * @param explored configurations expanded
	 * @param reason why the input was rejected
	 */
	record Rejected(long explored, String reason) implements AcceptanceResult {
	}

	record Undetermined(long explored) implements AcceptanceResult {
	}
}
