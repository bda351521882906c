package org.javai.pda;

/**
 * The kind of failure carried by an {@link AutomatonException}.
 */
public enum ErrorKind {

	/** A state referenced by the definition is not declared. */
	INVALID_STATE,

	/** An input or stack symbol referenced by the definition is not declared. */
	INVALID_SYMBOL,

	/** A required state (such as the initial state) is absent. */
	MISSING_STATE,

	/** A required symbol (such as the initial stack symbol) is absent. */
	MISSING_SYMBOL,

	/** The initial state fails a required condition. */
	INITIAL_STATE,

	/** An accepting state fails a required condition. */
	FINAL_STATE,

	/** More than one move may apply to a configuration of a strict automaton. */
	NONDETERMINISM,

	/** The top of an empty stack was requested. */
	EMPTY_STACK,

	/** The input was rejected by a validated automaton. */
	REJECTION,

	/** The search stopped before reaching a decision. */
	SEARCH_BUDGET_EXHAUSTED
}
