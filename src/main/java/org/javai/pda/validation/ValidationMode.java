package org.javai.pda.validation;

/**
 * How strictly a definition is checked before an automaton is built.
 */
public enum ValidationMode {

	/**
	 * Structural checks only. Nondeterministic choices are allowed.
	 */
	LENIENT,

	/**
	 * Structural checks plus determinism: at most one move may apply to any configuration.
	 */
	STRICT;

	public boolean isStrict() {
		return this == STRICT;
	}
}
