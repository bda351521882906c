package org.javai.pda.search;

import java.util.Objects;

/**
 * A snapshot of a running automaton. Configurations are values: two with equal
 * components are the same configuration. The stack must not be modified once the
 * configuration has been created.
 *
 * @param state the current state
 * @param stack the current stack contents
 * @param cursor the index of the next input symbol to read
 */
public record Configuration(String state, PdaStack stack, int cursor) {

	public Configuration {
		Objects.requireNonNull(state, "state must not be null");
		Objects.requireNonNull(stack, "stack must not be null");
		if (cursor < 0) {
			throw new IllegalArgumentException("cursor must not be negative: " + cursor);
		}
	}
}
