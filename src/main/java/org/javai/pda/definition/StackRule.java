package org.javai.pda.definition;

import java.util.List;
import java.util.Objects;

/**
 * The effect of a move: the state to enter and the symbols that replace the stack top.
 *
 * @param nextState the destination state
 * @param push symbols pushed in place of the top, bottom to top; empty to pop
 */
public record StackRule(String nextState, List<String> push) {

	public StackRule {
		Objects.requireNonNull(nextState, "nextState must not be null");
		push = push != null ? List.copyOf(push) : List.of();
	}

	public static StackRule of(String nextState, String... push) {
		return new StackRule(nextState, List.of(push));
	}

	/**
	 * A rule that pops the top symbol and pushes nothing.
	 */
	public static StackRule pop(String nextState) {
		return new StackRule(nextState, List.of());
	}
}
