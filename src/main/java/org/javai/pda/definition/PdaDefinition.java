package org.javai.pda.definition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The formal definition of a pushdown automaton.
 * <p>
 * Every collection handed to the constructor is copied, so a definition never shares
 * mutable structure with its caller. A definition is not validated on its own; it becomes
 * usable once {@link org.javai.pda.PushdownAutomaton} has accepted it.
 *
 * @param states declared states
 * @param inputSymbols the input alphabet; never contains {@link TransitionTable#EPSILON}
 * @param stackSymbols the stack alphabet
 * @param transitions the transition relation
 * @param initialState the state every query starts in
 * @param initialStackSymbol the only symbol on the stack when a query starts
 * @param finalStates the accepting states
 */
public record PdaDefinition(
		Set<String> states,
		Set<String> inputSymbols,
		Set<String> stackSymbols,
		TransitionTable transitions,
		String initialState,
		String initialStackSymbol,
		Set<String> finalStates
) {

	public PdaDefinition {
		states = copyOf(states);
		inputSymbols = copyOf(inputSymbols);
		stackSymbols = copyOf(stackSymbols);
		transitions = transitions != null ? transitions : TransitionTable.empty();
		finalStates = copyOf(finalStates);
	}

	private static Set<String> copyOf(Collection<String> source) {
		return Collections.unmodifiableSet(source != null ? new LinkedHashSet<>(source) : new LinkedHashSet<>());
	}

	/**
	 * Returns an independent copy of this definition. The nested transition relation is
	 * rebuilt rather than shared.
	 */
	public PdaDefinition deepCopy() {
		return new PdaDefinition(states, inputSymbols, stackSymbols, TransitionTable.of(transitions.asMap()),
				initialState, initialStackSymbol, finalStates);
	}

	public boolean isFinal(String state) {
		return finalStates.contains(state);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for definitions written in code.
	 * <pre>
	 * PdaDefinition definition = PdaDefinition.builder()
	 *     .states("q0", "q1")
	 *     .inputSymbols("a", "b")
	 *     .stackSymbols("Z", "A")
	 *     .transitions(table)
	 *     .initialState("q0")
	 *     .initialStackSymbol("Z")
	 *     .finalStates("q1")
	 *     .build();
	 * </pre>
	 */
	public static final class Builder {

		private Set<String> states = new LinkedHashSet<>();
		private Set<String> inputSymbols = new LinkedHashSet<>();
		private Set<String> stackSymbols = new LinkedHashSet<>();
		private TransitionTable transitions = TransitionTable.empty();
		private String initialState;
		private String initialStackSymbol;
		private Set<String> finalStates = new LinkedHashSet<>();

		private Builder() {
		}

		public Builder states(String... states) {
			return states(List.of(states));
		}

		public Builder states(Collection<String> states) {
			this.states = new LinkedHashSet<>(states);
			return this;
		}

		public Builder inputSymbols(String... inputSymbols) {
			return inputSymbols(List.of(inputSymbols));
		}

		public Builder inputSymbols(Collection<String> inputSymbols) {
			this.inputSymbols = new LinkedHashSet<>(inputSymbols);
			return this;
		}

		public Builder stackSymbols(String... stackSymbols) {
			return stackSymbols(List.of(stackSymbols));
		}

		public Builder stackSymbols(Collection<String> stackSymbols) {
			this.stackSymbols = new LinkedHashSet<>(stackSymbols);
			return this;
		}

		public Builder transitions(TransitionTable transitions) {
			this.transitions = Objects.requireNonNull(transitions, "transitions must not be null");
			return this;
		}

		public Builder initialState(String initialState) {
			this.initialState = initialState;
			return this;
		}

		public Builder initialStackSymbol(String initialStackSymbol) {
			this.initialStackSymbol = initialStackSymbol;
			return this;
		}

		public Builder finalStates(String... finalStates) {
			return finalStates(List.of(finalStates));
		}

		public Builder finalStates(Collection<String> finalStates) {
			this.finalStates = new LinkedHashSet<>(finalStates);
			return this;
		}

		public PdaDefinition build() {
			return new PdaDefinition(states, inputSymbols, stackSymbols, transitions, initialState,
					initialStackSymbol, finalStates);
		}
	}
}
