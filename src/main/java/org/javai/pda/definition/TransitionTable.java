package org.javai.pda.definition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The transition relation of a pushdown automaton.
 * <p>
 * Moves are grouped by source state and input symbol. Each group holds a list of
 * alternatives; an alternative maps a stack-top symbol to the {@link StackRule} applied
 * when that symbol is on top. Several alternatives keyed on the same stack symbol model
 * a nondeterministic choice. The {@link #EPSILON} input marks moves that consume no input.
 * <p>
 * Instances are immutable.
 */
public final class TransitionTable {

	/**
	 * The empty input symbol.
	 */
	public static final String EPSILON = "";

	private static final TransitionTable EMPTY = new TransitionTable(Map.of());

	private final Map<String, Map<String, List<Map<String, StackRule>>>> moves;

	private TransitionTable(Map<String, Map<String, List<Map<String, StackRule>>>> moves) {
		this.moves = moves;
	}

	public static TransitionTable empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Creates a table from its nested-map form, deep-copying every level.
	 */
	public static TransitionTable of(Map<String, Map<String, List<Map<String, StackRule>>>> moves) {
		Objects.requireNonNull(moves, "moves must not be null");
		Builder builder = builder();
		moves.forEach((state, byInput) -> {
			Objects.requireNonNull(byInput, () -> "moves for state " + state + " must not be null");
			byInput.forEach((input, alternatives) -> {
				Objects.requireNonNull(alternatives,
						() -> "alternatives for state " + state + " on '" + input + "' must not be null");
				alternatives.forEach(alternative -> builder.alternative(state, input, alternative));
			});
		});
		return builder.build();
	}

	/**
	 * The source states that have at least one move.
	 */
	public Set<String> sourceStates() {
		return moves.keySet();
	}

	/**
	 * Moves leaving the given state, keyed by input symbol. Empty when the state has none.
	 */
	public Map<String, List<Map<String, StackRule>>> movesFrom(String state) {
		return moves.getOrDefault(state, Map.of());
	}

	/**
	 * Alternatives for the given state and input symbol. Empty when there are none.
	 */
	public List<Map<String, StackRule>> alternatives(String state, String input) {
		return movesFrom(state).getOrDefault(input, List.of());
	}

	/**
	 * Every rule applicable with the given state, input symbol and stack top, in
	 * declaration order.
	 */
	public List<StackRule> rulesFor(String state, String input, String stackTop) {
		List<Map<String, StackRule>> alternatives = alternatives(state, input);
		if (alternatives.isEmpty()) {
			return List.of();
		}
		List<StackRule> rules = new ArrayList<>(alternatives.size());
		for (Map<String, StackRule> alternative : alternatives) {
			StackRule rule = alternative.get(stackTop);
			if (rule != null) {
				rules.add(rule);
			}
		}
		return rules;
	}

	/**
	 * Nested-map view of the whole relation.
	 */
	public Map<String, Map<String, List<Map<String, StackRule>>>> asMap() {
		return moves;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof TransitionTable other)) {
			return false;
		}
		return moves.equals(other.moves);
	}

	@Override
	public int hashCode() {
		return moves.hashCode();
	}

	@Override
	public String toString() {
		return "TransitionTable" + moves;
	}

	/**
	 * Fluent builder. Declaration order of states, inputs and alternatives is kept.
	 */
	public static final class Builder {

		private final Map<String, Map<String, List<Map<String, StackRule>>>> moves = new LinkedHashMap<>();

		private Builder() {
		}

		/**
		 * Adds an alternative with a single stack-top entry.
		 */
		public Builder rule(String state, String input, String stackTop, String nextState, String... push) {
			return alternative(state, input, Map.of(stackTop, StackRule.of(nextState, push)));
		}

		/**
		 * Adds a single-entry epsilon alternative.
		 */
		public Builder epsilon(String state, String stackTop, String nextState, String... push) {
			return rule(state, EPSILON, stackTop, nextState, push);
		}

		/**
		 * Adds an alternative mapping several stack-top symbols to their rules.
		 */
		public Builder alternative(String state, String input, Map<String, StackRule> alternative) {
			Objects.requireNonNull(state, "state must not be null");
			Objects.requireNonNull(input, "input must not be null; use EPSILON for empty moves");
			Objects.requireNonNull(alternative, "alternative must not be null");
			Map<String, StackRule> copy = new LinkedHashMap<>();
			alternative.forEach((stackTop, rule) -> copy.put(
					Objects.requireNonNull(stackTop, "stack symbol must not be null"),
					Objects.requireNonNull(rule, () -> "rule for stack symbol " + stackTop + " must not be null")));
			moves.computeIfAbsent(state, s -> new LinkedHashMap<>())
					.computeIfAbsent(input, i -> new ArrayList<>())
					.add(Collections.unmodifiableMap(copy));
			return this;
		}

		/**
		 * Declares a source state that has no moves yet.
		 */
		public Builder state(String state) {
			moves.computeIfAbsent(Objects.requireNonNull(state, "state must not be null"), s -> new LinkedHashMap<>());
			return this;
		}

		public TransitionTable build() {
			Map<String, Map<String, List<Map<String, StackRule>>>> frozen = new LinkedHashMap<>();
			moves.forEach((state, byInput) -> {
				Map<String, List<Map<String, StackRule>>> inputs = new LinkedHashMap<>();
				byInput.forEach((input, alternatives) -> inputs.put(input, List.copyOf(alternatives)));
				frozen.put(state, Collections.unmodifiableMap(inputs));
			});
			return new TransitionTable(Collections.unmodifiableMap(frozen));
		}
	}
}
