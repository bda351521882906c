package org.javai.pda;

import java.util.List;
import java.util.Objects;
import org.javai.pda.definition.PdaDefinition;
import org.javai.pda.search.AcceptanceResult;
import org.javai.pda.search.ConfigurationSearch;
import org.javai.pda.search.SearchOptions;
import org.javai.pda.validation.PdaValidator;
import org.javai.pda.validation.ValidationMode;

/**
 * A validated pushdown automaton.
 * <p>
 * Instances only exist for definitions that passed validation: every factory method
 * validates before returning, and a failure leaves nothing behind. A strict automaton is
 * additionally guaranteed to be deterministic. Acceptance is decided by
 * {@link ConfigurationSearch}.
 * <p>
 * Instances are immutable and safe to query from several threads.
 *
 * <pre>
 * PushdownAutomaton pda = PushdownAutomaton.create(definition, ValidationMode.LENIENT);
 * boolean accepted = pda.accepts("aabb");
 * </pre>
 */
public final class PushdownAutomaton implements Automaton {

	private final PdaDefinition definition;
	private final ValidationMode mode;
	private final SearchOptions options;
	private final ConfigurationSearch search;

	private PushdownAutomaton(PdaDefinition definition, ValidationMode mode, SearchOptions options) {
		this.definition = definition;
		this.mode = mode;
		this.options = options;
		validate();
		this.search = new ConfigurationSearch(definition, options);
	}

	/**
	 * Builds an automaton with default search options.
	 *
	 * @throws AutomatonException if the definition is invalid for the given mode
	 */
	public static PushdownAutomaton create(PdaDefinition definition, ValidationMode mode) {
		return create(definition, mode, SearchOptions.defaults());
	}

	/**
	 * Builds an automaton.
	 *
	 * @throws AutomatonException if the definition is invalid for the given mode
	 */
	public static PushdownAutomaton create(PdaDefinition definition, ValidationMode mode, SearchOptions options) {
		Objects.requireNonNull(definition, "definition must not be null");
		Objects.requireNonNull(mode, "mode must not be null");
		Objects.requireNonNull(options, "options must not be null");
		return new PushdownAutomaton(definition.deepCopy(), mode, options);
	}

	/**
	 * Builds an independent copy of another automaton. The copy is validated again
	 * rather than trusted.
	 */
	public static PushdownAutomaton copyOf(PushdownAutomaton other) {
		Objects.requireNonNull(other, "other must not be null");
		return create(other.definition, other.mode, other.options);
	}

	/**
	 * Returns an automaton over the same definition that queries with different options.
	 */
	public PushdownAutomaton withOptions(SearchOptions options) {
		return create(definition, mode, options);
	}

	@Override
	public void validate() {
		new PdaValidator(mode).validate(definition);
	}

	@Override
	public AcceptanceResult evaluate(List<String> input) {
		return search.search(input);
	}

	public PdaDefinition definition() {
		return definition;
	}

	public ValidationMode mode() {
		return mode;
	}

	public SearchOptions options() {
		return options;
	}

	public boolean isDeterministic() {
		return mode.isStrict();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PushdownAutomaton other)) {
			return false;
		}
		return definition.equals(other.definition) && mode == other.mode;
	}

	@Override
	public int hashCode() {
		return Objects.hash(definition, mode);
	}

	@Override
	public String toString() {
		return "PushdownAutomaton[mode=" + mode + ", states=" + definition.states()
				+ ", initialState=" + definition.initialState() + ", finalStates=" + definition.finalStates() + "]";
	}
}
