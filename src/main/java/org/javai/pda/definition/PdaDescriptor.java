package org.javai.pda.definition;

import java.util.Objects;
import org.javai.pda.PushdownAutomaton;
import org.javai.pda.search.SearchOptions;
import org.javai.pda.validation.ValidationMode;

/**
 * A named definition as loaded from a document, together with the mode it is meant
 * to be validated in.
 *
 * @param id identifier used for registry lookups
 * @param description free-form description; may be null
 * @param mode validation mode
 * @param definition the automaton definition
 */
public record PdaDescriptor(String id, String description, ValidationMode mode, PdaDefinition definition) {

	public PdaDescriptor {
		Objects.requireNonNull(definition, "definition must not be null");
		mode = mode != null ? mode : ValidationMode.LENIENT;
	}

	/**
	 * Validates the definition and builds the automaton it describes.
	 */
	public PushdownAutomaton toAutomaton() {
		return PushdownAutomaton.create(definition, mode);
	}

	public PushdownAutomaton toAutomaton(SearchOptions options) {
		return PushdownAutomaton.create(definition, mode, options);
	}
}
