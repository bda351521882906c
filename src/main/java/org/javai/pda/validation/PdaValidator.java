package org.javai.pda.validation;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.pda.AutomatonException;
import org.javai.pda.ErrorKind;
import org.javai.pda.definition.PdaDefinition;
import org.javai.pda.definition.StackRule;
import org.javai.pda.definition.TransitionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a {@link PdaDefinition} for internal consistency.
 * <p>
 * Every state and symbol the transition relation mentions must be declared, as must the
 * initial state, the initial stack symbol and the accepting states. In
 * {@link ValidationMode#STRICT} mode the relation must also be deterministic: from a given
 * state a stack symbol may not be keyed by both an epsilon move and a consuming move, and
 * no stack symbol may appear in two alternatives for the same state and input.
 * <p>
 * The first violation found is raised as an {@link AutomatonException}. Instances hold
 * nothing but their mode and may be shared.
 */
public class PdaValidator {

	private static final Logger logger = LoggerFactory.getLogger(PdaValidator.class);

	private final ValidationMode mode;

	public PdaValidator(ValidationMode mode) {
		this.mode = Objects.requireNonNull(mode, "mode must not be null");
	}

	/**
	 * Validates the definition.
	 *
	 * @throws AutomatonException describing the first violation found
	 */
	public void validate(PdaDefinition definition) {
		Objects.requireNonNull(definition, "definition must not be null");
		if (definition.inputSymbols().contains(TransitionTable.EPSILON)) {
			throw fail(ErrorKind.INVALID_SYMBOL, "the empty symbol cannot be part of the input alphabet");
		}
		TransitionTable transitions = definition.transitions();
		for (String startState : transitions.sourceStates()) {
			validateMoves(definition, startState, transitions.movesFrom(startState));
			if (mode.isStrict()) {
				validateDeterminism(startState, transitions.movesFrom(startState));
			}
		}
		validateInitialState(definition);
		validateInitialStackSymbol(definition);
		validateFinalStates(definition);
		logger.debug("Validated {} definition with {} states and {} source states",
				mode, definition.states().size(), transitions.sourceStates().size());
	}

	private void validateMoves(PdaDefinition definition, String startState,
			Map<String, List<Map<String, StackRule>>> moves) {
		requireState(definition, startState);
		for (Map.Entry<String, List<Map<String, StackRule>>> entry : moves.entrySet()) {
			String input = entry.getKey();
			if (!TransitionTable.EPSILON.equals(input) && !definition.inputSymbols().contains(input)) {
				throw fail(ErrorKind.INVALID_SYMBOL,
						"state " + startState + " has invalid transition input symbol " + input);
			}
			for (Map<String, StackRule> alternative : entry.getValue()) {
				for (Map.Entry<String, StackRule> ruleEntry : alternative.entrySet()) {
					requireStackSymbol(definition, startState, ruleEntry.getKey());
					StackRule rule = ruleEntry.getValue();
					requireState(definition, rule.nextState());
					for (String pushed : rule.push()) {
						requireStackSymbol(definition, startState, pushed);
					}
				}
			}
		}
	}

	private void validateDeterminism(String startState, Map<String, List<Map<String, StackRule>>> moves) {
		Set<String> epsilonKeys = new HashSet<>();
		for (Map.Entry<String, List<Map<String, StackRule>>> entry : moves.entrySet()) {
			Set<String> seen = new HashSet<>();
			for (Map<String, StackRule> alternative : entry.getValue()) {
				for (String stackSymbol : alternative.keySet()) {
					if (!seen.add(stackSymbol)) {
						throw fail(ErrorKind.NONDETERMINISM, "state " + startState + " has more than one move on input '"
								+ entry.getKey() + "' with stack symbol " + stackSymbol);
					}
				}
			}
			if (TransitionTable.EPSILON.equals(entry.getKey())) {
				epsilonKeys.addAll(seen);
			}
		}
		if (epsilonKeys.isEmpty()) {
			return;
		}
		for (Map.Entry<String, List<Map<String, StackRule>>> entry : moves.entrySet()) {
			if (TransitionTable.EPSILON.equals(entry.getKey())) {
				continue;
			}
			for (Map<String, StackRule> alternative : entry.getValue()) {
				for (String stackSymbol : alternative.keySet()) {
					if (epsilonKeys.contains(stackSymbol)) {
						throw fail(ErrorKind.NONDETERMINISM, "state " + startState + " has an epsilon move and a move on '"
								+ entry.getKey() + "' for stack symbol " + stackSymbol);
					}
				}
			}
		}
	}

	private void validateInitialState(PdaDefinition definition) {
		String initialState = definition.initialState();
		if (initialState == null) {
			throw fail(ErrorKind.MISSING_STATE, "initial state is not set");
		}
		if (!definition.states().contains(initialState)) {
			throw fail(ErrorKind.INITIAL_STATE, "initial state " + initialState + " is not a declared state");
		}
	}

	private void validateInitialStackSymbol(PdaDefinition definition) {
		String initialStackSymbol = definition.initialStackSymbol();
		if (initialStackSymbol == null) {
			throw fail(ErrorKind.MISSING_SYMBOL, "initial stack symbol is not set");
		}
		if (!definition.stackSymbols().contains(initialStackSymbol)) {
			throw fail(ErrorKind.INVALID_SYMBOL, "initial stack symbol " + initialStackSymbol + " is invalid");
		}
	}

	private void validateFinalStates(PdaDefinition definition) {
		for (String finalState : definition.finalStates()) {
			if (!definition.states().contains(finalState)) {
				throw fail(ErrorKind.FINAL_STATE, "final state " + finalState + " is not a declared state");
			}
		}
	}

	private void requireState(PdaDefinition definition, String state) {
		if (!definition.states().contains(state)) {
			throw fail(ErrorKind.INVALID_STATE, "state " + state + " does not exist");
		}
	}

	private void requireStackSymbol(PdaDefinition definition, String startState, String stackSymbol) {
		if (!definition.stackSymbols().contains(stackSymbol)) {
			throw fail(ErrorKind.INVALID_SYMBOL,
					"state " + startState + " has invalid transition stack symbol " + stackSymbol);
		}
	}

	private AutomatonException fail(ErrorKind kind, String message) {
		logger.debug("Definition rejected ({}): {}", kind, message);
		return new AutomatonException(kind, message);
	}
}
