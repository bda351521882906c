package org.javai.pda.search;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
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
 * Decides acceptance by breadth-first exploration of the configuration space.
 * <p>
 * The search starts from the initial state with only the initial stack symbol on the
 * stack and the cursor at the start of the input. A configuration is accepting when the
 * whole input has been read and its state is a final state. A configuration whose stack
 * is empty has no moves and is abandoned.
 * <p>
 * Every configuration is recorded when it is enqueued and never enqueued twice, which
 * keeps epsilon cycles from looping. All applicable alternatives are explored, epsilon
 * moves included, until acceptance or exhaustion. Epsilon moves that grow the stack
 * without bound can still produce infinitely many configurations; bound such searches
 * with {@link SearchOptions#maxConfigurations()}.
 * <p>
 * The definition is only read, so one instance may serve concurrent queries. Every query
 * owns its frontier, visited set and stacks.
 */
public class ConfigurationSearch {

	private static final Logger logger = LoggerFactory.getLogger(ConfigurationSearch.class);

	private final PdaDefinition definition;
	private final SearchOptions options;

	public ConfigurationSearch(PdaDefinition definition, SearchOptions options) {
		this.definition = Objects.requireNonNull(definition, "definition must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	/**
	 * Runs an acceptance query over the given input symbols.
	 *
	 * @throws AutomatonException of kind {@link ErrorKind#INVALID_SYMBOL} when the input holds an
	 *         unknown symbol and the policy is {@link UnknownSymbolPolicy#FAIL}
	 */
	public AcceptanceResult search(List<String> input) {
		Objects.requireNonNull(input, "input must not be null");
		int unknownAt = indexOfUnknownSymbol(input);
		if (unknownAt >= 0) {
			String unknown = input.get(unknownAt);
			if (options.unknownSymbolPolicy() == UnknownSymbolPolicy.FAIL) {
				throw new AutomatonException(ErrorKind.INVALID_SYMBOL,
						"input symbol " + unknown + " is not in the input alphabet");
			}
			logger.debug("Rejecting input with unknown symbol '{}'", unknown);
			return new AcceptanceResult.Rejected(0, "unknown input symbol " + unknown);
		}

		Configuration initial = new Configuration(definition.initialState(),
				PdaStack.of(definition.initialStackSymbol()), 0);
		Deque<Configuration> frontier = new ArrayDeque<>();
		Set<Configuration> visited = new HashSet<>();
		frontier.add(initial);
		visited.add(initial);

		long explored = 0;
		while (!frontier.isEmpty()) {
			if (options.isBounded() && explored >= options.maxConfigurations()) {
				logger.warn("Search stopped after {} configurations with {} still pending",
						explored, frontier.size());
				return new AcceptanceResult.Undetermined(explored);
			}
			Configuration current = frontier.poll();
			explored++;

			if (current.cursor() == input.size() && definition.isFinal(current.state())) {
				logger.debug("Accepted input of length {} after {} configurations", input.size(), explored);
				return new AcceptanceResult.Accepted(explored);
			}
			if (current.stack().isEmpty()) {
				continue;
			}
			String stackTop = current.stack().top();

			expand(current, TransitionTable.EPSILON, stackTop, current.cursor(), frontier, visited);
			if (current.cursor() < input.size()) {
				expand(current, input.get(current.cursor()), stackTop, current.cursor() + 1, frontier, visited);
			}
		}
		logger.debug("Rejected input of length {} after {} configurations", input.size(), explored);
		return new AcceptanceResult.Rejected(explored, "no accepting configuration is reachable");
	}

	private void expand(Configuration current, String input, String stackTop, int nextCursor,
			Deque<Configuration> frontier, Set<Configuration> visited) {
		for (StackRule rule : definition.transitions().rulesFor(current.state(), input, stackTop)) {
			PdaStack stack = current.stack().copy();
			stack.replace(rule.push());
			Configuration next = new Configuration(rule.nextState(), stack, nextCursor);
			if (visited.add(next)) {
				frontier.add(next);
			}
		}
	}

	private int indexOfUnknownSymbol(List<String> input) {
		for (int i = 0; i < input.size(); i++) {
			String symbol = input.get(i);
			if (symbol == null || !definition.inputSymbols().contains(symbol)) {
				return i;
			}
		}
		return -1;
	}
}
