package org.javai.pda.definition;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.javai.pda.validation.ValidationMode;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * Parser for automaton definition documents.
 * <p>
 * YAML documents are read with SnakeYAML, JSON documents with Jackson. Both share one
 * layout:
 * <pre>
 * pda:
 *   id: anbn
 *   description: a^n b^n
 *   mode: lenient
 * states: [q0, q1, q2]
 * input_symbols: [a, b]
 * stack_symbols: [Z, A]
 * initial_state: q0
 * initial_stack_symbol: Z
 * final_states: [q2]
 * transitions:
 *   q0:
 *     a:
 *       - { Z: [q0, [Z, A]], A: [q0, [A, A]] }
 *     "":
 *       - { Z: [q2, [Z]] }
 * </pre>
 * A rule is written {@code [nextState, [pushed...]]}; the pushed list may be empty or left
 * out to pop. The empty key {@code ""} (or a null key) holds epsilon moves. Plain scalars
 * other than null are read as strings, so {@code 0} and {@code "0"} name the same symbol
 * and {@code yes} stays {@code "yes"} rather than becoming a boolean.
 * <p>
 * Only the document shape is checked here. Whether the states and symbols fit together is
 * decided by the validator when the automaton is built.
 */
public class PdaDefinitionParser {

	private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
	};

	private final Yaml yaml = createYaml();
	private final ObjectMapper mapper = new ObjectMapper();

	/**
	 * Parse a definition document from a path. Files ending in {@code .json} are read as
	 * JSON, anything else as YAML.
	 */
	public PdaDescriptor parse(Path path) {
		boolean json = path.getFileName() != null
				&& path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
		try (var reader = Files.newBufferedReader(path)) {
			return json ? buildDescriptor(mapper.readValue(reader, DOCUMENT_TYPE)) : parse(reader);
		} catch (DefinitionParseException e) {
			throw e;
		} catch (Exception e) {
			throw new DefinitionParseException("Failed to parse definition from path: " + path, e);
		}
	}

	/**
	 * Parse a YAML definition document from an input stream.
	 */
	public PdaDescriptor parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildDescriptor(data);
		} catch (Exception e) {
			throw new DefinitionParseException("Failed to parse definition from input stream", e);
		}
	}

	/**
	 * Parse a YAML definition document from a reader.
	 */
	public PdaDescriptor parse(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildDescriptor(data);
		} catch (Exception e) {
			throw new DefinitionParseException("Failed to parse definition from reader", e);
		}
	}

	/**
	 * Parse a YAML definition document from a string.
	 */
	public PdaDescriptor parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildDescriptor(data);
		} catch (Exception e) {
			throw new DefinitionParseException("Failed to parse definition from string", e);
		}
	}

	/**
	 * Parse a JSON definition document from a string.
	 */
	public PdaDescriptor parseJson(String jsonContent) {
		try {
			return buildDescriptor(mapper.readValue(jsonContent, DOCUMENT_TYPE));
		} catch (Exception e) {
			throw new DefinitionParseException("Failed to parse definition from JSON", e);
		}
	}

	private static Yaml createYaml() {
		LoaderOptions loaderOptions = new LoaderOptions();
		DumperOptions dumperOptions = new DumperOptions();
		return new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions), dumperOptions,
				loaderOptions, new SymbolResolver());
	}

	/**
	 * Resolves only {@code null}/{@code ~} implicitly; every other plain scalar is a string.
	 */
	private static final class SymbolResolver extends Resolver {

		@Override
		protected void addImplicitResolvers() {
			addImplicitResolver(Tag.NULL, NULL, "~nN\0");
			addImplicitResolver(Tag.NULL, EMPTY, null);
		}
	}

	@SuppressWarnings("unchecked")
	private PdaDescriptor buildDescriptor(Map<String, Object> data) {
		if (data == null) {
			throw new DefinitionParseException("Definition document is empty");
		}
		String id = null;
		String description = null;
		ValidationMode mode = ValidationMode.LENIENT;
		Object header = data.get("pda");
		if (header != null) {
			if (!(header instanceof Map)) {
				throw new DefinitionParseException("'pda' section must be a mapping");
			}
			Map<String, Object> pda = (Map<String, Object>) header;
			id = toStringOrNull(pda.get("id"));
			description = toStringOrNull(pda.get("description"));
			mode = buildMode(pda.get("mode"));
		}

		PdaDefinition definition = PdaDefinition.builder()
				.states(buildSymbolSet(data, "states"))
				.inputSymbols(buildSymbolSet(data, "input_symbols"))
				.stackSymbols(buildSymbolSet(data, "stack_symbols"))
				.transitions(buildTransitions(data.get("transitions")))
				.initialState(toStringOrNull(data.get("initial_state")))
				.initialStackSymbol(toStringOrNull(data.get("initial_stack_symbol")))
				.finalStates(buildSymbolSet(data, "final_states"))
				.build();
		return new PdaDescriptor(id, description, mode, definition);
	}

	private ValidationMode buildMode(Object modeObj) {
		if (modeObj == null) {
			return ValidationMode.LENIENT;
		}
		String value = toString(modeObj).trim().toUpperCase(Locale.ROOT);
		try {
			return ValidationMode.valueOf(value);
		} catch (IllegalArgumentException e) {
			throw new DefinitionParseException("Unknown validation mode: " + modeObj, e);
		}
	}

	private List<String> buildSymbolSet(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return List.of();
		}
		if (!(value instanceof Collection<?> items)) {
			throw new DefinitionParseException("'" + key + "' must be a list");
		}
		List<String> symbols = new ArrayList<>(items.size());
		for (Object item : items) {
			if (item == null) {
				throw new DefinitionParseException("'" + key + "' must not contain null entries");
			}
			symbols.add(toString(item));
		}
		return symbols;
	}

	private TransitionTable buildTransitions(Object transitionsObj) {
		if (transitionsObj == null) {
			return TransitionTable.empty();
		}
		if (!(transitionsObj instanceof Map<?, ?> byState)) {
			throw new DefinitionParseException("'transitions' must be a mapping of states");
		}
		TransitionTable.Builder builder = TransitionTable.builder();
		for (Map.Entry<?, ?> stateEntry : byState.entrySet()) {
			String state = toString(stateEntry.getKey());
			builder.state(state);
			if (stateEntry.getValue() == null) {
				continue;
			}
			if (!(stateEntry.getValue() instanceof Map<?, ?> byInput)) {
				throw new DefinitionParseException("Transitions of state " + state + " must be a mapping of inputs");
			}
			for (Map.Entry<?, ?> inputEntry : byInput.entrySet()) {
				String input = inputEntry.getKey() == null ? TransitionTable.EPSILON : toString(inputEntry.getKey());
				for (Map<String, StackRule> alternative : buildAlternatives(state, input, inputEntry.getValue())) {
					builder.alternative(state, input, alternative);
				}
			}
		}
		return builder.build();
	}

	private List<Map<String, StackRule>> buildAlternatives(String state, String input, Object alternativesObj) {
		String where = "state " + state + " on input '" + input + "'";
		if (alternativesObj instanceof Map<?, ?> single) {
			return List.of(buildAlternative(where, single));
		}
		if (!(alternativesObj instanceof List<?> list)) {
			throw new DefinitionParseException("Alternatives of " + where + " must be a list of mappings");
		}
		List<Map<String, StackRule>> alternatives = new ArrayList<>(list.size());
		for (Object item : list) {
			if (!(item instanceof Map<?, ?> alternative)) {
				throw new DefinitionParseException("Alternative of " + where + " must be a mapping of stack symbols");
			}
			alternatives.add(buildAlternative(where, alternative));
		}
		return alternatives;
	}

	private Map<String, StackRule> buildAlternative(String where, Map<?, ?> alternative) {
		Map<String, StackRule> rules = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : alternative.entrySet()) {
			if (entry.getKey() == null) {
				throw new DefinitionParseException("Stack symbol of " + where + " must not be empty");
			}
			String stackSymbol = toString(entry.getKey());
			rules.put(stackSymbol, buildRule(where + " with stack symbol " + stackSymbol, entry.getValue()));
		}
		return rules;
	}

	private StackRule buildRule(String where, Object ruleObj) {
		if (!(ruleObj instanceof List<?> parts) || parts.isEmpty() || parts.size() > 2 || parts.get(0) == null) {
			throw new DefinitionParseException("Rule of " + where + " must be [nextState, [pushed...]]");
		}
		String nextState = toString(parts.get(0));
		if (parts.size() == 1 || parts.get(1) == null) {
			return StackRule.pop(nextState);
		}
		Object pushObj = parts.get(1);
		if (!(pushObj instanceof List<?> pushed)) {
			throw new DefinitionParseException("Pushed symbols of " + where + " must be a list");
		}
		List<String> push = new ArrayList<>(pushed.size());
		for (Object symbol : pushed) {
			if (symbol == null) {
				throw new DefinitionParseException("Pushed symbols of " + where + " must not contain null entries");
			}
			push.add(toString(symbol));
		}
		return new StackRule(nextState, push);
	}

	private String toString(Object obj) {
		return obj instanceof String ? (String) obj : String.valueOf(obj);
	}

	private String toStringOrNull(Object obj) {
		return obj == null ? null : toString(obj);
	}
}
