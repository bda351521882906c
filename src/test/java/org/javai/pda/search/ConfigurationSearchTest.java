package org.javai.pda.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.pda.AutomatonException;
import org.javai.pda.ErrorKind;
import org.javai.pda.definition.PdaDefinition;
import org.javai.pda.definition.TransitionTable;
import org.javai.pda.testsupport.LogCaptorAppender;
import org.javai.pda.testsupport.SampleDefinitions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class ConfigurationSearchTest {

	private static ConfigurationSearch searchFor(PdaDefinition definition) {
		return new ConfigurationSearch(definition, SearchOptions.defaults());
	}

	@Test
	@Timeout(5)
	@DisplayName("an epsilon cycle that never accepts should terminate with rejection")
	void epsilonCycleShouldTerminate() {
		ConfigurationSearch search = searchFor(SampleDefinitions.epsilonCycle());

		AcceptanceResult result = search.search(List.of("a", "a", "a"));

		assertThat(result).isInstanceOf(AcceptanceResult.Rejected.class);
		assertThat(result.explored()).isPositive();
	}

	@Test
	@DisplayName("a branch that empties its stack is abandoned while other branches continue")
	void emptyStackBranchShouldNotEndSearch() {
		PdaDefinition definition = PdaDefinition.builder()
				.states("start", "dead", "ok")
				.inputSymbols("a")
				.stackSymbols("Z")
				.transitions(TransitionTable.builder()
						.rule("start", "a", "Z", "dead")
						.epsilon("start", "Z", "start", "Z", "Z")
						.rule("start", "a", "Z", "ok", "Z")
						.build())
				.initialState("start")
				.initialStackSymbol("Z")
				.finalStates("ok")
				.build();
		ConfigurationSearch search = new ConfigurationSearch(definition,
				SearchOptions.defaults().withMaxConfigurations(1_000));

		assertThat(search.search(List.of("a")).isAccepted()).isTrue();
	}

	@Test
	void emptiedStackShouldRejectRemainingInputWithoutThrowing() {
		PdaDefinition definition = PdaDefinition.builder()
				.states("q0")
				.inputSymbols("a")
				.stackSymbols("Z")
				.transitions(TransitionTable.builder().rule("q0", "a", "Z", "q0").build())
				.initialState("q0")
				.initialStackSymbol("Z")
				.finalStates("q0")
				.build();
		ConfigurationSearch search = searchFor(definition);

		assertThat(search.search(List.of("a")).isAccepted()).isTrue();
		assertThat(search.search(List.of("a", "a"))).isInstanceOf(AcceptanceResult.Rejected.class);
	}

	@Test
	@DisplayName("every epsilon alternative is explored, not only the first match")
	void shouldExploreAllEpsilonAlternatives() {
		PdaDefinition definition = PdaDefinition.builder()
				.states("q0", "wrong", "right")
				.inputSymbols("a")
				.stackSymbols("Z")
				.transitions(TransitionTable.builder()
						.epsilon("q0", "Z", "wrong", "Z")
						.epsilon("q0", "Z", "right", "Z")
						.rule("right", "a", "Z", "right", "Z")
						.build())
				.initialState("q0")
				.initialStackSymbol("Z")
				.finalStates("right")
				.build();

		assertThat(searchFor(definition).search(List.of("a")).isAccepted()).isTrue();
	}

	@Test
	@DisplayName("an epsilon move that keeps pushing is stopped by the budget")
	void budgetShouldStopUnboundedGrowth() {
		ConfigurationSearch search = new ConfigurationSearch(SampleDefinitions.unboundedPush(),
				SearchOptions.defaults().withMaxConfigurations(50));

		AcceptanceResult result = search.search(List.of("a"));

		assertThat(result).isEqualTo(new AcceptanceResult.Undetermined(50));
	}

	@Test
	void acceptanceWithinBudgetShouldBeReported() {
		ConfigurationSearch search = new ConfigurationSearch(SampleDefinitions.anbn(),
				SearchOptions.defaults().withMaxConfigurations(100));

		assertThat(search.search(List.of("a", "b")).isAccepted()).isTrue();
	}

	@Test
	void unknownSymbolShouldBeRejectedByDefault() {
		AcceptanceResult result = searchFor(SampleDefinitions.anbn()).search(List.of("a", "x", "b"));

		assertThat(result).isInstanceOf(AcceptanceResult.Rejected.class);
		assertThat(result.explored()).isZero();
		assertThat(((AcceptanceResult.Rejected) result).reason()).contains("x");
	}

	@Test
	void unknownSymbolShouldFailWhenConfigured() {
		ConfigurationSearch search = new ConfigurationSearch(SampleDefinitions.anbn(),
				SearchOptions.defaults().withUnknownSymbolPolicy(UnknownSymbolPolicy.FAIL));

		assertThatThrownBy(() -> search.search(List.of("a", "x")))
				.isInstanceOf(AutomatonException.class)
				.hasMessageContaining("x");
	}

	@Test
	void epsilonIsNotAValidInputSymbol() {
		AcceptanceResult result = searchFor(SampleDefinitions.anbn()).search(List.of(TransitionTable.EPSILON));

		assertThat(result.isAccepted()).isFalse();
	}

	@Test
	void shouldLogOutcomeAtDebug() {
		try (LogCaptorAppender captor = LogCaptorAppender.capture(ConfigurationSearch.class, Level.DEBUG)) {
			ConfigurationSearch search = searchFor(SampleDefinitions.anbn());

			search.search(List.of("a", "b"));
			search.search(List.of("b"));

			assertThat(captor.messagesAt(Level.DEBUG))
					.anyMatch(message -> message.startsWith("Accepted input of length 2"))
					.anyMatch(message -> message.startsWith("Rejected input of length 1"));
		}
	}

	@Test
	void shouldWarnWhenBudgetIsExhausted() {
		try (LogCaptorAppender captor = LogCaptorAppender.capture(ConfigurationSearch.class, Level.DEBUG)) {
			new ConfigurationSearch(SampleDefinitions.unboundedPush(), SearchOptions.defaults().withMaxConfigurations(10))
					.search(List.of());

			assertThat(captor.messagesAt(Level.WARN)).singleElement()
					.asString()
					.contains("after 10 configurations");
		}
	}

	@Test
	@DisplayName("a null input symbol is unknown even when the input alphabet is empty")
	void nullSymbolShouldBeUnknownForEmptyAlphabet() {
		PdaDefinition definition = PdaDefinition.builder()
				.states("q0")
				.stackSymbols("Z")
				.initialState("q0")
				.initialStackSymbol("Z")
				.finalStates("q0")
				.build();
		List<String> input = Arrays.asList((String) null);

		assertThat(searchFor(definition).search(input)).isInstanceOf(AcceptanceResult.Rejected.class);
		assertThat(searchFor(definition).search(List.of()).isAccepted()).isTrue();
		assertThatThrownBy(() -> new ConfigurationSearch(definition,
				SearchOptions.defaults().withUnknownSymbolPolicy(UnknownSymbolPolicy.FAIL)).search(input))
				.isInstanceOf(AutomatonException.class)
				.matches(e -> ((AutomatonException) e).kind() == ErrorKind.INVALID_SYMBOL);
	}
}
