package org.javai.pda.definition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TransitionTableTest {

	@Test
	void rulesForShouldCollectMatchingAlternativesInOrder() {
		TransitionTable table = TransitionTable.builder()
				.rule("q0", "a", "Z", "q0", "Z", "A")
				.alternative("q0", "a", Map.of("A", StackRule.pop("q1"), "Z", StackRule.of("q1", "Z")))
				.build();

		assertThat(table.rulesFor("q0", "a", "Z"))
				.containsExactly(StackRule.of("q0", "Z", "A"), StackRule.of("q1", "Z"));
		assertThat(table.rulesFor("q0", "a", "A")).containsExactly(StackRule.pop("q1"));
		assertThat(table.rulesFor("q0", "b", "Z")).isEmpty();
		assertThat(table.rulesFor("q9", "a", "Z")).isEmpty();
	}

	@Test
	void epsilonShouldUseEmptyInputKey() {
		TransitionTable table = TransitionTable.builder()
				.epsilon("q0", "Z", "q1", "Z")
				.build();

		assertThat(table.alternatives("q0", TransitionTable.EPSILON)).hasSize(1);
		assertThat(table.movesFrom("q0")).containsOnlyKeys("");
	}

	@Test
	void ofShouldDeepCopyNestedMaps() {
		Map<String, StackRule> alternative = new HashMap<>();
		alternative.put("Z", StackRule.of("q1", "Z"));
		List<Map<String, StackRule>> alternatives = new ArrayList<>();
		alternatives.add(alternative);
		Map<String, List<Map<String, StackRule>>> byInput = new HashMap<>();
		byInput.put("a", alternatives);
		Map<String, Map<String, List<Map<String, StackRule>>>> moves = new HashMap<>();
		moves.put("q0", byInput);

		TransitionTable table = TransitionTable.of(moves);
		alternative.put("A", StackRule.pop("q0"));
		alternatives.add(Map.of());

		assertThat(table.alternatives("q0", "a")).hasSize(1);
		assertThat(table.alternatives("q0", "a").get(0)).containsOnlyKeys("Z");
		assertThatThrownBy(() -> table.asMap().put("q1", Map.of()))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void tablesWithSameMovesShouldBeEqual() {
		TransitionTable first = TransitionTable.builder().rule("q0", "a", "Z", "q1").build();
		TransitionTable second = TransitionTable.of(first.asMap());

		assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
	}
}
