package org.javai.pda.search;

import java.util.Objects;

/**
 * Per-automaton settings for acceptance queries.
 *
 * @param unknownSymbolPolicy handling of input symbols outside the input alphabet
 * @param maxConfigurations the most configurations one query may expand; {@code 0} for no limit
 */
public record SearchOptions(UnknownSymbolPolicy unknownSymbolPolicy, long maxConfigurations) {

	public static final long UNBOUNDED = 0;

	private static final SearchOptions DEFAULTS = new SearchOptions(UnknownSymbolPolicy.REJECT, UNBOUNDED);

	public SearchOptions {
		Objects.requireNonNull(unknownSymbolPolicy, "unknownSymbolPolicy must not be null");
		if (maxConfigurations < 0) {
			throw new IllegalArgumentException("maxConfigurations must not be negative: " + maxConfigurations);
		}
	}

	/**
	 * Rejects unknown symbols and places no limit on the search.
	 */
	public static SearchOptions defaults() {
		return DEFAULTS;
	}

	public SearchOptions withUnknownSymbolPolicy(UnknownSymbolPolicy policy) {
		return new SearchOptions(policy, maxConfigurations);
	}

	public SearchOptions withMaxConfigurations(long limit) {
		return new SearchOptions(unknownSymbolPolicy, limit);
	}

	public boolean isBounded() {
		return maxConfigurations != UNBOUNDED;
	}
}
