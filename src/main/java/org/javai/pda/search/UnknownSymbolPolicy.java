package org.javai.pda.search;

/**
 * What a query does with an input symbol that is not in the input alphabet.
 */
public enum UnknownSymbolPolicy {

	/**
	 * The input is not accepted; no search is run.
	 */
	REJECT,

	/**
	 * The query fails with an {@link org.javai.pda.ErrorKind#INVALID_SYMBOL} error.
	 */
	FAIL
}
