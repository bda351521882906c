package org.javai.pda.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.javai.pda.AutomatonException;
import org.javai.pda.ErrorKind;

/**
 * The auxiliary stack of a pushdown automaton.
 * <p>
 * Symbols are held bottom to top, so the last element is the top of the stack.
 * A stack is owned by a single search branch: branches that fork work on a
 * {@link #copy()} and never observe each other's changes. Equality and hashing are
 * by content, which lets configurations holding equal stacks be deduplicated.
 */
public final class PdaStack {

	private final List<String> symbols;

	private PdaStack(List<String> symbols) {
		this.symbols = symbols;
	}

	/**
	 * Creates a stack holding a single symbol, as at the start of every query.
	 */
	public static PdaStack of(String initialSymbol) {
		Objects.requireNonNull(initialSymbol, "initialSymbol must not be null");
		List<String> symbols = new ArrayList<>();
		symbols.add(initialSymbol);
		return new PdaStack(symbols);
	}

	/**
	 * Creates a stack from symbols listed bottom to top.
	 */
	public static PdaStack of(List<String> bottomToTop) {
		Objects.requireNonNull(bottomToTop, "bottomToTop must not be null");
		List<String> symbols = new ArrayList<>(bottomToTop.size() + 4);
		for (String symbol : bottomToTop) {
			symbols.add(Objects.requireNonNull(symbol, "stack symbols must not be null"));
		}
		return new PdaStack(symbols);
	}

	/**
	 * Returns the most recently pushed symbol.
	 *
	 * @throws AutomatonException of kind {@link ErrorKind#EMPTY_STACK} if the stack is empty
	 */
	public String top() {
		if (symbols.isEmpty()) {
			throw new AutomatonException(ErrorKind.EMPTY_STACK, "Cannot read the top of an empty stack");
		}
		return symbols.get(symbols.size() - 1);
	}

	/**
	 * Removes and discards the top symbol.
	 *
	 * @throws AutomatonException of kind {@link ErrorKind#EMPTY_STACK} if the stack is empty
	 */
	public void pop() {
		if (symbols.isEmpty()) {
			throw new AutomatonException(ErrorKind.EMPTY_STACK, "Cannot pop an empty stack");
		}
		symbols.remove(symbols.size() - 1);
	}

	/**
	 * Removes the top symbol and pushes the given sequence in order, so that its last
	 * element becomes the new top. An empty sequence behaves like {@link #pop()}.
	 */
	public void replace(List<String> sequence) {
		Objects.requireNonNull(sequence, "sequence must not be null");
		pop();
		symbols.addAll(sequence);
	}

	/**
	 * Returns an independent stack with the same contents.
	 */
	public PdaStack copy() {
		return new PdaStack(new ArrayList<>(symbols));
	}

	public int size() {
		return symbols.size();
	}

	public boolean isEmpty() {
		return symbols.isEmpty();
	}

	/**
	 * Unmodifiable bottom-to-top view of the stack contents.
	 */
	public List<String> symbols() {
		return Collections.unmodifiableList(symbols);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PdaStack other)) {
			return false;
		}
		return symbols.equals(other.symbols);
	}

	@Override
	public int hashCode() {
		return symbols.hashCode();
	}

	@Override
	public String toString() {
		return "PdaStack" + symbols;
	}
}
