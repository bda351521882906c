package org.javai.pda;

import java.util.Objects;

/**
 * Exception thrown when an automaton cannot be built or queried.
 * The {@link ErrorKind} tells callers which rule was violated.
 */
public class AutomatonException extends RuntimeException {

	private final ErrorKind kind;

	public AutomatonException(ErrorKind kind, String message) {
		super(message);
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
	}

	public AutomatonException(ErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
	}

	public ErrorKind kind() {
		return kind;
	}

	/**
	 * True for failures caused by a reference outside the declared states or alphabets.
	 */
	public boolean isStructural() {
		return switch (kind) {
			case INVALID_STATE, INVALID_SYMBOL, MISSING_STATE, MISSING_SYMBOL -> true;
			default -> false;
		};
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[" + kind + "]: " + getMessage();
	}
}
