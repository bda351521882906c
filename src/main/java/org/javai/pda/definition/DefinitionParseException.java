package org.javai.pda.definition;

/**
 * Exception thrown when a definition document cannot be read or is malformed.
 */
public class DefinitionParseException extends RuntimeException {

	public DefinitionParseException(String message) {
		super(message);
	}

	public DefinitionParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
