package org.javai.branta.engine;

/**
 * Base exception for failures raised by the grammar-execution engine.
 */
public class GrammarEngineException extends RuntimeException {

	public GrammarEngineException(String message) {
		super(message);
	}

	public GrammarEngineException(String message, Throwable cause) {
		super(message, cause);
	}
}
