package org.javai.branta.engine;

/**
 * Thrown when a grammar rendering cannot be turned into a parser: the text is malformed, the
 * start rule is missing, a rule has no alternatives, or a body refers to an undefined nonterminal.
 */
public class GrammarCompileException extends GrammarEngineException {

	public GrammarCompileException(String message) {
		super(message);
	}

	public GrammarCompileException(String message, Throwable cause) {
		super(message, cause);
	}
}
