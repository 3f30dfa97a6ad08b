package org.javai.branta.engine;

/**
 * Thrown when an input string is not in the language of the compiled grammar.
 */
public class GrammarParseException extends GrammarEngineException {

	private final int position;

	public GrammarParseException(String message, int position) {
		super(message);
		this.position = position;
	}

	/**
	 * Offset of the first character that could not be consumed, or the input length when the
	 * input ended too early.
	 */
	public int position() {
		return position;
	}
}
