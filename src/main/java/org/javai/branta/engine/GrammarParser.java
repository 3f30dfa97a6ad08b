package org.javai.branta.engine;

/**
 * Membership test for one compiled grammar.
 */
public interface GrammarParser {

	/**
	 * Parses the complete input, returning normally when it is accepted.
	 *
	 * @throws GrammarParseException if the input is rejected or the parse is abandoned
	 */
	void parse(String input) throws GrammarParseException;

	/**
	 * Returns {@code true} when {@link #parse(String)} accepts the input.
	 */
	default boolean accepts(String input) {
		try {
			parse(input);
			return true;
		}
		catch (GrammarParseException e) {
			return false;
		}
	}
}
