package org.javai.branta.engine;

/**
 * Compiles grammar renderings into parsers.
 * <p>
 * Implementations must tolerate arbitrary grammar structures, including degenerate ones, by
 * throwing a {@link GrammarEngineException} rather than failing in any other way.
 */
public interface GrammarEngine {

	/**
	 * Compiles the textual rendering of a grammar.
	 *
	 * @param rendering the grammar text, as produced by {@code Grammar.render()}
	 * @return a parser for the grammar's language
	 * @throws GrammarCompileException if the rendering cannot be compiled
	 */
	GrammarParser compile(String rendering) throws GrammarCompileException;
}
