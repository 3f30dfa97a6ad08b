package org.javai.branta.mutation;

import org.javai.branta.grammar.Grammar;

/**
 * Hook for simplifying a candidate before it is stored.
 */
@FunctionalInterface
public interface GrammarMinimizer {

	/**
	 * Leaves every grammar as it is.
	 */
	GrammarMinimizer NONE = grammar -> grammar;

	Grammar minimize(Grammar grammar);
}
