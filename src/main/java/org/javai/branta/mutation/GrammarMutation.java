package org.javai.branta.mutation;

import org.javai.branta.grammar.Grammar;

/**
 * A structural transform producing a new candidate grammar. The input grammar is never modified.
 */
public interface GrammarMutation {

	/**
	 * Short name used in logs.
	 */
	String name();

	/**
	 * Produces a mutant of {@code grammar}.
	 *
	 * @throws MutationException if the grammar does not meet the mutation's preconditions
	 */
	Grammar mutate(Grammar grammar) throws MutationException;
}
