package org.javai.branta.mutation;

import org.javai.branta.grammar.Symbol;

/**
 * The alphabet holds no symbol other than the one being replaced.
 */
public class NoAlternativeSymbolException extends MutationException {

	public NoAlternativeSymbolException(String mutation, Symbol current) {
		super(mutation, "no symbol other than " + current.render() + " to substitute");
	}
}
