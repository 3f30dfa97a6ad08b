package org.javai.branta.mutation;

/**
 * The grammar has fewer non-start nonterminals (or alternatives) than the mutation needs.
 */
public class InsufficientNonterminalsException extends MutationException {

	private final int required;
	private final int available;

	public InsufficientNonterminalsException(String mutation, int required, int available) {
		super(mutation, "needs at least " + required + " but the grammar has " + available);
		this.required = required;
		this.available = available;
	}

	public int required() {
		return required;
	}

	public int available() {
		return available;
	}
}
