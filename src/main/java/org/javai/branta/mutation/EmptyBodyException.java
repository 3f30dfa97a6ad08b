package org.javai.branta.mutation;

/**
 * The selected alternative has no positions to mutate.
 */
public class EmptyBodyException extends MutationException {

	public EmptyBodyException(String mutation, String rule, int bodyIndex) {
		super(mutation, "body " + bodyIndex + " of rule '" + rule + "' is empty");
	}
}
