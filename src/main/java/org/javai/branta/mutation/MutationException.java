package org.javai.branta.mutation;

/**
 * Raised when a mutation cannot be applied to the grammar it was given because a structural
 * precondition does not hold. The attempt is discarded and may be retried with a new draw.
 */
public class MutationException extends RuntimeException {

	private final String mutation;

	public MutationException(String mutation, String message) {
		super(mutation + ": " + message);
		this.mutation = mutation;
	}

	/**
	 * Name of the mutation that gave up.
	 */
	public String mutation() {
		return mutation;
	}
}
