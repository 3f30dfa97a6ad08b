package org.javai.branta.engine;

/**
 * Thrown when recognizing an input takes more steps than the parser's budget allows.
 */
public class ParseBudgetExceededException extends GrammarParseException {

	private final long budget;

	public ParseBudgetExceededException(long budget, int position) {
		super("Parse step budget of " + budget + " exceeded at offset " + position, position);
		this.budget = budget;
	}

	public long budget() {
		return budget;
	}
}
