package org.javai.branta.score;

/**
 * Outcome of scoring one grammar against the example sets.
 *
 * @param positivesMatched positive examples the grammar accepted
 * @param positives size of the positive example set
 * @param negativesMatched negative examples the grammar accepted
 * @param negatives size of the negative example set
 */
public record FitnessScore(
		int positivesMatched,
		int positives,
		int negativesMatched,
		int negatives
) {

	/**
	 * Share of accepted positives, floored at half an example. An empty set counts as 1.0.
	 */
	public double positiveScore() {
		if (positives == 0) {
			return 1.0;
		}
		return Math.max((double) positivesMatched / positives, 0.5 / positives);
	}

	/**
	 * Share of rejected negatives, floored at half an example. An empty set counts as 1.0.
	 */
	public double negativeScore() {
		if (negatives == 0) {
			return 1.0;
		}
		return Math.max(1.0 - (double) negativesMatched / negatives, 0.5 / negatives);
	}

	public double overallScore() {
		return positiveScore() * negativeScore();
	}
}
