package org.javai.branta.search;

import java.util.List;
import org.javai.branta.grammar.Grammar;
import org.javai.branta.score.Scorer;

/**
 * Outcome of a search run.
 *
 * @param best the highest-scoring entry at the end of the run
 * @param generationsRun generations completed before the run ended
 * @param population the final population in ascending score order
 */
public record SearchResult(
		PopulationEntry best,
		int generationsRun,
		List<PopulationEntry> population
) {

	public SearchResult {
		population = List.copyOf(population);
	}

	public Grammar bestGrammar() {
		return best.grammar();
	}

	public double bestScore() {
		return best.score();
	}

	public boolean isGoodEnough() {
		return Scorer.isGoodEnough(best.score());
	}
}
