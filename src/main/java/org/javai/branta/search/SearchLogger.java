package org.javai.branta.search;

import java.util.List;
import java.util.Locale;
import org.javai.branta.mutation.MutationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progress logging for a search run.
 */
public class SearchLogger {

	private final Logger logger;

	public SearchLogger(Class<?> owner) {
		this.logger = LoggerFactory.getLogger(owner);
	}

	public void logSearchStart(int guides, int positives, int negatives) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info("Beginning search with {} guides, {} positives, {} negatives", guides, positives, negatives);
	}

	public void logSeed(PopulationEntry seed) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info("Seed grammar #{} score={} rules={} alternatives={}",
				seed.id(),
				formatScore(seed.score()),
				seed.grammar().nonterminalNames().size(),
				seed.grammar().bodyCount());
		logger.debug("Seed grammar:\n{}", seed.grammar().render());
	}

	public void logCascade(List<String> steps) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.debug("Mutation cascade of {} step(s): {}", steps.size(), String.join(" > ", steps));
	}

	public void logSkippedAttempt(int generation, int attempt, MutationException e) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.debug("Generation {} attempt {} skipped: {}", generation, attempt, e.getMessage());
	}

	public void logAdmitted(PopulationEntry entry, double previousMinimum, int populationSize) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.debug("Admitted mutant #{} score={} (minimum was {}), population size {}",
				entry.id(),
				formatScore(entry.score()),
				formatScore(previousMinimum),
				populationSize);
	}

	public void logRejected(long id, double score, double minimum) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.debug("Rejected mutant #{} score={} (minimum {})", id, formatScore(score), formatScore(minimum));
	}

	public void logGenerationExhausted(int generation, int attempts) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn("Generation {} produced no candidate after {} attempts", generation, attempts);
	}

	public void logBestScore(int generation, double score) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info("Generation {}: current best score: {}", generation, formatScore(score));
	}

	public void logFinished(SearchResult result) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info("Search finished after {} generation(s): best grammar #{} score={}{}",
				result.generationsRun(),
				result.best().id(),
				formatScore(result.bestScore()),
				result.isGoodEnough() ? " (good enough)" : "");
	}

	private String formatScore(double value) {
		if (Double.isNaN(value)) {
			return "n/a";
		}
		return String.format(Locale.ROOT, "%.4f", value);
	}
}
