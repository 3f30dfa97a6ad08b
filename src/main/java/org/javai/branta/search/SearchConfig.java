package org.javai.branta.search;

import java.util.List;
import org.javai.branta.engine.EarleyGrammarEngine;
import org.javai.branta.mutation.BubbleMutation;

/**
 * Parameters of one search run.
 *
 * @param populationSize maximum number of grammars kept between generations
 * @param generations number of generations to run
 * @param cascadeLengths mutation cascade lengths, one drawn uniformly per generation
 * @param stopWhenGoodEnough stop as soon as the best grammar scores 1.0; off by default so a
 * run always lasts {@code generations} generations
 * @param maxAttemptsPerGeneration how often a generation redraws after a skippable mutation failure
 * @param maxParseSteps step budget of each membership test
 * @param maxEnumeratedBodyLength longest body whose non-contiguous subsequences are enumerated by Bubble
 * @param randomSeed seed of the run's random source; {@code null} for a nondeterministic run
 */
public record SearchConfig(
		int populationSize,
		int generations,
		List<Integer> cascadeLengths,
		boolean stopWhenGoodEnough,
		int maxAttemptsPerGeneration,
		long maxParseSteps,
		int maxEnumeratedBodyLength,
		Long randomSeed
) {

	public static final int DEFAULT_POPULATION_SIZE = 20;
	public static final int DEFAULT_GENERATIONS = 30;
	public static final List<Integer> DEFAULT_CASCADE_LENGTHS = List.of(1, 2, 4, 8, 16);
	public static final int DEFAULT_MAX_ATTEMPTS_PER_GENERATION = 32;

	public SearchConfig {
		if (populationSize <= 0) {
			throw new SearchConfigException("population_size must be positive");
		}
		if (generations < 0) {
			throw new SearchConfigException("generations must not be negative");
		}
		if (cascadeLengths == null || cascadeLengths.isEmpty()) {
			throw new SearchConfigException("cascade_lengths must not be empty");
		}
		if (cascadeLengths.stream().anyMatch(length -> length == null || length <= 0)) {
			throw new SearchConfigException("cascade_lengths must be positive: " + cascadeLengths);
		}
		if (maxAttemptsPerGeneration <= 0) {
			throw new SearchConfigException("max_attempts_per_generation must be positive");
		}
		if (maxParseSteps <= 0) {
			throw new SearchConfigException("max_parse_steps must be positive");
		}
		if (maxEnumeratedBodyLength < 1 || maxEnumeratedBodyLength > 20) {
			throw new SearchConfigException("max_enumerated_body_length must be between 1 and 20");
		}
		cascadeLengths = List.copyOf(cascadeLengths);
	}

	public static SearchConfig defaults() {
		return new SearchConfig(
				DEFAULT_POPULATION_SIZE,
				DEFAULT_GENERATIONS,
				DEFAULT_CASCADE_LENGTHS,
				false,
				DEFAULT_MAX_ATTEMPTS_PER_GENERATION,
				EarleyGrammarEngine.DEFAULT_MAX_STEPS,
				BubbleMutation.DEFAULT_MAX_ENUMERATED_BODY_LENGTH,
				null
		);
	}

	public SearchConfig withGenerations(int generations) {
		return new SearchConfig(populationSize, generations, cascadeLengths, stopWhenGoodEnough,
				maxAttemptsPerGeneration, maxParseSteps, maxEnumeratedBodyLength, randomSeed);
	}

	public SearchConfig withStopWhenGoodEnough(boolean stopWhenGoodEnough) {
		return new SearchConfig(populationSize, generations, cascadeLengths, stopWhenGoodEnough,
				maxAttemptsPerGeneration, maxParseSteps, maxEnumeratedBodyLength, randomSeed);
	}

	public SearchConfig withRandomSeed(Long randomSeed) {
		return new SearchConfig(populationSize, generations, cascadeLengths, stopWhenGoodEnough,
				maxAttemptsPerGeneration, maxParseSteps, maxEnumeratedBodyLength, randomSeed);
	}
}
