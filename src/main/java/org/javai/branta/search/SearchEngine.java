package org.javai.branta.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.javai.branta.grammar.Grammar;
import org.javai.branta.mutation.GrammarMinimizer;
import org.javai.branta.mutation.GrammarMutation;
import org.javai.branta.mutation.MutationException;
import org.javai.branta.score.Scorer;

/**
 * State and policy of one search run.
 * <p>
 * The engine owns the population, the grammar-id counter and the admission threshold. Each
 * generation picks a parent uniformly from the population, runs a cascade of randomly chosen
 * mutations on it, scores the final mutant once and admits it only if it beats the current
 * minimum score. A mutation that cannot be applied discards the attempt, which is redrawn up to
 * {@link SearchConfig#maxAttemptsPerGeneration()} times.
 * <p>
 * Not thread-safe; a run is strictly sequential.
 */
public class SearchEngine {

	private final SearchLogger logger = new SearchLogger(SearchEngine.class);

	private final Scorer scorer;
	private final List<GrammarMutation> mutations;
	private final SearchConfig config;
	private final Random random;
	private final GrammarMinimizer minimizer;
	private final Population population;

	private long grammarId;
	private double minimumScore;
	private int generationsRun;

	public SearchEngine(Grammar seed, Scorer scorer, List<GrammarMutation> mutations, SearchConfig config,
			Random random) {
		this(seed, scorer, mutations, config, random, GrammarMinimizer.NONE);
	}

	public SearchEngine(Grammar seed, Scorer scorer, List<GrammarMutation> mutations, SearchConfig config,
			Random random, GrammarMinimizer minimizer) {
		Objects.requireNonNull(seed, "seed must not be null");
		this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.random = Objects.requireNonNull(random, "random must not be null");
		this.minimizer = Objects.requireNonNull(minimizer, "minimizer must not be null");
		if (mutations == null || mutations.isEmpty()) {
			throw new IllegalArgumentException("At least one mutation is required");
		}
		this.mutations = List.copyOf(mutations);
		this.population = new Population(config.populationSize());

		PopulationEntry seedEntry = new PopulationEntry(seed, grammarId, scorer.score(seed));
		population.insert(seedEntry);
		minimumScore = seedEntry.score();
		logger.logSeed(seedEntry);
	}

	/**
	 * Picks a parent uniformly from the whole population.
	 */
	public PopulationEntry selectParent() {
		return population.get(random.nextInt(population.size()));
	}

	/**
	 * Applies a cascade of mutations to {@code parent}. The cascade length is drawn from the
	 * configured lengths and every step applies a uniformly chosen mutation to the previous
	 * step's output.
	 *
	 * @throws MutationException if a step cannot be applied
	 */
	public Grammar proposeMutant(Grammar parent) throws MutationException {
		List<Integer> lengths = config.cascadeLengths();
		int steps = lengths.get(random.nextInt(lengths.size()));
		List<String> applied = new ArrayList<>(steps);
		Grammar mutant = parent;
		for (int i = 0; i < steps; i++) {
			GrammarMutation mutation = mutations.get(random.nextInt(mutations.size()));
			mutant = mutation.mutate(mutant);
			applied.add(mutation.name());
		}
		logger.logCascade(applied);
		return mutant;
	}

	/**
	 * Admits {@code candidate} if its score is strictly greater than the current minimum, keeping
	 * the population sorted and within capacity.
	 *
	 * @return whether the candidate was admitted
	 */
	public boolean tryAdmit(PopulationEntry candidate) {
		Objects.requireNonNull(candidate, "candidate must not be null");
		if (candidate.score() <= minimumScore) {
			logger.logRejected(candidate.id(), candidate.score(), minimumScore);
			return false;
		}
		PopulationEntry entry = new PopulationEntry(
				minimizer.minimize(candidate.grammar()), candidate.id(), candidate.score());
		double previousMinimum = minimumScore;
		population.insert(entry);
		minimumScore = population.minimumScore();
		logger.logAdmitted(entry, previousMinimum, population.size());
		return true;
	}

	/**
	 * Runs one generation: select, mutate, score once, try to admit.
	 *
	 * @return whether a mutant was admitted
	 */
	public boolean runGeneration() {
		int generation = generationsRun + 1;
		boolean admitted = false;
		boolean proposed = false;
		for (int attempt = 1; attempt <= config.maxAttemptsPerGeneration() && !proposed; attempt++) {
			PopulationEntry parent = selectParent();
			Grammar mutant;
			try {
				mutant = proposeMutant(parent.grammar());
			}
			catch (MutationException e) {
				logger.logSkippedAttempt(generation, attempt, e);
				continue;
			}
			proposed = true;
			PopulationEntry candidate = new PopulationEntry(mutant, ++grammarId, scorer.score(mutant));
			admitted = tryAdmit(candidate);
		}
		if (!proposed) {
			logger.logGenerationExhausted(generation, config.maxAttemptsPerGeneration());
		}
		generationsRun = generation;
		logger.logBestScore(generation, population.best().score());
		return admitted;
	}

	/**
	 * Runs the configured number of generations, stopping early only when
	 * {@link SearchConfig#stopWhenGoodEnough()} is set and the best grammar is good enough.
	 */
	public SearchResult run() {
		for (int i = 0; i < config.generations(); i++) {
			if (config.stopWhenGoodEnough() && Scorer.isGoodEnough(population.best().score())) {
				break;
			}
			runGeneration();
		}
		SearchResult result = new SearchResult(population.best(), generationsRun, population.entries());
		logger.logFinished(result);
		return result;
	}

	public List<PopulationEntry> population() {
		return population.entries();
	}

	public double minimumScore() {
		return minimumScore;
	}

	public int generationsRun() {
		return generationsRun;
	}

	/**
	 * Id given to the most recently proposed mutant; 0 while only the seed exists.
	 */
	public long lastGrammarId() {
		return grammarId;
	}
}
