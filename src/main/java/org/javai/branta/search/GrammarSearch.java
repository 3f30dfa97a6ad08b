package org.javai.branta.search;

import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.javai.branta.engine.EarleyGrammarEngine;
import org.javai.branta.engine.GrammarEngine;
import org.javai.branta.grammar.Grammar;
import org.javai.branta.mutation.AlternateMutation;
import org.javai.branta.mutation.BubbleMutation;
import org.javai.branta.mutation.CoalesceMutation;
import org.javai.branta.mutation.GrammarMinimizer;
import org.javai.branta.mutation.GrammarMutation;
import org.javai.branta.mutation.RepeatMutation;
import org.javai.branta.score.Scorer;
import org.javai.branta.seed.SeedGrammarBuilder;

/**
 * Entry point of a grammar search.
 * <p>
 * Builds the seed grammar from the guides, scores candidates against the positive and negative
 * examples and returns the best grammar found:
 *
 * <pre>
 * SearchResult result = new GrammarSearch(new SearchConfigLoader().loadDefault())
 *     .search(List.of("ab"), List.of("ab", "aab"), List.of("ba"));
 * String grammar = result.bestGrammar().render();
 * </pre>
 */
public class GrammarSearch {

	private final SearchLogger logger = new SearchLogger(GrammarSearch.class);

	private final SearchConfig config;
	private final GrammarMinimizer minimizer;
	private final SeedGrammarBuilder seedBuilder = new SeedGrammarBuilder();

	public GrammarSearch() {
		this(SearchConfig.defaults());
	}

	public GrammarSearch(SearchConfig config) {
		this(config, GrammarMinimizer.NONE);
	}

	public GrammarSearch(SearchConfig config, GrammarMinimizer minimizer) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.minimizer = Objects.requireNonNull(minimizer, "minimizer must not be null");
	}

	public SearchResult search(List<String> guides, List<String> positives, List<String> negatives) {
		logger.logSearchStart(guides.size(), positives.size(), negatives.size());
		Random random = config.randomSeed() != null ? new Random(config.randomSeed()) : new Random();
		GrammarEngine engine = new EarleyGrammarEngine(config.maxParseSteps());
		Scorer scorer = new Scorer(positives, negatives, engine);
		Grammar seed = seedBuilder.build(guides);

		SearchEngine searchEngine = new SearchEngine(
				seed, scorer, mutations(random, config), config, random, minimizer);
		return searchEngine.run();
	}

	/**
	 * The four structural mutations sharing one random source.
	 */
	public static List<GrammarMutation> mutations(Random random, SearchConfig config) {
		return List.of(
				new BubbleMutation(random, config.maxEnumeratedBodyLength()),
				new CoalesceMutation(random),
				new AlternateMutation(random),
				new RepeatMutation(random)
		);
	}
}
