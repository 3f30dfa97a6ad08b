package org.javai.branta.score;

import java.util.List;
import java.util.Objects;
import org.javai.branta.engine.GrammarEngine;
import org.javai.branta.engine.GrammarParser;
import org.javai.branta.grammar.Grammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores grammars against fixed positive and negative example sets.
 * <p>
 * The grammar is compiled once per call. A grammar that fails to compile matches nothing, and
 * any failure while parsing one example counts as a non-match for that example only, so
 * structurally broken candidates are scored instead of aborting the search.
 */
public class Scorer {

	private static final Logger logger = LoggerFactory.getLogger(Scorer.class);

	private final List<String> positives;
	private final List<String> negatives;
	private final GrammarEngine engine;

	public Scorer(List<String> positives, List<String> negatives, GrammarEngine engine) {
		this.positives = List.copyOf(Objects.requireNonNull(positives, "positives must not be null"));
		this.negatives = List.copyOf(Objects.requireNonNull(negatives, "negatives must not be null"));
		this.engine = Objects.requireNonNull(engine, "engine must not be null");
	}

	/**
	 * Whether a score is high enough to stop searching. Only a grammar accepting every positive
	 * and rejecting every negative reaches 1.0.
	 */
	public static boolean isGoodEnough(double score) {
		return score >= 1.0;
	}

	public double score(Grammar grammar) {
		return evaluate(grammar).overallScore();
	}

	public FitnessScore evaluate(Grammar grammar) {
		Objects.requireNonNull(grammar, "grammar must not be null");
		GrammarParser parser;
		try {
			parser = engine.compile(grammar.render());
		}
		catch (RuntimeException e) {
			logger.debug("Grammar failed to compile, scoring as matching nothing: {}", e.getMessage());
			return new FitnessScore(0, positives.size(), 0, negatives.size());
		}
		int positivesMatched = countMatches(parser, positives);
		int negativesMatched = countMatches(parser, negatives);
		return new FitnessScore(positivesMatched, positives.size(), negativesMatched, negatives.size());
	}

	private int countMatches(GrammarParser parser, List<String> examples) {
		int matched = 0;
		for (String example : examples) {
			if (parses(parser, example)) {
				matched++;
			}
		}
		return matched;
	}

	private boolean parses(GrammarParser parser, String input) {
		try {
			parser.parse(input);
			return true;
		}
		catch (RuntimeException e) {
			logger.trace("Example '{}' not matched: {}", input, e.getMessage());
			return false;
		}
	}
}
