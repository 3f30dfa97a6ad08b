package org.javai.branta.score;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import org.javai.branta.engine.EarleyGrammarEngine;
import org.javai.branta.engine.GrammarCompileException;
import org.javai.branta.engine.GrammarEngine;
import org.javai.branta.engine.GrammarParser;
import org.javai.branta.grammar.Grammar;
import org.javai.branta.seed.SeedGrammarBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ScorerTest {

	@Mock
	private GrammarEngine engine;

	@Mock
	private GrammarParser parser;

	private final SeedGrammarBuilder seedBuilder = new SeedGrammarBuilder();

	@Test
	void perfectGrammarScoresOne() {
		Scorer scorer = new Scorer(List.of("ab"), List.of("ba"), new EarleyGrammarEngine());

		double score = scorer.score(seedBuilder.build(List.of("ab")));

		assertThat(score).isEqualTo(1.0);
		assertThat(Scorer.isGoodEnough(score)).isTrue();
	}

	@Test
	void scoreIsTheProductOfPositiveAndNegativeShares() {
		Scorer scorer = new Scorer(
				List.of("ab", "ac", "aa", "bb"),
				List.of("ab", "x"),
				new EarleyGrammarEngine());

		FitnessScore fitness = scorer.evaluate(seedBuilder.build(List.of("ab", "ac")));

		assertThat(fitness.positivesMatched()).isEqualTo(2);
		assertThat(fitness.negativesMatched()).isEqualTo(1);
		assertThat(fitness.positiveScore()).isCloseTo(0.5, within(1e-12));
		assertThat(fitness.negativeScore()).isCloseTo(0.5, within(1e-12));
		assertThat(fitness.overallScore()).isCloseTo(0.25, within(1e-12));
		assertThat(Scorer.isGoodEnough(fitness.overallScore())).isFalse();
	}

	@Test
	void bothHalvesAreFlooredAtHalfAnExample() {
		Scorer scorer = new Scorer(List.of("x", "y"), List.of("ab", "ab", "ab", "ab"), new EarleyGrammarEngine());

		FitnessScore fitness = scorer.evaluate(seedBuilder.build(List.of("ab")));

		assertThat(fitness.positiveScore()).isCloseTo(0.25, within(1e-12));
		assertThat(fitness.negativeScore()).isCloseTo(0.125, within(1e-12));
		assertThat(fitness.overallScore()).isGreaterThan(0.0);
	}

	@Test
	void scoringIsDeterministic() {
		Scorer scorer = new Scorer(List.of("ab", "b"), List.of("a"), new EarleyGrammarEngine());
		Grammar grammar = seedBuilder.build(List.of("ab", "a"));

		assertThat(scorer.score(grammar)).isEqualTo(scorer.score(grammar));
	}

	@Test
	void emptyExampleSetsAreNeutral() {
		FitnessScore fitness = new FitnessScore(0, 0, 0, 0);

		assertThat(fitness.overallScore()).isEqualTo(1.0);
	}

	@Test
	void compileFailureMatchesNothing() {
		when(engine.compile(anyString())).thenThrow(new GrammarCompileException("broken"));
		Scorer scorer = new Scorer(List.of("a", "b"), List.of("c"), engine);

		FitnessScore fitness = scorer.evaluate(seedBuilder.build(List.of("a")));

		assertThat(fitness.positivesMatched()).isZero();
		assertThat(fitness.negativesMatched()).isZero();
		assertThat(fitness.overallScore()).isCloseTo(0.25, within(1e-12));
	}

	@Test
	void parseFailuresOnlyAffectTheirOwnExample() {
		when(engine.compile(anyString())).thenReturn(parser);
		doThrow(new IllegalStateException("engine bug")).when(parser).parse("boom");
		Scorer scorer = new Scorer(List.of("ok", "boom", "fine"), List.of("boom"), engine);

		FitnessScore fitness = scorer.evaluate(seedBuilder.build(List.of("a")));

		assertThat(fitness.positivesMatched()).isEqualTo(2);
		assertThat(fitness.negativesMatched()).isZero();
		verify(parser, times(2)).parse("boom");
		verify(engine, times(1)).compile(anyString());
	}
}
