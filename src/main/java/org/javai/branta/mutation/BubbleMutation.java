package org.javai.branta.mutation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import org.javai.branta.grammar.Grammar;
import org.javai.branta.grammar.NameAllocator;
import org.javai.branta.grammar.Rule;
import org.javai.branta.grammar.Symbol;

/**
 * Extracts a subsequence of some body into a rule of its own.
 * <p>
 * One strict subsequence is drawn uniformly from those of any body that also occur as a
 * contiguous run in some body. A fresh nonterminal is defined with that subsequence as its
 * single body, and in every body the first contiguous occurrence is replaced by the fresh
 * nonterminal. Bodies without a contiguous occurrence are left alone, so the language never
 * changes and at least one body always refers to the fresh rule.
 */
public class BubbleMutation implements GrammarMutation {

	public static final String NAME = "bubble";
	public static final int DEFAULT_MAX_ENUMERATED_BODY_LENGTH = 10;

	private final Random random;
	private final int maxEnumeratedBodyLength;

	public BubbleMutation(Random random) {
		this(random, DEFAULT_MAX_ENUMERATED_BODY_LENGTH);
	}

	public BubbleMutation(Random random, int maxEnumeratedBodyLength) {
		if (maxEnumeratedBodyLength < 1 || maxEnumeratedBodyLength > 20) {
			throw new IllegalArgumentException("maxEnumeratedBodyLength must be between 1 and 20");
		}
		this.random = Objects.requireNonNull(random, "random must not be null");
		this.maxEnumeratedBodyLength = maxEnumeratedBodyLength;
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public Grammar mutate(Grammar grammar) {
		List<List<Symbol>> bodies = grammar.rules().values().stream()
				.flatMap(rule -> rule.bodies().stream())
				.toList();
		Set<List<Symbol>> candidates = new LinkedHashSet<>();
		for (List<Symbol> body : bodies) {
			candidates.addAll(Subsequences.strict(body, maxEnumeratedBodyLength));
		}
		List<List<Symbol>> choices = candidates.stream()
				.filter(candidate -> bodies.stream().anyMatch(body -> Subsequences.occursAsRun(body, candidate)))
				.toList();
		if (choices.isEmpty()) {
			return grammar.copy();
		}

		List<Symbol> extracted = choices.get(random.nextInt(choices.size()));
		String fresh = NameAllocator.fresh(grammar.rules().keySet());
		Symbol replacement = Symbol.nonterminal(fresh);

		Grammar.Builder builder = grammar.toBuilder();
		for (Rule rule : grammar.rules().values()) {
			List<List<Symbol>> rewritten = rule.bodies().stream()
					.map(body -> Subsequences.replaceFirstRun(body, extracted, replacement))
					.toList();
			builder.addOrReplaceRule(new Rule(rule.name(), rewritten));
		}
		builder.addOrReplaceRule(Rule.of(fresh, extracted));
		return builder.build();
	}
}
