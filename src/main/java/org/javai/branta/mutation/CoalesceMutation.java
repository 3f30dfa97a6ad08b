package org.javai.branta.mutation;

import java.util.ArrayList;
import java.util.Collections;
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
 * Merges between two and five nonterminals into a single fresh one.
 * <p>
 * Every occurrence of a merged name is replaced by the fresh nonterminal, whose alternatives
 * are all the alternatives of the merged rules in sampling order. The merged rules are then
 * unreachable and dropped. Everything derivable before stays derivable; sites that referred to
 * different merged names become interchangeable.
 */
public class CoalesceMutation implements GrammarMutation {

	public static final String NAME = "coalesce";
	public static final int MIN_MERGED = 2;
	public static final int MAX_MERGED = 5;

	private final Random random;

	public CoalesceMutation(Random random) {
		this.random = Objects.requireNonNull(random, "random must not be null");
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public Grammar mutate(Grammar grammar) {
		List<String> names = new ArrayList<>(grammar.nonterminalNames());
		if (names.size() < MIN_MERGED) {
			throw new InsufficientNonterminalsException(NAME, MIN_MERGED, names.size());
		}
		int upper = Math.min(MAX_MERGED, names.size());
		int count = MIN_MERGED + random.nextInt(upper - MIN_MERGED + 1);
		Collections.shuffle(names, random);
		Set<String> merged = new LinkedHashSet<>(names.subList(0, count));

		String fresh = NameAllocator.fresh(grammar.rules().keySet());
		Symbol replacement = Symbol.nonterminal(fresh);

		Grammar.Builder builder = grammar.toBuilder();
		List<List<Symbol>> mergedBodies = new ArrayList<>();
		for (String name : merged) {
			for (List<Symbol> body : grammar.rules().get(name).bodies()) {
				mergedBodies.add(substitute(body, merged, replacement));
			}
			builder.removeRule(name);
		}
		for (Rule rule : grammar.rules().values()) {
			if (!merged.contains(rule.name())) {
				List<List<Symbol>> bodies = rule.bodies().stream()
						.map(body -> substitute(body, merged, replacement))
						.toList();
				builder.addOrReplaceRule(new Rule(rule.name(), bodies));
			}
		}
		builder.addOrReplaceRule(new Rule(fresh, mergedBodies));
		return builder.build();
	}

	private static List<Symbol> substitute(List<Symbol> body, Set<String> merged, Symbol replacement) {
		return body.stream()
				.map(symbol -> symbol instanceof Symbol.Nonterminal n && merged.contains(n.name()) ? replacement : symbol)
				.toList();
	}
}
