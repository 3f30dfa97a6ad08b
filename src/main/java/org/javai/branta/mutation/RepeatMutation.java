package org.javai.branta.mutation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.javai.branta.grammar.Grammar;
import org.javai.branta.grammar.NameAllocator;
import org.javai.branta.grammar.Rule;
import org.javai.branta.grammar.Symbol;

/**
 * Lets one occurrence of a symbol repeat.
 * <p>
 * The symbol {@code x} at the chosen site is replaced by a fresh nonterminal {@code R} defined as
 * {@code R: x | x R}. The single occurrence stays derivable through the first alternative.
 */
public class RepeatMutation implements GrammarMutation {

	public static final String NAME = "repeat";

	private final Random random;

	public RepeatMutation(Random random) {
		this.random = Objects.requireNonNull(random, "random must not be null");
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public Grammar mutate(Grammar grammar) {
		return mutateAt(grammar, MutationSites.select(grammar, random, NAME));
	}

	/**
	 * Applies the mutation at an explicit site.
	 */
	public Grammar mutateAt(Grammar grammar, MutationSite site) {
		List<Symbol> body = MutationSites.bodyAt(grammar, site, NAME);
		Symbol repeated = body.get(site.position());
		String fresh = NameAllocator.fresh(grammar.rules().keySet());
		Symbol repeater = Symbol.nonterminal(fresh);

		Rule rule = grammar.rules().get(site.rule());
		List<List<Symbol>> bodies = new ArrayList<>(rule.bodies());
		List<Symbol> replaced = new ArrayList<>(body);
		replaced.set(site.position(), repeater);
		bodies.set(site.bodyIndex(), replaced);

		return grammar.toBuilder()
				.addOrReplaceRule(new Rule(rule.name(), bodies))
				.addOrReplaceRule(new Rule(fresh, List.of(List.of(repeated), List.of(repeated, repeater))))
				.build();
	}
}
