package org.javai.branta.mutation;

import java.util.List;
import java.util.Random;
import org.javai.branta.grammar.Grammar;
import org.javai.branta.grammar.Rule;
import org.javai.branta.grammar.Symbol;

/**
 * Weighted choice of a mutation site shared by {@link AlternateMutation} and
 * {@link RepeatMutation}.
 * <p>
 * A rule is chosen with probability proportional to its number of alternatives, then one of its
 * alternatives and a position inside it uniformly. The start rule never takes part.
 */
final class MutationSites {

	private MutationSites() {
	}

	static MutationSite select(Grammar grammar, Random random, String mutation) {
		List<Rule> rules = grammar.nonterminalRules();
		int total = rules.stream().mapToInt(Rule::bodyCount).sum();
		if (total == 0) {
			throw new InsufficientNonterminalsException(mutation, 1, 0);
		}
		int draw = random.nextInt(total);
		Rule chosen = rules.get(rules.size() - 1);
		for (Rule rule : rules) {
			if (draw < rule.bodyCount()) {
				chosen = rule;
				break;
			}
			draw -= rule.bodyCount();
		}
		int bodyIndex = random.nextInt(chosen.bodyCount());
		List<Symbol> body = chosen.body(bodyIndex);
		if (body.isEmpty()) {
			throw new EmptyBodyException(mutation, chosen.name(), bodyIndex);
		}
		return new MutationSite(chosen.name(), bodyIndex, random.nextInt(body.size()));
	}

	/**
	 * Resolves a site against a grammar, checking that it exists.
	 */
	static List<Symbol> bodyAt(Grammar grammar, MutationSite site, String mutation) {
		Rule rule = grammar.rule(site.rule())
				.filter(r -> !Grammar.START.equals(r.name()))
				.orElseThrow(() -> new IllegalArgumentException("No mutable rule named " + site.rule()));
		if (site.bodyIndex() < 0 || site.bodyIndex() >= rule.bodyCount()) {
			throw new IllegalArgumentException("Rule " + site.rule() + " has no body " + site.bodyIndex());
		}
		List<Symbol> body = rule.body(site.bodyIndex());
		if (body.isEmpty()) {
			throw new EmptyBodyException(mutation, site.rule(), site.bodyIndex());
		}
		if (site.position() < 0 || site.position() >= body.size()) {
			throw new IllegalArgumentException("Position " + site.position() + " is outside body " + body);
		}
		return body;
	}
}
