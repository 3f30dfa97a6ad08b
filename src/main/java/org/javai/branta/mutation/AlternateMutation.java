package org.javai.branta.mutation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.javai.branta.grammar.Grammar;
import org.javai.branta.grammar.Symbol;

/**
 * Adds an alternative that differs from an existing one in a single position.
 * <p>
 * The replacement symbol is drawn uniformly from the grammar's alphabet minus the symbol it
 * replaces. The original alternative is kept, so the language can only grow.
 */
public class AlternateMutation implements GrammarMutation {

	public static final String NAME = "alternate";

	private final Random random;

	public AlternateMutation(Random random) {
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
		Symbol current = body.get(site.position());

		List<Symbol> alternatives = new ArrayList<>(grammar.alphabet());
		alternatives.remove(current);
		if (alternatives.isEmpty()) {
			throw new NoAlternativeSymbolException(NAME, current);
		}
		List<Symbol> alternate = new ArrayList<>(body);
		alternate.set(site.position(), alternatives.get(random.nextInt(alternatives.size())));

		return grammar.toBuilder()
				.addBody(site.rule(), alternate)
				.build();
	}
}
