package org.javai.branta.seed;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.branta.grammar.Grammar;
import org.javai.branta.grammar.NameAllocator;
import org.javai.branta.grammar.Rule;
import org.javai.branta.grammar.Symbol;

/**
 * Builds the initial grammar of a search: exactly the union of the guide strings.
 * <p>
 * Every distinct character gets a leaf rule {@code t<i>: "<c>"} (numbered in order of first
 * appearance) and the entry rule {@code t0} has one body per guide, spelling it out through the
 * leaf nonterminals.
 */
public class SeedGrammarBuilder {

	public static final String ENTRY = NameAllocator.name(0);

	public Grammar build(List<String> guides) {
		Objects.requireNonNull(guides, "guides must not be null");
		if (guides.isEmpty()) {
			throw new IllegalArgumentException("At least one guide is required");
		}

		Map<Integer, String> leaves = new LinkedHashMap<>();
		List<List<Symbol>> entryBodies = new ArrayList<>();
		for (String guide : guides) {
			Objects.requireNonNull(guide, "guides must not contain null");
			List<Symbol> body = new ArrayList<>();
			guide.codePoints().forEach(c -> {
				String leaf = leaves.computeIfAbsent(c, k -> NameAllocator.name(leaves.size() + 1));
				body.add(Symbol.nonterminal(leaf));
			});
			entryBodies.add(body);
		}

		Grammar.Builder builder = Grammar.builder(ENTRY);
		leaves.forEach((c, leaf) -> builder.addOrReplaceRule(
				Rule.of(leaf, List.of(Symbol.terminal(Character.toString(c))))));
		builder.addOrReplaceRule(new Rule(ENTRY, entryBodies));
		return builder.build();
	}
}
