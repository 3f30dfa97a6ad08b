package org.javai.branta.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.branta.grammar.Grammar;
import org.javai.branta.grammar.Rule;
import org.javai.branta.grammar.Symbol;

/**
 * Earley recognizer over the characters of the input.
 * <p>
 * Terminals may span several characters and bodies may be empty; nullable nonterminals are
 * advanced over at prediction time so completions of empty derivations are never missed.
 * Every processed item counts against a step budget.
 */
public class EarleyParser implements GrammarParser {

	private final List<Production> productions = new ArrayList<>();
	private final Map<String, List<Integer>> productionsByLhs = new HashMap<>();
	private final Set<String> nullable;
	private final long maxSteps;

	EarleyParser(Grammar grammar, long maxSteps) {
		this.maxSteps = maxSteps;
		for (Rule rule : grammar.rules().values()) {
			for (List<Symbol> body : rule.bodies()) {
				productionsByLhs.computeIfAbsent(rule.name(), k -> new ArrayList<>()).add(productions.size());
				productions.add(new Production(rule.name(), body));
			}
		}
		this.nullable = computeNullable();
	}

	@Override
	public void parse(String input) throws GrammarParseException {
		if (input == null) {
			throw new GrammarParseException("Input must not be null", 0);
		}
		Chart chart = new Chart(input.length());
		for (int p : productionsByLhs.getOrDefault(Grammar.START, List.of())) {
			chart.add(0, new Item(p, 0, 0));
		}

		long steps = 0;
		int furthest = 0;
		for (int i = 0; i <= input.length() && i <= furthest; i++) {
			List<Item> items = chart.items(i);
			for (int k = 0; k < items.size(); k++) {
				if (++steps > maxSteps) {
					throw new ParseBudgetExceededException(maxSteps, i);
				}
				Item item = items.get(k);
				Production production = productions.get(item.production());
				if (item.dot() == production.body().size()) {
					complete(chart, i, item, production.lhs());
				}
				else {
					Symbol next = production.body().get(item.dot());
					if (next instanceof Symbol.Nonterminal nonterminal) {
						predict(chart, i, item, nonterminal.name());
					}
					else if (next instanceof Symbol.Terminal terminal && input.startsWith(terminal.literal(), i)) {
						int end = i + terminal.literal().length();
						chart.add(end, item.advance());
						furthest = Math.max(furthest, end);
					}
				}
			}
		}

		if (!chart.accepts(input.length())) {
			int position = Math.min(furthest, input.length());
			throw new GrammarParseException("Input rejected at offset " + position, position);
		}
	}

	private void predict(Chart chart, int i, Item item, String nonterminal) {
		for (int p : productionsByLhs.getOrDefault(nonterminal, List.of())) {
			chart.add(i, new Item(p, 0, i));
		}
		if (nullable.contains(nonterminal)) {
			chart.add(i, item.advance());
		}
	}

	private void complete(Chart chart, int i, Item item, String lhs) {
		List<Item> waiting = chart.waiting(item.origin(), lhs);
		for (int k = 0; k < waiting.size(); k++) {
			chart.add(i, waiting.get(k).advance());
		}
	}

	private Set<String> computeNullable() {
		Set<String> result = new HashSet<>();
		boolean changed = true;
		while (changed) {
			changed = false;
			for (Production production : productions) {
				if (result.contains(production.lhs())) {
					continue;
				}
				boolean empty = production.body().stream().allMatch(symbol ->
						symbol instanceof Symbol.Nonterminal n ? result.contains(n.name())
								: ((Symbol.Terminal) symbol).literal().isEmpty());
				if (empty) {
					result.add(production.lhs());
					changed = true;
				}
			}
		}
		return result;
	}

	private record Production(String lhs, List<Symbol> body) {
	}

	private record Item(int production, int dot, int origin) {
		Item advance() {
			return new Item(production, dot + 1, origin);
		}
	}

	/**
	 * Earley sets, each with an index of the items waiting on a nonterminal.
	 */
	private final class Chart {

		private final List<List<Item>> sets = new ArrayList<>();
		private final List<Set<Item>> seen = new ArrayList<>();
		private final List<Map<String, List<Item>>> waiting = new ArrayList<>();

		Chart(int length) {
			for (int i = 0; i <= length; i++) {
				sets.add(new ArrayList<>());
				seen.add(new LinkedHashSet<>());
				waiting.add(new HashMap<>());
			}
		}

		void add(int i, Item item) {
			if (!seen.get(i).add(item)) {
				return;
			}
			sets.get(i).add(item);
			List<Symbol> body = productions.get(item.production()).body();
			if (item.dot() < body.size() && body.get(item.dot()) instanceof Symbol.Nonterminal next) {
				waiting.get(i).computeIfAbsent(next.name(), k -> new ArrayList<>()).add(item);
			}
		}

		List<Item> items(int i) {
			return sets.get(i);
		}

		List<Item> waiting(int i, String nonterminal) {
			return waiting.get(i).getOrDefault(nonterminal, List.of());
		}

		boolean accepts(int end) {
			for (Item item : sets.get(end)) {
				Production production = productions.get(item.production());
				if (item.origin() == 0 && Grammar.START.equals(production.lhs())
						&& item.dot() == production.body().size()) {
					return true;
				}
			}
			return false;
		}
	}
}
