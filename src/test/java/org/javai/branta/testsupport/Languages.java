package org.javai.branta.testsupport;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.javai.branta.engine.EarleyGrammarEngine;
import org.javai.branta.engine.GrammarParser;
import org.javai.branta.grammar.Grammar;
import org.javai.branta.grammar.Symbol;

/**
 * Compares grammar languages on all strings up to a bounded length.
 */
public final class Languages {

	private static final EarleyGrammarEngine ENGINE = new EarleyGrammarEngine();

	private Languages() {
	}

	/**
	 * Every string over {@code alphabet} with length at most {@code maxLength}, the empty string included.
	 */
	public static List<String> strings(Set<Character> alphabet, int maxLength) {
		List<String> result = new ArrayList<>();
		result.add("");
		List<String> previous = List.of("");
		for (int length = 1; length <= maxLength; length++) {
			List<String> next = new ArrayList<>();
			for (String prefix : previous) {
				for (char c : alphabet) {
					next.add(prefix + c);
				}
			}
			result.addAll(next);
			previous = next;
		}
		return result;
	}

	/**
	 * Characters of every terminal in the grammar.
	 */
	public static Set<Character> characters(Grammar grammar) {
		Set<Character> characters = new TreeSet<>();
		for (Symbol symbol : grammar.alphabet()) {
			if (symbol instanceof Symbol.Terminal terminal) {
				terminal.literal().chars().forEach(c -> characters.add((char) c));
			}
		}
		return characters;
	}

	/**
	 * The strings among {@code candidates} accepted by {@code grammar}.
	 */
	public static Set<String> accepted(Grammar grammar, List<String> candidates) {
		GrammarParser parser = ENGINE.compile(grammar);
		Set<String> accepted = new TreeSet<>();
		for (String candidate : candidates) {
			if (parser.accepts(candidate)) {
				accepted.add(candidate);
			}
		}
		return accepted;
	}
}
