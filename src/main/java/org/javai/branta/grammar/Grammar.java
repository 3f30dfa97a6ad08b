package org.javai.branta.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of a context-free grammar.
 * <p>
 * A grammar always carries the distinguished {@value #START} rule whose single body is the
 * singleton sequence {@code [entry]}, so the execution engine sees a fixed top-level production
 * whichever nonterminal currently acts as the semantic entry point.
 * <p>
 * Snapshots are never edited. Structural changes go through a {@link Builder} obtained from
 * {@link #toBuilder()}, which produces a fresh snapshot; the rendering is therefore memoized
 * without any invalidation.
 *
 * <pre>
 * Grammar grammar = Grammar.builder("t0")
 *     .addOrReplaceRule(Rule.of("t0", List.of(Symbol.nonterminal("t1"))))
 *     .addOrReplaceRule(Rule.of("t1", List.of(Symbol.terminal("a"))))
 *     .build();
 * String text = grammar.render();
 * </pre>
 */
public final class Grammar {

	public static final String START = "start";

	private final Map<String, Rule> rules;
	private String rendering;

	private Grammar(Map<String, Rule> rules) {
		this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
	}

	/**
	 * Creates a builder whose start rule refers to {@code entry}.
	 */
	public static Builder builder(String entry) {
		return new Builder(entry);
	}

	/**
	 * The nonterminal referenced by the start rule.
	 */
	public String entry() {
		List<Symbol> body = rules.get(START).body(0);
		return body.get(0).render();
	}

	public Map<String, Rule> rules() {
		return rules;
	}

	public Optional<Rule> rule(String name) {
		return Optional.ofNullable(rules.get(name));
	}

	/**
	 * All rule names except {@value #START}, in definition order.
	 */
	public List<String> nonterminalNames() {
		return rules.keySet().stream()
				.filter(name -> !START.equals(name))
				.toList();
	}

	/**
	 * Rules other than the start rule, in definition order.
	 */
	public List<Rule> nonterminalRules() {
		return rules.values().stream()
				.filter(rule -> !START.equals(rule.name()))
				.toList();
	}

	/**
	 * Every distinct symbol a body may use: the terminals occurring in any body followed by the
	 * nonterminal names. The start rule is excluded.
	 */
	public Set<Symbol> alphabet() {
		Set<Symbol> alphabet = new LinkedHashSet<>();
		for (Rule rule : rules.values()) {
			for (List<Symbol> body : rule.bodies()) {
				for (Symbol symbol : body) {
					if (symbol instanceof Symbol.Terminal) {
						alphabet.add(symbol);
					}
				}
			}
		}
		for (String name : nonterminalNames()) {
			alphabet.add(Symbol.nonterminal(name));
		}
		return Collections.unmodifiableSet(alphabet);
	}

	/**
	 * Nonterminals referenced from some body without a defining rule.
	 */
	public Set<String> undefinedNonterminals() {
		Set<String> undefined = new LinkedHashSet<>();
		for (Rule rule : rules.values()) {
			for (List<Symbol> body : rule.bodies()) {
				for (Symbol symbol : body) {
					if (symbol instanceof Symbol.Nonterminal nonterminal && !rules.containsKey(nonterminal.name())) {
						undefined.add(nonterminal.name());
					}
				}
			}
		}
		return undefined;
	}

	/**
	 * Total number of alternatives across all non-start rules.
	 */
	public int bodyCount() {
		return nonterminalRules().stream().mapToInt(Rule::bodyCount).sum();
	}

	/**
	 * Returns a snapshot with {@code rule} added, or replacing the rule of the same name.
	 */
	public Grammar withRule(Rule rule) {
		return toBuilder().addOrReplaceRule(rule).build();
	}

	/**
	 * Returns an independent copy of this grammar.
	 */
	public Grammar copy() {
		return new Grammar(rules);
	}

	/**
	 * Returns a mutable working copy. Changes made through it never affect this snapshot.
	 */
	public Builder toBuilder() {
		Builder builder = new Builder(entry());
		builder.rules.clear();
		builder.rules.putAll(rules);
		return builder;
	}

	/**
	 * Renders the grammar in the text format read by the execution engine. The result is
	 * computed once per snapshot.
	 */
	public String render() {
		String text = rendering;
		if (text == null) {
			text = rules.values().stream()
					.map(Rule::render)
					.collect(Collectors.joining("\n", "", "\n"));
			rendering = text;
		}
		return text;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Grammar other)) {
			return false;
		}
		return rules.equals(other.rules);
	}

	@Override
	public int hashCode() {
		return rules.hashCode();
	}

	@Override
	public String toString() {
		return render();
	}

	/**
	 * Mutable working copy of a grammar. The start rule is always kept first.
	 */
	public static final class Builder {

		private final Map<String, Rule> rules = new LinkedHashMap<>();

		private Builder(String entry) {
			Objects.requireNonNull(entry, "entry must not be null");
			rules.put(START, Rule.of(START, List.of(Symbol.nonterminal(entry))));
		}

		public Builder addOrReplaceRule(Rule rule) {
			Objects.requireNonNull(rule, "rule must not be null");
			rules.put(rule.name(), rule);
			return this;
		}

		/**
		 * Appends an alternative to an existing rule.
		 *
		 * @throws IllegalArgumentException if no rule named {@code name} exists
		 */
		public Builder addBody(String name, List<Symbol> body) {
			Rule rule = rules.get(name);
			if (rule == null) {
				throw new IllegalArgumentException("Unknown rule: " + name);
			}
			rules.put(name, rule.withBody(body));
			return this;
		}

		public Builder removeRule(String name) {
			if (START.equals(name)) {
				throw new IllegalArgumentException("The start rule cannot be removed");
			}
			rules.remove(name);
			return this;
		}

		public Grammar build() {
			Rule start = rules.get(START);
			if (start == null || start.bodyCount() != 1 || start.body(0).size() != 1) {
				throw new IllegalStateException("Start rule must have exactly one single-symbol body");
			}
			return new Grammar(rules);
		}
	}
}
