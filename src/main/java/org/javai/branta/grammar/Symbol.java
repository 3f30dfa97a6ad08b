package org.javai.branta.grammar;

import java.util.Objects;

/**
 * A symbol occurring in a rule body. Sealed so that every body element is either a
 * {@link Terminal} or a {@link Nonterminal}.
 * <p>
 * In the textual rendering terminals keep the quoting convention (a double-quoted literal)
 * and nonterminals appear as bare names.
 */
public sealed interface Symbol {

	/**
	 * The symbol as it appears in a rendered grammar.
	 */
	String render();

	static Terminal terminal(String literal) {
		return new Terminal(literal);
	}

	static Nonterminal nonterminal(String name) {
		return new Nonterminal(name);
	}

	/**
	 * A literal string matched verbatim against the input.
	 *
	 * @param literal the text to match, usually a single character
	 */
	record Terminal(String literal) implements Symbol {
		public Terminal {
			Objects.requireNonNull(literal, "literal must not be null");
		}

		@Override
		public String render() {
			StringBuilder sb = new StringBuilder(literal.length() + 2).append('"');
			for (char c : literal.toCharArray()) {
				switch (c) {
					case '"' -> sb.append("\\\"");
					case '\\' -> sb.append("\\\\");
					case '\n' -> sb.append("\\n");
					case '\r' -> sb.append("\\r");
					case '\t' -> sb.append("\\t");
					default -> sb.append(c);
				}
			}
			return sb.append('"').toString();
		}

		@Override
		public String toString() {
			return render();
		}
	}

	/**
	 * A reference to another rule of the grammar.
	 *
	 * @param name the referenced rule name
	 */
	record Nonterminal(String name) implements Symbol {
		public Nonterminal {
			Objects.requireNonNull(name, "name must not be null");
			if (name.isBlank()) {
				throw new IllegalArgumentException("Nonterminal name must not be blank");
			}
		}

		@Override
		public String render() {
			return name;
		}

		@Override
		public String toString() {
			return name;
		}
	}
}
