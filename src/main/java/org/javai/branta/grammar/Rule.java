package org.javai.branta.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A production rule: a nonterminal name and its ordered alternatives.
 * <p>
 * Alternative order has no effect on the accepted language but is kept so that renderings
 * are reproducible. A rule has at least one alternative; an alternative may be empty.
 *
 * @param name the nonterminal defined by this rule
 * @param bodies the alternatives, each an ordered symbol sequence
 */
public record Rule(String name, List<List<Symbol>> bodies) {

	public Rule {
		Objects.requireNonNull(name, "name must not be null");
		if (name.isBlank()) {
			throw new IllegalArgumentException("Rule name must not be blank");
		}
		if (bodies == null || bodies.isEmpty()) {
			throw new IllegalArgumentException("Rule '" + name + "' must have at least one body");
		}
		bodies = bodies.stream().map(List::copyOf).toList();
	}

	public static Rule of(String name, List<Symbol> body) {
		return new Rule(name, List.of(body));
	}

	/**
	 * Returns a copy of this rule with {@code body} appended as a new alternative.
	 */
	public Rule withBody(List<Symbol> body) {
		List<List<Symbol>> extended = new ArrayList<>(bodies);
		extended.add(body);
		return new Rule(name, extended);
	}

	public List<Symbol> body(int index) {
		return bodies.get(index);
	}

	public int bodyCount() {
		return bodies.size();
	}

	/**
	 * Renders the rule definition, one alternative per line.
	 */
	public String render() {
		StringBuilder sb = new StringBuilder();
		String indent = " ".repeat(name.length());
		for (int i = 0; i < bodies.size(); i++) {
			String alternative = renderBody(bodies.get(i));
			if (i == 0) {
				sb.append(name).append(':');
			}
			else {
				sb.append('\n').append(indent).append(" |");
			}
			if (!alternative.isEmpty()) {
				sb.append(' ').append(alternative);
			}
		}
		return sb.toString();
	}

	static String renderBody(List<Symbol> body) {
		return body.stream().map(Symbol::render).collect(Collectors.joining(" "));
	}
}
