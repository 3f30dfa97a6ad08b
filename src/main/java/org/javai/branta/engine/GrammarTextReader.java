package org.javai.branta.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.branta.grammar.Grammar;
import org.javai.branta.grammar.Rule;
import org.javai.branta.grammar.Symbol;

/**
 * Reads the textual grammar format produced by {@link Grammar#render()} back into a grammar.
 * <p>
 * The format has one definition per rule, {@code name: alternative}, with further alternatives
 * either separated by {@code |} on the same line or on continuation lines starting with
 * {@code |}. Terminals are double-quoted literals, nonterminals bare names. An alternative
 * without symbols is an empty body. Blank lines and lines starting with {@code //} are ignored.
 */
public class GrammarTextReader {

	/**
	 * Parses a grammar rendering.
	 *
	 * @throws GrammarCompileException if the text is malformed or the start rule is missing
	 */
	public Grammar read(String text) {
		if (text == null) {
			throw new GrammarCompileException("Grammar text must not be null");
		}
		Map<String, List<List<Symbol>>> definitions = new LinkedHashMap<>();
		String current = null;
		String[] lines = text.split("\r?\n", -1);
		for (int i = 0; i < lines.length; i++) {
			int lineNumber = i + 1;
			String line = lines[i].strip();
			if (line.isEmpty() || line.startsWith("//")) {
				continue;
			}
			if (line.charAt(0) == '|') {
				if (current == null) {
					throw new GrammarCompileException("Alternative without a rule at line " + lineNumber);
				}
				definitions.get(current).addAll(readAlternatives(line.substring(1), lineNumber));
				continue;
			}
			int colon = line.indexOf(':');
			if (colon <= 0) {
				throw new GrammarCompileException("Expected 'name:' at line " + lineNumber);
			}
			String name = line.substring(0, colon).strip();
			if (!isName(name)) {
				throw new GrammarCompileException("Invalid rule name '" + name + "' at line " + lineNumber);
			}
			if (definitions.containsKey(name)) {
				throw new GrammarCompileException("Rule '" + name + "' defined twice (line " + lineNumber + ")");
			}
			definitions.put(name, new ArrayList<>(readAlternatives(line.substring(colon + 1), lineNumber)));
			current = name;
		}
		return toGrammar(definitions);
	}

	private Grammar toGrammar(Map<String, List<List<Symbol>>> definitions) {
		List<List<Symbol>> start = definitions.get(Grammar.START);
		if (start == null) {
			throw new GrammarCompileException("Grammar has no '" + Grammar.START + "' rule");
		}
		if (start.size() != 1 || start.get(0).size() != 1
				|| !(start.get(0).get(0) instanceof Symbol.Nonterminal entry)) {
			throw new GrammarCompileException("The '" + Grammar.START + "' rule must be a single nonterminal");
		}
		Grammar.Builder builder = Grammar.builder(entry.name());
		definitions.forEach((name, bodies) -> {
			if (!Grammar.START.equals(name)) {
				builder.addOrReplaceRule(new Rule(name, bodies));
			}
		});
		return builder.build();
	}

	private List<List<Symbol>> readAlternatives(String text, int lineNumber) {
		List<List<Symbol>> alternatives = new ArrayList<>();
		List<Symbol> body = new ArrayList<>();
		int pos = 0;
		while (pos < text.length()) {
			char c = text.charAt(pos);
			if (Character.isWhitespace(c)) {
				pos++;
			}
			else if (c == '|') {
				alternatives.add(body);
				body = new ArrayList<>();
				pos++;
			}
			else if (c == '"') {
				StringBuilder literal = new StringBuilder();
				pos = readLiteral(text, pos + 1, literal, lineNumber);
				body.add(Symbol.terminal(literal.toString()));
			}
			else if (isNameStart(c)) {
				int end = pos + 1;
				while (end < text.length() && isNamePart(text.charAt(end))) {
					end++;
				}
				body.add(Symbol.nonterminal(text.substring(pos, end)));
				pos = end;
			}
			else {
				throw new GrammarCompileException("Unexpected character '" + c + "' at line " + lineNumber);
			}
		}
		alternatives.add(body);
		return alternatives;
	}

	private int readLiteral(String text, int pos, StringBuilder literal, int lineNumber) {
		while (pos < text.length()) {
			char c = text.charAt(pos);
			if (c == '"') {
				return pos + 1;
			}
			if (c == '\\') {
				if (pos + 1 >= text.length()) {
					break;
				}
				char escaped = text.charAt(pos + 1);
				switch (escaped) {
					case 'n' -> literal.append('\n');
					case 'r' -> literal.append('\r');
					case 't' -> literal.append('\t');
					case '"', '\\' -> literal.append(escaped);
					default -> throw new GrammarCompileException(
							"Unknown escape '\\" + escaped + "' at line " + lineNumber);
				}
				pos += 2;
			}
			else {
				literal.append(c);
				pos++;
			}
		}
		throw new GrammarCompileException("Unterminated literal at line " + lineNumber);
	}

	private static boolean isName(String name) {
		if (name.isEmpty() || !isNameStart(name.charAt(0))) {
			return false;
		}
		return name.chars().skip(1).allMatch(c -> isNamePart((char) c));
	}

	private static boolean isNameStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	private static boolean isNamePart(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}
}
