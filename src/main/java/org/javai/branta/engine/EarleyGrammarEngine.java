package org.javai.branta.engine;

import java.util.Set;
import org.javai.branta.grammar.Grammar;

/**
 * {@link GrammarEngine} that reads renderings with {@link GrammarTextReader} and recognizes
 * inputs with an {@link EarleyParser}.
 * <p>
 * Compilation rejects grammars that refer to undefined nonterminals. Each parse is bounded by a
 * step budget; exhausting it raises {@link ParseBudgetExceededException}.
 */
public class EarleyGrammarEngine implements GrammarEngine {

	public static final long DEFAULT_MAX_STEPS = 200_000;

	private final GrammarTextReader reader = new GrammarTextReader();
	private final long maxSteps;

	public EarleyGrammarEngine() {
		this(DEFAULT_MAX_STEPS);
	}

	public EarleyGrammarEngine(long maxSteps) {
		if (maxSteps <= 0) {
			throw new IllegalArgumentException("maxSteps must be positive");
		}
		this.maxSteps = maxSteps;
	}

	@Override
	public GrammarParser compile(String rendering) throws GrammarCompileException {
		Grammar grammar;
		try {
			grammar = reader.read(rendering);
		}
		catch (GrammarCompileException e) {
			throw e;
		}
		catch (RuntimeException e) {
			throw new GrammarCompileException("Failed to read grammar: " + e.getMessage(), e);
		}
		Set<String> undefined = grammar.undefinedNonterminals();
		if (!undefined.isEmpty()) {
			throw new GrammarCompileException("Undefined nonterminals: " + undefined);
		}
		return new EarleyParser(grammar, maxSteps);
	}

	/**
	 * Compiles a grammar through its rendering.
	 */
	public GrammarParser compile(Grammar grammar) throws GrammarCompileException {
		return compile(grammar.render());
	}

	public long maxSteps() {
		return maxSteps;
	}
}
