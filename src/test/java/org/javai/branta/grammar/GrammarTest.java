package org.javai.branta.grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.branta.grammar.Symbol.nonterminal;
import static org.javai.branta.grammar.Symbol.terminal;

import java.util.List;
import org.junit.jupiter.api.Test;

class GrammarTest {

	private static Grammar abGrammar() {
		return Grammar.builder("t0")
				.addOrReplaceRule(Rule.of("t1", List.of(terminal("a"))))
				.addOrReplaceRule(Rule.of("t2", List.of(terminal("b"))))
				.addOrReplaceRule(new Rule("t0", List.of(
						List.of(nonterminal("t1"), nonterminal("t2")),
						List.of(nonterminal("t2")))))
				.build();
	}

	@Test
	void rendersStartRuleFirstAndAlternativesOnContinuationLines() {
		assertThat(abGrammar().render()).isEqualTo("""
				start: t0
				t1: "a"
				t2: "b"
				t0: t1 t2
				   | t2
				""");
	}

	@Test
	void rendersEscapedTerminalsAndEmptyAlternatives() {
		Grammar grammar = Grammar.builder("t0")
				.addOrReplaceRule(new Rule("t0", List.of(
						List.of(terminal("\"")),
						List.of(),
						List.of(terminal("\\"), terminal("\n")))))
				.build();

		assertThat(grammar.render()).isEqualTo("""
				start: t0
				t0: "\\""
				   |
				   | "\\\\" "\\n"
				""");
	}

	@Test
	void renderingIsComputedOncePerSnapshot() {
		Grammar grammar = abGrammar();

		assertThat(grammar.render()).isSameAs(grammar.render());
	}

	@Test
	void entryFollowsTheStartRule() {
		Grammar grammar = abGrammar();
		Grammar redirected = grammar.withRule(Rule.of(Grammar.START, List.of(nonterminal("t2"))));

		assertThat(grammar.entry()).isEqualTo("t0");
		assertThat(redirected.entry()).isEqualTo("t2");
		assertThat(redirected.rules().keySet()).first().isEqualTo(Grammar.START);
	}

	@Test
	void builderEditsNeverReachTheOriginal() {
		Grammar original = abGrammar();
		String before = original.render();

		Grammar edited = original.toBuilder()
				.addBody("t1", List.of(terminal("c")))
				.removeRule("t2")
				.build();

		assertThat(original.render()).isEqualTo(before);
		assertThat(original.rule("t2")).isPresent();
		assertThat(edited.rule("t1").orElseThrow().bodyCount()).isEqualTo(2);
		assertThat(edited.rule("t2")).isEmpty();
	}

	@Test
	void copyIsEqualButIndependent() {
		Grammar original = abGrammar();
		Grammar copy = original.copy();

		assertThat(copy).isNotSameAs(original).isEqualTo(original);
		assertThat(copy.withRule(Rule.of("t3", List.of(terminal("c"))))).isNotEqualTo(original);
		assertThat(original.rule("t3")).isEmpty();
	}

	@Test
	void alphabetListsTerminalsThenNonterminalsWithoutStart() {
		assertThat(abGrammar().alphabet()).containsExactly(
				terminal("a"), terminal("b"),
				nonterminal("t1"), nonterminal("t2"), nonterminal("t0"));
	}

	@Test
	void reportsUndefinedNonterminals() {
		Grammar grammar = Grammar.builder("t0")
				.addOrReplaceRule(Rule.of("t0", List.of(nonterminal("t9"), terminal("x"))))
				.build();

		assertThat(grammar.undefinedNonterminals()).containsExactly("t9");
		assertThat(abGrammar().undefinedNonterminals()).isEmpty();
	}

	@Test
	void countsAlternativesOutsideStart() {
		assertThat(abGrammar().bodyCount()).isEqualTo(4);
		assertThat(abGrammar().nonterminalNames()).containsExactly("t1", "t2", "t0");
	}

	@Test
	void startRuleCannotBeRemovedOrWidened() {
		Grammar.Builder builder = abGrammar().toBuilder();

		assertThatThrownBy(() -> builder.removeRule(Grammar.START))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> builder.addBody(Grammar.START, List.of(nonterminal("t1"))).build())
				.isInstanceOf(IllegalStateException.class);
	}

	@Test
	void rulesNeedAtLeastOneAlternative() {
		assertThatThrownBy(() -> new Rule("t0", List.of()))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("t0");
	}

	@Test
	void freshNamesAvoidTakenOnes() {
		assertThat(NameAllocator.fresh(List.of("start", "t0", "t1"))).isEqualTo("t3");
		assertThat(NameAllocator.fresh(List.of("start", "t0", "t3", "t4"))).isEqualTo("t5");
		assertThat(NameAllocator.fresh(List.of("start", "t7"))).isEqualTo("t2");
	}
}
