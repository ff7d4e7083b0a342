package edu.isi.kazakhfst;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import static edu.isi.kazakhfst.Pattern.empty;
import static edu.isi.kazakhfst.SubstitutionMap.cross;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CascadeComposerTest {

	private static final RewriteRule A_TO_B = RewriteRule.obligatory("a-to-b", cross("a", "b"), empty(), empty());
	private static final RewriteRule B_TO_C = RewriteRule.obligatory("b-to-c", cross("b", "c"), empty(), empty());

	@Test
	void shouldApplyRulesInOrder() throws Exception {
		assertThat(RuleFixtures.apply("a", A_TO_B, B_TO_C)).isEqualTo("c");
		assertThat(RuleFixtures.apply("a", B_TO_C, A_TO_B)).isEqualTo("b");
		assertThat(RuleFixtures.apply("ab", B_TO_C, A_TO_B)).isEqualTo("bc");
	}

	@Test
	void shouldComposePairLikeList() throws Exception {
		Alphabet alph = RuleFixtures.letters();
		Automaton ab = RewriteCompiler.compile(A_TO_B, alph);
		Automaton bc = RewriteCompiler.compile(B_TO_C, alph);
		Automaton pair = CascadeComposer.compose(ab, bc);
		Automaton list = CascadeComposer.compose(Arrays.asList(ab, bc));
		assertThat(pair.toString()).isEqualTo(list.toString());
	}

	@Test
	void shouldBeAssociative() throws Exception {
		Alphabet alph = RuleFixtures.letters();
		Automaton ab = RewriteCompiler.compile(A_TO_B, alph);
		Automaton bc = RewriteCompiler.compile(B_TO_C, alph);
		Automaton da = RewriteCompiler.compile(RewriteRule.obligatory("d-to-a", cross("d", "a"), empty(), empty()), alph);
		Automaton left = CascadeComposer.compose(CascadeComposer.compose(da, ab), bc);
		Automaton right = CascadeComposer.compose(da, CascadeComposer.compose(ab, bc));
		CompiledCascade l = new CompiledCascade("left", left, 3);
		CompiledCascade r = new CompiledCascade("right", right, 3);
		for (String w : new String[] {"", "a", "dab", "cdcd", "abcd"})
			assertThat(Resolver.resolve(l, w)).isEqualTo(Resolver.resolve(r, w));
		assertThat(Resolver.resolve(l, "dab")).isEqualTo("ccc");
	}

	@Test
	void shouldRejectAutomataOverDifferentTables() throws Exception {
		Automaton a = RewriteCompiler.compile(A_TO_B, RuleFixtures.letters());
		Automaton b = RewriteCompiler.compile(B_TO_C, RuleFixtures.letters());
		assertThatThrownBy(() -> CascadeComposer.compose(a, b))
				.isInstanceOf(AlphabetMismatchException.class);
	}

	@Test
	void shouldRejectOutputsTheNextCantRead() throws Exception {
		Alphabet alph = RuleFixtures.letters();
		Alphabet ab = alph.restrictToInventory("ab", "a", "b");
		Automaton rule = RewriteCompiler.compile(A_TO_B, alph);
		Automaton onlyAb = PatternCompiler.compile(Pattern.star(Pattern.anyOf("a", "b")), alph).withAlphabets(ab, ab);
		Automaton ok = CascadeComposer.compose(onlyAb, rule);
		assertThat(ok.getInputAlphabet()).isEqualTo(ab);
		assertThatThrownBy(() -> CascadeComposer.compose(Arrays.asList(onlyAb, rule, onlyAb)))
				.isInstanceOf(AlphabetMismatchException.class)
				.hasMessageContaining("not contained");
	}

	@Test
	void shouldFailOnEmptyComposition() throws Exception {
		Alphabet alph = RuleFixtures.letters();
		Automaton onlyA = PatternCompiler.compile(Pattern.literal("a"), alph);
		Automaton onlyB = PatternCompiler.compile(Pattern.literal("b"), alph);
		assertThatThrownBy(() -> CascadeComposer.compose(onlyA, onlyB))
				.isInstanceOf(EmptyLanguageException.class);
	}
}
