package edu.isi.kazakhfst;

import org.junit.jupiter.api.Test;

import static edu.isi.kazakhfst.Pattern.anyOf;
import static edu.isi.kazakhfst.Pattern.bos;
import static edu.isi.kazakhfst.Pattern.empty;
import static edu.isi.kazakhfst.Pattern.eos;
import static edu.isi.kazakhfst.Pattern.literal;
import static edu.isi.kazakhfst.RuleFixtures.apply;
import static edu.isi.kazakhfst.SubstitutionMap.cross;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RewriteCompilerTest {

	@Test
	void shouldPassThroughWhenNothingMatches() throws Exception {
		RewriteRule r = RewriteRule.obligatory("a-to-b", cross("a", "b"), literal("c"), empty());
		assertThat(apply("dd", r)).isEqualTo("dd");
		assertThat(apply("ad", r)).isEqualTo("ad");
		assertThat(apply("", r)).isEqualTo("");
	}

	@Test
	void shouldRewriteEveryOccurrenceInLeftContext() throws Exception {
		RewriteRule r = RewriteRule.obligatory("a-to-b", cross("a", "b"), literal("c"), empty());
		assertThat(apply("cac", r)).isEqualTo("cbc");
		assertThat(apply("acaca", r)).isEqualTo("acbcb");
	}

	@Test
	void shouldMatchLeftContextAgainstRewrittenOutput() throws Exception {
		// the second a sees the c written for the first one
		RewriteRule r = RewriteRule.obligatory("a-to-c", cross("a", "c"), literal("c"), empty());
		assertThat(apply("caa", r)).isEqualTo("ccc");
	}

	@Test
	void shouldMatchRightContextAgainstInput() throws Exception {
		RewriteRule r = RewriteRule.obligatory("a-to-b", cross("a", "b"), empty(), literal("c"));
		assertThat(apply("aac", r)).isEqualTo("abc");
		assertThat(apply("aca", r)).isEqualTo("bca");
	}

	@Test
	void shouldHonorWordBoundaries() throws Exception {
		RewriteRule initial = RewriteRule.obligatory("initial", cross("a", "b"), bos(), empty());
		RewriteRule last = RewriteRule.obligatory("final", cross("a", "b"), empty(), eos());
		assertThat(apply("aaa", initial)).isEqualTo("baa");
		assertThat(apply("aaa", last)).isEqualTo("aab");
		assertThat(apply("a", initial)).isEqualTo("b");
	}

	@Test
	void shouldNotOverlapMatches() throws Exception {
		RewriteRule r = RewriteRule.obligatory("aa-to-b", cross("aa", "b"), empty(), empty());
		assertThat(apply("aaa", r)).isEqualTo("ba");
		assertThat(apply("aaaa", r)).isEqualTo("bb");
	}

	@Test
	void shouldDeleteWithEmptyOutput() throws Exception {
		RewriteRule r = RewriteRule.obligatory("drop-b", cross("b", ""), empty(), empty());
		assertThat(apply("abcb", r)).isEqualTo("ac");
	}

	@Test
	void shouldApplyWholeMapInOnePass() throws Exception {
		SubstitutionMap m = SubstitutionMap.builder()
				.add("ab", "d")
				.add("c", "a")
				.build();
		RewriteRule r = RewriteRule.obligatory("map", m, empty(), empty());
		// c becomes a, but the new a is output and can't start an ab match
		assertThat(apply("abcab", r)).isEqualTo("dad");
		assertThat(apply("cb", r)).isEqualTo("ab");
	}

	@Test
	void shouldInsertLongerOutputs() throws Exception {
		RewriteRule r = RewriteRule.obligatory("a-to-dcb", cross("a", "dcb"), empty(), empty());
		assertThat(apply("bab", r)).isEqualTo("bdcbb");
	}

	@Test
	void shouldKeepBothPathsForOptionalRules() throws Exception {
		// the rewrite costs something, so the untouched path wins
		SubstitutionMap costly = SubstitutionMap.builder().add("a", "b", 1.0).build();
		assertThat(apply("a", RewriteRule.optional("maybe", costly, empty(), empty()))).isEqualTo("a");
		assertThat(apply("a", RewriteRule.obligatory("must", costly, empty(), empty()))).isEqualTo("b");
	}

	@Test
	void shouldPreferLongestInput() throws Exception {
		SubstitutionMap m = SubstitutionMap.builder()
				.add("a", "b")
				.add("ab", "c")
				.build();
		RewriteRule r = RewriteRule.obligatory("a-or-ab", m, empty(), empty());
		assertThat(apply("abd", r)).isEqualTo("cd");
		assertThat(apply("ad", r)).isEqualTo("bd");
		assertThat(apply("aab", r)).isEqualTo("bc");
		assertThat(apply("abab", r)).isEqualTo("cc");
	}

	@Test
	void shouldTakeShorterInputWhenLongerOneLacksRightContext() throws Exception {
		SubstitutionMap m = SubstitutionMap.builder()
				.add("a", "d")
				.add("ab", "c")
				.build();
		RewriteRule r = RewriteRule.obligatory("before-b-or-c", m, empty(), anyOf("b", "c"));
		assertThat(apply("abc", r)).isEqualTo("cc");
		assertThat(apply("abd", r)).isEqualTo("dbd");
		assertThat(apply("aa", r)).isEqualTo("aa");
	}

	@Test
	void shouldPreferLongestOfSeveralNestedInputs() throws Exception {
		SubstitutionMap m = SubstitutionMap.builder()
				.add("a", "b")
				.add("ab", "c")
				.add("abc", "d")
				.build();
		RewriteRule r = RewriteRule.obligatory("nested", m, empty(), empty());
		assertThat(apply("abcd", r)).isEqualTo("dd");
		assertThat(apply("abd", r)).isEqualTo("cd");
		assertThat(apply("ad", r)).isEqualTo("bd");
		SubstitutionMap pairs = SubstitutionMap.builder()
				.add("a", "b")
				.add("aa", "c")
				.build();
		assertThat(apply("aaa", RewriteRule.obligatory("pairs", pairs, empty(), empty()))).isEqualTo("cb");
	}

	@Test
	void shouldRejectDuplicateAndEmptyInputs() {
		SubstitutionMap dup = SubstitutionMap.builder()
				.add("a", "b")
				.add("a", "c")
				.build();
		assertThatThrownBy(() -> RewriteCompiler.compile(RewriteRule.obligatory("dup", dup, empty(), empty()),
				RuleFixtures.letters()))
				.isInstanceOf(ConflictingSubstitutionException.class);
		assertThatThrownBy(() -> RewriteCompiler.compile(RewriteRule.obligatory("empty", cross("", "b"), empty(), empty()),
				RuleFixtures.letters()))
				.isInstanceOf(ConflictingSubstitutionException.class);
	}

	@Test
	void shouldRejectSymbolsOutsideAlphabet() {
		RewriteRule r = RewriteRule.obligatory("x-to-a", cross("x", "a"), empty(), empty());
		assertThatThrownBy(() -> RewriteCompiler.compile(r, RuleFixtures.letters()))
				.isInstanceOf(AlphabetMismatchException.class)
				.hasMessageContaining("x-to-a");
	}

	@Test
	void shouldRejectNegativeWeights() {
		assertThatThrownBy(() -> SubstitutionMap.builder().add("a", "b", -1.0))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void shouldBeTotalOverSigmaStar() throws Exception {
		Alphabet alph = RuleFixtures.letters();
		Automaton a = RewriteCompiler.compile(
				RewriteRule.obligatory("a-to-b", cross("a", "b"), literal("c"), empty()), alph);
		assertThat(a.isFinal(a.getStart())).isTrue();
		assertThat(a.getInputAlphabet()).isEqualTo(alph);
	}
}
