package edu.isi.kazakhfst;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static edu.isi.kazakhfst.Pattern.empty;
import static edu.isi.kazakhfst.Pattern.literal;
import static edu.isi.kazakhfst.SubstitutionMap.cross;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ResolverTest {

	private static CompiledCascade cascade;

	@BeforeAll
	static void compile() throws Exception {
		cascade = RuleFixtures.cascade(
				RewriteRule.obligatory("ab-to-c", cross("ab", "c"), empty(), empty()),
				RewriteRule.obligatory("c-to-d", cross("c", "d"), literal("d"), empty()));
	}

	@Test
	void shouldResolveStrings() throws Exception {
		assertThat(Resolver.resolve(cascade, "abab")).isEqualTo("cc");
		assertThat(Resolver.resolve(cascade, "dab")).isEqualTo("dd");
		assertThat(Resolver.resolve(cascade, "")).isEqualTo("");
	}

	@Test
	void shouldResolveSymbolLists() throws Exception {
		List<Symbol> in = cascade.getInputAlphabet().tokenize("dabc");
		List<Symbol> out = Resolver.resolve(cascade, in);
		assertThat(out).extracting(Symbol::getText).containsExactly("d", "d", "d");
		for (Symbol s : out)
			assertThat(cascade.getOutputAlphabet().contains(s)).isTrue();
	}

	@Test
	void shouldRejectSymbolsOutsideInputAlphabet() {
		InvalidSymbolException e = catchThrowableOfType(() -> Resolver.resolve(cascade, "abx"), InvalidSymbolException.class);
		assertThat(e.getPosition()).isEqualTo(2);
		assertThat(e.getSymbol()).isEqualTo("x");

		Alphabet other = Alphabet.fromInventory("other", "x");
		List<Symbol> foreign = new ArrayList<Symbol>(other.getMembers());
		assertThatThrownBy(() -> Resolver.resolve(cascade, foreign))
				.isInstanceOf(InvalidSymbolException.class);
	}

	@Test
	void shouldFailWhenOutputIsRestricted() throws Exception {
		CompiledCascade narrow = PipelineBuilder.build(RuleTable.builder("narrow")
				.inputInventory("a", "b")
				.outputInventory("a")
				.group("b-to-a", RewriteRule.obligatory("b-to-a", cross("b", "a"), literal("a"), empty()))
				.build());
		assertThat(Resolver.resolve(narrow, "ab")).isEqualTo("aa");
		assertThatThrownBy(() -> Resolver.resolve(narrow, "ba"))
				.isInstanceOf(NoValidTransductionException.class);
	}

	@Test
	void shouldPreferCheapestPath() throws Exception {
		SubstitutionMap m = SubstitutionMap.builder().add("a", "b", 2.0).build();
		SubstitutionMap n = SubstitutionMap.builder().add("a", "c", 1.0).build();
		CompiledCascade c = RuleFixtures.cascade(
				RewriteRule.optional("a-to-b", m, empty(), empty()),
				RewriteRule.optional("a-to-c", n, empty(), empty()));
		// untouched costs 0
		assertThat(Resolver.resolve(c, "a")).isEqualTo("a");
	}

	@Test
	void shouldGiveSameAnswerEveryTime() throws Exception {
		String first = Resolver.resolve(cascade, "dabcab");
		for (int i = 0; i < 20; i++)
			assertThat(Resolver.resolve(cascade, "dabcab")).isEqualTo(first);
	}

	@Test
	void shouldResolveConcurrently() throws Exception {
		ExecutorService pool = Executors.newFixedThreadPool(8);
		try {
			List<Future<String>> results = new ArrayList<Future<String>>();
			for (int i = 0; i < 200; i++) {
				final String word = (i % 2 == 0) ? "dabab" : "abcd";
				results.add(pool.submit(new Callable<String>() {
					public String call() throws Exception {
						return Resolver.resolve(cascade, word);
					}
				}));
			}
			for (int i = 0; i < results.size(); i++)
				assertThat(results.get(i).get(10, TimeUnit.SECONDS)).isEqualTo(i % 2 == 0 ? "ddd" : "ccd");
		}
		finally {
			pool.shutdownNow();
		}
	}
}
