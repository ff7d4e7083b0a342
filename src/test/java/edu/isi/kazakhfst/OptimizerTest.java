package edu.isi.kazakhfst;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OptimizerTest {

	private final Alphabet alph = RuleFixtures.letters();
	private final Semiring sr = new TropicalSemiring();

	private int id(String s) {
		return alph.getTable().lookup(s).getId();
	}

	@Test
	void shouldThrowWhenNothingIsAccepted() {
		Automaton a = new Automaton(alph, alph, sr);
		int s0 = a.addState();
		int s1 = a.addState();
		a.setStart(s0);
		a.addArc(s0, id("a"), id("a"), sr.ONE(), s1);
		assertThatThrownBy(() -> Optimizer.optimize(a))
				.isInstanceOf(EmptyLanguageException.class);
	}

	@Test
	void shouldTrimDeadAndUnreachableStates() throws Exception {
		Automaton a = new Automaton(alph, alph, sr);
		int s0 = a.addState();
		int fin = a.addState();
		int dead = a.addState();
		int unreachable = a.addState();
		a.setStart(s0);
		a.setFinal(fin, sr.ONE());
		a.setFinal(unreachable, sr.ONE());
		a.addArc(s0, id("a"), id("a"), sr.ONE(), fin);
		a.addArc(s0, id("b"), id("b"), sr.ONE(), dead);
		Automaton t = Optimizer.trim(a);
		assertThat(t.getNumStates()).isEqualTo(2);
		assertThat(t.getNumArcs()).isEqualTo(1);
	}

	@Test
	void shouldMergeEquivalentBranches() throws Exception {
		// a(b|c) written as ab|ac
		Automaton ab = Automaton.sequence(alph, sr, new int[] {id("a"), id("b")});
		Automaton ac = Automaton.sequence(alph, sr, new int[] {id("a"), id("c")});
		Automaton opt = Optimizer.optimize(Automaton.union(ab, ac));
		assertThat(opt.getNumStates()).isEqualTo(3);
		assertThat(opt.getArcs(opt.getStart())).hasSize(1);
	}

	@Test
	void shouldKeepWeightedEpsilonArcs() throws Exception {
		Automaton a = new Automaton(alph, alph, sr);
		int s0 = a.addState();
		int s1 = a.addState();
		a.setStart(s0);
		a.setFinal(s1, sr.ONE());
		a.addArc(s0, SymbolTable.EPSILON, SymbolTable.EPSILON, 2.0, s1);
		Automaton opt = Optimizer.optimize(a);
		assertThat(opt.getNumArcs()).isEqualTo(1);
		assertThat(opt.getArcs(opt.getStart()).get(0).weight).isEqualTo(2.0);
	}

	@Test
	void shouldKeepBestFinalWeightOfMergedStates() throws Exception {
		Automaton a = new Automaton(alph, alph, sr);
		int s0 = a.addState();
		int s1 = a.addState();
		int s2 = a.addState();
		a.setStart(s0);
		a.setFinal(s1, 3.0);
		a.setFinal(s2, 1.0);
		a.addArc(s0, id("a"), id("a"), sr.ONE(), s1);
		a.addArc(s0, id("a"), id("a"), sr.ONE(), s2);
		Automaton opt = Optimizer.optimize(a);
		assertThat(opt.getNumStates()).isEqualTo(2);
		int target = opt.getArcs(opt.getStart()).get(0).to;
		assertThat(opt.getFinalWeight(target)).isEqualTo(1.0);
	}

	@Test
	void shouldBeDeterministic() throws Exception {
		Automaton a = PatternCompiler.build(Pattern.star(Pattern.anyOf("ab", "ac", "d")), alph);
		assertThat(Optimizer.optimize(a).toString()).isEqualTo(Optimizer.optimize(a).toString());
		Automaton once = Optimizer.optimize(a);
		assertThat(Optimizer.optimize(once).toString()).isEqualTo(once.toString());
	}
}
