package edu.isi.kazakhfst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gnu.trove.TDoubleArrayList;

/**
 * Weighted finite-state transducer. States are the integers 0..n-1; each state keeps
 * its outgoing arcs in insertion order, and that order is what every traversal in
 * this package follows. An acceptor is simply a transducer whose arcs all have
 * in == out.
 * <p>
 * Automata are built by the compiler that owns them (the mutators are package
 * private) and treated as immutable from then on; the combinators below always
 * return a new automaton.
 */
public class Automaton {

	private final Alphabet inputAlphabet;
	private final Alphabet outputAlphabet;
	private final Semiring semiring;
	private final ArrayList<ArrayList<Arc>> arcs;
	// ZERO means not final
	private final TDoubleArrayList finals;
	private int start;

	public Automaton(Alphabet in, Alphabet out, Semiring s) {
		inputAlphabet = in;
		outputAlphabet = out;
		semiring = s;
		arcs = new ArrayList<ArrayList<Arc>>();
		finals = new TDoubleArrayList();
		start = -1;
	}

	// construction

	int addState() {
		arcs.add(new ArrayList<Arc>());
		finals.add(semiring.ZERO());
		return arcs.size()-1;
	}
	void addArc(int from, int in, int out, double weight, int to) {
		arcs.get(from).add(new Arc(in, out, weight, to));
	}
	void addArc(int from, Arc a, int offset) {
		arcs.get(from).add(new Arc(a.in, a.out, a.weight, a.to+offset));
	}
	void setStart(int s) {
		start = s;
	}
	void setFinal(int s, double weight) {
		finals.set(s, weight);
	}

	// accessors

	public Alphabet getInputAlphabet() { return inputAlphabet; }
	public Alphabet getOutputAlphabet() { return outputAlphabet; }
	public Semiring getSemiring() { return semiring; }
	public int getStart() { return start; }
	public int getNumStates() { return arcs.size(); }
	public List<Arc> getArcs(int s) {
		return Collections.unmodifiableList(arcs.get(s));
	}
	public int getNumArcs() {
		int n = 0;
		for (ArrayList<Arc> l : arcs)
			n += l.size();
		return n;
	}
	public double getFinalWeight(int s) { return finals.get(s); }
	public boolean isFinal(int s) {
		return !semiring.isZero(finals.get(s));
	}
	public boolean isAcceptor() {
		for (ArrayList<Arc> l : arcs)
			for (Arc a : l)
				if (a.in != a.out)
					return false;
		return true;
	}

	// copy all states and arcs of src into dst. finals come along; returns the offset of src's states
	private static int copyInto(Automaton dst, Automaton src) {
		int offset = dst.getNumStates();
		for (int i = 0; i < src.getNumStates(); i++)
			dst.addState();
		for (int i = 0; i < src.getNumStates(); i++) {
			for (Arc a : src.arcs.get(i))
				dst.addArc(i+offset, a, offset);
			dst.setFinal(i+offset, src.getFinalWeight(i));
		}
		return offset;
	}

	private static void checkSameAlphabets(Automaton a, Automaton b, String op) throws AlphabetMismatchException {
		if (!a.inputAlphabet.equals(b.inputAlphabet) || !a.outputAlphabet.equals(b.outputAlphabet))
			throw new AlphabetMismatchException("Can't take "+op+" of automata over "+a.inputAlphabet+"->"+a.outputAlphabet+
					" and "+b.inputAlphabet+"->"+b.outputAlphabet);
		if (a.semiring.getClass() != b.semiring.getClass())
			throw new AlphabetMismatchException("Can't take "+op+" of automata over different semirings");
	}

	// the combinators. none of them touches its arguments

	/** accepts the empty string only */
	public static Automaton epsilon(Alphabet alph, Semiring s) {
		Automaton ret = new Automaton(alph, alph, s);
		int st = ret.addState();
		ret.setStart(st);
		ret.setFinal(st, s.ONE());
		return ret;
	}

	/** accepts exactly the given sequence of symbol ids */
	public static Automaton sequence(Alphabet alph, Semiring s, int[] ids) {
		Automaton ret = new Automaton(alph, alph, s);
		int curr = ret.addState();
		ret.setStart(curr);
		for (int id : ids) {
			int next = ret.addState();
			ret.addArc(curr, id, id, s.ONE(), next);
			curr = next;
		}
		ret.setFinal(curr, s.ONE());
		return ret;
	}

	/** accepts any single one of the given symbol ids */
	public static Automaton anyOf(Alphabet alph, Semiring s, int[] ids) {
		Automaton ret = new Automaton(alph, alph, s);
		int st = ret.addState();
		int fin = ret.addState();
		ret.setStart(st);
		ret.setFinal(fin, s.ONE());
		for (int id : ids)
			ret.addArc(st, id, id, s.ONE(), fin);
		return ret;
	}

	public static Automaton union(Automaton a, Automaton b) throws AlphabetMismatchException {
		checkSameAlphabets(a, b, "union");
		Automaton ret = new Automaton(a.inputAlphabet, a.outputAlphabet, a.semiring);
		int st = ret.addState();
		ret.setStart(st);
		int oa = copyInto(ret, a);
		int ob = copyInto(ret, b);
		ret.addArc(st, SymbolTable.EPSILON, SymbolTable.EPSILON, a.semiring.ONE(), a.start+oa);
		ret.addArc(st, SymbolTable.EPSILON, SymbolTable.EPSILON, a.semiring.ONE(), b.start+ob);
		return ret;
	}

	public static Automaton concat(Automaton a, Automaton b) throws AlphabetMismatchException {
		checkSameAlphabets(a, b, "concatenation");
		Automaton ret = new Automaton(a.inputAlphabet, a.outputAlphabet, a.semiring);
		int oa = copyInto(ret, a);
		int ob = copyInto(ret, b);
		ret.setStart(a.start+oa);
		// a's final weight moves onto the bridging arc
		for (int i = 0; i < a.getNumStates(); i++) {
			if (!a.isFinal(i))
				continue;
			ret.addArc(i+oa, SymbolTable.EPSILON, SymbolTable.EPSILON, a.getFinalWeight(i), b.start+ob);
			ret.setFinal(i+oa, a.semiring.ZERO());
		}
		return ret;
	}

	/** zero or more repetitions */
	public static Automaton closure(Automaton a) {
		Automaton ret = new Automaton(a.inputAlphabet, a.outputAlphabet, a.semiring);
		int st = ret.addState();
		ret.setStart(st);
		ret.setFinal(st, a.semiring.ONE());
		int oa = copyInto(ret, a);
		ret.addArc(st, SymbolTable.EPSILON, SymbolTable.EPSILON, a.semiring.ONE(), a.start+oa);
		for (int i = 0; i < a.getNumStates(); i++) {
			if (!a.isFinal(i))
				continue;
			ret.addArc(i+oa, SymbolTable.EPSILON, SymbolTable.EPSILON, a.getFinalWeight(i), st);
			ret.setFinal(i+oa, a.semiring.ZERO());
		}
		return ret;
	}

	/**
	 * Same states and arcs, declared over other alphabets. Used to give a restriction
	 * acceptor a narrower output side, e.g. "reads anything, writes only phonemes".
	 */
	public Automaton withAlphabets(Alphabet in, Alphabet out) throws AlphabetMismatchException {
		if (!in.isCompatible(inputAlphabet) || !out.isCompatible(outputAlphabet))
			throw new AlphabetMismatchException("Can't redeclare "+inputAlphabet+"->"+outputAlphabet+" as "+in+"->"+out);
		Automaton ret = new Automaton(in, out, semiring);
		copyInto(ret, this);
		ret.setStart(start);
		for (int i = 0; i < ret.getNumStates(); i++) {
			for (Arc a : ret.arcs.get(i)) {
				if (!allowed(in, a.in) || !allowed(out, a.out))
					throw new AlphabetMismatchException("Arc "+a+" uses a symbol outside "+in+"->"+out);
			}
		}
		return ret;
	}

	/** unweighted acceptor for the strings this automaton reads */
	public Automaton inputProjection() {
		Automaton ret = new Automaton(inputAlphabet, inputAlphabet, semiring);
		for (int i = 0; i < getNumStates(); i++) {
			ret.addState();
			if (isFinal(i))
				ret.setFinal(i, semiring.ONE());
		}
		for (int i = 0; i < getNumStates(); i++)
			for (Arc a : arcs.get(i))
				ret.addArc(i, a.in, a.in, semiring.ONE(), a.to);
		ret.setStart(start);
		return ret;
	}

	private static boolean allowed(Alphabet alph, int id) {
		return id == SymbolTable.EPSILON || id == SymbolTable.BOS || id == SymbolTable.EOS || alph.contains(id);
	}

	public String toString() {
		SymbolTable t = inputAlphabet.getTable();
		StringBuilder sb = new StringBuilder();
		sb.append("start ").append(start).append("\n");
		for (int i = 0; i < getNumStates(); i++) {
			for (Arc a : arcs.get(i))
				sb.append(i).append(" -> ").append(a.to).append(" ").append(label(t, a.in)).append(":")
					.append(label(t, a.out)).append(" / ").append(a.weight).append("\n");
			if (isFinal(i))
				sb.append(i).append(" final / ").append(getFinalWeight(i)).append("\n");
		}
		return sb.toString();
	}
	private static String label(SymbolTable t, int id) {
		return id == SymbolTable.EPSILON ? SymbolTable.EPSILON_TEXT : t.getString(id);
	}
}
