package edu.isi.kazakhfst;

import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;

import gnu.trove.TIntArrayList;
import gnu.trove.TIntObjectHashMap;

// relational composition of an ordered list of transducers.
// the first is applied first: compose([a, b]) maps x to z when a maps x to y and b maps y to z
public class CascadeComposer {

	// a state of the product: a state of each side, plus the epsilon filter bit.
	// filter 1 means b has moved alone since the last real match, so a may not move alone until the next one
	private static final class ComposePair {
		final int a;
		final int b;
		final int filter;
		ComposePair(int a, int b, int filter) {
			this.a = a;
			this.b = b;
			this.filter = filter;
		}
		String getJoin() {
			return a+"_"+b+"_"+filter;
		}
	}

	/**
	 * Compose left to right, optimizing after every step. Every adjacent pair is
	 * checked before any composing is done.
	 * @throws AlphabetMismatchException if some automaton writes a symbol the next one can't read
	 * @throws EmptyLanguageException if the composed relation is empty
	 */
	public static Automaton compose(List<Automaton> cascade) throws AlphabetMismatchException, EmptyLanguageException {
		if (cascade.isEmpty())
			throw new IllegalArgumentException("Can't compose an empty cascade");
		for (int i = 0; i+1 < cascade.size(); i++)
			checkCompatible(cascade.get(i), cascade.get(i+1), i);
		Automaton ret = cascade.get(0);
		for (int i = 1; i < cascade.size(); i++) {
			Date preCompTime = new Date();
			ret = Optimizer.optimize(product(ret, cascade.get(i)));
			Debug.dbtime(3, preCompTime, "composed step "+i+" of "+(cascade.size()-1)+" ("+ret.getNumStates()+" states)");
		}
		return ret;
	}

	public static Automaton compose(Automaton a, Automaton b) throws AlphabetMismatchException, EmptyLanguageException {
		checkCompatible(a, b, 0);
		return Optimizer.optimize(product(a, b));
	}

	private static void checkCompatible(Automaton a, Automaton b, int pos) throws AlphabetMismatchException {
		Alphabet out = a.getOutputAlphabet();
		Alphabet in = b.getInputAlphabet();
		if (!out.isCompatible(in))
			throw new AlphabetMismatchException("Automata "+pos+" and "+(pos+1)+" use different symbol tables");
		if (!in.containsAll(out))
			throw new AlphabetMismatchException("Output alphabet "+out+" of automaton "+pos+
					" is not contained in input alphabet "+in+" of automaton "+(pos+1));
		if (a.getSemiring().getClass() != b.getSemiring().getClass())
			throw new AlphabetMismatchException("Automata "+pos+" and "+(pos+1)+" use different semirings");
	}

	// per-state index of b's arcs by input label, in stored order
	private static ArrayList<TIntObjectHashMap> indexByInput(Automaton b) {
		ArrayList<TIntObjectHashMap> ret = new ArrayList<TIntObjectHashMap>();
		for (int i = 0; i < b.getNumStates(); i++) {
			TIntObjectHashMap m = new TIntObjectHashMap();
			List<Arc> arcs = b.getArcs(i);
			for (int j = 0; j < arcs.size(); j++) {
				int in = arcs.get(j).in;
				TIntArrayList l = (TIntArrayList)m.get(in);
				if (l == null) {
					l = new TIntArrayList();
					m.put(in, l);
				}
				l.add(j);
			}
			ret.add(m);
		}
		return ret;
	}

	// the unoptimized product. states are discovered breadth-first from the start pair
	static Automaton product(Automaton a, Automaton b) {
		boolean debug = false;
		Semiring s = a.getSemiring();
		Automaton ret = new Automaton(a.getInputAlphabet(), b.getOutputAlphabet(), s);
		ArrayList<TIntObjectHashMap> bIndex = indexByInput(b);
		HashMap<String, Integer> ids = new HashMap<String, Integer>();
		ArrayList<ComposePair> pairs = new ArrayList<ComposePair>();
		ComposePair start = new ComposePair(a.getStart(), b.getStart(), 0);
		ids.put(start.getJoin(), ret.addState());
		pairs.add(start);
		ret.setStart(0);
		for (int i = 0; i < pairs.size(); i++) {
			ComposePair p = pairs.get(i);
			if (a.isFinal(p.a) && b.isFinal(p.b))
				ret.setFinal(i, s.times(a.getFinalWeight(p.a), b.getFinalWeight(p.b)));
			List<Arc> bArcs = b.getArcs(p.b);
			for (Arc aa : a.getArcs(p.a)) {
				if (aa.out == SymbolTable.EPSILON) {
					// a moves alone
					if (p.filter == 0)
						ret.addArc(i, aa.in, SymbolTable.EPSILON, aa.weight, pairId(ret, ids, pairs, new ComposePair(aa.to, p.b, 0)));
					continue;
				}
				TIntArrayList matches = (TIntArrayList)bIndex.get(p.b).get(aa.out);
				if (matches == null)
					continue;
				for (int j = 0; j < matches.size(); j++) {
					Arc ba = bArcs.get(matches.get(j));
					ret.addArc(i, aa.in, ba.out, s.times(aa.weight, ba.weight),
							pairId(ret, ids, pairs, new ComposePair(aa.to, ba.to, 0)));
				}
			}
			// b moves alone
			TIntArrayList bEps = (TIntArrayList)bIndex.get(p.b).get(SymbolTable.EPSILON);
			if (bEps != null) {
				for (int j = 0; j < bEps.size(); j++) {
					Arc ba = bArcs.get(bEps.get(j));
					ret.addArc(i, SymbolTable.EPSILON, ba.out, ba.weight, pairId(ret, ids, pairs, new ComposePair(p.a, ba.to, 1)));
				}
			}
		}
		if (debug) Debug.debug(debug, a.getNumStates()+" x "+b.getNumStates()+" -> "+ret.getNumStates()+" pairs");
		return ret;
	}

	private static int pairId(Automaton ret, HashMap<String, Integer> ids, ArrayList<ComposePair> pairs, ComposePair p) {
		String k = p.getJoin();
		Integer id = ids.get(k);
		if (id == null) {
			id = ret.addState();
			ids.put(k, id);
			pairs.add(p);
		}
		return id;
	}
}
