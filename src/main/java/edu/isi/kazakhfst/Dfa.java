package edu.isi.kazakhfst;

import java.util.ArrayList;

import gnu.trove.TIntIntHashMap;

// transition table view of an optimized, epsilon-free acceptor. used by the rewrite
// compiler to run context acceptors alongside the rule; missing transitions are -1 (dead)
class Dfa {
	static final int DEAD = -1;

	private final ArrayList<TIntIntHashMap> delta;
	private final boolean[] finals;
	private final int start;

	Dfa(Automaton a) throws UnusualConditionException {
		delta = new ArrayList<TIntIntHashMap>();
		finals = new boolean[a.getNumStates()];
		for (int i = 0; i < a.getNumStates(); i++) {
			TIntIntHashMap m = new TIntIntHashMap();
			for (Arc arc : a.getArcs(i)) {
				if (arc.in != arc.out || arc.in == SymbolTable.EPSILON)
					throw new UnusualConditionException("Arc "+arc+" from "+i+" is not a symbol arc of an acceptor");
				if (m.containsKey(arc.in))
					throw new UnusualConditionException("State "+i+" has two arcs on "+arc.in);
				m.put(arc.in, arc.to);
			}
			delta.add(m);
			finals[i] = a.isFinal(i);
		}
		start = a.getStart();
	}

	int getStart() { return start; }

	boolean isFinal(int q) {
		return q != DEAD && finals[q];
	}

	int next(int q, int sym) {
		if (q == DEAD)
			return DEAD;
		TIntIntHashMap m = delta.get(q);
		if (!m.containsKey(sym))
			return DEAD;
		return m.get(sym);
	}

	// follow a whole sequence; DEAD as soon as any step is missing
	int next(int q, int[] syms) {
		for (int s : syms) {
			q = next(q, s);
			if (q == DEAD)
				break;
		}
		return q;
	}

	int getNumStates() { return finals.length; }
}
