package edu.isi.kazakhfst;

import java.util.ArrayList;
import java.util.List;

import gnu.trove.TIntArrayList;
import gnu.trove.TIntIntHashMap;
import gnu.trove.TIntStack;

/**
 * The product of one input word with a compiled automaton: nodes are
 * (input position, automaton state) pairs, numbered in the order a breadth-first
 * walk over the stored arc order discovers them. Epsilon-input arcs stay at the same
 * position. Built per call and thrown away.
 */
class Lattice {
	private final Automaton fst;
	private final int length;
	private final TIntArrayList nodePos = new TIntArrayList();
	private final TIntArrayList nodeState = new TIntArrayList();
	// outgoing edges per node, as (target node, arc) in arc order
	private final ArrayList<TIntArrayList> edgeTo = new ArrayList<TIntArrayList>();
	private final ArrayList<ArrayList<Arc>> edgeArc = new ArrayList<ArrayList<Arc>>();
	private boolean[] useful;

	Lattice(Automaton fst, int[] input) throws UnusualConditionException {
		boolean debug = false;
		this.fst = fst;
		length = input.length;
		Semiring s = fst.getSemiring();
		// keyed by pos * numStates + state
		TIntIntHashMap ids = new TIntIntHashMap();
		int numStates = fst.getNumStates();
		node(ids, numStates, 0, fst.getStart());
		for (int i = 0; i < nodePos.size(); i++) {
			int pos = nodePos.get(i);
			int q = nodeState.get(i);
			for (Arc a : fst.getArcs(q)) {
				if (!s.isMonotone(a.weight))
					throw new UnusualConditionException("Arc "+a+" from state "+q+" has weight "+a.weight+"; best path needs monotone weights");
				int next;
				if (a.in == SymbolTable.EPSILON)
					next = node(ids, numStates, pos, a.to);
				else if (pos < length && a.in == input[pos])
					next = node(ids, numStates, pos+1, a.to);
				else
					continue;
				edgeTo.get(i).add(next);
				edgeArc.get(i).add(a);
			}
		}
		if (debug) Debug.debug(debug, nodePos.size()+" lattice nodes for input of length "+length);
		trim();
	}

	private int node(TIntIntHashMap ids, int numStates, int pos, int q) {
		int key = pos*numStates + q;
		if (ids.containsKey(key))
			return ids.get(key);
		int id = nodePos.size();
		ids.put(key, id);
		nodePos.add(pos);
		nodeState.add(q);
		edgeTo.add(new TIntArrayList());
		edgeArc.add(new ArrayList<Arc>());
		return id;
	}

	// mark nodes that can reach an accepting node
	private void trim() {
		int n = nodePos.size();
		ArrayList<TIntArrayList> rev = new ArrayList<TIntArrayList>();
		for (int i = 0; i < n; i++)
			rev.add(new TIntArrayList());
		for (int i = 0; i < n; i++) {
			TIntArrayList to = edgeTo.get(i);
			for (int j = 0; j < to.size(); j++)
				rev.get(to.get(j)).add(i);
		}
		useful = new boolean[n];
		TIntStack ready = new TIntStack();
		for (int i = 0; i < n; i++) {
			if (isAccepting(i)) {
				useful[i] = true;
				ready.push(i);
			}
		}
		while (ready.size() > 0) {
			TIntArrayList preds = rev.get(ready.pop());
			for (int j = 0; j < preds.size(); j++) {
				int p = preds.get(j);
				if (!useful[p]) {
					useful[p] = true;
					ready.push(p);
				}
			}
		}
	}

	boolean isEmpty() {
		return useful.length == 0 || !useful[0];
	}
	int getNumNodes() { return nodePos.size(); }
	boolean isUseful(int node) { return useful[node]; }
	boolean isAccepting(int node) {
		return nodePos.get(node) == length && fst.isFinal(nodeState.get(node));
	}
	double getFinalWeight(int node) {
		return fst.getFinalWeight(nodeState.get(node));
	}
	TIntArrayList getEdgeTargets(int node) { return edgeTo.get(node); }
	List<Arc> getEdgeArcs(int node) { return edgeArc.get(node); }
}
