package edu.isi.kazakhfst;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import gnu.trove.TIntArrayList;
import gnu.trove.TIntHashSet;
import gnu.trove.TIntIntHashMap;
import gnu.trove.TIntStack;

/**
 * Size reduction for automata. optimize() = trim, determinize, minimize, trim.
 * <p>
 * Transducers are determinized as acceptors over (in, out, weight) triples, so only
 * unweighted eps:eps arcs disappear and the relation (with its weights) is
 * unchanged. Every loop below visits states in number order and arcs in stored
 * order, so the same input always yields the same automaton.
 */
public class Optimizer {

	// an arc label taken as one symbol of the encoded acceptor
	private static final class Label implements Comparable<Label> {
		final int in;
		final int out;
		final double weight;
		Label(Arc a) {
			in = a.in;
			out = a.out;
			weight = a.weight;
		}
		public boolean equals(Object o) {
			if (!(o instanceof Label))
				return false;
			Label l = (Label)o;
			return in == l.in && out == l.out && Double.compare(weight, l.weight) == 0;
		}
		public int hashCode() {
			long w = Double.doubleToLongBits(weight);
			return (in*31 + out)*31 + (int)(w ^ (w >>> 32));
		}
		public int compareTo(Label l) {
			if (in != l.in)
				return in < l.in ? -1 : 1;
			if (out != l.out)
				return out < l.out ? -1 : 1;
			return Double.compare(weight, l.weight);
		}
	}

	public static Automaton optimize(Automaton a) throws EmptyLanguageException {
		boolean debug = false;
		Automaton t = trim(a);
		Automaton d = determinize(t);
		Automaton m = minimize(d);
		Automaton ret = trim(m);
		if (debug) Debug.debug(debug, a.getNumStates()+" states -> "+t.getNumStates()+" trimmed -> "+
				d.getNumStates()+" determinized -> "+ret.getNumStates()+" minimized");
		return ret;
	}

	/**
	 * Keep only states that are reachable from the start and can reach a final
	 * state. Zero-weight arcs don't count. Surviving states keep their relative order.
	 * @throws EmptyLanguageException if the start state doesn't survive
	 */
	public static Automaton trim(Automaton a) throws EmptyLanguageException {
		boolean debug = false;
		Semiring s = a.getSemiring();
		int n = a.getNumStates();
		if (a.getStart() < 0)
			throw new EmptyLanguageException("Automaton has no start state");
		// phase 1: co-accessible, walking reversed arcs back from the finals
		ArrayList<TIntArrayList> rev = new ArrayList<TIntArrayList>();
		for (int i = 0; i < n; i++)
			rev.add(new TIntArrayList());
		for (int i = 0; i < n; i++)
			for (Arc arc : a.getArcs(i))
				if (!s.isZero(arc.weight))
					rev.get(arc.to).add(i);
		boolean[] coacc = new boolean[n];
		TIntStack ready = new TIntStack();
		for (int i = 0; i < n; i++) {
			if (a.isFinal(i)) {
				coacc[i] = true;
				ready.push(i);
			}
		}
		while (ready.size() > 0) {
			TIntArrayList preds = rev.get(ready.pop());
			for (int j = 0; j < preds.size(); j++) {
				int p = preds.get(j);
				if (!coacc[p]) {
					coacc[p] = true;
					ready.push(p);
				}
			}
		}
		// phase 2: accessible from the start, through co-accessible states only
		boolean[] keep = new boolean[n];
		if (coacc[a.getStart()]) {
			keep[a.getStart()] = true;
			ready.push(a.getStart());
		}
		while (ready.size() > 0) {
			int st = ready.pop();
			for (Arc arc : a.getArcs(st)) {
				if (s.isZero(arc.weight) || !coacc[arc.to] || keep[arc.to])
					continue;
				keep[arc.to] = true;
				ready.push(arc.to);
			}
		}
		if (!keep[a.getStart()])
			throw new EmptyLanguageException("No final state is reachable from the start state");
		int[] map = new int[n];
		Automaton ret = new Automaton(a.getInputAlphabet(), a.getOutputAlphabet(), s);
		for (int i = 0; i < n; i++)
			map[i] = keep[i] ? ret.addState() : -1;
		for (int i = 0; i < n; i++) {
			if (!keep[i])
				continue;
			for (Arc arc : a.getArcs(i))
				if (!s.isZero(arc.weight) && keep[arc.to])
					ret.addArc(map[i], arc.in, arc.out, arc.weight, map[arc.to]);
			ret.setFinal(map[i], a.getFinalWeight(i));
		}
		ret.setStart(map[a.getStart()]);
		if (debug) Debug.debug(debug, "Trimmed "+n+" states to "+ret.getNumStates());
		return ret;
	}

	// unweighted eps:eps arcs are the only ones that get followed without a label
	private static boolean isFreeEpsilon(Semiring s, Arc a) {
		return a.isEpsilon() && !s.better(a.weight, s.ONE()) && !s.better(s.ONE(), a.weight);
	}

	// sorted closure of a set of states over free epsilon arcs
	private static int[] closure(Automaton a, TIntArrayList seeds) {
		Semiring s = a.getSemiring();
		TIntHashSet seen = new TIntHashSet();
		TIntStack ready = new TIntStack();
		for (int i = 0; i < seeds.size(); i++) {
			if (seen.add(seeds.get(i)))
				ready.push(seeds.get(i));
		}
		while (ready.size() > 0) {
			int st = ready.pop();
			for (Arc arc : a.getArcs(st)) {
				if (isFreeEpsilon(s, arc) && seen.add(arc.to))
					ready.push(arc.to);
			}
		}
		int[] ret = seen.toArray();
		Arrays.sort(ret);
		return ret;
	}

	/**
	 * Subset construction over encoded labels. A subset's final weight is the plus
	 * (best) of its members' final weights; arcs are added in the order their labels
	 * are first seen among the members.
	 */
	public static Automaton determinize(Automaton a) {
		boolean debug = false;
		Semiring s = a.getSemiring();
		Automaton ret = new Automaton(a.getInputAlphabet(), a.getOutputAlphabet(), s);
		HashMap<String, Integer> subsetIds = new HashMap<String, Integer>();
		ArrayList<int[]> subsets = new ArrayList<int[]>();
		TIntArrayList seed = new TIntArrayList();
		seed.add(a.getStart());
		int[] first = closure(a, seed);
		subsetIds.put(Arrays.toString(first), ret.addState());
		subsets.add(first);
		ret.setStart(0);
		// subsets are numbered in discovery order, so this is a breadth-first walk
		for (int curr = 0; curr < subsets.size(); curr++) {
			int[] members = subsets.get(curr);
			double fin = s.ZERO();
			LinkedHashMap<Label, TIntArrayList> moves = new LinkedHashMap<Label, TIntArrayList>();
			for (int st : members) {
				fin = s.plus(fin, a.getFinalWeight(st));
				for (Arc arc : a.getArcs(st)) {
					if (isFreeEpsilon(s, arc))
						continue;
					Label l = new Label(arc);
					TIntArrayList dest = moves.get(l);
					if (dest == null) {
						dest = new TIntArrayList();
						moves.put(l, dest);
					}
					dest.add(arc.to);
				}
			}
			ret.setFinal(curr, fin);
			for (Map.Entry<Label, TIntArrayList> move : moves.entrySet()) {
				int[] next = closure(a, move.getValue());
				String key = Arrays.toString(next);
				Integer id = subsetIds.get(key);
				if (id == null) {
					id = ret.addState();
					subsetIds.put(key, id);
					subsets.add(next);
				}
				Label l = move.getKey();
				ret.addArc(curr, l.in, l.out, l.weight, id);
			}
		}
		if (debug) Debug.debug(debug, "Determinized "+a.getNumStates()+" states into "+ret.getNumStates()+" subsets");
		return ret;
	}

	/**
	 * Moore partition refinement. The input must be deterministic over its labels
	 * (as determinize() leaves it). Blocks start out split by final weight; the result
	 * numbers blocks breadth-first from the start block.
	 */
	public static Automaton minimize(Automaton a) {
		boolean debug = false;
		int n = a.getNumStates();
		int[] block = new int[n];
		// initial partition: same final weight
		HashMap<Double, Integer> byFinal = new HashMap<Double, Integer>();
		for (int i = 0; i < n; i++) {
			Double w = a.getFinalWeight(i);
			Integer b = byFinal.get(w);
			if (b == null) {
				b = byFinal.size();
				byFinal.put(w, b);
			}
			block[i] = b;
		}
		int numBlocks = byFinal.size();
		int rounds = 0;
		while (true) {
			rounds++;
			HashMap<String, Integer> sigs = new HashMap<String, Integer>();
			int[] next = new int[n];
			for (int i = 0; i < n; i++) {
				String sig = signature(a, i, block);
				Integer b = sigs.get(sig);
				if (b == null) {
					b = sigs.size();
					sigs.put(sig, b);
				}
				next[i] = b;
			}
			block = next;
			if (sigs.size() == numBlocks)
				break;
			numBlocks = sigs.size();
		}
		if (debug) Debug.debug(debug, n+" states in "+numBlocks+" blocks after "+rounds+" rounds");

		// one representative per block; its arcs (in their stored order) become the block's arcs
		int[] rep = new int[numBlocks];
		Arrays.fill(rep, -1);
		for (int i = 0; i < n; i++)
			if (rep[block[i]] < 0)
				rep[block[i]] = i;
		Automaton ret = new Automaton(a.getInputAlphabet(), a.getOutputAlphabet(), a.getSemiring());
		TIntIntHashMap newId = new TIntIntHashMap();
		TIntArrayList queue = new TIntArrayList();
		int startBlock = block[a.getStart()];
		newId.put(startBlock, ret.addState());
		queue.add(startBlock);
		for (int q = 0; q < queue.size(); q++) {
			int b = queue.get(q);
			int r = rep[b];
			for (Arc arc : a.getArcs(r)) {
				int tb = block[arc.to];
				if (!newId.containsKey(tb)) {
					newId.put(tb, ret.addState());
					queue.add(tb);
				}
			}
		}
		for (int q = 0; q < queue.size(); q++) {
			int b = queue.get(q);
			int r = rep[b];
			int from = newId.get(b);
			for (Arc arc : a.getArcs(r))
				ret.addArc(from, arc.in, arc.out, arc.weight, newId.get(block[arc.to]));
			ret.setFinal(from, a.getFinalWeight(r));
		}
		ret.setStart(newId.get(startBlock));
		return ret;
	}

	// current block plus the sorted (label, target block) pairs
	private static String signature(Automaton a, int st, int[] block) {
		ArrayList<Arc> arcs = new ArrayList<Arc>(a.getArcs(st));
		Label[] labels = new Label[arcs.size()];
		Integer[] order = new Integer[arcs.size()];
		for (int i = 0; i < arcs.size(); i++) {
			labels[i] = new Label(arcs.get(i));
			order[i] = i;
		}
		final Label[] lab = labels;
		Arrays.sort(order, new Comparator<Integer>() {
			public int compare(Integer x, Integer y) {
				return lab[x].compareTo(lab[y]);
			}
		});
		StringBuilder sb = new StringBuilder();
		sb.append(block[st]);
		for (int i : order) {
			Label l = labels[i];
			sb.append('|').append(l.in).append(',').append(l.out).append(',').append(l.weight)
				.append('>').append(block[arcs.get(i).to]);
		}
		return sb.toString();
	}
}
