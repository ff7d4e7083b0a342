package edu.isi.kazakhfst;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Picks the single output a compiled cascade gives a word: the best path through
 * the word's lattice under the tropical semiring. Ties go to the path whose nodes
 * were discovered first, i.e. the one that follows the stored arc order, and a
 * node's predecessor only changes for a strictly better distance. The answer is
 * therefore the same on every call.
 * <p>
 * All state is local to the call; the cascade is only read.
 */
public class Resolver {

	private static final class Item implements Comparable<Item> {
		final double dist;
		final int node;
		Item(double dist, int node) {
			this.dist = dist;
			this.node = node;
		}
		// lattice node numbers are discovery order, so they break ties
		public int compareTo(Item o) {
			int c = Double.compare(dist, o.dist);
			if (c != 0)
				return c;
			return node < o.node ? -1 : (node == o.node ? 0 : 1);
		}
	}

	/**
	 * @throws InvalidSymbolException if some symbol isn't in the cascade's input alphabet
	 * @throws NoValidTransductionException if the cascade has no path for the input
	 */
	public static List<Symbol> resolve(CompiledCascade cascade, List<Symbol> input) throws InvalidSymbolException,
	NoValidTransductionException, UnusualConditionException {
		Alphabet in = cascade.getInputAlphabet();
		int[] ids = new int[input.size()];
		for (int i = 0; i < ids.length; i++) {
			Symbol s = input.get(i);
			if (!in.contains(s))
				throw new InvalidSymbolException(s.getText(), i, in.getName());
			ids[i] = in.getTable().lookup(s.getText()).getId();
		}
		int[] out = bestPath(cascade, ids);
		Alphabet outAlph = cascade.getOutputAlphabet();
		ArrayList<Symbol> ret = new ArrayList<Symbol>();
		for (int id : out)
			ret.add(outAlph.getSymbol(id));
		return ret;
	}

	/** tokenizes the word against the input alphabet (longest match first), then resolves */
	public static String resolve(CompiledCascade cascade, String word) throws InvalidSymbolException,
	NoValidTransductionException, UnusualConditionException {
		List<Symbol> syms = cascade.getInputAlphabet().tokenize(word);
		StringBuilder sb = new StringBuilder();
		for (Symbol s : resolve(cascade, syms))
			sb.append(s.getText());
		return sb.toString();
	}

	// output ids along the best path, epsilons dropped
	private static int[] bestPath(CompiledCascade cascade, int[] input) throws NoValidTransductionException, UnusualConditionException {
		boolean debug = false;
		Automaton fst = cascade.getAutomaton();
		Semiring s = fst.getSemiring();
		Lattice lat = new Lattice(fst, input);
		if (lat.isEmpty())
			throw new NoValidTransductionException("No path through "+cascade.getName()+" for "+
					cascade.getInputAlphabet().toString(input));
		int n = lat.getNumNodes();
		double[] dist = new double[n];
		Arrays.fill(dist, s.ZERO());
		int[] backNode = new int[n];
		Arc[] backArc = new Arc[n];
		Arrays.fill(backNode, -1);
		boolean[] done = new boolean[n];
		PriorityQueue<Item> queue = new PriorityQueue<Item>();
		dist[0] = s.ONE();
		queue.add(new Item(dist[0], 0));
		int bestEnd = -1;
		double bestTotal = s.ZERO();
		while (!queue.isEmpty()) {
			Item it = queue.poll();
			int u = it.node;
			if (done[u])
				continue;
			done[u] = true;
			if (lat.isAccepting(u)) {
				double total = s.times(dist[u], lat.getFinalWeight(u));
				if (bestEnd < 0 || s.better(total, bestTotal)) {
					bestEnd = u;
					bestTotal = total;
				}
			}
			List<Arc> arcs = lat.getEdgeArcs(u);
			for (int j = 0; j < arcs.size(); j++) {
				int v = lat.getEdgeTargets(u).get(j);
				if (!lat.isUseful(v) || done[v])
					continue;
				double nd = s.times(dist[u], arcs.get(j).weight);
				if (s.better(nd, dist[v])) {
					dist[v] = nd;
					backNode[v] = u;
					backArc[v] = arcs.get(j);
					queue.add(new Item(nd, v));
				}
			}
		}
		if (bestEnd < 0)
			throw new NoValidTransductionException("No accepting path through "+cascade.getName()+" for "+
					cascade.getInputAlphabet().toString(input));
		ArrayList<Arc> path = new ArrayList<Arc>();
		for (int v = bestEnd; v != 0; v = backNode[v])
			path.add(backArc[v]);
		int count = 0;
		for (Arc a : path)
			if (a.out != SymbolTable.EPSILON)
				count++;
		int[] ret = new int[count];
		int k = count;
		for (Arc a : path)
			if (a.out != SymbolTable.EPSILON)
				ret[--k] = a.out;
		if (debug) Debug.debug(debug, "Best path of "+path.size()+" arcs, weight "+bestTotal);
		return ret;
	}
}
