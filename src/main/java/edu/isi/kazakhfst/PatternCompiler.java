package edu.isi.kazakhfst;

import java.util.ArrayList;
import java.util.List;

import gnu.trove.TIntIntHashMap;

/**
 * Turns {@link Pattern}s into acceptors and {@link SubstitutionMap}s into
 * transducers, over a given alphabet.
 */
public class PatternCompiler {

	private static final Semiring SEMIRING = new TropicalSemiring();

	/**
	 * Minimal deterministic acceptor for the pattern.
	 * @throws AlphabetMismatchException if a literal uses a symbol outside the alphabet
	 * @throws EmptyLanguageException if the pattern matches nothing
	 */
	public static Automaton compile(Pattern p, Alphabet alph) throws AlphabetMismatchException, EmptyLanguageException {
		return Optimizer.optimize(build(p, alph));
	}

	// unoptimized acceptor, straight from the combinators
	static Automaton build(Pattern p, Alphabet alph) throws AlphabetMismatchException {
		switch (p.getKind()) {
		case EMPTY:
			return Automaton.epsilon(alph, SEMIRING);
		case LITERAL:
			return Automaton.sequence(alph, SEMIRING, alph.tokenizeIds(p.getText()));
		case ANY:
			return Automaton.anyOf(alph, SEMIRING, alph.getMemberIds());
		case BOS:
			return Automaton.sequence(alph, SEMIRING, new int[] {SymbolTable.BOS});
		case EOS:
			return Automaton.sequence(alph, SEMIRING, new int[] {SymbolTable.EOS});
		case CLOSURE:
			return Automaton.closure(build(p.getChildren().get(0), alph));
		case UNION: {
			Automaton ret = null;
			for (Pattern c : p.getChildren())
				ret = ret == null ? build(c, alph) : Automaton.union(ret, build(c, alph));
			return ret;
		}
		case CONCAT: {
			Automaton ret = null;
			for (Pattern c : p.getChildren())
				ret = ret == null ? build(c, alph) : Automaton.concat(ret, build(c, alph));
			return ret;
		}
		default:
			throw new IllegalArgumentException("Unknown pattern kind "+p.getKind());
		}
	}

	/**
	 * The map as a trie-shaped transducer: input symbols are read with empty output
	 * and each entry's output is written on epsilon-input arcs below the node that
	 * ends it, the entry's weight on the first of them. Its input side is the set of
	 * strings the map can rewrite.
	 * @throws ConflictingSubstitutionException if an input is empty or given twice
	 */
	public static Automaton compileMap(SubstitutionMap map, Alphabet alph) throws AlphabetMismatchException, ConflictingSubstitutionException {
		Trie trie = new Trie(map, alph);
		Automaton ret = new Automaton(alph, alph, SEMIRING);
		// trie nodes keep their numbers as states
		for (int i = 0; i < trie.size(); i++)
			ret.addState();
		ret.setStart(Trie.ROOT);
		for (int node = 0; node < trie.size(); node++) {
			int[] syms = trie.getEdgeSymbols(node);
			for (int sym : syms)
				ret.addArc(node, sym, SymbolTable.EPSILON, SEMIRING.ONE(), trie.child(node, sym));
			int e = trie.getEntry(node);
			if (e < 0)
				continue;
			int[] out = trie.getOutput(e);
			double w = trie.getWeight(e);
			int curr = node;
			for (int i = 0; i < out.length; i++) {
				int next = ret.addState();
				ret.addArc(curr, SymbolTable.EPSILON, out[i], i == 0 ? w : SEMIRING.ONE(), next);
				curr = next;
			}
			ret.setFinal(curr, out.length == 0 ? w : SEMIRING.ONE());
		}
		return ret;
	}

	/**
	 * Entry inputs as a prefix tree over symbol ids. Node 0 is the root. A node may
	 * end an entry and still have children when one input is a prefix of another;
	 * which of the two applies is decided by the rewrite compiler.
	 */
	static class Trie {
		static final int ROOT = 0;

		private final ArrayList<TIntIntHashMap> children = new ArrayList<TIntIntHashMap>();
		// edge symbols per node in insertion order
		private final ArrayList<int[]> order = new ArrayList<int[]>();
		private final ArrayList<Integer> entryAt = new ArrayList<Integer>();
		private final List<int[]> outputs = new ArrayList<int[]>();
		private final List<Double> weights = new ArrayList<Double>();

		Trie(SubstitutionMap map, Alphabet alph) throws AlphabetMismatchException, ConflictingSubstitutionException {
			boolean debug = false;
			newNode();
			int e = 0;
			for (SubstitutionMap.Entry entry : map.getEntries()) {
				int[] in = alph.tokenizeIds(entry.getInput());
				if (in.length == 0)
					throw new ConflictingSubstitutionException("Empty input in substitution "+entry);
				int node = ROOT;
				for (int sym : in) {
					int c = child(node, sym);
					if (c < 0) {
						c = newNode();
						addEdge(node, sym, c);
					}
					node = c;
				}
				if (entryAt.get(node) >= 0)
					throw new ConflictingSubstitutionException("Duplicate input in "+entry+" and "+map.getEntries().get(entryAt.get(node)));
				entryAt.set(node, e++);
				outputs.add(alph.tokenizeIds(entry.getOutput()));
				weights.add(entry.getWeight());
				if (debug) Debug.debug(debug, "Entry "+entry+" ends at node "+node);
			}
		}

		private int newNode() {
			children.add(new TIntIntHashMap());
			order.add(new int[0]);
			entryAt.add(-1);
			return children.size()-1;
		}
		private void addEdge(int node, int sym, int c) {
			children.get(node).put(sym, c);
			int[] old = order.get(node);
			int[] edges = new int[old.length+1];
			System.arraycopy(old, 0, edges, 0, old.length);
			edges[old.length] = sym;
			order.set(node, edges);
		}

		int size() { return children.size(); }
		// -1 if there's no edge
		int child(int node, int sym) {
			TIntIntHashMap m = children.get(node);
			return m.containsKey(sym) ? m.get(sym) : -1;
		}
		int[] getEdgeSymbols(int node) { return order.get(node); }
		boolean endsEntry(int node) { return entryAt.get(node) >= 0; }
		boolean hasChildren(int node) { return children.get(node).size() > 0; }
		// entry index ending here, or -1
		int getEntry(int node) { return entryAt.get(node); }
		int[] getOutput(int entry) { return outputs.get(entry); }
		double getWeight(int entry) { return weights.get(entry); }
	}
}
