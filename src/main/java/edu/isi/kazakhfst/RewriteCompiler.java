package edu.isi.kazakhfst;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;

import gnu.trove.TIntArrayList;

/**
 * Compiles a {@link RewriteRule} into a transducer that applies it left to right
 * over an alphabet: at each position not inside an earlier match, if an input of the
 * map starts here, the output written so far ends in the left context and the rest
 * of the input starts with the right context, the input is replaced and scanning
 * resumes after it. Obligatory rules must rewrite every such occurrence; optional
 * rules keep both paths. When inputs of the map are prefixes of each other, the
 * longest one whose right context holds is the one rewritten.
 * <p>
 * States of the result are tuples of
 * <ul>
 * <li>the state of L = ([BOS]|sigma)* left, run over the output,
 * <li>a node of the map's prefix tree (the root when no match is in progress),
 * <li>pending right contexts: states of R = right (sigma|[EOS])* that must still
 * accept, one per completed match,
 * <li>blocked rewrites: states of M = (inputs) right (sigma|[EOS])* that must never
 * accept, one per position where an obligatory rewrite was passed over,
 * <li>longer inputs: prefix tree nodes still being read after a shorter input was
 * rewritten, and states of R, one per longer input that has been read, that must
 * never accept.
 * </ul>
 * The context sets stand in for the marker symbols of the classic
 * Kaplan-Kay construction: contexts are checked without being consumed.
 */
public class RewriteCompiler {

	private static final Semiring SEMIRING = new TropicalSemiring();
	private static final int[] NONE = new int[0];

	private static final class Tuple {
		final int l;
		final int node;
		final int[] pending;
		final int[] blocked;
		final int[] longer;
		final int[] forbidden;
		Tuple(int l, int node, int[] pending, int[] blocked, int[] longer, int[] forbidden) {
			this.l = l;
			this.node = node;
			this.pending = pending;
			this.blocked = blocked;
			this.longer = longer;
			this.forbidden = forbidden;
		}
		String key() {
			return l+"/"+node+"/"+Arrays.toString(pending)+"/"+Arrays.toString(blocked)+"/"+
				Arrays.toString(longer)+"/"+Arrays.toString(forbidden);
		}
	}

	// everything one compilation needs, so compile() itself stays reentrant
	private static final class Build {
		final Alphabet alph;
		final PatternCompiler.Trie trie;
		final Dfa left;
		final Dfa right;
		final Dfa must;
		final boolean obligatory;
		final Automaton ret;
		final HashMap<String, Integer> ids = new HashMap<String, Integer>();
		final ArrayList<Tuple> tuples = new ArrayList<Tuple>();
		Build(Alphabet alph, PatternCompiler.Trie trie, Dfa left, Dfa right, Dfa must, boolean obligatory) {
			this.alph = alph;
			this.trie = trie;
			this.left = left;
			this.right = right;
			this.must = must;
			this.obligatory = obligatory;
			ret = new Automaton(alph, alph, SEMIRING);
		}
		// state for the tuple, made (and queued) on first sight
		int state(Tuple t) {
			String k = t.key();
			Integer id = ids.get(k);
			if (id == null) {
				id = ret.addState();
				ids.put(k, id);
				tuples.add(t);
			}
			return id;
		}
	}

	/**
	 * @throws ConflictingSubstitutionException if a map input is empty or given twice
	 * @throws AlphabetMismatchException if the map or a context uses a symbol outside the alphabet
	 * @throws EmptyLanguageException if a context can never be satisfied
	 */
	public static Automaton compile(RewriteRule rule, Alphabet alph) throws AlphabetMismatchException,
	ConflictingSubstitutionException, EmptyLanguageException, UnusualConditionException {
		boolean debug = false;
		try {
			return build(rule, alph);
		}
		catch (AlphabetMismatchException e) {
			throw new AlphabetMismatchException("Rule "+rule.getName()+": "+e.getMessage(), e);
		}
		catch (ConflictingSubstitutionException e) {
			throw new ConflictingSubstitutionException("Rule "+rule.getName()+": "+e.getMessage(), e);
		}
		catch (EmptyLanguageException e) {
			if (debug) Debug.debug(debug, "Empty language while compiling "+rule);
			throw new EmptyLanguageException("Rule "+rule.getName()+": "+e.getMessage(), e);
		}
	}

	private static Automaton build(RewriteRule rule, Alphabet alph) throws AlphabetMismatchException,
	ConflictingSubstitutionException, EmptyLanguageException, UnusualConditionException {
		boolean debug = false;
		PatternCompiler.Trie trie = new PatternCompiler.Trie(rule.getMap(), alph);
		int[] members = alph.getMemberIds();

		// L = ([BOS]|sigma)* left
		Automaton lead = Automaton.closure(Automaton.anyOf(alph, SEMIRING, with(members, SymbolTable.BOS)));
		Dfa left = new Dfa(Optimizer.optimize(Automaton.concat(lead, PatternCompiler.build(rule.getLeft(), alph))));
		// R = right (sigma|[EOS])*
		Automaton tail = Automaton.closure(Automaton.anyOf(alph, SEMIRING, with(members, SymbolTable.EOS)));
		Automaton rightPat = PatternCompiler.build(rule.getRight(), alph);
		Dfa right = new Dfa(Optimizer.optimize(Automaton.concat(rightPat, tail)));
		// M = (inputs) right (sigma|[EOS])*
		Automaton phi = PatternCompiler.compileMap(rule.getMap(), alph).inputProjection();
		Dfa must = new Dfa(Optimizer.optimize(Automaton.concat(Automaton.concat(phi, rightPat), tail)));

		Build b = new Build(alph, trie, left, right, must, rule.isObligatory());
		int startL = left.next(left.getStart(), SymbolTable.BOS);
		b.ret.setStart(b.state(new Tuple(startL, PatternCompiler.Trie.ROOT, NONE, NONE, NONE, NONE)));
		for (int i = 0; i < b.tuples.size(); i++) {
			Tuple t = b.tuples.get(i);
			int q = b.ids.get(t.key());
			if (isFinal(b, t))
				b.ret.setFinal(q, SEMIRING.ONE());
			for (int x : members)
				expand(b, q, t, x);
		}
		if (debug) Debug.debug(debug, rule.getName()+": "+b.tuples.size()+" tuples, "+b.ret.getNumStates()+" states");
		return Optimizer.optimize(b.ret);
	}

	// all arcs on input x out of tuple t (state q), match arc before pass-through
	private static void expand(Build b, int q, Tuple t, int x) {
		int[] pending = advancePending(b.right, t.pending, x);
		if (pending == null)
			return;
		int[] blocked = advanceBlocked(b.must, t.blocked, x);
		if (blocked == null)
			return;
		int[] forbidden = advanceForbidden(b.right, t.forbidden, x);
		if (forbidden == null)
			return;
		int[] longer = NONE;
		if (t.longer.length > 0) {
			TIntArrayList still = new TIntArrayList();
			for (int node : t.longer) {
				int c = b.trie.child(node, x);
				if (c < 0)
					continue;
				// a longer input was there after all: its right context must fail
				if (b.trie.endsEntry(c)) {
					if (b.right.isFinal(b.right.getStart()))
						return;
					forbidden = insert(forbidden, b.right.getStart());
				}
				if (b.trie.hasChildren(c))
					still.add(c);
			}
			longer = sortUniq(still.toNativeArray(), still.size());
		}
		Tuple next = new Tuple(t.l, t.node, pending, blocked, longer, forbidden);
		// inside a match the only way on is down the tree
		if (t.node != PatternCompiler.Trie.ROOT) {
			int c = b.trie.child(t.node, x);
			if (c >= 0)
				matchStep(b, q, t, x, c, next);
			return;
		}
		boolean leftOk = b.left.isFinal(t.l);
		if (leftOk) {
			int c = b.trie.child(PatternCompiler.Trie.ROOT, x);
			if (c >= 0)
				matchStep(b, q, t, x, c, next);
		}
		int[] passBlocked = blocked;
		if (b.obligatory && leftOk) {
			int m = b.must.next(b.must.getStart(), x);
			// an input and its right context start right here: passing over is not allowed
			if (b.must.isFinal(m))
				return;
			if (m != Dfa.DEAD)
				passBlocked = insert(blocked, m);
		}
		int l = b.left.next(t.l, x);
		if (l == Dfa.DEAD)
			return;
		int to = b.state(new Tuple(l, PatternCompiler.Trie.ROOT, pending, passBlocked, longer, forbidden));
		b.ret.addArc(q, x, x, SEMIRING.ONE(), to);
	}

	// x read as part of a match that has reached trie node c; "next" holds the
	// contexts already advanced over x. Finishing an entry comes before reading on.
	private static void matchStep(Build b, int q, Tuple t, int x, int c, Tuple next) {
		if (b.trie.endsEntry(c))
			finishMatch(b, q, t, x, c, next);
		if (b.trie.hasChildren(c)) {
			int to = b.state(new Tuple(t.l, c, next.pending, next.blocked, next.longer, next.forbidden));
			b.ret.addArc(q, x, SymbolTable.EPSILON, SEMIRING.ONE(), to);
		}
	}

	private static void finishMatch(Build b, int q, Tuple t, int x, int c, Tuple next) {
		int e = b.trie.getEntry(c);
		int[] out = b.trie.getOutput(e);
		double w = b.trie.getWeight(e);
		int l = b.left.next(t.l, out);
		if (l == Dfa.DEAD)
			return;
		int r = b.right.getStart();
		int[] pending = b.right.isFinal(r) ? next.pending : insert(next.pending, r);
		// inputs extending this one are watched from here on
		int[] longer = b.trie.hasChildren(c) ? insert(next.longer, c) : next.longer;
		int to = b.state(new Tuple(l, PatternCompiler.Trie.ROOT, pending, next.blocked, longer, next.forbidden));
		if (out.length == 0) {
			b.ret.addArc(q, x, SymbolTable.EPSILON, w, to);
			return;
		}
		// x:y1/w, then eps:y2 ... eps:yp
		int curr = q;
		for (int i = 0; i < out.length; i++) {
			int n = i == out.length-1 ? to : b.ret.addState();
			b.ret.addArc(curr, i == 0 ? x : SymbolTable.EPSILON, out[i], i == 0 ? w : SEMIRING.ONE(), n);
			curr = n;
		}
	}

	// right contexts that have now been seen are dropped; null if one can no longer be
	private static int[] advancePending(Dfa right, int[] pending, int x) {
		if (pending.length == 0)
			return pending;
		int[] ret = new int[pending.length];
		int n = 0;
		for (int p : pending) {
			int r = right.next(p, x);
			if (r == Dfa.DEAD)
				return null;
			if (!right.isFinal(r))
				ret[n++] = r;
		}
		return sortUniq(ret, n);
	}

	// blocked rewrites that can no longer complete are dropped; null if one completes
	private static int[] advanceBlocked(Dfa must, int[] blocked, int x) {
		if (blocked.length == 0)
			return blocked;
		int[] ret = new int[blocked.length];
		int n = 0;
		for (int m : blocked) {
			int r = must.next(m, x);
			if (must.isFinal(r))
				return null;
			if (r != Dfa.DEAD)
				ret[n++] = r;
		}
		return sortUniq(ret, n);
	}

	// right contexts of longer inputs that fail are dropped; null if one holds
	private static int[] advanceForbidden(Dfa right, int[] forbidden, int x) {
		if (forbidden.length == 0)
			return forbidden;
		int[] ret = new int[forbidden.length];
		int n = 0;
		for (int f : forbidden) {
			int r = right.next(f, x);
			if (right.isFinal(r))
				return null;
			if (r != Dfa.DEAD)
				ret[n++] = r;
		}
		return sortUniq(ret, n);
	}

	private static boolean isFinal(Build b, Tuple t) {
		if (t.node != PatternCompiler.Trie.ROOT)
			return false;
		for (int p : t.pending)
			if (!b.right.isFinal(b.right.next(p, SymbolTable.EOS)))
				return false;
		for (int m : t.blocked)
			if (b.must.isFinal(b.must.next(m, SymbolTable.EOS)))
				return false;
		for (int f : t.forbidden)
			if (b.right.isFinal(b.right.next(f, SymbolTable.EOS)))
				return false;
		return true;
	}

	private static int[] with(int[] ids, int extra) {
		int[] ret = Arrays.copyOf(ids, ids.length+1);
		ret[ids.length] = extra;
		return ret;
	}
	private static int[] insert(int[] set, int v) {
		if (Arrays.binarySearch(set, v) >= 0)
			return set;
		int[] ret = Arrays.copyOf(set, set.length+1);
		ret[set.length] = v;
		Arrays.sort(ret);
		return ret;
	}
	private static int[] sortUniq(int[] a, int n) {
		if (n == 0)
			return NONE;
		int[] s = Arrays.copyOf(a, n);
		Arrays.sort(s);
		int k = 1;
		for (int i = 1; i < n; i++)
			if (s[i] != s[k-1])
				s[k++] = s[i];
		return k == n ? s : Arrays.copyOf(s, k);
	}
}
