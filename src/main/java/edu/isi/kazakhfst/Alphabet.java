package edu.isi.kazakhfst;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

import gnu.trove.TIntArrayList;
import gnu.trove.TIntHashSet;

/**
 * A named set of symbols over a {@link SymbolTable}. Alphabets built with
 * {@link #restrict} share their parent's table, so automata over a pipeline's
 * grapheme, phoneme and universal alphabets can be composed with each other.
 * The sentinels are never members, but patterns may always mention them.
 */
public class Alphabet {
	private final String name;
	private final SymbolTable table;
	// members in declared order; this order is the arc order of compiled rules
	private final int[] members;
	private final TIntHashSet memberSet;

	private Alphabet(String name, SymbolTable table, int[] members) {
		this.name = name;
		this.table = table;
		this.members = members;
		memberSet = new TIntHashSet();
		for (int id : members)
			memberSet.add(id);
	}

	/** a fresh table holding exactly these symbols */
	public static Alphabet create(String name, Collection<String> symbols) {
		LinkedHashSet<String> uniq = new LinkedHashSet<String>(symbols);
		SymbolTable table = new SymbolTable(uniq);
		TIntArrayList ids = new TIntArrayList();
		for (String s : uniq)
			ids.add(table.lookup(s).getId());
		return new Alphabet(name, table, ids.toNativeArray());
	}

	/** symbols are the individual code points of every inventory entry */
	public static Alphabet fromInventory(String name, String... inventory) {
		return create(name, codePoints(Arrays.asList(inventory)));
	}

	// split strings into code point strings, first occurrence order
	public static List<String> codePoints(Collection<String> strs) {
		LinkedHashSet<String> ret = new LinkedHashSet<String>();
		for (String s : strs) {
			int i = 0;
			while (i < s.length()) {
				int cp = s.codePointAt(i);
				ret.add(new String(Character.toChars(cp)));
				i += Character.charCount(cp);
			}
		}
		return new ArrayList<String>(ret);
	}

	/** sub-alphabet over the same table */
	public Alphabet restrict(String subname, Collection<String> symbols) throws AlphabetMismatchException {
		TIntArrayList ids = new TIntArrayList();
		for (String s : new LinkedHashSet<String>(symbols)) {
			Symbol sym = table.lookup(s);
			if (sym == null || !memberSet.contains(sym.getId()))
				throw new AlphabetMismatchException("Can't restrict "+name+" to "+subname+": "+s+" is not a member");
			ids.add(sym.getId());
		}
		return new Alphabet(subname, table, ids.toNativeArray());
	}
	public Alphabet restrictToInventory(String subname, String... inventory) throws AlphabetMismatchException {
		return restrict(subname, codePoints(Arrays.asList(inventory)));
	}

	public String getName() { return name; }
	public SymbolTable getTable() { return table; }
	public int size() { return members.length; }
	public int[] getMemberIds() { return members.clone(); }
	public List<Symbol> getMembers() {
		ArrayList<Symbol> ret = new ArrayList<Symbol>();
		for (int id : members)
			ret.add(table.get(id));
		return Collections.unmodifiableList(ret);
	}
	public Symbol getSymbol(int id) { return table.get(id); }
	public Symbol getBos() { return table.get(SymbolTable.BOS); }
	public Symbol getEos() { return table.get(SymbolTable.EOS); }

	public boolean contains(int id) {
		return memberSet.contains(id);
	}
	public boolean contains(Symbol s) {
		Symbol mine = table.lookup(s.getText());
		return mine != null && memberSet.contains(mine.getId());
	}
	// same id space
	public boolean isCompatible(Alphabet o) {
		return table == o.table;
	}
	public boolean containsAll(Alphabet o) {
		if (!isCompatible(o))
			return false;
		for (int id : o.members)
			if (!memberSet.contains(id))
				return false;
		return true;
	}

	/**
	 * Greedy longest-match segmentation of a word into member symbols.
	 * @throws InvalidSymbolException at the first position where no member matches
	 */
	public List<Symbol> tokenize(String word) throws InvalidSymbolException {
		ArrayList<Symbol> ret = new ArrayList<Symbol>();
		int pos = 0;
		int index = 0;
		while (pos < word.length()) {
			Symbol found = longestAt(word, pos);
			if (found == null) {
				int cp = word.codePointAt(pos);
				throw new InvalidSymbolException(new String(Character.toChars(cp)), index, name);
			}
			ret.add(found);
			pos += found.getText().length();
			index++;
		}
		return ret;
	}
	// same segmentation for pattern literals, but a miss is an authoring error
	int[] tokenizeIds(String text) throws AlphabetMismatchException {
		TIntArrayList ids = new TIntArrayList();
		int pos = 0;
		while (pos < text.length()) {
			Symbol found = longestAt(text, pos);
			if (found == null)
				throw new AlphabetMismatchException("Literal \""+text+"\" has a symbol at offset "+pos+" that is not in alphabet "+name);
			ids.add(found.getId());
			pos += found.getText().length();
		}
		return ids.toNativeArray();
	}
	private Symbol longestAt(String word, int pos) {
		int max = Math.min(table.getMaxLength(), word.length()-pos);
		for (int len = max; len > 0; len--) {
			Symbol s = table.lookup(word.substring(pos, pos+len));
			if (s != null && memberSet.contains(s.getId()))
				return s;
		}
		return null;
	}

	public String toString(int[] ids) {
		StringBuilder sb = new StringBuilder();
		for (int id : ids)
			sb.append(table.getString(id));
		return sb.toString();
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Alphabet))
			return false;
		Alphabet a = (Alphabet)o;
		return containsAll(a) && a.containsAll(this);
	}
	public int hashCode() {
		return System.identityHashCode(table)*31 + members.length;
	}
	public String toString() {
		return name+"("+members.length+" symbols)";
	}
}
