package edu.isi.kazakhfst;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;

// maps symbol text to ids and back. ids 0-2 are reserved for epsilon and the sentinels;
// everything else is numbered in the order given. filled once at construction,
// so tables can be shared by any number of alphabets and threads
public class SymbolTable {
	public static final int EPSILON = 0;
	public static final int BOS = 1;
	public static final int EOS = 2;
	public static final String EPSILON_TEXT = "*e*";
	public static final String BOS_TEXT = "[BOS]";
	public static final String EOS_TEXT = "[EOS]";

	private final ArrayList<Symbol> i2s;
	private final HashMap<String, Symbol> str2Sym;
	// longest symbol text, in chars. bounds tokenization lookahead
	private int maxLength;

	public SymbolTable(Collection<String> texts) {
		boolean debug = false;
		i2s = new ArrayList<Symbol>();
		str2Sym = new HashMap<String, Symbol>();
		add(EPSILON_TEXT);
		add(BOS_TEXT);
		add(EOS_TEXT);
		maxLength = 0;
		for (String t : texts) {
			if (t.length() == 0)
				throw new IllegalArgumentException("Empty symbol text");
			if (str2Sym.containsKey(t))
				continue;
			Symbol s = add(t);
			if (debug) Debug.debug(debug, "Added "+t+" as "+s.getId());
			maxLength = Math.max(maxLength, t.length());
		}
	}
	private Symbol add(String t) {
		Symbol s = new Symbol(t, i2s.size());
		i2s.add(s);
		str2Sym.put(t, s);
		return s;
	}

	public int size() { return i2s.size(); }
	public int getMaxLength() { return maxLength; }
	public Symbol get(int id) { return i2s.get(id); }
	// null if not present
	public Symbol lookup(String text) { return str2Sym.get(text); }

	public String getString(int id) {
		if (id == EPSILON)
			return "";
		return i2s.get(id).getText();
	}
}
