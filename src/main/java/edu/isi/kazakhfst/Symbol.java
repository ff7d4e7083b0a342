package edu.isi.kazakhfst;

// an atomic token: a grapheme, a phoneme, a tag character, or one of the sentinels.
// the id is only meaningful inside the table that issued it; equality is by text
public final class Symbol {
	private final String text;
	private final int id;
	Symbol(String text, int id) {
		this.text = text;
		this.id = id;
	}
	public String getText() { return text; }
	public int getId() { return id; }
	public boolean isSentinel() {
		return id == SymbolTable.BOS || id == SymbolTable.EOS;
	}
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Symbol))
			return false;
		return text.equals(((Symbol)o).text);
	}
	public int hashCode() {
		return text.hashCode();
	}
	public String toString() {
		return text;
	}
}
