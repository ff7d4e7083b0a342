package edu.isi.kazakhfst;

// one transition: in:out/weight -> to. labels are symbol table ids, 0 being epsilon
public final class Arc {
	public final int in;
	public final int out;
	public final double weight;
	public final int to;
	public Arc(int in, int out, double weight, int to) {
		this.in = in;
		this.out = out;
		this.weight = weight;
		this.to = to;
	}
	public boolean isEpsilon() {
		return in == SymbolTable.EPSILON && out == SymbolTable.EPSILON;
	}
	public String toString() {
		return in+":"+out+"/"+weight+" -> "+to;
	}
}
