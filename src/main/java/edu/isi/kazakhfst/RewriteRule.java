package edu.isi.kazakhfst;

/**
 * phi -> psi / lambda _ rho, as declared data. The left context is matched against
 * what the rule has written so far (preceded by [BOS]), the right context against
 * the input still to be read (followed by [EOS]).
 */
public final class RewriteRule {
	private final String name;
	private final SubstitutionMap map;
	private final Pattern left;
	private final Pattern right;
	private final boolean obligatory;

	public RewriteRule(String name, SubstitutionMap map, Pattern left, Pattern right, boolean obligatory) {
		this.name = name;
		this.map = map;
		this.left = left;
		this.right = right;
		this.obligatory = obligatory;
	}

	public static RewriteRule obligatory(String name, SubstitutionMap map, Pattern left, Pattern right) {
		return new RewriteRule(name, map, left, right, true);
	}
	public static RewriteRule optional(String name, SubstitutionMap map, Pattern left, Pattern right) {
		return new RewriteRule(name, map, left, right, false);
	}

	public String getName() { return name; }
	public SubstitutionMap getMap() { return map; }
	public Pattern getLeft() { return left; }
	public Pattern getRight() { return right; }
	public boolean isObligatory() { return obligatory; }

	public String toString() {
		return name+": "+map+" / "+left+" _ "+right+(obligatory ? "" : " (optional)");
	}
}
