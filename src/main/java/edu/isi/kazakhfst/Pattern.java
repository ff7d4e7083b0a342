package edu.isi.kazakhfst;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A regular expression over symbols, as plain immutable data. Literals stay as text
 * until {@link PatternCompiler} segments them against an alphabet, so one pattern
 * (say, the "rest of the word" closure) can be shared by every rule of a table.
 */
public final class Pattern {

	public enum Kind { EMPTY, LITERAL, ANY, BOS, EOS, UNION, CONCAT, CLOSURE }

	private static final Pattern EMPTY_PAT = new Pattern(Kind.EMPTY, null, Collections.<Pattern>emptyList());
	private static final Pattern ANY_PAT = new Pattern(Kind.ANY, null, Collections.<Pattern>emptyList());
	private static final Pattern BOS_PAT = new Pattern(Kind.BOS, null, Collections.<Pattern>emptyList());
	private static final Pattern EOS_PAT = new Pattern(Kind.EOS, null, Collections.<Pattern>emptyList());

	private final Kind kind;
	private final String text;
	private final List<Pattern> children;

	private Pattern(Kind kind, String text, List<Pattern> children) {
		this.kind = kind;
		this.text = text;
		this.children = children;
	}

	/** the empty string. an empty context always holds */
	public static Pattern empty() { return EMPTY_PAT; }
	/** any single member of the alphabet (not a sentinel) */
	public static Pattern any() { return ANY_PAT; }
	/** any sequence of members */
	public static Pattern anyStar() { return star(ANY_PAT); }
	public static Pattern bos() { return BOS_PAT; }
	public static Pattern eos() { return EOS_PAT; }

	public static Pattern literal(String text) {
		if (text.length() == 0)
			return EMPTY_PAT;
		return new Pattern(Kind.LITERAL, text, Collections.<Pattern>emptyList());
	}
	/** union of literals */
	public static Pattern anyOf(String... texts) {
		ArrayList<Pattern> l = new ArrayList<Pattern>();
		for (String t : texts)
			l.add(literal(t));
		return union(l);
	}
	public static Pattern union(Pattern... ps) {
		return union(Arrays.asList(ps));
	}
	public static Pattern union(List<Pattern> ps) {
		if (ps.isEmpty())
			throw new IllegalArgumentException("Union of no patterns");
		if (ps.size() == 1)
			return ps.get(0);
		return new Pattern(Kind.UNION, null, Collections.unmodifiableList(new ArrayList<Pattern>(ps)));
	}
	public static Pattern concat(Pattern... ps) {
		if (ps.length == 0)
			return EMPTY_PAT;
		if (ps.length == 1)
			return ps[0];
		return new Pattern(Kind.CONCAT, null, Collections.unmodifiableList(new ArrayList<Pattern>(Arrays.asList(ps))));
	}
	public static Pattern star(Pattern p) {
		return new Pattern(Kind.CLOSURE, null, Collections.singletonList(p));
	}

	// fluent forms for rule tables
	public Pattern then(Pattern p) { return concat(this, p); }
	public Pattern then(String lit) { return concat(this, literal(lit)); }

	public Kind getKind() { return kind; }
	public String getText() { return text; }
	public List<Pattern> getChildren() { return children; }

	public String toString() {
		switch (kind) {
		case EMPTY: return "\"\"";
		case LITERAL: return "\""+text+"\"";
		case ANY: return ".";
		case BOS: return SymbolTable.BOS_TEXT;
		case EOS: return SymbolTable.EOS_TEXT;
		case CLOSURE: return "("+children.get(0)+")*";
		default:
			StringBuilder sb = new StringBuilder("(");
			for (int i = 0; i < children.size(); i++) {
				if (i > 0)
					sb.append(kind == Kind.UNION ? " | " : " ");
				sb.append(children.get(i));
			}
			return sb.append(")").toString();
		}
	}
}
