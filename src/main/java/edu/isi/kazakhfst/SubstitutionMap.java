package edu.isi.kazakhfst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered (input, output, weight) entries of one rewrite rule. Inputs must be
 * non-empty and distinct; that is checked against the rule's alphabet when the map
 * is compiled, since only then is a literal split into symbols. Where one input is a
 * prefix of another, the longer one wins wherever it applies.
 */
public final class SubstitutionMap {

	public static final class Entry {
		private final String input;
		private final String output;
		private final double weight;
		Entry(String input, String output, double weight) {
			this.input = input;
			this.output = output;
			this.weight = weight;
		}
		public String getInput() { return input; }
		public String getOutput() { return output; }
		public double getWeight() { return weight; }
		public String toString() {
			return input+" -> "+output+(weight != 0 ? " # "+weight : "");
		}
	}

	public static final class Builder {
		private final ArrayList<Entry> entries = new ArrayList<Entry>();
		private Builder() {}
		public Builder add(String input, String output) {
			return add(input, output, 0);
		}
		// weights are tropical costs, so they can't be negative
		public Builder add(String input, String output, double weight) {
			if (weight < 0 || Double.isNaN(weight))
				throw new IllegalArgumentException("Bad weight "+weight+" for "+input+" -> "+output);
			entries.add(new Entry(input, output, weight));
			return this;
		}
		public SubstitutionMap build() {
			if (entries.isEmpty())
				throw new IllegalStateException("Substitution map has no entries");
			return new SubstitutionMap(new ArrayList<Entry>(entries));
		}
	}

	private final List<Entry> entries;

	private SubstitutionMap(List<Entry> entries) {
		this.entries = Collections.unmodifiableList(entries);
	}

	public static Builder builder() {
		return new Builder();
	}
	/** the single pair map behind most rules */
	public static SubstitutionMap cross(String input, String output) {
		return builder().add(input, output).build();
	}

	public List<Entry> getEntries() { return entries; }
	public int size() { return entries.size(); }

	public String toString() {
		return entries.toString();
	}
}
