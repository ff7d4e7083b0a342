package edu.isi.kazakhfst;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declaration of one pipeline: the strings its input and output are made of, and
 * the rewrite rules in application order, grouped under names for reporting.
 * The working alphabet is every code point of either inventory. Plain data; nothing
 * is checked or compiled until {@link PipelineBuilder#build}.
 */
public final class RuleTable {

	public static final class Builder {
		private final String name;
		private List<String> inputInventory = Collections.emptyList();
		private List<String> outputInventory = Collections.emptyList();
		private final LinkedHashMap<String, List<RewriteRule>> groups = new LinkedHashMap<String, List<RewriteRule>>();

		private Builder(String name) {
			this.name = name;
		}
		/** input is any sequence of these strings */
		public Builder inputInventory(String... inv) {
			inputInventory = Collections.unmodifiableList(new ArrayList<String>(Arrays.asList(inv)));
			return this;
		}
		/** output must be a sequence of these strings */
		public Builder outputInventory(String... inv) {
			outputInventory = Collections.unmodifiableList(new ArrayList<String>(Arrays.asList(inv)));
			return this;
		}
		public Builder group(String groupName, RewriteRule... rules) {
			if (groups.containsKey(groupName))
				throw new IllegalArgumentException("Group "+groupName+" declared twice in "+name);
			groups.put(groupName, Collections.unmodifiableList(new ArrayList<RewriteRule>(Arrays.asList(rules))));
			return this;
		}
		public RuleTable build() {
			if (inputInventory.isEmpty() || outputInventory.isEmpty())
				throw new IllegalStateException("Rule table "+name+" needs both inventories");
			return new RuleTable(this);
		}
	}

	private final String name;
	private final List<String> inputInventory;
	private final List<String> outputInventory;
	private final Map<String, List<RewriteRule>> groups;

	private RuleTable(Builder b) {
		name = b.name;
		inputInventory = b.inputInventory;
		outputInventory = b.outputInventory;
		groups = Collections.unmodifiableMap(new LinkedHashMap<String, List<RewriteRule>>(b.groups));
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	public String getName() { return name; }
	public List<String> getInputInventory() { return inputInventory; }
	public List<String> getOutputInventory() { return outputInventory; }
	public Map<String, List<RewriteRule>> getGroups() { return groups; }

	// both inventories, input first
	List<String> getUniverseInventory() {
		ArrayList<String> ret = new ArrayList<String>(inputInventory);
		ret.addAll(outputInventory);
		return ret;
	}
}
