package edu.isi.kazakhfst;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Compiles a {@link RuleTable} into a {@link CompiledCascade}: every rule over the
 * table's working alphabet, then the whole cascade between an acceptor for valid
 * input and an acceptor for valid output, composed and optimized. Any failure
 * aborts the build; nothing partially compiled is returned.
 */
public class PipelineBuilder {

	private static final Semiring SEMIRING = new TropicalSemiring();

	public static CompiledCascade build(RuleTable table) throws AlphabetMismatchException,
	ConflictingSubstitutionException, EmptyLanguageException, UnusualConditionException {
		boolean debug = false;
		Date startTime = new Date();
		String name = table.getName();
		Alphabet universe = Alphabet.create(name, Alphabet.codePoints(table.getUniverseInventory()));
		Alphabet input = universe.restrictToInventory(name+"-input", table.getInputInventory().toArray(new String[0]));
		Alphabet output = universe.restrictToInventory(name+"-output", table.getOutputInventory().toArray(new String[0]));
		if (debug) Debug.debug(debug, "Alphabets "+universe+", "+input+", "+output);

		ArrayList<Automaton> cascade = new ArrayList<Automaton>();
		cascade.add(restriction(table.getInputInventory(), universe).withAlphabets(input, input));
		int numRules = 0;
		for (Map.Entry<String, List<RewriteRule>> group : table.getGroups().entrySet()) {
			Date groupTime = new Date();
			for (RewriteRule rule : group.getValue()) {
				Date ruleTime = new Date();
				Automaton a = RewriteCompiler.compile(rule, universe);
				Debug.dbtime(3, ruleTime, "compiled rule "+rule.getName()+" ("+a.getNumStates()+" states)");
				cascade.add(a);
				numRules++;
			}
			Debug.dbtime(2, groupTime, "compiled group "+group.getKey());
		}
		cascade.add(restriction(table.getOutputInventory(), universe).withAlphabets(universe, output));

		Date composeTime = new Date();
		Automaton composed;
		try {
			composed = CascadeComposer.compose(cascade);
		}
		catch (EmptyLanguageException e) {
			throw new EmptyLanguageException("Pipeline "+name+" accepts no input", e);
		}
		Debug.dbtime(2, composeTime, "composed "+name);
		CompiledCascade ret = new CompiledCascade(name, composed, numRules);
		Debug.dbtime(1, startTime, "built "+ret.getStats());
		return ret;
	}

	// any sequence of the inventory strings
	private static Automaton restriction(List<String> inventory, Alphabet universe) throws AlphabetMismatchException, EmptyLanguageException {
		Pattern any = Pattern.anyOf(inventory.toArray(new String[0]));
		return PatternCompiler.compile(Pattern.star(any), universe);
	}
}
