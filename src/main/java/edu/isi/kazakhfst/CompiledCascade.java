package edu.isi.kazakhfst;

/**
 * A compiled pipeline: one optimized transducer plus the alphabets its callers
 * see. Immutable once built, so one instance can serve any number of threads.
 */
public final class CompiledCascade {
	private final String name;
	private final Automaton automaton;
	private final int numRules;

	public CompiledCascade(String name, Automaton automaton, int numRules) {
		this.name = name;
		this.automaton = automaton;
		this.numRules = numRules;
	}

	public String getName() { return name; }
	public Automaton getAutomaton() { return automaton; }
	public Alphabet getInputAlphabet() { return automaton.getInputAlphabet(); }
	public Alphabet getOutputAlphabet() { return automaton.getOutputAlphabet(); }
	public int getNumRules() { return numRules; }
	public int getNumStates() { return automaton.getNumStates(); }
	public int getNumArcs() { return automaton.getNumArcs(); }

	/** one line summary, as printed by the command line check mode */
	public String getStats() {
		return name+": "+numRules+" rules, "+getNumStates()+" states, "+getNumArcs()+" arcs, "+
			getInputAlphabet()+" -> "+getOutputAlphabet();
	}

	public String toString() {
		return getStats();
	}
}
