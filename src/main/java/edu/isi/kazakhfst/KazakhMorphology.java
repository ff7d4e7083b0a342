package edu.isi.kazakhfst;

import static edu.isi.kazakhfst.Pattern.anyOf;
import static edu.isi.kazakhfst.Pattern.anyStar;
import static edu.isi.kazakhfst.Pattern.bos;
import static edu.isi.kazakhfst.Pattern.empty;
import static edu.isi.kazakhfst.Pattern.eos;
import static edu.isi.kazakhfst.Pattern.literal;
import static edu.isi.kazakhfst.Pattern.union;
import static edu.isi.kazakhfst.SubstitutionMap.cross;

/**
 * Affixal inflection for Kazakh (2017 Latin script) under vowel and consonant
 * harmony. Input is a stem followed by tags, e.g. {@code bala+PLR+1SING-POSS};
 * output is the inflected word, {@code balalarym}. Tense is not covered.
 * <p>
 * Supported tags: +PLR, +1SING-POSS, +1PLR-POSS, +2SING-POSS, +2PLR-POSS, +3-POSS,
 * +NEG, +CAUSE, +PASS, +ACC, +DAT, +GEN, +LOC, +ABL, +INS, +PRES-PTCP, +PAST-PTCP.
 * <p>
 * A possessive followed by a case ending leaves a ^ boundary that the case rules
 * pick up (balasy^+DAT gives balasyna). Tags no rule consumes make the word fail.
 */
public class KazakhMorphology {

	static final String[] VOWELS = {
		"a", "o", "u", "y",
		"á", "e", "i", "ú", "ó"
	};
	static final String[] CONSONANTS = {
		"ý", "b", "d", "f",
		"g", "ǵ", "h", "ı",
		"j", "k", "l", "m",
		"n", "ń", "p", "q",
		"r", "s", "t", "v",
		"x", "z", "sh", "ch"
	};
	static final String[] TAG_SYMBOLS = {
		"A", "B", "C", "D",
		"E", "F", "G", "H",
		"I", "J", "K", "L",
		"M", "N", "O", "P",
		"Q", "R", "S", "T",
		"U", "V", "W", "X",
		"Y", "Z", "+", "1",
		"2", "3", "-", "^"
	};

	private static final Pattern V = anyOf(VOWELS);
	private static final Pattern C = anyOf(CONSONANTS);
	// vowel classes, for vowel harmony. ı after a vowel counts with it
	private static final Pattern V_FRONT = union(
			anyOf("á", "e", "i", "ó", "ú"),
			bos().then("ı"),
			anyOf("áı", "eı", "iı", "óı", "úı"));
	private static final Pattern V_BACK = anyOf(
			"a", "o", "u", "y",
			"aı", "oı", "uı", "yı");
	// consonant classes, for consonant harmony
	private static final Pattern NASAL = anyOf("m", "n", "ń");
	private static final Pattern LIQUID = anyOf("l", "ı", "ý");
	private static final Pattern V_FRIC = anyOf("z", "j", "v");
	private static final Pattern LIQUID_V_FRIC = anyOf("z", "j", "v", "r", "l", "ı", "ý");
	private static final Pattern SONORANT_V_FRIC = anyOf(
			"v", "ı", "ý", "r",
			"l", "m", "n", "ń",
			"z", "j");
	// includes voiced consonants that devoice in coda position
	private static final Pattern VOICELESS = anyOf(
			"b", "p", "g", "k",
			"f", "h", "d", "p",
			"q", "s", "t", "x",
			"sh", "ch");

	private static final Pattern FRONT_ANY = V_FRONT.then(anyStar());
	private static final Pattern BACK_ANY = V_BACK.then(anyStar());

	private static RewriteRule rule(String name, SubstitutionMap map, Pattern left) {
		return RewriteRule.obligatory(name, map, left, empty());
	}
	private static RewriteRule rule(String name, SubstitutionMap map, Pattern left, Pattern right) {
		return RewriteRule.obligatory(name, map, left, right);
	}

	public static RuleTable ruleTable() {
		RuleTable.Builder b = RuleTable.builder("morphology");
		String[] input = new String[VOWELS.length+CONSONANTS.length+TAG_SYMBOLS.length];
		System.arraycopy(VOWELS, 0, input, 0, VOWELS.length);
		System.arraycopy(CONSONANTS, 0, input, VOWELS.length, CONSONANTS.length);
		System.arraycopy(TAG_SYMBOLS, 0, input, VOWELS.length+CONSONANTS.length, TAG_SYMBOLS.length);
		String[] output = new String[VOWELS.length+CONSONANTS.length];
		System.arraycopy(VOWELS, 0, output, 0, VOWELS.length);
		System.arraycopy(CONSONANTS, 0, output, VOWELS.length, CONSONANTS.length);
		b.inputInventory(input).outputInventory(output);

		b.group("plural",
				rule("plural-ler", cross("+PLR", "ler"), V_FRONT),
				rule("plural-lar", cross("+PLR", "lar"), V_BACK),
				rule("plural-der", cross("+PLR", "der"), V_FRONT.then(SONORANT_V_FRIC)),
				rule("plural-dar", cross("+PLR", "dar"), V_BACK.then(SONORANT_V_FRIC)),
				rule("plural-ter", cross("+PLR", "ter"), V_FRONT.then(VOICELESS)),
				rule("plural-tar", cross("+PLR", "tar"), V_BACK.then(VOICELESS)));

		Pattern loc = literal("+LOC");
		Pattern abl = literal("+ABL");
		Pattern dat = literal("+DAT");
		b.group("possessive",
				// third person before locative and ablative keeps a ^ for the case ending
				rule("poss3-loc-si", cross("+3-POSS", "si^"), V_FRONT, loc),
				rule("poss3-loc-sy", cross("+3-POSS", "sy^"), V_BACK, loc),
				rule("poss3-loc-i", cross("+3-POSS", "i^"), V_FRONT.then(C), loc),
				rule("poss3-loc-y", cross("+3-POSS", "y^"), V_BACK.then(C), loc),
				rule("poss3-abl-si", cross("+3-POSS", "si^"), V_FRONT, abl),
				rule("poss3-abl-sy", cross("+3-POSS", "sy^"), V_BACK, abl),
				rule("poss3-abl-i", cross("+3-POSS", "i^"), V_FRONT.then(C), abl),
				rule("poss3-abl-y", cross("+3-POSS", "y^"), V_BACK.then(C), abl),
				// every person before dative
				rule("poss-dat-vowel", SubstitutionMap.builder()
						.add("+1SING-POSS", "m^")
						.add("+2SING-POSS", "ń^")
						.build(), V, dat),
				rule("poss-dat-front", SubstitutionMap.builder()
						.add("+1PLR-POSS", "miz^")
						.add("+2PLR-POSS", "ńiz^")
						.add("+3-POSS", "si^")
						.build(), V_FRONT, dat),
				rule("poss-dat-back", SubstitutionMap.builder()
						.add("+1PLR-POSS", "myz^")
						.add("+2PLR-POSS", "ńyz^")
						.add("+3-POSS", "sy^")
						.build(), V_BACK, dat),
				rule("poss-dat-front-c", SubstitutionMap.builder()
						.add("+1SING-POSS", "im^")
						.add("+1PLUR-POSS", "imiz^")
						.add("+2SING-POSS", "iń^")
						.add("+2PLR-POSS", "ińiz^")
						.add("+3-POSS", "i^")
						.build(), V_FRONT.then(C), dat),
				rule("poss-dat-back-c", SubstitutionMap.builder()
						.add("+1SING-POSS", "ym^")
						.add("+1PLR-POSS", "ymyz^")
						.add("+2SING-POSS", "yń^")
						.add("+2PLR-POSS", "yńyz^")
						.add("+3-POSS", "y^")
						.build(), V_FRONT.then(C), dat),
				// and with no case ending
				rule("poss-vowel", SubstitutionMap.builder()
						.add("+1SING-POSS", "m")
						.add("+2SING-POSS", "ń")
						.build(), V),
				rule("poss-front", SubstitutionMap.builder()
						.add("+1PLR-POSS", "miz")
						.add("+2PLR-POSS", "ńiz")
						.add("+3-POSS", "si")
						.build(), V_FRONT),
				rule("poss-back", SubstitutionMap.builder()
						.add("+1PLR-POSS", "myz")
						.add("+2PLR-POSS", "ńyz")
						.add("+3-POSS", "sy")
						.build(), V_BACK),
				rule("poss-front-c", SubstitutionMap.builder()
						.add("+1SING-POSS", "im")
						.add("+1PLR-POSS", "imiz")
						.add("+2SING-POSS", "iń")
						.add("+2PLR-POSS", "ińiz")
						.add("+3-POSS", "i")
						.build(), V_FRONT.then(C)),
				rule("poss-back-c", SubstitutionMap.builder()
						.add("+1SING-POSS", "ym")
						.add("+1PLR-POSS", "ymyz")
						.add("+2SING-POSS", "yń")
						.add("+2PLR-POSS", "yńyz")
						.add("+3-POSS", "y")
						.build(), V_BACK.then(C)));

		b.group("negative",
				rule("neg-me", cross("ý+NEG", "meý"), union(V_FRONT, V_FRONT.then(LIQUID))),
				rule("neg-ma", cross("ý+NEG", "maý"), union(V_BACK, V_BACK.then(LIQUID))),
				rule("neg-be", cross("ý+NEG", "beý"), union(V_FRONT.then(NASAL), V_FRONT.then(V_FRIC))),
				rule("neg-ba", cross("ý+NEG", "baý"), union(V_BACK.then(NASAL), V_BACK.then(V_FRIC))),
				rule("neg-pe", cross("ý+NEG", "peý"), V_FRONT.then(VOICELESS)),
				rule("neg-pa", cross("ý+NEG", "paý"), V_BACK.then(VOICELESS)));

		b.group("causative",
				rule("cause-t", cross("ý+CAUSE", "tý"), V),
				rule("cause-tir", cross("ý+CAUSE", "tirý"), V_FRONT.then(VOICELESS)),
				rule("cause-tyr", cross("ý+CAUSE", "tyrý"), V_BACK.then(VOICELESS)),
				rule("cause-dir", cross("ý+CAUSE", "dirý"), FRONT_ANY),
				rule("cause-dyr", cross("ý+CAUSE", "dyrý"), BACK_ANY));

		b.group("passive",
				rule("pass-in", cross("ý+PASS", "iný"), V_FRONT.then("l")),
				rule("pass-yn", cross("ý+PASS", "yný"), V_BACK.then("l")),
				rule("pass-il", cross("ý+PASS", "ilý"), FRONT_ANY),
				rule("pass-yl", cross("ý+PASS", "ylý"), BACK_ANY));

		b.group("accusative",
				rule("acc-ti", cross("+ACC", "ti"), union(V_FRONT.then(VOICELESS), FRONT_ANY.then(VOICELESS))),
				rule("acc-ty", cross("+ACC", "ty"), union(V_BACK.then(VOICELESS), BACK_ANY.then(VOICELESS))),
				rule("acc-ni", cross("+ACC", "ni"), V_FRONT),
				rule("acc-ny", cross("+ACC", "ny"), V_BACK),
				rule("acc-poss", cross("^+ACC", "n"), empty(), eos()),
				rule("acc-di", cross("+ACC", "di"), FRONT_ANY),
				rule("acc-dy", cross("+ACC", "dy"), BACK_ANY));

		b.group("dative",
				rule("dat-poss-ne", cross("^+DAT", "ne"), V_FRONT),
				rule("dat-poss-na", cross("^+DAT", "na"), V_BACK),
				rule("dat-poss-e", cross("^+DAT", "e"), FRONT_ANY),
				rule("dat-poss-a", cross("^+DAT", "a"), BACK_ANY),
				rule("dat-ge", cross("+DAT", "ge"), union(V_FRONT, V_FRONT.then(SONORANT_V_FRIC))),
				rule("dat-ga", cross("+DAT", "ǵa"), union(V_BACK, V_BACK.then(SONORANT_V_FRIC))),
				rule("dat-ke", cross("+DAT", "ke"), V_FRONT.then(C)),
				rule("dat-qa", cross("+DAT", "qa"), V_BACK.then(C)));

		b.group("genitive",
				rule("gen-nin", cross("+GEN", "niń"), union(V_FRONT, V_FRONT.then(NASAL))),
				rule("gen-nyn", cross("+GEN", "nyń"), union(V_BACK, V_BACK.then(NASAL))),
				rule("gen-din", cross("+GEN", "diń"), V_FRONT.then(LIQUID_V_FRIC)),
				rule("gen-dyn", cross("+GEN", "dyń"), V_BACK.then(LIQUID_V_FRIC)),
				rule("gen-tin", cross("+GEN", "tiń"), union(V_FRONT.then(VOICELESS), FRONT_ANY)),
				rule("gen-tyn", cross("+GEN", "tyń"), union(V_BACK.then(VOICELESS), FRONT_ANY)));

		b.group("locative",
				rule("loc-poss-nde", cross("^+LOC", "nde"), V_FRONT),
				rule("loc-poss-nda", cross("^+LOC", "nda"), V_BACK),
				rule("loc-te", cross("+LOC", "te"), V_FRONT.then(VOICELESS)),
				rule("loc-ta", cross("+LOC", "ta"), V_BACK.then(VOICELESS)),
				rule("loc-de", cross("+LOC", "de"), union(V_FRONT, FRONT_ANY)),
				rule("loc-da", cross("+LOC", "da"), union(V_BACK, BACK_ANY)));

		b.group("ablative",
				rule("abl-poss-nen", cross("^+ABL", "nen"), V_FRONT),
				rule("abl-poss-nan", cross("^+ABL", "nan"), V_BACK),
				rule("abl-den", cross("+ABL", "den"), union(V_FRONT, V_FRONT.then(LIQUID_V_FRIC))),
				rule("abl-dan", cross("+ABL", "dan"), union(V_BACK, V_BACK.then(LIQUID_V_FRIC))),
				rule("abl-nen", cross("+ABL", "nen"), V_FRONT.then(NASAL)),
				rule("abl-nan", cross("+ABL", "nan"), V_BACK.then(NASAL)),
				rule("abl-ten", cross("+ABL", "ten"), union(V_FRONT.then(VOICELESS), FRONT_ANY.then(VOICELESS))),
				rule("abl-tan", cross("+ABL", "tan"), union(V_BACK.then(VOICELESS), BACK_ANY.then(VOICELESS))));

		b.group("instrumental",
				rule("ins-men", cross("+INS", "men"), union(V, NASAL, literal("l"), literal("r"))),
				rule("ins-ben", cross("+INS", "ben"), anyOf("z", "j")),
				rule("ins-pen", cross("+INS", "pen"), VOICELESS));

		b.group("present-participle",
				rule("pres-ptcp-ietin", cross("ý+PRES-PTCP", "ıetin"), V_FRONT),
				rule("pres-ptcp-iatyn", cross("ý+PRES-PTCP", "ıatyn"), V_BACK),
				rule("pres-ptcp-etin", cross("ý+PRES-PTCP", "etin"), V_FRONT.then(C)),
				rule("pres-ptcp-atyn", cross("ý+PRES-PTCP", "atyn"), V_BACK.then(C)));

		b.group("past-participle",
				rule("past-ptcp-gen", cross("ý+PAST-PTCP", "gen"), union(V_FRONT, V_FRONT.then(SONORANT_V_FRIC))),
				rule("past-ptcp-gan", cross("ý+PAST-PTCP", "ǵan"), union(V_BACK, V_BACK.then(SONORANT_V_FRIC))),
				rule("past-ptcp-ken", cross("ý+PAST-PTCP", "ken"), V_FRONT.then(VOICELESS)),
				rule("past-ptcp-qan", cross("ý+PAST-PTCP", "qan"), V_BACK.then(VOICELESS)));

		return b.build();
	}

	public static CompiledCascade buildMorphologyPipeline(RuleTable table) throws AlphabetMismatchException,
	ConflictingSubstitutionException, EmptyLanguageException, UnusualConditionException {
		return PipelineBuilder.build(table);
	}

	private final CompiledCascade cascade;

	public KazakhMorphology(CompiledCascade cascade) {
		this.cascade = cascade;
	}

	public CompiledCascade getCascade() { return cascade; }

	/**
	 * @throws InvalidSymbolException if the input has a character that is neither a letter nor a tag character
	 * @throws NoValidTransductionException if some tag isn't realized, e.g. an unknown tag
	 */
	public String inflect(String taggedWord) throws InvalidSymbolException, NoValidTransductionException, UnusualConditionException {
		return Resolver.resolve(cascade, taggedWord);
	}
}
