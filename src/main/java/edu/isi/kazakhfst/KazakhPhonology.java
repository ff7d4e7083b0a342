package edu.isi.kazakhfst;

import java.util.Arrays;

import static edu.isi.kazakhfst.Pattern.anyOf;
import static edu.isi.kazakhfst.Pattern.anyStar;
import static edu.isi.kazakhfst.Pattern.bos;
import static edu.isi.kazakhfst.Pattern.empty;
import static edu.isi.kazakhfst.SubstitutionMap.cross;

/**
 * Grapheme-to-phoneme conversion for Kazakh in the 2017 Latin script (standard,
 * non-city dialect). A first rule maps single graphemes and the digraphs sh and ch
 * to phonemes; the rest handle /ý/ under vowel harmony and the glides and
 * uvular release at the start of a word.
 */
public class KazakhPhonology {

	static final String[] GRAPHEMES = {
		"a", "o", "u", "y", "á", "e", "i", "ó",
		"ú", "ý", "b", "d", "g", "f", "ǵ", "h",
		"ı", "j", "k", "l", "m", "n", "ń", "p",
		"q", "r", "s", "t", "v", "x", "z", "sh", "ch"
	};
	static final String[] PHONEMES = {
		"a", "æ", "b", "d", "e", "f", "g", "ɣ", "h",
		"ɪ", "j", "k", "l", "m", "n", "ŋ", "o", "œ",
		"p", "q", "ɾ", "s", "ʃ", "t", "tɕ", "u", "v",
		"χ", "y", "z", "ʒ", "ɯ", "w", "uw", "yw", "ɣʷ", "ɜʷ"
	};

	// whole graphemes as symbols, for checking that a word is spelled with them
	private static final Alphabet SPELLING = Alphabet.create("graphemes", Arrays.asList(GRAPHEMES));

	private static final Pattern BACK_VOWEL = anyOf("a", "o", "u", "y");
	private static final Pattern FRONT_VOWEL = anyOf("á", "e", "i", "ó", "ú");

	public static RuleTable ruleTable() {
		SubstitutionMap g2p = SubstitutionMap.builder()
			.add("y", "ɯ")
			.add("á", "æ")
			.add("i", "ɪ")
			.add("ó", "œ")
			.add("ú", "y")
			.add("ǵ", "ɣ")
			.add("ı", "j")
			.add("j", "ʒ")
			.add("ń", "ŋ")
			.add("r", "ɾ")
			.add("x", "χ")
			.add("sh", "ʃ")
			.add("ch", "tɕ")
			.build();
		return RuleTable.builder("phonology")
			.inputInventory(GRAPHEMES)
			.outputInventory(PHONEMES)
			.group("g2p",
					RewriteRule.obligatory("g2p", g2p, empty(), empty()))
			.group("glides",
					// ý after a back or front vowel anywhere earlier in the word, else word-initially
					RewriteRule.obligatory("u-glide", cross("ý", "uw"), BACK_VOWEL.then(anyStar()), empty()),
					RewriteRule.obligatory("y-glide", cross("ý", "yw"), FRONT_VOWEL.then(anyStar()), empty()),
					RewriteRule.obligatory("w-initial", cross("ý", "w"), bos(), empty()))
			.group("initial",
					RewriteRule.obligatory("q-release", cross("q", "qχ"), bos(), empty()),
					RewriteRule.obligatory("o-prothesis", cross("o", "ɣʷ"), bos(), empty()),
					RewriteRule.obligatory("oe-prothesis", cross("œ", "ɜʷ"), bos(), empty()))
			.build();
	}

	public static CompiledCascade buildPhonologyPipeline(RuleTable table) throws AlphabetMismatchException,
	ConflictingSubstitutionException, EmptyLanguageException, UnusualConditionException {
		return PipelineBuilder.build(table);
	}

	private final CompiledCascade cascade;

	public KazakhPhonology(CompiledCascade cascade) {
		this.cascade = cascade;
	}

	public CompiledCascade getCascade() { return cascade; }

	/**
	 * @throws InvalidSymbolException if the word can't be spelled with the graphemes;
	 * the position counts graphemes, sh and ch being one each
	 * @throws NoValidTransductionException if the rules leave something that isn't a phoneme
	 */
	public String toPhoneme(String word) throws InvalidSymbolException, NoValidTransductionException, UnusualConditionException {
		SPELLING.tokenize(word);
		return Resolver.resolve(cascade, word);
	}
}
