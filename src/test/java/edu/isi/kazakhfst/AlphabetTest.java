package edu.isi.kazakhfst;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class AlphabetTest {

	@Test
	void shouldReserveEpsilonAndSentinels() {
		Alphabet a = Alphabet.fromInventory("test", "ab");
		SymbolTable t = a.getTable();
		assertThat(t.size()).isEqualTo(5);
		assertThat(t.getString(SymbolTable.EPSILON)).isEmpty();
		assertThat(a.getBos().getText()).isEqualTo("[BOS]");
		assertThat(a.getEos().isSentinel()).isTrue();
		assertThat(a.contains(SymbolTable.BOS)).isFalse();
		assertThat(a.contains(SymbolTable.EOS)).isFalse();
		assertThat(a.size()).isEqualTo(2);
	}

	@Test
	void shouldSplitInventoryIntoCodePoints() {
		List<String> cps = Alphabet.codePoints(Arrays.asList("sh", "ɣʷ", "s"));
		assertThat(cps).containsExactly("s", "h", "ɣ", "ʷ");
	}

	@Test
	void shouldTokenizeLongestMatchFirst() throws Exception {
		Alphabet a = Alphabet.create("digraphs", Arrays.asList("s", "h", "sh", "a"));
		List<Symbol> toks = a.tokenize("shash");
		assertThat(toks).extracting(Symbol::getText).containsExactly("sh", "a", "sh");
	}

	@Test
	void shouldReportPositionOfInvalidSymbol() {
		Alphabet a = Alphabet.fromInventory("letters", "abc");
		InvalidSymbolException e = catchThrowableOfType(() -> a.tokenize("ab1c"), InvalidSymbolException.class);
		assertThat(e.getSymbol()).isEqualTo("1");
		assertThat(e.getPosition()).isEqualTo(2);
		assertThat(e.getMessage()).contains("letters");
	}

	@Test
	void shouldRestrictOverSameTable() throws Exception {
		Alphabet all = Alphabet.fromInventory("all", "abcd");
		Alphabet ab = all.restrictToInventory("ab", "a", "b");
		assertThat(ab.isCompatible(all)).isTrue();
		assertThat(all.containsAll(ab)).isTrue();
		assertThat(ab.containsAll(all)).isFalse();
		assertThat(ab.getMembers()).extracting(Symbol::getText).containsExactly("a", "b");
		assertThatThrownBy(() -> all.restrictToInventory("bad", "x"))
				.isInstanceOf(AlphabetMismatchException.class);
	}

	@Test
	void shouldCompareSymbolsByText() {
		Alphabet one = Alphabet.fromInventory("one", "ab");
		Alphabet two = Alphabet.fromInventory("two", "ba");
		assertThat(one.getSymbol(3)).isEqualTo(two.getSymbol(4));
		assertThat(two.contains(one.getSymbol(3))).isTrue();
		assertThat(one).isNotEqualTo(two);
	}
}
