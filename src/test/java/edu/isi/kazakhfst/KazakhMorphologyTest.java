package edu.isi.kazakhfst;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KazakhMorphologyTest {

	private static KazakhMorphology morph;

	@BeforeAll
	static void compile() throws Exception {
		morph = new KazakhMorphology(KazakhMorphology.buildMorphologyPipeline(KazakhMorphology.ruleTable()));
	}

	@ParameterizedTest
	@CsvSource({
		// negative
		"sený+NEG, senbeý",
		"jazý+NEG, jazbaý",
		"qulý+NEG, qulmaý",
		"jeý+NEG, jemeý",
		"satý+NEG, satpaý",
		"kótý+NEG, kótpeý",
		// causative
		"sený+CAUSE, sendirý",
		"jazý+CAUSE, jazdyrý",
		"qulý+CAUSE, quldyrý",
		"jeý+CAUSE, jetý",
		"satý+CAUSE, sattyrý",
		"kótý+CAUSE, kóttirý",
		// passive
		"sený+PASS, senilý",
		"alý+PASS, alyný",
		"jazý+PASS, jazylý",
		"qulý+PASS, qulyný",
		// participles
		"sený+PRES-PTCP, senetin",
		"alý+PRES-PTCP, alatyn",
		"jeý+PRES-PTCP, jeıetin",
		"sený+PAST-PTCP, sengen",
		"jazý+PAST-PTCP, jazǵan",
		"jeý+PAST-PTCP, jegen",
		"satý+PAST-PTCP, satqan",
		"kótý+PAST-PTCP, kótken"
	})
	void shouldInflectVerbs(String input, String expected) throws Exception {
		assertThat(morph.inflect(input)).isEqualTo(expected);
	}

	@ParameterizedTest
	@CsvSource({
		"bala+PLR, balalar",
		"kirpi+PLR, kirpiler",
		"sóz+PLR, sózder",
		"adam+PLR, adamdar",
		"mektep+PLR, mektepter",
		"qazaq+PLR, qazaqtar"
	})
	void shouldPluralize(String input, String expected) throws Exception {
		assertThat(morph.inflect(input)).isEqualTo(expected);
	}

	@ParameterizedTest
	@CsvSource({
		"bala+1SING-POSS, balam",
		"bala+PLR+1SING-POSS, balalarym",
		"adam+2SING-POSS, adamyń",
		"adam+PLR+2SING-POSS, adamdaryń",
		"mektep+1PLR-POSS, mektepimiz",
		"qala+1PLR-POSS, qalamyz",
		"bala+2PLR-POSS, balańyz",
		"bala+PLR+2PLR-POSS, balalaryńyz",
		"kirpi+3-POSS, kirpisi",
		"kirpi+PLR+3-POSS, kirpileri"
	})
	void shouldAddPossessives(String input, String expected) throws Exception {
		assertThat(morph.inflect(input)).isEqualTo(expected);
	}

	@ParameterizedTest
	@CsvSource({
		// accusative
		"qala+ACC, qalany",
		"qazaq+ACC, qazaqty",
		"sóz+ACC, sózdi",
		"adam+ACC, adamdy",
		"shymkent+ACC, shymkentti",
		// genitive
		"qala+GEN, qalanyń",
		"shymkent+GEN, shymkenttiń",
		"sóz+GEN, sózdiń",
		"qazaq+GEN, qazaqtyń",
		// dative
		"bala+DAT, balaǵa",
		"qazaq+DAT, qazaqqa",
		"sóz+DAT, sózge",
		"mektep+DAT, mektepke",
		// locative
		"qala+LOC, qalada",
		"kól+LOC, kólde",
		"saıt+LOC, saıtta",
		"mektep+LOC, mektepte",
		// ablative
		"qala+ABL, qaladan",
		"qazaqstan+ABL, qazaqstannan",
		"shymkent+ABL, shymkentten",
		"kól+ABL, kólden",
		// instrumental, consonant harmony only
		"qala+INS, qalamen",
		"qazaqstan+ABL+INS, qazaqstannanmen",
		"sóz+INS, sózben",
		"mektep+INS, mekteppen"
	})
	void shouldAddCaseEndings(String input, String expected) throws Exception {
		assertThat(morph.inflect(input)).isEqualTo(expected);
	}

	@ParameterizedTest
	@CsvSource({
		"bala+1SING-POSS+DAT, balama",
		"kirpi+1PLR-POSS+DAT, kirpimize",
		"sóz+2SING-POSS+DAT, sózińe",
		"bala+3-POSS+DAT, balasyna",
		"bala+3-POSS+LOC, balasynda",
		"kirpi+3-POSS+LOC, kirpisinde",
		"bala+3-POSS+ABL, balasynan",
		"kirpi+3-POSS+ABL, kirpisinen"
	})
	void shouldChainPossessiveAndCase(String input, String expected) throws Exception {
		assertThat(morph.inflect(input)).isEqualTo(expected);
	}

	@Test
	void shouldLeaveBareStemsAlone() throws Exception {
		assertThat(morph.inflect("bala")).isEqualTo("bala");
		assertThat(morph.inflect("shymkent")).isEqualTo("shymkent");
	}

	@Test
	void shouldRejectUnknownTags() {
		assertThatThrownBy(() -> morph.inflect("bala+XYZ"))
				.isInstanceOf(NoValidTransductionException.class);
	}

	@Test
	void shouldRejectCharactersOutsideInventory() {
		assertThatThrownBy(() -> morph.inflect("bala+PLR!"))
				.isInstanceOf(InvalidSymbolException.class);
		assertThatThrownBy(() -> morph.inflect("bala plr"))
				.isInstanceOf(InvalidSymbolException.class);
	}

	@Test
	void shouldOnlyProduceLetters() throws Exception {
		Alphabet letters = morph.getCascade().getOutputAlphabet();
		for (String w : new String[] {"bala+3-POSS+DAT", "kirpi+PLR+3-POSS", "jeý+PRES-PTCP", "shymkent+GEN"}) {
			String out = morph.inflect(w);
			assertThat(letters.tokenize(out)).isNotEmpty();
			assertThat(out).doesNotContain("+", "^");
		}
	}
}
