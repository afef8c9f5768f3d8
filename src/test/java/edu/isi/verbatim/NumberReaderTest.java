package edu.isi.verbatim;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class NumberReaderTest {
	private static NumberReader reader;

	@BeforeAll
	static void setUp() throws Exception {
		reader = new NumberReader(new Lexicon("test", TestLexicon.asciiAlphabet(), TestLexicon.numberTables()));
	}

	@Test
	void readsPlainNumbers() throws Exception {
		Fst plain = reader.getPlain();
		assertThat(FstTesting.best(plain, "0")).isEqualTo("ZERO");
		assertThat(FstTesting.best(plain, "7")).isEqualTo("SEVEN");
		assertThat(FstTesting.best(plain, "15")).isEqualTo("FIFTEEN");
		assertThat(FstTesting.best(plain, "100")).isEqualTo("ONE HUNDRED");
		assertThat(FstTesting.best(plain, "105")).isEqualTo("ONE HUNDRED FIVE");
		assertThat(FstTesting.best(plain, "1234")).isEqualTo("ONE THOUSAND TWO HUNDRED THIRTY FOUR");
		assertThat(FstTesting.best(plain, "1000000")).isEqualTo("ONE MILLION");
		assertThat(FstTesting.best(plain, "2000017")).isEqualTo("TWO MILLION SEVENTEEN");
		assertThat(FstTesting.best(plain, "999999999999")).isEqualTo(
				"NINE HUNDRED NINETY NINE BILLION NINE HUNDRED NINETY NINE MILLION NINE HUNDRED NINETY NINE THOUSAND NINE HUNDRED NINETY NINE");
	}

	@Test
	void eachNumberHasOneReading() throws Exception {
		assertThat(FstTesting.outputs(reader.getPlain(), "1000000", 5)).hasSize(1);
		assertThat(FstTesting.outputs(reader.getPlain(), "10203", 5)).containsExactly("TEN THOUSAND TWO HUNDRED THREE");
	}

	@Test
	void plainRejectsLeadingZerosAndOverlongStrings() {
		assertThat(FstTesting.accepts(reader.getPlain(), "07")).isFalse();
		assertThat(FstTesting.accepts(reader.getPlain(), "1234567890123")).isFalse();
		assertThat(FstTesting.accepts(reader.getPlain(), "")).isFalse();
		assertThat(reader.getMaxDigits()).isEqualTo(12);
	}

	@Test
	void readsCommaGroupedNumbers() throws Exception {
		assertThat(FstTesting.best(reader.getGrouped(), "1,000")).isEqualTo("ONE THOUSAND");
		assertThat(FstTesting.best(reader.getGrouped(), "12,345,678")).isEqualTo("TWELVE MILLION THREE HUNDRED FORTY FIVE THOUSAND SIX HUNDRED SEVENTY EIGHT");
		assertThat(FstTesting.accepts(reader.getGrouped(), "1,00")).isFalse();
		assertThat(FstTesting.accepts(reader.getGrouped(), "100")).isFalse();
	}

	@Test
	void spellsWhatCannotBeNamed() throws Exception {
		Fst any = reader.getAny();
		assertThat(FstTesting.best(any, "042")).isEqualTo("ZERO FOUR TWO");
		assertThat(FstTesting.best(any, "1234567890123")).isEqualTo("ONE TWO THREE FOUR FIVE SIX SEVEN EIGHT NINE ZERO ONE TWO THREE");
		assertThat(FstTesting.best(any, "42")).isEqualTo("FORTY TWO");
		assertThat(FstTesting.best(any, "4,200")).isEqualTo("FOUR THOUSAND TWO HUNDRED");
	}

	@Test
	void groupsHonourLeadingZeros() throws Exception {
		assertThat(FstTesting.best(reader.group(3, true), "007")).isEqualTo("SEVEN");
		assertThat(FstTesting.accepts(reader.group(3, false), "007")).isFalse();
		assertThat(FstTesting.accepts(reader.group(3, true), "000")).isFalse();
		try {
			reader.group(4, false);
			fail("read a group of four digits");
		}
		catch (IllegalArgumentException e) {
			assertThat(e.getMessage()).contains("4");
		}
	}

	@Test
	void scalesComeFromTheMagnitudeTable() {
		assertThat(reader.getScales()).containsEntry(3, "THOUSAND").containsEntry(6, "MILLION").containsEntry(9, "BILLION").hasSize(3);
	}

	@Test
	void indianScalesGroupByTwo() throws Exception {
		NumberReader indian = new NumberReader(TestLexicon.with(NumberReader.MAGNITUDE, LexiconTable.of(NumberReader.MAGNITUDE,
				"100", "HUNDRED", "1000", "THOUSAND", "100000", "LAKH", "10000000", "CRORE")));
		assertThat(FstTesting.best(indian.getPlain(), "1500000")).isEqualTo("FIFTEEN LAKH");
		assertThat(FstTesting.best(indian.getPlain(), "20000000")).isEqualTo("TWO CRORE");
		assertThat(FstTesting.best(indian.getGrouped(), "1,50,000")).isEqualTo("ONE LAKH FIFTY THOUSAND");
	}

	@Test
	void rejectsAMagnitudeGapWiderThanAGroup() throws Exception {
		Lexicon lex = TestLexicon.with(NumberReader.MAGNITUDE, LexiconTable.of(NumberReader.MAGNITUDE,
				"100", "HUNDRED", "1000", "THOUSAND", "10000000", "CRORE"));
		try {
			new NumberReader(lex);
			fail("accepted a four digit gap");
		}
		catch (ConfigureException e) {
			assertThat(e.getMessage()).contains("at most 3");
		}
	}

	@Test
	void rejectsMagnitudesThatAreNotPowersOfTen() throws Exception {
		Lexicon lex = TestLexicon.with(NumberReader.MAGNITUDE, LexiconTable.of(NumberReader.MAGNITUDE, "100", "HUNDRED", "1500", "ODD"));
		try {
			new NumberReader(lex);
			fail("accepted 1500 as a magnitude");
		}
		catch (ConfigureException e) {
			assertThat(e.getMessage()).contains("1500");
		}
	}
}
