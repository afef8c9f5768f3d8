package edu.isi.verbatim;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class RewriteTest {
	private static Alphabet ascii;

	@BeforeAll
	static void setUp() throws Exception {
		ascii = TestLexicon.asciiAlphabet();
	}

	private static String run(Fst rule, String text) throws Exception {
		return new RewriteCascade().add("rule", rule).apply(text, ascii);
	}

	@Test
	void rewritesEveryOccurrenceWithoutContext() throws Exception {
		Fst rule = Rewrite.compile(FstBuilder.cross("a", "b"), ascii);
		assertThat(run(rule, "banana")).isEqualTo("bbnbnb");
		assertThat(run(rule, "xyz")).isEqualTo("xyz");
		assertThat(run(rule, "")).isEqualTo("");
	}

	@Test
	void rewritesOnlyBetweenTheContexts() throws Exception {
		Fst rule = Rewrite.compile(FstBuilder.cross("a", "b"), FstBuilder.accept("c"), FstBuilder.accept("d"), ascii);
		assertThat(run(rule, "cad cab")).isEqualTo("cbd cab");
		assertThat(run(rule, "ad")).isEqualTo("ad");
		assertThat(run(rule, "cadcad")).isEqualTo("cbdcbd");
	}

	@Test
	void rightContextAloneIsEnough() throws Exception {
		Fst rule = Rewrite.compile(FstBuilder.cross("-", " "), null, FstBuilder.accept("x"), ascii);
		assertThat(run(rule, "a-x b-y")).isEqualTo("a x b-y");
	}

	@Test
	void applyingTwiceChangesNothingMore() throws Exception {
		Fst rule = Rewrite.compile(FstBuilder.cross("=", " = "), FstBuilder.labelSet(new int[] {'x', 'y'}), FstBuilder.accept("5"), ascii);
		String once = run(rule, "x=5 y=5");
		assertThat(once).isEqualTo("x = 5 y = 5");
		assertThat(run(rule, once)).isEqualTo(once);
	}

	@Test
	void charactersOutsideTheAlphabetPassThrough() throws Exception {
		Fst rule = Rewrite.compile(FstBuilder.cross("a", "b"), ascii);
		assertThat(run(rule, "éa中")).isEqualTo("éb中");
	}

	@Test
	void reservedMarkersAreRejected() {
		try {
			Rewrite.compile(FstBuilder.cross(new int[] {'a'}, new int[] {Labels.RIGHT_MARK}, 0), ascii);
			fail("compiled a rule writing a marker");
		}
		catch (ConfigureException e) {
			assertThat(e.getMessage()).contains("reserved");
		}
	}

	@Test
	void symbolsOutsideTheAlphabetAreRejected() {
		try {
			Rewrite.compile(FstBuilder.cross("a", "é"), ascii);
			fail("compiled a rule writing outside the alphabet");
		}
		catch (ConfigureException e) {
			assertThat(e.getMessage()).contains("outside the alphabet");
		}
	}

	@Test
	void englishSpacingCascade() throws Exception {
		Alphabet en = Alphabet.load("en");
		RewriteCascade c = EnglishPack.buildCascade(en);
		assertThat(c.getNames()).containsExactly("math_symbol_spacing", "em_dash_joiner", "em_dash_before_digit", "glued_equals", "joiner_hyphen");
		assertThat(c.apply("√2", en)).isEqualTo("√ 2");
		assertThat(c.apply("5—a", en)).isEqualTo("5 a");
		assertThat(c.apply("—5", en)).isEqualTo("— 5");
		assertThat(c.apply("x=5", en)).isEqualTo("x = 5");
		assertThat(c.apply("x = 5", en)).isEqualTo("x = 5");
		assertThat(c.apply("5-a", en)).isEqualTo("5 a");
		assertThat(c.apply("a-b", en)).isEqualTo("a-b");
		assertThat(c.apply("10-2", en)).isEqualTo("10-2");
		String once = c.apply("x=5 and 3-b", en);
		assertThat(c.apply(once, en)).isEqualTo(once);
	}
}
