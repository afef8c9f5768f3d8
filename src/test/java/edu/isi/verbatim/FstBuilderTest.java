package edu.isi.verbatim;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

import org.junit.jupiter.api.Test;

class FstBuilderTest {

	@Test
	void crossMapsExactlyOneString() throws Exception {
		Fst f = FstBuilder.cross("abc", "x");
		assertThat(FstTesting.best(f, "abc")).isEqualTo("x");
		assertThat(FstTesting.accepts(f, "ab")).isFalse();
		assertThat(FstTesting.accepts(f, "abcd")).isFalse();
	}

	@Test
	void emptyAndEpsilonDiffer() {
		assertThat(FstBuilder.empty().isEmpty()).isTrue();
		assertThat(FstTesting.accepts(FstBuilder.empty(), "")).isFalse();
		assertThat(FstTesting.accepts(FstBuilder.epsilon(), "")).isTrue();
		assertThat(FstTesting.accepts(FstBuilder.epsilon(), "a")).isFalse();
	}

	@Test
	void everyRowOfATableSurvivesTheStringMap() throws Exception {
		Lexicon lex = Lexicon.load("en", null);
		for (String table : new String[] {NumberReader.TWO_DIGIT, MathGrammar.OPERATOR, Lexicon.WHITELIST}) {
			Fst map = lex.stringMap(table);
			for (LexiconTable.Row r : lex.getTable(table).getRows())
				assertThat(FstTesting.outputs(map, r.getKey(), 5)).as(table+" "+r.getKey()).contains(r.getValue());
		}
	}

	@Test
	void stringMapKeepsEveryReadingOfARepeatedKey() throws Exception {
		Fst f = FstBuilder.stringMap(new String[][] {{"St.", "saint"}, {"St.", "street"}, {"Dr.", "doctor"}});
		assertThat(FstTesting.outputs(f, "St.", 5)).containsExactlyInAnyOrder("saint", "street");
		assertThat(FstTesting.best(f, "Dr.")).isEqualTo("doctor");
		assertThat(FstTesting.accepts(f, "St")).isFalse();
	}

	@Test
	void unionConcatAndClosure() throws Exception {
		Fst ab = FstBuilder.union(FstBuilder.accept("a"), FstBuilder.accept("b"));
		Fst two = FstBuilder.closure(ab, 2, 3);
		assertThat(FstTesting.accepts(two, "a")).isFalse();
		assertThat(FstTesting.accepts(two, "ab")).isTrue();
		assertThat(FstTesting.accepts(two, "bab")).isTrue();
		assertThat(FstTesting.accepts(two, "abab")).isFalse();
		Fst open = FstBuilder.closure(ab, 1, -1);
		assertThat(FstTesting.accepts(open, "abbabbba")).isTrue();
		assertThat(FstTesting.accepts(open, "")).isFalse();
		assertThat(FstTesting.accepts(FstBuilder.star(ab), "")).isTrue();
		Fst c = FstBuilder.concat(FstBuilder.accept("x"), FstBuilder.optional(FstBuilder.accept("y")), FstBuilder.accept("z"));
		assertThat(FstTesting.accepts(c, "xz")).isTrue();
		assertThat(FstTesting.accepts(c, "xyz")).isTrue();
		assertThat(FstTesting.accepts(c, "xyyz")).isFalse();
	}

	@Test
	void boundedClosureHasOnePathPerCount() throws Exception {
		Fst f = FstBuilder.closure(FstBuilder.accept("a"), 0, 4);
		assertThat(KBestPaths.nBest(FstTesting.apply(f, "aa"), 10, false)).hasSize(1);
	}

	@Test
	void addWeightCountsOncePerPath() throws Exception {
		Fst f = FstBuilder.addWeight(FstBuilder.plus(FstBuilder.accept("a")), 1.5);
		assertThat(FstTesting.weight(f, "aaaa")).isEqualTo(1.5);
	}

	@Test
	void projectionAndInversion() throws Exception {
		Fst f = FstBuilder.cross("one", "1");
		assertThat(FstTesting.best(FstBuilder.project(f, FstBuilder.Tape.INPUT), "one")).isEqualTo("one");
		assertThat(FstTesting.best(FstBuilder.project(f, FstBuilder.Tape.OUTPUT), "1")).isEqualTo("1");
		assertThat(FstTesting.best(FstBuilder.invert(f), "1")).isEqualTo("one");
	}

	@Test
	void reverseMapsReversedStrings() throws Exception {
		Fst f = FstBuilder.concat(FstBuilder.cross("ab", "x"), FstBuilder.cross("c", "yz"));
		assertThat(FstTesting.best(FstBuilder.reverse(f), "cba")).isEqualTo("zyx");
	}

	@Test
	void differenceRemovesTheExcludedStrings() throws Exception {
		Fst digit = FstBuilder.labelSet(Labels.toLabels("0123456789"));
		Fst runs = FstBuilder.closure(digit, 1, 4);
		Fst roundThousands = FstBuilder.concat(digit, FstBuilder.accept("000"));
		Fst d = FstBuilder.difference(runs, roundThousands);
		assertThat(FstTesting.accepts(d, "1234")).isTrue();
		assertThat(FstTesting.accepts(d, "12")).isTrue();
		assertThat(FstTesting.accepts(d, "5000")).isFalse();
		assertThat(FstTesting.accepts(d, "12345")).isFalse();
	}

	@Test
	void differenceOfATransducerDomain() throws Exception {
		Fst f = FstBuilder.stringMap(new String[][] {{"a", "A"}, {"b", "B"}, {"c", "C"}});
		Fst dom = FstBuilder.difference(FstBuilder.project(f, FstBuilder.Tape.INPUT), FstBuilder.cross("b", "zzz"));
		Fst restricted = FstBuilder.compose(dom, f);
		assertThat(FstTesting.best(restricted, "a")).isEqualTo("A");
		assertThat(FstTesting.accepts(restricted, "b")).isFalse();
	}

	@Test
	void differenceNeedsAnAcceptor() {
		try {
			FstBuilder.difference(FstBuilder.cross("a", "b"), FstBuilder.accept("a"));
			fail("transducer accepted on the left of a difference");
		}
		catch (IllegalArgumentException e) {
			assertThat(e.getMessage()).contains("acceptor");
		}
	}

	@Test
	void priorityUnionPrefersTheFirstRelation() throws Exception {
		Fst sigmaStar = Alphabet.loop(Labels.toLabels("ab"));
		Fst q = FstBuilder.cross("a", "X");
		Fst r = FstBuilder.union(FstBuilder.cross("a", "Y"), FstBuilder.cross("b", "Z"));
		Fst p = FstBuilder.priorityUnion(q, r, sigmaStar);
		assertThat(FstTesting.outputs(p, "a", 5)).containsExactly("X");
		assertThat(FstTesting.best(p, "b")).isEqualTo("Z");
	}

	@Test
	void insertAndDeleteAnAcceptorLanguage() throws Exception {
		Fst digits = FstBuilder.plus(FstBuilder.labelSet(Labels.toLabels("0123456789")));
		assertThat(FstTesting.best(FstBuilder.delete(digits), "2024")).isEqualTo("");
		assertThat(FstTesting.best(FstBuilder.concat(FstBuilder.insert(FstBuilder.accept("no")), FstBuilder.accept("x")), "x")).isEqualTo("nox");
	}
}
