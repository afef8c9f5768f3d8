package edu.isi.verbatim;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class CompositionTest {

	@Test
	void composesRelations() throws Exception {
		Fst a = FstBuilder.stringMap(new String[][] {{"1", "one"}, {"2", "two"}});
		Fst b = FstBuilder.stringMap(new String[][] {{"one", "uno"}, {"two", "dos"}});
		Fst c = FstBuilder.compose(a, b);
		assertThat(FstTesting.best(c, "1")).isEqualTo("uno");
		assertThat(FstTesting.best(c, "2")).isEqualTo("dos");
	}

	@Test
	void epsilonFilterLeavesOnePathPerPairing() throws Exception {
		// a deletes b after writing x; b inserts z after reading x
		Fst a = FstBuilder.cross("ab", "x");
		Fst b = FstBuilder.cross("x", "yz");
		Fst c = FstBuilder.compose(a, b);
		assertThat(KBestPaths.nBest(c, 10, false)).hasSize(1);
		assertThat(FstTesting.best(c, "ab")).isEqualTo("yz");

		Fst del = FstBuilder.concat(FstBuilder.accept("a"), FstBuilder.delete("bb"));
		Fst ins = FstBuilder.concat(FstBuilder.accept("a"), FstBuilder.insert("cc"));
		assertThat(KBestPaths.nBest(FstBuilder.compose(del, ins), 10, false)).hasSize(1);
	}

	@Test
	void compositionIsAssociative() throws Exception {
		Fst a = FstBuilder.union(FstBuilder.cross("ab", "x"), FstBuilder.addWeight(FstBuilder.cross("ab", "xy"), 0.5));
		Fst b = FstBuilder.union(FstBuilder.cross("x", "1"), FstBuilder.cross("xy", "22"),
				FstBuilder.addWeight(FstBuilder.cross("x", ""), 2));
		Fst c = FstBuilder.union(FstBuilder.cross("1", "one"), FstBuilder.cross("22", "twenty two"),
				FstBuilder.cross("", "nothing"));
		Fst left = FstBuilder.compose(FstBuilder.compose(a, b), c);
		Fst right = FstBuilder.compose(a, FstBuilder.compose(b, c));
		assertThat(FstTesting.outputs(left, "ab", 10)).containsExactlyElementsOf(FstTesting.outputs(right, "ab", 10));
		assertThat(FstTesting.weight(left, "ab")).isCloseTo(FstTesting.weight(right, "ab"), within(1e-9));
		assertThat(FstTesting.outputs(left, "ab", 10)).containsExactly("one", "twenty two", "nothing");
	}

	@Test
	void weightsAdd() throws Exception {
		Fst a = FstBuilder.addWeight(FstBuilder.cross("a", "b"), 1.25);
		Fst b = FstBuilder.addWeight(FstBuilder.cross("b", "c"), 0.5);
		assertThat(FstTesting.weight(FstBuilder.compose(a, b), "a")).isCloseTo(1.75, within(1e-9));
	}

	@Test
	void emptyOperandGivesEmptyResult() {
		assertThat(FstBuilder.compose(FstBuilder.empty(), FstBuilder.accept("a")).isEmpty()).isTrue();
		assertThat(FstBuilder.compose(FstBuilder.accept("a"), FstBuilder.accept("b")).isEmpty()).isTrue();
	}
}
