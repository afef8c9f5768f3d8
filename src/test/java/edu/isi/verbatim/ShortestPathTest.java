package edu.isi.verbatim;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.Test;

class ShortestPathTest {

	@Test
	void findsTheGlobalMinimumNotTheCheapestFirstStep() throws Exception {
		MutableFst m = new MutableFst();
		int s0 = m.addState(), s1 = m.addState(), s2 = m.addState(), s3 = m.addState();
		m.setStart(s0);
		m.addArc(s0, 'a', 'x', 0.1, s1);
		m.addArc(s1, 'b', 'x', 5, s3);
		m.addArc(s0, 'a', 'y', 1, s2);
		m.addArc(s2, 'b', 'y', 1, s3);
		m.setFinal(s3, 0);
		Path p = ShortestPath.best(m.build());
		assertThat(p.getOutput()).isEqualTo("yy");
		assertThat(p.getWeight()).isCloseTo(2.0, within(1e-9));
	}

	@Test
	void exactTiesGoToTheFirstDeclaredBranch() throws Exception {
		Fst f = FstBuilder.union(FstBuilder.cross("a", "first"), FstBuilder.cross("a", "second"), FstBuilder.cross("a", "third"));
		assertThat(FstTesting.best(f, "a")).isEqualTo("first");
		Fst g = FstBuilder.union(FstBuilder.cross("a", "second"), FstBuilder.cross("a", "first"));
		assertThat(FstTesting.best(g, "a")).isEqualTo("second");
	}

	@Test
	void tiesWithinToleranceCountAsTies() throws Exception {
		Fst f = FstBuilder.union(FstBuilder.addWeight(FstBuilder.cross("a", "first"), 1+1e-9), FstBuilder.addWeight(FstBuilder.cross("a", "second"), 1));
		assertThat(FstTesting.best(f, "a")).isEqualTo("first");
	}

	@Test
	void noPathIsAnError() {
		try {
			ShortestPath.best(FstBuilder.empty());
			fail("found a path in the empty automaton");
		}
		catch (UnusualConditionException e) {
			assertThat(e.getMessage()).contains("No accepting path");
		}
	}

	@Test
	void negativeCyclesAreRejectedWhenBuilding() {
		Fst loop = FstBuilder.star(FstBuilder.addWeight(FstBuilder.accept("a"), -1));
		try {
			WeightBounds.checkNegativeCycles(loop, "loop");
			fail("negative cycle not detected");
		}
		catch (ConfigureException e) {
			assertThat(e.getMessage()).contains("loop");
		}
	}

	@Test
	void negativeArcsOutsideCyclesAreFine() throws Exception {
		Fst f = FstBuilder.concat(FstBuilder.addWeight(FstBuilder.accept("a"), -0.2), FstBuilder.star(FstBuilder.accept("b")));
		WeightBounds.checkNegativeCycles(f, "f");
		assertThat(FstTesting.weight(f, "abbb")).isCloseTo(-0.2, within(1e-9));
	}

	@Test
	void worstCaseCountsCyclesOnce() {
		Fst f = FstBuilder.concat(FstBuilder.addWeight(FstBuilder.accept("a"), 0.5),
				FstBuilder.star(FstBuilder.addWeight(FstBuilder.accept("b"), 0.25)));
		assertThat(WeightBounds.worstCase(f)).isCloseTo(0.75, within(1e-9));
	}

	@Test
	void nBestComesOutInWeightOrder() throws Exception {
		Fst f = FstBuilder.union(
				FstBuilder.addWeight(FstBuilder.cross("a", "three"), 3),
				FstBuilder.addWeight(FstBuilder.cross("a", "one"), 1),
				FstBuilder.addWeight(FstBuilder.cross("a", "two"), 2));
		List<Path> paths = KBestPaths.nBest(FstTesting.apply(f, "a"), 2, false);
		assertThat(paths).hasSize(2);
		assertThat(paths.get(0).getOutput()).isEqualTo("one");
		assertThat(paths.get(1).getOutput()).isEqualTo("two");
		assertThat(paths.get(0).getWeight()).isLessThanOrEqualTo(paths.get(1).getWeight());
	}

	@Test
	void nBestCanSkipRepeatedOutputs() throws Exception {
		Fst f = FstBuilder.union(
				FstBuilder.addWeight(FstBuilder.cross("a", "x"), 1),
				FstBuilder.addWeight(FstBuilder.cross("a", "x"), 2),
				FstBuilder.addWeight(FstBuilder.cross("a", "y"), 3));
		assertThat(FstTesting.outputs(f, "a", 5)).containsExactly("x", "y");
		assertThat(KBestPaths.nBest(FstTesting.apply(f, "a"), 5, false)).hasSize(3);
	}
}
