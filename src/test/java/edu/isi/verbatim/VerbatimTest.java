package edu.isi.verbatim;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VerbatimTest {
	// shared so that each grammar configuration is compiled once
	@TempDir
	static File cache;

	private static List<String> run(InputStream in, String... argv) throws Exception {
		PrintStream out = System.out;
		InputStream stdin = System.in;
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		try {
			System.setOut(new PrintStream(buf, true, "UTF-8"));
			if (in != null)
				System.setIn(in);
			Verbatim.main(argv);
		}
		finally {
			System.setOut(out);
			System.setIn(stdin);
		}
		return Arrays.asList(new String(buf.toByteArray(), StandardCharsets.UTF_8).split("\n"));
	}

	@Test
	void normalizesEachLineOfStandardInput(@TempDir File dir) throws Exception {
		File input = new File(dir, "input.txt");
		Files.write(input.toPath(), "I have $5.50\nDr. Smith\nthe 21st of 5%\n".getBytes(StandardCharsets.UTF_8));
		InputStream in = new FileInputStream(input);
		try {
			List<String> lines = run(in, "-c", cache.getPath());
			assertThat(lines).containsExactly("I have five dollars and fifty cents", "doctor Smith",
					"the twenty first of five percent");
		}
		finally {
			in.close();
		}
		assertThat(new File(cache, "en_tn_true_deterministic_cased_none_tokenize.far")).exists();
	}

	@Test
	void joinsTextArgumentsIntoOneLine() throws Exception {
		List<String> lines = run(null, "-c", cache.getPath(), "it", "costs", "$1.5");
		assertThat(lines).containsExactly("it costs one dollar and fifty cents");
	}

	@Test
	void printsDistinctAlternativesBestFirst() throws Exception {
		List<String> lines = run(null, "-c", cache.getPath(), "--non-deterministic", "-n", "3", "12345678901");
		assertThat(lines.size()).isBetween(2, 3);
		assertThat(lines.get(0)).isEqualTo(
				"twelve billion three hundred forty five million six hundred seventy eight thousand nine hundred one");
		assertThat(lines).contains("one two three four five six seven eight nine zero one");
		assertThat(lines).doesNotHaveDuplicates();
		assertThat(new File(cache, "en_tn_false_deterministic_cased_none_tokenize.far")).exists();
	}

	@Test
	void lowerCasedInputOption() throws Exception {
		List<String> lines = run(null, "-c", cache.getPath(), "--input-case", "lower_cased", "dr. smith");
		assertThat(lines).containsExactly("doctor smith");
	}
}
