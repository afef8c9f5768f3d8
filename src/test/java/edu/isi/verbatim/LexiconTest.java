package edu.isi.verbatim;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

import java.io.File;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LexiconTest {

	@Test
	void readsRowsWithOptionalWeights() throws Exception {
		LexiconTable t = LexiconTable.read("t", new StringReader("a\talpha\n\nb\tbeta\t0.5\na\tapple\n"));
		assertThat(t.size()).isEqualTo(3);
		assertThat(t.lookup("a")).containsExactly("alpha", "apple");
		assertThat(t.getRows().get(1).getWeight()).isEqualTo(0.5);
		assertThat(t.lookup("z")).isEmpty();
	}

	@Test
	void rejectsMalformedRows() throws Exception {
		String[] bad = {"a\n", "a\tb\tc\td\n", "\tb\n", "a\tb\theavy\n"};
		for (String s : bad) {
			try {
				LexiconTable.read("bad.tsv", new StringReader(s));
				fail("read "+s);
			}
			catch (DataFormatException e) {
				assertThat(e.getMessage()).startsWith("bad.tsv:1:");
			}
		}
	}

	@Test
	void alphabetReadsRangesAndComments() throws Exception {
		Alphabet a = Alphabet.read(new StringReader("# digits\n0030-0039 digits\n0041\n"), "a");
		assertThat(a.contains('5')).isTrue();
		assertThat(a.contains('A')).isTrue();
		assertThat(a.contains('B')).isFalse();
		assertThat(a.encode("AB")).containsExactly('A', Labels.OTHER);
		try {
			Alphabet.read(new StringReader("zz\n"), "a");
			fail("read a bad code point");
		}
		catch (DataFormatException e) {
			assertThat(e.getMessage()).contains("a:1");
		}
	}

	@Test
	void alphabetRejectsReservedLabels() throws Exception {
		try {
			new Alphabet(new int[] {'a', Labels.LEFT_MARK});
			fail("took a marker into the alphabet");
		}
		catch (ConfigureException e) {
			assertThat(e.getMessage()).contains("reserved");
		}
	}

	@Test
	void loadsTheEnglishTables() throws Exception {
		Lexicon lex = Lexicon.load("en", null);
		assertThat(lex.getLanguage()).isEqualTo("en");
		assertThat(lex.lookup(NumberReader.DIGIT, "7")).isEqualTo("seven");
		assertThat(lex.hasTable(Lexicon.WHITELIST)).isTrue();
		assertThat(lex.hasTable("no/such")).isFalse();
		try {
			lex.getTable("no/such");
			fail("found a missing table");
		}
		catch (ConfigureException e) {
			assertThat(e.getMessage()).contains("no/such");
		}
	}

	@Test
	void unknownLanguageIsAConfigurationError() throws Exception {
		try {
			Lexicon.load("xx", null);
			fail("loaded language xx");
		}
		catch (ConfigureException e) {
			assertThat(e.getMessage()).contains("xx");
		}
	}

	@Test
	void extraWhitelistOverridesAndExtends(@TempDir File dir) throws Exception {
		File w = new File(dir, "mine.tsv");
		Files.write(w.toPath(), "Dr.\tdoctor who\nETA\te t a\n".getBytes(StandardCharsets.UTF_8));
		Lexicon base = Lexicon.load("en", null);
		Lexicon lex = Lexicon.load("en", w);
		assertThat(lex.getTable(Lexicon.WHITELIST).lookup("Dr.")).containsExactly("doctor who");
		assertThat(lex.lookup(Lexicon.WHITELIST, "ETA")).isEqualTo("e t a");
		assertThat(lex.getTable(Lexicon.WHITELIST).size()).isEqualTo(base.getTable(Lexicon.WHITELIST).size()+1);
		assertThat(lex.fingerprint()).isNotEqualTo(base.fingerprint());
	}

	@Test
	void missingWhitelistFileIsAConfigurationError(@TempDir File dir) throws Exception {
		try {
			Lexicon.load("en", new File(dir, "absent.tsv"));
			fail("read a missing whitelist");
		}
		catch (ConfigureException e) {
			assertThat(e.getMessage()).contains("lexicon");
		}
	}
}
