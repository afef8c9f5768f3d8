package edu.isi.verbatim;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.File;
import java.io.FileOutputStream;
import java.io.ObjectOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GrammarArchiveTest {

	private static Map<String, Fst> grammars() {
		Map<String, Fst> m = new LinkedHashMap<String, Fst>();
		m.put(Normalizer.CLASSIFY, FstBuilder.cross("12", "twelve"));
		m.put(Normalizer.REWRITE+"spacing", FstBuilder.cross("=", " = "));
		m.put(Normalizer.VERBALIZE+"cardinal", FstBuilder.addWeight(FstBuilder.cross("x", "y"), 0.5));
		return m;
	}

	@Test
	void readsBackWhatWasWritten(@TempDir File dir) throws Exception {
		File f = new File(dir, "en.far");
		assertThat(new GrammarArchive(f, "fp").write(grammars())).isTrue();
		Map<String, Fst> back = new GrammarArchive(f, "fp").read();
		assertThat(back).isNotNull();
		assertThat(back.keySet()).containsExactlyElementsOf(grammars().keySet());
		assertThat(FstTesting.best(back.get(Normalizer.CLASSIFY), "12")).isEqualTo("twelve");
		assertThat(FstTesting.weight(back.get(Normalizer.VERBALIZE+"cardinal"), "x")).isEqualTo(0.5);
		assertThat(dir.list()).containsExactly("en.far");
	}

	@Test
	void createsTheCacheDirectory(@TempDir File dir) {
		File f = new File(new File(dir, "a/b"), "en.far");
		assertThat(new GrammarArchive(f, "fp").write(grammars())).isTrue();
		assertThat(f).exists();
	}

	@Test
	void overwritesAnOlderArchive(@TempDir File dir) throws Exception {
		File f = new File(dir, "en.far");
		new GrammarArchive(f, "old").write(grammars());
		Map<String, Fst> one = new LinkedHashMap<String, Fst>();
		one.put(Normalizer.CLASSIFY, FstBuilder.cross("1", "one"));
		assertThat(new GrammarArchive(f, "new").write(one)).isTrue();
		assertThat(new GrammarArchive(f, "new").read()).containsOnlyKeys(Normalizer.CLASSIFY);
	}

	@Test
	void ignoresAnArchiveBuiltFromOtherData(@TempDir File dir) {
		File f = new File(dir, "en.far");
		new GrammarArchive(f, "fp").write(grammars());
		assertThat(new GrammarArchive(f, "other").read()).isNull();
	}

	@Test
	void ignoresMissingAndCorruptArchives(@TempDir File dir) throws Exception {
		File f = new File(dir, "en.far");
		assertThat(new GrammarArchive(f, "fp").read()).isNull();
		Files.write(f.toPath(), "not an archive".getBytes(StandardCharsets.UTF_8));
		assertThat(new GrammarArchive(f, "fp").read()).isNull();
	}

	@Test
	void ignoresAnArchiveHoldingSomethingElse(@TempDir File dir) throws Exception {
		File f = new File(dir, "en.far");
		ObjectOutputStream out = new ObjectOutputStream(new GZIPOutputStream(new FileOutputStream(f)));
		try {
			out.writeInt(GrammarArchive.FORMAT);
			out.writeUTF("fp");
			out.writeInt(1);
			out.writeUTF(Normalizer.CLASSIFY);
			out.writeObject("not an automaton");
		}
		finally {
			out.close();
		}
		assertThat(new GrammarArchive(f, "fp").read()).isNull();
	}

	@Test
	void ignoresAnArchiveOfAnotherFormat(@TempDir File dir) throws Exception {
		File f = new File(dir, "en.far");
		ObjectOutputStream out = new ObjectOutputStream(new GZIPOutputStream(new FileOutputStream(f)));
		try {
			out.writeInt(GrammarArchive.FORMAT-1);
			out.writeUTF("fp");
			out.writeObject(new LinkedHashMap<String, Fst>(grammars()));
		}
		finally {
			out.close();
		}
		assertThat(new GrammarArchive(f, "fp").read()).isNull();
	}

	@Test
	void failingToWriteIsNotAnError(@TempDir File dir) throws Exception {
		File blocker = new File(dir, "file");
		Files.write(blocker.toPath(), new byte[] {1});
		GrammarArchive a = new GrammarArchive(new File(blocker, "en.far"), "fp");
		assertThat(a.write(grammars())).isFalse();
		assertThat(a.read()).isNull();
	}
}
