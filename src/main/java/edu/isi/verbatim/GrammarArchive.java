package edu.isi.verbatim;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Compiled grammars on disk: a gzip'd stream holding a format number, the
 * fingerprint of the lexicon and configuration they were built from, and
 * the number of automata, then each automaton after its name, in order. An archive that is missing, unreadable, from
 * another format or built from other data is ignored, so the caller
 * rebuilds. Failing to write one is not an error.
 */
public class GrammarArchive {
	public static final int FORMAT = 2;

	private final File file;
	private final String fingerprint;

	public GrammarArchive(File file, String fingerprint) {
		this.file = file;
		this.fingerprint = fingerprint;
	}

	public File getFile() {
		return file;
	}

	/**
	 * @return the stored automata, or null if there is no usable archive
	 */
	public Map<String, Fst> read() {
		if (!file.exists())
			return null;
		try {
			ObjectInputStream in = new ObjectInputStream(new GZIPInputStream(new BufferedInputStream(new FileInputStream(file))));
			try {
				int format = in.readInt();
				if (format != FORMAT) {
					Debug.prettyDebug("Grammar archive "+file+" has format "+format+", not "+FORMAT+"; rebuilding");
					return null;
				}
				String fp = in.readUTF();
				if (!fp.equals(fingerprint)) {
					Debug.prettyDebug("Grammar archive "+file+" was built from other data; rebuilding");
					return null;
				}
				int n = in.readInt();
				Map<String, Fst> grammars = new LinkedHashMap<String, Fst>();
				for (int i = 0; i < n; i++) {
					String name = in.readUTF();
					Fst f = (Fst)in.readObject();
					grammars.put(name, f);
				}
				return grammars;
			}
			finally {
				in.close();
			}
		}
		catch (IOException e) {
			Debug.prettyDebug("Couldn't read grammar archive "+file+" ("+e.getMessage()+"); rebuilding");
		}
		catch (ClassNotFoundException e) {
			Debug.prettyDebug("Grammar archive "+file+" holds unknown classes ("+e.getMessage()+"); rebuilding");
		}
		catch (ClassCastException e) {
			Debug.prettyDebug("Grammar archive "+file+" holds something other than grammars; rebuilding");
		}
		return null;
	}

	/**
	 * Write through a temporary file in the same directory, then rename, so
	 * a reader never sees half an archive.
	 * @return whether the archive was written
	 */
	public boolean write(Map<String, Fst> grammars) {
		File dir = file.getAbsoluteFile().getParentFile();
		File tmp = null;
		try {
			if (!dir.isDirectory() && !dir.mkdirs())
				throw new IOException("can't create directory "+dir);
			tmp = File.createTempFile(file.getName(), ".tmp", dir);
			ObjectOutputStream out = new ObjectOutputStream(new GZIPOutputStream(new BufferedOutputStream(new FileOutputStream(tmp))));
			try {
				out.writeInt(FORMAT);
				out.writeUTF(fingerprint);
				out.writeInt(grammars.size());
				for (Map.Entry<String, Fst> e : grammars.entrySet()) {
					out.writeUTF(e.getKey());
					out.writeObject(e.getValue());
				}
			}
			finally {
				out.close();
			}
			if (!tmp.renameTo(file)) {
				if (!file.delete() || !tmp.renameTo(file))
					throw new IOException("can't move "+tmp+" to "+file);
			}
			tmp = null;
			return true;
		}
		catch (IOException e) {
			Debug.prettyDebug("Warning: couldn't write grammar archive "+file+": "+e.getMessage());
			return false;
		}
		finally {
			if (tmp != null && tmp.exists() && !tmp.delete())
				Debug.prettyDebug("Warning: couldn't remove "+tmp);
		}
	}
}
