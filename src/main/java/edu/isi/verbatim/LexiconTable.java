package edu.isi.verbatim;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One lexical table: rows of written form, spoken form and an optional
 * weight, in file order. A written form may have several spoken forms.
 */
public class LexiconTable {
	public static final class Row {
		private final String key;
		private final String value;
		private final double weight;
		public Row(String key, String value, double weight) {
			this.key = key;
			this.value = value;
			this.weight = weight;
		}
		public String getKey() { return key; }
		public String getValue() { return value; }
		public double getWeight() { return weight; }
		public String toString() { return key+"\t"+value+(weight == 0 ? "" : "\t"+weight); }
	}

	private final String name;
	private final List<Row> rows;

	public LexiconTable(String name, List<Row> rows) {
		this.name = name;
		this.rows = Collections.unmodifiableList(new ArrayList<Row>(rows));
	}

	// written/spoken pairs given inline
	public static LexiconTable of(String name, String... keysAndValues) {
		if (keysAndValues.length % 2 != 0)
			throw new IllegalArgumentException("Table "+name+" needs key/value pairs");
		List<Row> rows = new ArrayList<Row>();
		for (int i = 0; i < keysAndValues.length; i += 2)
			rows.add(new Row(keysAndValues[i], keysAndValues[i+1], 0));
		return new LexiconTable(name, rows);
	}

	/**
	 * key TAB value [TAB weight] per line; blank lines are skipped.
	 */
	public static LexiconTable read(String name, Reader r) throws IOException, DataFormatException {
		BufferedReader br = new BufferedReader(r);
		List<Row> rows = new ArrayList<Row>();
		String line;
		int lineno = 0;
		while ((line = br.readLine()) != null) {
			lineno++;
			if (line.trim().length() == 0)
				continue;
			String[] f = line.split("\t", -1);
			if (f.length < 2 || f.length > 3)
				throw new DataFormatException(name+":"+lineno+": expected 2 or 3 tab-separated fields, got "+f.length);
			if (f[0].length() == 0)
				throw new DataFormatException(name+":"+lineno+": empty written form");
			double w = 0;
			if (f.length == 3) {
				try {
					w = Double.parseDouble(f[2]);
				}
				catch (NumberFormatException e) {
					throw new DataFormatException(name+":"+lineno+": bad weight "+f[2], e);
				}
			}
			rows.add(new Row(f[0], f[1], w));
		}
		return new LexiconTable(name, rows);
	}

	public String getName() {
		return name;
	}

	public List<Row> getRows() {
		return rows;
	}

	// spoken forms of key, in file order
	public List<String> lookup(String key) {
		List<String> ret = new ArrayList<String>();
		for (Row r : rows)
			if (r.getKey().equals(key))
				ret.add(r.getValue());
		return ret;
	}

	public int size() {
		return rows.size();
	}
}
