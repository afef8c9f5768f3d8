package edu.isi.verbatim;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;
// diagnostics on stderr: notices, guarded tracing, and timing by level
public class Debug {

	static String encoding = "utf-8";
	public static void setEncoding(String s) {
		encoding = s;
		initializeStream();
	}

	private static OutputStreamWriter w=null;
	private static void initializeStream() {
		try {
			w = new OutputStreamWriter(System.err, encoding);
		}
		catch (UnsupportedEncodingException e) {
			System.err.println("Warning: encoding "+encoding+" not supported; using default");
			w = new OutputStreamWriter(System.err);
		}
	}

	// stuff we always print to stderr
	public static void prettyDebug(String s) {
		write(s+"\n");
	}

	// tracing. callers keep a local boolean and pass it in
	public static void debug(boolean d, String s)  {
		if (!d)
			return;
		StackTraceElement caller = new Throwable().getStackTrace()[1];
		debug(d, 0, caller.getClassName()+":"+caller.getMethodName(), s);
	}
	private static void debug(boolean d, int i, String caller, String s) {
		StringBuilder sb = new StringBuilder();
		for (int x = 0; x < i; x++)
			sb.append(' ');
		sb.append(caller).append(" : ").append(s).append('\n');
		write(sb.toString());
	}

	private static int dblevel=0;
	public static void setDbLevel(int i) {
		dblevel = i;
	}

	// print time debug info if the level is proper
	public static void dbtime(int currlevel, int needlevel, Date pta, Date ptb, String msg) {
		if (currlevel < needlevel)
			return;
		long x = ptb.getTime() - pta.getTime();
		write(msg+": "+x+" ms\n");
	}

	// global version of dbtime
	public static void dbtime(int needlevel, Date pta, String msg) {
		dbtime(dblevel, needlevel, pta, new Date(), msg);
	}

	private static synchronized void write(String s) {
		if (w == null)
			initializeStream();
		try {
			w.write(s);
			w.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+s);
		}
	}
}
