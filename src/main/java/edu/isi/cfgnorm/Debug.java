package edu.isi.cfgnorm;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.io.Writer;
import java.util.Date;

// diagnostics to stderr. Nothing here changes what a rewrite produces
public class Debug {

	private static String charset = "utf-8";
	private static Writer err = null;

	// the cli calls this once the -e option is known
	public static synchronized void setEncoding(String s) {
		charset = s;
		err = null;
	}

	private static synchronized void emit(String line) {
		if (err == null) {
			try {
				err = new OutputStreamWriter(System.err, charset);
			}
			catch (UnsupportedEncodingException e) {
				System.err.println("Unknown encoding "+charset+" for diagnostics; falling back to platform default");
				err = new OutputStreamWriter(System.err);
			}
		}
		try {
			err.write(line);
			err.write('\n');
			err.flush();
		}
		catch (IOException e) {
			System.err.println("Could not write diagnostic: "+line);
		}
	}

	// banner, usage, errors: always printed
	public static void prettyDebug(String s) {
		emit(s);
	}

	// developer tracing, prefixed with the caller. callers keep a local debug flag
	public static void debug(boolean d, String s)  {
		if (d)
			emit(caller()+" : "+s);
	}

	// class and method two frames up: whoever called debug()
	private static String caller() {
		StackTraceElement[] trace = new Throwable().getStackTrace();
		if (trace.length < 3)
			return "?";
		return trace[2].getClassName()+":"+trace[2].getMethodName();
	}

	// elapsed time between two marks, if the -t level asks for it
	public static void dbtime(int currlevel, int needlevel, Date from, Date to, String msg) {
		if (currlevel < needlevel)
			return;
		emit(msg+": "+(to.getTime()-from.getTime())+" ms");
	}
}
