package edu.isi.kazakhfst;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.io.Writer;
import java.util.Date;
// debugging and timing output, all to stderr.
// methods are synchronized since compiled cascades are shared by resolving threads
public class Debug {

	private static String encoding = "utf-8";
	private static Writer w = null;
	// timing reports at or below this level are printed
	private static int dblevel = 0;

	public static synchronized void setEncoding(String s) {
		encoding = s;
		w = null;
	}
	public static synchronized void setDbLevel(int i) {
		dblevel = i;
	}

	private static Writer writer() {
		if (w == null) {
			try {
				w = new OutputStreamWriter(System.err, encoding);
			}
			catch (UnsupportedEncodingException e) {
				System.err.println("Warning: encoding "+encoding+" not supported; using default");
				w = new OutputStreamWriter(System.err);
			}
		}
		return w;
	}

	private static void emit(String s) {
		try {
			Writer out = writer();
			out.write(s);
			out.write("\n");
			out.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+s);
		}
	}

	// always printed
	public static synchronized void prettyDebug(String s) {
		emit(s);
	}

	// printed when d is set; prefixed by the caller
	public static void debug(boolean d, String s) {
		if (!d)
			return;
		StackTraceElement caller = new Throwable().getStackTrace()[1];
		log(caller.getClassName()+":"+caller.getMethodName(), s);
	}
	private static synchronized void log(String caller, String s) {
		emit(caller+" : "+s);
	}

	// elapsed time since start, if the global level is high enough
	public static synchronized void dbtime(int needlevel, Date start, String msg) {
		if (dblevel < needlevel)
			return;
		long x = new Date().getTime() - start.getTime();
		emit(msg+": "+x+" ms");
	}
}
