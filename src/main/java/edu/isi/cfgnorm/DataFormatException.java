package edu.isi.cfgnorm;

/**
 * Grammar text that can't be read: a record without an arrow, a bad left-hand
 * side, or no records at all. Carries the zero-based index of the offending
 * record when there is one, -1 otherwise.
 */
public class DataFormatException extends Exception {
	private final int record;

	public DataFormatException() { super(); record = -1; }
	public DataFormatException(String message) { super(message); record = -1; }
	public DataFormatException(String message, Throwable cause) { super(message, cause); record = -1; }
	public DataFormatException(Throwable cause) { super(cause); record = -1; }

	// message is expected to name the record already
	public DataFormatException(String message, int rec) {
		super(message);
		record = rec;
	}

	public int getRecord() { return record; }
}
