package edu.isi.cfgnorm;

/** command line asks for something that can't be run: an unknown step name,
    an empty entry in a step list, or options that exclude each other */
public class ConfigureException extends Exception {
	public ConfigureException() { super(); }
	public ConfigureException(String message) { super(message); }
	public ConfigureException(String message, Throwable cause) { super(message, cause); }
	public ConfigureException(Throwable cause) { super(cause); }
}
