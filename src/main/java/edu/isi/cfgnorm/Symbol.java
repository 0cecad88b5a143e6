package edu.isi.cfgnorm;

// a grammar symbol. Text symbols come from the user; everything else is
// synthesized by a rewrite operation and carries where it came from.
// Synthesized symbols never equal a text symbol, even if they print the same.
public abstract class Symbol implements Comparable<Symbol> {

	// ordering of the variants, used to break ties between equal printed forms
	public enum KIND { TEXT, PRIMED, CHAIN, PROXY }

	abstract public KIND getKind();

	abstract public String toString();
	abstract public int hashCode();
	abstract public boolean equals(Object o);

	public boolean isSynthetic() {
		return getKind() != KIND.TEXT;
	}

	// printed form first, then variant
	public int compareTo(Symbol s) {
		int c = toString().compareTo(s.toString());
		if (c != 0)
			return c;
		c = getKind().compareTo(s.getKind());
		if (c != 0)
			return c;
		return compareProvenance(s);
	}

	// tie break between two symbols of the same variant and printed form
	abstract int compareProvenance(Symbol s);
}
