package edu.isi.cfgnorm;

// symbol read from grammar text or supplied by a caller
public class TextSymbol extends Symbol {
	private final String intern;

	public TextSymbol(String s) {
		if (s == null || s.length() == 0)
			throw new IllegalArgumentException("text symbol needs a name");
		intern = s.intern();
	}

	public KIND getKind() { return KIND.TEXT; }

	public String toString() { return intern; }

	public int hashCode() {
		return intern.hashCode();
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof TextSymbol))
			return false;
		return intern.equals(((TextSymbol)o).intern);
	}

	int compareProvenance(Symbol s) {
		return intern.compareTo(((TextSymbol)s).intern);
	}
}
