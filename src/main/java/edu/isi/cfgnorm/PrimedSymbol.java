package edu.isi.cfgnorm;

// fresh start symbol made when the old start symbol is nullable.
// display is the base plus a prime; priming a primed symbol nests.
public class PrimedSymbol extends Symbol {
	private final Symbol base;
	private final String display;

	public PrimedSymbol(Symbol b) {
		if (b == null)
			throw new IllegalArgumentException("cannot prime a null symbol");
		base = b;
		display = b.toString()+"'";
	}

	public KIND getKind() { return KIND.PRIMED; }

	public Symbol getBase() { return base; }

	public String toString() { return display; }

	public int hashCode() {
		return 31*base.hashCode()+1;
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof PrimedSymbol))
			return false;
		return base.equals(((PrimedSymbol)o).base);
	}

	int compareProvenance(Symbol s) {
		return base.compareTo(((PrimedSymbol)s).base);
	}
}
