package edu.isi.cfgnorm;

/**
 * Helper nonterminal introduced when a long alternative is split into binary
 * rules. Identified by the left-hand side it was split from, the number of the
 * alternative within that rule, and its position in the chain (counting from 1).
 * Prints as <code>X_i:j</code>.
 */
public class ChainSymbol extends Symbol {
	private final Symbol owner;
	private final int alternative;
	private final int position;
	private final String display;

	public ChainSymbol(Symbol lhs, int alt, int pos) {
		if (lhs == null)
			throw new IllegalArgumentException("chain symbol needs an owner");
		if (alt < 0 || pos < 1)
			throw new IllegalArgumentException("bad chain index "+alt+":"+pos+" for "+lhs);
		owner = lhs;
		alternative = alt;
		position = pos;
		display = lhs.toString()+"_"+alt+":"+pos;
	}

	public KIND getKind() { return KIND.CHAIN; }

	public Symbol getOwner() { return owner; }
	public int getAlternative() { return alternative; }
	public int getPosition() { return position; }

	public String toString() { return display; }

	public int hashCode() {
		int h = owner.hashCode();
		h = 31*h+alternative;
		h = 31*h+position;
		return h;
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof ChainSymbol))
			return false;
		ChainSymbol c = (ChainSymbol)o;
		return alternative == c.alternative && position == c.position && owner.equals(c.owner);
	}

	int compareProvenance(Symbol s) {
		ChainSymbol c = (ChainSymbol)s;
		int r = owner.compareTo(c.owner);
		if (r != 0)
			return r;
		r = Integer.compare(alternative, c.alternative);
		if (r != 0)
			return r;
		return Integer.compare(position, c.position);
	}
}
