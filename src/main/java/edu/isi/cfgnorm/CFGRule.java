package edu.isi.cfgnorm;

// CFG Rule. Symbol lhs, Alternative rhs. A flat view of one entry of a rule set
public class CFGRule implements Comparable<CFGRule> {
	private final Symbol lhs;
	private final Alternative rhs;

	public CFGRule(Symbol inlhs, Alternative inrhs) {
		if (inlhs == null || inrhs == null)
			throw new IllegalArgumentException("rule needs both sides");
		lhs = inlhs;
		rhs = inrhs;
	}

	public Symbol getLHS() { return lhs; }
	public Alternative getRHS() { return rhs; }

	public int hashCode() {
		return 31*lhs.hashCode()+rhs.hashCode();
	}

	// equals if lhs is same and rhs is same
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof CFGRule))
			return false;
		CFGRule r = (CFGRule)o;
		return lhs.equals(r.lhs) && rhs.equals(r.rhs);
	}

	public int compareTo(CFGRule r) {
		int c = lhs.compareTo(r.lhs);
		if (c != 0)
			return c;
		return rhs.compareTo(r.rhs);
	}

	public String toString() {
		return lhs.toString()+" -> "+rhs.toString();
	}
}
