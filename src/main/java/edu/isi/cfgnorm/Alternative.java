package edu.isi.cfgnorm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/** One right-hand side of a rule: an ordered, possibly empty, sequence of
    symbols. The empty sequence is the null (epsilon) alternative.
    Immutable.
 */
public class Alternative implements Comparable<Alternative> {

	private static final Alternative EMPTY = new Alternative(new Symbol[0]);

	private final Symbol[] leaves;
	private final int hsh;

	private Alternative(Symbol[] syms) {
		leaves = syms;
		hsh = Arrays.hashCode(leaves);
	}

	/** the empty alternative */
	public static Alternative getEpsilon() {
		return EMPTY;
	}

	public static Alternative of(Symbol... syms) {
		return of(Arrays.asList(syms));
	}

	public static Alternative of(Collection<Symbol> syms) {
		if (syms.isEmpty())
			return EMPTY;
		Symbol[] arr = syms.toArray(new Symbol[syms.size()]);
		for (Symbol s : arr) {
			if (s == null)
				throw new IllegalArgumentException("null symbol in alternative "+syms);
		}
		return new Alternative(arr);
	}

	// one symbol per character, whitespace skipped. "%" alone is the empty alternative
	public static Alternative fromString(String text) {
		String trimmed = text.trim();
		if (trimmed.equals("%"))
			return EMPTY;
		ArrayList<Symbol> syms = new ArrayList<Symbol>();
		for (int i = 0; i < trimmed.length(); i++) {
			char c = trimmed.charAt(i);
			if (Character.isWhitespace(c))
				continue;
			syms.add(SymbolFactory.getSymbol(String.valueOf(c)));
		}
		return of(syms);
	}

	public int getSize() { return leaves.length; }
	public boolean isEmptyString() { return leaves.length == 0; }
	public Symbol getLabel(int i) { return leaves[i]; }
	public List<Symbol> getLeaves() { return Collections.unmodifiableList(Arrays.asList(leaves)); }

	// true if every symbol is drawn from the alphabet. vacuously true when empty
	public boolean isStringOf(Set<Symbol> alphabet) {
		for (Symbol s : leaves) {
			if (!alphabet.contains(s))
				return false;
		}
		return true;
	}

	// single-symbol alternative consisting of exactly s
	public boolean isSingleton(Symbol s) {
		return leaves.length == 1 && leaves[0].equals(s);
	}

	public int hashCode() { return hsh; }

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Alternative))
			return false;
		Alternative a = (Alternative)o;
		return hsh == a.hsh && Arrays.equals(leaves, a.leaves);
	}

	// element-wise; a proper prefix sorts first, so the empty alternative is least
	public int compareTo(Alternative a) {
		int n = Math.min(leaves.length, a.leaves.length);
		for (int i = 0; i < n; i++) {
			int c = leaves[i].compareTo(a.leaves[i]);
			if (c != 0)
				return c;
		}
		return Integer.compare(leaves.length, a.leaves.length);
	}

	public String toString() {
		if (leaves.length == 0)
			return "%";
		StringBuffer sb = new StringBuffer();
		for (int i = 0; i < leaves.length; i++) {
			if (i > 0)
				sb.append(' ');
			sb.append(leaves[i].toString());
		}
		return sb.toString();
	}
}
