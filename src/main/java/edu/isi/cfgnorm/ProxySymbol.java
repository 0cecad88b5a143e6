package edu.isi.cfgnorm;

// nonterminal standing in for a terminal inside binary rules: t# -> t
public class ProxySymbol extends Symbol {
	private final Symbol terminal;
	private final String display;

	public ProxySymbol(Symbol t) {
		if (t == null)
			throw new IllegalArgumentException("cannot proxy a null symbol");
		terminal = t;
		display = t.toString()+"#";
	}

	public KIND getKind() { return KIND.PROXY; }

	public Symbol getTerminal() { return terminal; }

	public String toString() { return display; }

	public int hashCode() {
		return 31*terminal.hashCode()+3;
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof ProxySymbol))
			return false;
		return terminal.equals(((ProxySymbol)o).terminal);
	}

	int compareProvenance(Symbol s) {
		return terminal.compareTo(((ProxySymbol)s).terminal);
	}
}
