package edu.isi.cfgnorm;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

// hands out symbols. Text symbols are cached by name so repeated reads of the
// same grammar share instances; synthesized symbols are cheap value objects.
public class SymbolFactory {
	private static final Map<String, TextSymbol> str2Sym = new ConcurrentHashMap<String, TextSymbol>();

	static public Symbol getSymbol(String str) {
		boolean debug = false;
		TextSymbol sym = str2Sym.get(str);
		if (sym == null) {
			if (debug) Debug.debug(debug, "creating new symbol from "+str);
			sym = new TextSymbol(str);
			TextSymbol prev = str2Sym.putIfAbsent(str, sym);
			if (prev != null)
				sym = prev;
		}
		return sym;
	}

	// start' for a nullable start symbol
	static public Symbol getPrimedSymbol(Symbol base) {
		return new PrimedSymbol(base);
	}

	// X_i:j helper for binarization
	static public Symbol getChainSymbol(Symbol lhs, int alt, int pos) {
		return new ChainSymbol(lhs, alt, pos);
	}

	// t# stand-in for terminal t
	static public Symbol getProxySymbol(Symbol terminal) {
		return new ProxySymbol(terminal);
	}
}
