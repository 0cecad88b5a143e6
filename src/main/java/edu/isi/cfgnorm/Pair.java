package edu.isi.cfgnorm;

// ordered pair, used for unit pairs (X, Y): X derives Y through unit rules alone
public class Pair<A, B> {
	private final A _a;
	private final B _b;
	public A l() { return _a; }
	public B r() { return _b; }
	public Pair (A a, B b) {_a = a; _b = b; }
	public String toString() { return "<"+_a+", "+_b+">"; }

	public int hashCode() {
		int h = _a == null ? 0 : _a.hashCode();
		return 31*h+(_b == null ? 0 : _b.hashCode());
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Pair))
			return false;
		Pair<?, ?> p = (Pair<?, ?>)o;
		return (_a == null ? p._a == null : _a.equals(p._a)) &&
			(_b == null ? p._b == null : _b.equals(p._b));
	}
}
