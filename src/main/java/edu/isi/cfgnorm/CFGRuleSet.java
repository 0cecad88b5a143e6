package edu.isi.cfgnorm;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import gnu.trove.TIntHashSet;
import gnu.trove.TIntObjectHashMap;
import gnu.trove.TObjectIntHashMap;

/**
 * A context-free grammar: a start symbol and, for every nonterminal, the set of
 * its alternatives. Nonterminals are exactly the keys of the rule map;
 * terminals are every right-hand-side symbol that is not a key. Both are
 * computed once, at construction.
 * <p>
 * Immutable. Every analysis returns a fresh set and every rewrite returns a new
 * rule set; the receiver is never changed.
 */
public class CFGRuleSet {

	private final Symbol startState;
	// start first, the rest ordered by symbol. values are sorted and unmodifiable
	private final Map<Symbol, Set<Alternative>> rulesByLHS;
	private final Set<Symbol> states;
	private final Set<Symbol> terminals;

	/**
	 * @param rules alternatives for each nonterminal
	 * @param start start symbol. It is added as a key with no alternatives if
	 * the map lacks it
	 */
	public CFGRuleSet(Map<Symbol, ? extends Collection<Alternative>> rules, Symbol start) {
		if (start == null)
			throw new IllegalArgumentException("grammar needs a start symbol");
		if (rules == null)
			throw new IllegalArgumentException("grammar needs a rule map");
		startState = start;
		TreeMap<Symbol, Set<Alternative>> sorted = new TreeMap<Symbol, Set<Alternative>>();
		for (Map.Entry<Symbol, ? extends Collection<Alternative>> e : rules.entrySet()) {
			if (e.getKey() == null)
				throw new IllegalArgumentException("null left-hand side");
			TreeSet<Alternative> alts = new TreeSet<Alternative>();
			if (e.getValue() != null) {
				for (Alternative a : e.getValue()) {
					if (a == null)
						throw new IllegalArgumentException("null alternative for "+e.getKey());
					alts.add(a);
				}
			}
			sorted.put(e.getKey(), Collections.unmodifiableSet(alts));
		}
		LinkedHashMap<Symbol, Set<Alternative>> ordered = new LinkedHashMap<Symbol, Set<Alternative>>();
		Set<Alternative> startAlts = sorted.remove(start);
		if (startAlts == null)
			startAlts = Collections.unmodifiableSet(new TreeSet<Alternative>());
		ordered.put(start, startAlts);
		ordered.putAll(sorted);
		rulesByLHS = Collections.unmodifiableMap(ordered);
		states = Collections.unmodifiableSet(new LinkedHashSet<Symbol>(ordered.keySet()));

		TreeSet<Symbol> terms = new TreeSet<Symbol>();
		for (Set<Alternative> alts : ordered.values()) {
			for (Alternative a : alts) {
				for (Symbol s : a.getLeaves()) {
					if (!states.contains(s))
						terms.add(s);
				}
			}
		}
		terminals = Collections.unmodifiableSet(terms);
	}

	// from a flat list of rules
	public CFGRuleSet(Symbol start, Collection<CFGRule> rules) {
		this(groupRules(rules), start);
	}

	private static Map<Symbol, List<Alternative>> groupRules(Collection<CFGRule> rules) {
		LinkedHashMap<Symbol, List<Alternative>> map = new LinkedHashMap<Symbol, List<Alternative>>();
		for (CFGRule r : rules) {
			if (!map.containsKey(r.getLHS()))
				map.put(r.getLHS(), new ArrayList<Alternative>());
			map.get(r.getLHS()).add(r.getRHS());
		}
		return map;
	}

	// accessors

	public Symbol getStartState() { return startState; }

	// nonterminals, start first
	public Set<Symbol> getStates() { return states; }

	public Set<Symbol> getTerminals() { return terminals; }

	public Map<Symbol, Set<Alternative>> getRules() { return rulesByLHS; }

	// alternatives of one nonterminal; empty for a symbol that is not a key
	public Set<Alternative> getRulesOfType(Symbol s) {
		Set<Alternative> alts = rulesByLHS.get(s);
		if (alts == null)
			return Collections.emptySet();
		return alts;
	}

	// flat view in printing order
	public List<CFGRule> getRuleList() {
		ArrayList<CFGRule> list = new ArrayList<CFGRule>();
		for (Map.Entry<Symbol, Set<Alternative>> e : rulesByLHS.entrySet()) {
			for (Alternative a : e.getValue())
				list.add(new CFGRule(e.getKey(), a));
		}
		return list;
	}

	public int getNumRules() {
		int n = 0;
		for (Set<Alternative> alts : rulesByLHS.values())
			n += alts.size();
		return n;
	}
	public int getNumStates() { return states.size(); }
	public int getNumTerminals() { return terminals.size(); }

	// is some alternative of some rule exactly the single nonterminal it names?
	public boolean isUnitRule(CFGRule r) {
		return r.getRHS().getSize() == 1 && states.contains(r.getRHS().getLabel(0));
	}

	// does the symbol occur on any right-hand side?
	public boolean isOnRHS(Symbol s) {
		for (Set<Alternative> alts : rulesByLHS.values()) {
			for (Alternative a : alts) {
				if (a.getLeaves().contains(s))
					return true;
			}
		}
		return false;
	}

	/**
	 * Strict Chomsky normal form: every alternative is one terminal or two
	 * nonterminals. The single exception is an empty alternative on the start
	 * symbol, allowed only while the start symbol appears on no right-hand side.
	 */
	public boolean isNormal() {
		boolean debug = false;
		boolean startOnRHS = isOnRHS(startState);
		for (Map.Entry<Symbol, Set<Alternative>> e : rulesByLHS.entrySet()) {
			for (Alternative a : e.getValue()) {
				boolean ok;
				switch (a.getSize()) {
				case 0:
					ok = e.getKey().equals(startState) && !startOnRHS;
					break;
				case 1:
					ok = terminals.contains(a.getLabel(0));
					break;
				case 2:
					ok = states.contains(a.getLabel(0)) && states.contains(a.getLabel(1));
					break;
				default:
					ok = false;
				}
				if (!ok) {
					if (debug) Debug.debug(debug, "Not normal because of "+e.getKey()+" -> "+a);
					return false;
				}
			}
		}
		return true;
	}

	// fixpoint analyses

	/**
	 * Nonterminals that derive the empty string. A nonterminal joins once one of
	 * its alternatives consists only of known nullable symbols; the empty
	 * alternative qualifies on the first pass.
	 */
	public Set<Symbol> getNullableStates() {
		boolean debug = false;
		Set<Symbol> nullable = new HashSet<Symbol>();
		while (true) {
			HashSet<Symbol> next = new HashSet<Symbol>(nullable);
			for (Map.Entry<Symbol, Set<Alternative>> e : rulesByLHS.entrySet()) {
				if (next.contains(e.getKey()))
					continue;
				for (Alternative a : e.getValue()) {
					if (a.isStringOf(nullable)) {
						next.add(e.getKey());
						break;
					}
				}
			}
			if (next.equals(nullable))
				break;
			if (debug) Debug.debug(debug, "Nullable went from "+nullable.size()+" to "+next.size());
			nullable = next;
		}
		return Collections.unmodifiableSet(nullable);
	}

	/**
	 * Pairs (X, Y) of nonterminals where X derives Y using unit alternatives only.
	 * Seeded with the direct unit alternatives and closed under composition.
	 * (X, X) appears only when X sits on a unit cycle.
	 */
	public Set<Pair<Symbol, Symbol>> getUnitPairs() {
		boolean debug = false;
		// integer mapping of states
		TObjectIntHashMap s2i = new TObjectIntHashMap();
		Symbol[] i2s = new Symbol[states.size()];
		int nextid = 0;
		for (Symbol s : states) {
			i2s[nextid] = s;
			s2i.put(s, nextid++);
		}
		// seed with direct unit alternatives
		TIntObjectHashMap unitTargets = new TIntObjectHashMap();
		for (Map.Entry<Symbol, Set<Alternative>> e : rulesByLHS.entrySet()) {
			TIntHashSet targets = new TIntHashSet();
			for (Alternative a : e.getValue()) {
				if (a.getSize() == 1 && states.contains(a.getLabel(0)))
					targets.add(s2i.get(a.getLabel(0)));
			}
			unitTargets.put(s2i.get(e.getKey()), targets);
		}
		// (x, y) and (y, z) give (x, z). repeat until a pass adds nothing
		boolean changed = true;
		int passes = 0;
		while (changed) {
			changed = false;
			passes++;
			for (int x = 0; x < i2s.length; x++) {
				TIntHashSet xTargets = (TIntHashSet)unitTargets.get(x);
				for (int y : xTargets.toArray()) {
					TIntHashSet yTargets = (TIntHashSet)unitTargets.get(y);
					for (int z : yTargets.toArray()) {
						if (xTargets.add(z))
							changed = true;
					}
				}
			}
		}
		if (debug) Debug.debug(debug, "Unit pair closure took "+passes+" passes");
		HashSet<Pair<Symbol, Symbol>> pairs = new HashSet<Pair<Symbol, Symbol>>();
		for (int x = 0; x < i2s.length; x++) {
			for (int y : ((TIntHashSet)unitTargets.get(x)).toArray())
				pairs.add(new Pair<Symbol, Symbol>(i2s[x], i2s[y]));
		}
		return Collections.unmodifiableSet(pairs);
	}

	/** All symbols, terminal or not, that occur in some sentential form derived from the start symbol. */
	public Set<Symbol> getReachableSymbols() {
		Set<Symbol> reachable = new HashSet<Symbol>();
		reachable.add(startState);
		while (true) {
			HashSet<Symbol> next = new HashSet<Symbol>(reachable);
			for (Symbol s : reachable) {
				for (Alternative a : getRulesOfType(s))
					next.addAll(a.getLeaves());
			}
			if (next.equals(reachable))
				break;
			reachable = next;
		}
		return Collections.unmodifiableSet(reachable);
	}

	/**
	 * Symbols that derive some terminal string: all terminals, plus every
	 * nonterminal with an alternative made only of productive symbols.
	 */
	public Set<Symbol> getProductiveSymbols() {
		Set<Symbol> productive = new HashSet<Symbol>(terminals);
		while (true) {
			HashSet<Symbol> next = new HashSet<Symbol>(productive);
			for (Map.Entry<Symbol, Set<Alternative>> e : rulesByLHS.entrySet()) {
				if (next.contains(e.getKey()))
					continue;
				for (Alternative a : e.getValue()) {
					if (a.isStringOf(productive)) {
						next.add(e.getKey());
						break;
					}
				}
			}
			if (next.equals(productive))
				break;
			productive = next;
		}
		return Collections.unmodifiableSet(productive);
	}

	// rewrite operations

	public CFGRuleSet withoutEpsilonRules() {
		return withoutEpsilonRules(StepListener.NONE);
	}

	/**
	 * Removes empty alternatives. Each alternative is re-emitted once for every
	 * way of dropping some of its nullable symbols; results that are empty or
	 * that are the bare left-hand side are not emitted. If the start symbol was
	 * nullable, a new start symbol S' -> S | % keeps the empty string.
	 */
	public CFGRuleSet withoutEpsilonRules(StepListener listener) {
		boolean debug = false;
		Set<Symbol> nullable = getNullableStates();
		listener.analysisDone("Nullable Nonterminals", nullable);

		LinkedHashMap<Symbol, Set<Alternative>> newRules = new LinkedHashMap<Symbol, Set<Alternative>>();
		for (Map.Entry<Symbol, Set<Alternative>> e : rulesByLHS.entrySet()) {
			Symbol lhs = e.getKey();
			HashSet<Alternative> alts = new HashSet<Alternative>();
			for (Alternative a : e.getValue()) {
				if (a.isEmptyString())
					continue;
				alts.add(a);
				expandNullable(lhs, a, nullable, 0, new ArrayList<Symbol>(), alts);
			}
			if (debug) Debug.debug(debug, lhs+": "+e.getValue().size()+" alternatives became "+alts.size());
			newRules.put(lhs, alts);
		}

		Symbol start = startState;
		if (nullable.contains(startState)) {
			start = SymbolFactory.getPrimedSymbol(startState);
			while (newRules.containsKey(start))
				start = SymbolFactory.getPrimedSymbol(start);
			HashSet<Alternative> startAlts = new HashSet<Alternative>();
			startAlts.add(Alternative.getEpsilon());
			startAlts.add(Alternative.of(startState));
			newRules.put(start, startAlts);
			if (debug) Debug.debug(debug, "Start "+startState+" is nullable; new start is "+start);
		}
		return new CFGRuleSet(newRules, start);
	}

	// walk the alternative, at each nullable position trying both keep and drop
	private static void expandNullable(Symbol lhs, Alternative a, Set<Symbol> nullable,
									   int pos, ArrayList<Symbol> kept, Set<Alternative> out) {
		if (pos == a.getSize()) {
			if (kept.isEmpty())
				return;
			Alternative na = Alternative.of(kept);
			if (na.isSingleton(lhs))
				return;
			out.add(na);
			return;
		}
		Symbol sym = a.getLabel(pos);
		kept.add(sym);
		expandNullable(lhs, a, nullable, pos+1, kept, out);
		kept.remove(kept.size()-1);
		if (nullable.contains(sym))
			expandNullable(lhs, a, nullable, pos+1, kept, out);
	}

	public CFGRuleSet withoutUnitRules() {
		return withoutUnitRules(StepListener.NONE);
	}

	/**
	 * Removes alternatives that are a single nonterminal. For every unit pair
	 * (X, Y) the alternative Y is dropped from X, then X takes all of Y's
	 * remaining alternatives. All drops happen before any absorption.
	 */
	public CFGRuleSet withoutUnitRules(StepListener listener) {
		boolean debug = false;
		Set<Pair<Symbol, Symbol>> unitPairs = getUnitPairs();
		listener.analysisDone("Unit Pairs", unitPairs);

		HashMap<Symbol, Set<Alternative>> newRules = new HashMap<Symbol, Set<Alternative>>();
		for (Map.Entry<Symbol, Set<Alternative>> e : rulesByLHS.entrySet())
			newRules.put(e.getKey(), new HashSet<Alternative>(e.getValue()));

		for (Pair<Symbol, Symbol> p : unitPairs)
			newRules.get(p.l()).remove(Alternative.of(p.r()));

		// absorb from a snapshot so the order of pairs doesn't matter
		HashMap<Symbol, Set<Alternative>> trimmed = new HashMap<Symbol, Set<Alternative>>();
		for (Map.Entry<Symbol, Set<Alternative>> e : newRules.entrySet())
			trimmed.put(e.getKey(), new HashSet<Alternative>(e.getValue()));
		for (Pair<Symbol, Symbol> p : unitPairs) {
			if (debug) Debug.debug(debug, p.l()+" absorbs "+trimmed.get(p.r()).size()+" alternatives of "+p.r());
			newRules.get(p.l()).addAll(trimmed.get(p.r()));
		}
		return new CFGRuleSet(newRules, startState);
	}

	// keep only rules whose lhs is in symbols, and alternatives made only of symbols
	public CFGRuleSet withSymbols(Set<Symbol> symbols) {
		LinkedHashMap<Symbol, Set<Alternative>> newRules = new LinkedHashMap<Symbol, Set<Alternative>>();
		for (Map.Entry<Symbol, Set<Alternative>> e : rulesByLHS.entrySet()) {
			if (!symbols.contains(e.getKey()))
				continue;
			HashSet<Alternative> alts = new HashSet<Alternative>();
			for (Alternative a : e.getValue()) {
				if (a.isStringOf(symbols))
					alts.add(a);
			}
			newRules.put(e.getKey(), alts);
		}
		return new CFGRuleSet(newRules, startState);
	}

	public CFGRuleSet withProductiveSymbols() {
		return withProductiveSymbols(StepListener.NONE);
	}

	public CFGRuleSet withProductiveSymbols(StepListener listener) {
		Set<Symbol> productive = getProductiveSymbols();
		listener.analysisDone("Productive Symbols", productive);
		return withSymbols(productive);
	}

	public CFGRuleSet withReachableSymbols() {
		return withReachableSymbols(StepListener.NONE);
	}

	public CFGRuleSet withReachableSymbols(StepListener listener) {
		Set<Symbol> reachable = getReachableSymbols();
		listener.analysisDone("Reachable Symbols", reachable);
		return withSymbols(reachable);
	}

	public CFGRuleSet withUsefulSymbols() {
		return withUsefulSymbols(StepListener.NONE);
	}

	// productive filter must run first: unproductive rules can be the only
	// route by which other symbols are reachable
	public CFGRuleSet withUsefulSymbols(StepListener listener) {
		return withProductiveSymbols(listener).withReachableSymbols(listener);
	}

	/**
	 * Splits every alternative longer than two into a chain of binary rules:
	 * X -> s1 X_i:1, X_i:1 -> s2 X_i:2, ..., X_i:n-2 -> sn-1 sn, where i numbers
	 * the alternative within X's rule in sorted order. Shorter alternatives are
	 * kept as they are.
	 */
	public CFGRuleSet withPairRules() {
		boolean debug = false;
		LinkedHashMap<Symbol, Set<Alternative>> newRules = new LinkedHashMap<Symbol, Set<Alternative>>();
		for (Symbol lhs : states)
			newRules.put(lhs, new HashSet<Alternative>());
		for (Map.Entry<Symbol, Set<Alternative>> e : rulesByLHS.entrySet()) {
			Symbol lhs = e.getKey();
			int altnum = 0;
			for (Alternative a : e.getValue()) {
				int i = altnum++;
				int n = a.getSize();
				if (n <= 2) {
					newRules.get(lhs).add(a);
					continue;
				}
				Symbol curr = lhs;
				for (int j = 0; j < n-2; j++) {
					Symbol next = SymbolFactory.getChainSymbol(lhs, i, j+1);
					addRule(newRules, curr, Alternative.of(a.getLabel(j), next));
					curr = next;
				}
				addRule(newRules, curr, Alternative.of(a.getLabel(n-2), a.getLabel(n-1)));
				if (debug) Debug.debug(debug, "Split "+lhs+" -> "+a+" into "+(n-1)+" binary rules");
			}
		}
		return new CFGRuleSet(newRules, startState);
	}

	/**
	 * Gives each terminal t a nonterminal t# -> t and replaces t by t# inside
	 * every two-symbol alternative. Single-terminal alternatives stay as they are.
	 */
	public CFGRuleSet withUnitTerminals() {
		LinkedHashMap<Symbol, Set<Alternative>> newRules = new LinkedHashMap<Symbol, Set<Alternative>>();
		HashMap<Symbol, Symbol> proxies = new HashMap<Symbol, Symbol>();
		for (Symbol t : terminals) {
			Symbol proxy = SymbolFactory.getProxySymbol(t);
			proxies.put(t, proxy);
			addRule(newRules, proxy, Alternative.of(t));
		}
		for (Map.Entry<Symbol, Set<Alternative>> e : rulesByLHS.entrySet()) {
			if (!newRules.containsKey(e.getKey()))
				newRules.put(e.getKey(), new HashSet<Alternative>());
			for (Alternative a : e.getValue()) {
				if (a.getSize() != 2) {
					newRules.get(e.getKey()).add(a);
					continue;
				}
				ArrayList<Symbol> syms = new ArrayList<Symbol>(2);
				for (Symbol s : a.getLeaves())
					syms.add(proxies.containsKey(s) ? proxies.get(s) : s);
				newRules.get(e.getKey()).add(Alternative.of(syms));
			}
		}
		return new CFGRuleSet(newRules, startState);
	}

	public CFGRuleSet toChomskyNormalForm() {
		return toChomskyNormalForm(StepListener.NONE);
	}

	public CFGRuleSet toChomskyNormalForm(StepListener listener) {
		return Pipeline.chomskyNormalForm().run(this, listener);
	}

	private static void addRule(Map<Symbol, Set<Alternative>> rules, Symbol lhs, Alternative rhs) {
		if (!rules.containsKey(lhs))
			rules.put(lhs, new HashSet<Alternative>());
		rules.get(lhs).add(rhs);
	}

	// reading

	/**
	 * Reads grammar text: records separated by <code>;;</code>, each
	 * <code>LHS -> alt | alt ...</code>. Inside an alternative every
	 * non-whitespace character is a symbol and <code>%</code> alone is the empty
	 * alternative. An empty right-hand side gives the left-hand side no
	 * alternatives. The first record's left-hand side is the start symbol.
	 *
	 * @throws DataFormatException on a record without <code>-&gt;</code>, a bad
	 * left-hand side, or text with no records at all
	 */
	public static CFGRuleSet fromString(String text) throws DataFormatException {
		boolean debug = false;
		LinkedHashMap<Symbol, Set<Alternative>> rules = new LinkedHashMap<Symbol, Set<Alternative>>();
		Symbol start = null;
		String[] records = text.split(";;", -1);
		for (int i = 0; i < records.length; i++) {
			String line = records[i].trim();
			if (line.length() == 0)
				continue;
			int arrow = line.indexOf("->");
			if (arrow < 0)
				throw new DataFormatException("Record "+i+" <<< "+line+" >>> contains no \"->\"", i);
			String lhsText = line.substring(0, arrow).trim();
			String rhsText = line.substring(arrow+2).trim();
			if (lhsText.length() == 0)
				throw new DataFormatException("Record "+i+" <<< "+line+" >>>: LHS appears to be empty", i);
			for (int c = 0; c < lhsText.length(); c++) {
				if (Character.isWhitespace(lhsText.charAt(c)))
					throw new DataFormatException("Record "+i+" <<< "+line+" >>>: LHS "+lhsText+" is more than one symbol", i);
			}
			Symbol lhs = SymbolFactory.getSymbol(lhsText);
			if (start == null)
				start = lhs;
			if (!rules.containsKey(lhs))
				rules.put(lhs, new HashSet<Alternative>());
			if (rhsText.length() == 0)
				continue;
			for (String option : rhsText.split("\\|", -1))
				rules.get(lhs).add(Alternative.fromString(option));
			if (debug) Debug.debug(debug, "Record "+i+" gave "+lhs+" "+rules.get(lhs).size()+" alternatives");
		}
		if (start == null)
			throw new DataFormatException("No rules found; cannot determine a start symbol");
		return new CFGRuleSet(rules, start);
	}

	public static CFGRuleSet fromReader(BufferedReader br) throws IOException, DataFormatException {
		StringBuffer sb = new StringBuffer();
		String line;
		while ((line = br.readLine()) != null) {
			sb.append(line);
			sb.append('\n');
		}
		br.close();
		return fromString(sb.toString());
	}

	public static CFGRuleSet fromFile(String filename, String encoding) throws IOException, DataFormatException {
		return fromReader(new BufferedReader(new InputStreamReader(new FileInputStream(filename), encoding)));
	}

	// writing

	/**
	 * Canonical form: start rule first, the others by left-hand side, each
	 * rule's alternatives sorted, one rule per line ending in <code>;;</code>.
	 * Equal grammars always print the same.
	 */
	public String toString() {
		StringBuffer sb = new StringBuffer();
		for (Map.Entry<Symbol, Set<Alternative>> e : rulesByLHS.entrySet()) {
			sb.append(e.getKey().toString());
			sb.append(" ->");
			boolean first = true;
			for (Alternative a : e.getValue()) {
				sb.append(first ? " " : " | ");
				sb.append(a.toString());
				first = false;
			}
			sb.append(" ;;\n");
		}
		return sb.toString();
	}

	public void print(Writer w) throws IOException {
		w.write(toString());
		w.flush();
	}

	public int hashCode() {
		return 31*startState.hashCode()+rulesByLHS.hashCode();
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof CFGRuleSet))
			return false;
		CFGRuleSet rs = (CFGRuleSet)o;
		return startState.equals(rs.startState) && rulesByLHS.equals(rs.rulesByLHS);
	}
}
