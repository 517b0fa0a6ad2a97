package pseudopython.formatters;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * What the expression renderer needs to know beyond the expression itself: how prefixed names
 * map to symbols, and which names are procedures defined in the same script.
 */
public class LaTeXRenderingContext {

	public static final Map<String, String> DEFAULT_SYMBOL_PREFIXES;
	static {
		Map<String, String> prefixes = new LinkedHashMap<>();
		prefixes.put("Sym_", "\\%s");
		prefixes.put("MC_", "\\mathcal{%s}");
		prefixes.put("BB_", "\\mathbb{%s}");
		DEFAULT_SYMBOL_PREFIXES = Collections.unmodifiableMap(prefixes);
	}

	// ordered; the first matching prefix wins
	private final Map<String, String> symbolPrefixes;
	private final Set<String> procedures;

	public LaTeXRenderingContext(Map<String, String> symbolPrefixes, Set<String> procedures) {
		this.symbolPrefixes = symbolPrefixes;
		this.procedures = procedures;
	}

	public static LaTeXRenderingContext defaults() {
		return new LaTeXRenderingContext(DEFAULT_SYMBOL_PREFIXES, Collections.emptySet());
	}

	public LaTeXRenderingContext withProcedures(Set<String> procedures) {
		return new LaTeXRenderingContext(symbolPrefixes, procedures);
	}

	public Map<String, String> getSymbolPrefixes() {
		return symbolPrefixes;
	}

	public boolean isProcedure(String name) {
		return procedures.contains(name);
	}
}
