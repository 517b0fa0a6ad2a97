package pseudopython.trans.passes.codegen.latex;

import org.json.JSONException;
import org.json.JSONObject;
import pseudopython.PseudoPythonOptionException;
import pseudopython.formatters.LaTeXRenderingContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// Settings for pseudocode generation, read from the "codegen" object of the JSON configuration file.
// Every field is optional:
//
//   "codegen": {
//     "indent": 2,
//     "symbol_prefixes": { "Sym_": "\\%s", "MC_": "\\mathcal{%s}", "BB_": "\\mathbb{%s}" }
//   }
//
// A symbol prefix maps names starting with it to a LaTeX template, in which %s stands for the rest
// of the name. Prefixes given in the file replace the default table.
public class LaTeXCodeGenOptions {
	public static final String CODEGEN_FIELD = "codegen";
	public static final String INDENT_FIELD = "indent";
	public static final String SYMBOL_PREFIXES_FIELD = "symbol_prefixes";

	public static final int DEFAULT_INDENT = 2;

	private final int indent;
	private final Map<String, String> symbolPrefixes;

	public LaTeXCodeGenOptions() {
		this(DEFAULT_INDENT, LaTeXRenderingContext.DEFAULT_SYMBOL_PREFIXES);
	}

	public LaTeXCodeGenOptions(int indent, Map<String, String> symbolPrefixes) {
		this.indent = indent;
		this.symbolPrefixes = symbolPrefixes;
	}

	// Expects the whole configuration; a missing "codegen" object means all defaults.
	public LaTeXCodeGenOptions(JSONObject config) throws PseudoPythonOptionException {
		if (!config.has(CODEGEN_FIELD)) {
			this.indent = DEFAULT_INDENT;
			this.symbolPrefixes = LaTeXRenderingContext.DEFAULT_SYMBOL_PREFIXES;
			return;
		}

		try {
			JSONObject codegenConfig = config.getJSONObject(CODEGEN_FIELD);
			if (codegenConfig.has(INDENT_FIELD)) {
				this.indent = codegenConfig.getInt(INDENT_FIELD);
			} else {
				this.indent = DEFAULT_INDENT;
			}

			if (codegenConfig.has(SYMBOL_PREFIXES_FIELD)) {
				JSONObject prefixes = codegenConfig.getJSONObject(SYMBOL_PREFIXES_FIELD);
				Map<String, String> map = new LinkedHashMap<>();
				// JSONObject does not keep key order, so longer prefixes are tried first
				prefixes.keySet().stream()
						.sorted((a, b) -> a.length() != b.length() ? b.length() - a.length() : a.compareTo(b))
						.forEach(key -> map.put(key, prefixes.getString(key)));
				this.symbolPrefixes = Collections.unmodifiableMap(map);
			} else {
				this.symbolPrefixes = LaTeXRenderingContext.DEFAULT_SYMBOL_PREFIXES;
			}
		} catch (JSONException e) {
			throw new PseudoPythonOptionException("Configuration is invalid: " + e.getMessage());
		}

		if (indent < 0) {
			throw new PseudoPythonOptionException("Configuration is invalid: " + INDENT_FIELD + " must not be negative");
		}
	}

	public int getIndent() {
		return indent;
	}

	public Map<String, String> getSymbolPrefixes() {
		return symbolPrefixes;
	}
}
