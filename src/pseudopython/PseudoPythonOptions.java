package pseudopython;

import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;
import pseudopython.trans.passes.codegen.latex.LaTeXCodeGenOptions;
import pseudopython.trans.passes.preview.PreviewOptions;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

public class PseudoPythonOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = { "-help" })
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = { "-quiet" })
	public boolean quiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution ", aliases = { "-verbose" })
	public boolean verbose = false;

	@Option(value = "-c path to the configuration file, if any")
	public String config;

	@Option(value = "-o write the pseudocode to this file instead of standard output")
	public String output;

	@Option("wrap the pseudocode in a standalone LaTeX document")
	public boolean standalone = false;

	@Option("build a PDF preview at this path")
	public String pdf;

	@Option("build a PNG preview at this path")
	public String png;

	public String inputFilePath;

	// fields extracted from the JSON configuration file
	public LaTeXCodeGenOptions codegen = new LaTeXCodeGenOptions();
	public PreviewOptions preview = new PreviewOptions();

	private final Options plumeOptions;
	private final String[] args;

	public PseudoPythonOptions(String[] args) {
		this.args = args;
		plumeOptions = new Options("pseudopython [options] script.py", this);
	}

	public void printHelp(PrintStream out) {
		plumeOptions.printUsage(out);
	}

	public void parse() throws PseudoPythonOptionException {
		String[] remainingArgs;
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new PseudoPythonOptionException(e.getMessage());
		}

		if (help || version) {
			return;
		}

		if (remainingArgs.length != 1) {
			throw new PseudoPythonOptionException("Expected exactly one script, got " + remainingArgs.length);
		}
		inputFilePath = remainingArgs[0];

		if (quiet && verbose) {
			throw new PseudoPythonOptionException("-q and -v cannot be used together");
		}

		if (config == null || config.isEmpty()) {
			return;
		}

		String s;
		try {
			s = FileUtils.readFileToString(new File(config), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new PseudoPythonOptionException("Error reading configuration file: " + ex.getMessage());
		}

		JSONObject configObject;
		try {
			configObject = new JSONObject(s);
		} catch (JSONException e) {
			throw new PseudoPythonOptionException(config + ": parsing error: " + e.getMessage());
		}

		codegen = new LaTeXCodeGenOptions(configObject);
		preview = new PreviewOptions(configObject);
	}
}
