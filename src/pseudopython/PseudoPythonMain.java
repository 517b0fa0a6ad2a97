package pseudopython;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BOMInputStream;
import pseudopython.errors.Issue;
import pseudopython.errors.TopLevelIssueContext;
import pseudopython.formatters.PseudocodeFormatter;
import pseudopython.trans.IOErrorIssue;
import pseudopython.trans.PseudoPythonTranslator;
import pseudopython.trans.passes.codegen.latex.PseudocodeLine;
import pseudopython.trans.passes.option.OptionParsingPass;
import pseudopython.trans.passes.preview.PreviewBuildPass;
import pseudopython.trans.passes.preview.StandaloneDocument;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Logger;

public class PseudoPythonMain {
	private final String[] cmdArgs;
	private static final Logger logger = Logger.getLogger("PseudoPython Main");

	public PseudoPythonMain(String[] args) {
		cmdArgs = args;
	}

	// Creates a PseudoPythonMain instance, and initiates run() below.
	public static void main(String[] args) {
		if (new PseudoPythonMain(args).run(System.out, System.err)) {
			logger.fine("Finished");
		} else {
			logger.fine("Terminated with errors");
			System.exit(1);
		}
	}

	// a leading byte order mark is dropped while decoding
	private static String readScript(Path path) throws IOException {
		try (InputStream in = new BOMInputStream(FileUtils.openInputStream(path.toFile()))) {
			return IOUtils.toString(in, StandardCharsets.UTF_8);
		}
	}

	private static boolean report(TopLevelIssueContext ctx, PrintStream err) {
		err.println(ctx.format());
		return false;
	}

	// Top-level workhorse method.
	public boolean run(PrintStream out, PrintStream err) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging. Every stage logger reports through the root handlers.
		PseudoPythonOptions opts = OptionParsingPass.perform(ctx, Logger.getLogger(""), cmdArgs);
		if (ctx.hasErrors()) {
			report(ctx, err);
			opts.printHelp(err);
			return false;
		}
		if (opts.version) {
			out.println("pseudopython version " + PseudoPythonOptions.VERSION);
			return true;
		}
		if (opts.help) {
			opts.printHelp(out);
			return true;
		}

		logger.info("Opening source file");
		Path inputFilePath = Paths.get(opts.inputFilePath);
		String source;
		try {
			source = readScript(inputFilePath);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			return report(ctx, err);
		}

		logger.info("Translating " + inputFilePath);
		PseudoPythonTranslator translator = new PseudoPythonTranslator(opts.codegen);
		int indent = opts.codegen.getIndent();
		List<PseudocodeLine> lines;
		try {
			lines = translator.translate(inputFilePath, source);

			if (opts.pdf != null || opts.png != null) {
				logger.info("Building preview");
				PreviewBuildPass.perform(opts.preview, inputFilePath, lines, indent,
						opts.pdf == null ? null : Paths.get(opts.pdf),
						opts.png == null ? null : Paths.get(opts.png));
			}
		} catch (Issue issue) {
			ctx.error(issue);
			return report(ctx, err);
		}

		String text = opts.standalone
				? StandaloneDocument.format(opts.preview, lines, indent)
				: PseudocodeFormatter.format(lines, indent);
		if (opts.output != null) {
			logger.info("Writing pseudocode to \"" + opts.output + "\"");
			try {
				FileUtils.writeStringToFile(Paths.get(opts.output).toFile(), text, StandardCharsets.UTF_8);
			} catch (IOException e) {
				ctx.error(new IOErrorIssue(e));
				return report(ctx, err);
			}
		} else if (opts.pdf == null && opts.png == null) {
			out.print(text);
			out.flush();
		}
		return true;
	}
}
