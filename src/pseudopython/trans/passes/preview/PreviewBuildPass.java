package pseudopython.trans.passes.preview;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import pseudopython.errors.Issue;
import pseudopython.trans.IOErrorIssue;
import pseudopython.trans.passes.codegen.latex.PseudocodeLine;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds a PDF or PNG picture of the pseudocode with the external TeX toolchain.
 *
 * The work happens in .pseudopython/&lt;script name&gt;/ next to the script, and only the requested
 * artifacts are moved out of it.
 */
public class PreviewBuildPass {
	private static final Logger logger = Logger.getLogger("PseudoPython Preview");

	static final String JOB_NAME = "pseudopython";
	static final String BUILD_DIRECTORY = ".pseudopython";
	static final int OUTPUT_TAIL_LINES = 20;

	private PreviewBuildPass() {}

	public static Path buildDirectory(Path script) {
		Path absolute = script.toAbsolutePath();
		return absolute.resolveSibling(BUILD_DIRECTORY).resolve(absolute.getFileName().toString());
	}

	/**
	 * @param pdf where to put the PDF, or null
	 * @param png where to put the PNG, or null
	 */
	public static void perform(PreviewOptions options, Path script, List<PseudocodeLine> lines, int indent,
	                           Path pdf, Path png) throws Issue {
		if (pdf == null && png == null) {
			return;
		}
		Path buildDir = buildDirectory(script);
		File texFile = buildDir.resolve(JOB_NAME + ".tex").toFile();
		try {
			FileUtils.forceMkdir(buildDir.toFile());
			FileUtils.writeStringToFile(texFile, StandaloneDocument.format(options, lines, indent),
					StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new IOErrorIssue(e);
		}

		logger.info("Running " + options.getPdflatex() + " in \"" + buildDir + "\"");
		ProcessBuilder latex = new ProcessBuilder(options.getPdflatex(), "-halt-on-error",
				"-interaction=nonstopmode", JOB_NAME + ".tex");
		latex.directory(buildDir.toFile());
		// the script's own directory comes first so local style files are found
		String texInputs = String.join(File.pathSeparator,
				Arrays.asList(".", script.toAbsolutePath().getParent().toString(), ""));
		latex.environment().put("TEXINPUTS", texInputs);
		run(latex);

		if (png != null) {
			logger.info("Running " + options.getPdftoppm());
			ProcessBuilder ppm = new ProcessBuilder(options.getPdftoppm(), "-singlefile", "-png",
					JOB_NAME + ".pdf", JOB_NAME);
			ppm.directory(buildDir.toFile());
			run(ppm);
			moveArtifact(buildDir.resolve(JOB_NAME + ".png"), png);
		}
		if (pdf != null) {
			moveArtifact(buildDir.resolve(JOB_NAME + ".pdf"), pdf);
		}
	}

	private static void run(ProcessBuilder pb) throws Issue {
		String command = String.join(" ", pb.command());
		pb.redirectErrorStream(true);
		try {
			Process process = pb.start();
			String output;
			try (InputStream in = process.getInputStream()) {
				output = IOUtils.toString(in, StandardCharsets.UTF_8);
			}
			int exitCode = process.waitFor();
			logger.fine(command + " exited with status " + exitCode);
			if (exitCode != 0) {
				throw new PreviewBuildIssue(command, exitCode, tail(output));
			}
		} catch (IOException e) {
			throw new PreviewBuildIssue(command, e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new PreviewBuildIssue(command, e);
		}
	}

	// TeX logs are long; the error is at the end
	static String tail(String output) {
		String[] lines = output.split("\r?\n");
		int from = Math.max(0, lines.length - OUTPUT_TAIL_LINES);
		return String.join("\n", Arrays.asList(lines).subList(from, lines.length));
	}

	private static void moveArtifact(Path built, Path destination) throws Issue {
		try {
			File target = destination.toFile();
			if (target.exists()) {
				FileUtils.forceDelete(target);
			}
			FileUtils.moveFile(built.toFile(), target);
		} catch (IOException e) {
			throw new IOErrorIssue(e);
		}
		logger.info("Wrote " + destination.toAbsolutePath());
	}
}
