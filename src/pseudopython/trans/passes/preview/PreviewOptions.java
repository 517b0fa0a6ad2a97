package pseudopython.trans.passes.preview;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import pseudopython.PseudoPythonOptionException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

// Settings for the standalone preview document and the TeX toolchain that builds it, read from the
// "preview" object of the JSON configuration file:
//
//   "preview": {
//     "pdflatex": "pdflatex",
//     "pdftoppm": "pdftoppm",
//     "width": "13cm",
//     "packages": ["amsmath", "amsfonts"]
//   }
//
// Every field is optional.
public class PreviewOptions {
	public static final String PREVIEW_FIELD = "preview";

	public static final String DEFAULT_PDFLATEX = "pdflatex";
	public static final String DEFAULT_PDFTOPPM = "pdftoppm";
	public static final String DEFAULT_WIDTH = "13cm";
	public static final List<String> DEFAULT_PACKAGES =
			Collections.unmodifiableList(Arrays.asList("amsmath", "amsfonts"));

	private final String pdflatex;
	private final String pdftoppm;
	private final String width;
	private final List<String> packages;

	public PreviewOptions() {
		this(DEFAULT_PDFLATEX, DEFAULT_PDFTOPPM, DEFAULT_WIDTH, DEFAULT_PACKAGES);
	}

	public PreviewOptions(String pdflatex, String pdftoppm, String width, List<String> packages) {
		this.pdflatex = pdflatex;
		this.pdftoppm = pdftoppm;
		this.width = width;
		this.packages = packages;
	}

	// Expects the whole configuration.
	public PreviewOptions(JSONObject config) throws PseudoPythonOptionException {
		if (!config.has(PREVIEW_FIELD)) {
			this.pdflatex = DEFAULT_PDFLATEX;
			this.pdftoppm = DEFAULT_PDFTOPPM;
			this.width = DEFAULT_WIDTH;
			this.packages = DEFAULT_PACKAGES;
			return;
		}

		try {
			JSONObject previewConfig = config.getJSONObject(PREVIEW_FIELD);
			this.pdflatex = previewConfig.has("pdflatex") ? previewConfig.getString("pdflatex") : DEFAULT_PDFLATEX;
			this.pdftoppm = previewConfig.has("pdftoppm") ? previewConfig.getString("pdftoppm") : DEFAULT_PDFTOPPM;
			this.width = previewConfig.has("width") ? previewConfig.getString("width") : DEFAULT_WIDTH;
			if (previewConfig.has("packages")) {
				JSONArray packageArray = previewConfig.getJSONArray("packages");
				List<String> packageList = new ArrayList<>();
				for (int i = 0; i < packageArray.length(); i++) {
					packageList.add(packageArray.getString(i));
				}
				this.packages = Collections.unmodifiableList(packageList);
			} else {
				this.packages = DEFAULT_PACKAGES;
			}
		} catch (JSONException e) {
			throw new PseudoPythonOptionException("Configuration is invalid: " + e.getMessage());
		}
	}

	public String getPdflatex() {
		return pdflatex;
	}

	public String getPdftoppm() {
		return pdftoppm;
	}

	public String getWidth() {
		return width;
	}

	public List<String> getPackages() {
		return packages;
	}
}
