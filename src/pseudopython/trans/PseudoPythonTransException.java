package pseudopython.trans;

import pseudopython.PseudoPythonException;

/**
 * Exception during script to pseudocode translation
 *
 */
public class PseudoPythonTransException extends PseudoPythonException {

	private static final long serialVersionUID = -3390472106532381985L;
	private static final String prefix = "Translation Error";

	public PseudoPythonTransException(String msg) {
		super(prefix, msg);
	}

}
