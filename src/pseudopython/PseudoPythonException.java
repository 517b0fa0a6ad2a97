package pseudopython;

/**
 * A pseudopython exception consisting of a prefix (type of error) and a message
 *
 */
public abstract class PseudoPythonException extends RuntimeException {
	public PseudoPythonException(String prefix, String msg) {
		super(prefix + ": " + msg);
	}
}
