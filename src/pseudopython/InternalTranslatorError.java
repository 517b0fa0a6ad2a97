package pseudopython;

public class InternalTranslatorError extends RuntimeException {
	public InternalTranslatorError(String message) {
		super("internal translator error: " + message);
	}
}
