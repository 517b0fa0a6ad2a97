package pseudopython;

public class PseudoPythonOptionException extends Exception {

	private static final long serialVersionUID = 4283117019564378233L;

	public PseudoPythonOptionException(String message) {
		super(message);
	}

}
