package net.lsmc.exception;

/**
 * Exception thrown if a valuation cannot be carried out, e.g. because a regression
 * used to estimate a conditional expectation is ill-conditioned.
 *
 * The numerical core never retries; the exception is propagated to the caller.
 */
public class CalculationException extends Exception {

	private static final long serialVersionUID = 6043912513409381253L;

	public CalculationException(String message) {
		super(message);
	}

	public CalculationException(Throwable cause) {
		super(cause);
	}

	public CalculationException(String message, Throwable cause) {
		super(message, cause);
	}
}
