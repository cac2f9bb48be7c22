package net.lsmc.exception;

/**
 * Thrown if the regression of the continuation value fails at a given time index
 * of the backward induction.
 */
public class NumericFitException extends CalculationException {

	private static final long serialVersionUID = -2361830521712398046L;

	private final int timeIndex;

	public NumericFitException(int timeIndex, Throwable cause) {
		super("Regression of the continuation value failed at time index " + timeIndex + ": " + cause.getMessage(), cause);
		this.timeIndex = timeIndex;
	}

	/**
	 * @return The time index at which the regression failed.
	 */
	public int getTimeIndex() {
		return timeIndex;
	}
}
