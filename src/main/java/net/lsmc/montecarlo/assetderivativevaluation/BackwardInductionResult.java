package net.lsmc.montecarlo.assetderivativevaluation;

import net.lsmc.stochastic.RandomVariableInterface;

/**
 * The result of a Longstaff-Schwartz backward induction: the simulated underlying, the option value,
 * the exercise value and the estimated continuation value for each time index, the regression
 * coefficients, and the Monte-Carlo value with its standard error.
 *
 * The arrays are indexed by the time index. Getters return copies of the arrays; the random variables
 * are immutable.
 */
public class BackwardInductionResult {

	private final RandomVariableInterface[]	underlying;
	private final RandomVariableInterface[]	values;
	private final RandomVariableInterface[]	exerciseValues;
	private final RandomVariableInterface[]	continuationValues;
	private final double[][]				coefficients;

	private final double value;
	private final double standardError;

	public BackwardInductionResult(
			RandomVariableInterface[] underlying,
			RandomVariableInterface[] values,
			RandomVariableInterface[] exerciseValues,
			RandomVariableInterface[] continuationValues,
			double[][] coefficients) {
		super();
		this.underlying = underlying.clone();
		this.values = values.clone();
		this.exerciseValues = exerciseValues.clone();
		this.continuationValues = continuationValues.clone();
		this.coefficients = copyOf(coefficients);

		this.value = values[0].getAverage();
		this.standardError = values[0].getStandardError();
	}

	/**
	 * @return The Monte-Carlo value, i.e. the average of the option value at time index 0.
	 */
	public double getValue() {
		return value;
	}

	/**
	 * @return The standard error of the Monte-Carlo value.
	 */
	public double getStandardError() {
		return standardError;
	}

	/**
	 * @return The simulated underlying x[t].
	 */
	public RandomVariableInterface[] getUnderlying() {
		return underlying.clone();
	}

	/**
	 * @return The option value v[t] under the exercise strategy.
	 */
	public RandomVariableInterface[] getValues() {
		return values.clone();
	}

	/**
	 * @return The exercise value h[t].
	 */
	public RandomVariableInterface[] getExerciseValues() {
		return exerciseValues.clone();
	}

	/**
	 * @return The estimated continuation value c[t]; zero at the first and the last time index, where it is not estimated.
	 */
	public RandomVariableInterface[] getContinuationValues() {
		return continuationValues.clone();
	}

	/**
	 * @return The regression coefficients beta[t] (ascending powers); zero at the first and the last time index.
	 */
	public double[][] getCoefficients() {
		return copyOf(coefficients);
	}

	public int getNumberOfTimes() {
		return underlying.length;
	}

	public int getNumberOfPaths() {
		return underlying[0].size();
	}

	private static double[][] copyOf(double[][] matrix) {
		double[][] copy = new double[matrix.length][];
		for(int row = 0; row < matrix.length; row++) copy[row] = matrix[row].clone();
		return copy;
	}

	@Override
	public String toString() {
		return "BackwardInductionResult [value=" + value + ", standardError=" + standardError
				+ ", numberOfTimes=" + getNumberOfTimes() + ", numberOfPaths=" + getNumberOfPaths() + "]";
	}
}
