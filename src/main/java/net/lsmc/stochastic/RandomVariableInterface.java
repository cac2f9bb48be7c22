package net.lsmc.stochastic;

import java.util.function.DoubleUnaryOperator;

/**
 * The interface implemented by a Monte-Carlo random variable, i.e. the cross-section of
 * all simulated paths at a given time index.
 *
 * Implementations are immutable: all operations return new objects.
 */
public interface RandomVariableInterface {

	/**
	 * @return The number of realizations (paths).
	 */
	int size();

	/**
	 * @param pathOrState The path index.
	 * @return The realization for the given path.
	 */
	double get(int pathOrState);

	/**
	 * @return A copy of the realizations of this random variable.
	 */
	double[] getRealizations();

	/**
	 * @return True if all realizations are identical.
	 */
	boolean isDeterministic();

	double getMin();

	double getMax();

	double getAverage();

	/**
	 * Returns the (population) variance, i.e. the sum of squared deviations divided by <code>size()</code>.
	 *
	 * @return The variance.
	 */
	double getVariance();

	/**
	 * Returns the sample variance, i.e. the sum of squared deviations divided by <code>size()-1</code>.
	 *
	 * @return The sample variance.
	 */
	double getSampleVariance();

	double getStandardDeviation();

	/**
	 * Returns the standard error of the Monte-Carlo average, i.e. <code>getStandardDeviation() / sqrt(size())</code>.
	 *
	 * @return The standard error.
	 */
	double getStandardError();

	RandomVariableInterface add(double value);

	RandomVariableInterface add(RandomVariableInterface randomVariable);

	RandomVariableInterface sub(double value);

	RandomVariableInterface sub(RandomVariableInterface randomVariable);

	RandomVariableInterface mult(double value);

	RandomVariableInterface mult(RandomVariableInterface randomVariable);

	/**
	 * @param floor The floor.
	 * @return The random variable <code>max(this, floor)</code>.
	 */
	RandomVariableInterface floor(double floor);

	/**
	 * @param floor The floor.
	 * @return The random variable <code>max(this, floor)</code>, taken path by path.
	 */
	RandomVariableInterface floor(RandomVariableInterface floor);

	/**
	 * Applies a function to every realization.
	 *
	 * @param function The function.
	 * @return The random variable <code>function(this)</code>.
	 */
	RandomVariableInterface apply(DoubleUnaryOperator function);
}
