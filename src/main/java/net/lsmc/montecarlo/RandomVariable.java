package net.lsmc.montecarlo;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

import net.lsmc.stochastic.RandomVariableInterface;

/**
 * The class RandomVariable represents a random variable being the evaluation of a stochastic process
 * at a certain time within a Monte-Carlo simulation.
 * It is internally represented by an array of doubles, one entry per path.
 *
 * The realizations are never modified after construction.
 */
public class RandomVariable implements RandomVariableInterface {

	private final double[] realizations;

	/**
	 * Create a random variable from an array of realizations. The array is not copied and must not be
	 * modified by the caller afterwards.
	 *
	 * @param realizations The realizations, one per path.
	 */
	public RandomVariable(double[] realizations) {
		super();
		if(realizations == null || realizations.length == 0) {
			throw new IllegalArgumentException("A random variable requires at least one realization.");
		}
		this.realizations = realizations;
	}

	/**
	 * Create a random variable having the same value on all paths.
	 *
	 * @param numberOfPaths The number of paths.
	 * @param value The value.
	 */
	public RandomVariable(int numberOfPaths, double value) {
		this(filledArray(numberOfPaths, value));
	}

	private static double[] filledArray(int numberOfPaths, double value) {
		if(numberOfPaths < 1) {
			throw new IllegalArgumentException("Number of paths must be positive, got " + numberOfPaths + ".");
		}
		double[] values = new double[numberOfPaths];
		Arrays.fill(values, value);
		return values;
	}

	@Override
	public int size() {
		return realizations.length;
	}

	@Override
	public double get(int pathOrState) {
		return realizations[pathOrState];
	}

	@Override
	public double[] getRealizations() {
		return realizations.clone();
	}

	@Override
	public boolean isDeterministic() {
		for(double realization : realizations) {
			if(realization != realizations[0]) return false;
		}
		return true;
	}

	@Override
	public double getMin() {
		double min = Double.POSITIVE_INFINITY;
		for(double realization : realizations) min = Math.min(min, realization);
		return min;
	}

	@Override
	public double getMax() {
		double max = Double.NEGATIVE_INFINITY;
		for(double realization : realizations) max = Math.max(max, realization);
		return max;
	}

	@Override
	public double getAverage() {
		double sum = 0.0;
		for(double realization : realizations) sum += realization;
		return sum / realizations.length;
	}

	@Override
	public double getVariance() {
		return getSumOfSquaredDeviations() / realizations.length;
	}

	@Override
	public double getSampleVariance() {
		if(realizations.length == 1) return 0.0;
		return getSumOfSquaredDeviations() / (realizations.length - 1);
	}

	private double getSumOfSquaredDeviations() {
		double average = getAverage();
		double sum = 0.0;
		for(double realization : realizations) {
			double deviation = realization - average;
			sum += deviation * deviation;
		}
		return sum;
	}

	@Override
	public double getStandardDeviation() {
		return Math.sqrt(getVariance());
	}

	@Override
	public double getStandardError() {
		return getStandardDeviation() / Math.sqrt(realizations.length);
	}

	@Override
	public RandomVariableInterface add(double value) {
		return apply(x -> x + value);
	}

	@Override
	public RandomVariableInterface add(RandomVariableInterface randomVariable) {
		checkSize(randomVariable);
		double[] result = new double[realizations.length];
		for(int path = 0; path < result.length; path++) result[path] = realizations[path] + randomVariable.get(path);
		return new RandomVariable(result);
	}

	@Override
	public RandomVariableInterface sub(double value) {
		return apply(x -> x - value);
	}

	@Override
	public RandomVariableInterface sub(RandomVariableInterface randomVariable) {
		checkSize(randomVariable);
		double[] result = new double[realizations.length];
		for(int path = 0; path < result.length; path++) result[path] = realizations[path] - randomVariable.get(path);
		return new RandomVariable(result);
	}

	@Override
	public RandomVariableInterface mult(double value) {
		return apply(x -> x * value);
	}

	@Override
	public RandomVariableInterface mult(RandomVariableInterface randomVariable) {
		checkSize(randomVariable);
		double[] result = new double[realizations.length];
		for(int path = 0; path < result.length; path++) result[path] = realizations[path] * randomVariable.get(path);
		return new RandomVariable(result);
	}

	@Override
	public RandomVariableInterface floor(double floor) {
		return apply(x -> Math.max(x, floor));
	}

	@Override
	public RandomVariableInterface floor(RandomVariableInterface floor) {
		checkSize(floor);
		double[] result = new double[realizations.length];
		for(int path = 0; path < result.length; path++) result[path] = Math.max(realizations[path], floor.get(path));
		return new RandomVariable(result);
	}

	@Override
	public RandomVariableInterface apply(DoubleUnaryOperator function) {
		double[] result = new double[realizations.length];
		for(int path = 0; path < result.length; path++) result[path] = function.applyAsDouble(realizations[path]);
		return new RandomVariable(result);
	}

	private void checkSize(RandomVariableInterface randomVariable) {
		if(randomVariable.size() != realizations.length) {
			throw new IllegalArgumentException("Random variables have different number of paths: " + realizations.length + " and " + randomVariable.size() + ".");
		}
	}

	@Override
	public String toString() {
		return "RandomVariable [size=" + realizations.length + ", average=" + getAverage() + "]";
	}
}
