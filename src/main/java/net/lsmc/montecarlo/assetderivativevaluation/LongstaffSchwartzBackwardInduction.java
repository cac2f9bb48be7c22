package net.lsmc.montecarlo.assetderivativevaluation;

import java.util.logging.Level;
import java.util.logging.Logger;

import net.lsmc.exception.CalculationException;
import net.lsmc.exception.NumericFitException;
import net.lsmc.montecarlo.RandomVariable;
import net.lsmc.montecarlo.assetderivativevaluation.products.PayoffFunction;
import net.lsmc.montecarlo.conditionalexpectation.ContinuationValueRegression;
import net.lsmc.stochastic.RandomVariableInterface;

/**
 * Valuation of an early exercise option by the backward induction of Longstaff and Schwartz.
 *
 * Starting from the exercise value at the last time index, the value is discounted back one time step
 * at a time. At each interior time index the continuation value is estimated by a regression on the
 * underlying and the option is exercised on the paths where the exercise value is strictly larger than
 * the continuation value floored at zero. At time index 0 no exercise decision is made.
 *
 * The regression coefficients are either fitted on the given paths, or, if given, applied as they are.
 * The latter allows to value the exercise strategy on paths independent of the ones used to determine it.
 */
public class LongstaffSchwartzBackwardInduction {

	private static final Logger logger = Logger.getLogger("net.lsmc");

	private final PayoffFunction				payoff;
	private final double						discountFactor;
	private final ContinuationValueRegression	regression;

	/**
	 * @param payoff The exercise value as a function of the underlying.
	 * @param discountFactor The discount factor over a single time step.
	 * @param regression The estimator of the continuation value.
	 */
	public LongstaffSchwartzBackwardInduction(PayoffFunction payoff, double discountFactor, ContinuationValueRegression regression) {
		super();
		this.payoff = payoff;
		this.discountFactor = discountFactor;
		this.regression = regression;
	}

	/**
	 * Runs the backward induction fitting the regression coefficients on the given paths.
	 *
	 * @param underlying The paths of the underlying, indexed by time index.
	 * @return The result of the backward induction.
	 * @throws CalculationException Thrown if a regression fails ({@link NumericFitException}).
	 */
	public BackwardInductionResult getValues(RandomVariableInterface[] underlying) throws CalculationException {
		return getValues(underlying, null);
	}

	/**
	 * Runs the backward induction.
	 *
	 * @param underlying The paths of the underlying, indexed by time index.
	 * @param coefficients The regression coefficients to apply, indexed by time index, or null if they should be fitted on the given paths.
	 * @return The result of the backward induction.
	 * @throws CalculationException Thrown if a regression fails ({@link NumericFitException}).
	 */
	public BackwardInductionResult getValues(RandomVariableInterface[] underlying, double[][] coefficients) throws CalculationException {
		int numberOfTimes = underlying.length;
		if(numberOfTimes < 2) throw new IllegalArgumentException("Backward induction requires at least 2 times, got " + numberOfTimes + ".");
		boolean isFitCoefficients = coefficients == null;
		if(!isFitCoefficients) validateCoefficients(coefficients, numberOfTimes);

		int numberOfPaths = underlying[0].size();
		int lastTimeIndex = numberOfTimes - 1;

		RandomVariableInterface[] exerciseValues		= new RandomVariableInterface[numberOfTimes];
		RandomVariableInterface[] values				= new RandomVariableInterface[numberOfTimes];
		RandomVariableInterface[] continuationValues	= new RandomVariableInterface[numberOfTimes];
		double[][] regressionCoefficients = new double[numberOfTimes][regression.getOrder()];

		for(int timeIndex = 0; timeIndex < numberOfTimes; timeIndex++) {
			exerciseValues[timeIndex] = payoff.getValue(underlying[timeIndex]);
		}

		// Not estimated at the boundaries
		RandomVariableInterface zero = new RandomVariable(numberOfPaths, 0.0);
		continuationValues[0] = zero;
		continuationValues[lastTimeIndex] = zero;

		// Exercise (or expiry) at maturity
		values[lastTimeIndex] = exerciseValues[lastTimeIndex];

		for(int timeIndex = lastTimeIndex - 1; timeIndex >= 1; timeIndex--) {
			RandomVariableInterface discountedFutureValue = values[timeIndex + 1].mult(discountFactor);

			if(isFitCoefficients) {
				try {
					regressionCoefficients[timeIndex] = regression.getCoefficients(underlying[timeIndex], discountedFutureValue, exerciseValues[timeIndex]);
				}
				catch(CalculationException e) {
					throw new NumericFitException(timeIndex, e);
				}
			}
			else {
				regressionCoefficients[timeIndex] = coefficients[timeIndex].clone();
			}

			continuationValues[timeIndex] = regression.getValue(regressionCoefficients[timeIndex], underlying[timeIndex]);

			values[timeIndex] = getValueWithExercise(exerciseValues[timeIndex], continuationValues[timeIndex], discountedFutureValue);
		}

		// No exercise decision at time 0
		values[0] = values[1].mult(discountFactor);

		BackwardInductionResult result = new BackwardInductionResult(underlying, values, exerciseValues, continuationValues, regressionCoefficients);

		if(logger.isLoggable(Level.FINE)) {
			logger.fine("Backward induction (" + (isFitCoefficients ? "fitted" : "given") + " coefficients) on " + numberOfPaths + " paths and "
					+ numberOfTimes + " times: value " + result.getValue() + " (standard error " + result.getStandardError() + ").");
		}

		return result;
	}

	/*
	 * Exercise where the exercise value is strictly larger than max(continuation value, 0). The floor
	 * prevents a negative regression estimate from triggering the exercise of an out of the money path.
	 */
	private static RandomVariableInterface getValueWithExercise(RandomVariableInterface exerciseValue, RandomVariableInterface continuationValue, RandomVariableInterface discountedFutureValue) {
		double[] value = discountedFutureValue.getRealizations();
		for(int path = 0; path < value.length; path++) {
			if(exerciseValue.get(path) > Math.max(continuationValue.get(path), 0.0)) {
				value[path] = exerciseValue.get(path);
			}
		}
		return new RandomVariable(value);
	}

	private void validateCoefficients(double[][] coefficients, int numberOfTimes) {
		if(coefficients.length != numberOfTimes) {
			throw new IllegalArgumentException("Expected regression coefficients for " + numberOfTimes + " times, got " + coefficients.length + ".");
		}
		for(int timeIndex = 1; timeIndex < numberOfTimes - 1; timeIndex++) {
			if(coefficients[timeIndex] == null || coefficients[timeIndex].length != regression.getOrder()) {
				throw new IllegalArgumentException("Expected " + regression.getOrder() + " regression coefficients at time index " + timeIndex + ".");
			}
		}
	}

	public PayoffFunction getPayoff() {
		return payoff;
	}

	public double getDiscountFactor() {
		return discountFactor;
	}

	public ContinuationValueRegression getRegression() {
		return regression;
	}
}
