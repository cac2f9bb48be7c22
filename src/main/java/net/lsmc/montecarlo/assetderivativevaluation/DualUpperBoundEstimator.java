package net.lsmc.montecarlo.assetderivativevaluation;

import java.util.logging.Level;
import java.util.logging.Logger;

import net.lsmc.montecarlo.GeometricBrownianMotionPathSimulator;
import net.lsmc.montecarlo.RandomVariable;
import net.lsmc.montecarlo.assetderivativevaluation.products.PayoffFunction;
import net.lsmc.montecarlo.conditionalexpectation.ContinuationValueRegression;
import net.lsmc.stochastic.RandomVariableInterface;

/**
 * Upper bound for the value of an early exercise option using the dual representation of Rogers:
 * for any martingale M with M(0) = 0 the value is bounded by E[ max<sub>t</sub> ( h(t) - M(t) ) ].
 *
 * The martingale is constructed from the value process V(t) = max(h(t), c(t)) given by the exercise
 * value h and the regression estimate c of a Longstaff-Schwartz valuation. Its increment
 * V(t) - E[V(t) | F(t-1)] is estimated by nested simulation: from each path's state at t-1 a bundle of
 * mini-paths is simulated over one time step and V is evaluated at their end points using the
 * regression coefficients of time t.
 *
 * All quantities are measured in units of time 0, i.e. the term at time index t carries the factor D<sup>t</sup>,
 * where D is the discount factor over one time step.
 *
 * The estimator requires <code>numberOfTimes x numberOfPaths x numberOfMiniPaths</code> simulated end points.
 * For a finite number of mini-paths the bound is biased upwards.
 */
public class DualUpperBoundEstimator {

	private static final Logger logger = Logger.getLogger("net.lsmc");

	private final GeometricBrownianMotionPathSimulator	pathSimulator;
	private final PayoffFunction						payoff;
	private final ContinuationValueRegression			regression;
	private final double								discountFactor;

	/**
	 * @param pathSimulator The simulator used for the mini-paths. Its time step has to agree with the one of the outer paths.
	 * @param payoff The exercise value as a function of the underlying.
	 * @param regression The regression used to evaluate the continuation value at the end points of the mini-paths.
	 * @param discountFactor The discount factor over a single time step.
	 */
	public DualUpperBoundEstimator(GeometricBrownianMotionPathSimulator pathSimulator, PayoffFunction payoff, ContinuationValueRegression regression, double discountFactor) {
		super();
		this.pathSimulator = pathSimulator;
		this.payoff = payoff;
		this.regression = regression;
		this.discountFactor = discountFactor;
	}

	/**
	 * Calculates the upper bound for the exercise strategy of a given backward induction.
	 *
	 * @param backwardInduction The result of the Longstaff-Schwartz backward induction.
	 * @param numberOfMiniPaths The number of mini-paths per path and time step.
	 * @return The upper bound.
	 */
	public UpperBoundResult getUpperBound(BackwardInductionResult backwardInduction, int numberOfMiniPaths) {
		return getUpperBound(
				backwardInduction.getUnderlying(),
				backwardInduction.getValues(),
				backwardInduction.getExerciseValues(),
				backwardInduction.getContinuationValues(),
				backwardInduction.getCoefficients(),
				numberOfMiniPaths);
	}

	/**
	 * Calculates the upper bound from the tensors of a Longstaff-Schwartz backward induction.
	 *
	 * @param underlying The underlying x[t].
	 * @param values The option value v[t] (only its dimensions are used).
	 * @param exerciseValues The exercise value h[t].
	 * @param continuationValues The continuation value c[t].
	 * @param coefficients The regression coefficients beta[t].
	 * @param numberOfMiniPaths The number of mini-paths per path and time step.
	 * @return The upper bound.
	 */
	public UpperBoundResult getUpperBound(
			RandomVariableInterface[] underlying,
			RandomVariableInterface[] values,
			RandomVariableInterface[] exerciseValues,
			RandomVariableInterface[] continuationValues,
			double[][] coefficients,
			int numberOfMiniPaths) {
		int numberOfTimes = underlying.length;
		if(numberOfMiniPaths < 1) throw new IllegalArgumentException("Number of mini-paths must be positive, got " + numberOfMiniPaths + ".");
		if(values.length != numberOfTimes || exerciseValues.length != numberOfTimes || continuationValues.length != numberOfTimes || coefficients.length != numberOfTimes) {
			throw new IllegalArgumentException("All tensors must have " + numberOfTimes + " times.");
		}

		int numberOfPaths = underlying[0].size();

		double[] martingale = new double[numberOfPaths];
		double[] upperBound = exerciseValues[0].getRealizations();

		double deflator = 1.0;
		for(int timeIndex = 1; timeIndex < numberOfTimes; timeIndex++) {
			deflator *= discountFactor;

			RandomVariableInterface conditionalExpectation = getConditionalExpectationOfValue(underlying[timeIndex-1], coefficients[timeIndex], numberOfMiniPaths);
			RandomVariableInterface value = exerciseValues[timeIndex].floor(continuationValues[timeIndex]);

			for(int path = 0; path < numberOfPaths; path++) {
				martingale[path] += deflator * (value.get(path) - conditionalExpectation.get(path));
				upperBound[path] = Math.max(upperBound[path], deflator * exerciseValues[timeIndex].get(path) - martingale[path]);
			}
		}

		UpperBoundResult result = new UpperBoundResult(new RandomVariable(upperBound));

		if(logger.isLoggable(Level.FINE)) {
			logger.fine("Dual upper bound using " + numberOfMiniPaths + " mini-paths on " + numberOfPaths + " paths and "
					+ numberOfTimes + " times: " + result.getUpperBound() + " (standard error " + result.getStandardError() + ").");
		}

		return result;
	}

	/*
	 * Estimates E[ max(h(t), c(t)) | x(t-1) ] on each path from the mini-paths started in x(t-1).
	 */
	private RandomVariableInterface getConditionalExpectationOfValue(RandomVariableInterface previousUnderlying, double[] coefficients, int numberOfMiniPaths) {
		RandomVariableInterface[] miniPathEndPoints = pathSimulator.generateMiniPaths(previousUnderlying, numberOfMiniPaths);

		double[] conditionalExpectation = new double[miniPathEndPoints.length];
		for(int path = 0; path < miniPathEndPoints.length; path++) {
			RandomVariableInterface miniExerciseValue		= payoff.getValue(miniPathEndPoints[path]);
			RandomVariableInterface miniContinuationValue	= regression.getValue(coefficients, miniPathEndPoints[path]);
			conditionalExpectation[path] = miniExerciseValue.floor(miniContinuationValue).getAverage();
		}
		return new RandomVariable(conditionalExpectation);
	}
}
