package net.lsmc.montecarlo.assetderivativevaluation;

import org.junit.Test;

import cern.jet.random.engine.MersenneTwister64;
import net.lsmc.exception.CalculationException;
import net.lsmc.functions.AnalyticFormulas;
import net.lsmc.montecarlo.GeometricBrownianMotionPathSimulator;
import net.lsmc.montecarlo.assetderivativevaluation.products.PutPayoff;
import net.lsmc.montecarlo.conditionalexpectation.PolynomialRegression;
import net.lsmc.stochastic.RandomVariableInterface;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class DualUpperBoundEstimatorTest {

	private final double initialValue	= 1.0;
	private final double strike			= 1.0;
	private final double riskFreeRate	= 0.05;
	private final double volatility		= 0.2;
	private final double maturity		= 1.0;

	@Test
	public void testSingleExerciseDateGivesEuropeanValue() throws CalculationException {
		int numberOfPaths = 2000;
		double discountFactor = Math.exp(-riskFreeRate * maturity);
		PutPayoff payoff = new PutPayoff(strike);
		PolynomialRegression regression = new PolynomialRegression(3, false);

		RandomVariableInterface[] paths = new GeometricBrownianMotionPathSimulator(riskFreeRate, volatility, maturity, new MersenneTwister64(1))
				.generatePaths(numberOfPaths, 2, initialValue);
		BackwardInductionResult lowerBound = new LongstaffSchwartzBackwardInduction(payoff, discountFactor, regression).getValues(paths);

		DualUpperBoundEstimator estimator = new DualUpperBoundEstimator(
				new GeometricBrownianMotionPathSimulator(riskFreeRate, volatility, maturity, new MersenneTwister64(2)), payoff, regression, discountFactor);
		UpperBoundResult upperBound = estimator.getUpperBound(lowerBound, 500);

		double valueAnalytic = AnalyticFormulas.blackScholesPutOptionValue(initialValue, riskFreeRate, volatility, maturity, strike);

		System.out.println("European put: lower bound " + lowerBound.getValue() + " (" + lowerBound.getStandardError() + "), upper bound "
				+ upperBound.getUpperBound() + " (" + upperBound.getStandardError() + "), analytic " + valueAnalytic);

		// Without early exercise the dual is the nested estimate of the European value
		assertEquals(valueAnalytic, upperBound.getUpperBound(), 1E-3);
		assertEquals(lowerBound.getValue(), upperBound.getUpperBound(), 4.0 * lowerBound.getStandardError());
		assertEquals(numberOfPaths, upperBound.getPerPathUpperBound().size());
	}

	@Test
	public void testZeroRateBoundIsUndiscountedDual() throws CalculationException {
		int numberOfTimes = 5;
		int numberOfPaths = 200;
		int numberOfMiniPaths = 30;
		double timeStep = maturity / (numberOfTimes - 1);
		PutPayoff payoff = new PutPayoff(strike);
		PolynomialRegression regression = new PolynomialRegression(3, true);

		RandomVariableInterface[] paths = new GeometricBrownianMotionPathSimulator(0.0, volatility, timeStep, new MersenneTwister64(5))
				.generatePaths(numberOfPaths, numberOfTimes, initialValue);
		BackwardInductionResult lowerBound = new LongstaffSchwartzBackwardInduction(payoff, 1.0, regression).getValues(paths);

		UpperBoundResult upperBound = new DualUpperBoundEstimator(
				new GeometricBrownianMotionPathSimulator(0.0, volatility, timeStep, new MersenneTwister64(6)), payoff, regression, 1.0)
				.getUpperBound(lowerBound, numberOfMiniPaths);

		// Same mini-paths, drawn in the same order: max over t of h(t) - M(t) without any discounting
		GeometricBrownianMotionPathSimulator miniPathSimulator = new GeometricBrownianMotionPathSimulator(0.0, volatility, timeStep, new MersenneTwister64(6));
		RandomVariableInterface[] exerciseValues = lowerBound.getExerciseValues();
		RandomVariableInterface[] continuationValues = lowerBound.getContinuationValues();
		double[][] coefficients = lowerBound.getCoefficients();

		double[] martingale = new double[numberOfPaths];
		double[] expected = exerciseValues[0].getRealizations();
		for(int timeIndex = 1; timeIndex < numberOfTimes; timeIndex++) {
			RandomVariableInterface[] endPoints = miniPathSimulator.generateMiniPaths(paths[timeIndex - 1], numberOfMiniPaths);
			for(int path = 0; path < numberOfPaths; path++) {
				double conditionalExpectation = payoff.getValue(endPoints[path]).floor(regression.getValue(coefficients[timeIndex], endPoints[path])).getAverage();
				martingale[path] += Math.max(exerciseValues[timeIndex].get(path), continuationValues[timeIndex].get(path)) - conditionalExpectation;
				expected[path] = Math.max(expected[path], exerciseValues[timeIndex].get(path) - martingale[path]);
			}
		}

		assertArrayEquals(expected, upperBound.getPerPathUpperBound().getRealizations(), 1e-12);
	}

	@Test
	public void testUpperBoundDominatesLowerBound() throws CalculationException {
		AmericanOptionPricingParameters parameters = new AmericanOptionPricingParameters(
				initialValue, strike, riskFreeRate, volatility, maturity, 9, 2000, 1, true, true, null, 3);

		for(int seed = 1; seed <= 3; seed++) {
			MonteCarloAmericanOptionPricer pricer = new MonteCarloAmericanOptionPricer(parameters.getCloneWithModifiedSeed(seed));
			BackwardInductionResult lowerBound = pricer.getValues();
			UpperBoundResult upperBound = pricer.getUpperBound(lowerBound, 300);

			double standardErrorOfDifference = Math.sqrt(lowerBound.getStandardError() * lowerBound.getStandardError() + upperBound.getStandardError() * upperBound.getStandardError());

			System.out.println("Seed " + seed + ": lower bound " + lowerBound.getValue() + ", upper bound " + upperBound.getUpperBound()
					+ " (standard error of difference " + standardErrorOfDifference + ")");

			assertTrue(upperBound.getUpperBound() >= lowerBound.getValue() - 3.0 * standardErrorOfDifference);
			assertTrue(upperBound.getUpperBound() - lowerBound.getValue() < 0.02);
		}
	}

	@Test
	public void testPathwiseBoundDominatesImmediateExercise() throws CalculationException {
		// In the money at time 0
		AmericanOptionPricingParameters parameters = new AmericanOptionPricingParameters(
				0.9, strike, riskFreeRate, volatility, maturity, 5, 500, 7, false, false, null, 3);
		MonteCarloAmericanOptionPricer pricer = new MonteCarloAmericanOptionPricer(parameters);

		BackwardInductionResult lowerBound = pricer.getValues();
		RandomVariableInterface perPathUpperBound = pricer.getUpperBound(lowerBound, 50).getPerPathUpperBound();

		assertTrue(perPathUpperBound.getMin() >= strike - 0.9);
	}

	@Test
	public void testUpperBoundIsReproducible() throws CalculationException {
		AmericanOptionPricingParameters parameters = new AmericanOptionPricingParameters(
				initialValue, strike, riskFreeRate, volatility, maturity, 5, 300, 11, true, true, null, 2);
		MonteCarloAmericanOptionPricer pricer = new MonteCarloAmericanOptionPricer(parameters);

		BackwardInductionResult lowerBound = pricer.getValues();
		UpperBoundResult upperBound1 = pricer.getUpperBound(lowerBound, 20);
		UpperBoundResult upperBound2 = pricer.getUpperBound(lowerBound, 20);

		assertEquals(upperBound1.getUpperBound(), upperBound2.getUpperBound(), 0.0);
		assertEquals(upperBound1.getStandardError(), upperBound2.getStandardError(), 0.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonPositiveNumberOfMiniPathsIsRejected() throws CalculationException {
		AmericanOptionPricingParameters parameters = new AmericanOptionPricingParameters(
				initialValue, strike, riskFreeRate, volatility, maturity, 3, 100, 1, false, false, null, 2);
		MonteCarloAmericanOptionPricer pricer = new MonteCarloAmericanOptionPricer(parameters);

		pricer.getUpperBound(pricer.getValues(), 0);
	}
}
