package net.lsmc.montecarlo.assetderivativevaluation;

import java.util.Date;
import java.util.logging.Level;
import java.util.logging.Logger;

import cern.jet.random.engine.MersenneTwister64;
import cern.jet.random.engine.RandomEngine;
import net.lsmc.exception.CalculationException;
import net.lsmc.montecarlo.GeometricBrownianMotionPathSimulator;
import net.lsmc.montecarlo.conditionalexpectation.PolynomialRegression;
import net.lsmc.stochastic.RandomVariableInterface;

/**
 * Monte-Carlo valuation of an American option under the Black-Scholes model using the
 * Longstaff-Schwartz algorithm, together with the dual upper bound of Rogers.
 *
 * If independent paths are used, the regression coefficients are determined on a first set of paths
 * and the resulting exercise strategy is valued on a second, independent set of paths. This removes the
 * foresight bias of valuing the strategy on the paths it was fitted on.
 *
 * Each call creates its own random number generator from the seed of the pricer. If the parameters carry no seed,
 * the pricer draws one on construction from a shared seed generator, hence repeated calls of the same pricer
 * give identical results while different pricers use different random numbers.
 */
public class MonteCarloAmericanOptionPricer {

	private static final Logger logger = Logger.getLogger("net.lsmc");

	// Scrambles the seed of the generator used for the mini-paths of the dual valuation
	private static final int UPPER_BOUND_SEED_SCRAMBLE = 0x5bd1e995;

	// Provides the seeds of pricers constructed without a seed
	private static final RandomEngine seedGenerator = new MersenneTwister64(new Date());

	private final AmericanOptionPricingParameters	parameters;
	private final int								seed;

	public MonteCarloAmericanOptionPricer(AmericanOptionPricingParameters parameters) {
		super();
		if(parameters == null) throw new IllegalArgumentException("Parameters must not be null.");
		this.parameters = parameters;
		this.seed = parameters.getSeed() != null ? parameters.getSeed() : createSeed();
	}

	/**
	 * Returns the Monte-Carlo value of the option.
	 *
	 * @return The value.
	 * @throws CalculationException Thrown if the valuation fails, e.g. due to an ill-conditioned regression.
	 */
	public double getValue() throws CalculationException {
		return getValues().getValue();
	}

	/**
	 * Runs the Longstaff-Schwartz valuation and returns the result of the backward induction providing the value.
	 * If independent paths are used, this is the backward induction on the second set of paths, using the
	 * coefficients fitted on the first.
	 *
	 * @return The result of the backward induction.
	 * @throws CalculationException Thrown if the valuation fails, e.g. due to an ill-conditioned regression.
	 */
	public BackwardInductionResult getValues() throws CalculationException {
		GeometricBrownianMotionPathSimulator pathSimulator = getPathSimulator(new MersenneTwister64(seed));
		LongstaffSchwartzBackwardInduction backwardInduction = getBackwardInduction();

		RandomVariableInterface[] paths = pathSimulator.generatePaths(parameters.getNumberOfPaths(), parameters.getNumberOfTimes(), parameters.getInitialValue());
		BackwardInductionResult result = backwardInduction.getValues(paths);

		if(parameters.isUseIndependentPaths()) {
			if(logger.isLoggable(Level.FINE)) {
				logger.fine("Valuing the exercise strategy on independent paths (fitted value " + result.getValue() + ").");
			}
			RandomVariableInterface[] independentPaths = pathSimulator.generatePaths(parameters.getNumberOfPaths(), parameters.getNumberOfTimes(), parameters.getInitialValue());
			result = backwardInduction.getValues(independentPaths, result.getCoefficients());
		}

		if(logger.isLoggable(Level.FINE)) {
			logger.fine("Value " + result.getValue() + " (standard error " + result.getStandardError() + ") for " + parameters + ".");
		}

		return result;
	}

	/**
	 * Calculates the dual upper bound for the exercise strategy given by a backward induction result.
	 * The mini-paths use a random number generator of their own.
	 *
	 * @param backwardInduction The result of {@link #getValues()}.
	 * @param numberOfMiniPaths The number of mini-paths per path and time step.
	 * @return The upper bound.
	 */
	public UpperBoundResult getUpperBound(BackwardInductionResult backwardInduction, int numberOfMiniPaths) {
		if(backwardInduction.getNumberOfTimes() != parameters.getNumberOfTimes()) {
			throw new IllegalArgumentException("Backward induction uses " + backwardInduction.getNumberOfTimes() + " times, expected " + parameters.getNumberOfTimes() + ".");
		}

		RandomEngine randomNumberGenerator = new MersenneTwister64(seed ^ UPPER_BOUND_SEED_SCRAMBLE);

		DualUpperBoundEstimator estimator = new DualUpperBoundEstimator(
				getPathSimulator(randomNumberGenerator),
				parameters.getPayoff(),
				getBackwardInduction().getRegression(),
				parameters.getDiscountFactor());

		return estimator.getUpperBound(backwardInduction, numberOfMiniPaths);
	}

	private GeometricBrownianMotionPathSimulator getPathSimulator(RandomEngine randomNumberGenerator) {
		return new GeometricBrownianMotionPathSimulator(parameters.getRiskFreeRate(), parameters.getVolatility(), parameters.getTimeStep(), randomNumberGenerator);
	}

	private LongstaffSchwartzBackwardInduction getBackwardInduction() {
		return new LongstaffSchwartzBackwardInduction(
				parameters.getPayoff(),
				parameters.getDiscountFactor(),
				new PolynomialRegression(parameters.getPolynomialOrder(), parameters.isUseInTheMoneyPaths()));
	}

	private static int createSeed() {
		synchronized(seedGenerator) {
			return seedGenerator.nextInt();
		}
	}

	public AmericanOptionPricingParameters getParameters() {
		return parameters;
	}

	/**
	 * @return The seed of the paths, either the one of the parameters or the one drawn on construction.
	 */
	public int getSeed() {
		return seed;
	}
}
