package net.lsmc.montecarlo.assetderivativevaluation;

import java.util.Map;

import net.lsmc.montecarlo.assetderivativevaluation.products.PayoffFunction;
import net.lsmc.montecarlo.assetderivativevaluation.products.PutPayoff;

/**
 * The parameters of a Monte-Carlo valuation of an American option: model (Black-Scholes), product,
 * discretization and algorithm. Objects of this class are immutable and validated on construction.
 *
 * The option can be exercised at the times <code>0, dt, ..., (numberOfTimes-1) dt = maturity</code>.
 */
public class AmericanOptionPricingParameters {

	public static final double		DEFAULT_INITIAL_VALUE		= 1.0;
	public static final double		DEFAULT_STRIKE				= 1.0;
	public static final double		DEFAULT_RISK_FREE_RATE		= 0.05;
	public static final double		DEFAULT_VOLATILITY			= 0.2;
	public static final double		DEFAULT_MATURITY			= 1.0;
	public static final int			DEFAULT_NUMBER_OF_TIMES		= 64;
	public static final int			DEFAULT_NUMBER_OF_PATHS		= 100000;
	public static final int			DEFAULT_POLYNOMIAL_ORDER	= 3;

	// Model
	private final double	initialValue;
	private final double	riskFreeRate;
	private final double	volatility;

	// Product
	private final double			strike;
	private final double			maturity;
	private final PayoffFunction	payoff;

	// Discretization
	private final int		numberOfTimes;
	private final int		numberOfPaths;
	private final Integer	seed;

	// Algorithm
	private final boolean	isUseInTheMoneyPaths;
	private final boolean	isUseIndependentPaths;
	private final int		polynomialOrder;

	/**
	 * Create the parameters.
	 *
	 * @param initialValue The spot value S0 of the underlying.
	 * @param strike The strike K.
	 * @param riskFreeRate The risk free rate r.
	 * @param volatility The volatility sigma.
	 * @param maturity The maturity T.
	 * @param numberOfTimes The number of exercise times including 0 and T.
	 * @param numberOfPaths The number of simulated paths.
	 * @param seed The seed of the random number generator, or null for a non-reproducible seed.
	 * @param isUseInTheMoneyPaths If true, the regression uses only the in the money paths.
	 * @param isUseIndependentPaths If true, the exercise strategy is valued on paths independent of those used for the regression.
	 * @param payoff The payoff, or null for a put with the given strike.
	 * @param polynomialOrder The number of monomials of the regression.
	 */
	public AmericanOptionPricingParameters(
			double initialValue,
			double strike,
			double riskFreeRate,
			double volatility,
			double maturity,
			int numberOfTimes,
			int numberOfPaths,
			Integer seed,
			boolean isUseInTheMoneyPaths,
			boolean isUseIndependentPaths,
			PayoffFunction payoff,
			int polynomialOrder) {
		super();
		if(!(initialValue > 0.0))		throw new IllegalArgumentException("Initial value must be positive, got " + initialValue + ".");
		if(!(strike >= 0.0))			throw new IllegalArgumentException("Strike must be non-negative, got " + strike + ".");
		if(Double.isNaN(riskFreeRate) || Double.isInfinite(riskFreeRate))	throw new IllegalArgumentException("Risk free rate must be finite, got " + riskFreeRate + ".");
		if(!(volatility > 0.0) || Double.isInfinite(volatility))			throw new IllegalArgumentException("Volatility must be positive, got " + volatility + ".");
		if(!(maturity > 0.0) || Double.isInfinite(maturity))				throw new IllegalArgumentException("Maturity must be positive, got " + maturity + ".");
		if(numberOfTimes < 2)			throw new IllegalArgumentException("Number of times must be at least 2, got " + numberOfTimes + ".");
		if(numberOfPaths < 1)			throw new IllegalArgumentException("Number of paths must be positive, got " + numberOfPaths + ".");
		if(polynomialOrder < 1)			throw new IllegalArgumentException("Polynomial order must be at least 1, got " + polynomialOrder + ".");

		this.initialValue = initialValue;
		this.strike = strike;
		this.riskFreeRate = riskFreeRate;
		this.volatility = volatility;
		this.maturity = maturity;
		this.numberOfTimes = numberOfTimes;
		this.numberOfPaths = numberOfPaths;
		this.seed = seed;
		this.isUseInTheMoneyPaths = isUseInTheMoneyPaths;
		this.isUseIndependentPaths = isUseIndependentPaths;
		this.payoff = payoff != null ? payoff : new PutPayoff(strike);
		this.polynomialOrder = polynomialOrder;
	}

	/**
	 * Create the parameters with default values.
	 */
	public AmericanOptionPricingParameters() {
		this(DEFAULT_INITIAL_VALUE, DEFAULT_STRIKE, DEFAULT_RISK_FREE_RATE, DEFAULT_VOLATILITY, DEFAULT_MATURITY,
				DEFAULT_NUMBER_OF_TIMES, DEFAULT_NUMBER_OF_PATHS, null, false, true, null, DEFAULT_POLYNOMIAL_ORDER);
	}

	/**
	 * Create the parameters from a map of properties. Missing properties take their default value.
	 * The keys are
	 * <code>initialValue, strike, riskFreeRate, volatility, maturity, numberOfTimes, numberOfPaths,
	 * seed, useInTheMoneyPaths, useIndependentPaths, payoff, polynomialOrder</code>.
	 * Numbers may be given as {@link Number} or as {@link String}. Counts have to be integral, e.g.
	 * <code>1.0E5</code> is accepted as number of paths, <code>1.5</code> is not.
	 *
	 * @param properties The properties (may be null).
	 * @return The parameters.
	 */
	public static AmericanOptionPricingParameters fromProperties(Map<String, ?> properties) {
		return new AmericanOptionPricingParameters(
				getDouble(properties, "initialValue", DEFAULT_INITIAL_VALUE),
				getDouble(properties, "strike", DEFAULT_STRIKE),
				getDouble(properties, "riskFreeRate", DEFAULT_RISK_FREE_RATE),
				getDouble(properties, "volatility", DEFAULT_VOLATILITY),
				getDouble(properties, "maturity", DEFAULT_MATURITY),
				getInteger(properties, "numberOfTimes", DEFAULT_NUMBER_OF_TIMES),
				getInteger(properties, "numberOfPaths", DEFAULT_NUMBER_OF_PATHS),
				properties != null && properties.get("seed") != null ? getInteger(properties, "seed", 0) : null,
				getBoolean(properties, "useInTheMoneyPaths", false),
				getBoolean(properties, "useIndependentPaths", true),
				getPayoff(properties),
				getInteger(properties, "polynomialOrder", DEFAULT_POLYNOMIAL_ORDER));
	}

	private static double getDouble(Map<String, ?> properties, String key, double defaultValue) {
		if(properties == null || properties.get(key) == null) return defaultValue;

		Object value = properties.get(key);
		if(value instanceof Number) return ((Number)value).doubleValue();
		if(value instanceof String) {
			try {
				return Double.parseDouble(((String)value).trim());
			}
			catch(NumberFormatException e) {
				throw new IllegalArgumentException("Property " + key + " is not a number: " + value + ".", e);
			}
		}
		throw new IllegalArgumentException("Property " + key + " has unsupported type " + value.getClass().getName() + ".");
	}

	private static int getInteger(Map<String, ?> properties, String key, int defaultValue) {
		if(properties == null || properties.get(key) == null) return defaultValue;

		double value = getDouble(properties, key, defaultValue);
		if(value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
			throw new IllegalArgumentException("Property " + key + " must be an integer, got " + properties.get(key) + ".");
		}
		return (int)value;
	}

	private static boolean getBoolean(Map<String, ?> properties, String key, boolean defaultValue) {
		if(properties == null || properties.get(key) == null) return defaultValue;

		Object value = properties.get(key);
		if(value instanceof Boolean) return (Boolean)value;
		if(value instanceof String) {
			String string = ((String)value).trim();
			if(string.equalsIgnoreCase("true"))		return true;
			if(string.equalsIgnoreCase("false"))	return false;
		}
		throw new IllegalArgumentException("Property " + key + " is not a boolean: " + value + ".");
	}

	private static PayoffFunction getPayoff(Map<String, ?> properties) {
		if(properties == null || properties.get("payoff") == null) return null;

		Object value = properties.get("payoff");
		if(value instanceof PayoffFunction) return (PayoffFunction)value;
		throw new IllegalArgumentException("Property payoff must implement " + PayoffFunction.class.getSimpleName() + ", got " + value.getClass().getName() + ".");
	}

	/**
	 * Create a copy of this object using a different seed.
	 *
	 * @param seed The new seed.
	 * @return A copy of this object with the given seed.
	 */
	public AmericanOptionPricingParameters getCloneWithModifiedSeed(int seed) {
		return new AmericanOptionPricingParameters(initialValue, strike, riskFreeRate, volatility, maturity,
				numberOfTimes, numberOfPaths, seed, isUseInTheMoneyPaths, isUseIndependentPaths, payoff, polynomialOrder);
	}

	/**
	 * Create a copy of this object using a different in the money regression setting.
	 *
	 * @param isUseInTheMoneyPaths If true, the regression uses only the in the money paths.
	 * @return A copy of this object with the given setting.
	 */
	public AmericanOptionPricingParameters getCloneWithModifiedUseInTheMoneyPaths(boolean isUseInTheMoneyPaths) {
		return new AmericanOptionPricingParameters(initialValue, strike, riskFreeRate, volatility, maturity,
				numberOfTimes, numberOfPaths, seed, isUseInTheMoneyPaths, isUseIndependentPaths, payoff, polynomialOrder);
	}

	public double getInitialValue() {
		return initialValue;
	}

	public double getStrike() {
		return strike;
	}

	public double getRiskFreeRate() {
		return riskFreeRate;
	}

	public double getVolatility() {
		return volatility;
	}

	public double getMaturity() {
		return maturity;
	}

	public int getNumberOfTimes() {
		return numberOfTimes;
	}

	public int getNumberOfPaths() {
		return numberOfPaths;
	}

	/**
	 * @return The seed, or null if no seed is given.
	 */
	public Integer getSeed() {
		return seed;
	}

	public boolean isUseInTheMoneyPaths() {
		return isUseInTheMoneyPaths;
	}

	public boolean isUseIndependentPaths() {
		return isUseIndependentPaths;
	}

	public PayoffFunction getPayoff() {
		return payoff;
	}

	public int getPolynomialOrder() {
		return polynomialOrder;
	}

	/**
	 * @return The time step dt = maturity / (numberOfTimes - 1).
	 */
	public double getTimeStep() {
		return maturity / (numberOfTimes - 1);
	}

	/**
	 * @return The discount factor exp(-r dt) over one time step.
	 */
	public double getDiscountFactor() {
		return Math.exp(-riskFreeRate * getTimeStep());
	}

	@Override
	public String toString() {
		return "AmericanOptionPricingParameters [initialValue=" + initialValue + ", strike=" + strike + ", riskFreeRate=" + riskFreeRate
				+ ", volatility=" + volatility + ", maturity=" + maturity + ", numberOfTimes=" + numberOfTimes + ", numberOfPaths=" + numberOfPaths
				+ ", seed=" + seed + ", isUseInTheMoneyPaths=" + isUseInTheMoneyPaths + ", isUseIndependentPaths=" + isUseIndependentPaths
				+ ", payoff=" + payoff + ", polynomialOrder=" + polynomialOrder + "]";
	}
}
