package net.lsmc.montecarlo;

import cern.jet.random.engine.RandomEngine;
import cern.jet.stat.Probability;
import net.lsmc.stochastic.RandomVariableInterface;

/**
 * Simulation of sample paths of a geometric Brownian motion under the risk neutral measure, i.e.
 * \[
 * 	dS = r S dt + \sigma S dW,
 * \]
 * using the exact log-normal transition over a time step <code>dt</code>,
 * \[
 * 	S(t+dt) = S(t) \exp\left( (r - \frac{1}{2} \sigma^2) dt + \sigma \Delta W \right) .
 * \]
 *
 * The Brownian increments are generated from the given random number engine by inversion of the
 * normal distribution. The generator is owned by the caller and is the only state of this class. Two
 * simulators constructed with generators using the same seed produce bit-identical paths.
 */
public class GeometricBrownianMotionPathSimulator {

	private final double		riskFreeRate;
	private final double		volatility;
	private final double		timeStep;
	private final RandomEngine	randomNumberGenerator;

	private final double		drift;
	private final double		diffusion;

	/**
	 * Create the simulator.
	 *
	 * @param riskFreeRate The risk free rate r.
	 * @param volatility The log-volatility sigma.
	 * @param timeStep The time step dt between two consecutive simulation times.
	 * @param randomNumberGenerator The uniform random number generator (seeded by the caller).
	 */
	public GeometricBrownianMotionPathSimulator(double riskFreeRate, double volatility, double timeStep, RandomEngine randomNumberGenerator) {
		super();
		if(!(volatility > 0.0))		throw new IllegalArgumentException("Volatility must be positive, got " + volatility + ".");
		if(!(timeStep > 0.0))		throw new IllegalArgumentException("Time step must be positive, got " + timeStep + ".");
		if(randomNumberGenerator == null)	throw new IllegalArgumentException("Random number generator must not be null.");

		this.riskFreeRate = riskFreeRate;
		this.volatility = volatility;
		this.timeStep = timeStep;
		this.randomNumberGenerator = randomNumberGenerator;

		this.drift = (riskFreeRate - 0.5 * volatility * volatility) * timeStep;
		this.diffusion = volatility * Math.sqrt(timeStep);
	}

	/**
	 * Generates <code>numberOfPaths</code> paths on the time discretization <code>0, dt, ..., (numberOfTimes-1) dt</code>,
	 * all starting in <code>initialValue</code>.
	 *
	 * @param numberOfPaths The number of paths.
	 * @param numberOfTimes The number of simulation times including time 0.
	 * @param initialValue The initial value S0.
	 * @return The paths, as array indexed by time index, each element being the cross-section over all paths.
	 */
	public RandomVariableInterface[] generatePaths(int numberOfPaths, int numberOfTimes, double initialValue) {
		if(numberOfPaths < 1)			throw new IllegalArgumentException("Number of paths must be positive, got " + numberOfPaths + ".");
		if(numberOfTimes < 2)			throw new IllegalArgumentException("Number of times must be at least 2, got " + numberOfTimes + ".");
		if(!(initialValue > 0.0))		throw new IllegalArgumentException("Initial value must be positive, got " + initialValue + ".");

		double[][] values = new double[numberOfTimes][numberOfPaths];

		for(int path = 0; path < numberOfPaths; path++) {
			double logIncrementSum = 0.0;
			values[0][path] = initialValue;
			for(int timeIndex = 1; timeIndex < numberOfTimes; timeIndex++) {
				logIncrementSum += drift + diffusion * nextStandardNormal();
				values[timeIndex][path] = initialValue * Math.exp(logIncrementSum);
			}
		}

		RandomVariableInterface[] paths = new RandomVariableInterface[numberOfTimes];
		for(int timeIndex = 0; timeIndex < numberOfTimes; timeIndex++) {
			paths[timeIndex] = new RandomVariable(values[timeIndex]);
		}
		return paths;
	}

	/**
	 * Generates for each given origin value a bundle of <code>numberOfMiniPaths</code> independent
	 * mini-paths, i.e. paths with two times (start and end), spanning a single time step.
	 *
	 * @param initialValues The origins, one per outer path.
	 * @param numberOfMiniPaths The number of mini-paths per origin.
	 * @return Array indexed by the outer path; element <code>i</code> holds the end points of the mini-paths started in <code>initialValues.get(i)</code>.
	 */
	public RandomVariableInterface[] generateMiniPaths(RandomVariableInterface initialValues, int numberOfMiniPaths) {
		RandomVariableInterface[] endPoints = new RandomVariableInterface[initialValues.size()];
		for(int path = 0; path < initialValues.size(); path++) {
			endPoints[path] = generateMiniPaths(initialValues.get(path), numberOfMiniPaths);
		}
		return endPoints;
	}

	/**
	 * Generates a bundle of <code>numberOfMiniPaths</code> independent single step paths starting in <code>initialValue</code>.
	 *
	 * @param initialValue The origin.
	 * @param numberOfMiniPaths The number of mini-paths.
	 * @return The end points of the mini-paths.
	 */
	public RandomVariableInterface generateMiniPaths(double initialValue, int numberOfMiniPaths) {
		if(numberOfMiniPaths < 1)		throw new IllegalArgumentException("Number of mini-paths must be positive, got " + numberOfMiniPaths + ".");
		if(!(initialValue > 0.0))		throw new IllegalArgumentException("Initial value must be positive, got " + initialValue + ".");

		double[] endPoints = new double[numberOfMiniPaths];
		for(int miniPath = 0; miniPath < numberOfMiniPaths; miniPath++) {
			endPoints[miniPath] = initialValue * Math.exp(drift + diffusion * nextStandardNormal());
		}
		return new RandomVariable(endPoints);
	}

	private double nextStandardNormal() {
		// The engine generates uniforms in the open interval (0,1)
		return Probability.normalInverse(randomNumberGenerator.nextDouble());
	}

	public double getRiskFreeRate() {
		return riskFreeRate;
	}

	public double getVolatility() {
		return volatility;
	}

	public double getTimeStep() {
		return timeStep;
	}
}
