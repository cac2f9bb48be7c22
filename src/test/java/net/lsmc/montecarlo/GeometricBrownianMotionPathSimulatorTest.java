package net.lsmc.montecarlo;

import org.junit.Test;

import cern.jet.random.engine.MersenneTwister64;
import net.lsmc.stochastic.RandomVariableInterface;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class GeometricBrownianMotionPathSimulatorTest {

	private final double riskFreeRate	= 0.05;
	private final double volatility		= 0.2;
	private final double timeStep		= 0.1;

	private GeometricBrownianMotionPathSimulator createSimulator(int seed) {
		return new GeometricBrownianMotionPathSimulator(riskFreeRate, volatility, timeStep, new MersenneTwister64(seed));
	}

	@Test
	public void testInitialValueAndPositivity() {
		RandomVariableInterface[] paths = createSimulator(3141).generatePaths(1000, 11, 1.5);

		assertEquals(11, paths.length);
		for(int path = 0; path < 1000; path++) {
			assertEquals(1.5, paths[0].get(path), 0.0);
		}
		for(RandomVariableInterface underlying : paths) {
			assertEquals(1000, underlying.size());
			assertTrue(underlying.getMin() > 0.0);
		}
	}

	@Test
	public void testReproducibility() {
		RandomVariableInterface[] paths1 = createSimulator(3141).generatePaths(500, 8, 1.0);
		RandomVariableInterface[] paths2 = createSimulator(3141).generatePaths(500, 8, 1.0);

		for(int timeIndex = 0; timeIndex < paths1.length; timeIndex++) {
			assertArrayEquals(paths1[timeIndex].getRealizations(), paths2[timeIndex].getRealizations(), 0.0);
		}

		RandomVariableInterface miniPaths1 = createSimulator(7).generateMiniPaths(0.9, 100);
		RandomVariableInterface miniPaths2 = createSimulator(7).generateMiniPaths(0.9, 100);
		assertArrayEquals(miniPaths1.getRealizations(), miniPaths2.getRealizations(), 0.0);
	}

	@Test
	public void testConsecutiveCallsAreIndependentDraws() {
		GeometricBrownianMotionPathSimulator simulator = createSimulator(3141);
		RandomVariableInterface[] paths1 = simulator.generatePaths(100, 3, 1.0);
		RandomVariableInterface[] paths2 = simulator.generatePaths(100, 3, 1.0);

		assertFalse(paths1[2].get(0) == paths2[2].get(0));
	}

	@Test
	public void testRiskNeutralDrift() {
		int numberOfTimes = 11;
		RandomVariableInterface[] paths = createSimulator(3141).generatePaths(100000, numberOfTimes, 1.0);

		double maturity = (numberOfTimes - 1) * timeStep;
		RandomVariableInterface terminalValue = paths[numberOfTimes - 1];
		assertEquals(Math.exp(riskFreeRate * maturity), terminalValue.getAverage(), 4.0 * terminalValue.getStandardError());

		// Log-increments over one step have variance sigma^2 dt
		RandomVariableInterface logIncrement = paths[5].apply(Math::log).sub(paths[4].apply(Math::log));
		assertEquals(volatility * volatility * timeStep, logIncrement.getVariance(), 2E-4);
		assertEquals((riskFreeRate - 0.5 * volatility * volatility) * timeStep, logIncrement.getAverage(), 4.0 * logIncrement.getStandardError());
	}

	@Test
	public void testMiniPathsStartInTheirOrigins() {
		RandomVariableInterface origins = new RandomVariable(new double[] { 0.5, 1.0, 2.0 });
		RandomVariableInterface[] endPoints = createSimulator(42).generateMiniPaths(origins, 50000);

		assertEquals(3, endPoints.length);
		for(int path = 0; path < origins.size(); path++) {
			assertEquals(50000, endPoints[path].size());
			// One step forward expectation under the risk neutral measure
			double expected = origins.get(path) * Math.exp(riskFreeRate * timeStep);
			assertEquals(expected, endPoints[path].getAverage(), 4.0 * endPoints[path].getStandardError());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSingleTimeIsRejected() {
		createSimulator(1).generatePaths(10, 1, 1.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonPositiveNumberOfMiniPathsIsRejected() {
		createSimulator(1).generateMiniPaths(1.0, 0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonPositiveVolatilityIsRejected() {
		new GeometricBrownianMotionPathSimulator(riskFreeRate, 0.0, timeStep, new MersenneTwister64(1));
	}
}
