package net.lsmc.montecarlo;

import org.junit.Test;

import net.lsmc.stochastic.RandomVariableInterface;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RandomVariableTest {

	@Test
	public void testStatistics() {
		RandomVariableInterface randomVariable = new RandomVariable(new double[] { 1.0, 2.0, 3.0, 4.0 });

		assertEquals(2.5, randomVariable.getAverage(), 1e-15);
		assertEquals(1.25, randomVariable.getVariance(), 1e-15);
		assertEquals(5.0 / 3.0, randomVariable.getSampleVariance(), 1e-15);
		assertEquals(Math.sqrt(1.25), randomVariable.getStandardDeviation(), 1e-15);
		assertEquals(Math.sqrt(1.25) / 2.0, randomVariable.getStandardError(), 1e-15);
		assertEquals(1.0, randomVariable.getMin(), 0.0);
		assertEquals(4.0, randomVariable.getMax(), 0.0);
		assertFalse(randomVariable.isDeterministic());
	}

	@Test
	public void testArithmetic() {
		RandomVariableInterface x = new RandomVariable(new double[] { -1.0, 0.5, 2.0 });
		RandomVariableInterface y = new RandomVariable(new double[] { 1.0, 1.0, 3.0 });

		assertArrayEquals(new double[] { 0.0, 1.5, 5.0 }, x.add(y).getRealizations(), 1e-15);
		assertArrayEquals(new double[] { -2.0, -0.5, -1.0 }, x.sub(y).getRealizations(), 1e-15);
		assertArrayEquals(new double[] { -1.0, 0.5, 6.0 }, x.mult(y).getRealizations(), 1e-15);
		assertArrayEquals(new double[] { 0.0, 0.5, 2.0 }, x.floor(0.0).getRealizations(), 1e-15);
		assertArrayEquals(new double[] { 1.0, 1.0, 3.0 }, x.floor(y).getRealizations(), 1e-15);
		assertArrayEquals(new double[] { -3.0, 1.5, 6.0 }, x.mult(3.0).getRealizations(), 1e-15);
		assertArrayEquals(new double[] { 1.0, 0.25, 4.0 }, x.apply(value -> value * value).getRealizations(), 1e-15);
	}

	@Test
	public void testImmutability() {
		double[] realizations = new double[] { 1.0, 2.0 };
		RandomVariableInterface randomVariable = new RandomVariable(realizations);

		randomVariable.getRealizations()[0] = 42.0;
		randomVariable.add(1.0);

		assertEquals(1.0, randomVariable.get(0), 0.0);
	}

	@Test
	public void testDeterministic() {
		RandomVariableInterface randomVariable = new RandomVariable(5, 0.3);

		assertEquals(5, randomVariable.size());
		assertTrue(randomVariable.isDeterministic());
		assertEquals(0.0, randomVariable.getVariance(), 0.0);
		assertEquals(0.0, new RandomVariable(new double[] { 7.0 }).getSampleVariance(), 0.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDifferentSizesAreRejected() {
		new RandomVariable(new double[] { 1.0, 2.0 }).add(new RandomVariable(new double[] { 1.0 }));
	}
}
