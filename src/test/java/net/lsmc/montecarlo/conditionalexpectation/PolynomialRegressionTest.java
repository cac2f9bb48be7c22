package net.lsmc.montecarlo.conditionalexpectation;

import org.junit.Test;

import net.lsmc.exception.CalculationException;
import net.lsmc.montecarlo.RandomVariable;
import net.lsmc.montecarlo.assetderivativevaluation.products.PutPayoff;
import net.lsmc.stochastic.RandomVariableInterface;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PolynomialRegressionTest {

	private final RandomVariableInterface underlying = new RandomVariable(new double[] { 0.7, 0.8, 0.9, 0.95, 1.05, 1.1, 1.2, 1.3 });
	private final RandomVariableInterface exerciseValue = new PutPayoff(1.0).getValue(underlying);

	@Test
	public void testExactQuadraticIsRecovered() throws CalculationException {
		RandomVariableInterface target = underlying.apply(x -> 0.3 - 0.2 * x + 0.1 * x * x);

		PolynomialRegression regression = new PolynomialRegression(3, false);
		double[] coefficients = regression.getCoefficients(underlying, target, exerciseValue);

		assertArrayEquals(new double[] { 0.3, -0.2, 0.1 }, coefficients, 1e-10);
		assertArrayEquals(target.getRealizations(), regression.getValue(coefficients, underlying).getRealizations(), 1e-12);
	}

	@Test
	public void testInTheMoneyRegressionIgnoresOutOfTheMoneyPaths() throws CalculationException {
		// Linear on the in the money paths, arbitrary elsewhere
		RandomVariableInterface target = underlying.apply(x -> x < 1.0 ? 2.0 - x : 100.0);

		double[] coefficientsInTheMoney = new PolynomialRegression(2, true).getCoefficients(underlying, target, exerciseValue);
		double[] coefficientsAllPaths = new PolynomialRegression(2, false).getCoefficients(underlying, target, exerciseValue);

		assertArrayEquals(new double[] { 2.0, -1.0 }, coefficientsInTheMoney, 1e-10);
		assertTrue(Math.abs(coefficientsAllPaths[1] + 1.0) > 1.0);
	}

	@Test
	public void testEvaluationUsesAllPaths() {
		PolynomialRegression regression = new PolynomialRegression(3, true);

		RandomVariableInterface value = regression.getValue(new double[] { 1.0, 2.0, 3.0 }, new RandomVariable(new double[] { 0.0, 1.0, 2.0 }));

		assertArrayEquals(new double[] { 1.0, 6.0, 17.0 }, value.getRealizations(), 1e-15);
	}

	@Test
	public void testTooFewInTheMoneyPathsFail() {
		RandomVariableInterface exerciseValueWithTwoPathsInTheMoney = new PutPayoff(0.85).getValue(underlying);
		try {
			new PolynomialRegression(3, true).getCoefficients(underlying, underlying, exerciseValueWithTwoPathsInTheMoney);
			fail("Regression with two in the money paths and three coefficients must fail.");
		}
		catch(CalculationException e) {
			assertTrue(e.getMessage().contains("only 2 paths are in the money"));
		}
	}

	@Test(expected = CalculationException.class)
	public void testNoPathInTheMoneyFails() throws CalculationException {
		RandomVariableInterface noPathInTheMoney = new PutPayoff(0.1).getValue(underlying);
		new PolynomialRegression(1, true).getCoefficients(underlying, underlying, noPathInTheMoney);
	}

	@Test(expected = CalculationException.class)
	public void testDegenerateRegressorFails() throws CalculationException {
		RandomVariableInterface constant = new RandomVariable(8, 1.0);
		new PolynomialRegression(2, false).getCoefficients(constant, underlying, exerciseValue);
	}

	@Test
	public void testConstantRegressionOfDegenerateRegressorIsMean() throws CalculationException {
		RandomVariableInterface constant = new RandomVariable(8, 1.0);
		double[] coefficients = new PolynomialRegression(1, false).getCoefficients(constant, underlying, exerciseValue);

		assertEquals(underlying.getAverage(), coefficients[0], 1e-12);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testOrderZeroIsRejected() {
		new PolynomialRegression(0, false);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testWrongNumberOfCoefficientsIsRejected() {
		new PolynomialRegression(3, false).getValue(new double[] { 1.0, 2.0 }, underlying);
	}
}
