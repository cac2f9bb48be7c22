package net.lsmc.montecarlo.conditionalexpectation;

import net.lsmc.exception.CalculationException;
import net.lsmc.stochastic.RandomVariableInterface;

/**
 * Estimation of the continuation value of an early exercise option, i.e. of the conditional
 * expectation of the discounted future value given the current state, by a regression on the
 * cross-section of simulated paths.
 */
public interface ContinuationValueRegression {

	/**
	 * Fits the regression coefficients.
	 *
	 * @param underlying The regressor, i.e. the value of the underlying on each path.
	 * @param target The regressand, i.e. the discounted future value on each path.
	 * @param exerciseValue The exercise value on each path (may be used to select the paths used in the fit).
	 * @return The regression coefficients.
	 * @throws CalculationException Thrown if the regression is ill-conditioned.
	 */
	double[] getCoefficients(RandomVariableInterface underlying, RandomVariableInterface target, RandomVariableInterface exerciseValue) throws CalculationException;

	/**
	 * Evaluates the regression function on all paths.
	 *
	 * @param coefficients The regression coefficients.
	 * @param underlying The value of the underlying on each path.
	 * @return The estimated continuation value on each path.
	 */
	RandomVariableInterface getValue(double[] coefficients, RandomVariableInterface underlying);

	/**
	 * @return The number of regression coefficients.
	 */
	int getOrder();
}
