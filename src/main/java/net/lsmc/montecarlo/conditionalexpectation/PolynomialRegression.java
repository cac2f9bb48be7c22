package net.lsmc.montecarlo.conditionalexpectation;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.math3.linear.SingularMatrixException;

import net.lsmc.exception.CalculationException;
import net.lsmc.functions.LinearAlgebra;
import net.lsmc.functions.MatrixUtils;
import net.lsmc.montecarlo.RandomVariable;
import net.lsmc.stochastic.RandomVariableInterface;

/**
 * Least square regression of the continuation value on the monomials
 * <code>1, S, S<sup>2</sup>, ..., S<sup>order-1</sup></code> of the underlying S.
 *
 * The coefficients are given in ascending powers. If <code>isUseInTheMoneyPathsOnly</code> is true, only
 * the paths with a strictly positive exercise value enter the fit; the regression function is always
 * evaluated on all paths.
 *
 * An ill-conditioned regression is reported by a {@link CalculationException}: less paths than
 * coefficients, a degenerate regressor, or a rank deficient basis. The order is never reduced silently.
 */
public class PolynomialRegression implements ContinuationValueRegression {

	private static final Logger logger = Logger.getLogger("net.lsmc");

	private final int		order;
	private final boolean	isUseInTheMoneyPathsOnly;

	/**
	 * @param order The number of monomials (the polynomial degree is <code>order-1</code>).
	 * @param isUseInTheMoneyPathsOnly If true, the fit uses only paths with strictly positive exercise value.
	 */
	public PolynomialRegression(int order, boolean isUseInTheMoneyPathsOnly) {
		super();
		if(order < 1) throw new IllegalArgumentException("Polynomial order must be at least 1, got " + order + ".");
		this.order = order;
		this.isUseInTheMoneyPathsOnly = isUseInTheMoneyPathsOnly;
	}

	@Override
	public double[] getCoefficients(RandomVariableInterface underlying, RandomVariableInterface target, RandomVariableInterface exerciseValue) throws CalculationException {
		int numberOfPaths = underlying.size();
		if(target.size() != numberOfPaths || exerciseValue.size() != numberOfPaths) {
			throw new IllegalArgumentException("Regressor, regressand and exercise value must have the same number of paths.");
		}

		// Select the paths entering the regression
		int numberOfSelectedPaths = 0;
		for(int path = 0; path < numberOfPaths; path++) {
			if(isSelected(exerciseValue, path)) numberOfSelectedPaths++;
		}
		if(numberOfSelectedPaths < order) {
			throw new CalculationException("Regression requires at least " + order + " paths, but only " + numberOfSelectedPaths
					+ (isUseInTheMoneyPathsOnly ? " paths are in the money." : " paths are given."));
		}

		double[] regressor = new double[numberOfSelectedPaths];
		double[] regressand = new double[numberOfSelectedPaths];
		for(int path = 0, selectedPath = 0; path < numberOfPaths; path++) {
			if(isSelected(exerciseValue, path)) {
				regressor[selectedPath] = underlying.get(path);
				regressand[selectedPath] = target.get(path);
				selectedPath++;
			}
		}

		if(order > 1 && new RandomVariable(regressor).isDeterministic()) {
			throw new CalculationException("Regressor has zero variance on the " + numberOfSelectedPaths + " selected paths.");
		}

		double[] coefficients;
		try {
			coefficients = LinearAlgebra.solveLinearEquationLeastSquareFullRank(MatrixUtils.createVandermondeMatrix(regressor, order), regressand);
		}
		catch(SingularMatrixException e) {
			throw new CalculationException("Regression basis matrix is rank deficient.", e);
		}

		if(logger.isLoggable(Level.FINEST)) {
			logger.finest("Regression on " + numberOfSelectedPaths + " paths, coefficients:\n" + MatrixUtils.printMatrix(new double[][] { coefficients }));
		}

		return coefficients;
	}

	private boolean isSelected(RandomVariableInterface exerciseValue, int path) {
		return !isUseInTheMoneyPathsOnly || exerciseValue.get(path) > 0.0;
	}

	@Override
	public RandomVariableInterface getValue(double[] coefficients, RandomVariableInterface underlying) {
		if(coefficients.length != order) {
			throw new IllegalArgumentException("Expected " + order + " regression coefficients, got " + coefficients.length + ".");
		}

		// Horner scheme
		return underlying.apply(x -> {
			double value = 0.0;
			for(int power = coefficients.length - 1; power >= 0; power--) {
				value = value * x + coefficients[power];
			}
			return value;
		});
	}

	@Override
	public int getOrder() {
		return order;
	}
}
