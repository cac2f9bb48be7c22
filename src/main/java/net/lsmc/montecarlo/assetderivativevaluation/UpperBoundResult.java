package net.lsmc.montecarlo.assetderivativevaluation;

import net.lsmc.stochastic.RandomVariableInterface;

/**
 * The result of the dual (upper bound) valuation: the path-wise upper bound and its Monte-Carlo
 * average with standard error.
 */
public class UpperBoundResult {

	private final RandomVariableInterface perPathUpperBound;

	public UpperBoundResult(RandomVariableInterface perPathUpperBound) {
		super();
		this.perPathUpperBound = perPathUpperBound;
	}

	public double getUpperBound() {
		return perPathUpperBound.getAverage();
	}

	public double getStandardError() {
		return perPathUpperBound.getStandardError();
	}

	public RandomVariableInterface getPerPathUpperBound() {
		return perPathUpperBound;
	}

	@Override
	public String toString() {
		return "UpperBoundResult [upperBound=" + getUpperBound() + ", standardError=" + getStandardError() + "]";
	}
}
