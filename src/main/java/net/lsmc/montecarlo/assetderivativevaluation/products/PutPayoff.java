package net.lsmc.montecarlo.assetderivativevaluation.products;

import net.lsmc.stochastic.RandomVariableInterface;

/**
 * The payoff max(K - S, 0) of a put with strike K.
 */
public class PutPayoff implements PayoffFunction {

	private final double strike;

	public PutPayoff(double strike) {
		super();
		this.strike = strike;
	}

	@Override
	public RandomVariableInterface getValue(RandomVariableInterface underlying) {
		return underlying.mult(-1.0).add(strike).floor(0.0);
	}

	public double getStrike() {
		return strike;
	}

	@Override
	public String toString() {
		return "PutPayoff [strike=" + strike + "]";
	}
}
