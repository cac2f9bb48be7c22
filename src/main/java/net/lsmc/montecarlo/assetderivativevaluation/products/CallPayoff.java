package net.lsmc.montecarlo.assetderivativevaluation.products;

import net.lsmc.stochastic.RandomVariableInterface;

/**
 * The payoff max(S - K, 0) of a call with strike K.
 */
public class CallPayoff implements PayoffFunction {

	private final double strike;

	public CallPayoff(double strike) {
		super();
		this.strike = strike;
	}

	@Override
	public RandomVariableInterface getValue(RandomVariableInterface underlying) {
		return underlying.sub(strike).floor(0.0);
	}

	public double getStrike() {
		return strike;
	}

	@Override
	public String toString() {
		return "CallPayoff [strike=" + strike + "]";
	}
}
