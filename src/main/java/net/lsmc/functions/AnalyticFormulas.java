package net.lsmc.functions;

import cern.jet.stat.Probability;

/**
 * This class implements some analytic formulas for European options under the Black-Scholes model.
 * They serve as control values for the Monte-Carlo valuation of early exercise options: the value
 * of an American option dominates the value of the corresponding European option.
 */
public class AnalyticFormulas {

	private AnalyticFormulas() {
	}

	/**
	 * Calculates the Black-Scholes option value of a call, i.e., the payoff max(S(T)-K,0), where S follows a log-normal process with constant log-volatility.
	 *
	 * @param initialStockValue The spot value of the underlying.
	 * @param riskFreeRate The risk free rate r (df = exp(-r T)).
	 * @param volatility The Black-Scholes volatility.
	 * @param optionMaturity The option maturity T.
	 * @param optionStrike The option strike. If the option strike is &le; 0.0 the method returns the value of the forward contract paying S(T)-K in T.
	 * @return Returns the value of a European call option under the Black-Scholes model.
	 */
	public static double blackScholesOptionValue(
			double initialStockValue,
			double riskFreeRate,
			double volatility,
			double optionMaturity,
			double optionStrike)
	{
		if(optionStrike <= 0.0) {
			// The Black-Scholes model does not consider it being an option
			return initialStockValue - optionStrike * Math.exp(-riskFreeRate * optionMaturity);
		}
		else if(optionMaturity <= 0.0 || volatility <= 0.0) {
			double forward = initialStockValue * Math.exp(riskFreeRate * optionMaturity);
			return Math.max(forward - optionStrike, 0.0) * Math.exp(-riskFreeRate * optionMaturity);
		}
		else {
			// Calculate analytic value
			double dPlus = (Math.log(initialStockValue / optionStrike) + (riskFreeRate + 0.5 * volatility * volatility) * optionMaturity) / (volatility * Math.sqrt(optionMaturity));
			double dMinus = dPlus - volatility * Math.sqrt(optionMaturity);

			return initialStockValue * Probability.normal(dPlus) - optionStrike * Math.exp(-riskFreeRate * optionMaturity) * Probability.normal(dMinus);
		}
	}

	/**
	 * Calculates the Black-Scholes option value of a put, i.e., the payoff max(K-S(T),0), using put-call parity.
	 *
	 * @param initialStockValue The spot value of the underlying.
	 * @param riskFreeRate The risk free rate r (df = exp(-r T)).
	 * @param volatility The Black-Scholes volatility.
	 * @param optionMaturity The option maturity T.
	 * @param optionStrike The option strike.
	 * @return Returns the value of a European put option under the Black-Scholes model.
	 */
	public static double blackScholesPutOptionValue(
			double initialStockValue,
			double riskFreeRate,
			double volatility,
			double optionMaturity,
			double optionStrike)
	{
		double callValue = blackScholesOptionValue(initialStockValue, riskFreeRate, volatility, optionMaturity, optionStrike);
		return callValue - initialStockValue + optionStrike * Math.exp(-riskFreeRate * optionMaturity);
	}
}
