package net.lsmc.montecarlo.assetderivativevaluation;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.math3.random.EmpiricalDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import net.lsmc.exception.CalculationException;

/**
 * Repeats the Longstaff-Schwartz valuation over a family of seeds, once with the regression on all
 * paths and once with the regression on the in the money paths only, and collects the distribution of
 * the values. This allows to compare the bias of the two regression variants against a reference value.
 */
public class BiasExperiment {

	private static final Logger logger = Logger.getLogger("net.lsmc");

	private final AmericanOptionPricingParameters	parameters;
	private final int								numberOfRepetitions;
	private final int								firstSeed;

	/**
	 * @param parameters The parameters (the seed and the in the money setting are overwritten).
	 * @param numberOfRepetitions The number of valuations per variant.
	 * @param firstSeed The seed of the first valuation; valuation i uses <code>firstSeed + i</code>.
	 */
	public BiasExperiment(AmericanOptionPricingParameters parameters, int numberOfRepetitions, int firstSeed) {
		super();
		if(numberOfRepetitions < 2) throw new IllegalArgumentException("Number of repetitions must be at least 2, got " + numberOfRepetitions + ".");
		this.parameters = parameters;
		this.numberOfRepetitions = numberOfRepetitions;
		this.firstSeed = firstSeed;
	}

	/**
	 * Runs the valuations of one variant.
	 *
	 * @param isUseInTheMoneyPaths The in the money regression setting.
	 * @return The values, one per seed.
	 * @throws CalculationException Thrown if a valuation fails.
	 */
	public double[] getValues(boolean isUseInTheMoneyPaths) throws CalculationException {
		AmericanOptionPricingParameters variant = parameters.getCloneWithModifiedUseInTheMoneyPaths(isUseInTheMoneyPaths);

		double[] values = new double[numberOfRepetitions];
		for(int repetition = 0; repetition < numberOfRepetitions; repetition++) {
			values[repetition] = new MonteCarloAmericanOptionPricer(variant.getCloneWithModifiedSeed(firstSeed + repetition)).getValue();
		}

		if(logger.isLoggable(Level.FINE)) {
			DescriptiveStatistics statistics = new DescriptiveStatistics(values);
			logger.fine("In the money regression " + isUseInTheMoneyPaths + ": mean " + statistics.getMean() + ", standard deviation " + statistics.getStandardDeviation()
					+ " over " + numberOfRepetitions + " seeds.");
		}

		return values;
	}

	/**
	 * Calculates the histogram of a sample using equal width bins over its range.
	 *
	 * @param values The sample.
	 * @param numberOfBins The number of bins.
	 * @return The number of sample points per bin.
	 */
	public static long[] getHistogram(double[] values, int numberOfBins) {
		EmpiricalDistribution distribution = new EmpiricalDistribution(numberOfBins);
		distribution.load(values);

		List<SummaryStatistics> binStatistics = distribution.getBinStats();
		long[] histogram = new long[binStatistics.size()];
		for(int bin = 0; bin < histogram.length; bin++) {
			histogram[bin] = binStatistics.get(bin).getN();
		}
		return histogram;
	}

	/**
	 * @param values A sample.
	 * @return The mean of the sample.
	 */
	public static double getMean(double[] values) {
		return new DescriptiveStatistics(values).getMean();
	}

	public int getNumberOfRepetitions() {
		return numberOfRepetitions;
	}
}
